package com.apilifecycle.api;

import com.apilifecycle.engine.LifecycleDecision;
import com.apilifecycle.policy.DeprecationPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Writes a blocking decision (sunset or brownout) straight to the servlet response.
 *
 * Default bodies follow the error shape {@code {"detail": "..."}}. Override bodies are written
 * as-is: strings as text, byte arrays raw, anything else serialized through Jackson.
 */
@Component
public class BlockingResponseWriter {

    private final ObjectMapper objectMapper;

    public BlockingResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, LifecycleDecision decision, HttpHeaders headers,
                      DeprecationPolicy policy) throws IOException {
        response.setStatus(decision.statusCode());
        copyHeaders(headers, response);

        Object body = decision.body();
        if (body == null) {
            return;
        }
        if (policy.override().isEmpty()) {
            writeJson(response, Map.of("detail", body));
            return;
        }
        if (body instanceof byte[] bytes) {
            response.getOutputStream().write(bytes);
        } else if (body instanceof String text) {
            if (response.getContentType() == null) {
                response.setContentType(MediaType.TEXT_PLAIN_VALUE);
            }
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.getWriter().write(text);
        } else {
            writeJson(response, body);
        }
    }

    static void copyHeaders(HttpHeaders headers, HttpServletResponse response) {
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            List<String> values = header.getValue();
            for (int i = 0; i < values.size(); i++) {
                if (i == 0) {
                    response.setHeader(header.getKey(), values.get(i));
                } else {
                    response.addHeader(header.getKey(), values.get(i));
                }
            }
        }
    }

    private void writeJson(HttpServletResponse response, Object body) throws IOException {
        if (response.getContentType() == null) {
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        }
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }
}
