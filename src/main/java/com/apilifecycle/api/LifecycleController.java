package com.apilifecycle.api;

import com.apilifecycle.engine.LifecycleDecision;
import com.apilifecycle.engine.LifecycleEvaluator;
import com.apilifecycle.engine.LifecycleHeaderFormatter;
import com.apilifecycle.openapi.SchemaAnnotator;
import com.apilifecycle.openapi.SchemaNode;
import com.apilifecycle.policy.DeprecationPolicy;
import com.apilifecycle.policy.InstantNormalizer;
import com.apilifecycle.policy.OperationKey;
import com.apilifecycle.policy.PolicyResolver;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Introspection endpoints for operators and CI checks.
 *
 * GET  /v1/lifecycle/evaluation?method=GET&path=/v1/users&at=2025-01-01
 * POST /v1/lifecycle/openapi?at=...   (body: OpenAPI document, optional x-mounts)
 */
@RestController
@RequestMapping("/v1/lifecycle")
public class LifecycleController {

    private final PolicyResolver policyResolver;
    private final LifecycleEvaluator evaluator;
    private final LifecycleHeaderFormatter formatter;
    private final SchemaAnnotator annotator;
    private final Clock clock;

    public LifecycleController(PolicyResolver policyResolver,
                               LifecycleEvaluator evaluator,
                               LifecycleHeaderFormatter formatter,
                               SchemaAnnotator annotator,
                               Clock clock) {
        this.policyResolver = policyResolver;
        this.evaluator = evaluator;
        this.formatter = formatter;
        this.annotator = annotator;
        this.clock = clock;
    }

    /**
     * Shows what a request to the operation would get at the given instant (default: now).
     */
    @GetMapping("/evaluation")
    public Map<String, Object> evaluate(@RequestParam(defaultValue = "GET") String method,
                                        @RequestParam String path,
                                        @RequestParam(required = false) String at) {
        OperationKey operation = OperationKey.of(method, path);
        Instant instant = at == null ? clock.instant() : InstantNormalizer.normalize(at);
        Optional<DeprecationPolicy> policy = policyResolver.resolve(operation);
        LifecycleDecision decision = policy
            .map(p -> evaluator.evaluate(p, instant))
            .orElse(LifecycleDecision.allow());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("operation", operation.toString());
        body.put("evaluated_at", instant.toString());
        body.put("policy_found", policy.isPresent());
        body.put("action", decision.action());
        body.put("status_code", decision.statusCode());
        body.put("headers", new LinkedHashMap<>(formatter.format(decision)));
        return body;
    }

    /**
     * Annotates the posted OpenAPI document against the registered policies and returns it.
     */
    @PostMapping("/openapi")
    public ObjectNode annotate(@RequestBody ObjectNode document,
                               @RequestParam(required = false) String at) {
        SchemaNode root = SchemaNode.fromDocument(document);
        if (at == null) {
            annotator.annotate(root, policyResolver);
        } else {
            annotator.annotate(root, policyResolver, InstantNormalizer.normalize(at));
        }
        return document;
    }
}
