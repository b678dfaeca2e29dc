package com.apilifecycle.openapi;

import com.apilifecycle.policy.DeprecationPolicy;
import com.apilifecycle.policy.OperationKey;
import com.apilifecycle.policy.PolicyResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Writes deprecation state into OpenAPI operation objects.
 *
 * Per operation, with the policy resolved for its effective (mount-prefixed) path:
 * - deprecation or sunset already reached: {@code deprecated: true} plus a DEPRECATED notice
 *   (an earlier UPCOMING notice is dropped)
 * - deprecation scheduled in the future: {@code deprecated} untouched, UPCOMING notice appended
 * - no policy, or nothing announced yet: untouched
 *
 * Notices are appended only when absent, so re-running at the same instant changes nothing.
 * Traversal state is private to one call.
 */
public class SchemaAnnotator {

    private static final Logger log = LoggerFactory.getLogger(SchemaAnnotator.class);

    public static final String DEPRECATED_MARKER = "**DEPRECATED**";
    public static final String UPCOMING_MARKER = "**UPCOMING DEPRECATION**";

    private static final Set<String> HTTP_METHODS =
        Set.of("get", "put", "post", "delete", "options", "head", "patch", "trace");
    private static final String PARAGRAPH = "\n\n";

    private final Clock clock;

    public SchemaAnnotator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AnnotationSummary annotate(SchemaNode root, PolicyResolver resolver) {
        return annotate(root, resolver, clock.instant());
    }

    public AnnotationSummary annotate(SchemaNode root, PolicyResolver resolver, Instant now) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(now, "now");

        Traversal traversal = new Traversal(resolver, now);
        traversal.visit(root, "");
        AnnotationSummary summary = traversal.summary();
        log.info("OpenAPI lifecycle annotation: nodes={}, operations={}, deprecated={}, upcoming={}",
            summary.visitedNodes(), summary.operations(), summary.markedDeprecated(), summary.markedUpcoming());
        return summary;
    }

    /**
     * Counts for one annotate call; {@code markedDeprecated} and {@code markedUpcoming} only
     * count operations this call actually changed.
     */
    public record AnnotationSummary(int visitedNodes, int operations, int markedDeprecated, int markedUpcoming) {}

    private static final class Traversal {

        private final PolicyResolver resolver;
        private final Instant now;
        private final Set<VisitKey> visited = new HashSet<>();
        private final Set<SchemaNode> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());

        private int visitedNodes;
        private int operations;
        private int markedDeprecated;
        private int markedUpcoming;

        Traversal(PolicyResolver resolver, Instant now) {
            this.resolver = resolver;
            this.now = now;
        }

        void visit(SchemaNode node, String prefix) {
            if (ancestors.contains(node)) {
                log.debug("Mount cycle detected at prefix {}, not descending", prefix);
                return;
            }
            if (!visited.add(new VisitKey(node, prefix))) {
                return;
            }
            visitedNodes++;
            ancestors.add(node);
            try {
                annotatePaths(node.document(), prefix);
                for (SchemaNode.Mount mount : node.mounts()) {
                    visit(mount.child(), joinPaths(prefix, mount.prefix()));
                }
            } finally {
                ancestors.remove(node);
            }
        }

        AnnotationSummary summary() {
            return new AnnotationSummary(visitedNodes, operations, markedDeprecated, markedUpcoming);
        }

        private void annotatePaths(ObjectNode document, String prefix) {
            JsonNode paths = document.path("paths");
            Iterator<Map.Entry<String, JsonNode>> pathItems = paths.fields();
            while (pathItems.hasNext()) {
                Map.Entry<String, JsonNode> pathItem = pathItems.next();
                String effectivePath = joinPaths(prefix, pathItem.getKey());
                Iterator<Map.Entry<String, JsonNode>> entries = pathItem.getValue().fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    if (!HTTP_METHODS.contains(entry.getKey()) || !(entry.getValue() instanceof ObjectNode operation)) {
                        continue;
                    }
                    operations++;
                    resolver.resolve(OperationKey.of(entry.getKey(), effectivePath))
                        .ifPresent(policy -> annotateOperation(operation, policy));
                }
            }
        }

        private void annotateOperation(ObjectNode operation, DeprecationPolicy policy) {
            if (isReached(policy.deprecationAt()) || isReached(policy.sunsetAt())) {
                if (markDeprecated(operation, policy)) {
                    markedDeprecated++;
                }
            } else if (policy.deprecationAt() != null) {
                if (markUpcoming(operation, policy)) {
                    markedUpcoming++;
                }
            }
        }

        private boolean isReached(Instant at) {
            return at != null && !now.isBefore(at);
        }
    }

    private static boolean markDeprecated(ObjectNode operation, DeprecationPolicy policy) {
        boolean changed = false;
        if (!operation.path("deprecated").asBoolean(false)) {
            operation.put("deprecated", true);
            changed = true;
        }
        String description = operation.path("description").asText("");
        String updated = withoutUpcomingNotice(description);
        if (!updated.contains(DEPRECATED_MARKER)) {
            updated = appendParagraph(updated, deprecatedNotice(policy));
        }
        if (!updated.equals(description)) {
            operation.put("description", updated);
            changed = true;
        }
        return changed;
    }

    private static boolean markUpcoming(ObjectNode operation, DeprecationPolicy policy) {
        String description = operation.path("description").asText("");
        if (description.contains(UPCOMING_MARKER)) {
            return false;
        }
        operation.put("description", appendParagraph(description, upcomingNotice(policy)));
        return true;
    }

    static String deprecatedNotice(DeprecationPolicy policy) {
        StringBuilder notice = new StringBuilder(DEPRECATED_MARKER).append('.');
        policy.deprecation().ifPresent(at -> notice.append(" Deprecated since ").append(at).append('.'));
        appendDetails(notice, policy);
        return notice.toString();
    }

    static String upcomingNotice(DeprecationPolicy policy) {
        StringBuilder notice = new StringBuilder(UPCOMING_MARKER)
            .append(": scheduled for ").append(policy.deprecationAt()).append('.');
        appendDetails(notice, policy);
        return notice.toString();
    }

    private static void appendDetails(StringBuilder notice, DeprecationPolicy policy) {
        policy.sunset().ifPresent(at -> notice.append(" Sunset date: ").append(at).append('.'));
        policy.alternativeUri().ifPresent(uri -> notice.append(" Alternative: ").append(uri).append('.'));
        URI docs = policy.links().get(DeprecationPolicy.DEPRECATION_RELATION);
        if (docs != null) {
            notice.append(" See: ").append(docs).append('.');
        }
    }

    private static String appendParagraph(String description, String paragraph) {
        return description.isEmpty() ? paragraph : description + PARAGRAPH + paragraph;
    }

    private static String withoutUpcomingNotice(String description) {
        if (!description.contains(UPCOMING_MARKER)) {
            return description;
        }
        List<String> kept = new ArrayList<>();
        for (String paragraph : description.split(PARAGRAPH, -1)) {
            if (!paragraph.startsWith(UPCOMING_MARKER)) {
                kept.add(paragraph);
            }
        }
        return String.join(PARAGRAPH, kept);
    }

    static String joinPaths(String prefix, String path) {
        String head = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        if (path.isEmpty()) {
            return head.isEmpty() ? "/" : head;
        }
        return head + (path.startsWith("/") ? path : "/" + path);
    }

    // Records compare components with equals(); SchemaNode keeps Object identity semantics.
    private record VisitKey(SchemaNode node, String prefix) {}
}
