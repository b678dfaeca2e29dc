package com.apilifecycle.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link PolicyResolver} holding operation-level and prefix-level policies.
 *
 * Resolution order:
 * 1. exact operation (method + path)
 * 2. exact path registered for any method
 * 3. longest registered prefix that the path equals or continues at a '/' boundary
 *
 * Registration normally happens once during startup; lookups are lock-free.
 */
public class PolicyRegistry implements PolicyResolver {

    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    private final ConcurrentHashMap<OperationKey, DeprecationPolicy> operations = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<PrefixEntry> prefixes = new CopyOnWriteArrayList<>();

    public PolicyRegistry register(OperationKey operation, DeprecationPolicy policy) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(policy, "policy");
        DeprecationPolicy previous = operations.put(operation, policy);
        if (previous != null) {
            log.warn("Replaced deprecation policy for operation {}", operation);
        }
        return this;
    }

    public PolicyRegistry register(String method, String path, DeprecationPolicy policy) {
        return register(OperationKey.of(method, path), policy);
    }

    public synchronized PolicyRegistry registerPrefix(String prefix, DeprecationPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        String normalized = normalizePrefix(prefix);
        prefixes.removeIf(entry -> {
            boolean same = entry.prefix().equals(normalized);
            if (same) {
                log.warn("Replaced deprecation policy for prefix {}", normalized);
            }
            return same;
        });
        prefixes.add(new PrefixEntry(normalized, policy));
        // Most specific prefix first.
        prefixes.sort(Comparator.comparingInt((PrefixEntry entry) -> entry.prefix().length()).reversed());
        return this;
    }

    @Override
    public Optional<DeprecationPolicy> resolve(OperationKey operation) {
        DeprecationPolicy exact = operations.get(operation);
        if (exact != null) {
            return Optional.of(exact);
        }
        if (operation.method() != null) {
            DeprecationPolicy anyMethod = operations.get(OperationKey.anyMethod(operation.path()));
            if (anyMethod != null) {
                return Optional.of(anyMethod);
            }
        }
        for (PrefixEntry entry : prefixes) {
            if (matchesPrefix(operation.path(), entry.prefix())) {
                return Optional.of(entry.policy());
            }
        }
        return Optional.empty();
    }

    public Map<OperationKey, DeprecationPolicy> operations() {
        return Map.copyOf(operations);
    }

    public int size() {
        return operations.size() + prefixes.size();
    }

    private static boolean matchesPrefix(String path, String prefix) {
        if ("/".equals(prefix)) {
            return true;
        }
        return path.startsWith(prefix)
            && (path.length() == prefix.length() || path.charAt(prefix.length()) == '/');
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new PolicyValidationException("prefix must not be blank");
        }
        String normalized = prefix.startsWith("/") ? prefix : "/" + prefix;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private record PrefixEntry(String prefix, DeprecationPolicy policy) {}
}
