package com.apilifecycle.policy;

import java.util.Locale;
import java.util.Objects;

/**
 * Stable identifier of an API operation: HTTP method plus path.
 * A null method stands for every method on the path.
 */
public record OperationKey(String method, String path) {

    public OperationKey {
        Objects.requireNonNull(path, "path");
        method = method == null || method.isBlank() ? null : method.toUpperCase(Locale.ROOT);
    }

    public static OperationKey of(String method, String path) {
        return new OperationKey(method, path);
    }

    public static OperationKey anyMethod(String path) {
        return new OperationKey(null, path);
    }

    @Override
    public String toString() {
        return (method == null ? "*" : method) + " " + path;
    }
}
