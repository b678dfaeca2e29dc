package com.apilifecycle.policy;

import java.util.Optional;

/**
 * Maps an operation to the deprecation policy that governs it, if any.
 * Shared by the per-request adapter and the schema annotator.
 */
@FunctionalInterface
public interface PolicyResolver {

    Optional<DeprecationPolicy> resolve(OperationKey operation);
}
