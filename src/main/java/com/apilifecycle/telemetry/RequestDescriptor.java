package com.apilifecycle.telemetry;

/**
 * Transport-neutral view of the request that triggered an evaluation.
 *
 * @param responseStatus status actually sent to the client, or null when not known yet
 */
public record RequestDescriptor(String method, String path, Integer responseStatus) {
}
