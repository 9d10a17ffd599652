package com.sentinel.api.error;

/**
 * Failure taxonomy shared by every moderation workflow.
 */
public enum ErrorKind {
    /** Storage or notification timeout; retried with backoff, then degraded. */
    TRANSIENT_IO,
    /** Malformed input such as a short appeal reason or an out-of-range duration. */
    VALIDATION,
    /** Terminal rejection because policy forbids the operation. */
    POLICY_BLOCKED,
    /** Lost conditional update; retried immediately a few times, then treated as TRANSIENT_IO. */
    CONCURRENCY_CONFLICT,
    NOT_FOUND
}
