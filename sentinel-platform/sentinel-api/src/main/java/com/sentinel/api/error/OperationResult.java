package com.sentinel.api.error;

/**
 * Typed outcome of a workflow operation.
 * Exactly one of {@code value} and {@code errorKind} is set.
 */
public record OperationResult<T>(
        boolean success,
        T value,
        ErrorKind errorKind,
        String message
) {
    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(true, value, null, null);
    }

    public static <T> OperationResult<T> ok(T value, String message) {
        return new OperationResult<>(true, value, null, message);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new OperationResult<>(false, null, kind, message);
    }

    public static <T> OperationResult<T> failure(ModerationException e) {
        return new OperationResult<>(false, null, e.getKind(), e.getMessage());
    }

    /**
     * Returns the value or rethrows the failure as the matching exception.
     */
    public T orElseThrow() {
        if (success) {
            return value;
        }
        throw switch (errorKind) {
            case VALIDATION -> new ModerationValidationException(message);
            case POLICY_BLOCKED -> new PolicyBlockedException(message);
            case NOT_FOUND -> new ResourceNotFoundException(message);
            case CONCURRENCY_CONFLICT -> new ConcurrencyConflictException(message, null);
            case TRANSIENT_IO -> new TransientIoException(message);
        };
    }
}
