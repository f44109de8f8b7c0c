package org.javai.retry.exception;

/**
 * Thrown when {@code RetryResult.getOrThrow()} is called on a failed result.
 * The terminal error of the execution is the cause.
 */
public class RetryFailedException extends RuntimeException {

    public RetryFailedException(Throwable error) {
        super("Retry failed: " + describe(error), error);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
