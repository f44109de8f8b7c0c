package org.javai.retry.ops;

import org.javai.retry.RetryContext;

import java.time.Duration;

/**
 * Reports the lifecycle of retry executions for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporters are called on the thread that drives the execution and must not throw.
 */
public interface RetryReporter {

    /**
     * Reports that an execution ended without success.
     *
     * @param operation The name of the retried operation
     * @param error The terminal error
     * @param context Progress at the moment the execution ended
     */
    void reportFailure(String operation, Throwable error, RetryContext context);

    /**
     * Reports that a retry is about to wait and then run another attempt.
     *
     * @param operation The name of the retried operation
     * @param context Progress, including the attempt about to run
     * @param delay The wait before the attempt
     */
    default void reportRetryAttempt(String operation, RetryContext context, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that an execution succeeded.
     *
     * @param operation The name of the retried operation
     * @param context Progress at the moment of success
     */
    default void reportSuccess(String operation, RetryContext context) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static RetryReporter noOp() {
        return (operation, error, context) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }
}
