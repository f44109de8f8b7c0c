package org.javai.retry.classify;

import java.util.Set;

/**
 * Decides whether a failed attempt may be retried.
 *
 * <p>Only failures thrown by the guarded operation are classified. Failures raised inside
 * lifecycle callbacks always end the execution and never reach a classifier.
 */
@FunctionalInterface
public interface ExceptionClassifier {

    /**
     * Classifies a failure thrown by the operation.
     *
     * @param error The failure thrown (or completed exceptionally) by the operation
     * @param retryOn The configured retryable exception types; empty means "retry on anything"
     * @return true to schedule another attempt, false to end the execution with {@code error}
     */
    boolean isRetryable(Throwable error, Set<Class<? extends Throwable>> retryOn);

    /**
     * The default classifier.
     *
     * @see DefaultExceptionClassifier
     */
    static ExceptionClassifier defaultClassifier() {
        return DefaultExceptionClassifier.INSTANCE;
    }
}
