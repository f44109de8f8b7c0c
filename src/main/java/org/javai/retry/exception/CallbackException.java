package org.javai.retry.exception;

/**
 * Base type for failures raised inside a lifecycle callback or an acceptance condition.
 * The original failure is always available as {@link #getCause()}.
 *
 * <p>Callback failures are terminal: they end the execution immediately and are never
 * passed to the exception classifier.
 */
public abstract class CallbackException extends RuntimeException {

    protected CallbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
