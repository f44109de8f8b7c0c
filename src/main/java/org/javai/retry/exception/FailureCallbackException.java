package org.javai.retry.exception;

/**
 * Raised when a failure callback throws. Carries the original failure as its cause.
 *
 * <p>It replaces whatever terminal error the execution had already determined; that earlier
 * error is not retained.
 */
public class FailureCallbackException extends CallbackException {

    public FailureCallbackException(Throwable cause) {
        super("An exception occurred in a failure callback, see cause", cause);
    }
}
