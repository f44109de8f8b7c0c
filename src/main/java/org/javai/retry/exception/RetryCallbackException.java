package org.javai.retry.exception;

/**
 * Raised when a retry callback throws. Carries the original failure as its cause.
 */
public class RetryCallbackException extends CallbackException {

    public RetryCallbackException(Throwable cause) {
        super("An exception occurred in a retry callback, see cause", cause);
    }
}
