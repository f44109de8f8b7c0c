package org.javai.retry.exception;

/**
 * Raised when a success callback throws. Carries the original failure as its cause.
 */
public class SuccessCallbackException extends CallbackException {

    public SuccessCallbackException(Throwable cause) {
        super("An exception occurred in a success callback, see cause", cause);
    }
}
