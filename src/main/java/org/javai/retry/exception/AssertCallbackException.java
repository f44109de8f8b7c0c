package org.javai.retry.exception;

/**
 * Raised when the acceptance condition throws. Carries the original failure as its cause.
 */
public class AssertCallbackException extends CallbackException {

    public AssertCallbackException(Throwable cause) {
        super("An exception occurred in the acceptance condition, see cause", cause);
    }
}
