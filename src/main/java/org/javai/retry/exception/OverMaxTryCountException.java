package org.javai.retry.exception;

/**
 * Raised when the execution reached its maximum number of attempts without success.
 */
public class OverMaxTryCountException extends RuntimeException {

    private final int triedCount;

    public OverMaxTryCountException(int triedCount) {
        super("Gave up after " + triedCount + " attempt(s)");
        this.triedCount = triedCount;
    }

    /**
     * Total number of attempts performed.
     */
    public int triedCount() {
        return triedCount;
    }
}
