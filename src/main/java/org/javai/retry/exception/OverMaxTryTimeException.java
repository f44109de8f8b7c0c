package org.javai.retry.exception;

import java.time.Duration;

/**
 * Raised when the execution ran out of its time budget without success.
 */
public class OverMaxTryTimeException extends RuntimeException {

    private final Duration triedTime;

    public OverMaxTryTimeException(Duration triedTime) {
        super("Gave up after " + triedTime.toMillis() + " ms");
        this.triedTime = triedTime;
    }

    /**
     * Total time spent since the first attempt started.
     */
    public Duration triedTime() {
        return triedTime;
    }
}
