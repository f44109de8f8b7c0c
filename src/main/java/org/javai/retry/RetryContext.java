package org.javai.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Snapshot of an execution's progress, handed to lifecycle callbacks.
 *
 * <p>Each callback invocation receives a value taken at that moment; later attempts never
 * change it, and nothing a callback does with it can influence the running execution.
 *
 * @param triedCount Attempts started so far (1-based)
 * @param retryCount Retries performed so far; 0 until the first retry
 * @param triedTime Time elapsed since the first attempt started
 */
public record RetryContext(int triedCount, int retryCount, Duration triedTime) {

    public RetryContext {
        if (triedCount < 0) {
            throw new IllegalArgumentException("triedCount must be >= 0");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        Objects.requireNonNull(triedTime, "triedTime must not be null");
    }

    public boolean isRetry() {
        return triedCount > 1;
    }
}
