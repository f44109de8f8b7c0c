package org.javai.retry.interval;

import java.time.Duration;
import java.util.Objects;

/**
 * Waits the same fixed duration before every retry.
 */
public final class ConstantRetryInterval implements RetryIntervalStrategy {

    private final Duration interval;

    public ConstantRetryInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        this.interval = interval;
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public String toString() {
        return "ConstantRetryInterval[" + interval + "]";
    }
}
