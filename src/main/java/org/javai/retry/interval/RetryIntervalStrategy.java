package org.javai.retry.interval;

import java.time.Duration;

/**
 * Produces the delay to wait before each retry.
 *
 * <p>Implementations may be stateful: an exponential strategy remembers how many intervals it
 * has handed out. A single instance must therefore serve a single retry execution at a time.
 * Sharing one instance between concurrent executions is the caller's responsibility and its
 * outcome is undefined.
 */
@FunctionalInterface
public interface RetryIntervalStrategy {

    /**
     * Returns the delay before the next retry. Called once per retry, never before the first attempt.
     *
     * @return a non-negative delay
     */
    Duration getInterval();

    /**
     * A strategy that always waits for the same duration.
     */
    static RetryIntervalStrategy constant(Duration interval) {
        return new ConstantRetryInterval(interval);
    }

    /**
     * A strategy that never waits.
     */
    static RetryIntervalStrategy immediate() {
        return new ConstantRetryInterval(Duration.ZERO);
    }

    /**
     * A jittered exponential strategy starting at {@code initial} and capped at {@code max}.
     */
    static RetryIntervalStrategy exponential(Duration initial, Duration max) {
        return new ExponentialRetryInterval(initial, max);
    }
}
