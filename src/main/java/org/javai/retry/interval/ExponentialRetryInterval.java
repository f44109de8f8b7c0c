package org.javai.retry.interval;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Backoff that roughly doubles with each retry and adds up to 10% positive jitter.
 *
 * <p>The n-th interval is {@code initial * (2^n - 1) * (1 + jitter)} with jitter drawn from
 * {@code [0, 0.1)}, capped at {@code max}. Once an interval reaches the cap the strategy is
 * saturated and returns that same value for the rest of its life.
 *
 * <p>Instances are stateful and not thread-safe; use one per retry execution.
 */
public final class ExponentialRetryInterval implements RetryIntervalStrategy {

    /** Used when no cap is given. */
    public static final Duration UNBOUNDED = Duration.ofMillis(Long.MAX_VALUE);

    private static final double MAX_JITTER = 0.1;

    private final Duration initial;
    private final Duration max;
    private final DoubleSupplier jitter;

    private int attemptCount;
    private Duration previousDelay;

    public ExponentialRetryInterval(Duration initial) {
        this(initial, UNBOUNDED);
    }

    public ExponentialRetryInterval(Duration initial, Duration max) {
        this(initial, max, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Package-private for tests. {@code jitter} must yield values in {@code [0, 1)}, which are
     * scaled into the jitter range.
     */
    ExponentialRetryInterval(Duration initial, Duration max, DoubleSupplier jitter) {
        this.initial = Objects.requireNonNull(initial, "initial must not be null");
        this.max = Objects.requireNonNull(max, "max must not be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
        if (initial.isNegative()) {
            throw new IllegalArgumentException("initial must not be negative");
        }
        if (max.isNegative()) {
            throw new IllegalArgumentException("max must not be negative");
        }
        this.previousDelay = initial;
    }

    @Override
    public Duration getInterval() {
        attemptCount++;

        if (previousDelay.compareTo(max) >= 0) {
            return previousDelay;
        }

        double delta = (Math.pow(2, attemptCount) - 1.0) * (1.0 + jitter.getAsDouble() * MAX_JITTER);
        double delayMillis = Math.min(initial.toMillis() * delta, (double) max.toMillis());

        previousDelay = Duration.ofMillis((long) delayMillis);
        return previousDelay;
    }

    /**
     * Number of intervals handed out so far.
     */
    public int attemptCount() {
        return attemptCount;
    }

    @Override
    public String toString() {
        return "ExponentialRetryInterval[initial=" + initial + ", max=" + max + "]";
    }
}
