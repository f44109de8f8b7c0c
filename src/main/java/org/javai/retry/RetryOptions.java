package org.javai.retry;

import org.javai.retry.interval.RetryIntervalStrategy;
import org.javai.retry.ops.ReporterUtils;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Bounds and backoff for one retry execution.
 *
 * <p>The interval strategy may be stateful, so a given options value should back one
 * execution at a time. There is no process-wide default: {@link #defaults()} is simply a
 * value that callers (usually {@link RetryBuilder}) start from.
 *
 * @param retryInterval Delay strategy consulted before every retry
 * @param maxTryTime Time budget measured from the start of the first attempt
 * @param maxTryCount Maximum number of attempts, including the first (must be &gt;= 1)
 */
public record RetryOptions(
        RetryIntervalStrategy retryInterval,
        Duration maxTryTime,
        int maxTryCount
) {

    /** A time budget that is never exhausted. */
    public static final Duration UNBOUNDED = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);
    public static final int DEFAULT_MAX_TRY_COUNT = 2;

    static final String MAX_TRY_COUNT_PROPERTY = "javai.retry.maxTryCount";
    static final String MAX_TRY_COUNT_ENV = "JAVAI_RETRY_MAX_TRY_COUNT";
    static final String MAX_TRY_TIME_PROPERTY = "javai.retry.maxTryTime";
    static final String MAX_TRY_TIME_ENV = "JAVAI_RETRY_MAX_TRY_TIME";
    static final String INTERVAL_PROPERTY = "javai.retry.interval";
    static final String INTERVAL_ENV = "JAVAI_RETRY_INTERVAL";

    public RetryOptions {
        Objects.requireNonNull(retryInterval, "retryInterval must not be null");
        Objects.requireNonNull(maxTryTime, "maxTryTime must not be null");
        if (maxTryTime.isNegative()) {
            throw new IllegalArgumentException("maxTryTime must not be negative");
        }
        if (maxTryCount < 1) {
            throw new IllegalArgumentException("maxTryCount must be >= 1, was: " + maxTryCount);
        }
    }

    /**
     * Two attempts, 100ms apart, no time budget.
     */
    public static RetryOptions defaults() {
        return new RetryOptions(RetryIntervalStrategy.constant(DEFAULT_INTERVAL), UNBOUNDED, DEFAULT_MAX_TRY_COUNT);
    }

    public RetryOptions withRetryInterval(RetryIntervalStrategy retryInterval) {
        return new RetryOptions(retryInterval, maxTryTime, maxTryCount);
    }

    public RetryOptions withMaxTryTime(Duration maxTryTime) {
        return new RetryOptions(retryInterval, maxTryTime, maxTryCount);
    }

    public RetryOptions withMaxTryCount(int maxTryCount) {
        return new RetryOptions(retryInterval, maxTryTime, maxTryCount);
    }

    public boolean hasTimeBudget() {
        return !UNBOUNDED.equals(maxTryTime);
    }

    /**
     * Overlays values found in system properties or environment variables on {@code fallback}.
     *
     * <p>Recognised settings (system property first, then environment variable):
     * <ul>
     *   <li>{@code javai.retry.maxTryCount} / {@code JAVAI_RETRY_MAX_TRY_COUNT}: integer</li>
     *   <li>{@code javai.retry.maxTryTime} / {@code JAVAI_RETRY_MAX_TRY_TIME}: ISO-8601 duration</li>
     *   <li>{@code javai.retry.interval} / {@code JAVAI_RETRY_INTERVAL}: ISO-8601 duration, constant interval</li>
     * </ul>
     *
     * @param fallback values used for settings that are not configured
     * @return the resolved options
     * @throws IllegalArgumentException if a configured value cannot be parsed
     */
    public static RetryOptions fromEnvironment(RetryOptions fallback) {
        Objects.requireNonNull(fallback, "fallback must not be null");

        RetryOptions options = fallback;

        String maxTryCount = ReporterUtils.resolveOptionalConfig(MAX_TRY_COUNT_PROPERTY, MAX_TRY_COUNT_ENV);
        if (maxTryCount != null) {
            try {
                options = options.withMaxTryCount(Integer.parseInt(maxTryCount.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + MAX_TRY_COUNT_PROPERTY + ": " + maxTryCount, e);
            }
        }

        String maxTryTime = ReporterUtils.resolveOptionalConfig(MAX_TRY_TIME_PROPERTY, MAX_TRY_TIME_ENV);
        if (maxTryTime != null) {
            options = options.withMaxTryTime(parseDuration(MAX_TRY_TIME_PROPERTY, maxTryTime));
        }

        String interval = ReporterUtils.resolveOptionalConfig(INTERVAL_PROPERTY, INTERVAL_ENV);
        if (interval != null) {
            options = options.withRetryInterval(RetryIntervalStrategy.constant(parseDuration(INTERVAL_PROPERTY, interval)));
        }

        return options;
    }

    private static Duration parseDuration(String name, String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
