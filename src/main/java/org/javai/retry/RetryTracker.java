package org.javai.retry;

import org.javai.retry.exception.OverMaxTryCountException;
import org.javai.retry.exception.OverMaxTryTimeException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;

/**
 * Live counters of a single execution. Owned by exactly one run and never shared;
 * callbacks only ever see {@link #snapshot()}s.
 */
final class RetryTracker {

    private final Clock clock;
    private final Instant startedAt;

    private int triedCount;
    private int retryCount;
    private Duration triedTime = Duration.ZERO;

    RetryTracker(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Starts the next attempt.
     *
     * @return true if this attempt is a retry
     */
    boolean beginAttempt() {
        triedCount++;
        refresh();
        if (triedCount > 1) {
            retryCount = triedCount - 1;
            return true;
        }
        return false;
    }

    /**
     * Evaluates the continuation bounds after an unsuccessful attempt, recording the
     * terminal error on {@code result} when a bound is hit.
     *
     * @return true if another attempt may be made
     */
    boolean shouldContinue(RetryResult<?> result, RetryOptions options, CancellationToken cancellation) {
        refresh();
        if (triedTime.compareTo(options.maxTryTime()) >= 0) {
            result.setError(new OverMaxTryTimeException(triedTime));
            return false;
        }
        if (triedCount >= options.maxTryCount()) {
            result.setError(new OverMaxTryCountException(triedCount));
            return false;
        }
        if (cancellation.isCancellationRequested()) {
            result.setError(new CancellationException("Retry cancelled after " + triedCount + " attempt(s)"));
            return false;
        }
        return true;
    }

    RetryContext snapshot() {
        return new RetryContext(triedCount, retryCount, triedTime);
    }

    int triedCount() {
        return triedCount;
    }

    private void refresh() {
        triedTime = Duration.between(startedAt, clock.instant());
    }
}
