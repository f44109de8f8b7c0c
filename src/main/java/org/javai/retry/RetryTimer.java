package org.javai.retry;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Schedules the waits of asynchronous executions.
 *
 * <p>A single daemon thread only fires timers; the execution itself continues on its resume
 * executor. Cancelled timers are removed from the queue at once, so a cancelled long backoff
 * holds no resources until its delay would have elapsed.
 */
final class RetryTimer {

    private static final ScheduledThreadPoolExecutor SCHEDULER = createScheduler();

    private RetryTimer() {
        // Utility class
    }

    static ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return SCHEDULER.schedule(task, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    /**
     * Number of timers still waiting to fire. Package-private for tests.
     */
    static int pendingCount() {
        return SCHEDULER.getQueue().size();
    }

    private static ScheduledThreadPoolExecutor createScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "javai-retry-timer");
            t.setDaemon(true);
            return t;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
