package org.javai.retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for asynchronous retry executions.
 *
 * <p>Cancellation is advisory. A running execution checks the token before and while it waits
 * between attempts and after every unsuccessful attempt; an attempt already in flight is
 * never interrupted.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * CompletableFuture<RetryResult<Order>> pending = task.runAsync(token);
 * ...
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * A fresh token that has not been cancelled.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that is already cancelled.
     */
    public static CancellationToken cancelled() {
        CancellationToken token = create();
        token.cancel();
        return token;
    }

    /**
     * A token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation and notifies registered listeners. Only the first call has an effect.
     *
     * @throws UnsupportedOperationException if this is {@link #none()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                if (listeners.remove(listener)) {
                    listener.run();
                }
            }
        }
    }

    /**
     * Requests cancellation once {@code delay} has elapsed.
     *
     * @return this token
     */
    public CancellationToken cancelAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        CompletableFuture.runAsync(this::cancel,
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
        return this;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Registers a listener to run on cancellation. Runs it immediately if the token is already
     * cancelled.
     *
     * @return a registration that removes the listener again
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        if (!cancellable) {
            return () -> {};
        }
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Handle for a registered cancellation listener.
     */
    @FunctionalInterface
    public interface Registration {
        void unregister();
    }
}
