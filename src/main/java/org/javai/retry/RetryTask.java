package org.javai.retry;

import org.javai.retry.CallbackRegistry.Category;
import org.javai.retry.classify.ExceptionClassifier;
import org.javai.retry.exception.AssertCallbackException;
import org.javai.retry.exception.CallbackException;
import org.javai.retry.ops.RetryReporter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Predicate;

/**
 * Blocking retry execution: the calling thread performs every attempt and sleeps between them.
 *
 * <p>Each call to {@link #run(Predicate)} is an independent execution with its own counters
 * and result. The task itself keeps no per-run state, but the configured
 * {@link org.javai.retry.interval.RetryIntervalStrategy} may; see {@link RetryOptions}.
 *
 * @param <T> The type of the operation's result
 */
public final class RetryTask<T> implements Retriable<T> {

    static final String DEFAULT_NAME = "retry";

    private final String name;
    private final ThrowingSupplier<T, ? extends Exception> operation;
    private final RetryOptions options;
    private final Set<Class<? extends Throwable>> retryOn;
    private final ExceptionClassifier classifier;
    private final RetryReporter reporter;
    private final Executor executor;
    private final Sleeper sleeper;
    private final Clock clock;
    private final CallbackRegistry<T> callbacks = new CallbackRegistry<>();

    /**
     * Creates a task with the default classifier, no reporting and no name.
     *
     * @param operation The operation to retry
     * @param options Bounds and backoff
     * @param retryOn Exception types worth retrying; empty retries on any exception
     */
    public RetryTask(ThrowingSupplier<T, ? extends Exception> operation, RetryOptions options,
                     Set<Class<? extends Throwable>> retryOn) {
        this(DEFAULT_NAME, operation, options, retryOn, ExceptionClassifier.defaultClassifier(),
                RetryReporter.noOp(), ForkJoinPool.commonPool(), Thread::sleep, Clock.systemUTC());
    }

    RetryTask(String name, ThrowingSupplier<T, ? extends Exception> operation, RetryOptions options,
              Set<Class<? extends Throwable>> retryOn, ExceptionClassifier classifier, RetryReporter reporter,
              Executor executor, Sleeper sleeper, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.retryOn = Set.copyOf(Objects.requireNonNull(retryOn, "retryOn must not be null"));
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public RetryResult<T> run(Predicate<? super RetryResult<T>> condition) {
        RetryTracker tracker = new RetryTracker(clock);
        RetryResult<T> result = new RetryResult<>();

        do {
            if (tracker.beginAttempt()) {
                try {
                    callbacks.invoke(Category.RETRY, result, tracker.snapshot());
                } catch (CallbackException e) {
                    result.setError(e);
                    break;
                }

                Duration delay = options.retryInterval().getInterval();
                reporter.reportRetryAttempt(name, tracker.snapshot(), delay);
                if (!sleep(delay, result)) {
                    break;
                }
            }

            try {
                result.setResult(operation.get());
            } catch (Throwable t) {
                if (classifier.isRetryable(t, retryOn)) {
                    continue;
                }
                result.setError(t);
                break;
            }

            if (condition != null) {
                try {
                    if (!condition.test(result)) {
                        continue;
                    }
                } catch (Throwable t) {
                    Throwables.rethrowIfUnrecoverable(t);
                    result.setError(new AssertCallbackException(t));
                    break;
                }
            }

            try {
                callbacks.invoke(Category.SUCCESS, result, tracker.snapshot());
            } catch (CallbackException e) {
                result.setError(e);
                break;
            }

            reporter.reportSuccess(name, tracker.snapshot());
            return result;
        } while (tracker.shouldContinue(result, options, CancellationToken.none()));

        try {
            callbacks.invoke(Category.FAILURE, result, tracker.snapshot());
        } catch (CallbackException e) {
            // Replaces the terminal error determined above.
            result.setError(e);
        }

        reporter.reportFailure(name, result.error(), tracker.snapshot());
        return result;
    }

    @Override
    public AsyncRetriable<T> asAsync() {
        return new AsyncRetryTask<>(name, () -> supplyAsync(operation, executor), options, retryOn, classifier,
                reporter, executor, clock, callbacks.copy());
    }

    @Override
    public Retriable<T> onRetry(RetryHook<T> hook) {
        callbacks.add(Category.RETRY, hook);
        return this;
    }

    @Override
    public Retriable<T> onSuccess(RetryHook<T> hook) {
        callbacks.add(Category.SUCCESS, hook);
        return this;
    }

    @Override
    public Retriable<T> onFailure(RetryHook<T> hook) {
        callbacks.add(Category.FAILURE, hook);
        return this;
    }

    public String name() {
        return name;
    }

    public RetryOptions options() {
        return options;
    }

    /**
     * Sleeps before a retry.
     *
     * @return false if the thread was interrupted; the result then carries a cancellation error
     */
    private boolean sleep(Duration delay, RetryResult<T> result) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting to retry");
            cancelled.initCause(e);
            result.setError(cancelled);
            return false;
        }
    }

    private static <T> CompletableFuture<T> supplyAsync(ThrowingSupplier<T, ? extends Exception> operation,
                                                        Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
