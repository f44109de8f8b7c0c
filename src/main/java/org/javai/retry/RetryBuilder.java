package org.javai.retry;

import org.javai.retry.classify.ExceptionClassifier;
import org.javai.retry.interval.RetryIntervalStrategy;
import org.javai.retry.ops.RetryReporter;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;

/**
 * Fluent configuration of retry tasks.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retriable<Response> task = RetryBuilder.create()
 *     .named("UserApi.fetch")
 *     .maxTryCount(5)
 *     .maxTryTime(Duration.ofSeconds(30))
 *     .retryInterval(RetryIntervalStrategy.exponential(Duration.ofMillis(100), Duration.ofSeconds(5)))
 *     .retryOn(IOException.class)
 *     .reporter(new Log4jRetryReporter())
 *     .build(() -> userApi.fetch(userId));
 *
 * RetryResult<Response> result = task.run();
 * }</pre>
 *
 * <p>The options a builder starts from are an explicit value ({@link RetryOptions#defaults()}
 * unless given to {@link #create(RetryOptions)}); nothing is read from global state.
 */
public final class RetryBuilder {

    private String name = RetryTask.DEFAULT_NAME;
    private RetryOptions options;
    private final Set<Class<? extends Throwable>> retryOn = new LinkedHashSet<>();
    private ExceptionClassifier classifier = ExceptionClassifier.defaultClassifier();
    private RetryReporter reporter = RetryReporter.noOp();
    private Executor executor = ForkJoinPool.commonPool();
    private RetryTask.Sleeper sleeper = Thread::sleep;
    private Clock clock = Clock.systemUTC();

    private RetryBuilder(RetryOptions options) {
        this.options = options;
    }

    /**
     * A builder starting from {@link RetryOptions#defaults()}.
     */
    public static RetryBuilder create() {
        return new RetryBuilder(RetryOptions.defaults());
    }

    /**
     * A builder starting from the given options.
     */
    public static RetryBuilder create(RetryOptions options) {
        return new RetryBuilder(Objects.requireNonNull(options, "options must not be null"));
    }

    /**
     * Sets the operation name used in reporting (optional).
     */
    public RetryBuilder named(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    /**
     * Replaces all options at once.
     */
    public RetryBuilder options(RetryOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        return this;
    }

    /**
     * Sets the maximum number of attempts, including the first.
     *
     * @throws IllegalArgumentException if {@code maxTryCount} is less than 1
     */
    public RetryBuilder maxTryCount(int maxTryCount) {
        this.options = options.withMaxTryCount(maxTryCount);
        return this;
    }

    /**
     * Sets the time budget, measured from the start of the first attempt.
     */
    public RetryBuilder maxTryTime(Duration maxTryTime) {
        this.options = options.withMaxTryTime(maxTryTime);
        return this;
    }

    /**
     * Sets the backoff strategy. Give each built task its own stateful strategy instance.
     */
    public RetryBuilder retryInterval(RetryIntervalStrategy retryInterval) {
        this.options = options.withRetryInterval(retryInterval);
        return this;
    }

    /**
     * Retries only failures that are instances of one of the registered types.
     */
    public RetryBuilder retryOn(Class<? extends Throwable> type) {
        retryOn.add(Objects.requireNonNull(type, "type must not be null"));
        return this;
    }

    @SafeVarargs
    public final RetryBuilder retryOn(Class<? extends Throwable>... types) {
        for (Class<? extends Throwable> type : types) {
            retryOn(type);
        }
        return this;
    }

    /**
     * Forgets registered types, so that any failure is retried.
     */
    public RetryBuilder retryAllExceptions() {
        retryOn.clear();
        return this;
    }

    public RetryBuilder classifier(ExceptionClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        return this;
    }

    /**
     * Sets the reporter for retry events (optional, defaults to no-op).
     */
    public RetryBuilder reporter(RetryReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        return this;
    }

    /**
     * Sets the executor that asynchronous tasks resume on (optional, defaults to the common pool).
     */
    public RetryBuilder executor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        return this;
    }

    /**
     * Sets the sleeper for testing (package-private).
     */
    RetryBuilder sleeper(RetryTask.Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        return this;
    }

    /**
     * Sets the clock for testing (package-private).
     */
    RetryBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        return this;
    }

    /**
     * Builds a blocking task around an operation producing a value.
     */
    public <T> Retriable<T> build(ThrowingSupplier<T, ? extends Exception> operation) {
        return new RetryTask<>(name, operation, options, retryOn, classifier, reporter, executor, sleeper, clock);
    }

    /**
     * Builds a blocking task around an action.
     */
    public Retriable<Void> buildAction(ThrowingRunnable<? extends Exception> action) {
        Objects.requireNonNull(action, "action must not be null");
        return build(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Builds an asynchronous task. {@code operation} is called once per attempt.
     */
    public <T> AsyncRetriable<T> buildAsync(Supplier<? extends CompletionStage<T>> operation) {
        return new AsyncRetryTask<>(name, operation, options, retryOn, classifier, reporter, executor, clock,
                new CallbackRegistry<>());
    }
}
