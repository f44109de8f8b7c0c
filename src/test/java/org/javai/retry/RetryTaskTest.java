package org.javai.retry;

import org.javai.retry.classify.ExceptionClassifier;
import org.javai.retry.exception.AssertCallbackException;
import org.javai.retry.exception.FailureCallbackException;
import org.javai.retry.exception.OverMaxTryCountException;
import org.javai.retry.exception.OverMaxTryTimeException;
import org.javai.retry.exception.RetryCallbackException;
import org.javai.retry.exception.RetryFailedException;
import org.javai.retry.exception.SuccessCallbackException;
import org.javai.retry.interval.RetryIntervalStrategy;
import org.javai.retry.ops.RetryReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryTaskTest {

    private List<Long> sleeps;
    private List<String> events;
    private MutableClock clock;
    private RetryReporter reporter;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        events = new ArrayList<>();
        clock = new MutableClock();
        reporter = new RetryReporter() {
            @Override
            public void reportFailure(String operation, Throwable error, RetryContext context) {
                events.add("failure:" + operation + ":" + error.getClass().getSimpleName() + ":" + context.triedCount());
            }

            @Override
            public void reportRetryAttempt(String operation, RetryContext context, Duration delay) {
                events.add("retry:" + operation + ":" + context.retryCount() + ":" + delay.toMillis());
            }

            @Override
            public void reportSuccess(String operation, RetryContext context) {
                events.add("success:" + operation + ":" + context.triedCount());
            }
        };
    }

    private <T> RetryTask<T> task(ThrowingSupplier<T, ? extends Exception> operation, RetryOptions options,
                                  Set<Class<? extends Throwable>> retryOn) {
        return new RetryTask<>("Op", operation, options, retryOn, ExceptionClassifier.defaultClassifier(),
                reporter, Runnable::run, sleeps::add, clock);
    }

    private static RetryOptions options(int maxTryCount) {
        return new RetryOptions(RetryIntervalStrategy.constant(Duration.ofMillis(100)), RetryOptions.UNBOUNDED,
                maxTryCount);
    }

    @Test
    void run_successOnFirstAttempt_runsNoRetryCallbacksAndNoDelay() {
        AtomicInteger retries = new AtomicInteger();
        List<RetryContext> successContexts = new ArrayList<>();

        RetryResult<String> result = this.<String>task(() -> "success", options(3), Set.of())
                .onRetry((RetryCallback<String>) (r, context) -> retries.incrementAndGet())
                .onSuccess((RetryCallback<String>) (r, context) -> successContexts.add(context))
                .run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOrThrow()).isEqualTo("success");
        assertThat(retries).hasValue(0);
        assertThat(sleeps).isEmpty();
        assertThat(successContexts).containsExactly(new RetryContext(1, 0, Duration.ZERO));
        assertThat(successContexts.get(0).isRetry()).isFalse();
        assertThat(events).containsExactly("success:Op:1");
    }

    @Test
    void run_retriesOnTransientFailure() {
        AtomicInteger attempts = new AtomicInteger();

        RetryResult<String> result = this.<String>task(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("attempt " + attempts.get());
            }
            return "success on attempt 3";
        }, options(5), Set.of(IOException.class)).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.result()).isEqualTo("success on attempt 3");
        assertThat(attempts).hasValue(3);
        assertThat(sleeps).containsExactly(100L, 100L);
        assertThat(events).containsExactly("retry:Op:1:100", "retry:Op:2:100", "success:Op:3");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 8})
    void run_alwaysFailing_stopsAfterExactlyMaxTryCountAttempts(int maxTryCount) {
        AtomicInteger attempts = new AtomicInteger();
        List<RetryContext> failureContexts = new ArrayList<>();

        RetryResult<String> result = this.<String>task(() -> {
            attempts.incrementAndGet();
            throw new IOException("down");
        }, options(maxTryCount), Set.of())
                .onFailure((RetryCallback<String>) (r, context) -> failureContexts.add(context))
                .run();

        assertThat(attempts).hasValue(maxTryCount);
        assertThat(result.error())
                .isInstanceOfSatisfying(OverMaxTryCountException.class,
                        e -> assertThat(e.triedCount()).isEqualTo(maxTryCount));
        assertThat(failureContexts).hasSize(1);
        assertThat(failureContexts.get(0).triedCount()).isEqualTo(maxTryCount);
        assertThat(failureContexts.get(0).retryCount()).isEqualTo(maxTryCount - 1);
        assertThat(sleeps).hasSize(maxTryCount - 1);
    }

    @Test
    void run_nonRetryableFailure_endsAfterOneAttemptWithOriginalError() {
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger retries = new AtomicInteger();
        IllegalStateException failure = new IllegalStateException("bad state");

        RetryResult<String> result = this.<String>task(() -> {
            attempts.incrementAndGet();
            throw failure;
        }, options(5), Set.of(IOException.class))
                .onRetry((ResultCallback<String>) r -> retries.incrementAndGet())
                .run();

        assertThat(attempts).hasValue(1);
        assertThat(retries).hasValue(0);
        assertThat(result.error()).isSameAs(failure);
        assertThat(events).containsExactly("failure:Op:IllegalStateException:1");
    }

    @Test
    void run_retryOnMatchesSubclasses() {
        AtomicInteger attempts = new AtomicInteger();

        RetryResult<String> result = this.<String>task(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new SocketTimeoutException("slow");
            }
            return "ok";
        }, options(3), Set.of(IOException.class)).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(attempts).hasValue(2);
    }

    @Test
    void run_unrecoverableError_isNeverRetried() {
        AtomicInteger attempts = new AtomicInteger();
        StackOverflowError overflow = new StackOverflowError("deep");

        RetryResult<String> result = this.<String>task(() -> {
            attempts.incrementAndGet();
            throw overflow;
        }, options(5), Set.of()).run();

        assertThat(attempts).hasValue(1);
        assertThat(result.error()).isSameAs(overflow);
    }

    @Test
    void run_retryCallbackThrows_endsImmediatelyWithRetryCallbackException() {
        AtomicInteger attempts = new AtomicInteger();
        IllegalStateException hookFailure = new IllegalStateException("hook broke");

        RetryResult<String> result = this.<String>task(() -> {
            attempts.incrementAndGet();
            throw new IOException("down");
        }, options(5), Set.of())
                .onRetry((ResultCallback<String>) r -> {
                    throw hookFailure;
                })
                .run();

        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
        assertThat(result.error())
                .isInstanceOf(RetryCallbackException.class)
                .hasCause(hookFailure);
    }

    @Test
    void run_retryCallbacksRunInRegistrationOrder_andFirstFailureSkipsTheRest() {
        List<String> calls = new ArrayList<>();

        RetryResult<String> result = this.<String>task(() -> {
            throw new IOException("down");
        }, options(3), Set.of())
                .onRetry((ResultCallback<String>) r -> calls.add("first"))
                .onRetry((ResultCallback<String>) r -> {
                    calls.add("second");
                    throw new IOException("second failed");
                })
                .onRetry((ResultCallback<String>) r -> calls.add("third"))
                .run();

        assertThat(calls).containsExactly("first", "second");
        assertThat(result.error())
                .isInstanceOf(RetryCallbackException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void run_successCallbackThrows_resultIsFailureWithSuccessCallbackException() {
        AtomicInteger failureCalls = new AtomicInteger();

        RetryResult<String> result = this.<String>task(() -> "value", options(3), Set.of())
                .onSuccess((ResultCallback<String>) r -> {
                    throw new IllegalArgumentException("rejected");
                })
                .onFailure((ResultCallback<String>) r -> failureCalls.incrementAndGet())
                .run();

        assertThat(result.isFailure()).isTrue();
        assertThat(result.result()).isEqualTo("value");
        assertThat(result.error())
                .isInstanceOf(SuccessCallbackException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(failureCalls).hasValue(1);
    }

    @Test
    void run_conditionRejectsOnce_thenAccepts_makesTwoAttemptsAndOneRetryRound() {
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger retries = new AtomicInteger();

        RetryResult<Integer> result = task(attempts::incrementAndGet, options(3), Set.of())
                .onRetry((ResultCallback<Integer>) r -> retries.incrementAndGet())
                .run(r -> r.result() >= 2);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.result()).isEqualTo(2);
        assertThat(attempts).hasValue(2);
        assertThat(retries).hasValue(1);
        assertThat(sleeps).containsExactly(100L);
    }

    @Test
    void run_conditionNeverAccepts_endsWithOverMaxTryCountAndKeepsLastValue() {
        AtomicInteger attempts = new AtomicInteger();

        RetryResult<Integer> result = task(attempts::incrementAndGet, options(3), Set.of())
                .run(r -> false);

        assertThat(attempts).hasValue(3);
        assertThat(result.result()).isEqualTo(3);
        assertThat(result.error()).isInstanceOf(OverMaxTryCountException.class);
    }

    @Test
    void run_conditionThrows_endsWithAssertCallbackException() {
        RetryResult<String> result = this.<String>task(() -> "value", options(3), Set.of())
                .run(r -> {
                    throw new IllegalStateException("cannot judge");
                });

        assertThat(result.error())
                .isInstanceOf(AssertCallbackException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void run_timeBudgetExhausted_endsWithOverMaxTryTime() {
        AtomicInteger attempts = new AtomicInteger();
        RetryOptions options = new RetryOptions(RetryIntervalStrategy.immediate(), Duration.ofMillis(100), 10);

        RetryResult<String> result = this.<String>task(() -> {
            attempts.incrementAndGet();
            clock.advance(Duration.ofMillis(40));
            throw new IOException("slow failure");
        }, options, Set.of()).run();

        assertThat(attempts).hasValue(3);
        assertThat(result.error())
                .isInstanceOfSatisfying(OverMaxTryTimeException.class,
                        e -> assertThat(e.triedTime()).isEqualTo(Duration.ofMillis(120)));
    }

    @Test
    void run_timeBudgetIsCheckedBeforeCount() {
        RetryOptions options = new RetryOptions(RetryIntervalStrategy.immediate(), Duration.ofMillis(10), 1);

        RetryResult<String> result = this.<String>task(() -> {
            clock.advance(Duration.ofMillis(10));
            throw new IOException("down");
        }, options, Set.of()).run();

        assertThat(result.error()).isInstanceOf(OverMaxTryTimeException.class);
    }

    @Test
    void run_failureCallbackThrows_replacesTerminalError() {
        RetryResult<String> result = this.<String>task(() -> {
            throw new IOException("down");
        }, options(2), Set.of())
                .onFailure((ResultCallback<String>) r -> {
                    assertThat(r.error()).isInstanceOf(OverMaxTryCountException.class);
                    throw new IllegalStateException("alerting broke");
                })
                .run();

        assertThat(result.error())
                .isInstanceOf(FailureCallbackException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(events).containsExactly("retry:Op:1:100", "failure:Op:FailureCallbackException:2");
    }

    @Test
    void run_exactlyOneOfSuccessOrFailurePathRuns() {
        List<String> outcomes = new ArrayList<>();
        AtomicInteger attempts = new AtomicInteger();

        RetryTask<String> task = this.<String>task(() -> {
            if (attempts.incrementAndGet() % 2 == 1) {
                throw new IOException("odd attempt");
            }
            return "even";
        }, options(1), Set.of());
        task.onSuccess((ResultCallback<String>) r -> outcomes.add("success"))
                .onFailure((ResultCallback<String>) r -> outcomes.add("failure"));

        task.run();
        task.run();

        assertThat(outcomes).containsExactly("failure", "success");
    }

    @Test
    void run_callbacksReceiveImmutableSnapshots() {
        List<RetryContext> contexts = new ArrayList<>();

        this.<String>task(() -> {
            clock.advance(Duration.ofMillis(5));
            throw new IOException("down");
        }, options(3), Set.of())
                .onRetry((RetryCallback<String>) (r, context) -> contexts.add(context))
                .run();

        assertThat(contexts).containsExactly(
                new RetryContext(2, 1, Duration.ofMillis(5)),
                new RetryContext(3, 2, Duration.ofMillis(10)));
        assertThat(contexts).allMatch(RetryContext::isRetry);
    }

    @Test
    void run_retryCallbackSeesPreviousAttemptsResult() {
        AtomicInteger attempts = new AtomicInteger();
        List<Integer> seen = new ArrayList<>();

        task(attempts::incrementAndGet, options(3), Set.of())
                .onRetry((ResultCallback<Integer>) r -> seen.add(r.result()))
                .run(r -> r.result() == 3);

        assertThat(seen).containsExactly(1, 2);
    }

    @Test
    void run_interruptedWhileWaiting_endsWithCancellation() {
        AtomicInteger attempts = new AtomicInteger();
        RetryTask<String> task = new RetryTask<>("Op", () -> {
            attempts.incrementAndGet();
            throw new IOException("down");
        }, options(5), Set.of(), ExceptionClassifier.defaultClassifier(), reporter, Runnable::run,
                millis -> {
                    throw new InterruptedException("shutdown");
                }, clock);

        RetryResult<String> result = task.run();

        assertThat(Thread.interrupted()).isTrue();
        assertThat(attempts).hasValue(1);
        assertThat(result.error())
                .isInstanceOf(CancellationException.class)
                .hasCauseInstanceOf(InterruptedException.class);
    }

    @Test
    void run_eachRunIsIndependent() {
        AtomicInteger attempts = new AtomicInteger();
        RetryTask<Integer> task = task(attempts::incrementAndGet, options(2), Set.of());

        RetryResult<Integer> first = task.run(r -> false);
        RetryResult<Integer> second = task.run();

        assertThat(first.error()).isInstanceOf(OverMaxTryCountException.class);
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.result()).isEqualTo(3);
    }

    @Test
    void run_retryCallbackThrowsError_isWrappedAndFailureCallbacksRun() {
        AtomicInteger failureCalls = new AtomicInteger();

        RetryResult<String> result = this.<String>task(() -> {
            throw new IOException("down");
        }, options(3), Set.of())
                .onRetry((ResultCallback<String>) r -> {
                    throw new AssertionError("hook");
                })
                .onFailure((ResultCallback<String>) r -> failureCalls.incrementAndGet())
                .run();

        assertThat(result.error())
                .isInstanceOf(RetryCallbackException.class)
                .hasCauseInstanceOf(AssertionError.class);
        assertThat(failureCalls).hasValue(1);
    }

    @Test
    void run_successCallbackThrowsError_isWrappedAndFailureCallbacksRun() {
        AtomicInteger failureCalls = new AtomicInteger();

        RetryResult<String> result = this.<String>task(() -> "value", options(3), Set.of())
                .onSuccess((ResultCallback<String>) r -> {
                    throw new AssertionError("hook");
                })
                .onFailure((ResultCallback<String>) r -> failureCalls.incrementAndGet())
                .run();

        assertThat(result.error())
                .isInstanceOf(SuccessCallbackException.class)
                .hasCauseInstanceOf(AssertionError.class);
        assertThat(failureCalls).hasValue(1);
    }

    @Test
    void run_failureCallbackThrowsError_isWrapped() {
        RetryResult<String> result = this.<String>task(() -> {
            throw new IOException("down");
        }, options(1), Set.of())
                .onFailure((ResultCallback<String>) r -> {
                    throw new NoClassDefFoundError("missing");
                })
                .run();

        assertThat(result.error())
                .isInstanceOf(FailureCallbackException.class)
                .hasCauseInstanceOf(NoClassDefFoundError.class);
    }

    @Test
    void run_conditionThrowsError_isWrapped() {
        RetryResult<String> result = this.<String>task(() -> "value", options(3), Set.of())
                .run(r -> {
                    throw new AssertionError("cannot judge");
                });

        assertThat(result.error())
                .isInstanceOf(AssertCallbackException.class)
                .hasCauseInstanceOf(AssertionError.class);
    }

    @Test
    void run_unrecoverableErrorInCallback_propagates() {
        RetryTask<String> task = this.<String>task(() -> "value", options(3), Set.of());
        task.onSuccess((ResultCallback<String>) r -> {
            throw new StackOverflowError("deep");
        });

        assertThatThrownBy(() -> task.run()).isInstanceOf(StackOverflowError.class);
    }

    @Test
    void asAsync_failingAsyncCallback_endsLikeTheBlockingRun() throws Exception {
        RetryTask<String> task = this.<String>task(() -> {
            throw new IOException("down");
        }, options(3), Set.of());
        task.onRetry(RetryHook.ofAsync((AsyncRetryCallback<String>) (r, context) ->
                CompletableFuture.failedFuture(new AssertionError("hook"))));

        RetryResult<String> blocking = task.run();
        RetryResult<String> async = task.asAsync().runAsync().get(5, TimeUnit.SECONDS);

        assertThat(blocking.error())
                .isInstanceOf(RetryCallbackException.class)
                .hasCauseInstanceOf(AssertionError.class);
        assertThat(async.error())
                .isInstanceOf(RetryCallbackException.class)
                .hasCauseInstanceOf(AssertionError.class);
    }

    @Test
    void getOrThrow_onFailure_throwsRetryFailedExceptionWithCause() {
        RetryResult<String> result = this.<String>task(() -> {
            throw new IOException("down");
        }, options(1), Set.of()).run();

        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(RetryFailedException.class)
                .hasCauseInstanceOf(OverMaxTryCountException.class);
        assertThat(result.getOrElse("fallback")).isEqualTo("fallback");
        assertThat(result.getOrElseGet(() -> "computed")).isEqualTo("computed");
        assertThat(result.errorIfPresent()).isPresent();
    }

    @Test
    void publicConstructor_usesDefaults() {
        RetryTask<String> task = new RetryTask<>(() -> "ok", RetryOptions.defaults(), Set.of());

        assertThat(task.name()).isEqualTo(RetryTask.DEFAULT_NAME);
        assertThat(task.options().maxTryCount()).isEqualTo(2);
        assertThat(task.run().result()).isEqualTo("ok");
    }
}
