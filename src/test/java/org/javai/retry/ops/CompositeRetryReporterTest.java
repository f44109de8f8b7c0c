package org.javai.retry.ops;

import org.javai.retry.RetryContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeRetryReporterTest {

	private static final RetryContext CONTEXT = new RetryContext(2, 1, Duration.ofMillis(10));

	@Test
	void fansOutEveryEventToAllReporters() {
		List<String> first = new ArrayList<>();
		List<String> second = new ArrayList<>();

		RetryReporter composite = RetryReporter.composite(recording(first), recording(second));
		composite.reportRetryAttempt("op", CONTEXT, Duration.ofMillis(5));
		composite.reportSuccess("op", CONTEXT);
		composite.reportFailure("op", new IOException("down"), CONTEXT);

		assertThat(first).containsExactly("retry", "success", "failure");
		assertThat(second).containsExactly("retry", "success", "failure");
	}

	@Test
	void failingReporter_doesNotStopTheOthers() {
		List<String> events = new ArrayList<>();
		RetryReporter broken = (operation, error, context) -> {
			throw new IllegalStateException("broken reporter");
		};

		CompositeRetryReporter composite = CompositeRetryReporter.of(broken, recording(events));

		assertThatCode(() -> composite.reportFailure("op", new IOException("down"), CONTEXT))
				.doesNotThrowAnyException();
		assertThat(events).containsExactly("failure");
	}

	@Test
	void builder_skipsNullAndDisabledReporters() {
		CompositeRetryReporter composite = CompositeRetryReporter.builder()
				.add(RetryReporter.noOp())
				.add(null)
				.addIf(false, RetryReporter.noOp())
				.addIf(true, RetryReporter.noOp())
				.build();

		assertThat(composite.size()).isEqualTo(2);
	}

	@Test
	void of_collection_copiesReporters() {
		List<RetryReporter> reporters = new ArrayList<>(List.of(RetryReporter.noOp()));

		CompositeRetryReporter composite = CompositeRetryReporter.of(reporters);
		reporters.add(RetryReporter.noOp());

		assertThat(composite.size()).isEqualTo(1);
	}

	private static RetryReporter recording(List<String> events) {
		return new RetryReporter() {
			@Override
			public void reportFailure(String operation, Throwable error, RetryContext context) {
				events.add("failure");
			}

			@Override
			public void reportRetryAttempt(String operation, RetryContext context, Duration delay) {
				events.add("retry");
			}

			@Override
			public void reportSuccess(String operation, RetryContext context) {
				events.add("success");
			}
		};
	}
}
