package org.javai.retry.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.retry.RetryContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.of(
 *     new Log4jRetryReporter(),
 *     new MetricsRetryReporter("myapp")
 * );
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOGGER = LogManager.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportFailure(String operation, Throwable error, RetryContext context) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportFailure(operation, error, context);
			} catch (Exception e) {
				logReporterError("reportFailure", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryAttempt(String operation, RetryContext context, Duration delay) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(operation, context, delay);
			} catch (Exception e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportSuccess(String operation, RetryContext context) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportSuccess(operation, context);
			} catch (Exception e) {
				logReporterError("reportSuccess", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, RetryReporter reporter, Exception e) {
		LOGGER.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}

	/**
	 * Builder for creating a {@link CompositeRetryReporter}.
	 */
	public static final class Builder {
		private final List<RetryReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null reporters are ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(RetryReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, RetryReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeRetryReporter build() {
			return new CompositeRetryReporter(reporters);
		}
	}
}
