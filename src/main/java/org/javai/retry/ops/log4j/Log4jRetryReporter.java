package org.javai.retry.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.retry.RetryContext;
import org.javai.retry.ops.ReporterUtils;
import org.javai.retry.ops.RetryReporter;

import java.time.Duration;

/**
 * Reports retry executions using Log4j2.
 *
 * <p>Terminal failures are logged at a level chosen by the kind of error:
 * <ul>
 *   <li>callback failures → ERROR</li>
 *   <li>exhausted attempts or time budget, operation errors → WARN</li>
 *   <li>cancellation → INFO</li>
 * </ul>
 * Retries are logged at INFO and successes at DEBUG.
 */
public class Log4jRetryReporter implements RetryReporter {

	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker SUCCEEDED_MARKER = MarkerManager.getMarker("RETRY_SUCCEEDED");
	private static final Marker FAILED_MARKER = MarkerManager.getMarker("RETRY_FAILED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.retry.RetryReporter"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, RetryContext context, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry {} of operation [{}] in {} ms, elapsed {} ms",
				context.retryCount(),
				operation,
				delay.toMillis(),
				context.triedTime().toMillis());
	}

	@Override
	public void reportSuccess(String operation, RetryContext context) {
		logger.atDebug()
			.withMarker(SUCCEEDED_MARKER)
			.log("Operation [{}] succeeded after {} attempt(s), elapsed {} ms",
				operation,
				context.triedCount(),
				context.triedTime().toMillis());
	}

	@Override
	public void reportFailure(String operation, Throwable error, RetryContext context) {
		String kind = ReporterUtils.errorKind(error);
		logger.atLevel(levelFor(kind))
			.withMarker(FAILED_MARKER)
			.withThrowable(error)
			.log("Operation [{}] failed after {} attempt(s), elapsed {} ms | kind={}, error={}",
				operation,
				context.triedCount(),
				context.triedTime().toMillis(),
				kind,
				error.getClass().getName());
	}

	static Level levelFor(String kind) {
		return switch (kind) {
			case "callback" -> Level.ERROR;
			case "cancelled" -> Level.INFO;
			default -> Level.WARN;
		};
	}
}
