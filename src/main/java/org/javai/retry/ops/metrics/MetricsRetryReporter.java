package org.javai.retry.ops.metrics;

import org.javai.retry.RetryContext;
import org.javai.retry.ops.ReporterUtils;
import org.javai.retry.ops.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the operation name, prefixed with a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.order.fetch","triedCount":"2",...}
 * }</pre>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.retry.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	MetricsRetryReporter(String namespace, Logger logger) {
		this(namespace, logger, Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, RetryContext context, Duration delay) {
		try {
			StringBuilder sb = startEvent("retry_attempt", operation, context);
			appendField(sb, "retryCount", String.valueOf(context.retryCount()));
			appendField(sb, "delayMs", String.valueOf(delay.toMillis()));
			logger.info(sb.append("}").toString());
		} catch (Exception e) {
			// Reporting should not break the retry loop
		}
	}

	@Override
	public void reportSuccess(String operation, RetryContext context) {
		try {
			StringBuilder sb = startEvent("retry_success", operation, context);
			logger.info(sb.append("}").toString());
		} catch (Exception e) {
			// Reporting should not break the retry loop
		}
	}

	@Override
	public void reportFailure(String operation, Throwable error, RetryContext context) {
		try {
			StringBuilder sb = startEvent("retry_failure", operation, context);
			appendField(sb, "errorKind", ReporterUtils.errorKind(error));
			appendField(sb, "errorType", error.getClass().getName());
			if (error.getMessage() != null) {
				appendField(sb, "message", error.getMessage());
			}
			logger.info(sb.append("}").toString());
		} catch (Exception e) {
			// Reporting should not break the retry loop
		}
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private StringBuilder startEvent(String eventType, String operation, RetryContext context) {
		StringBuilder sb = new StringBuilder("{");
		sb.append("\"eventType\":\"").append(eventType).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()));
		appendField(sb, "trackingKey", buildTrackingKey(operation));
		appendField(sb, "triedCount", String.valueOf(context.triedCount()));
		appendField(sb, "triedTimeMs", String.valueOf(context.triedTime().toMillis()));
		return sb;
	}

	private static void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(ReporterUtils.escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
