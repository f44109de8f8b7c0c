package org.javai.retry.ops;

import org.javai.retry.exception.CallbackException;
import org.javai.retry.exception.OverMaxTryCountException;
import org.javai.retry.exception.OverMaxTryTimeException;

import java.util.concurrent.CancellationException;

/**
 * Shared utilities for reporters and configuration lookup.
 */
public final class ReporterUtils {

	private ReporterUtils() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable.
	 *
	 * @param sysProp the system property name, checked first
	 * @param envVar the environment variable name
	 * @return the resolved value, or null if neither is set
	 */
	public static String resolveOptionalConfig(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value;
	}

	/**
	 * Short label for the kind of terminal error, used as a log and metrics dimension.
	 */
	public static String errorKind(Throwable error) {
		if (error instanceof OverMaxTryCountException) {
			return "over_max_try_count";
		}
		if (error instanceof OverMaxTryTimeException) {
			return "over_max_try_time";
		}
		if (error instanceof CancellationException) {
			return "cancelled";
		}
		if (error instanceof CallbackException) {
			return "callback";
		}
		return "operation";
	}

	/**
	 * Escapes special characters for JSON string values.
	 */
	public static String escapeJson(String s) {
		if (s == null) return "";
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
