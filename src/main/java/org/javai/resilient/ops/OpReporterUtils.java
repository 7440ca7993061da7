package org.javai.resilient.ops;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared formatting helpers for OpReporter implementations.
 */
public final class OpReporterUtils {

	private OpReporterUtils() {
		// Utility class
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

	/**
	 * Formats a correlation id for display, returning "none" if absent.
	 */
	public static String formatCorrelationId(String correlationId) {
		return correlationId != null ? correlationId : "none";
	}

	/**
	 * Formats tags as {@code {k=v, k2=v2}} in key order, or an empty string when there are none.
	 */
	public static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return tags.entrySet().stream()
				.sorted(Map.Entry.comparingByKey())
				.map(e -> e.getKey() + "=" + e.getValue())
				.collect(Collectors.joining(", ", "{", "}"));
	}

	/**
	 * Formats a latency in milliseconds, e.g. {@code 125ms}.
	 */
	public static String formatLatency(Duration latency) {
		return latency.toMillis() + "ms";
	}
}
