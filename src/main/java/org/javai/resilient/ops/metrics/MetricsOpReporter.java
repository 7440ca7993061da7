package org.javai.resilient.ops.metrics;

import org.javai.resilient.Failure;
import org.javai.resilient.breaker.CircuitState;
import org.javai.resilient.ops.CallMetadata;
import org.javai.resilient.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Map;

import static org.javai.resilient.ops.OpReporterUtils.escapeJson;

/**
 * Reports client events as JSON-lines metrics via SLF4J.
 *
 * <p>One JSON object per event, suitable for a metrics aggregation pipeline. Every event
 * carries an {@code eventType} and a {@code trackingKey}; the key is the operation
 * (or the breaker name), prefixed by an optional namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"call_completed","timestamp":"2024-01-20T10:30:00Z","trackingKey":"billing.GET https://api/x","status":"200","latencyMs":"42",...}
 * {"eventType":"breaker_transition","timestamp":"2024-01-20T10:31:00Z","trackingKey":"billing.payments","from":"CLOSED","to":"OPEN"}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilient.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsOpReporter with no namespace and the default logger.
	 */
	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsOpReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(Failure failure) {
		emit(new JsonLine("failure", ISO_FORMATTER.format(failure.occurredAt()), trackingKey(failure.operation()))
				.field("type", failure.type().name())
				.field("code", failure.code().name())
				.field("status", failure.hasStatus() ? String.valueOf(failure.status()) : null)
				.field("message", failure.message())
				.field("operation", failure.operation())
				.field("correlationId", failure.correlationId())
				.tags(failure.tags()));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		emit(new JsonLine("retry_attempt", ISO_FORMATTER.format(failure.occurredAt()), trackingKey(failure.operation()))
				.field("attemptNumber", String.valueOf(attemptNumber))
				.field("delayMs", String.valueOf(delay.toMillis()))
				.field("policy", policyId)
				.field("type", failure.type().name())
				.field("operation", failure.operation())
				.field("correlationId", failure.correlationId()));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId, String reason) {
		emit(new JsonLine("retry_exhausted", ISO_FORMATTER.format(failure.occurredAt()), trackingKey(failure.operation()))
				.field("totalAttempts", String.valueOf(totalAttempts))
				.field("policy", policyId)
				.field("reason", reason)
				.field("type", failure.type().name())
				.field("operation", failure.operation())
				.field("correlationId", failure.correlationId()));
	}

	@Override
	public void reportStateChange(String breakerName, CircuitState from, CircuitState to) {
		emit(new JsonLine("breaker_transition", ISO_FORMATTER.format(clock.instant()), trackingKey(breakerName))
				.field("breaker", breakerName)
				.field("from", from.name())
				.field("to", to.name()));
	}

	@Override
	public void reportCompleted(CallMetadata call) {
		String operation = call.method() + " " + call.target();
		emit(new JsonLine("call_completed", ISO_FORMATTER.format(clock.instant()), trackingKey(operation))
				.field("method", call.method())
				.field("target", call.target())
				.field("status", String.valueOf(call.status()))
				.field("latencyMs", String.valueOf(call.latency().toMillis()))
				.field("attempts", String.valueOf(call.attempts()))
				.field("correlationId", call.correlationId()));
	}

	String trackingKey(String key) {
		if (namespace == null) {
			return key;
		}
		return namespace + "." + key;
	}

	private void emit(JsonLine line) {
		try {
			logger.info(line.toString());
		} catch (Exception e) {
			// Reporting must not break the call being reported
			System.err.println("MetricsOpReporter failed to emit event: " + e.getMessage());
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	/**
	 * Flat JSON object builder; null values are omitted.
	 */
	private static final class JsonLine {
		private final StringBuilder sb = new StringBuilder("{");

		JsonLine(String eventType, String timestamp, String trackingKey) {
			append("eventType", eventType, true);
			append("timestamp", timestamp, false);
			append("trackingKey", trackingKey, false);
		}

		JsonLine field(String key, String value) {
			if (value != null) {
				append(key, value, false);
			}
			return this;
		}

		JsonLine tags(Map<String, String> tags) {
			if (tags == null || tags.isEmpty()) {
				return this;
			}
			sb.append(",\"tags\":{");
			boolean first = true;
			for (Map.Entry<String, String> entry : tags.entrySet()) {
				if (!first) {
					sb.append(",");
				}
				sb.append("\"").append(escapeJson(entry.getKey())).append("\":\"")
				  .append(escapeJson(entry.getValue())).append("\"");
				first = false;
			}
			sb.append("}");
			return this;
		}

		private void append(String key, String value, boolean first) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
		}

		@Override
		public String toString() {
			return sb + "}";
		}
	}
}
