package org.javai.resilient.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilient.Failure;
import org.javai.resilient.FailureType;
import org.javai.resilient.breaker.CircuitState;
import org.javai.resilient.ops.CallMetadata;
import org.javai.resilient.ops.OpReporter;

import java.time.Duration;
import java.util.TreeMap;

import static org.javai.resilient.ops.OpReporterUtils.formatCorrelationId;
import static org.javai.resilient.ops.OpReporterUtils.formatLatency;
import static org.javai.resilient.ops.OpReporterUtils.formatTags;

/**
 * Reports client events using Log4j2.
 *
 * <p>Levels:
 * <ul>
 *   <li>breaker transitions → WARN</li>
 *   <li>failed attempts that will be retried → DEBUG</li>
 *   <li>retries exhausted → WARN</li>
 *   <li>completed calls (method, target, status, latency) → INFO, with response size and
 *       headers at DEBUG</li>
 *   <li>failures returned to the caller → WARN, or ERROR for decode failures</li>
 * </ul>
 *
 * <p>Every event carries a marker so appenders can route them separately.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker BREAKER_MARKER = MarkerManager.getMarker("BREAKER");
	private static final Marker CALL_MARKER = MarkerManager.getMarker("CALL");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.resilient.client"));
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		Level level = failure.type() == FailureType.DECODE_FAILURE ? Level.ERROR : Level.WARN;

		logger.atLevel(level)
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.exception())
			.log("Call [{}] failed: {} | type={}, code={}, status={}, correlationId={}{}",
				failure.operation(),
				failure.message(),
				failure.type(),
				failure.code(),
				failure.hasStatus() ? failure.status() : "none",
				formatCorrelationId(failure.correlationId()),
				tagsSuffix(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		logger.atDebug()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} for [{}] failed, retrying in {} with policy [{}]. Error: {}",
				attemptNumber,
				failure.operation(),
				formatLatency(delay),
				policyId,
				failure.message());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId, String reason) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Gave up on [{}] after {} attempts with policy [{}] ({}). Error: {}",
				failure.operation(),
				totalAttempts,
				policyId,
				reason,
				failure.message());
	}

	@Override
	public void reportStateChange(String breakerName, CircuitState from, CircuitState to) {
		logger.atWarn()
			.withMarker(BREAKER_MARKER)
			.log("Circuit breaker [{}] changed state: {} -> {}", breakerName, from, to);
	}

	@Override
	public void reportCompleted(CallMetadata call) {
		logger.atInfo()
			.withMarker(CALL_MARKER)
			.log("Call completed | method={}, target={}, status={}, latency={}, attempts={}, correlationId={}",
				call.method(),
				call.target(),
				call.status(),
				formatLatency(call.latency()),
				call.attempts(),
				formatCorrelationId(call.correlationId()));
		if (call.responseBytes() >= 0) {
			logger.atDebug()
				.withMarker(CALL_MARKER)
				.log("Response | target={}, status={}, bytes={}, headers={}",
					call.target(),
					call.status(),
					call.responseBytes(),
					new TreeMap<>(call.responseHeaders()));
		}
	}

	private static String tagsSuffix(Failure failure) {
		String tags = formatTags(failure.tags());
		return tags.isEmpty() ? "" : ", tags=" + tags;
	}
}
