package org.javai.resilient.ops;

import org.javai.resilient.Failure;
import org.javai.resilient.breaker.CircuitState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every event. If a reporter throws, the exception is
 * written to stderr and the remaining reporters still run; the call being reported is
 * never affected.
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("billing"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	/**
	 * Creates a builder for constructing a composite reporter.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", r -> r.report(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		fanOut("reportRetryAttempt", r -> r.reportRetryAttempt(failure, attemptNumber, delay, policyId));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId, String reason) {
		fanOut("reportRetryExhausted", r -> r.reportRetryExhausted(failure, totalAttempts, policyId, reason));
	}

	@Override
	public void reportStateChange(String breakerName, CircuitState from, CircuitState to) {
		fanOut("reportStateChange", r -> r.reportStateChange(breakerName, from, to));
	}

	@Override
	public void reportCompleted(CallMetadata call) {
		fanOut("reportCompleted", r -> r.reportCompleted(call));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> event) {
		for (OpReporter reporter : reporters) {
			try {
				event.accept(reporter);
			} catch (Exception e) {
				logReporterError(method, reporter, e);
			}
		}
	}

	private static void logReporterError(String method, OpReporter reporter, Exception e) {
		System.err.println("OpReporter." + method + " failed for " +
			reporter.getClass().getName() + ": " + e.getMessage());
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null reporters are ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(OpReporter reporter) {
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
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Builds the composite reporter.
		 *
		 * @return the composite reporter
		 */
		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
