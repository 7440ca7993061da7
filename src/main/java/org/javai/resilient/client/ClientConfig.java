package org.javai.resilient.client;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable configuration of a {@link ResilientHttpClient}.
 *
 * @param timeout Overall time allowed for a call, all attempts and delays included
 * @param dialTimeout Time allowed to establish a connection
 * @param maxRetries Retries after the first attempt; {@code 0} disables retry
 * @param retryDelay Base delay; the delay after attempt {@code n} is {@code retryDelay * n}
 * @param failureThreshold Consecutive failed calls that open the breaker
 * @param openDuration Time the breaker stays open before admitting a trial call
 * @param halfOpenMaxCalls Trial calls admitted while half-open
 */
public record ClientConfig(
        Duration timeout,
        Duration dialTimeout,
        int maxRetries,
        Duration retryDelay,
        int failureThreshold,
        Duration openDuration,
        int halfOpenMaxCalls
) {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_DIAL_TIMEOUT = Duration.ofSeconds(5);
    static final int DEFAULT_MAX_RETRIES = 3;
    static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    static final int DEFAULT_FAILURE_THRESHOLD = 10;
    static final Duration DEFAULT_OPEN_DURATION = Duration.ofMinutes(1);
    static final int DEFAULT_HALF_OPEN_MAX_CALLS = 1;

    private static final Pattern SIMPLE_DURATION = Pattern.compile("(\\d+)(ms|s|m|h)");

    public ClientConfig {
        requirePositive(timeout, "timeout");
        requirePositive(dialTimeout, "dialTimeout");
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative, was: " + retryDelay);
        }
        requirePositive(openDuration, "openDuration");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
        if (maxRetries == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxRetries must be < " + Integer.MAX_VALUE + ", was: " + maxRetries);
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1, was: " + halfOpenMaxCalls);
        }
    }

    /**
     * Returns the default configuration: 30s timeout, 5s dial timeout, 3 retries with a 1s base
     * delay, breaker opening after 10 consecutive failures for 1 minute, one trial call.
     */
    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Total attempts allowed per call, first attempt included.
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Resolves each setting from a system property, then an environment variable, then the
     * default.
     *
     * <table>
     *   <caption>Settings</caption>
     *   <tr><th>System property</th><th>Environment variable</th></tr>
     *   <tr><td>resilient.http.timeout</td><td>HTTP_TIMEOUT</td></tr>
     *   <tr><td>resilient.http.dialTimeout</td><td>HTTP_DIAL_TIMEOUT</td></tr>
     *   <tr><td>resilient.http.maxRetries</td><td>HTTP_MAX_RETRIES</td></tr>
     *   <tr><td>resilient.http.retryDelay</td><td>HTTP_RETRY_DELAY</td></tr>
     *   <tr><td>resilient.http.failureThreshold</td><td>HTTP_CB_THRESHOLD</td></tr>
     *   <tr><td>resilient.http.openDuration</td><td>HTTP_CB_TIMEOUT</td></tr>
     *   <tr><td>resilient.http.halfOpenMaxCalls</td><td>HTTP_CB_HALF_OPEN_CALLS</td></tr>
     * </table>
     *
     * @throws IllegalArgumentException if a value is present but malformed
     */
    public static ClientConfig fromEnvironment() {
        return fromEnvironment(System::getProperty, System::getenv);
    }

    static ClientConfig fromEnvironment(Function<String, String> systemProperties, Function<String, String> environment) {
        Resolver r = new Resolver(systemProperties, environment);
        return builder()
                .timeout(r.duration("resilient.http.timeout", "HTTP_TIMEOUT", DEFAULT_TIMEOUT))
                .dialTimeout(r.duration("resilient.http.dialTimeout", "HTTP_DIAL_TIMEOUT", DEFAULT_DIAL_TIMEOUT))
                .maxRetries(r.integer("resilient.http.maxRetries", "HTTP_MAX_RETRIES", DEFAULT_MAX_RETRIES))
                .retryDelay(r.duration("resilient.http.retryDelay", "HTTP_RETRY_DELAY", DEFAULT_RETRY_DELAY))
                .failureThreshold(r.integer("resilient.http.failureThreshold", "HTTP_CB_THRESHOLD", DEFAULT_FAILURE_THRESHOLD))
                .openDuration(r.duration("resilient.http.openDuration", "HTTP_CB_TIMEOUT", DEFAULT_OPEN_DURATION))
                .halfOpenMaxCalls(r.integer("resilient.http.halfOpenMaxCalls", "HTTP_CB_HALF_OPEN_CALLS", DEFAULT_HALF_OPEN_MAX_CALLS))
                .build();
    }

    /**
     * Parses {@code 500ms}, {@code 30s}, {@code 1m}, {@code 2h} or an ISO-8601 duration such as
     * {@code PT30S}.
     *
     * @throws IllegalArgumentException if the value matches neither form
     */
    static Duration parseDuration(String value) {
        String trimmed = value.trim();
        Matcher m = SIMPLE_DURATION.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (m.matches()) {
            long amount = Long.parseLong(m.group(1));
            switch (m.group(2)) {
                case "ms":
                    return Duration.ofMillis(amount);
                case "s":
                    return Duration.ofSeconds(amount);
                case "m":
                    return Duration.ofMinutes(amount);
                default:
                    return Duration.ofHours(amount);
            }
        }
        try {
            return Duration.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("not a duration: '" + value + "'", e);
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was: " + d);
        }
    }

    private static final class Resolver {
        private final Function<String, String> systemProperties;
        private final Function<String, String> environment;

        Resolver(Function<String, String> systemProperties, Function<String, String> environment) {
            this.systemProperties = systemProperties;
            this.environment = environment;
        }

        Duration duration(String sysProp, String envVar, Duration fallback) {
            String raw = lookup(sysProp, envVar);
            if (raw == null) {
                return fallback;
            }
            try {
                return parseDuration(raw);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid duration for " + envVar + " / " + sysProp + ": " + raw, e);
            }
        }

        int integer(String sysProp, String envVar, int fallback) {
            String raw = lookup(sysProp, envVar);
            if (raw == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + envVar + " / " + sysProp + ": " + raw, e);
            }
        }

        private String lookup(String sysProp, String envVar) {
            String value = systemProperties.apply(sysProp);
            if (value == null || value.isBlank()) {
                value = environment.apply(envVar);
            }
            return value == null || value.isBlank() ? null : value;
        }
    }

    public static final class Builder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration dialTimeout = DEFAULT_DIAL_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private Duration openDuration = DEFAULT_OPEN_DURATION;
        private int halfOpenMaxCalls = DEFAULT_HALF_OPEN_MAX_CALLS;

        private Builder() {}

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder dialTimeout(Duration dialTimeout) {
            this.dialTimeout = dialTimeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder openDuration(Duration openDuration) {
            this.openDuration = openDuration;
            return this;
        }

        public Builder halfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(timeout, dialTimeout, maxRetries, retryDelay,
                    failureThreshold, openDuration, halfOpenMaxCalls);
        }
    }
}
