package io.github.orkee.live;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Retry, fallback and polling settings shared by every subscription of a client.
 * <p>
 * Out-of-range values never fail: each one is replaced by the default for its field
 * and a warning is logged. Use {@link #builder()} or {@link #fromEnvironment(Map)}.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** environment variable for {@link #getMaxRetries()} */
    public static final String ENV_MAX_RETRIES = "ORKEE_SSE_MAX_RETRIES";

    /** environment variable for {@link #getRetryDelay()}, in milliseconds */
    public static final String ENV_RETRY_DELAY_MS = "ORKEE_SSE_RETRY_DELAY_MS";

    /** environment variable for {@link #getPollInterval()}, in milliseconds */
    public static final String ENV_POLL_INTERVAL_MS = "ORKEE_SSE_POLL_INTERVAL_MS";

    /** environment variable for {@link #getIdleTimeout()}, in milliseconds */
    public static final String ENV_IDLE_TIMEOUT_MS = "ORKEE_SSE_IDLE_TIMEOUT_MS";

    /** default number of stream retries before falling back to polling */
    public static final int DEFAULT_MAX_RETRIES = 3;

    /** default delay before re-opening a failed stream */
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(2000);

    /** default interval between snapshot polls */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(5000);

    /** idle watchdog is off unless configured */
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ZERO;

    static final int MAX_RETRIES_LIMIT = 100;
    static final Duration RETRY_DELAY_LIMIT = Duration.ofMinutes(5);
    static final Duration POLL_INTERVAL_LIMIT = Duration.ofMinutes(10);
    static final Duration IDLE_TIMEOUT_LIMIT = Duration.ofHours(1);

    private static final RetryPolicy DEFAULTS = builder().build();

    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration pollInterval;
    private final Duration idleTimeout;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.pollInterval = builder.pollInterval;
        this.idleTimeout = builder.idleTimeout;
    }

    /**
     * Creates a new builder initialized with the defaults.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the policy with all defaults.
     *
     * @return the default policy
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the policy from the process environment.
     *
     * @return the configured policy
     * @see #fromEnvironment(Map)
     */
    public static RetryPolicy fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the policy from environment-style string values.
     * Missing keys keep their default; malformed or out-of-range values fall back to it.
     *
     * @param env the variables, keyed by the {@code ENV_*} names
     * @return the configured policy
     */
    public static RetryPolicy fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env cannot be null");
        Builder builder = builder();

        Long maxRetries = parse(env, ENV_MAX_RETRIES);
        if (maxRetries != null) {
            builder.maxRetries(maxRetries > Integer.MAX_VALUE ? -1 : maxRetries.intValue());
        }
        Long retryDelayMs = parse(env, ENV_RETRY_DELAY_MS);
        if (retryDelayMs != null) {
            builder.retryDelay(Duration.ofMillis(retryDelayMs));
        }
        Long pollIntervalMs = parse(env, ENV_POLL_INTERVAL_MS);
        if (pollIntervalMs != null) {
            builder.pollInterval(Duration.ofMillis(pollIntervalMs));
        }
        Long idleTimeoutMs = parse(env, ENV_IDLE_TIMEOUT_MS);
        if (idleTimeoutMs != null) {
            builder.idleTimeout(Duration.ofMillis(idleTimeoutMs));
        }
        return builder.build();
    }

    // null means "not set"; unparsable values become -1 so the setter rejects them
    private static Long parse(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("ignoring non-numeric {}={}", name, raw);
            return -1L;
        }
    }

    /**
     * Returns how many times a failed stream is re-opened before switching to polling.
     * Zero means the first failure switches to polling.
     *
     * @return the retry limit
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Returns the fixed delay before each stream retry.
     *
     * @return the retry delay
     */
    public Duration getRetryDelay() {
        return retryDelay;
    }

    /**
     * Returns the interval between snapshot polls.
     *
     * @return the poll interval
     */
    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * Returns how long an open stream may stay silent before it is treated as failed.
     *
     * @return the idle timeout, {@link Duration#ZERO} when disabled
     */
    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Checks if the idle watchdog is enabled.
     *
     * @return true if an idle timeout is set
     */
    public boolean isIdleTimeoutEnabled() {
        return !idleTimeout.isZero();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries &&
                retryDelay.equals(that.retryDelay) &&
                pollInterval.equals(that.pollInterval) &&
                idleTimeout.equals(that.idleTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, retryDelay, pollInterval, idleTimeout);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetries=" + maxRetries +
                ", retryDelay=" + retryDelay.toMillis() + "ms" +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", idleTimeout=" + idleTimeout.toMillis() + "ms" +
                '}';
    }

    /**
     * Builder for RetryPolicy.
     */
    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;

        private Builder() {
        }

        /**
         * Sets the number of stream retries before falling back to polling.
         * Values outside {@code 0..100} fall back to {@value #DEFAULT_MAX_RETRIES}.
         *
         * @param maxRetries the retry limit
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
                log.warn("maxRetries {} out of range, using default {}", maxRetries, DEFAULT_MAX_RETRIES);
                this.maxRetries = DEFAULT_MAX_RETRIES;
            } else {
                this.maxRetries = maxRetries;
            }
            return this;
        }

        /**
         * Sets the delay before each stream retry.
         * Delays under one millisecond or above five minutes fall back to the default.
         *
         * @param retryDelay the delay
         * @return this builder
         */
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = positiveOrDefault("retryDelay", retryDelay, RETRY_DELAY_LIMIT, DEFAULT_RETRY_DELAY);
            return this;
        }

        /**
         * Sets the interval between snapshot polls.
         * Intervals under one millisecond or above ten minutes fall back to the default.
         *
         * @param pollInterval the interval
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = positiveOrDefault("pollInterval", pollInterval, POLL_INTERVAL_LIMIT, DEFAULT_POLL_INTERVAL);
            return this;
        }

        /**
         * Sets how long an open stream may go without any frame before it is dropped and retried.
         * {@link Duration#ZERO} disables the watchdog; negative or sub-millisecond values and values
         * above one hour fall back to disabled.
         *
         * @param idleTimeout the timeout
         * @return this builder
         */
        public Builder idleTimeout(Duration idleTimeout) {
            Objects.requireNonNull(idleTimeout, "idleTimeout cannot be null");
            boolean subMillisecond = !idleTimeout.isZero() && idleTimeout.toMillis() < 1;
            if (idleTimeout.isNegative() || subMillisecond || idleTimeout.compareTo(IDLE_TIMEOUT_LIMIT) > 0) {
                log.warn("idleTimeout {}ms out of range, disabling", idleTimeout.toMillis());
                this.idleTimeout = DEFAULT_IDLE_TIMEOUT;
            } else {
                this.idleTimeout = idleTimeout;
            }
            return this;
        }

        /**
         * Builds the RetryPolicy instance.
         *
         * @return the configured policy
         */
        public RetryPolicy build() {
            return new RetryPolicy(this);
        }

        private static Duration positiveOrDefault(String name, Duration value, Duration limit, Duration fallback) {
            Objects.requireNonNull(value, name + " cannot be null");
            // timers run at millisecond resolution
            if (value.toMillis() < 1 || value.compareTo(limit) > 0) {
                log.warn("{} {}ms out of range, using default {}ms", name, value.toMillis(), fallback.toMillis());
                return fallback;
            }
            return value;
        }
    }
}
