// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Configuration of the delay between retry rounds of one execution.
 *
 * <p>This record holds the configurable constants for round backoff timing:
 * <ul>
 *   <li>{@code backoffBaseMs} - delay after the first round (default: 250ms)</li>
 *   <li>{@code backoffMaxMs} - maximum delay cap (default: 8000ms)</li>
 *   <li>{@code jitterMin} - minimum jitter percentage (default: 0.10 = 10%)</li>
 *   <li>{@code jitterMax} - maximum jitter percentage (default: 0.25 = 25%)</li>
 * </ul>
 *
 * <p><strong>Backoff Formula:</strong>
 * <pre>
 *   delay = min(base * 2^(round-1), max)
 *   finalDelay = delay + delay * random(jitterMin, jitterMax)
 * </pre>
 *
 * <p>The delays are bounded by the execution's deadline: a round whose delay would
 * end past the deadline is not started.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * RetryBackoffConfig patient = RetryBackoffConfig.builder()
 *     .backoffBaseMs(1000)
 *     .backoffMaxMs(30_000)
 *     .build();
 * client.setRetryBackoff(patient);
 * }</pre>
 *
 * @param backoffBaseMs base delay in milliseconds (must be &gt; 0)
 * @param backoffMaxMs  maximum delay cap in milliseconds (must be &gt;= backoffBaseMs)
 * @param jitterMin     minimum jitter percentage (must be &gt;= 0 and &lt; jitterMax)
 * @param jitterMax     maximum jitter percentage (must be &gt; jitterMin)
 * @see RequestExecutor
 * @since 0.1.0
 */
public record RetryBackoffConfig(
        long backoffBaseMs,
        long backoffMaxMs,
        double jitterMin,
        double jitterMax) {

    /** Default base delay: 250ms. */
    public static final long DEFAULT_BACKOFF_BASE_MS = 250;

    /** Default maximum delay: 8000ms. */
    public static final long DEFAULT_BACKOFF_MAX_MS = 8000;

    /** Default minimum jitter: 10%. */
    public static final double DEFAULT_JITTER_MIN = 0.10;

    /** Default maximum jitter: 25%. */
    public static final double DEFAULT_JITTER_MAX = 0.25;

    public RetryBackoffConfig {
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be > 0, got: " + backoffBaseMs);
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                    "backoffMaxMs must be >= backoffBaseMs, got: " + backoffMaxMs + " < " + backoffBaseMs);
        }
        if (jitterMin < 0) {
            throw new IllegalArgumentException("jitterMin must be >= 0, got: " + jitterMin);
        }
        if (jitterMax <= jitterMin) {
            throw new IllegalArgumentException(
                    "jitterMax must be > jitterMin, got: " + jitterMax + " <= " + jitterMin);
        }
    }

    /**
     * Returns the default configuration.
     *
     * @return default config with 250ms base, 8000ms max, 10-25% jitter
     */
    public static RetryBackoffConfig defaults() {
        return new RetryBackoffConfig(
                DEFAULT_BACKOFF_BASE_MS,
                DEFAULT_BACKOFF_MAX_MS,
                DEFAULT_JITTER_MIN,
                DEFAULT_JITTER_MAX);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Computes the delay after a failed round.
     *
     * @param round  the round that just failed, starting at 1
     * @param random source of jitter
     * @return the delay in milliseconds
     */
    public long delayMillis(final int round, final RandomGenerator random) {
        Objects.requireNonNull(random, "random");
        if (round < 1) {
            throw new IllegalArgumentException("round must be >= 1, got: " + round);
        }
        final int shift = Math.min(round - 1, 62);
        final long delay = backoffBaseMs > (backoffMaxMs >> shift) ? backoffMaxMs : backoffBaseMs << shift;
        final long cappedDelay = Math.min(delay, backoffMaxMs);
        final double jitter = random.nextDouble(jitterMin, jitterMax);
        return cappedDelay + (long) (cappedDelay * jitter);
    }

    /**
     * Builder for {@link RetryBackoffConfig}. All values start at their defaults.
     */
    public static final class Builder {
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;
        private double jitterMin = DEFAULT_JITTER_MIN;
        private double jitterMax = DEFAULT_JITTER_MAX;

        private Builder() {}

        public Builder backoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder backoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
            return this;
        }

        /**
         * Sets the minimum jitter percentage.
         *
         * @param jitterMin minimum jitter (e.g., 0.10 for 10%)
         * @return this builder
         */
        public Builder jitterMin(double jitterMin) {
            this.jitterMin = jitterMin;
            return this;
        }

        /**
         * Sets the maximum jitter percentage.
         *
         * @param jitterMax maximum jitter (e.g., 0.25 for 25%)
         * @return this builder
         */
        public Builder jitterMax(double jitterMax) {
            this.jitterMax = jitterMax;
            return this;
        }

        public RetryBackoffConfig build() {
            return new RetryBackoffConfig(backoffBaseMs, backoffMaxMs, jitterMin, jitterMax);
        }
    }
}
