// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-node exponential backoff used to keep failing nodes out of rotation.
 *
 * <p>
 * The first failure of a node puts it to rest for {@code minBackoff}; every
 * consecutive failure doubles the rest interval, capped at {@code maxBackoff}.
 * A successful response discards the accumulated backoff.
 *
 * <p>
 * The same record type describes both the network-wide policy and the backoff
 * state carried by an unhealthy node, in which case {@code currentInterval} is the
 * interval the node is currently resting for.
 *
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * NodeBackoffPolicy policy = NodeBackoffPolicy.builder()
 *     .minBackoff(Duration.ofSeconds(1))
 *     .maxBackoff(Duration.ofMinutes(5))
 *     .build();
 * client.network().setNodeBackoffPolicy(policy);
 * }</pre>
 *
 * @param currentInterval the interval most recently applied (equals {@code minBackoff} for a fresh policy)
 * @param minBackoff      the rest interval after a first failure (must be &gt; 0)
 * @param maxBackoff      the cap on the rest interval (must be &gt;= minBackoff)
 * @param maxAttempts     consecutive failures after which a node is reported as a removal candidate
 * @see NodeHealth
 * @since 0.1.0
 */
public record NodeBackoffPolicy(
        Duration currentInterval,
        Duration minBackoff,
        Duration maxBackoff,
        int maxAttempts) {

    /** Default minimum backoff: 250ms. */
    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofMillis(250);

    /** Default maximum backoff: 1 hour. */
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofHours(1);

    /** Default max attempts before a node is reported: 10. */
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    private static final int MULTIPLIER = 2;

    public NodeBackoffPolicy {
        Objects.requireNonNull(currentInterval, "currentInterval");
        Objects.requireNonNull(minBackoff, "minBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (minBackoff.isZero() || minBackoff.isNegative()) {
            throw new IllegalArgumentException("minBackoff must be > 0, got: " + minBackoff);
        }
        if (maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException(
                    "maxBackoff must be >= minBackoff, got: " + maxBackoff + " < " + minBackoff);
        }
        if (currentInterval.compareTo(minBackoff) < 0 || currentInterval.compareTo(maxBackoff) > 0) {
            throw new IllegalArgumentException(
                    "currentInterval must be within [minBackoff, maxBackoff], got: " + currentInterval);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
    }

    /**
     * Returns the default policy: 250ms minimum, 1 hour maximum, 10 attempts.
     *
     * @return the default policy
     */
    public static NodeBackoffPolicy defaults() {
        return new NodeBackoffPolicy(DEFAULT_MIN_BACKOFF, DEFAULT_MIN_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_MAX_ATTEMPTS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the backoff state for a node that just failed for the first time.
     *
     * @return a copy whose current interval is {@code minBackoff}
     */
    public NodeBackoffPolicy restart() {
        return new NodeBackoffPolicy(minBackoff, minBackoff, maxBackoff, maxAttempts);
    }

    /**
     * Returns the backoff state after one more consecutive failure.
     *
     * @return a copy whose current interval is doubled, capped at {@code maxBackoff}
     */
    public NodeBackoffPolicy advance() {
        // compare against max / 2 so the multiplication cannot overflow
        final Duration next = currentInterval.compareTo(maxBackoff.dividedBy(MULTIPLIER)) > 0
                ? maxBackoff
                : currentInterval.multipliedBy(MULTIPLIER);
        return new NodeBackoffPolicy(next, minBackoff, maxBackoff, maxAttempts);
    }

    public NodeBackoffPolicy withMinBackoff(final Duration minBackoff) {
        return new NodeBackoffPolicy(minBackoff, minBackoff, maxBackoff, maxAttempts);
    }

    public NodeBackoffPolicy withMaxBackoff(final Duration maxBackoff) {
        return new NodeBackoffPolicy(minBackoff, minBackoff, maxBackoff, maxAttempts);
    }

    public NodeBackoffPolicy withMaxAttempts(final int maxAttempts) {
        return new NodeBackoffPolicy(currentInterval, minBackoff, maxBackoff, maxAttempts);
    }

    /**
     * Builder for {@link NodeBackoffPolicy}. Starts from {@link #defaults()}.
     */
    public static final class Builder {
        private Duration minBackoff = DEFAULT_MIN_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

        private Builder() {}

        public Builder minBackoff(final Duration minBackoff) {
            this.minBackoff = minBackoff;
            return this;
        }

        public Builder maxBackoff(final Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Builds the policy.
         *
         * @return new immutable {@link NodeBackoffPolicy}
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public NodeBackoffPolicy build() {
            return new NodeBackoffPolicy(minBackoff, minBackoff, maxBackoff, maxAttempts);
        }
    }
}
