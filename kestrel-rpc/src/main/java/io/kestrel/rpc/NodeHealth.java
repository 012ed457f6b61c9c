// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Health of one consensus node, shared by every topology generation the node is part of.
 *
 * <p>
 * The holder is mutable and synchronized on itself; the {@link State} it holds is
 * an immutable value. Nodes start {@link Unused}, which counts as healthy.
 *
 * <pre>
 *   Unused ──markHealthy──▶ Healthy ◀──markHealthy── Unhealthy
 *     │                        │                         ▲
 *     └──────markUnhealthy─────┴───────markUnhealthy─────┘
 * </pre>
 *
 * @since 0.1.0
 */
public final class NodeHealth {

    /** A node counts as recently pinged for this long after its last successful use. */
    public static final Duration RECENTLY_PINGED_WINDOW = Duration.ofMinutes(15);

    /**
     * Immutable snapshot of a node's health.
     */
    public sealed interface State permits Unused, Healthy, Unhealthy {
    }

    /** The node has never been used. */
    public record Unused() implements State {
        static final Unused INSTANCE = new Unused();
    }

    /**
     * The node answered the last time it was used.
     *
     * @param usedAt when the node was last used
     */
    public record Healthy(Instant usedAt) implements State {
        public Healthy {
            Objects.requireNonNull(usedAt, "usedAt");
        }
    }

    /**
     * The node failed and rests until {@code healthyAt}.
     *
     * @param backoff   backoff state, its current interval is the rest period now applied
     * @param healthyAt the instant the node becomes eligible again
     * @param attempts  consecutive failures so far
     */
    public record Unhealthy(NodeBackoffPolicy backoff, Instant healthyAt, int attempts) implements State {
        public Unhealthy {
            Objects.requireNonNull(backoff, "backoff");
            Objects.requireNonNull(healthyAt, "healthyAt");
        }
    }

    private State state = Unused.INSTANCE;

    public synchronized State state() {
        return state;
    }

    /**
     * Records a successful response, dropping any backoff memory.
     *
     * @param now the current time
     */
    public synchronized void markHealthy(final Instant now) {
        state = new Healthy(now);
    }

    /**
     * Records a failure and puts the node to rest.
     *
     * <p>
     * A node that is already unhealthy keeps its backoff and attempt count, and its
     * rest interval grows; otherwise the interval starts at the policy's minimum.
     *
     * @param policy the policy of the network the node belongs to
     * @param now    the current time
     * @return the new state
     */
    public synchronized Unhealthy markUnhealthy(final NodeBackoffPolicy policy, final Instant now) {
        final Unhealthy next;
        if (state instanceof Unhealthy unhealthy) {
            final NodeBackoffPolicy backoff = unhealthy.backoff().advance();
            next = new Unhealthy(backoff, now.plus(backoff.currentInterval()), unhealthy.attempts() + 1);
        } else {
            final NodeBackoffPolicy backoff = policy.restart();
            next = new Unhealthy(backoff, now.plus(backoff.currentInterval()), 1);
        }
        state = next;
        return next;
    }

    /**
     * Records that the node was just attempted. An unhealthy node keeps resting.
     *
     * @param now the current time
     */
    public synchronized void markUsed(final Instant now) {
        if (!(state instanceof Unhealthy)) {
            state = new Healthy(now);
        }
    }

    public synchronized boolean isHealthy(final Instant now) {
        if (state instanceof Unhealthy unhealthy) {
            return !now.isBefore(unhealthy.healthyAt());
        }
        return true;
    }

    /**
     * Returns whether the node's health is known well enough to skip a liveness probe.
     *
     * @param now the current time
     * @return {@code true} if the node was used within the last 15 minutes, or is still resting
     */
    public synchronized boolean recentlyPinged(final Instant now) {
        if (state instanceof Healthy healthy) {
            return now.isBefore(healthy.usedAt().plus(RECENTLY_PINGED_WINDOW));
        }
        if (state instanceof Unhealthy unhealthy) {
            return now.isBefore(unhealthy.healthyAt());
        }
        return false;
    }

    /**
     * Returns when a resting node becomes eligible again.
     *
     * @return the instant, or {@code null} if the node is not unhealthy
     */
    public synchronized @Nullable Instant healthyAt() {
        return state instanceof Unhealthy unhealthy ? unhealthy.healthyAt() : null;
    }

    @Override
    public synchronized String toString() {
        return "NodeHealth{" + state + "}";
    }
}
