// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a request's deadline runs out while every attempt failed transiently.
 *
 * <p>
 * The cause is always the last node-level error observed (a busy node, an
 * unavailable channel, a retryable pre-check status), or {@code null} if no
 * node could be attempted at all before the deadline.
 *
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try {
 *     client.execute(query, Duration.ofSeconds(30));
 * } catch (ExecutionTimeoutException e) {
 *     System.out.println("Gave up after " + e.roundCount() + " rounds in " + e.elapsedMillis() + "ms");
 *     if (e.getCause() instanceof PreCheckStatusException pre) {
 *         System.out.println("Last status: " + pre.status());
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ExecutionTimeoutException extends KestrelException {

    /** Explicit UID for serialization stability across class evolution. */
    private static final long serialVersionUID = 1L;

    private final int roundCount;
    private final long elapsedMillis;

    public ExecutionTimeoutException(
            final int roundCount,
            final long elapsedMillis,
            final @Nullable KestrelException lastError) {
        super(
            String.format("Request timed out after %d rounds (elapsed: %dms)", roundCount, elapsedMillis),
            lastError
        );
        this.roundCount = roundCount;
        this.elapsedMillis = elapsedMillis;
    }

    /**
     * Returns how many rounds over the node list were started before giving up.
     *
     * @return the number of rounds
     */
    public int roundCount() {
        return roundCount;
    }

    /**
     * Returns the time spent on the request, including backoff delays.
     *
     * @return the elapsed time in milliseconds
     */
    public long elapsedMillis() {
        return elapsedMillis;
    }

    /**
     * Returns the last transient error, if any.
     *
     * @return the last node-level error, or {@code null} if no node was attempted
     */
    public @Nullable KestrelException lastError() {
        return (KestrelException) getCause();
    }
}
