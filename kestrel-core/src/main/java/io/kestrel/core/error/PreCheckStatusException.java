// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

import io.kestrel.core.Status;
import io.kestrel.core.types.TransactionId;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a node rejects a request during pre-check.
 *
 * <p>
 * A pre-check rejection happens before consensus: the node looked at the
 * request and refused it with a {@link Status}. Some statuses (for example
 * {@link Status#BUSY}) are retried on other nodes by the execution engine and
 * only reach the caller as the cause of an {@link ExecutionTimeoutException};
 * every other status is reported here on first occurrence.
 *
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try {
 *     client.execute(transfer);
 * } catch (PreCheckStatusException e) {
 *     if (e.status() == Status.INSUFFICIENT_PAYER_BALANCE) {
 *         // top up the operator account
 *     }
 * }
 * }</pre>
 */
public final class PreCheckStatusException extends KestrelException {

    private final Status status;
    private final @Nullable TransactionId transactionId;

    public PreCheckStatusException(final Status status, final @Nullable TransactionId transactionId) {
        super(describe(status, transactionId));
        this.status = status;
        this.transactionId = transactionId;
    }

    public Status status() {
        return status;
    }

    /**
     * Returns the transaction id the rejected request was submitted with.
     *
     * @return the transaction id, or {@code null} for requests without one (most queries)
     */
    public @Nullable TransactionId transactionId() {
        return transactionId;
    }

    @Override
    public String toString() {
        return "PreCheckStatusException{"
                + "status="
                + status
                + ", transactionId="
                + transactionId
                + "}";
    }

    private static String describe(final Status status, final @Nullable TransactionId transactionId) {
        Objects.requireNonNull(status, "status");
        if (transactionId == null) {
            return "Request failed pre-check with status " + status;
        }
        return "Transaction " + transactionId + " failed pre-check with status " + status;
    }
}
