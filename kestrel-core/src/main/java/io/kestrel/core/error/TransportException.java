// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.Objects;

/**
 * Exception thrown when a gRPC call to a consensus node fails at the transport level.
 *
 * <p>
 * Wraps the gRPC {@link Status} reported for the call. Whether such a failure
 * is retried on another node depends on the code:
 * <ul>
 * <li><strong>UNAVAILABLE</strong>, <strong>RESOURCE_EXHAUSTED</strong>: the node is
 * marked unhealthy and the next node is tried</li>
 * <li><strong>INTERNAL</strong> with a malformed-response description: the node is
 * marked unhealthy and the call fails, since it is unknown whether the request
 * took effect</li>
 * <li>anything else: the call fails immediately</li>
 * </ul>
 *
 * @see <a href="https://grpc.github.io/grpc/core/md_doc_statuscodes.html">gRPC status codes</a>
 */
public final class TransportException extends KestrelException {

    private final Status.Code code;
    private final String description;

    public TransportException(final StatusRuntimeException cause) {
        this(Objects.requireNonNull(cause, "cause").getStatus(), cause);
    }

    public TransportException(final Status status, final Throwable cause) {
        super(describe(status), cause);
        this.code = status.getCode();
        this.description = status.getDescription();
    }

    public Status.Code code() {
        return code;
    }

    /**
     * Returns the status description sent by the peer or produced locally.
     *
     * @return the description, or {@code null} if the status had none
     */
    public String description() {
        return description;
    }

    public boolean isUnavailable() {
        return code == Status.Code.UNAVAILABLE || code == Status.Code.RESOURCE_EXHAUSTED;
    }

    @Override
    public String toString() {
        return "TransportException{"
                + "code="
                + code
                + ", description="
                + description
                + "}";
    }

    private static String describe(final Status status) {
        final String description = status.getDescription();
        if (description == null || description.isBlank()) {
            return "gRPC call failed: " + status.getCode();
        }
        return "gRPC call failed: " + status.getCode() + ": " + description;
    }
}
