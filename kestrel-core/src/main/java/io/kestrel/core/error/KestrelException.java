// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

/**
 * Base runtime exception for all Kestrel SDK failures.
 *
 * <p>
 * This sealed class forms the root of Kestrel's exception hierarchy. Each
 * branch corresponds to one failure category, so callers can decide how to
 * react without inspecting messages.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * KestrelException
 * ├── {@link ConfigurationException} - the client or request is set up wrong (always permanent)
 * │   ├── {@link NodeAccountUnknownException} - explicit node id not in the network
 * │   ├── {@link MissingLedgerIdException} - checksum validation without a ledger id
 * │   ├── {@link BadEntityIdException} - entity id checksum does not match the ledger
 * │   └── {@link TlsBootstrapException} - no TLS endpoint of a node was reachable
 * ├── {@link TransportException} - gRPC channel or call failure
 * ├── {@link ProtocolException} - the node answered with something we cannot interpret
 * │   └── {@link UnrecognizedStatusException} - unknown pre-check status code
 * ├── {@link PreCheckStatusException} - the node rejected the request with a status
 * └── {@link ExecutionTimeoutException} - deadline exhausted while only transient errors occurred
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.execute(request);
 * } catch (PreCheckStatusException e) {
 *     // the node rejected the request, fix it before resubmitting
 * } catch (ExecutionTimeoutException e) {
 *     // every attempt failed transiently, e.getCause() is the last node error
 * } catch (KestrelException e) {
 *     // catch-all for any other Kestrel error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class KestrelException extends RuntimeException
        permits ConfigurationException,
        TransportException,
        ProtocolException,
        PreCheckStatusException,
        ExecutionTimeoutException {

    public KestrelException(final String message) {
        super(message);
    }

    public KestrelException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
