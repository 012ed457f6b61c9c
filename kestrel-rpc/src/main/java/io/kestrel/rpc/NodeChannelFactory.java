// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.ManagedChannel;
import io.kestrel.core.error.TlsBootstrapException;
import java.time.Duration;
import java.util.List;
import java.util.SortedSet;

/**
 * Creates the gRPC channels that {@link NodeConnection} and {@link MirrorNetwork} cache.
 *
 * <p>
 * {@link GrpcNodeChannelFactory} is the production implementation. Channel creation
 * is separated from caching so the caching and round-robin behaviour can be tested
 * without sockets.
 *
 * @since 0.1.0
 */
public interface NodeChannelFactory {

    /**
     * Creates one plaintext channel that balances over all of a node's addresses.
     *
     * @param addresses      the node's {@code host:port} addresses
     * @param connectTimeout bound on establishing a connection
     * @return a new channel
     */
    ManagedChannel createPlaintextChannel(SortedSet<String> addresses, Duration connectTimeout);

    /**
     * Bootstraps trust with a node's TLS endpoints and opens one channel per reachable endpoint.
     *
     * <p>
     * This performs blocking network I/O and must not be called on a latency sensitive thread.
     *
     * @param addresses      the node's TLS {@code host:port} addresses
     * @param connectTimeout bound on establishing a connection
     * @return at least one channel
     * @throws TlsBootstrapException if no endpoint could be reached
     */
    List<ManagedChannel> createTlsChannels(SortedSet<String> addresses, Duration connectTimeout);

    /**
     * Creates a channel to a mirror node service.
     *
     * @param addresses the mirror's {@code host:port} addresses
     * @param plaintext {@code true} for local development endpoints, {@code false} for TLS with the system trust store
     * @return a new channel
     */
    ManagedChannel createMirrorChannel(SortedSet<String> addresses, boolean plaintext);
}
