// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.kestrel.core.error.KestrelException;
import io.kestrel.core.error.TlsBootstrapException;
import io.kestrel.rpc.internal.Endpoints;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel cache for one consensus node.
 *
 * <p>
 * A connection holds at most one plaintext channel, balancing over all of the
 * node's addresses, and at most one pool of TLS channels, one per reachable TLS
 * endpoint. Both are created on first use and reused until the connection is
 * shut down. TLS channels are handed out round-robin.
 *
 * <p>
 * A connection that was shut down opens no new channel: {@link #channel} then fails
 * with {@code UNAVAILABLE}, as a call on a shut-down gRPC channel would.
 *
 * <p>
 * <strong>TLS trust:</strong> the TLS pool trusts whatever certificate each of the
 * node's endpoints presents when the pool is built, with hostname checks disabled.
 * This gives confidentiality but only trust-on-first-use authentication.
 *
 * <p>
 * <strong>Thread Safety:</strong> concurrent first calls converge on one channel
 * (plaintext) or one bootstrap (TLS); no lock is held while the TLS bootstrap performs
 * network I/O.
 *
 * @since 0.1.0
 */
public final class NodeConnection {

    private static final Logger log = LoggerFactory.getLogger(NodeConnection.class);

    /** Port of the plaintext gRPC endpoint of a consensus node. */
    public static final int PLAINTEXT_PORT = 50211;

    /** Port of the TLS gRPC endpoint of a consensus node. */
    public static final int TLS_PORT = 50212;

    private final SortedSet<String> addresses;
    private final NodeChannelFactory channelFactory;
    private final Executor bootstrapExecutor;

    private final Object plaintextLock = new Object();
    private volatile ManagedChannel plaintextChannel;
    private volatile boolean closed;

    private final AtomicReference<CompletableFuture<List<ManagedChannel>>> tlsChannels = new AtomicReference<>();
    private final AtomicInteger nextTlsChannel = new AtomicInteger();

    /**
     * Creates a connection with empty caches.
     *
     * @param addresses         the node's {@code host:port} addresses (copied, must not be empty)
     * @param channelFactory    creates channels on first use
     * @param bootstrapExecutor runs TLS bootstrap off the calling thread
     */
    public NodeConnection(
            final Collection<String> addresses,
            final NodeChannelFactory channelFactory,
            final Executor bootstrapExecutor) {
        Objects.requireNonNull(addresses, "addresses");
        if (addresses.isEmpty()) {
            throw new IllegalArgumentException("A node needs at least one address");
        }
        this.addresses = Collections.unmodifiableSortedSet(new TreeSet<>(addresses));
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.bootstrapExecutor = Objects.requireNonNull(bootstrapExecutor, "bootstrapExecutor");
    }

    public SortedSet<String> addresses() {
        return addresses;
    }

    /**
     * Returns the node's addresses with the plaintext port replaced by the TLS port.
     *
     * @return the TLS addresses; endpoints on other ports are kept as given
     */
    public SortedSet<String> tlsAddresses() {
        final TreeSet<String> tls = new TreeSet<>();
        for (String address : addresses) {
            tls.add(Endpoints.port(address) == PLAINTEXT_PORT ? Endpoints.withPort(address, TLS_PORT) : address);
        }
        return Collections.unmodifiableSortedSet(tls);
    }

    /**
     * Returns a channel to the node, creating it on first use.
     *
     * <p>
     * With transport security off, a node whose every address is already on the TLS
     * port is still reached over TLS.
     *
     * @param transportSecurity whether the network uses TLS
     * @param deadline          bound on establishing a connection
     * @return a cached channel
     * @throws TlsBootstrapException if the TLS pool had to be built and no endpoint was reachable
     * @throws io.grpc.StatusRuntimeException with {@code UNAVAILABLE} if the connection was shut down
     */
    public ManagedChannel channel(final boolean transportSecurity, final Duration deadline) {
        if (closed) {
            throw shutDown();
        }
        if (transportSecurity || onlyTlsPorts()) {
            return tlsChannel(deadline);
        }
        return plaintextChannel(deadline);
    }

    /**
     * Returns whether any channel was created through this connection.
     *
     * @return {@code true} once a plaintext channel or a TLS pool exists
     */
    public boolean hasCachedChannels() {
        return plaintextChannel != null || tlsChannels.get() != null;
    }

    public boolean isShutdown() {
        return closed;
    }

    /**
     * Shuts down every channel created through this connection. In-flight calls finish.
     */
    public void shutdown() {
        final ManagedChannel plaintext;
        synchronized (plaintextLock) {
            closed = true;
            plaintext = plaintextChannel;
        }
        if (plaintext != null) {
            plaintext.shutdown();
        }
        final CompletableFuture<List<ManagedChannel>> pool = tlsChannels.get();
        if (pool != null) {
            // a bootstrap still in progress shuts its channels down when it completes
            pool.thenAccept(channels -> channels.forEach(ManagedChannel::shutdown));
        }
    }

    private ManagedChannel plaintextChannel(final Duration deadline) {
        ManagedChannel channel = plaintextChannel;
        if (channel == null) {
            synchronized (plaintextLock) {
                channel = plaintextChannel;
                if (channel == null) {
                    if (closed) {
                        throw shutDown();
                    }
                    channel = channelFactory.createPlaintextChannel(addresses, deadline);
                    plaintextChannel = channel;
                }
            }
        }
        return channel;
    }

    private ManagedChannel tlsChannel(final Duration deadline) {
        final List<ManagedChannel> pool = tlsPool(deadline);
        return pool.get(Math.floorMod(nextTlsChannel.getAndIncrement(), pool.size()));
    }

    private List<ManagedChannel> tlsPool(final Duration deadline) {
        CompletableFuture<List<ManagedChannel>> pool = tlsChannels.get();
        if (pool == null) {
            final CompletableFuture<List<ManagedChannel>> created = new CompletableFuture<>();
            pool = tlsChannels.compareAndExchange(null, created);
            if (pool == null) {
                pool = created;
                bootstrap(created, deadline);
                if (closed) {
                    // shutdown() may have run before the pool was published
                    created.thenAccept(channels -> channels.forEach(ManagedChannel::shutdown));
                    throw shutDown();
                }
            }
        }
        try {
            return pool.join();
        } catch (CompletionException e) {
            // allow a later call to try the bootstrap again
            tlsChannels.compareAndSet(pool, null);
            if (e.getCause() instanceof KestrelException kestrel) {
                throw kestrel;
            }
            throw new TlsBootstrapException("TLS bootstrap failed for " + addresses, e.getCause());
        }
    }

    private void bootstrap(final CompletableFuture<List<ManagedChannel>> target, final Duration deadline) {
        final SortedSet<String> tls = tlsAddresses();
        log.debug("Bootstrapping TLS channels for {}", tls);
        final CompletableFuture<List<ManagedChannel>> created;
        try {
            created = CompletableFuture.supplyAsync(
                    () -> List.copyOf(channelFactory.createTlsChannels(tls, deadline)), bootstrapExecutor);
        } catch (RejectedExecutionException e) {
            target.completeExceptionally(e);
            return;
        }
        created.whenComplete((channels, error) -> {
            if (error != null) {
                target.completeExceptionally(error instanceof CompletionException ? error.getCause() : error);
            } else if (channels.isEmpty()) {
                target.completeExceptionally(new TlsBootstrapException(tls));
            } else {
                log.debug("Opened {} TLS channel(s) for {}", channels.size(), tls);
                target.complete(channels);
            }
        });
    }

    private StatusRuntimeException shutDown() {
        return Status.UNAVAILABLE.withDescription("Connection to " + addresses + " is shut down").asRuntimeException();
    }

    private boolean onlyTlsPorts() {
        for (String address : addresses) {
            if (Endpoints.port(address) != TLS_PORT) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "NodeConnection{addresses=" + addresses + "}";
    }
}
