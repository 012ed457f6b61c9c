// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.ManagedChannel;
import io.kestrel.rpc.internal.Endpoints;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The mirror node endpoints of a client, used for queries served outside consensus
 * such as address book retrieval.
 *
 * <p>
 * The channel is created on first use. Local development endpoints
 * ({@code localhost}, {@code 127.0.0.1}) are reached in plaintext, every other
 * endpoint over TLS verified against the system trust store.
 *
 * @since 0.1.0
 */
public final class MirrorNetwork implements AutoCloseable {

    private final SortedSet<String> addresses;
    private final NodeChannelFactory channelFactory;

    private final Object lock = new Object();
    private volatile ManagedChannel channel;

    public MirrorNetwork(final List<String> addresses, final NodeChannelFactory channelFactory) {
        Objects.requireNonNull(addresses, "addresses");
        final TreeSet<String> sorted = new TreeSet<>();
        for (String address : addresses) {
            Endpoints.port(address); // rejects malformed addresses up front
            sorted.add(address);
        }
        this.addresses = Collections.unmodifiableSortedSet(sorted);
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    }

    public static MirrorNetwork forName(final NetworkName network, final NodeChannelFactory channelFactory) {
        return new MirrorNetwork(List.of(network.mirrorAddress()), channelFactory);
    }

    public List<String> addresses() {
        return List.copyOf(addresses);
    }

    public boolean isEmpty() {
        return addresses.isEmpty();
    }

    /**
     * Returns the channel to the mirror network, creating it on first use.
     *
     * @return the channel
     * @throws IllegalStateException if no mirror address is configured
     */
    public ManagedChannel channel() {
        ManagedChannel current = channel;
        if (current == null) {
            synchronized (lock) {
                current = channel;
                if (current == null) {
                    if (addresses.isEmpty()) {
                        throw new IllegalStateException("No mirror network addresses configured");
                    }
                    current = channelFactory.createMirrorChannel(addresses, usesPlaintext(addresses.first()));
                    channel = current;
                }
            }
        }
        return current;
    }

    @Override
    public void close() {
        final ManagedChannel current;
        synchronized (lock) {
            current = channel;
        }
        if (current != null) {
            current.shutdown();
        }
    }

    static boolean usesPlaintext(final String address) {
        return address.contains("localhost") || address.contains("127.0.0.1");
    }

    @Override
    public String toString() {
        return "MirrorNetwork{addresses=" + addresses + "}";
    }
}
