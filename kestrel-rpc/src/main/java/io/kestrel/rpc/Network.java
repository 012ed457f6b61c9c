// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.kestrel.core.types.AccountId;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The mutable set of consensus nodes of one client.
 *
 * <p>
 * Holds the current {@link NetworkTopology} in an atomic reference. Readers take a
 * snapshot with {@link #topology()} and never block. Writers compute a new topology
 * from the current one and publish it with compare-and-set, recomputing from the
 * latest snapshot when another writer got there first, so no concurrent update is
 * lost.
 *
 * <p>
 * Connections that are no longer part of the published topology are shut down.
 * Calls already running on their channels are allowed to finish.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * Network network = client.network();
 * network.setTransportSecurity(true);
 * network.updateFromAddressBook(book);
 * List<AccountId> healthy = network.healthyNodeIds();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Network implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Network.class);

    private final AtomicReference<NetworkTopology> topology;
    private final Clock clock;

    public Network(final NetworkTopology initial, final Clock clock) {
        this.topology = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the current topology. The snapshot never changes.
     *
     * @return the current topology
     */
    public NetworkTopology topology() {
        return topology.get();
    }

    Clock clock() {
        return clock;
    }

    /**
     * Replaces the node list, keeping health and connections of nodes that stay.
     *
     * @param addresses {@code host:port} to node account id
     */
    public void updateFromAddresses(final Map<String, AccountId> addresses) {
        Objects.requireNonNull(addresses, "addresses");
        final NetworkTopology updated = update(current -> current.withAddresses(addresses));
        log.debug("Network updated from {} addresses: {} nodes", addresses.size(), updated.size());
    }

    /**
     * Replaces the node list with the nodes of an address book.
     *
     * @param book the address book
     * @see NetworkTopology#withAddressBook(NodeAddressBook)
     */
    public void updateFromAddressBook(final NodeAddressBook book) {
        Objects.requireNonNull(book, "book");
        final NetworkTopology updated = update(current -> current.withAddressBook(book));
        log.debug("Network updated from address book: {} nodes", updated.size());
    }

    public void setTransportSecurity(final boolean transportSecurity) {
        update(current -> current.withTransportSecurity(transportSecurity));
    }

    public boolean transportSecurity() {
        return topology().transportSecurity();
    }

    public void setNodeBackoffPolicy(final NodeBackoffPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        update(current -> current.withBackoffPolicy(policy));
    }

    public NodeBackoffPolicy nodeBackoffPolicy() {
        return topology().backoffPolicy();
    }

    public void setMinBackoff(final Duration minBackoff) {
        update(current -> current.withBackoffPolicy(current.backoffPolicy().withMinBackoff(minBackoff)));
    }

    public void setMaxBackoff(final Duration maxBackoff) {
        update(current -> current.withBackoffPolicy(current.backoffPolicy().withMaxBackoff(maxBackoff)));
    }

    public void setMaxNodeAttempts(final int maxAttempts) {
        update(current -> current.withBackoffPolicy(current.backoffPolicy().withMaxAttempts(maxAttempts)));
    }

    public NodeChannel channel(final int index, final Duration deadline) {
        return topology().channel(index, deadline);
    }

    public int[] nodeIndexesForIds(final List<AccountId> ids) {
        return topology().nodeIndexesForIds(ids);
    }

    public List<Integer> healthyNodeIndexes() {
        return topology().healthyNodeIndexes(clock.instant());
    }

    public void markNodeHealthy(final int index) {
        topology().markNodeHealthy(index, clock.instant());
    }

    public void markNodeUnhealthy(final int index) {
        topology().markNodeUnhealthy(index, clock.instant());
    }

    public void markNodeUsed(final int index) {
        topology().markNodeUsed(index, clock.instant());
    }

    public Map<String, AccountId> addresses() {
        return topology().addresses();
    }

    public List<AccountId> nodeIds() {
        return topology().nodeIds();
    }

    public List<AccountId> healthyNodeIds() {
        return topology().healthyNodeIds(clock.instant());
    }

    /**
     * Shuts down every channel of the current topology.
     */
    @Override
    public void close() {
        topology().connections().forEach(NodeConnection::shutdown);
    }

    private NetworkTopology update(final UnaryOperator<NetworkTopology> change) {
        while (true) {
            final NetworkTopology current = topology.get();
            final NetworkTopology updated = change.apply(current);
            if (topology.compareAndSet(current, updated)) {
                retire(current, updated);
                return updated;
            }
            log.debug("Concurrent network update detected, retrying");
        }
    }

    private static void retire(final NetworkTopology previous, final NetworkTopology current) {
        final Set<NodeConnection> kept = Collections.newSetFromMap(new IdentityHashMap<>());
        kept.addAll(current.connections());
        for (NodeConnection connection : previous.connections()) {
            if (!kept.contains(connection)) {
                connection.shutdown();
            }
        }
    }
}
