// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.kestrel.core.error.NodeAccountUnknownException;
import io.kestrel.core.types.AccountId;
import io.kestrel.rpc.internal.Endpoints;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable snapshot of the consensus nodes a client talks to.
 *
 * <p>
 * Nodes are addressed by index. The node id, health and connection lists are
 * index-aligned, and {@link #nodeIndexesForIds} maps node account ids back to
 * indexes. A snapshot never changes; {@link Network} replaces it as a whole.
 *
 * <p>
 * {@link NodeHealth} handles are shared between snapshots: a node that appears in
 * two generations is the same handle in both, so marking it through an older
 * snapshot is visible through the newer one.
 *
 * @since 0.1.0
 */
public final class NetworkTopology {

    private static final Logger log = LoggerFactory.getLogger(NetworkTopology.class);

    private final Map<AccountId, Integer> indexOf;
    private final List<AccountId> nodeIds;
    private final List<NodeHealth> health;
    private final List<NodeConnection> connections;
    private final NodeBackoffPolicy backoffPolicy;
    private final boolean transportSecurity;
    private final NodeChannelFactory channelFactory;
    private final Executor bootstrapExecutor;

    private NetworkTopology(
            final List<AccountId> nodeIds,
            final List<NodeHealth> health,
            final List<NodeConnection> connections,
            final NodeBackoffPolicy backoffPolicy,
            final boolean transportSecurity,
            final NodeChannelFactory channelFactory,
            final Executor bootstrapExecutor) {
        if (nodeIds.size() != health.size() || nodeIds.size() != connections.size()) {
            throw new IllegalArgumentException("Node lists must be index-aligned");
        }
        final Map<AccountId, Integer> index = new HashMap<>();
        for (int i = 0; i < nodeIds.size(); i++) {
            if (index.put(nodeIds.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate node account id " + nodeIds.get(i));
            }
        }
        this.indexOf = Collections.unmodifiableMap(index);
        this.nodeIds = List.copyOf(nodeIds);
        this.health = List.copyOf(health);
        this.connections = List.copyOf(connections);
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.transportSecurity = transportSecurity;
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.bootstrapExecutor = Objects.requireNonNull(bootstrapExecutor, "bootstrapExecutor");
    }

    /**
     * Creates a topology from an address map. Every node starts unused.
     *
     * @param addresses         {@code host:port} to node account id; several addresses may share a node
     * @param channelFactory    creates the nodes' channels
     * @param bootstrapExecutor runs TLS bootstrap
     * @return a new topology with the default backoff policy and transport security off
     */
    public static NetworkTopology fromAddresses(
            final Map<String, AccountId> addresses,
            final NodeChannelFactory channelFactory,
            final Executor bootstrapExecutor) {
        final NetworkTopology empty = new NetworkTopology(
                List.of(), List.of(), List.of(), NodeBackoffPolicy.defaults(), false, channelFactory, bootstrapExecutor);
        return empty.withAddresses(addresses);
    }

    /**
     * Creates a topology from the seed table of a public network.
     *
     * @param network           the network
     * @param channelFactory    creates the nodes' channels
     * @param bootstrapExecutor runs TLS bootstrap
     * @return a new topology listing every seed node on the plaintext port
     */
    public static NetworkTopology fromStatic(
            final NetworkName network,
            final NodeChannelFactory channelFactory,
            final Executor bootstrapExecutor) {
        return fromAddresses(network.addresses(), channelFactory, bootstrapExecutor);
    }

    /**
     * Returns a topology with the given node addresses, keeping state of nodes that stay.
     *
     * @param addresses {@code host:port} to node account id
     * @return the new topology
     * @see #withAddressBook(NodeAddressBook)
     */
    public NetworkTopology withAddresses(final Map<String, AccountId> addresses) {
        Objects.requireNonNull(addresses, "addresses");
        final Map<AccountId, SortedSet<String>> grouped = new LinkedHashMap<>();
        addresses.forEach((address, node) -> {
            Endpoints.port(address); // rejects malformed addresses up front
            grouped.computeIfAbsent(node, ignored -> new TreeSet<>()).add(address);
        });
        return rebuild(grouped);
    }

    /**
     * Returns a topology matching an address book, keeping state of nodes that stay.
     *
     * <p>
     * Only endpoints on {@link NodeConnection#PLAINTEXT_PORT} are taken from the book;
     * TLS addresses are derived from them when needed. For each node of the book:
     * <ul>
     * <li>a node already present with the same addresses keeps its connection and health</li>
     * <li>a node already present with other addresses keeps its health and gets a new connection</li>
     * <li>a new node starts unused</li>
     * </ul>
     * Nodes missing from the book are dropped, as are book entries without a plaintext endpoint.
     *
     * @param book the address book
     * @return the new topology
     */
    public NetworkTopology withAddressBook(final NodeAddressBook book) {
        Objects.requireNonNull(book, "book");
        final Map<AccountId, SortedSet<String>> grouped = new LinkedHashMap<>();
        for (NodeAddress node : book.nodeAddresses()) {
            for (String endpoint : node.serviceEndpoints()) {
                if (Endpoints.port(endpoint) == NodeConnection.PLAINTEXT_PORT) {
                    grouped.computeIfAbsent(node.nodeAccountId(), ignored -> new TreeSet<>()).add(endpoint);
                }
            }
            if (!grouped.containsKey(node.nodeAccountId())) {
                log.debug("Ignoring node {}: no endpoint on port {}", node.nodeAccountId(), NodeConnection.PLAINTEXT_PORT);
            }
        }
        return rebuild(grouped);
    }

    public NetworkTopology withTransportSecurity(final boolean transportSecurity) {
        return new NetworkTopology(
                nodeIds, health, connections, backoffPolicy, transportSecurity, channelFactory, bootstrapExecutor);
    }

    /**
     * Returns a topology applying another backoff policy to future failures.
     *
     * <p>
     * Nodes that are already resting keep their current backoff until they recover.
     *
     * @param policy the new policy
     * @return the new topology
     */
    public NetworkTopology withBackoffPolicy(final NodeBackoffPolicy policy) {
        return new NetworkTopology(
                nodeIds, health, connections, policy, transportSecurity, channelFactory, bootstrapExecutor);
    }

    private NetworkTopology rebuild(final Map<AccountId, SortedSet<String>> grouped) {
        final List<AccountId> ids = new ArrayList<>(grouped.size());
        final List<NodeHealth> healths = new ArrayList<>(grouped.size());
        final List<NodeConnection> conns = new ArrayList<>(grouped.size());
        grouped.forEach((node, addresses) -> {
            final Integer previous = indexOf.get(node);
            ids.add(node);
            if (previous == null) {
                healths.add(new NodeHealth());
                conns.add(new NodeConnection(addresses, channelFactory, bootstrapExecutor));
                return;
            }
            healths.add(health.get(previous));
            final NodeConnection existing = connections.get(previous);
            conns.add(existing.addresses().equals(addresses)
                    ? existing
                    : new NodeConnection(addresses, channelFactory, bootstrapExecutor));
        });
        return new NetworkTopology(
                ids, healths, conns, backoffPolicy, transportSecurity, channelFactory, bootstrapExecutor);
    }

    public int size() {
        return nodeIds.size();
    }

    public List<AccountId> nodeIds() {
        return nodeIds;
    }

    public boolean transportSecurity() {
        return transportSecurity;
    }

    public NodeBackoffPolicy backoffPolicy() {
        return backoffPolicy;
    }

    /**
     * Resolves node account ids to indexes.
     *
     * @param ids the node account ids
     * @return the indexes, in the order of {@code ids}
     * @throws NodeAccountUnknownException for the first id that is not part of this topology
     */
    public int[] nodeIndexesForIds(final List<AccountId> ids) {
        final int[] indexes = new int[ids.size()];
        for (int i = 0; i < indexes.length; i++) {
            final Integer index = indexOf.get(ids.get(i));
            if (index == null) {
                throw new NodeAccountUnknownException(ids.get(i));
            }
            indexes[i] = index;
        }
        return indexes;
    }

    public List<Integer> healthyNodeIndexes(final Instant now) {
        final List<Integer> healthy = new ArrayList<>();
        for (int i = 0; i < health.size(); i++) {
            if (health.get(i).isHealthy(now)) {
                healthy.add(i);
            }
        }
        return healthy;
    }

    public List<AccountId> healthyNodeIds(final Instant now) {
        final List<AccountId> healthy = new ArrayList<>();
        for (int index : healthyNodeIndexes(now)) {
            healthy.add(nodeIds.get(index));
        }
        return healthy;
    }

    public boolean isNodeHealthy(final int index, final Instant now) {
        return health.get(index).isHealthy(now);
    }

    public boolean nodeRecentlyPinged(final int index, final Instant now) {
        return health.get(index).recentlyPinged(now);
    }

    public void markNodeHealthy(final int index, final Instant now) {
        health.get(index).markHealthy(now);
    }

    /**
     * Puts a node to rest according to this topology's backoff policy.
     *
     * <p>
     * A node that keeps failing past the policy's max attempts is only reported in
     * the log; it stays part of the network.
     *
     * @param index the node index
     * @param now   the current time
     */
    public void markNodeUnhealthy(final int index, final Instant now) {
        final NodeHealth.Unhealthy state = health.get(index).markUnhealthy(backoffPolicy, now);
        log.debug("Node {} marked unhealthy for {} (consecutive failures: {})",
                nodeIds.get(index), state.backoff().currentInterval(), state.attempts());
        if (state.attempts() > backoffPolicy.maxAttempts()) {
            log.debug("Node {} exceeded {} consecutive failures, candidate for removal from the network",
                    nodeIds.get(index), backoffPolicy.maxAttempts());
        }
    }

    public void markNodeUsed(final int index, final Instant now) {
        health.get(index).markUsed(now);
    }

    /**
     * Returns the earliest instant at which a resting node recovers.
     *
     * @return the instant, or {@code null} if no node is resting
     */
    public @Nullable Instant earliestHealthyAt() {
        Instant earliest = null;
        for (NodeHealth node : health) {
            final Instant healthyAt = node.healthyAt();
            if (healthyAt != null && (earliest == null || healthyAt.isBefore(earliest))) {
                earliest = healthyAt;
            }
        }
        return earliest;
    }

    /**
     * Returns a channel to a node, creating and caching it on first use.
     *
     * @param index    the node index
     * @param deadline bound on establishing a connection
     * @return the node's account id and channel
     * @throws io.kestrel.core.error.TlsBootstrapException if transport security is on and none of the node's
     *                                                     TLS endpoints is reachable
     * @throws io.grpc.StatusRuntimeException              with {@code UNAVAILABLE} if a network update
     *                                                     retired the node's connection
     */
    public NodeChannel channel(final int index, final Duration deadline) {
        return new NodeChannel(nodeIds.get(index), connections.get(index).channel(transportSecurity, deadline));
    }

    /**
     * Returns every address of every node.
     *
     * @return {@code host:port} to node account id, in node order
     */
    public Map<String, AccountId> addresses() {
        final Map<String, AccountId> addresses = new LinkedHashMap<>();
        for (int i = 0; i < nodeIds.size(); i++) {
            for (String address : connections.get(i).addresses()) {
                addresses.put(address, nodeIds.get(i));
            }
        }
        return addresses;
    }

    NodeHealth health(final int index) {
        return health.get(index);
    }

    NodeConnection connection(final int index) {
        return connections.get(index);
    }

    List<NodeConnection> connections() {
        return connections;
    }

    @Override
    public String toString() {
        return "NetworkTopology{nodes=" + nodeIds + ", transportSecurity=" + transportSecurity + "}";
    }
}
