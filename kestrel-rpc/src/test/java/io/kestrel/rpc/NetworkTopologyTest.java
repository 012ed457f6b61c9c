// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.kestrel.core.error.NodeAccountUnknownException;
import io.kestrel.core.types.AccountId;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NetworkTopologyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static final AccountId NODE_3 = AccountId.of(3);
    private static final AccountId NODE_4 = AccountId.of(4);
    private static final AccountId NODE_5 = AccountId.of(5);

    private final FakeChannelFactory factory = new FakeChannelFactory();

    private NetworkTopology topology(final Map<String, AccountId> addresses) {
        return NetworkTopology.fromAddresses(addresses, factory, Runnable::run);
    }

    private static Map<String, AccountId> addresses(final Object... pairs) {
        final Map<String, AccountId> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (AccountId) pairs[i + 1]);
        }
        return map;
    }

    @Test
    void groupsAddressesByNode() {
        final NetworkTopology topology = topology(addresses(
                "10.0.0.1:50211", NODE_3,
                "10.0.0.2:50211", NODE_3,
                "10.0.0.3:50211", NODE_4));

        assertEquals(List.of(NODE_3, NODE_4), topology.nodeIds());
        assertEquals(2, topology.connection(0).addresses().size());
        assertEquals(addresses(
                "10.0.0.1:50211", NODE_3,
                "10.0.0.2:50211", NODE_3,
                "10.0.0.3:50211", NODE_4), topology.addresses());
    }

    @Test
    void rejectsAddressWithoutPort() {
        assertThrows(IllegalArgumentException.class, () -> topology(addresses("10.0.0.1", NODE_3)));
    }

    @Test
    void updateKeepsStateOfNodesThatStay() {
        final NetworkTopology before = topology(addresses(
                "10.0.0.3:50211", NODE_3,
                "10.0.0.4:50211", NODE_4));
        before.markNodeUnhealthy(0, T0);

        final NetworkTopology after = before.withAddresses(addresses(
                "10.0.0.3:50211", NODE_3,
                "10.0.0.44:50211", NODE_4,
                "10.0.0.5:50211", NODE_5));

        assertSame(before.health(0), after.health(0));
        assertSame(before.connection(0), after.connection(0));
        assertInstanceOf(NodeHealth.Unhealthy.class, after.health(0).state());

        assertSame(before.health(1), after.health(1));
        assertNotSame(before.connection(1), after.connection(1));

        assertInstanceOf(NodeHealth.Unused.class, after.health(2).state());
    }

    @Test
    void updateDropsNodesThatLeave() {
        final NetworkTopology before = topology(addresses(
                "10.0.0.3:50211", NODE_3,
                "10.0.0.4:50211", NODE_4));

        final NetworkTopology after = before.withAddresses(addresses("10.0.0.4:50211", NODE_4));

        assertEquals(List.of(NODE_4), after.nodeIds());
        assertThrows(NodeAccountUnknownException.class, () -> after.nodeIndexesForIds(List.of(NODE_3)));
    }

    @Test
    void addressBookKeepsOnlyPlaintextEndpoints() {
        final NodeAddressBook book = new NodeAddressBook(List.of(
                new NodeAddress(0, NODE_3, List.of("10.0.0.3:50211", "10.0.0.3:50212"), "node 0"),
                new NodeAddress(1, NODE_4, List.of("10.0.0.4:50212"), "node 1")));

        final NetworkTopology topology = topology(Map.of()).withAddressBook(book);

        assertEquals(List.of(NODE_3), topology.nodeIds());
        assertEquals(addresses("10.0.0.3:50211", NODE_3), topology.addresses());
    }

    @Test
    void addressBookUpdateMatchingExistingAddressesKeepsConnection() {
        final NetworkTopology before = topology(addresses("10.0.0.3:50211", NODE_3));
        final NodeAddressBook book = new NodeAddressBook(List.of(
                new NodeAddress(0, NODE_3, List.of("10.0.0.3:50211"), "")));

        final NetworkTopology after = before.withAddressBook(book);

        assertSame(before.connection(0), after.connection(0));
    }

    @Test
    void resolvesNodeIdsInRequestOrder() {
        final NetworkTopology topology = topology(addresses(
                "10.0.0.3:50211", NODE_3,
                "10.0.0.4:50211", NODE_4,
                "10.0.0.5:50211", NODE_5));

        assertArrayEquals(new int[] {2, 0}, topology.nodeIndexesForIds(List.of(NODE_5, NODE_3)));

        final NodeAccountUnknownException e = assertThrows(NodeAccountUnknownException.class,
                () -> topology.nodeIndexesForIds(List.of(NODE_3, AccountId.of(99))));
        assertEquals(AccountId.of(99), e.nodeAccountId());
    }

    @Test
    void healthyIndexesExcludeRestingNodes() {
        final NetworkTopology topology = topology(addresses(
                "10.0.0.3:50211", NODE_3,
                "10.0.0.4:50211", NODE_4,
                "10.0.0.5:50211", NODE_5));

        topology.markNodeUnhealthy(1, T0);

        assertEquals(List.of(0, 2), topology.healthyNodeIndexes(T0));
        assertEquals(List.of(NODE_3, NODE_5), topology.healthyNodeIds(T0));
        assertEquals(List.of(0, 1, 2), topology.healthyNodeIndexes(T0.plusMillis(250)));
    }

    @Test
    void earliestHealthyAtIsTheSoonestRecovery() {
        final NetworkTopology topology = topology(addresses(
                "10.0.0.3:50211", NODE_3,
                "10.0.0.4:50211", NODE_4));
        assertNull(topology.earliestHealthyAt());

        topology.markNodeUnhealthy(0, T0.plusSeconds(1));
        topology.markNodeUnhealthy(1, T0);

        assertEquals(T0.plusMillis(250), topology.earliestHealthyAt());
    }

    @Test
    void transportSecurityFlagSelectsChannelKind() {
        final NetworkTopology plaintext = topology(addresses("10.0.0.3:50211", NODE_3));
        final NetworkTopology tls = plaintext.withTransportSecurity(true);

        final NodeChannel channel = tls.channel(0, java.time.Duration.ofSeconds(1));

        assertEquals(NODE_3, channel.nodeAccountId());
        assertEquals(1, factory.tlsBootstraps.get());
        assertEquals(0, factory.plaintextCreated.get());
        assertTrue(tls.transportSecurity());
        assertSame(plaintext.health(0), tls.health(0));
    }

    @Test
    void fromStaticListsEverySeedNode() {
        final NetworkTopology topology = NetworkTopology.fromStatic(NetworkName.TESTNET, factory, Runnable::run);

        assertEquals(NetworkName.TESTNET.addresses().size(), topology.addresses().size());
        assertTrue(topology.size() > 0);
        topology.addresses().keySet().forEach(address -> assertTrue(address.endsWith(":50211"), address));
    }
}
