// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.util.List;

/**
 * The consensus nodes of a network as published by the network itself.
 *
 * @param nodeAddresses one entry per node
 */
public record NodeAddressBook(List<NodeAddress> nodeAddresses) {

    public NodeAddressBook {
        nodeAddresses = List.copyOf(nodeAddresses);
    }
}
