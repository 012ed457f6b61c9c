// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.kestrel.core.types.AccountId;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a network address book.
 *
 * @param nodeId           the node's numeric id within the network
 * @param nodeAccountId    the account the node is identified and paid through
 * @param serviceEndpoints the node's {@code host:port} gRPC endpoints
 * @param description      free-form description, may be empty
 */
public record NodeAddress(long nodeId, AccountId nodeAccountId, List<String> serviceEndpoints, String description) {

    public NodeAddress {
        Objects.requireNonNull(nodeAccountId, "nodeAccountId");
        serviceEndpoints = List.copyOf(serviceEndpoints);
        description = description == null ? "" : description;
    }
}
