// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.ManagedChannel;
import io.kestrel.core.types.AccountId;
import java.util.Objects;

/**
 * A channel to one consensus node, paired with the node's account id.
 *
 * @param nodeAccountId the node the channel talks to
 * @param channel       the gRPC channel, owned by the network and never shut down by callers
 */
public record NodeChannel(AccountId nodeAccountId, ManagedChannel channel) {

    public NodeChannel {
        Objects.requireNonNull(nodeAccountId, "nodeAccountId");
        Objects.requireNonNull(channel, "channel");
    }
}
