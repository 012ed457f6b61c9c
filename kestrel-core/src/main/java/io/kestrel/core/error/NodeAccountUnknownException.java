// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

import io.kestrel.core.types.AccountId;
import java.util.Objects;

/**
 * Thrown when a request names a node account id that the client's network does not contain.
 *
 * @since 0.1.0
 */
public final class NodeAccountUnknownException extends ConfigurationException {

    private final AccountId nodeAccountId;

    public NodeAccountUnknownException(final AccountId nodeAccountId) {
        super("Node account " + Objects.requireNonNull(nodeAccountId, "nodeAccountId")
                + " is not part of the network");
        this.nodeAccountId = nodeAccountId;
    }

    public AccountId nodeAccountId() {
        return nodeAccountId;
    }
}
