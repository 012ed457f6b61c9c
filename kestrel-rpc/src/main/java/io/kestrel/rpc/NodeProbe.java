// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.time.Duration;

/**
 * Checks whether a node is reachable before a request is sent to it.
 *
 * <p>
 * The executor probes nodes whose health has not been confirmed recently, and
 * {@link Client#ping(io.kestrel.core.types.AccountId)} probes on demand. The
 * caller records the result in the node's health.
 *
 * @see ChannelStateProbe
 * @since 0.1.0
 */
@FunctionalInterface
public interface NodeProbe {

    /**
     * Probes a node.
     *
     * @param node     the node's channel
     * @param deadline how long the probe may take
     * @return {@code true} if the node is reachable
     */
    boolean probe(NodeChannel node, Duration deadline);
}
