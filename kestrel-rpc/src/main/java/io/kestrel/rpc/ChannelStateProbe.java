// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes a node by asking its channel to connect and waiting for it to become ready.
 *
 * <p>
 * No request is sent. A channel that reports {@code TRANSIENT_FAILURE} or
 * {@code SHUTDOWN}, or that is not ready within the deadline, fails the probe.
 *
 * @since 0.1.0
 */
public final class ChannelStateProbe implements NodeProbe {

    private static final Logger log = LoggerFactory.getLogger(ChannelStateProbe.class);

    @Override
    public boolean probe(final NodeChannel node, final Duration deadline) {
        final ManagedChannel channel = node.channel();
        final long deadlineNanos = System.nanoTime() + deadline.toNanos();
        ConnectivityState state = channel.getState(true);
        while (state != ConnectivityState.READY) {
            if (state == ConnectivityState.TRANSIENT_FAILURE || state == ConnectivityState.SHUTDOWN) {
                log.debug("Probe of node {} failed: channel is {}", node.nodeAccountId(), state);
                return false;
            }
            final long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                log.debug("Probe of node {} timed out in state {}", node.nodeAccountId(), state);
                return false;
            }
            final CountDownLatch changed = new CountDownLatch(1);
            channel.notifyWhenStateChanged(state, changed::countDown);
            try {
                if (!changed.await(remaining, TimeUnit.NANOSECONDS)) {
                    log.debug("Probe of node {} timed out in state {}", node.nodeAccountId(), state);
                    return false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            state = channel.getState(false);
        }
        return true;
    }
}
