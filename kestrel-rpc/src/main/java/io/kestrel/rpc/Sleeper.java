// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.time.Duration;

/**
 * Blocks the calling thread between retry rounds. Replaced in tests to observe delays.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps with {@link Thread#sleep(long)}. */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
