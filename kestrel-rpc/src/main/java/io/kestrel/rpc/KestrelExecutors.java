// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors a {@link Client} owns.
 *
 * <p>
 * Kestrel separates work by its nature:
 * <ul>
 * <li><strong>I/O-bound work</strong> (blocking executions behind
 * {@link Client#executeAsync}, parallel pings): an unbounded cached pool</li>
 * <li><strong>CPU-bound work</strong> (TLS bootstrap: certificate retrieval,
 * trust store and SSL context construction): a bounded pool, so a cold start
 * against many nodes cannot starve other work</li>
 * <li><strong>Scheduled work</strong> (periodic network refresh): a single thread</li>
 * </ul>
 *
 * <p>
 * All threads are daemon threads named after their pool, for easier debugging.
 *
 * @since 0.1.0
 */
public final class KestrelExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);
    private static final AtomicInteger CPU_THREAD_ID = new AtomicInteger(0);
    private static final AtomicInteger SCHEDULER_THREAD_ID = new AtomicInteger(0);

    private KestrelExecutors() {
        // Utility class
    }

    /**
     * Creates an executor for blocking I/O-bound work.
     *
     * <p>
     * Threads are created on demand, reused while idle for 60 seconds, and named
     * {@code kestrel-io-N}.
     *
     * @return a cached thread pool
     */
    public static ExecutorService newIoBoundExecutor() {
        return Executors.newCachedThreadPool(daemonFactory("kestrel-io-", IO_THREAD_ID));
    }

    /**
     * Creates an executor for CPU-bound work sized to the available processors.
     *
     * @return a fixed-size thread pool
     */
    public static ExecutorService newCpuBoundExecutor() {
        return newCpuBoundExecutor(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates a CPU-bound executor with a custom number of threads.
     *
     * @param threads the number of threads in the pool
     * @return a fixed-size thread pool
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ExecutorService newCpuBoundExecutor(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newFixedThreadPool(threads, daemonFactory("kestrel-cpu-worker-", CPU_THREAD_ID));
    }

    /**
     * Creates a single-threaded scheduler for periodic background tasks.
     *
     * @return a scheduled executor with one thread named {@code kestrel-scheduler-N}
     */
    public static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonFactory("kestrel-scheduler-", SCHEDULER_THREAD_ID));
    }

    private static ThreadFactory daemonFactory(final String prefix, final AtomicInteger ids) {
        return r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            int id = ids.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, prefix + id);
            t.setDaemon(true);
            return t;
        };
    }
}
