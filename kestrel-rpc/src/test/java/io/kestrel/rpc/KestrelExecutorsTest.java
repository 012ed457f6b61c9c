// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class KestrelExecutorsTest {

    @Test
    void ioThreadsAreNamedDaemons() throws Exception {
        final ExecutorService executor = KestrelExecutors.newIoBoundExecutor();
        try {
            final Thread thread = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

            assertTrue(thread.getName().startsWith("kestrel-io-"), thread.getName());
            assertTrue(thread.isDaemon());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void cpuThreadsAreNamedDaemons() throws Exception {
        final ExecutorService executor = KestrelExecutors.newCpuBoundExecutor(1);
        try {
            final Thread thread = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

            assertTrue(thread.getName().startsWith("kestrel-cpu-worker-"), thread.getName());
            assertTrue(thread.isDaemon());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void schedulerThreadIsNamedDaemon() throws Exception {
        final ScheduledExecutorService scheduler = KestrelExecutors.newScheduler();
        try {
            final Thread thread = scheduler.schedule(Thread::currentThread, 1, TimeUnit.MILLISECONDS)
                    .get(5, TimeUnit.SECONDS);

            assertTrue(thread.getName().startsWith("kestrel-scheduler-"), thread.getName());
            assertTrue(thread.isDaemon());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void rejectsEmptyCpuPool() {
        assertThrows(IllegalArgumentException.class, () -> KestrelExecutors.newCpuBoundExecutor(0));
    }
}
