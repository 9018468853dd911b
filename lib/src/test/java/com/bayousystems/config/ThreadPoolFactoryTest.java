package com.bayousystems.config;

import com.bayousystems.Task;
import com.bayousystems.Worker;
import com.bayousystems.mailbox.config.MailboxConfig;
import com.bayousystems.mailbox.config.MailboxOrdering;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Thread naming and worker configuration defaults.
 */
class ThreadPoolFactoryTest {

    @Test
    void testWorkerThreadIsNamedAfterWorker() throws Exception {
        Worker<String, String> worker = Worker.<String, String>builder("named-worker",
                () -> task -> Thread.currentThread().getName()).start();
        try {
            String threadName = worker.submit(Task.of("capture")).get(Duration.ofSeconds(5));
            assertTrue(threadName.startsWith("bayou-named-worker-"), "Unexpected thread name: " + threadName);
        } finally {
            worker.stop();
        }
    }

    @Test
    void testCustomPrefixAndDaemonFlag() {
        ThreadPoolFactory factory = new ThreadPoolFactory()
                .setThreadNamePrefix("custom")
                .setDaemon(false);
        ThreadFactory threadFactory = factory.createThreadFactory("owner");

        Thread first = threadFactory.newThread(() -> { });
        Thread second = threadFactory.newThread(() -> { });

        assertEquals("custom-owner-1", first.getName());
        assertEquals("custom-owner-2", second.getName());
        assertFalse(first.isDaemon());
    }

    @Test
    void testUnnamedThreads() {
        ThreadPoolFactory factory = new ThreadPoolFactory().setUseNamedThreads(false);
        Thread thread = factory.createThreadFactory("owner").newThread(() -> { });
        assertFalse(thread.getName().contains("owner"));
        assertTrue(thread.isDaemon());
    }

    @Test
    void testScheduledExecutorRunsTasks() throws Exception {
        ScheduledExecutorService scheduler = new ThreadPoolFactory().createScheduledExecutorService("sup");
        try {
            String name = scheduler.schedule(() -> Thread.currentThread().getName(), 10, TimeUnit.MILLISECONDS)
                    .get(5, TimeUnit.SECONDS);
            assertTrue(name.startsWith("bayou-sup-scheduler-"), "Unexpected thread name: " + name);
        } finally {
            scheduler.shutdownNow();
        }
        assertThrows(IllegalArgumentException.class, () -> new ThreadPoolFactory().setSchedulerThreads(0));
    }

    @Test
    void testWorkerConfigDefaultsAndCopy() {
        WorkerConfig config = new WorkerConfig();
        assertFalse(config.isBounded());
        assertEquals(MailboxOrdering.PRIORITY, config.getOrdering());
        assertEquals(OverflowPolicy.BLOCK, config.getOverflowPolicy());
        assertEquals(WorkerConfig.DEFAULT_BLOCK_TIMEOUT, config.getBlockTimeout());

        config.setMailboxCapacity(8).setOrdering(MailboxOrdering.FIFO).setOverflowPolicy(OverflowPolicy.FAIL);
        WorkerConfig copy = config.copy();
        config.setMailboxCapacity(99);

        assertEquals(8, copy.getMailboxCapacity());
        assertEquals(MailboxOrdering.FIFO, copy.getOrdering());
        assertEquals(OverflowPolicy.FAIL, copy.getOverflowPolicy());

        MailboxConfig mailboxConfig = copy.toMailboxConfig();
        assertEquals(8, mailboxConfig.getCapacity());
        assertEquals(MailboxOrdering.FIFO, mailboxConfig.getOrdering());

        assertThrows(IllegalArgumentException.class, () -> config.setMailboxCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> config.setBlockTimeout(Duration.ofMillis(-1)));
    }
}
