package com.bayousystems.test;

import com.bayousystems.Task;
import com.bayousystems.TaskHandler;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyProbeTest {

    @Test
    void shouldTrackOverlappingInvocations() throws Exception {
        ConcurrencyProbe probe = new ConcurrencyProbe();
        CountDownLatch bothInside = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        TaskHandler<String, String> handler = probe.wrap(task -> {
            bothInside.countDown();
            release.await();
            return task.payload();
        });

        Thread first = new Thread(() -> invoke(handler, "a"));
        Thread second = new Thread(() -> invoke(handler, "b"));
        first.start();
        second.start();

        assertTrue(bothInside.await(5, TimeUnit.SECONDS));
        assertEquals(2, probe.active());
        release.countDown();
        first.join(5000);
        second.join(5000);

        assertEquals(0, probe.active());
        assertEquals(2, probe.maxObserved());
        assertEquals(2, probe.invocations());

        probe.reset();
        assertEquals(0, probe.maxObserved());
        assertEquals(0, probe.invocations());
    }

    @Test
    void shouldReleaseSlotWhenHandlerThrows() {
        ConcurrencyProbe probe = new ConcurrencyProbe();
        TaskHandler<String, String> handler = probe.wrap(task -> {
            throw new IllegalStateException("boom");
        });

        assertThrows(IllegalStateException.class, () -> handler.handle(Task.of("x")));
        assertEquals(0, probe.active());
        assertEquals(1, probe.maxObserved());
    }

    private static void invoke(TaskHandler<String, String> handler, String payload) {
        try {
            handler.handle(Task.of(payload));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
