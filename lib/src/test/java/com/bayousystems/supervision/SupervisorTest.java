package com.bayousystems.supervision;

import com.bayousystems.ErrorKind;
import com.bayousystems.ExitReason;
import com.bayousystems.FatalWorkerFault;
import com.bayousystems.RestartBudgetExceededException;
import com.bayousystems.Task;
import com.bayousystems.TaskHandle;
import com.bayousystems.TaskResult;
import com.bayousystems.Worker;
import com.bayousystems.WorkerEvent;
import com.bayousystems.WorkerEventListener;
import com.bayousystems.WorkerException;
import com.bayousystems.pool.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SupervisorTest {

    private static final RestartPolicy IMMEDIATE = new RestartPolicy(3, Duration.ofMinutes(1), BackoffStrategy.none());

    private final List<Supervisor> supervisors = new ArrayList<>();
    private final List<Worker<String, String>> workers = new ArrayList<>();
    private final List<WorkerPool<String, String>> pools = new ArrayList<>();

    @AfterEach
    void tearDown() {
        supervisors.forEach(Supervisor::stop);
        workers.forEach(Worker::stop);
        pools.forEach(WorkerPool::stop);
    }

    private Worker<String, String> worker(String id, AtomicInteger incarnations) {
        Worker<String, String> worker = Worker.<String, String>builder(id, () -> {
            incarnations.incrementAndGet();
            return task -> {
                if (task.payload().equals("crash")) {
                    throw new FatalWorkerFault("crashed on purpose");
                }
                if (task.payload().equals("fail")) {
                    throw new IllegalStateException("failed on purpose");
                }
                if (task.payload().equals("slow")) {
                    Thread.sleep(300);
                }
                return task.payload();
            };
        }).build();
        workers.add(worker);
        return worker;
    }

    private Worker<String, String> worker(String id) {
        return worker(id, new AtomicInteger());
    }

    private Supervisor supervisor(Supervisor.Builder builder) {
        Supervisor supervisor = builder.start();
        supervisors.add(supervisor);
        return supervisor;
    }

    @Test
    @Timeout(10)
    void testFatalWorkerIsRestartedWithFreshHandler() throws Exception {
        AtomicInteger incarnations = new AtomicInteger();
        Worker<String, String> worker = worker("restartable", incarnations);
        Supervisor supervisor = supervisor(Supervisor.builder("sup").withRestartPolicy(IMMEDIATE));
        supervisor.supervise(worker);
        worker.start();

        assertFalse(worker.submit(Task.of("crash")).await(Duration.ofSeconds(5)).isSuccess());
        awaitCondition(() -> supervisor.restartCount("restartable") == 1 && !worker.isTerminated(), 5000,
                "Worker should be restarted");

        assertEquals("after", worker.submit(Task.of("after")).get(Duration.ofSeconds(5)));
        assertEquals(2, incarnations.get());
        assertEquals(1, worker.getRestartCount());
        assertFalse(supervisor.isPermanentlyFailed("restartable"));
    }

    @Test
    @Timeout(10)
    @SuppressWarnings("unchecked")
    void testRestartBudgetExceededMarksPermanentFailure() throws Exception {
        Consumer<WorkerException> fatalHandler = mock(Consumer.class);
        WorkerEventListener observer = mock(WorkerEventListener.class);
        Worker<String, String> worker = worker("doomed");
        List<TaskHandle<String>> handles = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            handles.add(worker.submit(Task.of("crash")));
        }

        Supervisor supervisor = supervisor(Supervisor.builder("budget")
                .withRestartPolicy(IMMEDIATE)
                .onFatal(fatalHandler));
        supervisor.addEventListener(observer);
        supervisor.supervise(worker);
        worker.start();

        verify(fatalHandler, timeout(5000)).accept(argThat(e -> e instanceof RestartBudgetExceededException));
        verify(observer, timeout(5000)).onEvent(argThat(event -> event instanceof WorkerEvent.Exited exited
                && exited.reason() == ExitReason.RESTART_BUDGET_EXCEEDED
                && exited.sourceId().equals("budget")));

        assertTrue(supervisor.isPermanentlyFailed("doomed"));
        assertEquals(3, supervisor.restartCount("doomed"));
        assertTrue(worker.isTerminated());
        for (TaskHandle<String> handle : handles) {
            TaskResult.Failure<?> failure = assertInstanceOf(TaskResult.Failure.class, handle.await());
            assertEquals(ErrorKind.WORKER_FATAL_FAULT, failure.errorKind());
        }
    }

    @Test
    @Timeout(10)
    void testRestartWindowSlides() throws Exception {
        AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(inv -> now.get());

        Worker<String, String> worker = worker("sliding");
        Supervisor supervisor = supervisor(Supervisor.builder("window")
                .withRestartPolicy(new RestartPolicy(1, Duration.ofSeconds(10), BackoffStrategy.none()))
                .withClock(clock));
        supervisor.supervise(worker);
        worker.start();

        worker.submit(Task.of("crash")).await();
        awaitCondition(() -> supervisor.restartCount("sliding") == 1 && !worker.isTerminated(), 5000,
                "First crash should be restarted");

        now.set(now.get().plusSeconds(11));
        worker.submit(Task.of("crash")).await();
        awaitCondition(() -> supervisor.restartCount("sliding") == 2 && !worker.isTerminated(), 5000,
                "Crash outside the window should be restarted");

        worker.submit(Task.of("crash")).await();
        awaitCondition(() -> supervisor.isPermanentlyFailed("sliding"), 5000,
                "Second crash within the window should exceed the budget");
        assertEquals(2, supervisor.restartCount("sliding"));
    }

    @Test
    @Timeout(10)
    void testRequestedExitsAreNotRestarted() throws Exception {
        Worker<String, String> stopped = worker("stopped");
        Worker<String, String> drained = worker("drained");
        Worker<String, String> crashing = worker("crashing");
        Supervisor supervisor = supervisor(Supervisor.builder("requested").withRestartPolicy(IMMEDIATE));
        supervisor.supervise(stopped);
        supervisor.supervise(drained);
        supervisor.supervise(crashing);
        stopped.start();
        drained.start();
        crashing.start();

        stopped.stop();
        drained.shutdownGraceful().get(5, TimeUnit.SECONDS);
        crashing.submit(Task.of("crash"));

        // the supervisor handles events in order, so the crash restart comes after both exits
        awaitCondition(() -> supervisor.restartCount("crashing") == 1, 5000, "Crash should be restarted");
        assertEquals(0, supervisor.restartCount("stopped"));
        assertEquals(0, supervisor.restartCount("drained"));
        assertTrue(stopped.isTerminated());
        assertTrue(drained.isTerminated());
    }

    @Test
    @Timeout(10)
    void testResumeStrategyKeepsWorkerRunning() throws Exception {
        AtomicInteger incarnations = new AtomicInteger();
        Worker<String, String> worker = worker("resilient", incarnations);
        Worker<String, String> marker = worker("marker");
        Supervisor supervisor = supervisor(Supervisor.builder("resume")
                .withRestartPolicy(IMMEDIATE)
                .withTaskErrorStrategy(SupervisionStrategy.RESUME));
        supervisor.supervise(worker);
        supervisor.supervise(marker);
        AtomicBoolean errored = new AtomicBoolean();
        worker.addEventListener(event -> {
            if (event instanceof WorkerEvent.Errored) {
                errored.set(true);
            }
        });
        worker.start();
        marker.start();

        worker.submit(Task.of("fail")).await();
        awaitCondition(errored::get, 5000, "Errored event expected");
        marker.submit(Task.of("crash"));
        awaitCondition(() -> supervisor.restartCount("marker") == 1, 5000, "Marker should be restarted");

        assertEquals(0, supervisor.restartCount("resilient"));
        assertEquals(1, incarnations.get());
        assertEquals("ok", worker.submit(Task.of("ok")).get(Duration.ofSeconds(5)));
    }

    @Test
    @Timeout(10)
    void testRestartStrategyRestartsOnTaskFailure() throws Exception {
        AtomicInteger incarnations = new AtomicInteger();
        Worker<String, String> worker = worker("fragile", incarnations);
        Supervisor supervisor = supervisor(Supervisor.builder("restart")
                .withRestartPolicy(IMMEDIATE)
                .withTaskErrorStrategy(SupervisionStrategy.RESTART));
        supervisor.supervise(worker);
        worker.start();

        worker.submit(Task.of("fail")).await();
        awaitCondition(() -> supervisor.restartCount("fragile") == 1, 5000, "Task failure should restart");
        awaitCondition(() -> incarnations.get() == 2, 5000, "Restart should create a new handler");
        assertEquals("ok", worker.submit(Task.of("ok")).get(Duration.ofSeconds(5)));
    }

    @Test
    @Timeout(10)
    void testRestartStrategyLetsFollowingTaskFinish() throws Exception {
        AtomicInteger incarnations = new AtomicInteger();
        Worker<String, String> worker = worker("bystander", incarnations);
        Supervisor supervisor = supervisor(Supervisor.builder("restart-busy")
                .withRestartPolicy(IMMEDIATE)
                .withTaskErrorStrategy(SupervisionStrategy.RESTART));
        supervisor.supervise(worker);
        worker.start();

        TaskHandle<String> failing = worker.submit(Task.of("fail"));
        TaskHandle<String> slow = worker.submit(Task.of("slow"));

        assertFalse(failing.await(Duration.ofSeconds(5)).isSuccess());
        assertEquals("slow", slow.get(Duration.ofSeconds(5)));
        awaitCondition(() -> supervisor.restartCount("bystander") == 1, 5000, "Task failure should restart");
        awaitCondition(() -> incarnations.get() == 2, 5000, "Restart should create a new handler");
        assertEquals(0, worker.getMetrics().abandoned());
        assertEquals("after", worker.submit(Task.of("after")).get(Duration.ofSeconds(5)));
    }

    @Test
    @Timeout(10)
    void testStopStrategyStopsWorkerOnTaskFailure() throws Exception {
        Worker<String, String> worker = worker("strict");
        Supervisor supervisor = supervisor(Supervisor.builder("stop")
                .withRestartPolicy(IMMEDIATE)
                .withTaskErrorStrategy(SupervisionStrategy.STOP));
        supervisor.supervise(worker);
        worker.start();

        worker.submit(Task.of("fail")).await();
        awaitCondition(worker::isTerminated, 5000, "Worker should be stopped");
        assertEquals(0, supervisor.restartCount("strict"));
        assertFalse(worker.isAcceptingWork());
    }

    @Test
    @Timeout(10)
    @SuppressWarnings("unchecked")
    void testEscalateStrategyRaisesToObservers() throws Exception {
        Consumer<WorkerException> fatalHandler = mock(Consumer.class);
        WorkerEventListener observer = mock(WorkerEventListener.class);
        Worker<String, String> worker = worker("escalating");
        Supervisor supervisor = supervisor(Supervisor.builder("escalate")
                .withRestartPolicy(IMMEDIATE)
                .withTaskErrorStrategy(SupervisionStrategy.ESCALATE)
                .onFatal(fatalHandler));
        supervisor.addEventListener(observer);
        supervisor.supervise(worker);
        worker.start();

        worker.submit(Task.of("fail")).await();

        verify(fatalHandler, timeout(5000)).accept(argThat(e -> e.getErrorKind() == ErrorKind.TASK_EXECUTION_FAILURE
                && "escalating".equals(e.getSourceId())
                && e.getCause() instanceof IllegalStateException));
        verify(observer, timeout(5000)).onEvent(argThat(event -> event instanceof WorkerEvent.Exited exited
                && exited.reason() == ExitReason.ESCALATED));
        assertEquals(0, supervisor.restartCount("escalating"));
    }

    @Test
    @Timeout(10)
    void testParentRestartsChildSupervisorThatGaveUp() throws Exception {
        AtomicInteger incarnations = new AtomicInteger();
        Worker<String, String> worker = worker("leaf", incarnations);
        Supervisor child = Supervisor.builder("child")
                .withRestartPolicy(new RestartPolicy(0, Duration.ofMinutes(1), BackoffStrategy.none()))
                .start();
        supervisors.add(child);
        Supervisor parent = supervisor(Supervisor.builder("parent").withRestartPolicy(IMMEDIATE));
        child.supervise(worker);
        parent.supervise(child);
        worker.start();

        worker.submit(Task.of("crash"));

        awaitCondition(() -> parent.restartCount("child") == 1, 5000, "Parent should restart the child");
        awaitCondition(() -> !worker.isTerminated() && !child.isPermanentlyFailed("leaf"), 5000,
                "Child restart should restart its worker");
        assertEquals("ok", worker.submit(Task.of("ok")).get(Duration.ofSeconds(5)));
        assertEquals(2, incarnations.get());
        assertEquals(0, child.restartCount("leaf"));
    }

    @Test
    @Timeout(10)
    void testSupervisesPoolMembership() throws Exception {
        WorkerPool<String, String> pool = WorkerPool.<String, String>builder("supervised", () -> task -> {
            if (task.payload().equals("crash")) {
                throw new FatalWorkerFault("crashed on purpose");
            }
            return task.payload();
        }).withSize(2).build();
        pools.add(pool);
        Supervisor supervisor = supervisor(Supervisor.builder("pool-sup").withRestartPolicy(IMMEDIATE));
        supervisor.supervise(pool);

        assertEquals(Set.of("supervised-worker-0", "supervised-worker-1"), Set.copyOf(supervisor.supervisedIds()));

        pool.resize(3);
        assertTrue(supervisor.supervisedIds().contains("supervised-worker-2"));

        TaskHandle<String> crash = pool.submit(Task.of("crash"));
        assertEquals("supervised-worker-0", crash.workerId());
        awaitCondition(() -> supervisor.restartCount("supervised-worker-0") == 1, 5000,
                "Pool worker should be restarted");

        pool.resize(1);
        assertEquals(List.of("supervised-worker-0"), supervisor.supervisedIds());

        supervisor.unsupervise(pool);
        assertTrue(supervisor.supervisedIds().isEmpty());
    }

    @Test
    @Timeout(10)
    void testStoppingSupervisorStopsEntities() throws Exception {
        WorkerEventListener observer = mock(WorkerEventListener.class);
        Worker<String, String> worker = worker("owned");
        Supervisor supervisor = supervisor(Supervisor.builder("owner").withRestartPolicy(IMMEDIATE));
        supervisor.addEventListener(observer);
        supervisor.supervise(worker);
        worker.start();

        supervisor.stop();

        assertTrue(supervisor.isTerminated());
        assertTrue(worker.isTerminated());
        verify(observer).onEvent(argThat(event -> event instanceof WorkerEvent.Exited exited
                && exited.reason() == ExitReason.STOPPED));
    }

    @Test
    void testSupervisorRejectsDuplicateAndSelf() {
        Worker<String, String> worker = worker("once");
        Supervisor supervisor = supervisor(Supervisor.builder("dupes"));
        supervisor.supervise(worker);

        assertThrows(IllegalArgumentException.class, () -> supervisor.supervise(worker));
        assertThrows(IllegalArgumentException.class, () -> supervisor.supervise(supervisor));
    }

    private static void awaitCondition(BooleanSupplier condition, long timeoutMillis, String failureMessage)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(10);
        }
        if (!condition.getAsBoolean()) {
            throw new AssertionError(failureMessage);
        }
    }
}
