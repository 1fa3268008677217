package com.javis.orchestrator;

import com.javis.agents.AgentRegistry;
import com.javis.agents.Capability;
import com.javis.memory.HashingEmbeddingProvider;
import com.javis.memory.InMemoryMemoryStore;
import com.javis.memory.MemoryStore;
import com.javis.shared.config.OrchestratorConfig;
import com.javis.shared.model.ErrorKind;
import com.javis.shared.model.Priority;
import com.javis.shared.model.Result;
import com.javis.shared.model.Task;
import com.javis.shared.model.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DefaultTaskOrchestratorTest {

    private final AgentRegistry registry = new AgentRegistry();
    private final InMemoryMemoryStore memory = new InMemoryMemoryStore(new HashingEmbeddingProvider(64));
    private DefaultTaskOrchestrator orchestrator;

    private static OrchestratorConfig config(int workers, int ceiling) {
        return OrchestratorConfig.defaults()
                .withMaxConcurrency(workers)
                .withRetryCeiling(ceiling)
                .withBackoff(1, 5);
    }

    private DefaultTaskOrchestrator start(OrchestratorConfig config) {
        orchestrator = new DefaultTaskOrchestrator(registry, memory, config);
        return orchestrator;
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) orchestrator.close();
    }

    /** Occupies a worker until {@code release} is counted down. */
    private ScriptedAgent blocker(CountDownLatch started, CountDownLatch release) {
        return new ScriptedAgent("blocker", Set.of("block"), (task, c) -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return Result.success(task.id(), Map.of());
        });
    }

    @Test
    void scannerScenarioSucceedsAndIsRemembered() {
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        start(config(2, 3));

        var task = new Task("port_scan", Priority.HIGH, Map.of("target", "10.0.0.5"));
        var result = orchestrator.submit(task);

        assertTrue(result.success());
        assertEquals("scanner", result.agentId());
        assertEquals(TaskStatus.SUCCEEDED, task.status());
        var records = memory.search("port_scan", 5, Map.of("type", "task", "task_type", "port_scan"));
        assertEquals(1, records.size());
        var meta = records.get(0).metadata();
        assertEquals("scanner", meta.get("agent"));
        assertEquals(task.id(), meta.get("task_id"));
        assertEquals("HIGH", meta.get("priority"));
        assertEquals("10.0.0.5", meta.get("target"));
    }

    @Test
    void unroutableTaskFailsWithoutAttempt() {
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        start(config(1, 3));

        var task = Task.of("weather", Priority.NORMAL);
        var result = orchestrator.submit(task);

        assertFalse(result.success());
        assertEquals(ErrorKind.NO_CAPABLE_AGENT, result.errorKind());
        assertEquals(0, result.attempts());
        assertEquals(0, task.attempts());
        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals(0, memory.size());
    }

    @Test
    void requiredCapabilityRestrictsRouting() {
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        start(config(1, 3));
        var task = new Task("port_scan", Priority.NORMAL, Map.of(), null, "containers");
        assertEquals(ErrorKind.NO_CAPABLE_AGENT, orchestrator.submit(task).errorKind());
    }

    @Test
    void alwaysFailingAgentStopsAtCeiling() {
        var broken = ScriptedAgent.failing("scanner", "port_scan");
        registry.register(broken);
        start(config(1, 3));

        var task = Task.of("port_scan", Priority.NORMAL);
        var result = orchestrator.submit(task);

        assertFalse(result.success());
        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals(3, task.attempts());
        assertEquals(3, result.attempts());
        assertEquals(3, broken.calls.get());
        assertEquals(ErrorKind.RETRY_EXHAUSTED, result.errorKind());
        assertEquals(ErrorKind.AGENT_EXECUTION, result.error().cause().kind());
        assertTrue(result.error().rootCause().message().contains("scanner is broken"));
    }

    @Test
    void ceilingOfOneReportsTheErrorItself() {
        registry.register(ScriptedAgent.failing("scanner", "port_scan"));
        start(config(1, 1));

        var result = orchestrator.submit(Task.of("port_scan", Priority.NORMAL));
        assertEquals(ErrorKind.AGENT_EXECUTION, result.errorKind());
        assertEquals(1, result.attempts());
        assertNull(result.error().cause());
    }

    @Test
    void agentErrorFailsTaskAndWorkerKeepsServing() {
        registry.register(new ScriptedAgent("boom", Set.of("explode"), (task, c) -> {
            throw new AssertionError("agent bug");
        }));
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        start(config(1, 1));

        var broken = orchestrator.submit(Task.of("explode", Priority.NORMAL), Duration.ofSeconds(2));
        assertEquals(ErrorKind.AGENT_EXECUTION, broken.errorKind());
        assertTrue(broken.error().message().contains("agent bug"));

        var next = orchestrator.submit(Task.of("port_scan", Priority.NORMAL), Duration.ofSeconds(2));
        assertTrue(next.success());
        assertEquals(0, orchestrator.status().running());
    }

    @Test
    void failureMovesOnToNextCandidate() {
        var primary = ScriptedAgent.failing("primary", "port_scan");
        var secondary = ScriptedAgent.succeeding("secondary", "port_scan");
        registry.register(secondary);
        registry.register(primary, 10);
        start(config(1, 3));

        var result = orchestrator.submit(Task.of("port_scan", Priority.NORMAL));

        assertTrue(result.success());
        assertEquals("secondary", result.agentId());
        assertEquals(2, result.attempts());
        assertEquals(1, primary.calls.get());
        assertEquals(1, secondary.calls.get());
    }

    @Test
    void failureResultIsRetriedOnSameAgentAfterBackoff() {
        var flaky = new ScriptedAgent("flaky", Set.of("docker"), (task, c) ->
                task.attempts() == 0
                        ? Result.failure(task.id(), ErrorKind.AGENT_EXECUTION, "daemon not ready")
                        : Result.success(task.id(), Map.of("message", "ok")));
        registry.register(flaky);
        start(config(1, 3));

        var result = orchestrator.submit(Task.of("docker", Priority.NORMAL));
        assertTrue(result.success());
        assertEquals(2, result.attempts());
        assertEquals(2, flaky.calls.get());
    }

    @Test
    void higherPriorityStartsFirstOnSingleWorker() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var order = new CopyOnWriteArrayList<String>();
        registry.register(blocker(started, release));
        registry.register(new ScriptedAgent("worker", Set.of("job"), (task, c) -> {
            order.add(task.description());
            return Result.success(task.id(), Map.of());
        }));
        start(config(1, 3));

        var blocking = orchestrator.submitAsync(Task.of("block", Priority.CRITICAL));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        var a = orchestrator.submitAsync(new Task("job", Priority.LOW, Map.of(), "A", null));
        var b = orchestrator.submitAsync(new Task("job", Priority.HIGH, Map.of(), "B", null));
        release.countDown();

        assertTrue(a.get(5, TimeUnit.SECONDS).success());
        assertTrue(b.get(5, TimeUnit.SECONDS).success());
        assertTrue(blocking.get(5, TimeUnit.SECONDS).success());
        assertEquals(List.of("B", "A"), order);
    }

    @Test
    void samePriorityKeepsSubmissionOrder() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var order = new CopyOnWriteArrayList<String>();
        registry.register(blocker(started, release));
        registry.register(new ScriptedAgent("worker", Set.of("job"), (task, c) -> {
            order.add(task.description());
            return Result.success(task.id(), Map.of());
        }));
        start(config(1, 3));

        orchestrator.submitAsync(Task.of("block", Priority.NORMAL));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        var futures = List.of("1", "2", "3").stream()
                .map(d -> orchestrator.submitAsync(new Task("job", Priority.NORMAL, Map.of(), d, null)))
                .toList();
        release.countDown();
        for (var f : futures) f.get(5, TimeUnit.SECONDS);

        assertEquals(List.of("1", "2", "3"), order);
    }

    @Test
    void cancellingQueuedTaskNeverInvokesAgent() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        registry.register(blocker(started, release));
        var scanner = ScriptedAgent.succeeding("scanner", "port_scan");
        registry.register(scanner);
        start(config(1, 3));

        orchestrator.submitAsync(Task.of("block", Priority.NORMAL));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        var task = Task.of("port_scan", Priority.HIGH);
        var future = orchestrator.submitAsync(task);

        assertTrue(orchestrator.cancel(task.id()));
        assertFalse(orchestrator.cancel(task.id()));
        release.countDown();

        var result = future.get(5, TimeUnit.SECONDS);
        assertEquals(ErrorKind.CANCELLED, result.errorKind());
        assertEquals(TaskStatus.CANCELLED, task.status());
        assertEquals(0, scanner.calls.get());
    }

    @Test
    void cancellingRunningTaskSignalsTokenAndDiscardsLateResult() throws Exception {
        var running = new CountDownLatch(1);
        var sawCancel = new CountDownLatch(1);
        registry.register(new ScriptedAgent("slow", Set.of("audit"), (task, token) -> {
            running.countDown();
            while (!token.isCancelled()) Thread.sleep(5);
            sawCancel.countDown();
            return Result.success(task.id(), Map.of("message", "finished anyway"));
        }));
        start(config(1, 3));

        var task = Task.of("audit", Priority.NORMAL);
        var future = orchestrator.submitAsync(task);
        assertTrue(running.await(5, TimeUnit.SECONDS));
        assertTrue(orchestrator.cancel(task.id()));

        var result = future.get(5, TimeUnit.SECONDS);
        assertTrue(sawCancel.await(5, TimeUnit.SECONDS));
        assertEquals(ErrorKind.CANCELLED, result.errorKind());
        // give the worker time to hand back its late result
        Thread.sleep(50);
        assertEquals(TaskStatus.CANCELLED, task.status());
        assertEquals(0, memory.size());
    }

    @Test
    void deadlineCancelsWithTimeout() {
        registry.register(new ScriptedAgent("hang", Set.of("audit"), (task, token) -> {
            while (!token.isCancelled()) Thread.sleep(5);
            return Result.success(task.id(), Map.of());
        }));
        start(config(1, 3));

        var task = Task.of("audit", Priority.NORMAL);
        var result = orchestrator.submit(task, Duration.ofMillis(100));

        assertFalse(result.success());
        assertEquals(ErrorKind.TIMEOUT, result.errorKind());
        assertTrue(result.cancelled());
        assertEquals(TaskStatus.CANCELLED, task.status());
    }

    @Test
    void concurrencyIsBounded() {
        var current = new AtomicInteger();
        var peak = new AtomicInteger();
        registry.register(new ScriptedAgent("busy", Set.of("job"), (task, c) -> {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(30);
            current.decrementAndGet();
            return Result.success(task.id(), Map.of());
        }));
        start(config(2, 1));

        var tasks = IntStream.range(0, 8)
                .mapToObj(i -> Task.of("job", Priority.NORMAL)).toList();
        var results = orchestrator.submitAll(tasks);

        assertTrue(results.stream().allMatch(Result::success));
        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
    }

    @Test
    void submitAllKeepsInputOrder() {
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        registry.register(ScriptedAgent.succeeding("devops", "docker"));
        start(config(4, 1));

        var tasks = List.of(Task.of("docker", Priority.LOW), Task.of("weather", Priority.HIGH),
                Task.of("port_scan", Priority.CRITICAL));
        var results = orchestrator.submitAll(tasks);

        assertEquals(3, results.size());
        for (int i = 0; i < tasks.size(); i++) {
            assertEquals(tasks.get(i).id(), results.get(i).taskId());
        }
        assertEquals(ErrorKind.NO_CAPABLE_AGENT, results.get(1).errorKind());
    }

    @Test
    void memoryFailureDoesNotFailTask() {
        var brokenMemory = mock(MemoryStore.class);
        when(brokenMemory.add(anyString(), any())).thenThrow(new IllegalStateException("disk full"));
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        orchestrator = new DefaultTaskOrchestrator(registry, brokenMemory, config(1, 3));

        assertTrue(orchestrator.submit(Task.of("port_scan", Priority.NORMAL)).success());
        verify(brokenMemory).add(anyString(), any());
    }

    @Test
    void closedOrchestratorCancelsNewSubmissions() {
        var scanner = ScriptedAgent.succeeding("scanner", "port_scan");
        registry.register(scanner);
        start(config(1, 3)).close();

        var task = Task.of("port_scan", Priority.NORMAL);
        var result = orchestrator.submit(task);
        assertEquals(ErrorKind.CANCELLED, result.errorKind());
        assertEquals(TaskStatus.CANCELLED, task.status());
        assertEquals(0, scanner.calls.get());
        assertTrue(orchestrator.status().closed());
    }

    @Test
    void closeDrainsInFlightWork() throws Exception {
        var started = new CountDownLatch(1);
        registry.register(new ScriptedAgent("slow", Set.of("job"), (task, c) -> {
            started.countDown();
            Thread.sleep(100);
            return Result.success(task.id(), Map.of());
        }));
        start(config(1, 1));

        var future = orchestrator.submitAsync(Task.of("job", Priority.NORMAL));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        orchestrator.close();

        assertTrue(future.get(1, TimeUnit.SECONDS).success());
    }

    @Test
    void closeInterruptsBlockedAgentAndStopsPromptly() throws Exception {
        var started = new CountDownLatch(1);
        var interrupted = new CountDownLatch(1);
        registry.register(new ScriptedAgent("stuck", Set.of("job"), (task, c) -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return Result.success(task.id(), Map.of());
        }));
        var noGrace = new OrchestratorConfig(1, 1, 1, 5, 120, 30, 0);
        start(noGrace);

        var future = orchestrator.submitAsync(Task.of("job", Priority.NORMAL));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        long begin = System.nanoTime();
        orchestrator.close();
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(interrupted.await(1, TimeUnit.SECONDS));
        assertTrue(tookMs < 3000, "close took " + tookMs + " ms");
        assertEquals(ErrorKind.CANCELLED, future.get(1, TimeUnit.SECONDS).errorKind());
    }

    @Test
    void finishedTasksStayFindable() {
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        start(config(1, 3));

        var task = Task.of("port_scan", Priority.NORMAL);
        orchestrator.submit(task);
        orchestrator.submit(Task.of("weather", Priority.NORMAL));

        assertSame(task, orchestrator.find(task.id()).orElseThrow());
        assertTrue(orchestrator.find("no-such-task").isEmpty());
        var status = orchestrator.status();
        assertEquals(1, status.succeeded());
        assertEquals(1, status.failed());
        assertEquals(0, status.active());
        assertEquals(2, status.retained());
    }

    @Test
    void taskCannotBeSubmittedTwice() {
        registry.register(ScriptedAgent.succeeding("scanner", "port_scan"));
        start(config(1, 3));
        var task = Task.of("port_scan", Priority.NORMAL);
        orchestrator.submit(task);
        assertThrows(IllegalStateException.class, () -> orchestrator.submit(task));
    }

    @Test
    void capabilityNameIsUsedForRouting() {
        registry.register(new ScriptedAgent("net", Set.of("port_scan"),
                (task, c) -> Result.success(task.id(), Map.of())));
        start(config(1, 1));
        var task = new Task("port_scan", Priority.NORMAL, Map.of(), null, "net-capability");
        assertTrue(orchestrator.submit(task).success());
        assertTrue(registry.capabilitiesOf("net").contains(new Capability("net-capability", Set.of("port_scan"))));
    }
}
