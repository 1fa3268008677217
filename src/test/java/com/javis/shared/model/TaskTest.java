package com.javis.shared.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void newTaskIsPendingWithDefaults() {
        var task = new Task("port_scan", null, null);
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(Priority.NORMAL, task.priority());
        assertEquals(0, task.attempts());
        assertEquals("port_scan", task.description());
        assertTrue(task.payload().isEmpty());
        assertFalse(task.isDone());
    }

    @Test
    void idsAreUniquePerCreation() {
        assertNotEquals(Task.of("a", Priority.LOW).id(), Task.of("a", Priority.LOW).id());
    }

    @Test
    void rejectsBlankType() {
        assertThrows(IllegalArgumentException.class, () -> Task.of(" ", Priority.HIGH));
    }

    @Test
    void priorityParsesCaseInsensitively() {
        assertEquals(Priority.HIGH, Priority.parse(" high "));
        assertEquals(Priority.CRITICAL, Priority.parse("Critical"));
        assertEquals(Priority.NORMAL, Priority.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Priority.parse("urgent"));
    }

    @Test
    void payloadIsCopiedAndReadOnly() {
        var payload = new HashMap<String, Object>();
        payload.put("target", "10.0.0.1");
        var task = new Task("port_scan", Priority.HIGH, payload);
        payload.put("target", "changed");
        assertEquals("10.0.0.1", task.payload().get("target"));
        assertThrows(UnsupportedOperationException.class, () -> task.payload().put("x", 1));
    }

    @Test
    void retryCycleCountsAttempts() {
        var task = Task.of("t", Priority.NORMAL);
        task.start();
        task.failAttempt();
        assertEquals(TaskStatus.FAILED, task.status());
        assertFalse(task.isDone());
        task.start();
        task.succeed();
        assertEquals(TaskStatus.SUCCEEDED, task.status());
        assertEquals(1, task.attempts());
        assertTrue(task.isDone());
        assertNotNull(task.finishedAt());
    }

    @Test
    void illegalTransitionsAreRejected() {
        var task = Task.of("t", Priority.NORMAL);
        assertThrows(IllegalStateException.class, task::succeed);
        assertThrows(IllegalStateException.class, task::failAttempt);
        task.start();
        assertThrows(IllegalStateException.class, task::start);
        assertThrows(IllegalStateException.class, task::giveUp);
    }

    @Test
    void terminalStatusIsFinal() {
        var task = Task.of("t", Priority.NORMAL);
        assertTrue(task.cancel());
        assertEquals(TaskStatus.CANCELLED, task.status());
        assertFalse(task.cancel());
        assertThrows(IllegalStateException.class, task::start);
    }

    @Test
    void giveUpWithoutAttemptIsTerminalFailure() {
        var task = new Task("t", Priority.LOW, Map.of());
        task.giveUp();
        assertEquals(TaskStatus.FAILED, task.status());
        assertEquals(0, task.attempts());
        assertTrue(task.isDone());
    }
}
