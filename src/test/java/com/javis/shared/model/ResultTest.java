package com.javis.shared.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void dataMayHoldNullValues() {
        var data = new HashMap<String, Object>();
        data.put("port", null);
        var result = Result.success("t1", data);
        assertTrue(result.data().containsKey("port"));
        assertNull(result.errorKind());
    }

    @Test
    void timeoutCountsAsCancelled() {
        var result = Result.failure("t1", ErrorKind.TIMEOUT, "too slow");
        assertTrue(result.cancelled());
        assertFalse(Result.failure("t1", ErrorKind.AGENT_EXECUTION, "boom").cancelled());
    }

    @Test
    void withExecutionKeepsOutcome() {
        var result = Result.failure("t1", ErrorKind.AGENT_EXECUTION, "boom")
                .withExecution(Duration.ofMillis(20), 2, "scanner");
        assertEquals(ErrorKind.AGENT_EXECUTION, result.errorKind());
        assertEquals(2, result.attempts());
        assertEquals("scanner", result.agentId());
        assertEquals(Duration.ofMillis(20), result.duration());
    }

    @Test
    void rootCauseFollowsChain() {
        var last = new TaskError(ErrorKind.AGENT_EXECUTION, "connection refused");
        var error = new TaskError(ErrorKind.RETRY_EXHAUSTED, "gave up", last);
        assertSame(last, error.rootCause());
        assertTrue(error.toString().contains("connection refused"));
    }

    @Test
    void intentClampsConfidence() {
        assertEquals(1.0, new Intent("x", 3.2, null).confidence());
        assertEquals(0.0, new Intent("x", -1, null).confidence());
        assertEquals(0.0, new Intent("x", Double.NaN, null).confidence());
        assertTrue(new Intent(null, 0.5, null).isUnknown());
        assertNull(new Intent("docker", 0.9, null).errorKind());
    }
}
