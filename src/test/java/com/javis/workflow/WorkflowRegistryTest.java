package com.javis.workflow;

import com.javis.orchestrator.WorkflowStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowRegistryTest {

    private static WorkflowDefinition definition(String name, String trigger) {
        return new WorkflowDefinition(name, trigger, null, Map.of(), List.of(WorkflowStep.of("s", "docker")));
    }

    @Test
    void matchesOnFirstWordOnly() {
        var registry = new WorkflowRegistry();
        registry.register(definition("Audit", "audit"));

        assertEquals("Audit", registry.match("/audit prod cluster").name());
        assertEquals("Audit", registry.match("/audit").name());
        assertNull(registry.match("/auditing"));
        assertNull(registry.match("audit now"));
        assertNull(registry.match(null));
    }

    @Test
    void argumentIsTextAfterTrigger() {
        assertEquals("10.0.0.5 fast", WorkflowRegistry.argument("/pentest  10.0.0.5 fast "));
        assertEquals("", WorkflowRegistry.argument("/pentest"));
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        var registry = new WorkflowRegistry();
        registry.register(definition("Bundled", "/audit"));
        registry.register(definition("Custom", "audit"));

        assertEquals(1, registry.all().size());
        assertEquals("Custom", registry.match("/audit").name());
    }
}
