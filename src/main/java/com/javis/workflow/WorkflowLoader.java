package com.javis.workflow;

import com.javis.orchestrator.WorkflowStep;
import com.javis.shared.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads workflow templates. The bundled {@code workflows.yaml} holds a list
 * under {@code workflows}; a user directory holds one template per file.
 * Unreadable or invalid user templates are skipped with a warning.
 */
public class WorkflowLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);
    private static final String DEFAULT_RESOURCE = "workflows.yaml";

    @SuppressWarnings("unchecked")
    public static List<WorkflowDefinition> loadDefaults() {
        try (var in = WorkflowLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) return List.of();
            Map<String, Object> raw = new Yaml().load(in);
            if (raw == null) return List.of();
            var entries = (List<Map<String, Object>>) raw.getOrDefault("workflows", List.of());
            return entries.stream().map(WorkflowLoader::parse).toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled " + DEFAULT_RESOURCE, e);
        }
    }

    public static List<WorkflowDefinition> loadFrom(Path dir) {
        if (!Files.isDirectory(dir)) return List.of();
        try (var stream = Files.list(dir)) {
            return stream
                .filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                .sorted()
                .map(WorkflowLoader::loadFile)
                .filter(d -> d != null)
                .toList();
        } catch (IOException e) {
            log.warn("Failed to scan workflows directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private static WorkflowDefinition loadFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return read(in);
        } catch (Exception e) {
            log.warn("Failed to load workflow from {}: {}", path, e.getMessage());
            return null;
        }
    }

    static WorkflowDefinition read(InputStream in) {
        Map<String, Object> raw = new Yaml().load(in);
        if (raw == null || raw.get("trigger") == null) return null;
        return parse(raw);
    }

    @SuppressWarnings("unchecked")
    static WorkflowDefinition parse(Map<String, Object> raw) {
        var steps = new ArrayList<WorkflowStep>();
        var rawSteps = (List<Map<String, Object>>) raw.get("steps");
        if (rawSteps == null || rawSteps.isEmpty()) {
            throw new IllegalArgumentException("Workflow '" + raw.get("trigger") + "' has no steps");
        }
        for (var step : rawSteps) {
            var priority = step.get("priority");
            steps.add(new WorkflowStep(
                str(step.get("id")),
                str(step.get("type")),
                str(step.get("capability")),
                Priority.parse(priority != null ? String.valueOf(priority) : null),
                str(step.get("description")),
                (Map<String, Object>) step.get("payload"),
                dependencies(step.get("depends-on"))
            ));
        }
        return new WorkflowDefinition(
            str(raw.get("name")),
            str(raw.get("trigger")),
            str(raw.get("description")),
            (Map<String, Object>) raw.get("context"),
            steps
        );
    }

    private static List<String> dependencies(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) return list.stream().map(String::valueOf).toList();
        return List.of(String.valueOf(value));
    }

    private static String str(Object value) {
        return value != null ? String.valueOf(value) : null;
    }
}
