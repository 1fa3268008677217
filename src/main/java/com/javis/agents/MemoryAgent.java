package com.javis.agents;

import com.javis.memory.MemoryStore;
import com.javis.shared.model.ErrorKind;
import com.javis.shared.model.Result;
import com.javis.shared.model.Task;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Exposes the memory store as routable tasks: {@code remember} stores the
 * {@code fact} payload entry, {@code recall} searches by {@code query} and
 * {@code forget} deletes by {@code id}.
 */
public class MemoryAgent implements Agent {

    public static final String ID = "memory";
    public static final String REMEMBER = "remember";
    public static final String RECALL = "recall";
    public static final String FORGET = "forget";

    private static final int DEFAULT_RECALL_LIMIT = 5;
    private static final Set<Capability> CAPABILITIES =
            Set.of(Capability.of("memory", REMEMBER, RECALL, FORGET));

    private final MemoryStore memoryStore;

    public MemoryAgent(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Override public String id() { return ID; }

    @Override public Set<Capability> capabilities() { return CAPABILITIES; }

    @Override
    public Result execute(Task task, CancellationToken cancellation) {
        cancellation.throwIfCancelled();
        if (REMEMBER.equals(task.type())) return remember(task);
        if (RECALL.equals(task.type())) return recall(task);
        if (FORGET.equals(task.type())) return forget(task);
        return Result.failure(task.id(), ErrorKind.AGENT_EXECUTION, "Unsupported task type: " + task.type());
    }

    private Result remember(Task task) {
        var fact = text(task, "fact");
        if (fact.isBlank()) return Result.failure(task.id(), ErrorKind.AGENT_EXECUTION, "fact is required");
        var id = memoryStore.add(fact, Map.of("type", "fact"));
        return Result.success(task.id(), Map.of("id", id, "message", "Stored to memory."));
    }

    private Result recall(Task task) {
        var query = text(task, "query");
        if (query.isBlank()) return Result.failure(task.id(), ErrorKind.AGENT_EXECUTION, "query is required");
        int limit = limit(task.payload().get("limit"));
        var hits = memoryStore.search(query, limit);
        var memories = new ArrayList<Map<String, Object>>();
        var sb = new StringBuilder();
        for (var hit : hits) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", hit.id());
            entry.put("text", hit.text());
            entry.put("score", hit.score());
            memories.add(entry);
            sb.append("- [").append(String.format("%.3f", hit.score())).append("] ").append(hit.text()).append("\n");
        }
        var data = new LinkedHashMap<String, Object>();
        data.put("count", hits.size());
        data.put("memories", memories);
        data.put("message", hits.isEmpty() ? "No memories found." : sb.toString().stripTrailing());
        return Result.success(task.id(), data);
    }

    private Result forget(Task task) {
        var id = text(task, "id");
        if (id.isBlank()) return Result.failure(task.id(), ErrorKind.AGENT_EXECUTION, "id is required");
        // an unknown id is not worth a retry
        var deleted = memoryStore.delete(id);
        return Result.success(task.id(), Map.of("id", id, "deleted", deleted,
                "message", deleted ? "Memory deleted: " + id : "No memory with id " + id));
    }

    private static String text(Task task, String key) {
        var value = task.payload().get(key);
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static int limit(Object value) {
        if (value instanceof Number n) return Math.max(1, n.intValue());
        if (value != null) {
            try {
                return Math.max(1, Integer.parseInt(String.valueOf(value).trim()));
            } catch (NumberFormatException e) {
                return DEFAULT_RECALL_LIMIT;
            }
        }
        return DEFAULT_RECALL_LIMIT;
    }
}
