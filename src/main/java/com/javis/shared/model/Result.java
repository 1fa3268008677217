package com.javis.shared.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Result(
    String taskId,
    boolean success,
    Map<String, Object> data,
    TaskError error,
    Duration duration,
    int attempts,
    String agentId
) {
    public Result {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static Result success(String taskId, Map<String, Object> data) {
        return new Result(taskId, true, data, null, Duration.ZERO, 0, null);
    }

    public static Result failure(String taskId, ErrorKind kind, String message) {
        return new Result(taskId, false, Map.of(), new TaskError(kind, message), Duration.ZERO, 0, null);
    }

    public ErrorKind errorKind() {
        return error != null ? error.kind() : null;
    }

    public boolean cancelled() {
        return error != null && (error.kind() == ErrorKind.CANCELLED || error.kind() == ErrorKind.TIMEOUT);
    }

    public Result withExecution(Duration duration, int attempts, String agentId) {
        return new Result(taskId, success, data, error, duration, attempts, agentId);
    }

    public Result withTaskId(String taskId) {
        return new Result(taskId, success, data, error, duration, attempts, agentId);
    }
}
