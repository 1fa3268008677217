package com.javis.orchestrator;

import com.javis.shared.model.ErrorKind;
import com.javis.shared.model.Result;
import com.javis.shared.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Submits each step once its dependencies have finished. A step whose
 * dependency did not succeed is cancelled without running, which cascades to
 * its own dependents. Independent branches proceed in parallel.
 */
class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final TaskOrchestrator orchestrator;

    WorkflowRunner(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    List<Result> run(Workflow workflow) {
        log.info("Starting workflow {} ({} steps)", workflow.name(), workflow.steps().size());
        var futures = new HashMap<String, CompletableFuture<Result>>();
        for (var step : workflow.executionOrder()) {
            var deps = new LinkedHashMap<String, CompletableFuture<Result>>();
            for (var dep : step.dependsOn()) deps.put(dep, futures.get(dep));
            var future = CompletableFuture.allOf(deps.values().toArray(CompletableFuture[]::new))
                    .thenCompose(ignored -> runStep(workflow, step, deps));
            futures.put(step.id(), future);
        }
        var results = workflow.steps().stream().map(s -> futures.get(s.id()).join()).toList();
        long failed = results.stream().filter(r -> !r.success()).count();
        log.info("Workflow {} finished: {} of {} steps succeeded",
                workflow.name(), results.size() - failed, results.size());
        return results;
    }

    private CompletableFuture<Result> runStep(Workflow workflow, WorkflowStep step,
                                              Map<String, CompletableFuture<Result>> deps) {
        var inputs = new LinkedHashMap<String, Object>();
        String failedDependency = null;
        for (var entry : deps.entrySet()) {
            var result = entry.getValue().join();
            if (!result.success()) {
                failedDependency = entry.getKey();
                break;
            }
            inputs.put(entry.getKey(), result.data());
        }

        var payload = new LinkedHashMap<String, Object>(workflow.context());
        payload.putAll(step.payload());
        if (!deps.isEmpty()) payload.put(Workflow.INPUTS_KEY, inputs);
        var description = step.description() != null
                ? step.description() : workflow.name() + "/" + step.id();
        var task = new Task(step.taskType(), step.priority(), payload, description, step.requiredCapability());

        if (failedDependency != null) {
            log.info("Workflow {}: skipping step {}, dependency {} did not succeed",
                    workflow.name(), step.id(), failedDependency);
            task.cancel();
            return CompletableFuture.completedFuture(Result.failure(task.id(), ErrorKind.CANCELLED,
                    "Dependency '" + failedDependency + "' did not succeed"));
        }
        return orchestrator.submitAsync(task);
    }
}
