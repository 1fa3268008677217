package com.javis.gateway;

import com.javis.memory.MemoryResult;
import com.javis.observability.DoctorCommand;
import com.javis.shared.model.Priority;
import com.javis.shared.model.Result;
import com.javis.shared.model.Task;
import com.javis.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns one line of input into a reply: built-in slash commands, workflow
 * triggers, and otherwise classify, submit and report.
 */
public class CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    /** Payload key holding the raw instruction text. */
    public static final String TEXT_KEY = "text";

    private final JavisContext context;
    private final DoctorCommand doctor;

    public CommandProcessor(JavisContext context, DoctorCommand doctor) {
        this.context = context;
        this.doctor = doctor;
    }

    public String handle(String input) {
        var text = input == null ? "" : input.trim();
        if (text.isEmpty()) return "";

        if ("/doctor".equals(text)) return doctor.run();
        if ("/status".equals(text)) return status();
        if ("/workflows".equals(text)) return listWorkflows();

        var workflow = context.workflows().match(text);
        if (workflow != null) {
            var argument = WorkflowRegistry.argument(text);
            log.info("Running workflow /{} with argument '{}'", workflow.trigger(), argument);
            var instance = workflow.instantiate(argument);
            var results = context.orchestrator().runWorkflow(instance);
            var sb = new StringBuilder(workflow.name()).append(":");
            for (int i = 0; i < results.size(); i++) {
                sb.append("\n  ").append(instance.steps().get(i).id()).append(": ").append(describe(results.get(i)));
            }
            return sb.toString();
        }
        if (text.startsWith("/")) {
            return "Unknown command " + text.split("\\s", 2)[0] + ". Try /workflows, /status or /doctor.";
        }
        return instruct(text);
    }

    private String instruct(String text) {
        var intent = context.classifier().classify(text, recentContext(text));
        log.debug("Classified '{}' as {} ({})", text, intent.label(), intent.confidence());
        if (intent.isUnknown()) {
            log.info("{}: could not classify '{}' (confidence {})", intent.errorKind(), text, intent.confidence());
            return "I'm not sure what you mean. Could you rephrase that?";
        }

        var payload = new LinkedHashMap<String, Object>(intent.slots());
        payload.put(TEXT_KEY, text);
        var task = new Task(intent.label(), Priority.NORMAL, payload, text, null);
        var result = context.orchestrator().submit(task);
        if (result.success()) {
            context.classifier().learn(text, intent.label());
        }
        return describe(result);
    }

    private List<MemoryResult> recentContext(String text) {
        int hits = context.config().classifier().contextHits();
        if (hits == 0) return List.of();
        try {
            return context.memory().search(text, hits);
        } catch (RuntimeException e) {
            log.warn("Memory lookup failed, classifying without context: {}", e.getMessage());
            return List.of();
        }
    }

    private String status() {
        var s = context.orchestrator().status();
        return String.format("Agents: %d | Workers: %d | Running: %d | Queued: %d%n"
                        + "Succeeded: %d | Failed: %d | Cancelled: %d | Memories: %d",
                s.agents(), s.maxConcurrency(), s.running(), s.queued(),
                s.succeeded(), s.failed(), s.cancelled(), context.memory().size());
    }

    private String listWorkflows() {
        if (context.workflows().all().isEmpty()) return "No workflows registered.";
        return context.workflows().all().stream()
                .map(w -> "/" + w.trigger() + " - " + w.description())
                .collect(Collectors.joining("\n"));
    }

    static String describe(Result result) {
        if (result.success()) {
            var message = result.data().get("message");
            return message != null ? String.valueOf(message) : "Done. " + result.data();
        }
        var error = result.error();
        var root = error.rootCause();
        return root == error
                ? "[" + error.kind() + "] " + error.message()
                : "[" + error.kind() + "] " + error.message() + ": " + root.message();
    }
}
