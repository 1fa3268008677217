package com.javis.gateway;

import com.javis.agents.AgentRegistry;
import com.javis.agents.MemoryAgent;
import com.javis.intent.IntentCatalog;
import com.javis.intent.IntentCatalogLoader;
import com.javis.intent.IntentClassifier;
import com.javis.intent.NaiveBayesIntentModel;
import com.javis.memory.EmbeddingProvider;
import com.javis.memory.HashingEmbeddingProvider;
import com.javis.memory.HttpEmbeddingProvider;
import com.javis.memory.InMemoryMemoryStore;
import com.javis.memory.LuceneMemoryStore;
import com.javis.memory.MemoryStore;
import com.javis.observability.OrchestratorMetrics;
import com.javis.orchestrator.DefaultTaskOrchestrator;
import com.javis.orchestrator.TaskOrchestrator;
import com.javis.shared.config.JavisConfig;
import com.javis.shared.config.MemoryConfig;
import com.javis.shared.text.TextAnalyzer;
import com.javis.workflow.WorkflowLoader;
import com.javis.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Everything the process shares, built once at startup and torn down in
 * reverse: in-flight tasks drain before the memory store is flushed.
 */
public class JavisContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JavisContext.class);

    private final JavisConfig config;
    private final TextAnalyzer analyzer;
    private final MemoryStore memory;
    private final IntentClassifier classifier;
    private final AgentRegistry agents;
    private final TaskOrchestrator orchestrator;
    private final WorkflowRegistry workflows;
    private final OrchestratorMetrics metrics;
    private boolean closed;

    public JavisContext(JavisConfig config, TextAnalyzer analyzer, MemoryStore memory,
                        IntentClassifier classifier, AgentRegistry agents,
                        TaskOrchestrator orchestrator, WorkflowRegistry workflows,
                        OrchestratorMetrics metrics) {
        this.config = config;
        this.analyzer = analyzer;
        this.memory = memory;
        this.classifier = classifier;
        this.agents = agents;
        this.orchestrator = orchestrator;
        this.workflows = workflows;
        this.metrics = metrics;
    }

    /**
     * Wires the default components for {@code config}. The built-in memory agent
     * is registered; callers register their own agents on {@link #agents()}.
     */
    public static JavisContext create(JavisConfig config) {
        var analyzer = new TextAnalyzer();
        var memory = openMemory(config.memory(), analyzer);

        IntentCatalog catalog = config.classifier().catalogPath() != null
                ? IntentCatalogLoader.load(Path.of(config.classifier().catalogPath()))
                : IntentCatalogLoader.loadDefault();
        var model = NaiveBayesIntentModel.trainedOn(catalog, analyzer);
        var classifier = new IntentClassifier(model, catalog, config.classifier());
        log.info("Intent classifier trained on {} intents", catalog.size());

        var agents = new AgentRegistry();
        agents.register(new MemoryAgent(memory));

        var metrics = new OrchestratorMetrics();
        var orchestrator = new DefaultTaskOrchestrator(agents, memory, config.orchestrator(), metrics);

        var workflows = new WorkflowRegistry();
        WorkflowLoader.loadDefaults().forEach(workflows::register);
        for (var definition : WorkflowLoader.loadFrom(Path.of(config.workflowsDir()))) {
            workflows.register(definition);
            log.info("Registered workflow: /{}", definition.trigger());
        }

        return new JavisContext(config, analyzer, memory, classifier, agents, orchestrator, workflows, metrics);
    }

    static EmbeddingProvider embeddingProvider(MemoryConfig.EmbeddingConfig embedding, TextAnalyzer analyzer) {
        if ("http".equalsIgnoreCase(embedding.provider())) {
            return new HttpEmbeddingProvider(embedding.baseUrl(), embedding.apiKey(),
                    embedding.model(), embedding.dimension());
        }
        if (!"hashing".equalsIgnoreCase(embedding.provider())) {
            throw new IllegalArgumentException("Unknown embedding provider: " + embedding.provider());
        }
        return new HashingEmbeddingProvider(embedding.dimension(), analyzer);
    }

    private static MemoryStore openMemory(MemoryConfig memoryConfig, TextAnalyzer analyzer) {
        var provider = embeddingProvider(memoryConfig.embedding(), analyzer);
        if (memoryConfig.backend() == MemoryConfig.Backend.IN_MEMORY) {
            return new InMemoryMemoryStore(provider);
        }
        try {
            return new LuceneMemoryStore(provider, memoryConfig.indexPath());
        } catch (IOException e) {
            log.warn("Memory index unavailable at {}, keeping memories in-memory: {}",
                    memoryConfig.indexPath(), e.getMessage());
            return new InMemoryMemoryStore(provider);
        }
    }

    public JavisConfig config() { return config; }
    public MemoryStore memory() { return memory; }
    public IntentClassifier classifier() { return classifier; }
    public AgentRegistry agents() { return agents; }
    public TaskOrchestrator orchestrator() { return orchestrator; }
    public WorkflowRegistry workflows() { return workflows; }
    public OrchestratorMetrics metrics() { return metrics; }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        orchestrator.close();
        memory.close();
        analyzer.close();
        log.info("Javis context closed");
    }
}
