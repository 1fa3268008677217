package com.javis.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

public class ConfigLoader {

    static final Path HOME_DIR = Path.of(System.getProperty("user.home"), ".javis");
    private static final Path DEFAULT_PATH = HOME_DIR.resolve("config.yaml");

    public static JavisConfig load() {
        return load(DEFAULT_PATH);
    }

    public static JavisConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static JavisConfig load(Path path, Env env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var orchestrator = (Map<String, Object>) raw.getOrDefault("orchestrator", Map.of());
        var classifier = (Map<String, Object>) raw.getOrDefault("classifier", Map.of());
        var memory = (Map<String, Object>) raw.getOrDefault("memory", Map.of());
        var defaults = JavisConfig.defaults();

        return new JavisConfig(
            parseOrchestrator(orchestrator, env),
            parseClassifier(classifier, env),
            parseMemory(memory, env),
            env.getOrDefault("JAVIS_WORKFLOWS_DIR",
                String.valueOf(raw.getOrDefault("workflows-dir", defaults.workflowsDir())))
        );
    }

    private static OrchestratorConfig parseOrchestrator(Map<String, Object> section, Env env) {
        var d = OrchestratorConfig.defaults();
        return new OrchestratorConfig(
            Integer.parseInt(env.getOrDefault("JAVIS_MAX_CONCURRENCY",
                String.valueOf(section.getOrDefault("max-concurrency", d.maxConcurrency())))),
            Integer.parseInt(env.getOrDefault("JAVIS_RETRY_CEILING",
                String.valueOf(section.getOrDefault("retry-ceiling", d.retryCeiling())))),
            Long.parseLong(String.valueOf(section.getOrDefault("backoff-ms", d.backoffMs()))),
            Long.parseLong(String.valueOf(section.getOrDefault("max-backoff-ms", d.maxBackoffMs()))),
            Long.parseLong(String.valueOf(section.getOrDefault("timeout-seconds", d.timeoutSeconds()))),
            Long.parseLong(String.valueOf(section.getOrDefault("retention-minutes", d.retentionMinutes()))),
            Long.parseLong(String.valueOf(section.getOrDefault("shutdown-grace-seconds", d.shutdownGraceSeconds())))
        );
    }

    private static ClassifierConfig parseClassifier(Map<String, Object> section, Env env) {
        var d = ClassifierConfig.defaults();
        var catalog = section.get("catalog");
        return new ClassifierConfig(
            Double.parseDouble(String.valueOf(section.getOrDefault("confidence-threshold", d.confidenceThreshold()))),
            Double.parseDouble(String.valueOf(section.getOrDefault("fallback-confidence", d.fallbackConfidence()))),
            Integer.parseInt(String.valueOf(section.getOrDefault("context-hits", d.contextHits()))),
            env.getOrDefault("JAVIS_INTENT_CATALOG", catalog != null ? String.valueOf(catalog) : null)
        );
    }

    @SuppressWarnings("unchecked")
    private static MemoryConfig parseMemory(Map<String, Object> section, Env env) {
        var d = MemoryConfig.defaults();
        var e = MemoryConfig.EmbeddingConfig.defaults();
        var embedding = (Map<String, Object>) section.getOrDefault("embedding", Map.of());
        var backend = String.valueOf(section.getOrDefault("backend", d.backend().name()))
                .trim().replace('-', '_').toUpperCase(Locale.ROOT);

        return new MemoryConfig(
            MemoryConfig.Backend.valueOf(backend),
            env.getOrDefault("JAVIS_INDEX_PATH",
                String.valueOf(section.getOrDefault("index-path", d.indexPath()))),
            new MemoryConfig.EmbeddingConfig(
                String.valueOf(embedding.getOrDefault("provider", e.provider())),
                env.getOrDefault("JAVIS_EMBEDDING_BASE_URL",
                    String.valueOf(embedding.getOrDefault("base-url", e.baseUrl()))),
                env.getOrDefault("JAVIS_EMBEDDING_API_KEY",
                    String.valueOf(embedding.getOrDefault("api-key", e.apiKey()))),
                String.valueOf(embedding.getOrDefault("model", e.model())),
                Integer.parseInt(String.valueOf(embedding.getOrDefault("dimension", e.dimension())))
            )
        );
    }

    /** Environment lookup, replaceable in tests. */
    @FunctionalInterface
    interface Env {
        String get(String name);

        default String getOrDefault(String name, String fallback) {
            var val = get(name);
            return val != null ? val : fallback;
        }
    }
}
