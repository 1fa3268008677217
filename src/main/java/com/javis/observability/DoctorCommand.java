package com.javis.observability;

import com.javis.agents.AgentRegistry;
import com.javis.shared.config.MemoryConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;

/** Environment self-check behind the {@code /doctor} command. */
public class DoctorCommand {

    private final MemoryConfig memoryConfig;
    private final AgentRegistry agents;
    private final HttpClient httpClient;

    public DoctorCommand(MemoryConfig memoryConfig, AgentRegistry agents) {
        this(memoryConfig, agents, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build());
    }

    public DoctorCommand(MemoryConfig memoryConfig, AgentRegistry agents, HttpClient httpClient) {
        this.memoryConfig = memoryConfig;
        this.agents = agents;
        this.httpClient = httpClient;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkEmbeddingEndpoint());
        results.add(checkMemoryIndex());
        results.add(checkAgents());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkEmbeddingEndpoint() {
        var embedding = memoryConfig.embedding();
        if (!"http".equalsIgnoreCase(embedding.provider())) {
            return "[OK] Embeddings: offline " + embedding.provider() + " provider (" + embedding.dimension() + " dims)";
        }
        try {
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(embedding.baseUrl()))
                    .timeout(Duration.ofSeconds(5))
                    .GET().build();
            var resp = httpClient.send(req, HttpResponse.BodyHandlers.discarding());
            return resp.statusCode() < 500
                    ? "[OK] Embedding endpoint reachable"
                    : "[FAIL] Embedding endpoint: HTTP " + resp.statusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "[FAIL] Embedding endpoint: interrupted";
        } catch (IOException | IllegalArgumentException e) {
            return "[FAIL] Embedding endpoint: " + e.getMessage();
        }
    }

    private String checkMemoryIndex() {
        if (memoryConfig.backend() == MemoryConfig.Backend.IN_MEMORY) {
            return "[WARN] Memory is in-memory only (lost on exit)";
        }
        var path = Path.of(memoryConfig.indexPath());
        return Files.isDirectory(path)
                ? "[OK] Lucene index directory exists"
                : "[WARN] Lucene index directory not found (will be created on first store)";
    }

    private String checkAgents() {
        int count = agents.size();
        if (count == 0) return "[FAIL] No agents registered";
        var ids = agents.all().stream().map(a -> a.id()).toList();
        return "[OK] " + count + " agent(s) registered: " + String.join(", ", ids);
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
