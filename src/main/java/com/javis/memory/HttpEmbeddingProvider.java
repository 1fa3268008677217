package com.javis.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Client for an OpenAI-compatible {@code /embeddings} endpoint (OpenAI, Ollama, vLLM).
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int dimension;
    private final HttpClient httpClient;

    public HttpEmbeddingProvider(String baseUrl, String apiKey, String model, int dimension) {
        this(baseUrl, apiKey, model, dimension, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    HttpEmbeddingProvider(String baseUrl, String apiKey, String model, int dimension, HttpClient httpClient) {
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.model = model;
        this.dimension = dimension;
        this.httpClient = httpClient;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public float[] embed(String text) {
        HttpResponse<String> resp;
        try {
            var body = MAPPER.writeValueAsString(Map.of("model", model, "input", text));
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/embeddings"))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(body));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for embedding", e);
        }

        if (resp.statusCode() != 200) {
            log.error("Embedding API error {}: {}", resp.statusCode(), resp.body());
            throw new EmbeddingException("Embedding API returned HTTP " + resp.statusCode());
        }
        try {
            var arr = MAPPER.readTree(resp.body()).path("data").path(0).path("embedding");
            if (arr.size() != dimension) {
                throw new EmbeddingException("Expected " + dimension + "-dimensional embedding from "
                        + model + ", got " + arr.size());
            }
            var vec = new float[arr.size()];
            for (int i = 0; i < arr.size(); i++) {
                vec[i] = (float) arr.get(i).asDouble();
            }
            return vec;
        } catch (IOException e) {
            throw new EmbeddingException("Malformed embedding response", e);
        }
    }
}
