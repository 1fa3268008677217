package com.javis.shared.config;

public record MemoryConfig(
    Backend backend,
    String indexPath,
    EmbeddingConfig embedding
) {
    public enum Backend { LUCENE, IN_MEMORY }

    public record EmbeddingConfig(String provider, String baseUrl, String apiKey,
                                  String model, int dimension) {
        public EmbeddingConfig {
            if (dimension < 1) throw new IllegalArgumentException("embedding dimension must be >= 1");
        }

        public static EmbeddingConfig defaults() {
            return new EmbeddingConfig("hashing", "http://localhost:11434/v1", "", "nomic-embed-text", 384);
        }
    }

    public static MemoryConfig defaults() {
        return new MemoryConfig(Backend.LUCENE,
                ConfigLoader.HOME_DIR.resolve("index").toString(),
                EmbeddingConfig.defaults());
    }
}
