package com.javis.shared.config;

public record JavisConfig(
    OrchestratorConfig orchestrator,
    ClassifierConfig classifier,
    MemoryConfig memory,
    String workflowsDir
) {
    public static JavisConfig defaults() {
        return new JavisConfig(
            OrchestratorConfig.defaults(),
            ClassifierConfig.defaults(),
            MemoryConfig.defaults(),
            ConfigLoader.HOME_DIR.resolve("workflows").toString()
        );
    }
}
