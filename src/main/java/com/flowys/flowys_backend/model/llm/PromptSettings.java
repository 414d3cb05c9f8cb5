package com.flowys.flowys_backend.model.llm;

/** Per-node model knobs. Null model means the provider default. */
public record PromptSettings(String model, double temperature, int maxTokens) {
}
