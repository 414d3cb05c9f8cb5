package com.flowys.flowys_backend.model.llm;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Provider-agnostic request. Each LlmClient translates this into its provider's API format.
 */
@Data
@Builder(toBuilder = true)
public class LlmRequest {

    private List<PromptMessage> messages;
    private String model;

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private int maxTokens = 16384;

    // null means free-form text
    private OutputSchema outputSchema;
}
