package com.flowys.flowys_backend.model.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * LLM providers the AI node can talk to.
 * Each provider maps to a concrete LlmClient implementation.
 */
public enum LlmProvider {

    OPENAI("OpenAI",       "https://api.openai.com/v1/chat/completions"),
    ANTHROPIC("Anthropic", "https://api.anthropic.com/v1/messages");

    private final String displayName;
    private final String defaultEndpoint;

    LlmProvider(String displayName, String defaultEndpoint) {
        this.displayName     = displayName;
        this.defaultEndpoint = defaultEndpoint;
    }

    public String getDisplayName()     { return displayName; }
    public String getDefaultEndpoint() { return defaultEndpoint; }

    /** Lowercase id used in node config ("openai", "anthropic"). */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LlmProvider> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(p -> p.id().equalsIgnoreCase(id.trim()))
                .findFirst();
    }
}
