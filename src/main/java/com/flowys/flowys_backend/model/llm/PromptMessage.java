package com.flowys.flowys_backend.model.llm;

/** One chat turn. role is "system", "user" or "assistant". */
public record PromptMessage(String role, String content) {

    public static PromptMessage system(String content) {
        return new PromptMessage("system", content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage("user", content);
    }

    public PromptMessage withContent(String newContent) {
        return new PromptMessage(role, newContent);
    }
}
