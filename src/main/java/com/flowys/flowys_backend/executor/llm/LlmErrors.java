package com.flowys.flowys_backend.executor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Pulls the human-readable message out of a provider error body. */
final class LlmErrors {

    private LlmErrors() {}

    static String extractMessage(ObjectMapper mapper, String body) {
        if (body == null || body.isBlank()) return "";
        JsonNode message;
        try {
            message = mapper.readTree(body).path("error").path("message");
        } catch (JsonProcessingException e) {
            return fallbackBody(body);
        }
        return message.isTextual() ? message.asText() : fallbackBody(body);
    }

    private static String fallbackBody(String body) {
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
