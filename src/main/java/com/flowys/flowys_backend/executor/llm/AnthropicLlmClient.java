package com.flowys.flowys_backend.executor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.llm.LlmRequest;
import com.flowys.flowys_backend.model.llm.LlmResponse;
import com.flowys.flowys_backend.model.llm.PromptMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AnthropicLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmClient.class);
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    public AnthropicLlmClient(ObjectMapper mapper,
                              @Value("${flowys.llm.request-timeout:120s}") Duration requestTimeout) {
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultModel() { return "claude-sonnet-4-20250514"; }

    @Override
    public String[] getKnownModels() {
        return new String[]{
            "claude-sonnet-4-20250514",
            "claude-3-5-haiku-20241022",
            "claude-opus-4-20250514"
        };
    }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : LlmProvider.ANTHROPIC.getDefaultEndpoint();
        try {
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(buildBody(req))))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[Anthropic] HTTP {}", httpResp.statusCode());
                return LlmResponse.error("Anthropic API error " + httpResp.statusCode() + ": "
                        + LlmErrors.extractMessage(mapper, httpResp.body()), httpResp.statusCode());
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> resp = mapper.readValue(httpResp.body(), Map.class);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> content = (List<Map<String, Object>>) resp.getOrDefault("content", List.of());
            String text = content.stream()
                    .filter(block -> "text".equals(block.get("type")))
                    .map(block -> (String) block.get("text"))
                    .findFirst()
                    .orElse(null);
            if (text == null) {
                return LlmResponse.error("No text response from Anthropic", 0);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
            int inputTokens = usage != null ? ((Number) usage.getOrDefault("input_tokens", 0)).intValue() : 0;
            int outputTokens = usage != null ? ((Number) usage.getOrDefault("output_tokens", 0)).intValue() : 0;
            String model = (String) resp.getOrDefault("model", getDefaultModel());
            return LlmResponse.ok(text, model, inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error("Anthropic request interrupted", 0);
        } catch (IOException | RuntimeException e) {
            log.error("[Anthropic] Exception calling API", e);
            return LlmResponse.error("Anthropic client exception: " + e.getMessage(), 0);
        }
    }

    /**
     * The system prompt travels separately; the schema instruction is appended to the last user turn.
     * Consecutive turns from the same role are merged since the API expects alternation.
     */
    Map<String, Object> buildBody(LlmRequest req) throws IOException {
        StringBuilder system = new StringBuilder();
        List<Map<String, String>> messages = new ArrayList<>();
        for (PromptMessage m : req.getMessages()) {
            if ("system".equals(m.role())) {
                if (!system.isEmpty()) system.append("\n\n");
                system.append(m.content());
                continue;
            }
            Map<String, String> last = messages.isEmpty() ? null : messages.get(messages.size() - 1);
            if (last != null && last.get("role").equals(m.role())) {
                last.put("content", last.get("content") + "\n\n" + m.content());
            } else {
                messages.add(new LinkedHashMap<>(Map.of("role", m.role(), "content", m.content())));
            }
        }

        if (req.getOutputSchema() != null && !messages.isEmpty()) {
            Map<String, String> last = messages.get(messages.size() - 1);
            last.put("content", last.get("content")
                    + "\n\nYou must respond with valid JSON matching this schema:\n"
                    + mapper.writerWithDefaultPrettyPrinter().writeValueAsString(req.getOutputSchema().asMap())
                    + "\n\nRespond ONLY with the JSON, no other text.");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", req.getModel() != null && !req.getModel().isBlank() ? req.getModel() : getDefaultModel());
        body.put("max_tokens", req.getMaxTokens());
        // Anthropic accepts 0..1
        body.put("temperature", Math.min(1.0, Math.max(0.0, req.getTemperature())));
        if (!system.isEmpty()) {
            body.put("system", system.toString());
        }
        body.put("messages", messages);
        return body;
    }
}
