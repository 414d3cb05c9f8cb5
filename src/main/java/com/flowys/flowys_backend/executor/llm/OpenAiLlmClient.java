package com.flowys.flowys_backend.executor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.llm.LlmRequest;
import com.flowys.flowys_backend.model.llm.LlmResponse;
import com.flowys.flowys_backend.model.llm.OutputSchema;
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
import java.util.Locale;
import java.util.Map;

/**
 * Chat Completions client. When a schema is requested the strongest JSON mode the model supports is used:
 * strict json_schema for the gpt-4o family, json_object for older JSON-mode models, prompt instructions only
 * for everything else.
 */
@Component
public class OpenAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private static final List<String> STRUCTURED_OUTPUT_MODELS =
            List.of("gpt-4o", "gpt-4o-mini", "gpt-4o-2024", "gpt-4-turbo");

    private static final List<String> JSON_OBJECT_MODELS =
            List.of("gpt-4o", "gpt-4o-mini", "gpt-4-turbo", "gpt-4-1106", "gpt-4-0125", "gpt-3.5-turbo-1106", "gpt-3.5-turbo-0125");

    // Retired model ids and what to use instead
    static final Map<String, String> DEPRECATED_MODEL_REPLACEMENTS = Map.ofEntries(
            Map.entry("text-davinci-003", "gpt-4o-mini"),
            Map.entry("text-davinci-002", "gpt-4o-mini"),
            Map.entry("text-davinci-001", "gpt-4o-mini"),
            Map.entry("text-curie-001", "gpt-4o-mini"),
            Map.entry("text-babbage-001", "gpt-4o-mini"),
            Map.entry("text-ada-001", "gpt-4o-mini"),
            Map.entry("code-davinci-002", "gpt-4o"),
            Map.entry("code-cushman-001", "gpt-4o-mini"),
            Map.entry("gpt-3.5-turbo-0301", "gpt-4o-mini"),
            Map.entry("gpt-3.5-turbo-0613", "gpt-4o-mini"),
            Map.entry("gpt-3.5-turbo", "gpt-4o-mini"),
            Map.entry("gpt-4-0314", "gpt-4o"),
            Map.entry("gpt-4-0613", "gpt-4o"),
            Map.entry("gpt-4-32k", "gpt-4o"),
            Map.entry("gpt-4-32k-0314", "gpt-4o"),
            Map.entry("gpt-4-32k-0613", "gpt-4o"),
            Map.entry("gpt-4", "gpt-4o"));

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    public OpenAiLlmClient(ObjectMapper mapper,
                           @Value("${flowys.llm.request-timeout:120s}") Duration requestTimeout) {
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.OPENAI; }

    @Override
    public String getDefaultModel() { return "gpt-4o"; }

    @Override
    public String[] getKnownModels() {
        return new String[]{"gpt-4o", "gpt-4o-mini", "gpt-4-turbo"};
    }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : LlmProvider.OPENAI.getDefaultEndpoint();
        String model = resolveModel(req.getModel());
        try {
            Map<String, Object> body = buildBody(req, model);
            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[OpenAI] HTTP {}", httpResp.statusCode());
                return LlmResponse.error("OpenAI API error " + httpResp.statusCode() + ": "
                        + LlmErrors.extractMessage(mapper, httpResp.body()), httpResp.statusCode());
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> resp = mapper.readValue(httpResp.body(), Map.class);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> choices = (List<Map<String, Object>>) resp.get("choices");
            @SuppressWarnings("unchecked")
            Map<String, Object> message = choices == null || choices.isEmpty() ? null : (Map<String, Object>) choices.get(0).get("message");
            String text = message != null ? (String) message.get("content") : null;
            if (text == null || text.isEmpty()) {
                return LlmResponse.error("No response from OpenAI", 0);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
            int inputTokens = usage != null ? ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue() : 0;
            int outputTokens = usage != null ? ((Number) usage.getOrDefault("completion_tokens", 0)).intValue() : 0;
            return LlmResponse.ok(text, (String) resp.getOrDefault("model", model), inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error("OpenAI request interrupted", 0);
        } catch (IOException | RuntimeException e) {
            log.error("[OpenAI] Exception calling API", e);
            return LlmResponse.error("OpenAI client exception: " + e.getMessage(), 0);
        }
    }

    String resolveModel(String requested) {
        String model = requested != null && !requested.isBlank() ? requested : getDefaultModel();
        String replacement = DEPRECATED_MODEL_REPLACEMENTS.get(model);
        if (replacement != null) {
            log.warn("[OpenAI] Model \"{}\" is deprecated. Using \"{}\" instead.", model, replacement);
            return replacement;
        }
        return model;
    }

    Map<String, Object> buildBody(LlmRequest req, String model) throws IOException {
        List<Map<String, String>> messages = new ArrayList<>();
        for (PromptMessage m : req.getMessages()) {
            messages.add(new LinkedHashMap<>(Map.of("role", m.role(), "content", m.content())));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", req.getTemperature());
        body.put("max_tokens", req.getMaxTokens());

        OutputSchema schema = req.getOutputSchema();
        if (schema != null) {
            String instruction = "\n\nIMPORTANT: You must respond with valid JSON only, no other text. The JSON must match this schema:\n"
                    + mapper.writerWithDefaultPrettyPrinter().writeValueAsString(schema.asMap());
            Map<String, String> system = messages.stream().filter(m -> "system".equals(m.get("role"))).findFirst().orElse(null);
            if (system != null) {
                system.put("content", system.get("content") + instruction);
            } else {
                messages.add(0, new LinkedHashMap<>(Map.of("role", "system",
                        "content", "You are a helpful assistant. Respond only with valid JSON, no other text." + instruction)));
            }

            if (matchesAny(model, STRUCTURED_OUTPUT_MODELS)) {
                Map<String, Object> jsonSchema = new LinkedHashMap<>();
                jsonSchema.put("name", "response");
                jsonSchema.put("schema", normalizeSchema(schema.asMap()));
                jsonSchema.put("strict", true);
                body.put("response_format", Map.of("type", "json_schema", "json_schema", jsonSchema));
            } else if (matchesAny(model, JSON_OBJECT_MODELS)) {
                body.put("response_format", Map.of("type", "json_object"));
            }
        }
        body.put("messages", messages);
        return body;
    }

    /**
     * Strict mode wants every object closed (additionalProperties false) and every property listed
     * as required, at every nesting level.
     */
    @SuppressWarnings("unchecked")
    Map<String, Object> normalizeSchema(Map<String, Object> schema) {
        Map<String, Object> normalized = new LinkedHashMap<>(schema);

        if ("object".equals(normalized.get("type"))) {
            normalized.put("additionalProperties", false);
            if (normalized.get("properties") instanceof Map<?, ?> props) {
                Map<String, Object> normalizedProps = new LinkedHashMap<>();
                props.forEach((key, value) -> normalizedProps.put(String.valueOf(key),
                        value instanceof Map<?, ?> nested ? normalizeSchema((Map<String, Object>) nested) : value));
                normalized.put("properties", normalizedProps);
                if (!normalizedProps.isEmpty()) {
                    normalized.put("required", new ArrayList<>(normalizedProps.keySet()));
                }
            }
        }

        if ("array".equals(normalized.get("type")) && normalized.get("items") instanceof Map<?, ?> items) {
            normalized.put("items", normalizeSchema((Map<String, Object>) items));
        }

        for (String keyword : List.of("anyOf", "oneOf", "allOf")) {
            if (normalized.get(keyword) instanceof List<?> variants) {
                normalized.put(keyword, variants.stream()
                        .map(v -> v instanceof Map<?, ?> m ? normalizeSchema((Map<String, Object>) m) : v)
                        .toList());
            }
        }
        return normalized;
    }

    private static boolean matchesAny(String model, List<String> prefixes) {
        String lower = model.toLowerCase(Locale.ROOT);
        return prefixes.stream().anyMatch(p -> lower.startsWith(p.toLowerCase(Locale.ROOT)));
    }
}
