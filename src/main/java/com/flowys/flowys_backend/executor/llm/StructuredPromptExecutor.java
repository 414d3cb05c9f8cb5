package com.flowys.flowys_backend.executor.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.llm.LlmRequest;
import com.flowys.flowys_backend.model.llm.LlmResponse;
import com.flowys.flowys_backend.model.llm.OutputSchema;
import com.flowys.flowys_backend.model.llm.PromptMessage;
import com.flowys.flowys_backend.model.llm.PromptSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calls an LLM and, when a schema is given, keeps asking until the reply is JSON that satisfies it.
 *
 * Each attempt strips code fences, repairs truncated JSON, parses and validates. A failed attempt
 * appends a corrective user message chosen by what went wrong (cut off, missing field, anything else)
 * and tries again, up to {@value #MAX_ATTEMPTS} calls. Auth, rate-limit and quota errors are thrown
 * straight away.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredPromptExecutor {

    static final int MAX_ATTEMPTS = 3;

    // Replies longer than this that still fail are reported as too long
    private static final int LONG_RESPONSE_CHARS = 5000;

    private static final Set<Integer> AUTHORITATIVE_STATUSES = Set.of(401, 403, 429);

    static final String TRUNCATED_RETRY = "Your response was too long and got cut off. Please provide a SHORTER, COMPLETE JSON response. "
            + "Use brief values (max 100 characters per string field). Remove unnecessary details.";

    static final String TOO_LONG_ERROR = "The AI response was too long and incomplete. To fix this: "
            + "1) Simplify your output schema (fewer fields), 2) Ask for shorter/summarized content in your prompt, "
            + "3) Process data in smaller batches.";

    private final LlmClientFactory clientFactory;
    private final LlmCredentialResolver credentialResolver;
    private final JsonRepair jsonRepair;
    private final SchemaValidator schemaValidator;
    private final ObjectMapper objectMapper;

    public Map<String, Object> executePrompt(LlmProvider provider,
                                             PromptSettings settings,
                                             List<PromptMessage> messages,
                                             OutputSchema schema) {
        LlmClient client = clientFactory.getClient(provider);
        LlmCredentialResolver.Credentials credentials = credentialResolver.resolve(provider)
                .orElseThrow(() -> new LlmProviderException(401, "No API key configured for " + provider.getDisplayName()
                        + ". Add one under LLM providers or set it in the application configuration."));

        LlmRequest.LlmRequestBuilder request = LlmRequest.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .outputSchema(schema);

        if (schema == null) {
            LlmResponse response = client.call(request.messages(List.copyOf(messages)).build(),
                    credentials.apiKey(), credentials.endpoint());
            ensureNotCancelled();
            if (!response.isSuccess()) {
                throw new LlmProviderException(response.getStatusCode(), response.getErrorMessage());
            }
            return parseFreeForm(response.getRawText());
        }

        List<PromptMessage> conversation = new ArrayList<>(messages);
        String lastError = null;
        String lastContent = "";
        boolean lastTruncated = false;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            ensureNotCancelled();
            LlmResponse response = client.call(request.messages(List.copyOf(conversation)).build(),
                    credentials.apiKey(), credentials.endpoint());
            ensureNotCancelled();

            if (!response.isSuccess()) {
                if (isAuthoritative(response)) {
                    throw new LlmProviderException(response.getStatusCode(), response.getErrorMessage());
                }
                log.warn("[LLM] {} attempt {}/{} failed: {}", provider.id(), attempt, MAX_ATTEMPTS, response.getErrorMessage());
                lastError = response.getErrorMessage();
                lastTruncated = false;
                continue;
            }

            lastContent = response.getRawText() != null ? response.getRawText() : "";
            JsonRepair.Result repaired = jsonRepair.repair(jsonRepair.stripCodeFences(lastContent));
            String retryInstruction;
            try {
                Object parsed = objectMapper.readValue(repaired.json(), Object.class);
                Map<String, Object> valid = schemaValidator.validate(parsed, schema);
                if (attempt > 1) {
                    log.info("[LLM] {} produced valid JSON on attempt {}", provider.id(), attempt);
                }
                return valid;
            } catch (JsonProcessingException e) {
                lastError = e.getOriginalMessage();
                lastTruncated = repaired.completed() || isEndOfInput(e);
                retryInstruction = lastTruncated
                        ? TRUNCATED_RETRY
                        : "Your previous response was invalid JSON. Error: " + lastError + ". Please provide valid JSON only, no other text.";
            } catch (SchemaValidationException e) {
                lastError = e.getMessage();
                lastTruncated = false;
                retryInstruction = e.isMissingField()
                        ? "Your response was missing required fields. " + lastError + ". Please include ALL required fields in your JSON response."
                        : "Your previous response was invalid JSON. Error: " + lastError + ". Please provide valid JSON only, no other text.";
            }

            log.warn("[LLM] {} attempt {}/{} rejected: {}", provider.id(), attempt, MAX_ATTEMPTS, lastError);
            if (attempt < MAX_ATTEMPTS) {
                conversation.add(PromptMessage.user(retryInstruction));
            }
        }

        if (lastTruncated || lastContent.length() > LONG_RESPONSE_CHARS) {
            throw new StructuredOutputException(TOO_LONG_ERROR, true);
        }
        throw new StructuredOutputException(
                "Failed to get valid JSON response after " + MAX_ATTEMPTS + " attempts. Last error: " + lastError, false);
    }

    /** Free-form reply: JSON when it looks like JSON, otherwise the text itself. */
    private Map<String, Object> parseFreeForm(String content) {
        String text = content != null ? content : "";
        String trimmed = text.trim();
        boolean bracketed = (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (bracketed) {
            try {
                Object parsed = objectMapper.readValue(trimmed, Object.class);
                if (parsed instanceof Map<?, ?> map) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> result = (Map<String, Object>) map;
                    return result;
                }
                Map<String, Object> wrapped = new LinkedHashMap<>();
                wrapped.put("data", parsed);
                return wrapped;
            } catch (JsonProcessingException e) {
                log.debug("[LLM] Bracketed reply is not JSON, returning it as text: {}", e.getOriginalMessage());
            }
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("response", text);
        output.put("text", text);
        return output;
    }

    private static boolean isAuthoritative(LlmResponse response) {
        if (AUTHORITATIVE_STATUSES.contains(response.getStatusCode())) return true;
        String message = response.getErrorMessage() != null ? response.getErrorMessage() : "";
        return message.contains("API key") || message.contains("quota")
                || message.contains("401") || message.contains("403") || message.contains("429");
    }

    private static boolean isEndOfInput(JsonProcessingException e) {
        String message = e.getOriginalMessage() != null ? e.getOriginalMessage() : "";
        return e instanceof JsonEOFException || message.contains("end-of-input");
    }

    private static void ensureNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new LlmProviderException(0, "AI request cancelled");
        }
    }
}
