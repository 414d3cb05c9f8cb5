package com.flowys.flowys_backend.executor.impl;

import com.flowys.flowys_backend.executor.ConfigValues;
import com.flowys.flowys_backend.executor.NodeHandler;
import com.flowys.flowys_backend.executor.PathResolver;
import com.flowys.flowys_backend.executor.llm.StructuredPromptExecutor;
import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import com.flowys.flowys_backend.model.llm.OutputSchema;
import com.flowys.flowys_backend.model.llm.PromptMessage;
import com.flowys.flowys_backend.model.llm.PromptSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class AiNodeHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(AiNodeHandler.class);

    static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant.";
    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int DEFAULT_MAX_TOKENS = 16384;

    static final String CONCISE_INSTRUCTIONS = """


            CRITICAL INSTRUCTIONS FOR YOUR RESPONSE:
            - Respond with valid JSON only - no markdown, no explanations
            - Keep ALL string values SHORT (under 150 characters each)
            - Use brief, summarized content - not verbose descriptions
            - Complete the entire JSON structure - do not truncate
            - If listing items, include only essential information per item""";

    /** Common prompt-injection phrasings; matches are replaced with [FILTERED]. */
    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore\\s+(all\\s+)?(previous|above|prior)\\s+instructions?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard\\s+(all\\s+)?(previous|above|prior)\\s+instructions?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("forget\\s+(all\\s+)?(previous|above|prior)\\s+instructions?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("you\\s+are\\s+now\\s+a\\s+different", Pattern.CASE_INSENSITIVE),
            Pattern.compile("new\\s+instructions?:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system\\s*:\\s*you\\s+are", Pattern.CASE_INSENSITIVE)
    );

    private final StructuredPromptExecutor promptExecutor;
    private final PathResolver resolver;

    public AiNodeHandler(StructuredPromptExecutor promptExecutor, PathResolver resolver) {
        this.promptExecutor = promptExecutor;
        this.resolver = resolver;
    }

    @Override
    public NodeType supportedType() {
        return NodeType.AI;
    }

    @Override
    public NodeResult execute(NodeContext context) {
        Map<String, Object> cfg = context.getConfig();
        try {
            LlmProvider provider = LlmProvider.fromId(ConfigValues.string(cfg, "provider"))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown LLM provider: " + cfg.get("provider")));

            String template = ConfigValues.string(cfg, "userPromptTemplate", "");
            String userPrompt = resolver.interpolate(template, context.templateScope());

            String systemPrompt = ConfigValues.isBlank(cfg, "systemPrompt")
                    ? DEFAULT_SYSTEM_PROMPT
                    : sanitize(ConfigValues.string(cfg, "systemPrompt"));

            List<PromptMessage> messages = List.of(
                    PromptMessage.system(systemPrompt + CONCISE_INSTRUCTIONS),
                    PromptMessage.user(sanitize(userPrompt)));

            Double temperature = ConfigValues.number(cfg, "temperature");
            Double maxTokens = ConfigValues.number(cfg, "maxTokens");
            PromptSettings settings = new PromptSettings(
                    ConfigValues.string(cfg, "model"),
                    temperature != null ? temperature : DEFAULT_TEMPERATURE,
                    maxTokens != null ? maxTokens.intValue() : DEFAULT_MAX_TOKENS);

            Map<String, Object> schemaDef = ConfigValues.map(cfg, "outputSchema");
            OutputSchema schema = schemaDef.isEmpty() ? null : OutputSchema.of(schemaDef);

            log.info("[AiNode] {} calling {} model={} schema={}",
                    context.getNodeId(), provider.id(), settings.model(), schema != null);
            Map<String, Object> output = promptExecutor.executePrompt(provider, settings, messages, schema);
            return NodeResult.ok(output);
        } catch (RuntimeException e) {
            log.warn("[AiNode] {} failed: {}", context.getNodeId(), e.getMessage());
            return NodeResult.failure("AI execution error: " + e.getMessage());
        }
    }

    @Override
    public ConfigValidation validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (LlmProvider.fromId(ConfigValues.string(config, "provider")).isEmpty()) {
            errors.add("provider must be 'openai' or 'anthropic'");
        }
        if (ConfigValues.isBlank(config, "model")) {
            errors.add("model is required and must be a string");
        }
        if (ConfigValues.isBlank(config, "userPromptTemplate")) {
            errors.add("userPromptTemplate is required and must be a string");
        }
        if (config.get("temperature") != null) {
            if (!(config.get("temperature") instanceof Number t) || t.doubleValue() < 0 || t.doubleValue() > 2) {
                errors.add("temperature must be a number between 0 and 2");
            }
        }
        if (config.get("maxTokens") != null) {
            if (!(config.get("maxTokens") instanceof Number m) || m.doubleValue() < 1 || m.doubleValue() > 100000) {
                errors.add("maxTokens must be a number between 1 and 100000");
            }
        }
        return ConfigValidation.of(errors);
    }

    static String sanitize(String prompt) {
        String sanitized = prompt;
        for (Pattern pattern : INJECTION_PATTERNS) {
            sanitized = pattern.matcher(sanitized).replaceAll("[FILTERED]");
        }
        return sanitized;
    }
}
