package com.flowys.flowys_backend.executor.llm;

import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.domain.LlmProviderConfig;
import com.flowys.flowys_backend.repository.LlmProviderConfigRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds the API key and endpoint for a provider: an enabled stored config first,
 * then the key from application configuration.
 */
@Component
public class LlmCredentialResolver {

    public record Credentials(String apiKey, String endpoint) {}

    private final LlmProviderConfigRepository repository;
    private final String openAiKey;
    private final String anthropicKey;

    public LlmCredentialResolver(LlmProviderConfigRepository repository,
                                 @Value("${flowys.llm.openai.api-key:}") String openAiKey,
                                 @Value("${flowys.llm.anthropic.api-key:}") String anthropicKey) {
        this.repository = repository;
        this.openAiKey = openAiKey;
        this.anthropicKey = anthropicKey;
    }

    public Optional<Credentials> resolve(LlmProvider provider) {
        Optional<LlmProviderConfig> stored = repository.findByProvider(provider)
                .filter(LlmProviderConfig::isEnabled)
                .filter(cfg -> cfg.getApiKey() != null && !cfg.getApiKey().isBlank());
        if (stored.isPresent()) {
            return stored.map(cfg -> new Credentials(cfg.getApiKey(), cfg.getCustomEndpoint()));
        }
        String configured = provider == LlmProvider.OPENAI ? openAiKey : anthropicKey;
        return configured == null || configured.isBlank()
                ? Optional.empty()
                : Optional.of(new Credentials(configured, null));
    }
}
