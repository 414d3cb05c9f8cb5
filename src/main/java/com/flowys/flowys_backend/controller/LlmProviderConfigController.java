package com.flowys.flowys_backend.controller;

import com.flowys.flowys_backend.executor.llm.LlmClient;
import com.flowys.flowys_backend.executor.llm.LlmClientFactory;
import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.domain.LlmProviderConfig;
import com.flowys.flowys_backend.repository.LlmProviderConfigRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/llm-providers")
public class LlmProviderConfigController {

    private final LlmProviderConfigRepository repo;
    private final LlmClientFactory clientFactory;

    public LlmProviderConfigController(LlmProviderConfigRepository repo, LlmClientFactory clientFactory) {
        this.repo = repo;
        this.clientFactory = clientFactory;
    }

    @GetMapping
    public List<Map<String, Object>> listProviders() {
        Map<LlmProvider, LlmProviderConfig> saved = repo.findAll()
                .stream()
                .collect(Collectors.toMap(LlmProviderConfig::getProvider, c -> c));

        return Arrays.stream(LlmProvider.values())
                .map(p -> {
                    LlmClient client = clientFactory.getClient(p);
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("provider", p.id());
                    entry.put("displayName", p.getDisplayName());
                    entry.put("knownModels", client.getKnownModels());
                    entry.put("defaultModel", client.getDefaultModel());

                    LlmProviderConfig cfg = saved.get(p);
                    entry.put("configured", cfg != null);
                    entry.put("enabled", cfg != null && cfg.isEnabled());
                    entry.put("apiKeyMasked", cfg != null ? maskKey(cfg.getApiKey()) : null);
                    entry.put("customEndpoint", cfg != null ? cfg.getCustomEndpoint() : null);
                    return entry;
                })
                .collect(Collectors.toList());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> saveProvider(@RequestBody Map<String, Object> body) {
        Object providerValue = body.get("provider");
        Object apiKeyValue = body.get("apiKey");
        Object endpointValue = body.get("customEndpoint");

        if (!(providerValue instanceof String providerStr)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "provider is required");
        }
        LlmProvider provider = parseProvider(providerStr);

        if (!(apiKeyValue instanceof String apiKey) || apiKey.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "apiKey is required");
        }

        LlmProviderConfig cfg = repo.findByProvider(provider).orElseGet(LlmProviderConfig::new);
        cfg.setProvider(provider);
        cfg.setApiKey(apiKey.trim());
        cfg.setCustomEndpoint(endpointValue instanceof String e && !e.isBlank() ? e.trim() : null);
        cfg.setEnabled(!Boolean.FALSE.equals(body.get("enabled")));

        LlmProviderConfig stored = repo.save(cfg);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("provider", stored.getProvider().id());
        response.put("configured", true);
        response.put("enabled", stored.isEnabled());
        response.put("apiKeyMasked", maskKey(stored.getApiKey()));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{provider}")
    public ResponseEntity<Void> deleteProvider(@PathVariable String provider) {
        LlmProvider p = parseProvider(provider);
        repo.findByProvider(p).ifPresent(repo::delete);
        return ResponseEntity.noContent().build();
    }

    private LlmProvider parseProvider(String s) {
        return LlmProvider.fromId(s)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + s));
    }

    static String maskKey(String key) {
        if (key == null || key.length() < 10) return "****";
        return key.substring(0, 4) + "••••••••" + key.substring(key.length() - 4);
    }
}
