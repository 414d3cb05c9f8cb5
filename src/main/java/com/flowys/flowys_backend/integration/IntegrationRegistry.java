package com.flowys.flowys_backend.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class IntegrationRegistry {

    private final Map<String, Integration> integrations = new LinkedHashMap<>();

    public IntegrationRegistry(List<Integration> beans) {
        for (Integration integration : beans) {
            String id = integration.definition().id();
            if (integrations.putIfAbsent(id, integration) != null) {
                throw new IllegalStateException("Duplicate integration id: " + id);
            }
        }
        log.info("[Integrations] Registered: {}", integrations.keySet());
    }

    public Optional<Integration> get(String id) {
        return Optional.ofNullable(id).map(integrations::get);
    }

    public Collection<IntegrationDefinition> definitions() {
        return integrations.values().stream().map(Integration::definition).toList();
    }
}
