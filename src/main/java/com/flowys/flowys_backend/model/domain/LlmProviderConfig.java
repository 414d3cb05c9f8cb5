package com.flowys.flowys_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored credentials for one LLM provider. When a row exists and is enabled, its key
 * takes precedence over the key configured in application.yml.
 */
@Entity
@Table(name = "llm_provider_configs")
@Data
public class LlmProviderConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, unique = true)
    private LlmProvider provider;

    @Column(name = "api_key", nullable = false)
    private String apiKey;

    // Overrides the provider's public endpoint (proxies, Azure-style gateways)
    @Column(name = "custom_endpoint")
    private String customEndpoint;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() { updatedAt = Instant.now(); }
}
