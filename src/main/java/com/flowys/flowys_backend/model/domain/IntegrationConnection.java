package com.flowys.flowys_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A user's saved connection to a third-party integration.
 * Integration nodes reference it by id instead of embedding credentials in the workflow.
 *
 * Credentials are stored encrypted (see CredentialCipher) and only decrypted for the
 * duration of a single action call.
 */
@Entity
@Table(name = "integration_connections")
@Data
public class IntegrationConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    // Id of the registered Integration bean, e.g. "http-request"
    @Column(name = "integration_id", nullable = false)
    private String integrationId;

    @Column(nullable = false)
    private String name;

    // hex(iv):hex(ciphertext) of the JSON credential map
    @Column(name = "encrypted_credentials", columnDefinition = "text")
    private String encryptedCredentials;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() { updatedAt = Instant.now(); }
}
