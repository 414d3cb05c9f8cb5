package com.flowys.flowys_backend.controller;

import com.flowys.flowys_backend.integration.CredentialCipher;
import com.flowys.flowys_backend.integration.IntegrationDefinition;
import com.flowys.flowys_backend.integration.IntegrationRegistry;
import com.flowys.flowys_backend.model.domain.IntegrationConnection;
import com.flowys.flowys_backend.repository.IntegrationConnectionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Stored connections for integration nodes. Credentials go in encrypted and never come back out.
 */
@RestController
@RequestMapping("/api/integrations")
@RequiredArgsConstructor
public class IntegrationConnectionController {

    private final IntegrationConnectionRepository repo;
    private final IntegrationRegistry registry;
    private final CredentialCipher cipher;

    public record CreateConnectionRequest(String integrationId,
                                          String name,
                                          Map<String, Object> credentials,
                                          Map<String, Object> metadata) {}

    public record ConnectionSummary(UUID id,
                                    String integrationId,
                                    String name,
                                    Map<String, Object> metadata,
                                    boolean enabled,
                                    Instant lastUsedAt,
                                    Instant createdAt) {

        static ConnectionSummary of(IntegrationConnection c) {
            return new ConnectionSummary(c.getId(), c.getIntegrationId(), c.getName(), c.getMetadata(),
                    c.isEnabled(), c.getLastUsedAt(), c.getCreatedAt());
        }
    }

    // GET /api/integrations: registered integrations and their actions
    @GetMapping
    public Collection<IntegrationDefinition> definitions() {
        return registry.definitions();
    }

    @GetMapping("/connections")
    public List<ConnectionSummary> list(@RequestHeader(value = "X-Owner-Id", defaultValue = "anonymous") String ownerId) {
        return repo.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(ConnectionSummary::of)
                .toList();
    }

    @PostMapping("/connections")
    public ResponseEntity<ConnectionSummary> create(
            @RequestHeader(value = "X-Owner-Id", defaultValue = "anonymous") String ownerId,
            @RequestBody CreateConnectionRequest request) {
        if (request.integrationId() == null || registry.get(request.integrationId()).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Integration not found: " + request.integrationId());
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name is required");
        }

        IntegrationConnection connection = new IntegrationConnection();
        connection.setOwnerId(ownerId);
        connection.setIntegrationId(request.integrationId());
        connection.setName(request.name().trim());
        connection.setEncryptedCredentials(cipher.encrypt(request.credentials() != null ? request.credentials() : Map.of()));
        connection.setMetadata(request.metadata());

        IntegrationConnection saved = repo.save(connection);
        return ResponseEntity.status(HttpStatus.CREATED).body(ConnectionSummary.of(saved));
    }

    @PatchMapping("/connections/{id}/toggle")
    public ConnectionSummary toggle(@PathVariable UUID id) {
        IntegrationConnection connection = repo.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connection not found: " + id));
        connection.setEnabled(!connection.isEnabled());
        return ConnectionSummary.of(repo.save(connection));
    }

    @DeleteMapping("/connections/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        if (!repo.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Connection not found: " + id);
        }
        repo.deleteById(id);
        return ResponseEntity.noContent().build();
    }
}
