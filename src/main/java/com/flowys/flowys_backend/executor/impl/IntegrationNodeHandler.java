package com.flowys.flowys_backend.executor.impl;

import com.flowys.flowys_backend.executor.ConfigValues;
import com.flowys.flowys_backend.executor.NodeHandler;
import com.flowys.flowys_backend.integration.ActionContext;
import com.flowys.flowys_backend.integration.ActionResult;
import com.flowys.flowys_backend.integration.ConnectionData;
import com.flowys.flowys_backend.integration.CredentialCipher;
import com.flowys.flowys_backend.integration.Integration;
import com.flowys.flowys_backend.integration.IntegrationRegistry;
import com.flowys.flowys_backend.model.domain.IntegrationConnection;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import com.flowys.flowys_backend.repository.IntegrationConnectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs an action of a registered integration through one of the user's stored connections.
 *
 * Config shape:
 * {
 *   "connectionId":  "3f0c...",
 *   "integrationId": "http-request",
 *   "actionId":      "request",
 *   "input":         { "method": "POST", "path": "/v1/items" }
 * }
 *
 * Static "input" is merged with the node's upstream inputs; upstream values win.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntegrationNodeHandler implements NodeHandler {

    private final IntegrationConnectionRepository connectionRepository;
    private final IntegrationRegistry integrationRegistry;
    private final CredentialCipher credentialCipher;

    @Override
    public NodeType supportedType() {
        return NodeType.INTEGRATION;
    }

    @Override
    public NodeResult execute(NodeContext context) {
        Map<String, Object> cfg = context.getConfig();
        String connectionId = ConfigValues.string(cfg, "connectionId");
        String actionId = ConfigValues.string(cfg, "actionId");

        if (connectionId == null || connectionId.isBlank()) {
            return NodeResult.failure("Connection ID is required");
        }
        if (actionId == null || actionId.isBlank()) {
            return NodeResult.failure("Action ID is required");
        }

        try {
            Optional<IntegrationConnection> found = findConnection(connectionId);
            if (found.isEmpty()) {
                return NodeResult.failure("Connection not found: " + connectionId);
            }
            IntegrationConnection connection = found.get();
            if (!connection.isEnabled()) {
                return NodeResult.failure("Connection is disabled");
            }

            Optional<Integration> integration = integrationRegistry.get(connection.getIntegrationId());
            if (integration.isEmpty()) {
                return NodeResult.failure("Integration not found: " + connection.getIntegrationId());
            }
            if (integration.get().findAction(actionId).isEmpty()) {
                return NodeResult.failure("Action not found: " + actionId);
            }

            ConnectionData data = new ConnectionData(
                    connection.getId(),
                    connection.getIntegrationId(),
                    connection.getName(),
                    credentialCipher.decrypt(connection.getEncryptedCredentials()),
                    connection.getMetadata() != null ? connection.getMetadata() : Map.of());

            Map<String, Object> actionInput = new LinkedHashMap<>(ConfigValues.map(cfg, "input"));
            actionInput.putAll(context.getInputs());

            log.info("[IntegrationNode] {} running {}.{} via connection {}",
                    context.getNodeId(), connection.getIntegrationId(), actionId, connection.getId());
            ActionResult result = integration.get().executeAction(actionId, new ActionContext(data, actionInput));

            connection.setLastUsedAt(Instant.now());
            connectionRepository.save(connection);

            if (result.success()) {
                return NodeResult.ok(result.output() != null ? result.output() : new LinkedHashMap<>());
            }
            return NodeResult.failure(result.error() != null ? result.error() : "Integration action failed");
        } catch (RuntimeException e) {
            log.warn("[IntegrationNode] {} failed: {}", context.getNodeId(), e.getMessage());
            return NodeResult.failure(e.getMessage() != null ? e.getMessage() : "Integration execution failed");
        }
    }

    @Override
    public ConfigValidation validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (ConfigValues.isBlank(config, "connectionId")) {
            errors.add("Connection ID is required");
        }
        if (ConfigValues.isBlank(config, "integrationId")) {
            errors.add("Integration ID is required");
        }
        if (ConfigValues.isBlank(config, "actionId")) {
            errors.add("Action ID is required");
        }
        return ConfigValidation.of(errors);
    }

    private Optional<IntegrationConnection> findConnection(String connectionId) {
        UUID id;
        try {
            id = UUID.fromString(connectionId.trim());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return connectionRepository.findById(id);
    }
}
