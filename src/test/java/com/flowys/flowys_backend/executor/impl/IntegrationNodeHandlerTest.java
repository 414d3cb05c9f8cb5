package com.flowys.flowys_backend.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.integration.ActionContext;
import com.flowys.flowys_backend.integration.ActionResult;
import com.flowys.flowys_backend.integration.CredentialCipher;
import com.flowys.flowys_backend.integration.Integration;
import com.flowys.flowys_backend.integration.IntegrationAction;
import com.flowys.flowys_backend.integration.IntegrationDefinition;
import com.flowys.flowys_backend.integration.IntegrationRegistry;
import com.flowys.flowys_backend.model.domain.IntegrationConnection;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import com.flowys.flowys_backend.repository.IntegrationConnectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntegrationNodeHandlerTest {

    /** Echoes what it receives so tests can see the merged input and decrypted credentials. */
    static class EchoIntegration implements Integration {
        ActionContext lastContext;

        @Override
        public IntegrationDefinition definition() {
            return new IntegrationDefinition("echo", "Echo", "Returns its input",
                    IntegrationDefinition.AuthType.API_KEY,
                    List.of(new IntegrationAction("echo", "Echo", "Echo input", List.of()),
                            new IntegrationAction("fail", "Fail", "Always fails", List.of())));
        }

        @Override
        public ActionResult executeAction(String actionId, ActionContext context) {
            lastContext = context;
            if ("fail".equals(actionId)) {
                return ActionResult.failure("upstream said no");
            }
            return ActionResult.ok(new LinkedHashMap<>(context.input()));
        }
    }

    private IntegrationConnectionRepository repository;
    private CredentialCipher cipher;
    private EchoIntegration echo;
    private IntegrationNodeHandler handler;
    private IntegrationConnection connection;

    @BeforeEach
    void setUp() {
        repository = mock(IntegrationConnectionRepository.class);
        cipher = new CredentialCipher("test-secret", new ObjectMapper());
        echo = new EchoIntegration();
        handler = new IntegrationNodeHandler(repository, new IntegrationRegistry(List.of(echo)), cipher);

        connection = new IntegrationConnection();
        connection.setId(UUID.randomUUID());
        connection.setOwnerId("ada");
        connection.setIntegrationId("echo");
        connection.setName("My echo");
        connection.setEncryptedCredentials(cipher.encrypt(Map.of("apiKey", "secret")));
        when(repository.findById(connection.getId())).thenReturn(Optional.of(connection));
    }

    private NodeResult run(Map<String, Object> config, Map<String, Object> inputs) {
        return handler.execute(NodeContext.builder()
                .nodeId("int")
                .config(new HashMap<>(config))
                .inputs(new LinkedHashMap<>(inputs))
                .globalContext(new HashMap<>())
                .build());
    }

    private Map<String, Object> config(String actionId) {
        return Map.of("connectionId", connection.getId().toString(), "integrationId", "echo",
                "actionId", actionId, "input", Map.of("mode", "static", "keep", true));
    }

    @Nested
    class Execution {

        @Test
        void shouldMergeStaticInputWithUpstreamInputs() {
            NodeResult result = run(config("echo"), Map.of("mode", "upstream"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).isEqualTo(Map.of("mode", "upstream", "keep", true));
            assertThat(echo.lastContext.connection().credential("apiKey")).isEqualTo("secret");
        }

        @Test
        void shouldRecordLastUse() {
            run(config("echo"), Map.of());

            assertThat(connection.getLastUsedAt()).isNotNull();
            verify(repository).save(connection);
        }

        @Test
        void shouldSurfaceActionFailure() {
            NodeResult result = run(config("fail"), Map.of());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("upstream said no");
        }
    }

    @Nested
    class Rejections {

        @Test
        void shouldRequireConnectionAndAction() {
            assertThat(run(Map.of("actionId", "echo"), Map.of()).getError()).isEqualTo("Connection ID is required");
            assertThat(run(Map.of("connectionId", "x"), Map.of()).getError()).isEqualTo("Action ID is required");
        }

        @Test
        void shouldReportMissingConnection() {
            NodeResult result = run(Map.of("connectionId", "not-a-uuid", "actionId", "echo"), Map.of());

            assertThat(result.getError()).isEqualTo("Connection not found: not-a-uuid");
        }

        @Test
        void shouldRefuseDisabledConnection() {
            connection.setEnabled(false);

            assertThat(run(config("echo"), Map.of()).getError()).isEqualTo("Connection is disabled");
            verify(repository, never()).save(any());
        }

        @Test
        void shouldReportUnknownAction() {
            assertThat(run(config("explode"), Map.of()).getError()).isEqualTo("Action not found: explode");
        }

        @Test
        void shouldReportUnregisteredIntegration() {
            connection.setIntegrationId("gone");

            assertThat(run(config("echo"), Map.of()).getError()).isEqualTo("Integration not found: gone");
        }

        @Test
        void shouldFailCleanlyOnUnreadableCredentials() {
            connection.setEncryptedCredentials("garbage");

            assertThat(run(config("echo"), Map.of()).getError()).isEqualTo("Stored credentials are malformed");
        }
    }

    @Test
    void shouldValidateRequiredConfig() {
        assertThat(handler.validateConfig(Map.of()).errors())
                .containsExactly("Connection ID is required", "Integration ID is required", "Action ID is required");
        assertThat(handler.validateConfig(config("echo")).valid()).isTrue();
    }
}
