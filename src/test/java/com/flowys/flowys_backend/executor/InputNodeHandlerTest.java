package com.flowys.flowys_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InputNodeHandlerTest {

    private InputNodeHandler handler;

    @BeforeEach
    void setUp() {
        handler = new InputNodeHandler(new ObjectMapper());
    }

    private NodeResult run(Map<String, Object> config, Map<String, Object> inputs) {
        return handler.execute(NodeContext.builder()
                .nodeId("in")
                .config(new HashMap<>(config))
                .inputs(new HashMap<>(inputs))
                .build());
    }

    @Nested
    class Execute {

        @Test
        void shouldPassInputsThroughWithoutFields() {
            NodeResult result = run(Map.of(), Map.of("a", 1, "b", "x"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).containsEntry("a", 1).containsEntry("b", "x");
        }

        @Test
        void shouldCoerceDeclaredFields() {
            Map<String, Object> config = Map.of("fields", List.of(
                    Map.of("name", "count", "type", "number"),
                    Map.of("name", "ratio", "type", "number"),
                    Map.of("name", "on", "type", "boolean"),
                    Map.of("name", "payload", "type", "json")));

            NodeResult result = run(config, Map.of(
                    "count", "42", "ratio", "0.5", "on", "true", "payload", "{\"k\":[1]}"));

            assertThat(result.getOutput())
                    .containsEntry("count", 42L)
                    .containsEntry("ratio", 0.5)
                    .containsEntry("on", true)
                    .containsEntry("payload", Map.of("k", List.of(1)));
        }

        @Test
        void shouldUseDefaultsAndZeroValuesForMissingFields() {
            Map<String, Object> config = Map.of("fields", List.of(
                    Map.of("name", "limit", "type", "number", "default", 10),
                    Map.of("name", "query", "type", "string", "required", true),
                    Map.of("name", "n", "type", "number")));

            NodeResult result = run(config, Map.of("query", ""));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput())
                    .containsEntry("limit", 10)
                    .containsEntry("query", "")
                    .containsEntry("n", 0L);
        }

        @Test
        void shouldKeepUncoercibleValuesAsIs() {
            Map<String, Object> config = Map.of("fields", List.of(
                    Map.of("name", "count", "type", "number"),
                    Map.of("name", "flag", "type", "boolean")));

            NodeResult result = run(config, Map.of("count", "many", "flag", "yes"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).containsEntry("count", "many").containsEntry("flag", "yes");
        }

        @Test
        void shouldDropUndeclaredInputsWhenFieldsAreDeclared() {
            Map<String, Object> config = Map.of("fields", List.of(Map.of("name", "a", "type", "string")));

            NodeResult result = run(config, Map.of("a", "x", "extra", 1));

            assertThat(result.getOutput()).containsOnlyKeys("a");
        }
    }

    @Nested
    class ValidateConfig {

        @Test
        void shouldRejectNonListFields() {
            assertThat(handler.validateConfig(Map.of("fields", "nope")).errors())
                    .containsExactly("fields must be an array");
            assertThat(handler.validateConfig(Map.of()).valid()).isTrue();
        }
    }
}
