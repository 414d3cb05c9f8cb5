package com.flowys.flowys_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.execution.NodeContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private ConditionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ConditionEvaluator(new PathResolver(new ObjectMapper()));
    }

    private boolean eval(String condition, Map<String, Object> item) {
        return evaluator.evaluate(condition, Map.of("item", item));
    }

    @Nested
    class Comparisons {

        @Test
        void shouldCompareNumbersAfterCoercion() {
            assertThat(eval("item.score > 80", Map.of("score", 90))).isTrue();
            assertThat(eval("item.score > 80", Map.of("score", "85"))).isTrue();
            assertThat(eval("item.score >= 90", Map.of("score", 90))).isTrue();
            assertThat(eval("item.score <= 89", Map.of("score", 90))).isFalse();
            assertThat(eval("item.score < 100", Map.of("score", 90))).isTrue();
        }

        @Test
        void shouldNeverOrderMissingFields() {
            assertThat(eval("item.score < 50", Map.of("name", "x"))).isFalse();
            assertThat(eval("item.score > 0", Map.of())).isFalse();
            assertThat(eval("item.score >= 0", Map.of())).isFalse();
            assertThat(eval("item.score <= 0", Map.of())).isFalse();
        }

        @Test
        void shouldTreatExplicitNullAsZero() {
            Map<String, Object> item = new HashMap<>();
            item.put("score", null);

            assertThat(eval("item.score <= 0", item)).isTrue();
            assertThat(eval("item.score < 1", item)).isTrue();
            assertThat(eval("item.score > 0", item)).isFalse();
        }

        @Test
        void shouldFilterOutItemsWithoutTheComparedField() {
            LogicNodeHandler logic = new LogicNodeHandler(new PathResolver(new ObjectMapper()), evaluator);

            Object kept = logic.execute(NodeContext.builder()
                    .nodeId("f")
                    .config(Map.of("operation", "filter", "condition", "item.score < 50"))
                    .inputs(Map.of("data", List.of(Map.of("score", 10), Map.of("name", "no score"))))
                    .build()).getOutput().get("data");

            assertThat(kept).isEqualTo(List.of(Map.of("score", 10)));
        }

        @Test
        void shouldDistinguishLooseAndStrictEquality() {
            assertThat(eval("item.n == 5", Map.of("n", 5))).isTrue();
            assertThat(eval("item.n == '5'", Map.of("n", 5))).isTrue();
            assertThat(eval("item.n === '5'", Map.of("n", 5))).isFalse();
            assertThat(eval("item.n !== '5'", Map.of("n", 5))).isTrue();
            assertThat(eval("item.status != \"active\"", Map.of("status", "active"))).isFalse();
        }

        @Test
        void shouldResolveUnquotedRightSideAsPathThenLiteral() {
            Map<String, Object> scope = Map.of("item", Map.of("a", 3), "limit", 3);

            assertThat(evaluator.evaluate("item.a == limit", scope)).isTrue();
            assertThat(eval("item.status == active", Map.of("status", "active"))).isTrue();
        }
    }

    @Nested
    class StringAndPresenceOperators {

        @Test
        void shouldMatchSubstrings() {
            Map<String, Object> item = Map.of("name", "Ada Lovelace");

            assertThat(eval("item.name contains 'Love'", item)).isTrue();
            assertThat(eval("item.name startsWith 'Ada'", item)).isTrue();
            assertThat(eval("item.name endsWith 'Ada'", item)).isFalse();
        }

        @Test
        void shouldCheckExistenceAndEmptiness() {
            assertThat(eval("item.tags exists", Map.of("tags", List.of()))).isTrue();
            assertThat(eval("item.missing exists", Map.of())).isFalse();
            assertThat(eval("item.tags empty", Map.of("tags", List.of()))).isTrue();
            assertThat(eval("item.meta empty", Map.of("meta", Map.of()))).isTrue();
            assertThat(eval("item.name empty", Map.of("name", "x"))).isFalse();
        }
    }

    @Test
    void shouldFallBackToTruthinessForUnparsedExpressions() {
        assertThat(eval("item.active", Map.of("active", true))).isTrue();
        assertThat(eval("item.count", Map.of("count", 0))).isFalse();
        assertThat(eval("item.nothing", Map.of())).isFalse();
    }
}
