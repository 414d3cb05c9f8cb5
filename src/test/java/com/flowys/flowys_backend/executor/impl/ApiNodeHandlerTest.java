package com.flowys.flowys_backend.executor.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.executor.PathResolver;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ApiNodeHandlerTest {

    private MockRestServiceServer server;
    private ApiNodeHandler handler;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ObjectMapper mapper = new ObjectMapper();
        handler = new ApiNodeHandler(restTemplate, new PathResolver(mapper), mapper, Duration.ofSeconds(30));
    }

    private NodeResult run(Map<String, Object> config, Map<String, Object> inputs) {
        return handler.execute(NodeContext.builder()
                .nodeId("api")
                .config(new HashMap<>(config))
                .inputs(new HashMap<>(inputs))
                .build());
    }

    @Nested
    class Success {

        @Test
        void shouldInterpolateUrlAndSpreadJsonObject() {
            server.expect(requestTo("https://api.test/users/7"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("{\"name\":\"Ada\",\"id\":7}", MediaType.APPLICATION_JSON));

            NodeResult result = run(Map.of("url", "https://api.test/users/{{userId}}"), Map.of("userId", 7));

            server.verify();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).containsEntry("name", "Ada").containsEntry("id", 7);
        }

        @Test
        void shouldWrapJsonArrayAsDataAndCount() {
            server.expect(requestTo("https://api.test/items"))
                    .andRespond(withSuccess("[1,2,3]", MediaType.APPLICATION_JSON));

            NodeResult result = run(Map.of("url", "https://api.test/items"), Map.of());

            assertThat(result.getOutput()).isEqualTo(Map.of("data", List.of(1, 2, 3), "count", 3));
        }

        @Test
        void shouldWrapTextBodyAsResponse() {
            server.expect(requestTo("https://api.test/ping"))
                    .andRespond(withSuccess("pong", MediaType.TEXT_PLAIN));

            assertThat(run(Map.of("url", "https://api.test/ping"), Map.of()).getOutput())
                    .isEqualTo(Map.of("response", "pong"));
        }

        @Test
        void shouldSendInterpolatedBodyForPost() {
            server.expect(requestTo("https://api.test/users"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("Content-Type", "application/json"))
                    .andExpect(header("X-Token", "abc"))
                    .andExpect(content().string("{\"name\": \"Ada\"}"))
                    .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

            NodeResult result = run(Map.of(
                    "url", "https://api.test/users",
                    "method", "post",
                    "headers", Map.of("X-Token", "{{token}}"),
                    "body", "{\"name\": \"{{name}}\"}"),
                    Map.of("name", "Ada", "token", "abc"));

            server.verify();
            assertThat(result.getOutput()).containsEntry("ok", true);
        }

        @Test
        void shouldApplyResponseMapping() {
            server.expect(requestTo("https://api.test/me"))
                    .andRespond(withSuccess("{\"profile\":{\"email\":\"a@b.c\"}}", MediaType.APPLICATION_JSON));

            NodeResult result = run(Map.of("url", "https://api.test/me",
                    "responseMapping", Map.of("email", "profile.email")), Map.of());

            assertThat(result.getOutput()).isEqualTo(Map.of("email", "a@b.c"));
        }

        @Test
        void shouldPercentEncodeInterpolatedQueryValues() {
            server.expect(requestTo("https://api.test/search?q=hello%20world"))
                    .andRespond(withSuccess("{\"hits\":1}", MediaType.APPLICATION_JSON));

            NodeResult result = run(Map.of("url", "https://api.test/search?q={{query}}"), Map.of("query", "hello world"));

            server.verify();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).containsEntry("hits", 1);
        }

        @Test
        void shouldKeepAlreadyEncodedUrls() {
            server.expect(requestTo("https://api.test/search?q=a%20b"))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertThat(run(Map.of("url", "https://api.test/search?q=a%20b"), Map.of()).isSuccess()).isTrue();
            server.verify();
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldRejectPlaceholderUrl() {
            NodeResult result = run(Map.of("url", ApiNodeHandler.PLACEHOLDER_URL), Map.of());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).startsWith("Please configure a valid API URL.");
        }

        @Test
        void shouldRejectRelativeUrl() {
            NodeResult result = run(Map.of("url", "not a url"), Map.of());

            assertThat(result.getError())
                    .isEqualTo("Invalid URL format: \"not a url\". Make sure the URL starts with http:// or https://");
        }

        @Test
        void shouldDescribeErrorStatusWithTruncatedBody() {
            server.expect(requestTo("https://api.test/x"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND).body("x".repeat(250)));

            NodeResult result = run(Map.of("url", "https://api.test/x"), Map.of());

            assertThat(result.getError())
                    .startsWith("API returned error 404 (Not Found): xxx")
                    .endsWith("x.... Check the API URL and any required authentication.");
        }

        @Test
        void shouldReportInvalidJson() {
            server.expect(requestTo("https://api.test/x"))
                    .andRespond(withSuccess("{broken", MediaType.APPLICATION_JSON));

            assertThat(run(Map.of("url", "https://api.test/x"), Map.of()).getError())
                    .isEqualTo("The API returned invalid JSON. Check that the API endpoint returns valid JSON data.");
        }

        @Test
        void shouldReportTimeout() {
            server.expect(requestTo("https://api.test/slow"))
                    .andRespond(withException(new SocketTimeoutException("Read timed out")));

            assertThat(run(Map.of("url", "https://api.test/slow"), Map.of()).getError())
                    .isEqualTo("The API request timed out after 30 seconds. The server may be slow or unreachable.");
        }

        @Test
        void shouldReportConnectionFailure() {
            server.expect(requestTo("https://api.test/down"))
                    .andRespond(withException(new ConnectException("Connection refused")));

            assertThat(run(Map.of("url", "https://api.test/down"), Map.of()).getError())
                    .isEqualTo("Could not connect to the API. Check your internet connection and verify the API URL is correct.");
        }
    }

    @Test
    void shouldValidateUrlAndMethod() {
        assertThat(handler.validateConfig(Map.of("method", "FETCH")).errors())
                .containsExactly("url is required and must be a string", "method must be GET, POST, PUT, DELETE, or PATCH");
        assertThat(handler.validateConfig(Map.of("url", "https://x", "method", "GET")).valid()).isTrue();
    }
}
