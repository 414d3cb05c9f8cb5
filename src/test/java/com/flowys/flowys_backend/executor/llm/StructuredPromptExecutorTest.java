package com.flowys.flowys_backend.executor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.llm.LlmRequest;
import com.flowys.flowys_backend.model.llm.LlmResponse;
import com.flowys.flowys_backend.model.llm.OutputSchema;
import com.flowys.flowys_backend.model.llm.PromptMessage;
import com.flowys.flowys_backend.model.llm.PromptSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StructuredPromptExecutorTest {

    private static final PromptSettings SETTINGS = new PromptSettings("gpt-4o", 0.2, 1000);
    private static final List<PromptMessage> MESSAGES =
            List.of(PromptMessage.system("sys"), PromptMessage.user("Describe the product"));
    private static final OutputSchema SCHEMA = OutputSchema.of(Map.of(
            "type", "object",
            "properties", Map.of("title", Map.of("type", "string"), "summary", Map.of("type", "string")),
            "required", List.of("title", "summary")));

    private LlmClient client;
    private LlmCredentialResolver credentials;
    private StructuredPromptExecutor executor;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        client = mock(LlmClient.class);
        when(client.getProvider()).thenReturn(LlmProvider.OPENAI);
        credentials = mock(LlmCredentialResolver.class);
        when(credentials.resolve(LlmProvider.OPENAI))
                .thenReturn(Optional.of(new LlmCredentialResolver.Credentials("sk-test", null)));

        executor = new StructuredPromptExecutor(
                new LlmClientFactory(List.of(client)),
                credentials,
                new JsonRepair(mapper),
                new SchemaValidator(),
                mapper);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static LlmResponse reply(String text) {
        return LlmResponse.ok(text, "gpt-4o", 10, 10);
    }

    @Nested
    class WithSchema {

        @Test
        void shouldReturnValidatedObjectOnFirstAttempt() {
            when(client.call(any(), anyString(), isNull()))
                    .thenReturn(reply("```json\n{\"title\":\"Lamp\",\"summary\":\"Bright\"}\n```"));

            Map<String, Object> result = executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA);

            assertThat(result).isEqualTo(Map.of("title", "Lamp", "summary", "Bright"));
            verify(client, times(1)).call(any(), anyString(), isNull());
        }

        @Test
        void shouldRetryOnceNamingTheMissingField() {
            when(client.call(any(), anyString(), isNull()))
                    .thenReturn(reply("{\"title\":\"Lamp\"}"))
                    .thenReturn(reply("{\"title\":\"Lamp\",\"summary\":\"Bright\"}"));

            Map<String, Object> result = executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA);

            assertThat(result).containsEntry("summary", "Bright");
            ArgumentCaptor<LlmRequest> requests = ArgumentCaptor.forClass(LlmRequest.class);
            verify(client, times(2)).call(requests.capture(), anyString(), isNull());

            List<PromptMessage> second = requests.getAllValues().get(1).getMessages();
            assertThat(second).hasSize(3);
            assertThat(second.get(2).role()).isEqualTo("user");
            assertThat(second.get(2).content())
                    .contains("missing required fields")
                    .contains("summary");
            assertThat(requests.getAllValues().get(0).getMessages()).hasSize(2);
        }

        @Test
        void shouldAskForShorterResponseWhenTruncated() {
            when(client.call(any(), anyString(), isNull()))
                    .thenReturn(reply("{\"title\":\"Lamp\",\"summ"))
                    .thenReturn(reply("{\"title\":\"Lamp\",\"summary\":\"Bright\"}"));

            executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA);

            ArgumentCaptor<LlmRequest> requests = ArgumentCaptor.forClass(LlmRequest.class);
            verify(client, times(2)).call(requests.capture(), anyString(), isNull());
            assertThat(requests.getAllValues().get(1).getMessages().get(2).content())
                    .isEqualTo(StructuredPromptExecutor.TRUNCATED_RETRY);
        }

        @Test
        void shouldGiveUpAfterThreeAttempts() {
            when(client.call(any(), anyString(), isNull())).thenReturn(reply("not json at all"));

            assertThatThrownBy(() -> executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA))
                    .isInstanceOf(StructuredOutputException.class)
                    .hasMessageStartingWith("Failed to get valid JSON response after 3 attempts. Last error:");

            ArgumentCaptor<LlmRequest> requests = ArgumentCaptor.forClass(LlmRequest.class);
            verify(client, times(3)).call(requests.capture(), anyString(), isNull());
            assertThat(requests.getAllValues().get(2).getMessages()).hasSize(4);
        }

        @Test
        void shouldReportTooLongWhenEveryAttemptIsCutOff() {
            when(client.call(any(), anyString(), isNull())).thenReturn(reply("{\"title\":\"Lamp\",\"summ"));

            assertThatThrownBy(() -> executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA))
                    .isInstanceOf(StructuredOutputException.class)
                    .hasMessage(StructuredPromptExecutor.TOO_LONG_ERROR);
        }

        @Test
        void shouldThrowAuthoritativeErrorsWithoutRetrying() {
            when(client.call(any(), anyString(), isNull()))
                    .thenReturn(LlmResponse.error("Incorrect API key provided", 401));

            assertThatThrownBy(() -> executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA))
                    .isInstanceOf(LlmProviderException.class)
                    .hasMessage("Incorrect API key provided");
            verify(client, times(1)).call(any(), anyString(), isNull());
        }

        @Test
        void shouldRetryTransientProviderErrors() {
            when(client.call(any(), anyString(), isNull()))
                    .thenReturn(LlmResponse.error("Service unavailable", 503))
                    .thenReturn(reply("{\"title\":\"Lamp\",\"summary\":\"Bright\"}"));

            Map<String, Object> result = executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA);

            assertThat(result).containsEntry("title", "Lamp");
            verify(client, times(2)).call(any(), anyString(), isNull());
        }
    }

    @Nested
    class WithoutSchema {

        @Test
        void shouldReturnJsonObjectReplyAsIs() {
            when(client.call(any(), anyString(), isNull())).thenReturn(reply("{\"answer\":42}"));

            assertThat(executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, null))
                    .isEqualTo(Map.of("answer", 42));
        }

        @Test
        void shouldWrapArrayReplyAsData() {
            when(client.call(any(), anyString(), isNull())).thenReturn(reply("[1,2]"));

            assertThat(executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, null))
                    .isEqualTo(Map.of("data", List.of(1, 2)));
        }

        @Test
        void shouldWrapTextReply() {
            when(client.call(any(), anyString(), isNull())).thenReturn(reply("Hello there"));

            assertThat(executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, null))
                    .isEqualTo(Map.of("response", "Hello there", "text", "Hello there"));
        }
    }

    @Test
    void shouldFailFastWithoutCredentials() {
        when(credentials.resolve(LlmProvider.OPENAI)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA))
                .isInstanceOf(LlmProviderException.class)
                .hasMessageStartingWith("No API key configured for OpenAI");
        verify(client, never()).call(any(), any(), any());
    }

    @Test
    void shouldStopWhenThreadIsInterrupted() {
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> executor.executePrompt(LlmProvider.OPENAI, SETTINGS, MESSAGES, SCHEMA))
                .isInstanceOf(LlmProviderException.class)
                .hasMessage("AI request cancelled");
        verify(client, never()).call(any(), any(), any());
    }
}
