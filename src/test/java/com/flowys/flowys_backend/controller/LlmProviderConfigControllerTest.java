package com.flowys.flowys_backend.controller;

import com.flowys.flowys_backend.executor.llm.LlmClient;
import com.flowys.flowys_backend.executor.llm.LlmClientFactory;
import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.domain.LlmProviderConfig;
import com.flowys.flowys_backend.repository.LlmProviderConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LlmProviderConfigController.class)
class LlmProviderConfigControllerTest {

    private static final String KEY = "sk-abcdefghijklmnop1234";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private LlmProviderConfigRepository repo;

    @MockBean
    private LlmClientFactory clientFactory;

    @BeforeEach
    void setUp() {
        LlmClient client = mock(LlmClient.class);
        when(client.getDefaultModel()).thenReturn("model-default");
        when(client.getKnownModels()).thenReturn(new String[]{"model-default", "model-large"});
        when(clientFactory.getClient(any(LlmProvider.class))).thenReturn(client);
        when(repo.save(any(LlmProviderConfig.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static LlmProviderConfig stored(LlmProvider provider, String apiKey) {
        LlmProviderConfig cfg = new LlmProviderConfig();
        cfg.setProvider(provider);
        cfg.setApiKey(apiKey);
        cfg.setCustomEndpoint("https://proxy.internal/v1");
        return cfg;
    }

    @Nested
    class Listing {

        @Test
        void shouldListEveryProviderWithMaskedKey() throws Exception {
            when(repo.findAll()).thenReturn(List.of(stored(LlmProvider.OPENAI, KEY)));

            String body = mvc.perform(get("/api/llm-providers"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(LlmProvider.values().length))
                    .andExpect(jsonPath("$[0].provider").value("openai"))
                    .andExpect(jsonPath("$[0].configured").value(true))
                    .andExpect(jsonPath("$[0].enabled").value(true))
                    .andExpect(jsonPath("$[0].defaultModel").value("model-default"))
                    .andExpect(jsonPath("$[0].knownModels[1]").value("model-large"))
                    .andExpect(jsonPath("$[0].customEndpoint").value("https://proxy.internal/v1"))
                    .andExpect(jsonPath("$[1].provider").value("anthropic"))
                    .andExpect(jsonPath("$[1].configured").value(false))
                    .andReturn().getResponse().getContentAsString(StandardCharsets.UTF_8);

            assertThat(body).doesNotContain(KEY).contains("sk-a••••••••1234");
        }
    }

    @Nested
    class Saving {

        @Test
        void shouldStoreKeyAndEchoOnlyTheMask() throws Exception {
            when(repo.findByProvider(LlmProvider.ANTHROPIC)).thenReturn(Optional.empty());

            String body = mvc.perform(post("/api/llm-providers")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"provider\":\"anthropic\",\"apiKey\":\"  " + KEY + "  \",\"customEndpoint\":\" \"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.provider").value("anthropic"))
                    .andExpect(jsonPath("$.configured").value(true))
                    .andExpect(jsonPath("$.apiKey").doesNotExist())
                    .andReturn().getResponse().getContentAsString(StandardCharsets.UTF_8);

            assertThat(body).doesNotContain(KEY).contains("sk-a••••••••1234");
            verify(repo).save(argThat(cfg ->
                    KEY.equals(cfg.getApiKey()) && cfg.getCustomEndpoint() == null && cfg.isEnabled()));
        }

        @Test
        void shouldRejectMissingProvider() throws Exception {
            mvc.perform(post("/api/llm-providers")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"apiKey\":\"" + KEY + "\"}"))
                    .andExpect(status().isBadRequest());

            verify(repo, never()).save(any());
        }

        @Test
        void shouldRejectBlankApiKey() throws Exception {
            mvc.perform(post("/api/llm-providers")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"provider\":\"openai\",\"apiKey\":\"   \"}"))
                    .andExpect(status().isBadRequest());

            verify(repo, never()).save(any());
        }

        @Test
        void shouldRejectUnknownProvider() throws Exception {
            mvc.perform(post("/api/llm-providers")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"provider\":\"mistral\",\"apiKey\":\"" + KEY + "\"}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    class Deleting {

        @Test
        void shouldDeleteStoredConfig() throws Exception {
            LlmProviderConfig cfg = stored(LlmProvider.OPENAI, KEY);
            when(repo.findByProvider(LlmProvider.OPENAI)).thenReturn(Optional.of(cfg));

            mvc.perform(delete("/api/llm-providers/openai"))
                    .andExpect(status().isNoContent());

            verify(repo).delete(cfg);
        }

        @Test
        void shouldRejectUnknownProviderOnDelete() throws Exception {
            mvc.perform(delete("/api/llm-providers/mistral"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Test
    void shouldMaskShortKeysCompletely() {
        assertThat(LlmProviderConfigController.maskKey(null)).isEqualTo("****");
        assertThat(LlmProviderConfigController.maskKey("sk-short")).isEqualTo("****");
        assertThat(LlmProviderConfigController.maskKey("sk-1234abcdef")).isEqualTo("sk-1••••••••cdef");
    }
}
