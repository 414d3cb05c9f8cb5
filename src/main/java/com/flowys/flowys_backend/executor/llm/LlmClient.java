package com.flowys.flowys_backend.executor.llm;

import com.flowys.flowys_backend.model.domain.LlmProvider;
import com.flowys.flowys_backend.model.llm.LlmRequest;
import com.flowys.flowys_backend.model.llm.LlmResponse;

public interface LlmClient {

    LlmProvider getProvider();

    /** One round trip to the provider. endpoint may be null for the provider's public endpoint. */
    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    String getDefaultModel();

    String[] getKnownModels();
}
