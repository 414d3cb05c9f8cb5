package com.flowys.flowys_backend.integration;

import java.util.List;

public record IntegrationDefinition(String id,
                                    String name,
                                    String description,
                                    AuthType authType,
                                    List<IntegrationAction> actions) {

    public enum AuthType { API_KEY, BASIC_AUTH, OAUTH2, NONE }
}
