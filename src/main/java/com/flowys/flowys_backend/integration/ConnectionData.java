package com.flowys.flowys_backend.integration;

import java.util.Map;
import java.util.UUID;

/** A stored connection with its credentials decrypted, handed to one action call. */
public record ConnectionData(UUID id,
                             String integrationId,
                             String name,
                             Map<String, Object> credentials,
                             Map<String, Object> metadata) {

    public String credential(String key) {
        Object value = credentials.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
