package com.flowys.flowys_backend.integration;

import java.util.Map;

public record ActionContext(ConnectionData connection, Map<String, Object> input) {
}
