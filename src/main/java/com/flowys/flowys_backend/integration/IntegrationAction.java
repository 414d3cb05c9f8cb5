package com.flowys.flowys_backend.integration;

import java.util.List;

/** One callable operation of an integration; inputFields lists the input keys it reads. */
public record IntegrationAction(String id, String name, String description, List<String> inputFields) {
}
