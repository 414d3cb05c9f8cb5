package com.flowys.flowys_backend.model.dto;

import com.flowys.flowys_backend.model.domain.NodeType;

import java.util.Map;

/** Request body for POST /api/nodes/test: run one node in isolation. */
public record NodeTestRequest(
    NodeType nodeType,
    Map<String, Object> config,
    Map<String, Object> input
) {}
