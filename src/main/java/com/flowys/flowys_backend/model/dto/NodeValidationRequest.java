package com.flowys.flowys_backend.model.dto;

import com.flowys.flowys_backend.model.domain.NodeType;

import java.util.Map;

public record NodeValidationRequest(NodeType type, Map<String, Object> config) {}
