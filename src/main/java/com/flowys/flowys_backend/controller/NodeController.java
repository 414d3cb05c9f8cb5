package com.flowys.flowys_backend.controller;

import com.flowys.flowys_backend.model.dto.NodeTestRequest;
import com.flowys.flowys_backend.model.dto.NodeValidationRequest;
import com.flowys.flowys_backend.model.execution.ConfigValidation;
import com.flowys.flowys_backend.model.execution.NodeResult;
import com.flowys.flowys_backend.service.NodeService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/nodes")
@RequiredArgsConstructor
public class NodeController {

    private final NodeService nodeService;

    @GetMapping
    public List<NodeService.NodeTypeInfo> catalogue() {
        return nodeService.catalogue();
    }

    @PostMapping("/validate")
    public ConfigValidation validate(@RequestBody NodeValidationRequest request) {
        if (request.type() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "type is required");
        }
        return nodeService.validate(request.type(), request.config());
    }

    // POST /api/nodes/test: one node, no graph, empty global context
    @PostMapping("/test")
    public NodeResult test(@RequestBody NodeTestRequest request) {
        if (request.nodeType() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "nodeType is required");
        }
        return nodeService.test(request.nodeType(), request.config(), request.input());
    }
}
