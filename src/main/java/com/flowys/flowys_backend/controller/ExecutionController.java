package com.flowys.flowys_backend.controller;

import com.flowys.flowys_backend.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final WorkflowService workflowService;

    // GET /api/executions: ids of async runs still in flight
    @GetMapping
    public Map<String, Set<String>> running() {
        return Map.of("running", workflowService.runningExecutions());
    }

    // DELETE /api/executions/{id}: interrupts a running async execution
    @DeleteMapping("/{executionId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String executionId) {
        if (!workflowService.cancel(executionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No running execution: " + executionId);
        }
        return ResponseEntity.ok(Map.of("executionId", executionId, "cancelled", true));
    }
}
