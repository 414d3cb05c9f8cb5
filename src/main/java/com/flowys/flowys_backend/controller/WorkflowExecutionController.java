package com.flowys.flowys_backend.controller;

import com.flowys.flowys_backend.model.dto.ExecuteWorkflowRequest;
import com.flowys.flowys_backend.model.dto.WorkflowRunResponse;
import com.flowys.flowys_backend.service.InsufficientCreditsException;
import com.flowys.flowys_backend.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowExecutionController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final WorkflowService workflowService;

    // POST /api/workflows/execute: runs to completion and returns the execution record
    @PostMapping("/execute")
    public WorkflowRunResponse execute(@RequestHeader(value = OWNER_HEADER, defaultValue = "anonymous") String ownerId,
                                       @RequestBody ExecuteWorkflowRequest request) {
        return workflowService.execute(ownerId, request);
    }

    // POST /api/workflows/execute/async: returns immediately; progress on /topic/execution/{executionId}
    @PostMapping("/execute/async")
    public ResponseEntity<Map<String, String>> executeAsync(
            @RequestHeader(value = OWNER_HEADER, defaultValue = "anonymous") String ownerId,
            @RequestBody ExecuteWorkflowRequest request) {
        String executionId = workflowService.executeAsync(ownerId, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("executionId", executionId));
    }

    @PostMapping("/estimate")
    public WorkflowService.CostEstimate estimate(@RequestBody ExecuteWorkflowRequest request) {
        return workflowService.estimate(request.nodes());
    }

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<Map<String, Object>> insufficientCredits(InsufficientCreditsException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Insufficient credits");
        body.put("details", ex.getMessage());
        body.put("code", "INSUFFICIENT_CREDITS");
        body.put("required", ex.getRequired());
        body.put("remaining", ex.getRemaining());
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(body);
    }
}
