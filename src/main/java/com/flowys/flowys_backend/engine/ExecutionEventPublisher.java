package com.flowys.flowys_backend.engine;

import com.flowys.flowys_backend.model.execution.ExecutionLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes execution progress to STOMP subscribers of /topic/execution/{executionId}.
 *
 * Envelope: { event, executionId, timestamp, data }. Events are workflow.started,
 * node.running / node.completed / node.failed, and workflow.completed / workflow.failed.
 * Goes through the Redis bridge when one is configured so every instance can deliver it.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    public static final String WORKFLOW_STARTED = "workflow.started";
    public static final String WORKFLOW_COMPLETED = "workflow.completed";
    public static final String WORKFLOW_FAILED = "workflow.failed";

    private static final String TOPIC = "/topic/execution/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisEventBridge> redisBridgeProvider;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisEventBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void workflowStarted(String executionId, Map<String, Object> data) {
        publish(executionId, WORKFLOW_STARTED, data);
    }

    public void nodeUpdated(String executionId, ExecutionLog entry) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("nodeId", entry.getNodeId());
        data.put("nodeName", entry.getNodeName());
        data.put("status", entry.getStatus().value());
        if (entry.getError() != null) data.put("error", entry.getError());
        if (entry.getDuration() != null) data.put("duration", entry.getDuration());
        publish(executionId, "node." + entry.getStatus().value(), data);
    }

    public void workflowFinished(String executionId, boolean success, Map<String, Object> data) {
        publish(executionId, success ? WORKFLOW_COMPLETED : WORKFLOW_FAILED, data);
    }

    private void publish(String executionId, String event, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", event);
        payload.put("executionId", executionId);
        payload.put("timestamp", Instant.now().toString());
        payload.put("data", data != null ? data : Map.of());

        String destination = TOPIC + executionId;
        RedisEventBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("[Events] {} -> {} via {}", event, destination, bridge != null ? "Redis" : "Direct");
        try {
            if (bridge != null) {
                bridge.publish(destination, payload);
            } else {
                messagingTemplate.convertAndSend(destination, payload);
            }
        } catch (MessagingException e) {
            log.warn("[Events] Could not deliver {} for execution {}: {}", event, executionId, e.getMessage());
        }
    }
}
