package com.flowys.flowys_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Per-node log entry. Created when the node starts and updated in place as it finishes.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionLog {
    private String nodeId;
    private String nodeName;
    private NodeStatus status = NodeStatus.PENDING;
    private Map<String, Object> input;
    private Map<String, Object> output;
    private String error;
    private Instant startedAt;
    private Instant completedAt;
    private Long duration;

    public static ExecutionLog running(String nodeId, String nodeName) {
        ExecutionLog log = new ExecutionLog();
        log.nodeId    = nodeId;
        log.nodeName  = nodeName;
        log.status    = NodeStatus.RUNNING;
        log.startedAt = Instant.now();
        return log;
    }

    public void complete(Map<String, Object> output) {
        this.status = NodeStatus.COMPLETED;
        this.output = output;
        finish();
    }

    public void fail(String error) {
        this.status = NodeStatus.FAILED;
        this.error  = error;
        finish();
    }

    private void finish() {
        this.completedAt = Instant.now();
        this.duration = completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
