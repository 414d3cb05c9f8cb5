package com.flowys.flowys_backend.service;

import com.flowys.flowys_backend.engine.ExecutionEventPublisher;
import com.flowys.flowys_backend.engine.WorkflowExecutor;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.domain.WorkflowNode;
import com.flowys.flowys_backend.model.dto.CreditUsage;
import com.flowys.flowys_backend.model.dto.ExecuteWorkflowRequest;
import com.flowys.flowys_backend.model.dto.WorkflowRunResponse;
import com.flowys.flowys_backend.model.execution.WorkflowExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps an executor run with everything around it: the credit check before, the deduction
 * after, lifecycle events, and for async runs the bookkeeping that makes them cancellable.
 */
@Slf4j
@Service
public class WorkflowService {

    public record CostEstimate(long total, Map<NodeType, Long> byType) {}

    private final WorkflowExecutor executor;
    private final CreditLedger creditLedger;
    private final ExecutionEventPublisher events;
    private final ExecutorService runExecutor;

    static final String CANCELLED_BEFORE_START = "Execution cancelled";

    // executionId -> in-flight async run
    private final Map<String, QueuedRun> running = new ConcurrentHashMap<>();

    // claimed by whichever comes first: the worker starting the run or a cancel while still queued
    private record QueuedRun(Future<?> future, AtomicBoolean claimed) {}

    public WorkflowService(WorkflowExecutor executor,
                           CreditLedger creditLedger,
                           ExecutionEventPublisher events,
                           @Qualifier("workflowRunExecutor") ExecutorService runExecutor) {
        this.executor = executor;
        this.creditLedger = creditLedger;
        this.events = events;
        this.runExecutor = runExecutor;
    }

    /**
     * Runs the workflow on the calling thread and returns the finished execution record.
     *
     * @throws InsufficientCreditsException before anything runs when the owner cannot afford it
     */
    public WorkflowRunResponse execute(String ownerId, ExecuteWorkflowRequest request) {
        requireCredits(ownerId, request.nodes());
        return run(UUID.randomUUID().toString(), ownerId, request);
    }

    /**
     * Starts the workflow on the worker pool and returns its execution id. Progress is published
     * to /topic/execution/{executionId}.
     */
    public String executeAsync(String ownerId, ExecuteWorkflowRequest request) {
        requireCredits(ownerId, request.nodes());
        String executionId = UUID.randomUUID().toString();

        AtomicBoolean claimed = new AtomicBoolean();
        FutureTask<Void> task = new FutureTask<>(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                run(executionId, ownerId, request);
            } catch (RuntimeException ex) {
                String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                log.error("[Workflow] Async execution {} crashed: {}", executionId, msg, ex);
                events.workflowFinished(executionId, false, Map.of("status", "failed", "error", msg));
            } finally {
                running.remove(executionId);
            }
        }, null);

        running.put(executionId, new QueuedRun(task, claimed));
        runExecutor.execute(task);
        log.info("[Workflow] Queued async execution {} ({} nodes) for {}", executionId, request.nodes().size(), ownerId);
        return executionId;
    }

    /**
     * Interrupts a running async execution. The run stops before its next node and reports
     * "Execution cancelled"; in-flight HTTP and LLM calls are abandoned. A run still waiting
     * for a worker never starts and its failure event is published here instead.
     *
     * @return false when no execution with that id is running
     */
    public boolean cancel(String executionId) {
        QueuedRun queued = running.remove(executionId);
        if (queued == null) {
            return false;
        }
        if (queued.claimed().compareAndSet(false, true)) {
            queued.future().cancel(false);
            events.workflowFinished(executionId, false,
                    Map.of("status", "failed", "error", CANCELLED_BEFORE_START));
            log.info("[Workflow] Cancelled execution {} before it started", executionId);
            return true;
        }
        queued.future().cancel(true);
        log.info("[Workflow] Cancel requested for execution {}", executionId);
        return true;
    }

    public Set<String> runningExecutions() {
        return Set.copyOf(running.keySet());
    }

    public CostEstimate estimate(List<WorkflowNode> nodes) {
        Map<NodeType, Long> byType = new EnumMap<>(NodeType.class);
        for (WorkflowNode node : nodes) {
            if (node != null && node.getType() != null) {
                byType.merge(node.getType(), (long) node.getType().getCreditCost(), Long::sum);
            }
        }
        return new CostEstimate(CreditLedger.calculateCost(nodes), byType);
    }

    private void requireCredits(String ownerId, List<WorkflowNode> nodes) {
        CreditLedger.CreditCheck check = creditLedger.hasEnoughCredits(ownerId, nodes);
        if (!check.hasCredits()) {
            log.info("[Workflow] {} has {} credits, run needs {}", ownerId, check.remaining(), check.required());
            throw new InsufficientCreditsException(check.required(), check.remaining());
        }
    }

    private WorkflowRunResponse run(String executionId, String ownerId, ExecuteWorkflowRequest request) {
        Instant startedAt = Instant.now();
        Map<String, Object> input = new LinkedHashMap<>(request.input());

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("executionId", executionId);
        started.put("workflowId", request.workflowId());
        started.put("nodeCount", request.nodes().size());
        events.workflowStarted(executionId, started);

        WorkflowExecutionResult result = executor.execute(request.nodes(), request.edges(), input,
                (entry, logs) -> events.nodeUpdated(executionId, entry));

        long cost = CreditLedger.calculateCost(request.nodes());
        CreditLedger.CreditDeduction deduction = creditLedger.deductCredits(ownerId, cost);
        if (!deduction.success()) {
            log.warn("[Workflow] Could not charge {} credits to {} for {}: {}", cost, ownerId, executionId, deduction.error());
        }

        WorkflowRunResponse response = WorkflowRunResponse.of(executionId, request.workflowId(), input, result,
                startedAt, new CreditUsage(cost, deduction.remaining()));

        Map<String, Object> finished = new LinkedHashMap<>();
        finished.put("status", response.status());
        finished.put("output", response.output());
        finished.put("error", response.error());
        finished.put("errorAnalysis", response.errorAnalysis());
        finished.put("duration", response.duration());
        finished.put("credits", response.credits());
        events.workflowFinished(executionId, result.isSuccess(), finished);

        log.info("[Workflow] Execution {} {} in {}ms", executionId, response.status(), response.duration());
        return response;
    }
}
