package com.flowys.flowys_backend.engine;

import com.flowys.flowys_backend.executor.NodeHandler;
import com.flowys.flowys_backend.executor.NodeHandlerRegistry;
import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.domain.WorkflowEdge;
import com.flowys.flowys_backend.model.domain.WorkflowNode;
import com.flowys.flowys_backend.model.execution.ErrorAnalysis;
import com.flowys.flowys_backend.model.execution.ExecutionContext;
import com.flowys.flowys_backend.model.execution.ExecutionLog;
import com.flowys.flowys_backend.model.execution.NodeContext;
import com.flowys.flowys_backend.model.execution.NodeResult;
import com.flowys.flowys_backend.model.execution.WorkflowExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a workflow graph to completion on the calling thread.
 *
 * Nodes execute one at a time in topological order. Each node's input is assembled from the
 * outputs of its incoming edges; the first failing node stops the run, and the nodes downstream
 * of it are reported in the error analysis without being executed.
 *
 * Cancellation is cooperative: interrupting the thread stops the run before the next node, and
 * the HTTP and LLM handlers abort their in-flight calls.
 */
@Slf4j
@Service
public class WorkflowExecutor {

    static final String CANCELLED = "Execution cancelled";

    private final NodeHandlerRegistry handlerRegistry;
    private final ErrorAnalyzer errorAnalyzer;

    public WorkflowExecutor(NodeHandlerRegistry handlerRegistry, ErrorAnalyzer errorAnalyzer) {
        this.handlerRegistry = handlerRegistry;
        this.errorAnalyzer = errorAnalyzer;
    }

    public WorkflowExecutionResult execute(List<WorkflowNode> nodes, List<WorkflowEdge> edges, Map<String, Object> input) {
        return execute(nodes, edges, input, ExecutionListener.NONE);
    }

    public WorkflowExecutionResult execute(List<WorkflowNode> nodes,
                                           List<WorkflowEdge> edges,
                                           Map<String, Object> input,
                                           ExecutionListener listener) {
        long startTime = System.currentTimeMillis();
        Map<String, Object> runInput = input != null ? input : Map.of();
        ExecutionContext context = new ExecutionContext(runInput);

        WorkflowGraph graph;
        List<String> order;
        try {
            graph = WorkflowGraph.of(nodes, edges);
            order = graph.topologicalOrder();
            for (WorkflowNode node : graph.nodes()) {
                if (!handlerRegistry.isSupported(node.getType())) {
                    throw new UnknownNodeTypeException(node.getType());
                }
            }
        } catch (WorkflowStructureException e) {
            log.warn("[Executor] Rejected workflow: {}", e.getMessage());
            return WorkflowExecutionResult.builder()
                    .success(false)
                    .error(e.getMessage())
                    .logs(context.snapshotLogs())
                    .executionOrder(List.of())
                    .duration(System.currentTimeMillis() - startTime)
                    .build();
        }

        log.info("[Executor] Running {} nodes, order={}", graph.size(), order);

        for (String nodeId : order) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(context, order, startTime);
            }

            WorkflowNode node = graph.node(nodeId);
            ExecutionLog entry = ExecutionLog.running(nodeId, node.displayName());
            context.getLogs().add(entry);
            notifyListener(listener, entry, context);

            Map<String, Object> nodeInputs = assembleInputs(graph, nodeId, context);
            if (node.getType() == NodeType.INPUT) {
                Map<String, Object> merged = new LinkedHashMap<>(runInput);
                merged.putAll(nodeInputs);
                nodeInputs = merged;
            }
            entry.setInput(nodeInputs);

            NodeResult result = invoke(node, nodeInputs, context);

            if (!result.isSuccess()) {
                String error = result.getError() != null ? result.getError() : "Unknown error";
                entry.setOutput(result.getOutput());
                entry.fail(error);
                notifyListener(listener, entry, context);

                if (Thread.currentThread().isInterrupted()) {
                    return cancelled(context, order, startTime);
                }

                ErrorAnalysis analysis = errorAnalyzer.analyze(graph, node, error, nodeInputs);
                log.info("[Executor] Node {} ({}) failed: {}", nodeId, node.getType().value(), error);
                return WorkflowExecutionResult.builder()
                        .success(false)
                        .error("Node \"" + node.displayName() + "\" failed: " + error)
                        .errorAnalysis(analysis)
                        .logs(context.snapshotLogs())
                        .executionOrder(order)
                        .duration(System.currentTimeMillis() - startTime)
                        .build();
            }

            entry.complete(result.getOutput());
            notifyListener(listener, entry, context);
            context.recordOutput(nodeId, result.getOutput());
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("[Executor] Completed {} nodes in {}ms", order.size(), duration);
        return WorkflowExecutionResult.builder()
                .success(true)
                .output(finalOutput(graph, order, context))
                .logs(context.snapshotLogs())
                .executionOrder(order)
                .duration(duration)
                .build();
    }

    /**
     * An edge without a handle (or with "default") spreads the whole source output into the
     * inputs; a named handle copies that key, or the whole output when the key is absent.
     */
    private Map<String, Object> assembleInputs(WorkflowGraph graph, String nodeId, ExecutionContext context) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        for (WorkflowEdge edge : graph.incomingEdges(nodeId)) {
            Map<String, Object> sourceOutput = context.outputOf(edge.getSource());
            if (sourceOutput == null) continue;

            String handle = edge.getSourceHandle();
            if (handle == null || handle.isEmpty() || "default".equals(handle)) {
                inputs.putAll(sourceOutput);
            } else {
                Object value = sourceOutput.get(handle);
                inputs.put(handle, value != null ? value : sourceOutput);
            }
        }
        return inputs;
    }

    private NodeResult invoke(WorkflowNode node, Map<String, Object> inputs, ExecutionContext context) {
        NodeHandler handler = handlerRegistry.get(node.getType());
        NodeContext nodeContext = NodeContext.builder()
                .nodeId(node.getId())
                .inputs(inputs)
                .config(node.getConfig())
                .globalContext(context.getGlobalContext())
                .build();
        try {
            NodeResult result = handler.execute(nodeContext);
            return result != null ? result : NodeResult.failure("Handler returned no result");
        } catch (RuntimeException ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("[Executor] Node {} ({}) threw: {}", node.getId(), node.getType().value(), msg, ex);
            return NodeResult.failure(msg);
        }
    }

    /** Merged outputs of all output nodes, else the output of the last node executed. */
    private Map<String, Object> finalOutput(WorkflowGraph graph, List<String> order, ExecutionContext context) {
        Map<String, Object> result = new LinkedHashMap<>();
        boolean hasOutputNodes = false;
        for (WorkflowNode node : graph.nodes()) {
            if (node.getType() == NodeType.OUTPUT) {
                hasOutputNodes = true;
                Map<String, Object> output = context.outputOf(node.getId());
                if (output != null) result.putAll(output);
            }
        }
        if (hasOutputNodes || order.isEmpty()) {
            return result;
        }
        Map<String, Object> last = context.outputOf(order.get(order.size() - 1));
        return last != null ? last : result;
    }

    private WorkflowExecutionResult cancelled(ExecutionContext context, List<String> order, long startTime) {
        log.info("[Executor] Run cancelled after {} node(s)", context.getLogs().size());
        return WorkflowExecutionResult.builder()
                .success(false)
                .error(CANCELLED)
                .logs(context.snapshotLogs())
                .executionOrder(order)
                .duration(System.currentTimeMillis() - startTime)
                .build();
    }

    private void notifyListener(ExecutionListener listener, ExecutionLog entry, ExecutionContext context) {
        if (listener == null) return;
        try {
            listener.onNodeUpdate(entry, context.snapshotLogs());
        } catch (RuntimeException ex) {
            log.warn("[Executor] Progress listener failed for node {}: {}", entry.getNodeId(), ex.getMessage());
        }
    }
}
