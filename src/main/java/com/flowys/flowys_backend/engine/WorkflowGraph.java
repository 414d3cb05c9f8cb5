package com.flowys.flowys_backend.engine;

import com.flowys.flowys_backend.model.domain.WorkflowEdge;
import com.flowys.flowys_backend.model.domain.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable adjacency view of one workflow: nodes indexed by id in declaration order,
 * outgoing edges per node and in-degree counts. Built once per run.
 */
public final class WorkflowGraph {

    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
    private final List<WorkflowEdge> edges;
    private final Map<String, List<String>> adjacency = new LinkedHashMap<>();
    private final Map<String, Integer> inDegree = new LinkedHashMap<>();

    private WorkflowGraph(List<WorkflowNode> nodeList, List<WorkflowEdge> edgeList) {
        for (WorkflowNode node : nodeList) {
            if (node == null || node.getId() == null || node.getId().isBlank()) {
                throw new InvalidWorkflowException("Every node needs an id");
            }
            if (node.getType() == null) {
                throw new InvalidWorkflowException("Node " + node.getId() + " has no type");
            }
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new InvalidWorkflowException("Duplicate node id: " + node.getId());
            }
            adjacency.put(node.getId(), new ArrayList<>());
            inDegree.put(node.getId(), 0);
        }

        this.edges = List.copyOf(edgeList);
        for (WorkflowEdge edge : edges) {
            if (!nodes.containsKey(edge.getSource()) || !nodes.containsKey(edge.getTarget())) {
                throw new InvalidWorkflowException("Edge " + (edge.getId() != null ? edge.getId() + " " : "")
                        + "references unknown node: " + edge.getSource() + " -> " + edge.getTarget());
            }
            adjacency.get(edge.getSource()).add(edge.getTarget());
            inDegree.merge(edge.getTarget(), 1, Integer::sum);
        }
    }

    /**
     * @throws InvalidWorkflowException on missing ids or types, duplicate ids, or edges to unknown nodes
     */
    public static WorkflowGraph of(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return new WorkflowGraph(nodes != null ? nodes : List.of(), edges != null ? edges : List.of());
    }

    /**
     * Kahn's algorithm. Ties are broken by node declaration order, so the same graph always
     * yields the same order.
     *
     * @throws CyclicWorkflowException when some nodes can never reach in-degree zero
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> remaining = new LinkedHashMap<>(inDegree);
        Deque<String> queue = new ArrayDeque<>();
        remaining.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });

        List<String> order = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            for (String next : adjacency.get(id)) {
                int degree = remaining.merge(next, -1, Integer::sum);
                if (degree == 0) queue.add(next);
            }
        }

        if (order.size() != nodes.size()) {
            throw new CyclicWorkflowException();
        }
        return order;
    }

    public List<WorkflowEdge> incomingEdges(String nodeId) {
        return edges.stream().filter(e -> nodeId.equals(e.getTarget())).toList();
    }

    /** Labels of every node reachable from nodeId, breadth first, nodeId itself excluded. */
    public List<String> downstreamLabels(String nodeId) {
        List<String> labels = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            for (String next : adjacency.getOrDefault(queue.poll(), List.of())) {
                if (visited.add(next)) {
                    labels.add(nodes.get(next).displayName());
                    queue.add(next);
                }
            }
        }
        return labels;
    }

    public WorkflowNode node(String id) {
        return nodes.get(id);
    }

    public Collection<WorkflowNode> nodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }
}
