package com.spatialflow.service;

import com.spatialflow.model.ConnectionDirection;
import com.spatialflow.model.GraphEdge;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only queries over the edge set, treated as a directed graph
 * (source → target).
 */
public final class GraphQueries {

    private GraphQueries() {
    }

    /**
     * Edges touching the node: as target (INCOMING), as source (OUTGOING) or either.
     * A null direction counts as ANY.
     */
    public static int countConnections(GraphSnapshot graph, String nodeId, ConnectionDirection direction) {
        ConnectionDirection dir = direction == null ? ConnectionDirection.ANY : direction;
        return (int) graph.getEdges().stream()
                .filter(e -> switch (dir) {
                    case INCOMING -> nodeId.equals(e.getTarget());
                    case OUTGOING -> nodeId.equals(e.getSource());
                    case ANY -> nodeId.equals(e.getSource()) || nodeId.equals(e.getTarget());
                })
                .count();
    }

    /**
     * Nodes reachable through one outgoing edge of the given node, each at most once.
     */
    public static List<GraphNode> children(GraphSnapshot graph, String nodeId) {
        Set<String> childIds = graph.getEdges().stream()
                .filter(e -> nodeId.equals(e.getSource()))
                .map(GraphEdge::getTarget)
                .collect(Collectors.toSet());
        return graph.getNodes().stream()
                .filter(n -> childIds.contains(n.getId()))
                .collect(Collectors.toList());
    }

    /**
     * True if every child (requireAll) or any child has the property equal to the
     * target value, compared in string form. No children means false.
     */
    public static boolean childrenComplete(GraphSnapshot graph, String nodeId, String property,
                                           Object targetValue, boolean requireAll) {
        List<GraphNode> children = children(graph, nodeId);
        if (children.isEmpty()) {
            return false;
        }
        String target = ConditionEvaluator.stringify(targetValue);
        long matching = children.stream()
                .filter(n -> target.equals(ConditionEvaluator.stringify(
                        ConditionEvaluator.resolveField(n.getData(), property))))
                .count();
        return requireAll ? matching == children.size() : matching > 0;
    }

    /**
     * Breadth-first walk along outgoing edges. True if anything other than the
     * start node is reachable. Nodes are marked visited before their neighbours
     * are expanded, so cycles terminate.
     */
    public static boolean hasDescendants(GraphSnapshot graph, String nodeId) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (GraphEdge edge : graph.getEdges()) {
                if (current.equals(edge.getSource()) && !visited.contains(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        return visited.size() > 1;
    }
}
