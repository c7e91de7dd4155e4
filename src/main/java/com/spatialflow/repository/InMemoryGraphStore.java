package com.spatialflow.repository;

import com.spatialflow.model.GraphEdge;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import com.spatialflow.model.RunStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph held in memory, replaced wholesale by the canvas on every change.
 *
 * Snapshots are copies: callers may keep them across later changes.
 * Rules are swapped for new instances when their stats change, never
 * mutated in place.
 */
@Repository
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();

    @Override
    public synchronized GraphSnapshot snapshot() {
        List<GraphNode> nodeCopies = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes.values()) {
            nodeCopies.add(node.copy());
        }
        return new GraphSnapshot(nodeCopies, new ArrayList<>(edges));
    }

    public synchronized void replace(GraphSnapshot graph) {
        nodes.clear();
        for (GraphNode node : graph.getNodes()) {
            nodes.put(node.getId(), node.copy());
        }
        edges.clear();
        edges.addAll(graph.getEdges());
        log.debug("Graph replaced: nodes={}, edges={}", nodes.size(), edges.size());
    }

    @Override
    public synchronized void updateRunStats(String ruleNodeId, RunStats stats) {
        GraphNode node = nodes.get(ruleNodeId);
        if (node == null || node.getRule() == null) {
            log.debug("Run stats dropped, no rule node: {}", ruleNodeId);
            return;
        }
        node.setRule(node.getRule().withStats(stats));
    }
}
