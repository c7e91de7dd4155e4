package com.spatialflow.model;

import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time read of the whole graph: every node and every edge.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GraphSnapshot {

    @Builder.Default
    private List<GraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<GraphEdge> edges = new ArrayList<>();

    public static GraphSnapshot empty() {
        return new GraphSnapshot(new ArrayList<>(), new ArrayList<>());
    }

    public Optional<GraphNode> findNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return nodes.stream()
                .filter(n -> nodeId.equals(n.getId()))
                .findFirst();
    }
}
