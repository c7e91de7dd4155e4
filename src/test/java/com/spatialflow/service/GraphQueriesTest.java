package com.spatialflow.service;

import com.spatialflow.model.ConnectionDirection;
import com.spatialflow.model.GraphEdge;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphQueriesTest {

    private static GraphSnapshot graph(List<GraphNode> nodes, GraphEdge... edges) {
        return new GraphSnapshot(new ArrayList<>(nodes), new ArrayList<>(List.of(edges)));
    }

    private static GraphNode node(String id, String status) {
        return GraphNode.builder().id(id).data(new HashMap<>(Map.of("status", status))).build();
    }

    @Test
    @DisplayName("countConnections splits by direction")
    void countConnections() {
        GraphSnapshot g = graph(List.of(),
                new GraphEdge("e1", "a", "hub"), new GraphEdge("e2", "hub", "b"), new GraphEdge("e3", "hub", "c"));

        assertEquals(1, GraphQueries.countConnections(g, "hub", ConnectionDirection.INCOMING));
        assertEquals(2, GraphQueries.countConnections(g, "hub", ConnectionDirection.OUTGOING));
        assertEquals(3, GraphQueries.countConnections(g, "hub", ConnectionDirection.ANY));
        assertEquals(3, GraphQueries.countConnections(g, "hub", null));
    }

    @Test
    @DisplayName("children lists each target once, even with parallel edges")
    void childrenDistinct() {
        GraphSnapshot g = graph(List.of(node("p", "x"), node("c", "done")),
                new GraphEdge("e1", "p", "c"), new GraphEdge("e2", "p", "c"));
        assertEquals(1, GraphQueries.children(g, "p").size());
    }

    @Test
    @DisplayName("childrenComplete compares string forms")
    void childrenCompleteStringForm() {
        GraphNode child = GraphNode.builder().id("c").data(new HashMap<>(Map.of("points", 3.0))).build();
        GraphSnapshot g = graph(List.of(node("p", "x"), child), new GraphEdge("e1", "p", "c"));
        assertTrue(GraphQueries.childrenComplete(g, "p", "points", 3, true));
    }

    @Test
    @Timeout(2)
    @DisplayName("hasDescendants terminates on cycles")
    void cycleTerminates() {
        GraphSnapshot g = graph(List.of(),
                new GraphEdge("e1", "a", "b"), new GraphEdge("e2", "b", "c"), new GraphEdge("e3", "c", "a"),
                new GraphEdge("e4", "c", "c"));
        assertTrue(GraphQueries.hasDescendants(g, "a"));
    }

    @Test
    @DisplayName("a self-loop alone is not a descendant")
    void selfLoopOnly() {
        GraphSnapshot g = graph(List.of(), new GraphEdge("e1", "a", "a"));
        assertFalse(GraphQueries.hasDescendants(g, "a"));
    }
}
