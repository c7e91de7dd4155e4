package com.spatialflow.service;

import com.spatialflow.config.AutomationProperties;
import com.spatialflow.dto.AutomationEvent;
import com.spatialflow.dto.EventType;
import com.spatialflow.model.*;
import com.spatialflow.model.trigger.ManualTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Tests for GraphChangeTracker: which engine events each kind of graph
 * edit produces.
 *
 * The engine is mocked; region membership uses the real service so the
 * enter/exit ordering is exercised end to end.
 */
@ExtendWith(MockitoExtension.class)
class GraphChangeTrackerTest {

    @Mock private AutomationEngine engine;

    private SpatialRegionService regionService;
    private GraphChangeTracker tracker;

    @BeforeEach
    void setUp() {
        AutomationProperties properties = new AutomationProperties();
        regionService = new SpatialRegionService(properties);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        tracker = new GraphChangeTracker(engine, regionService, properties, clock);
    }

    private static GraphNode task(String id, double x, double y, Map<String, Object> data) {
        return GraphNode.builder().id(id).type("task").x(x).y(y).width(100.0).height(100.0)
                .data(new HashMap<>(data)).build();
    }

    private static GraphSnapshot graph(List<GraphNode> nodes, List<GraphEdge> edges) {
        return new GraphSnapshot(new ArrayList<>(nodes), new ArrayList<>(edges));
    }

    private List<AutomationEvent> capturedEvents() {
        ArgumentCaptor<AutomationEvent> captor = ArgumentCaptor.forClass(AutomationEvent.class);
        verify(engine, atLeast(0)).handleEvent(captor.capture());
        return captor.getAllValues();
    }

    private List<AutomationEvent> eventsOfType(EventType type) {
        return capturedEvents().stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    @Test
    @DisplayName("new node emits node-created")
    void newNode() {
        tracker.onGraphChanged(graph(List.of(task("t1", 0, 0, Map.of())), List.of()));

        List<AutomationEvent> created = eventsOfType(EventType.NODE_CREATED);
        assertEquals(1, created.size());
        assertEquals("t1", created.get(0).getSourceNodeId());
        assertEquals("task", created.get(0).getNodeType());
    }

    @Test
    @DisplayName("changed data emits one property-change per key, skipping bookkeeping keys")
    void propertyChanges() {
        tracker.onGraphChanged(graph(List.of(task("t1", 0, 0,
                Map.of("status", "todo", "title", "A", "updatedAt", 1))), List.of()));
        clearInvocations(engine);

        tracker.onGraphChanged(graph(List.of(task("t1", 0, 0,
                Map.of("status", "done", "title", "A", "updatedAt", 2))), List.of()));

        List<AutomationEvent> changes = eventsOfType(EventType.PROPERTY_CHANGE);
        assertEquals(1, changes.size());
        assertEquals("status", changes.get(0).getProperty());
        assertEquals("todo", changes.get(0).getOldValue());
        assertEquals("done", changes.get(0).getNewValue());
    }

    @Test
    @DisplayName("enabled rule nodes are registered and removed ones unregistered")
    void ruleRegistration() {
        AutomationRule rule = AutomationRule.builder().id("rule-1").enabled(true).trigger(new ManualTrigger()).build();
        GraphNode ruleNode = GraphNode.builder().id("rule-1").type("action").rule(rule).build();

        tracker.onGraphChanged(graph(List.of(ruleNode), List.of()));
        verify(engine).registerRule("rule-1", rule);

        tracker.onGraphChanged(graph(List.of(), List.of()));
        verify(engine).unregisterRule("rule-1");
    }

    @Test
    @DisplayName("disabling a registered rule unregisters it")
    void disableRule() {
        AutomationRule disabled = AutomationRule.builder().id("rule-1").enabled(false).build();
        when(engine.isRegistered("rule-1")).thenReturn(true);

        tracker.onGraphChanged(graph(List.of(GraphNode.builder().id("rule-1").rule(disabled).build()), List.of()));

        verify(engine).unregisterRule("rule-1");
        verify(engine, never()).registerRule(any(), any());
    }

    @Test
    @DisplayName("new edge emits connection-made for both ends")
    void newEdge() {
        List<GraphNode> nodes = List.of(task("a", 0, 0, Map.of()), task("b", 500, 0, Map.of()));
        tracker.onGraphChanged(graph(nodes, List.of()));
        clearInvocations(engine);

        tracker.onGraphChanged(graph(nodes, List.of(new GraphEdge("e1", "a", "b"))));

        List<AutomationEvent> made = eventsOfType(EventType.CONNECTION_MADE);
        assertEquals(2, made.size());
        AutomationEvent fromA = made.get(0);
        assertEquals("a", fromA.getSourceNodeId());
        assertEquals(ConnectionDirection.OUTGOING, fromA.getDirection());
        assertEquals("b", fromA.getConnectedNodeId());
        assertEquals(1, fromA.getConnectionCount());
        assertEquals(ConnectionDirection.INCOMING, made.get(1).getDirection());
    }

    @Test
    @DisplayName("removed edge emits connection-removed with the remaining count")
    void removedEdge() {
        List<GraphNode> nodes = List.of(task("a", 0, 0, Map.of()), task("b", 500, 0, Map.of()));
        tracker.onGraphChanged(graph(nodes, List.of(new GraphEdge("e1", "a", "b"))));
        clearInvocations(engine);

        tracker.onGraphChanged(graph(nodes, List.of()));

        List<AutomationEvent> removed = eventsOfType(EventType.CONNECTION_REMOVED);
        assertEquals(2, removed.size());
        assertTrue(removed.stream().allMatch(e -> e.getConnectionCount() == 0));
    }

    @Test
    @DisplayName("moving into a region updates membership and emits the entered region")
    void moveIntoRegion() {
        String regionId = regionService.addRegion(SpatialRegion.builder()
                .name("Done").bounds(Bounds.of(1000, 0, 500, 500)).build());
        tracker.onGraphChanged(graph(List.of(task("t1", 0, 0, Map.of())), List.of()));
        clearInvocations(engine);

        tracker.onGraphChanged(graph(List.of(task("t1", 1100, 100, Map.of())), List.of()));

        List<AutomationEvent> moves = eventsOfType(EventType.NODE_POSITION_CHANGE);
        assertEquals(1, moves.size());
        assertEquals(regionId, moves.get(0).getEnteredRegionId());
        assertEquals(1, regionService.getMemberCount(regionId));
    }

    @Test
    @DisplayName("a move with no membership change still emits a plain position event")
    void plainMove() {
        tracker.onGraphChanged(graph(List.of(task("t1", 0, 0, Map.of())), List.of()));
        clearInvocations(engine);

        tracker.onGraphChanged(graph(List.of(task("t1", 40, 40, Map.of())), List.of()));

        List<AutomationEvent> moves = eventsOfType(EventType.NODE_POSITION_CHANGE);
        assertEquals(1, moves.size());
        assertNull(moves.get(0).getEnteredRegionId());
        assertNull(moves.get(0).getExitedRegionId());
    }

    @Test
    @DisplayName("removing a node forgets its runtime state")
    void removedNode_forgotten() {
        tracker.onGraphChanged(graph(List.of(task("t1", 0, 0, Map.of())), List.of()));

        tracker.onGraphChanged(graph(List.of(), List.of()));

        verify(engine).unregisterRule("t1");
        verify(engine).forgetNode("t1");
    }

    @Test
    @DisplayName("a failing step still advances the baseline, so events are not sent twice")
    void failureAdvancesBaseline() {
        lenient().doThrow(new IllegalStateException("engine down"))
                .when(engine).handleEvent(argThat(e -> e.getType() == EventType.NODE_POSITION_CHANGE));
        tracker.onGraphChanged(graph(List.of(task("t1", 0, 0, Map.of("status", "todo"))), List.of()));
        GraphSnapshot movedAndDone = graph(List.of(task("t1", 50, 0, Map.of("status", "done"))), List.of());

        assertThrows(IllegalStateException.class, () -> tracker.onGraphChanged(movedAndDone));
        clearInvocations(engine);

        tracker.onGraphChanged(movedAndDone);

        verify(engine, never()).handleEvent(any());
    }

    @Test
    @DisplayName("an unchanged graph emits nothing")
    void unchangedGraph() {
        GraphSnapshot g = graph(List.of(task("t1", 0, 0, Map.of("status", "todo"))), List.of());
        tracker.onGraphChanged(g);
        clearInvocations(engine);

        tracker.onGraphChanged(g);

        verify(engine, never()).handleEvent(any());
    }
}
