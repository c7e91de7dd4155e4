package com.spatialflow.service;

import com.spatialflow.config.AutomationProperties;
import com.spatialflow.dto.AutomationEvent;
import com.spatialflow.dto.EventType;
import com.spatialflow.dto.MembershipChange;
import com.spatialflow.model.ConnectionDirection;
import com.spatialflow.model.GraphEdge;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns consecutive graph snapshots into engine events.
 *
 * Per change:
 *   new node       → node-created; an enabled rule on it is registered
 *   changed data   → one property-change per differing key
 *   rule node      → re-registered when enabled, unregistered when disabled
 *   removed node   → rule unregistered, region membership and proximity memory dropped
 *   new edge       → connection-made for both ends (outgoing / incoming)
 *   removed edge   → connection-removed for both ends
 *   moved node     → region membership recomputed, then one
 *                    node-position-change per entered and per exited region,
 *                    or a single region-less one when membership is unchanged
 *
 * Membership is updated before the position events are emitted, so the
 * matcher never sees stale counts for the move that caused them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphChangeTracker {

    /** Bookkeeping keys that change on every touch and never trigger rules. */
    private static final Set<String> IGNORED_KEYS = Set.of("updatedAt", "lastAccessedAt", "accessCount");

    private final AutomationEngine engine;
    private final SpatialRegionService regionService;
    private final AutomationProperties properties;
    private final Clock clock;

    private Map<String, GraphNode> previousNodes = new LinkedHashMap<>();
    private Map<String, GraphEdge> previousEdges = new LinkedHashMap<>();
    private final Map<String, double[]> previousPositions = new HashMap<>();

    public synchronized void onGraphChanged(GraphSnapshot current) {
        Instant now = clock.instant();
        Map<String, GraphNode> currentNodes = new LinkedHashMap<>();
        for (GraphNode node : current.getNodes()) {
            currentNodes.put(node.getId(), node);
        }

        Map<String, GraphEdge> currentEdges = new LinkedHashMap<>();
        for (GraphEdge edge : current.getEdges()) {
            currentEdges.put(edge.getId(), edge);
        }

        // baseline advances even when a step fails
        try {
            diffNodes(currentNodes, now);
            diffEdges(current, currentNodes, now);
            diffPositions(currentNodes, now);
        } finally {
            previousNodes = currentNodes;
            previousEdges = currentEdges;
        }
    }

    private void diffNodes(Map<String, GraphNode> currentNodes, Instant now) {
        for (GraphNode node : currentNodes.values()) {
            GraphNode previous = previousNodes.get(node.getId());
            if (previous == null) {
                engine.handleEvent(AutomationEvent.builder()
                        .type(EventType.NODE_CREATED)
                        .sourceNodeId(node.getId())
                        .timestamp(now)
                        .nodeType(node.getType())
                        .build());
            } else {
                emitPropertyChanges(previous, node, now);
            }
            syncRegistration(node);
        }

        for (String nodeId : previousNodes.keySet()) {
            if (!currentNodes.containsKey(nodeId)) {
                engine.unregisterRule(nodeId);
                engine.forgetNode(nodeId);
                regionService.forgetNode(nodeId);
            }
        }
    }

    private void emitPropertyChanges(GraphNode previous, GraphNode node, Instant now) {
        Map<String, Object> oldData = previous.getData() == null ? Map.of() : previous.getData();
        Map<String, Object> newData = node.getData() == null ? Map.of() : node.getData();

        for (Map.Entry<String, Object> entry : newData.entrySet()) {
            String key = entry.getKey();
            if (IGNORED_KEYS.contains(key) || Objects.equals(oldData.get(key), entry.getValue())) {
                continue;
            }
            engine.handleEvent(AutomationEvent.builder()
                    .type(EventType.PROPERTY_CHANGE)
                    .sourceNodeId(node.getId())
                    .timestamp(now)
                    .property(key)
                    .oldValue(oldData.get(key))
                    .newValue(entry.getValue())
                    .nodeType(node.getType())
                    .build());
        }
    }

    private void syncRegistration(GraphNode node) {
        if (node.getRule() != null && node.getRule().isEnabled()) {
            engine.registerRule(node.getId(), node.getRule());
        } else if (engine.isRegistered(node.getId())) {
            engine.unregisterRule(node.getId());
        }
    }

    private void diffEdges(GraphSnapshot current, Map<String, GraphNode> currentNodes, Instant now) {
        Set<String> currentEdgeIds = new HashSet<>();
        for (GraphEdge edge : current.getEdges()) {
            currentEdgeIds.add(edge.getId());
        }

        for (GraphEdge edge : current.getEdges()) {
            if (previousEdges.containsKey(edge.getId())) {
                continue;
            }
            GraphNode source = currentNodes.get(edge.getSource());
            GraphNode target = currentNodes.get(edge.getTarget());
            if (source != null) {
                engine.handleEvent(connectionMade(edge.getSource(), ConnectionDirection.OUTGOING,
                        edge.getTarget(), target, current, now));
            }
            if (target != null) {
                engine.handleEvent(connectionMade(edge.getTarget(), ConnectionDirection.INCOMING,
                        edge.getSource(), source, current, now));
            }
        }

        for (GraphEdge removed : previousEdges.values()) {
            if (currentEdgeIds.contains(removed.getId())) {
                continue;
            }
            engine.handleEvent(connectionRemoved(removed.getSource(), current, now));
            engine.handleEvent(connectionRemoved(removed.getTarget(), current, now));
        }
    }

    private AutomationEvent connectionMade(String nodeId, ConnectionDirection direction, String peerId,
                                           GraphNode peer, GraphSnapshot graph, Instant now) {
        return AutomationEvent.builder()
                .type(EventType.CONNECTION_MADE)
                .sourceNodeId(nodeId)
                .timestamp(now)
                .direction(direction)
                .connectedNodeId(peerId)
                .connectedNodeType(peer == null ? null : peer.getType())
                .connectionCount(GraphQueries.countConnections(graph, nodeId, ConnectionDirection.ANY))
                .build();
    }

    private AutomationEvent connectionRemoved(String nodeId, GraphSnapshot graph, Instant now) {
        return AutomationEvent.builder()
                .type(EventType.CONNECTION_REMOVED)
                .sourceNodeId(nodeId)
                .timestamp(now)
                .connectionCount(GraphQueries.countConnections(graph, nodeId, ConnectionDirection.ANY))
                .build();
    }

    /**
     * A node seen for the first time only seeds its position; region checks
     * start with its first move.
     */
    private void diffPositions(Map<String, GraphNode> currentNodes, Instant now) {
        double defaultWidth = properties.getRegions().getDefaultNodeWidth();
        double defaultHeight = properties.getRegions().getDefaultNodeHeight();

        for (GraphNode node : currentNodes.values()) {
            double[] previous = previousPositions.get(node.getId());
            if (previous != null && previous[0] == node.getX() && previous[1] == node.getY()) {
                continue;
            }
            previousPositions.put(node.getId(), new double[]{node.getX(), node.getY()});
            if (previous == null) {
                continue;
            }

            MembershipChange change = regionService.hasRegions()
                    ? regionService.checkNodePosition(node.getId(), node.toBounds(defaultWidth, defaultHeight))
                    : new MembershipChange(List.of(), List.of());
            for (String regionId : change.getEntered()) {
                engine.handleEvent(positionChange(node, now).enteredRegionId(regionId).build());
            }
            for (String regionId : change.getExited()) {
                engine.handleEvent(positionChange(node, now).exitedRegionId(regionId).build());
            }
            if (change.isEmpty()) {
                // plain move, still relevant to proximity triggers
                engine.handleEvent(positionChange(node, now).build());
            }
        }

        previousPositions.keySet().removeIf(nodeId -> !currentNodes.containsKey(nodeId));
    }

    private AutomationEvent.AutomationEventBuilder positionChange(GraphNode node, Instant now) {
        return AutomationEvent.builder()
                .type(EventType.NODE_POSITION_CHANGE)
                .sourceNodeId(node.getId())
                .timestamp(now)
                .nodeType(node.getType());
    }
}
