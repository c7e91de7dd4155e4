package com.spatialflow.service;

import com.spatialflow.config.AutomationProperties;
import com.spatialflow.dto.AutomationEvent;
import com.spatialflow.dto.EventType;
import com.spatialflow.model.AutomationRule;
import com.spatialflow.model.ConnectionDirection;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import com.spatialflow.model.ProximityDirection;
import com.spatialflow.model.trigger.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a rule's trigger fires for an incoming event.
 *
 * Most trigger kinds only look at the event. The graph-aware kinds
 * (connection-count, children-complete, ancestor-change) read the live
 * snapshot, cluster-size reads region membership, and proximity reads and
 * updates the per-(rule, node) proximity memory.
 *
 * Manual triggers never match here: manual runs go straight to execution.
 */
@Component
@RequiredArgsConstructor
public class TriggerMatcher {

    private final SpatialRegionService regionService;
    private final AutomationProperties properties;

    public boolean matches(String ruleId, AutomationRule rule, AutomationEvent event,
                           GraphSnapshot graph, ProximityMemory proximity) {
        Trigger trigger = rule.getTrigger();
        if (trigger == null || event.getType() == null) {
            return false;
        }

        return switch (trigger.getType()) {
            case MANUAL -> false;
            case PROPERTY_CHANGE -> matchPropertyChange((PropertyChangeTrigger) trigger, event);
            case NODE_CREATED -> matchNodeCreated((NodeCreatedTrigger) trigger, event);
            case CONNECTION_MADE -> matchConnectionMade((ConnectionMadeTrigger) trigger, event);
            case CONNECTION_COUNT -> matchConnectionCount((ConnectionCountTrigger) trigger, event, graph);
            case ISOLATION -> event.getType() == EventType.CONNECTION_REMOVED
                    && Integer.valueOf(0).equals(event.getConnectionCount());
            case CHILDREN_COMPLETE -> matchChildrenComplete((ChildrenCompleteTrigger) trigger, event, ruleId, graph);
            case ANCESTOR_CHANGE -> matchAncestorChange((AncestorChangeTrigger) trigger, event, graph);
            case REGION_ENTER -> event.getType() == EventType.NODE_POSITION_CHANGE
                    && sameId(((RegionEnterTrigger) trigger).getRegionId(), event.getEnteredRegionId());
            case REGION_EXIT -> event.getType() == EventType.NODE_POSITION_CHANGE
                    && sameId(((RegionExitTrigger) trigger).getRegionId(), event.getExitedRegionId());
            case CLUSTER_SIZE -> matchClusterSize((ClusterSizeTrigger) trigger, event);
            case PROXIMITY -> matchProximity((ProximityTrigger) trigger, event, ruleId, graph, proximity);
            case SCHEDULE -> event.getType() == EventType.SCHEDULE_TICK;
        };
    }

    private boolean matchPropertyChange(PropertyChangeTrigger trigger, AutomationEvent event) {
        if (event.getType() != EventType.PROPERTY_CHANGE) return false;
        if (trigger.getProperty() != null && !trigger.getProperty().equals(event.getProperty())) return false;
        if (trigger.getFromValue() != null && !valuesEqual(trigger.getFromValue(), event.getOldValue())) return false;
        if (trigger.getToValue() != null && !valuesEqual(trigger.getToValue(), event.getNewValue())) return false;
        return trigger.getNodeFilter() == null || trigger.getNodeFilter().equals(event.getNodeType());
    }

    private boolean matchNodeCreated(NodeCreatedTrigger trigger, AutomationEvent event) {
        if (event.getType() != EventType.NODE_CREATED) return false;
        return trigger.getNodeTypeFilter() == null || trigger.getNodeTypeFilter().equals(event.getNodeType());
    }

    private boolean matchConnectionMade(ConnectionMadeTrigger trigger, AutomationEvent event) {
        if (event.getType() != EventType.CONNECTION_MADE) return false;
        ConnectionDirection wanted = trigger.getDirection();
        if (wanted != null && wanted != ConnectionDirection.ANY && wanted != event.getDirection()) return false;
        return trigger.getNodeTypeFilter() == null || trigger.getNodeTypeFilter().equals(event.getConnectedNodeType());
    }

    /**
     * Counts edges in the live graph at match time, not the count carried by
     * the event.
     */
    private boolean matchConnectionCount(ConnectionCountTrigger trigger, AutomationEvent event, GraphSnapshot graph) {
        if (event.getType() != EventType.CONNECTION_MADE && event.getType() != EventType.CONNECTION_REMOVED) {
            return false;
        }
        if (trigger.getComparison() == null) return false;
        int count = GraphQueries.countConnections(graph, event.getSourceNodeId(), trigger.getDirection());
        return trigger.getComparison().test(count, trigger.getThreshold());
    }

    private boolean matchChildrenComplete(ChildrenCompleteTrigger trigger, AutomationEvent event,
                                          String ruleId, GraphSnapshot graph) {
        if (event.getType() != EventType.PROPERTY_CHANGE) return false;
        if (trigger.getProperty() != null && !trigger.getProperty().equals(event.getProperty())) return false;
        return GraphQueries.childrenComplete(graph, ruleId, trigger.getProperty(),
                trigger.getTargetValue(), trigger.isRequireAll());
    }

    private boolean matchAncestorChange(AncestorChangeTrigger trigger, AutomationEvent event, GraphSnapshot graph) {
        if (event.getType() != EventType.PROPERTY_CHANGE) return false;
        if (trigger.getProperty() != null && !trigger.getProperty().equals(event.getProperty())) return false;
        return GraphQueries.hasDescendants(graph, event.getSourceNodeId());
    }

    private boolean matchClusterSize(ClusterSizeTrigger trigger, AutomationEvent event) {
        if (event.getType() != EventType.NODE_POSITION_CHANGE) return false;
        String relevant = event.getEnteredRegionId() != null ? event.getEnteredRegionId() : event.getExitedRegionId();
        if (relevant == null || !relevant.equals(trigger.getRegionId())) return false;
        if (trigger.getComparison() == null) return false;
        int members = regionService.getMemberCount(trigger.getRegionId());
        return trigger.getComparison().test(members, trigger.getThreshold());
    }

    /**
     * Fires only on a crossing in the configured direction. The remembered
     * flag is updated on every position event, whether or not it fires; the
     * first event for a (rule, node) pair only seeds it.
     */
    private boolean matchProximity(ProximityTrigger trigger, AutomationEvent event, String ruleId,
                                   GraphSnapshot graph, ProximityMemory proximity) {
        if (event.getType() != EventType.NODE_POSITION_CHANGE) return false;
        if (trigger.getTargetNodeId() == null) return false;

        Optional<GraphNode> moving = graph.findNode(event.getSourceNodeId());
        Optional<GraphNode> target = graph.findNode(trigger.getTargetNodeId());
        if (moving.isEmpty() || target.isEmpty()) return false;

        double w = properties.getRegions().getDefaultNodeWidth();
        double h = properties.getRegions().getDefaultNodeHeight();
        double distance = Geometry.centerDistance(moving.get().toBounds(w, h), target.get().toBounds(w, h));

        boolean within = distance <= trigger.getDistance();
        Boolean wasWithin = proximity.update(ruleId, event.getSourceNodeId(), within);
        if (wasWithin == null) {
            // first sighting: no crossing yet
            return false;
        }

        if (trigger.getDirection() == ProximityDirection.ENTERING) {
            return !wasWithin && within;
        }
        return wasWithin && !within;
    }

    private static boolean sameId(String configured, String actual) {
        return configured != null && configured.equals(actual);
    }

    /**
     * Value filters compare numbers by value (JSON may give 3 or 3.0),
     * everything else with equals.
     */
    private static boolean valuesEqual(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return ((Number) expected).doubleValue() == ((Number) actual).doubleValue();
        }
        return Objects.equals(expected, actual);
    }
}
