package com.spatialflow.dto;

import com.spatialflow.model.ConnectionDirection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;

/**
 * A single graph mutation, as produced by the graph-change layer.
 *
 * Example JSON:
 * {
 *   "type": "property-change",
 *   "sourceNodeId": "task-42",
 *   "timestamp": "2024-05-01T10:15:30Z",
 *   "property": "status",
 *   "oldValue": "todo",
 *   "newValue": "done",
 *   "nodeType": "task"
 * }
 *
 * Which payload fields are set depends on the type:
 *   property-change      → property, oldValue, newValue, nodeType
 *   node-created         → nodeType
 *   connection-made      → direction, connectedNodeId, connectedNodeType, connectionCount
 *   connection-removed   → connectionCount (after the removal)
 *   node-position-change → enteredRegionId or exitedRegionId, nodeType
 *   manual, schedule-tick → nothing
 *
 * Events are never persisted.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AutomationEvent {

    @NotNull(message = "type is required")
    private EventType type;

    @NotBlank(message = "sourceNodeId is required")
    private String sourceNodeId;

    private Instant timestamp;

    private String property;
    private Object oldValue;
    private Object newValue;
    private String nodeType;

    private ConnectionDirection direction;
    private String connectedNodeId;
    private String connectedNodeType;
    private Integer connectionCount;

    private String enteredRegionId;
    private String exitedRegionId;

    public static AutomationEvent manual(String ruleId, Instant timestamp) {
        return AutomationEvent.builder()
                .type(EventType.MANUAL)
                .sourceNodeId(ruleId)
                .timestamp(timestamp)
                .build();
    }

    public static AutomationEvent scheduleTick(String ruleId, Instant timestamp) {
        return AutomationEvent.builder()
                .type(EventType.SCHEDULE_TICK)
                .sourceNodeId(ruleId)
                .timestamp(timestamp)
                .build();
    }
}
