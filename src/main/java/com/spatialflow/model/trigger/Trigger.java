package com.spatialflow.model.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * WHEN a rule becomes eligible to run.
 *
 * Serialized with its kind in the "type" field:
 *   {"type": "connection-count", "direction": "incoming", "comparison": "gte", "threshold": 3}
 *
 * Every subclass reports a distinct {@link TriggerType}; the matcher switches
 * over that enum without a default branch, so a new kind does not compile
 * until it is matched.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ManualTrigger.class, name = "manual"),
        @JsonSubTypes.Type(value = PropertyChangeTrigger.class, name = "property-change"),
        @JsonSubTypes.Type(value = NodeCreatedTrigger.class, name = "node-created"),
        @JsonSubTypes.Type(value = ConnectionMadeTrigger.class, name = "connection-made"),
        @JsonSubTypes.Type(value = ConnectionCountTrigger.class, name = "connection-count"),
        @JsonSubTypes.Type(value = IsolationTrigger.class, name = "isolation"),
        @JsonSubTypes.Type(value = ChildrenCompleteTrigger.class, name = "children-complete"),
        @JsonSubTypes.Type(value = AncestorChangeTrigger.class, name = "ancestor-change"),
        @JsonSubTypes.Type(value = RegionEnterTrigger.class, name = "region-enter"),
        @JsonSubTypes.Type(value = RegionExitTrigger.class, name = "region-exit"),
        @JsonSubTypes.Type(value = ClusterSizeTrigger.class, name = "cluster-size"),
        @JsonSubTypes.Type(value = ProximityTrigger.class, name = "proximity"),
        @JsonSubTypes.Type(value = ScheduleTrigger.class, name = "schedule")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class Trigger {

    public abstract TriggerType getType();
}
