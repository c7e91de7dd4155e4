package com.spatialflow.model.trigger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The 13 trigger kinds, with the names they carry on the wire.
 */
public enum TriggerType {
    MANUAL("manual"),
    PROPERTY_CHANGE("property-change"),
    NODE_CREATED("node-created"),
    CONNECTION_MADE("connection-made"),
    CONNECTION_COUNT("connection-count"),
    ISOLATION("isolation"),
    CHILDREN_COMPLETE("children-complete"),
    ANCESTOR_CHANGE("ancestor-change"),
    REGION_ENTER("region-enter"),
    REGION_EXIT("region-exit"),
    CLUSTER_SIZE("cluster-size"),
    PROXIMITY("proximity"),
    SCHEDULE("schedule");

    private final String wireName;

    TriggerType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
