package com.spatialflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kinds of graph mutation the engine reacts to.
 */
public enum EventType {
    @JsonProperty("property-change") PROPERTY_CHANGE,
    @JsonProperty("node-created") NODE_CREATED,
    @JsonProperty("connection-made") CONNECTION_MADE,
    @JsonProperty("connection-removed") CONNECTION_REMOVED,
    @JsonProperty("node-position-change") NODE_POSITION_CHANGE,
    @JsonProperty("manual") MANUAL,
    @JsonProperty("schedule-tick") SCHEDULE_TICK
}
