package com.spatialflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which node a condition reads from.
 */
public enum ConditionTarget {
    @JsonProperty("trigger-node") TRIGGER_NODE,
    @JsonProperty("rule-node") RULE_NODE,
    @JsonProperty("specific-node") SPECIFIC_NODE
}
