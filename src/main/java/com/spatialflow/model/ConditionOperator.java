package com.spatialflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConditionOperator {
    @JsonProperty("equals") EQUALS,
    @JsonProperty("not-equals") NOT_EQUALS,
    @JsonProperty("contains") CONTAINS,
    @JsonProperty("not-contains") NOT_CONTAINS,
    @JsonProperty("greater-than") GREATER_THAN,
    @JsonProperty("less-than") LESS_THAN,
    @JsonProperty("is-empty") IS_EMPTY,
    @JsonProperty("is-not-empty") IS_NOT_EMPTY,
    @JsonProperty("matches-regex") MATCHES_REGEX
}
