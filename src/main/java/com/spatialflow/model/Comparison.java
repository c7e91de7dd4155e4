package com.spatialflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Threshold comparison used by count-based triggers.
 */
public enum Comparison {
    @JsonProperty("gte") GTE,
    @JsonProperty("lte") LTE,
    @JsonProperty("eq") EQ;

    public boolean test(int count, int threshold) {
        return switch (this) {
            case GTE -> count >= threshold;
            case LTE -> count <= threshold;
            case EQ -> count == threshold;
        };
    }
}
