package com.spatialflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ENTERING fires on an outside-to-inside crossing of the distance threshold,
 * EXITING on inside-to-outside.
 */
public enum ProximityDirection {
    @JsonProperty("entering") ENTERING,
    @JsonProperty("exiting") EXITING
}
