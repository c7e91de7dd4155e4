package com.spatialflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Edge direction relative to a node: INCOMING = node is the edge target,
 * OUTGOING = node is the edge source, ANY = either.
 */
public enum ConnectionDirection {
    @JsonProperty("incoming") INCOMING,
    @JsonProperty("outgoing") OUTGOING,
    @JsonProperty("any") ANY
}
