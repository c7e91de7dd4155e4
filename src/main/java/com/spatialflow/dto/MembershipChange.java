package com.spatialflow.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

/**
 * Regions a node started and stopped overlapping after a move.
 */
@Value
public class MembershipChange {

    List<String> entered;
    List<String> exited;

    @JsonIgnore
    public boolean isEmpty() {
        return entered.isEmpty() && exited.isEmpty();
    }
}
