package com.spatialflow.model;

import lombok.*;

/**
 * A guard evaluated against one node's data before a rule runs.
 *
 * Example:
 *   target   = TRIGGER_NODE
 *   field    = "meta.priority"
 *   operator = EQUALS
 *   value    = "high"
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Condition {

    private String id;

    private ConditionTarget target;

    /** Only used when target is SPECIFIC_NODE. */
    private String targetNodeId;

    /** Dot path into the node's data, e.g. "status" or "meta.owner.name". */
    private String field;

    private ConditionOperator operator;

    /** Not needed for IS_EMPTY / IS_NOT_EMPTY. */
    private Object value;
}
