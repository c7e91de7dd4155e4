package com.spatialflow.model.trigger;

import lombok.*;

/**
 * Fires when the children of the rule's own node (targets of its outgoing
 * edges) have reached a target value for a property.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChildrenCompleteTrigger extends Trigger {

    private String property;

    /** Value that means "complete", e.g. "done". */
    private Object targetValue;

    /** true = every child must match, false = any child. */
    private boolean requireAll;

    @Override
    public TriggerType getType() {
        return TriggerType.CHILDREN_COMPLETE;
    }
}
