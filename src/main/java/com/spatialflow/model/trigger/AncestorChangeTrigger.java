package com.spatialflow.model.trigger;

import lombok.*;

/**
 * Fires when a watched property changes on a node that has descendants.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AncestorChangeTrigger extends Trigger {

    private String property;

    /** Kept for round-tripping; matching only needs one descendant to exist. */
    private Integer depth;

    @Override
    public TriggerType getType() {
        return TriggerType.ANCESTOR_CHANGE;
    }
}
