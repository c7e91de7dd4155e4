package com.spatialflow.model.trigger;

import lombok.NoArgsConstructor;

/**
 * Fires when removing an edge leaves a node with no connections at all.
 */
@NoArgsConstructor
public class IsolationTrigger extends Trigger {

    @Override
    public TriggerType getType() {
        return TriggerType.ISOLATION;
    }
}
