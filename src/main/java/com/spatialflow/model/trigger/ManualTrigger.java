package com.spatialflow.model.trigger;

import lombok.NoArgsConstructor;

/**
 * Runs only when invoked by hand; never matched against events.
 */
@NoArgsConstructor
public class ManualTrigger extends Trigger {

    @Override
    public TriggerType getType() {
        return TriggerType.MANUAL;
    }
}
