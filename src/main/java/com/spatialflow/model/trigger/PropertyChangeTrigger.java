package com.spatialflow.model.trigger;

import lombok.*;

/**
 * Fires when a node property changes, optionally narrowed by property name,
 * old value, new value and node type. Absent filters accept anything.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class PropertyChangeTrigger extends Trigger {

    /** Property to watch; null watches every property. */
    private String property;

    /** Only fire when the old value equals this. */
    private Object fromValue;

    /** Only fire when the new value equals this. */
    private Object toValue;

    /** Only fire for nodes of this type. */
    private String nodeFilter;

    @Override
    public TriggerType getType() {
        return TriggerType.PROPERTY_CHANGE;
    }
}
