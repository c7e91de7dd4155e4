package com.spatialflow.model.trigger;

import com.spatialflow.model.ProximityDirection;
import lombok.*;

/**
 * Fires when a moving node crosses a distance threshold around a target node.
 * Only the crossing fires; staying inside (or outside) does not.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProximityTrigger extends Trigger {

    /** Node the distance is measured from. */
    private String targetNodeId;

    /** Center-to-center distance threshold, in canvas units. */
    private double distance;

    private ProximityDirection direction;

    @Override
    public TriggerType getType() {
        return TriggerType.PROXIMITY;
    }
}
