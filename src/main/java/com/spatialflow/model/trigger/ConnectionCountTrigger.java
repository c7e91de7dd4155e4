package com.spatialflow.model.trigger;

import com.spatialflow.model.Comparison;
import com.spatialflow.model.ConnectionDirection;
import lombok.*;

/**
 * Fires on connection-made / connection-removed when the node's current
 * edge count, recomputed from the live edge set, passes the threshold.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ConnectionCountTrigger extends Trigger {

    private int threshold;

    private Comparison comparison;

    /** Null behaves like ANY. */
    private ConnectionDirection direction;

    @Override
    public TriggerType getType() {
        return TriggerType.CONNECTION_COUNT;
    }
}
