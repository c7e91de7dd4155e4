package com.spatialflow.model.trigger;

import com.spatialflow.model.Comparison;
import lombok.*;

/**
 * Fires when a node enters or leaves the region and the region's member
 * count then passes the threshold.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ClusterSizeTrigger extends Trigger {

    private String regionId;

    private int threshold;

    private Comparison comparison;

    @Override
    public TriggerType getType() {
        return TriggerType.CLUSTER_SIZE;
    }
}
