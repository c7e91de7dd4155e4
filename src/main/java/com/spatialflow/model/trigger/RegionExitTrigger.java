package com.spatialflow.model.trigger;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RegionExitTrigger extends Trigger {

    private String regionId;

    @Override
    public TriggerType getType() {
        return TriggerType.REGION_EXIT;
    }
}
