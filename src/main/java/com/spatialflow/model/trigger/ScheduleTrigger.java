package com.spatialflow.model.trigger;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ScheduleTrigger extends Trigger {

    /** 5-field cron, or 6-field with seconds. */
    private String cron;

    @Override
    public TriggerType getType() {
        return TriggerType.SCHEDULE;
    }
}
