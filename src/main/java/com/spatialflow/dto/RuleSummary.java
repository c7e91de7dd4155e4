package com.spatialflow.dto;

import com.spatialflow.model.trigger.TriggerType;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RuleSummary {

    private String id;
    private String title;
    private TriggerType triggerType;
    private boolean enabled;
    private boolean executing;
    private int runCount;
    private int errorCount;
    private Instant lastRun;
    private String lastError;
}
