package com.spatialflow.dto;

import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Handed to the step executor with each run. Variables start empty; the
 * executor stores created node ids, LLM responses etc. in them.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ExecutionContext {

    private String triggerNodeId;
    private String ruleId;
    private AutomationEvent event;

    @Builder.Default
    private Map<String, Object> variables = new HashMap<>();

    private Instant startedAt;
}
