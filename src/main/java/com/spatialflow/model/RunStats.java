package com.spatialflow.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Run statistics the engine writes back onto a rule node after each execution.
 * The engine never touches the rule's trigger, conditions or steps.
 */
@Value
@Builder
public class RunStats {

    int runCount;
    int errorCount;
    Instant lastRun;
    String lastError;
}
