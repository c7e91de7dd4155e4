package com.spatialflow.dto;

import lombok.*;

/**
 * Outcome of running a rule's action steps.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class StepResult {

    private boolean success;
    private String error;

    public static StepResult ok() {
        return new StepResult(true, null);
    }

    public static StepResult failure(String error) {
        return new StepResult(false, error);
    }
}
