package com.spatialflow.model;

import com.spatialflow.model.trigger.Trigger;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The automation carried by an action node: WHEN (trigger), IF (conditions),
 * THEN (action steps).
 *
 * Example:
 *   trigger     = property-change on "status", toValue "done"
 *   conditions  = [ trigger-node.priority == "high" ]
 *   actionSteps = [ {"type": "create-node", ...}, {"type": "llm-call", ...} ]
 *
 * Action steps are opaque here: the step executor interprets them.
 * The rule id is the id of the node that carries it.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class AutomationRule {

    private String id;

    private String title;

    private Trigger trigger;

    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> actionSteps = new ArrayList<>();

    private boolean enabled;

    private int runCount;

    private int errorCount;

    private Instant lastRun;

    private String lastError;

    /**
     * Copy of this rule with its run statistics replaced.
     */
    public AutomationRule withStats(RunStats stats) {
        return toBuilder()
                .runCount(stats.getRunCount())
                .errorCount(stats.getErrorCount())
                .lastRun(stats.getLastRun())
                .lastError(stats.getLastError())
                .build();
    }
}
