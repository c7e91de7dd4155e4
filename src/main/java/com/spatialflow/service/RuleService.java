package com.spatialflow.service;

import com.spatialflow.dto.RuleSummary;
import com.spatialflow.model.AutomationRule;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import com.spatialflow.repository.GraphStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rule-facing operations for the REST layer: listing registered rules with
 * their live run statistics, re-syncing, and manual runs.
 */
@Service
@RequiredArgsConstructor
public class RuleService {

    private final AutomationEngine engine;
    private final GraphStore graphStore;

    public List<RuleSummary> listActive() {
        GraphSnapshot graph = graphStore.snapshot();
        List<RuleSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, AutomationRule> entry : engine.getActiveRules().entrySet()) {
            // stats live on the graph node; the registered copy may be older
            AutomationRule rule = graph.findNode(entry.getKey())
                    .map(GraphNode::getRule)
                    .orElse(entry.getValue());
            summaries.add(toSummary(entry.getKey(), rule));
        }
        return summaries;
    }

    public int sync() {
        engine.syncRules();
        return engine.getActiveRules().size();
    }

    /**
     * Starts a manual run. Returns false when no rule node with that id exists.
     */
    public boolean trigger(String ruleId) {
        Optional<AutomationRule> rule = graphStore.snapshot().findNode(ruleId).map(GraphNode::getRule);
        if (rule.isEmpty()) {
            return false;
        }
        engine.triggerManual(ruleId);
        return true;
    }

    private RuleSummary toSummary(String ruleId, AutomationRule rule) {
        return RuleSummary.builder()
                .id(ruleId)
                .title(rule.getTitle())
                .triggerType(rule.getTrigger() == null ? null : rule.getTrigger().getType())
                .enabled(rule.isEnabled())
                .executing(engine.isExecuting(ruleId))
                .runCount(rule.getRunCount())
                .errorCount(rule.getErrorCount())
                .lastRun(rule.getLastRun())
                .lastError(rule.getLastError())
                .build();
    }
}
