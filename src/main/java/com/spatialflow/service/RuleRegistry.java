package com.spatialflow.service;

import com.spatialflow.model.AutomationRule;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The enabled rules currently watching the graph, keyed by the id of the
 * node that carries them. Listeners hear about every change to the set.
 */
@Slf4j
public class RuleRegistry {

    private final Map<String, AutomationRule> activeRules = new LinkedHashMap<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void addListener(Runnable listener) {
        listeners.add(listener);
    }

    public void register(String ruleId, AutomationRule rule) {
        AutomationRule previous;
        synchronized (this) {
            previous = activeRules.put(ruleId, rule);
        }
        if (previous != rule) {
            log.debug("Rule registered: id={}", ruleId);
            notifyListeners();
        }
    }

    public void unregister(String ruleId) {
        AutomationRule removed;
        synchronized (this) {
            removed = activeRules.remove(ruleId);
        }
        if (removed != null) {
            log.debug("Rule unregistered: id={}", ruleId);
            notifyListeners();
        }
    }

    /**
     * Full rebuild: afterwards exactly the enabled rules present in the
     * snapshot are registered. Calling it twice on the same snapshot is a no-op.
     */
    public void rebuild(GraphSnapshot graph) {
        Map<String, AutomationRule> rebuilt = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes()) {
            AutomationRule rule = node.getRule();
            if (rule != null && rule.isEnabled()) {
                rebuilt.put(node.getId(), rule);
            }
        }
        boolean changed;
        synchronized (this) {
            changed = !sameRules(activeRules, rebuilt);
            activeRules.clear();
            activeRules.putAll(rebuilt);
        }
        log.info("Rules synced: active={}", rebuilt.size());
        if (changed) {
            notifyListeners();
        }
    }

    public synchronized boolean contains(String ruleId) {
        return activeRules.containsKey(ruleId);
    }

    public synchronized Map<String, AutomationRule> snapshot() {
        return new LinkedHashMap<>(activeRules);
    }

    private static boolean sameRules(Map<String, AutomationRule> a, Map<String, AutomationRule> b) {
        if (!a.keySet().equals(b.keySet())) {
            return false;
        }
        for (Map.Entry<String, AutomationRule> entry : a.entrySet()) {
            if (!Objects.equals(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            listener.run();
        }
    }
}
