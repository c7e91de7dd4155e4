package com.spatialflow.service;

import com.spatialflow.scheduling.ScheduledTask;
import com.spatialflow.scheduling.TimerService;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Coalesces rapid matches per (rule, source node). A new match for a key
 * cancels that key's pending timer and arms a fresh one; only the last
 * match in a quiet period runs. Different keys never affect each other.
 */
@Slf4j
public class Debouncer {

    private final TimerService timerService;
    private final Duration quietPeriod;
    private final Map<Key, ScheduledTask> pending = new HashMap<>();

    public Debouncer(TimerService timerService, Duration quietPeriod) {
        this.timerService = timerService;
        this.quietPeriod = quietPeriod;
    }

    public synchronized void debounce(String ruleId, String sourceNodeId, Runnable action) {
        Key key = new Key(ruleId, sourceNodeId);
        ScheduledTask existing = pending.remove(key);
        if (existing != null) {
            existing.cancel();
        }

        AtomicReference<ScheduledTask> self = new AtomicReference<>();
        ScheduledTask task = timerService.schedule(() -> {
            synchronized (this) {
                // a replaced timer that fires anyway must not run
                if (!pending.remove(key, self.get())) {
                    return;
                }
            }
            log.debug("Debounce elapsed: rule={}, source={}", ruleId, sourceNodeId);
            action.run();
        }, quietPeriod);
        self.set(task);
        pending.put(key, task);
    }

    /**
     * Cancels every pending timer belonging to the rule.
     */
    public synchronized void cancelRule(String ruleId) {
        pending.entrySet().removeIf(entry -> {
            if (entry.getKey().getRuleId().equals(ruleId)) {
                entry.getValue().cancel();
                return true;
            }
            return false;
        });
    }

    /**
     * Cancels pending timers of every rule not in the given set.
     */
    public synchronized void retainRules(Set<String> ruleIds) {
        pending.entrySet().removeIf(entry -> {
            if (!ruleIds.contains(entry.getKey().getRuleId())) {
                entry.getValue().cancel();
                return true;
            }
            return false;
        });
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    @Value
    private static class Key {
        String ruleId;
        String sourceNodeId;
    }
}
