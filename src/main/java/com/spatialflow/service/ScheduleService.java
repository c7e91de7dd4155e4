package com.spatialflow.service;

import com.spatialflow.dto.AutomationEvent;
import com.spatialflow.model.AutomationRule;
import com.spatialflow.model.trigger.ScheduleTrigger;
import com.spatialflow.model.trigger.TriggerType;
import com.spatialflow.scheduling.ScheduledTask;
import com.spatialflow.scheduling.TimerService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Emits schedule-tick events for registered rules with a schedule trigger.
 *
 * Each rule gets one armed timer for the next occurrence of its cron; when
 * it fires a tick is sent to the engine (source = the rule id) and the next
 * occurrence is armed. Cron accepts 5 fields (minute precision) or 6 fields
 * (with seconds).
 *
 * Kept in step with the registry: a changed cron re-arms, a rule that is no
 * longer registered loses its timer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private final AutomationEngine engine;
    private final TimerService timerService;
    private final Clock clock;

    private final Map<String, Schedule> schedules = new HashMap<>();

    @PostConstruct
    void listenForRuleChanges() {
        engine.onRulesChanged(this::syncSchedules);
    }

    public synchronized void syncSchedules() {
        Map<String, AutomationRule> rules = engine.getActiveRules();
        Map<String, String> wanted = new HashMap<>();
        for (Map.Entry<String, AutomationRule> entry : rules.entrySet()) {
            AutomationRule rule = entry.getValue();
            if (rule.getTrigger() != null && rule.getTrigger().getType() == TriggerType.SCHEDULE) {
                wanted.put(entry.getKey(), ((ScheduleTrigger) rule.getTrigger()).getCron());
            }
        }

        schedules.entrySet().removeIf(entry -> {
            String cron = wanted.get(entry.getKey());
            if (cron == null || !cron.equals(entry.getValue().cron)) {
                entry.getValue().task.cancel();
                log.debug("Schedule torn down: rule={}", entry.getKey());
                return true;
            }
            return false;
        });

        for (Map.Entry<String, String> entry : wanted.entrySet()) {
            if (!schedules.containsKey(entry.getKey())) {
                arm(entry.getKey(), entry.getValue());
            }
        }
    }

    public synchronized Set<String> scheduledRuleIds() {
        return Set.copyOf(schedules.keySet());
    }

    private void arm(String ruleId, String cron) {
        CronExpression expression;
        try {
            expression = parse(cron);
        } catch (IllegalArgumentException e) {
            log.warn("Unsupported cron '{}' on rule {}: {}", cron, ruleId, e.getMessage());
            return;
        }

        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime next = expression.next(now);
        if (next == null) {
            log.warn("Cron '{}' on rule {} never fires again", cron, ruleId);
            return;
        }

        Schedule schedule = new Schedule(cron);
        schedule.task = timerService.schedule(() -> fire(ruleId, schedule), Duration.between(now, next));
        schedules.put(ruleId, schedule);
        log.debug("Schedule armed: rule={}, next={}", ruleId, next);
    }

    private void fire(String ruleId, Schedule schedule) {
        synchronized (this) {
            if (schedules.get(ruleId) != schedule) {
                return;
            }
        }
        log.info("Schedule tick: rule={}", ruleId);
        engine.handleEvent(AutomationEvent.scheduleTick(ruleId, clock.instant()));

        synchronized (this) {
            if (schedules.get(ruleId) == schedule) {
                schedules.remove(ruleId);
                arm(ruleId, schedule.cron);
            }
        }
    }

    static CronExpression parse(String cron) {
        if (cron == null) {
            throw new IllegalArgumentException("cron is missing");
        }
        String trimmed = cron.trim();
        // 5-field cron has no seconds field
        if (trimmed.split("\\s+").length == 5) {
            trimmed = "0 " + trimmed;
        }
        return CronExpression.parse(trimmed);
    }

    private static class Schedule {
        private final String cron;
        private ScheduledTask task;

        Schedule(String cron) {
            this.cron = cron;
        }
    }
}
