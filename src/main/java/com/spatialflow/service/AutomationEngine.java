package com.spatialflow.service;

import com.spatialflow.config.AutomationProperties;
import com.spatialflow.dto.AutomationEvent;
import com.spatialflow.dto.ExecutionContext;
import com.spatialflow.dto.StepResult;
import com.spatialflow.model.AutomationRule;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import com.spatialflow.model.RunStats;
import com.spatialflow.repository.GraphStore;
import com.spatialflow.scheduling.TimerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * The automation engine.
 *
 * FLOW:
 *   1. Receive a graph event (property change, new edge, node moved into a region...)
 *   2. For every registered rule → does its trigger match this event?
 *   3. If yes → debounce per (rule, source node): restart a quiet-period timer
 *   4. Timer fires → rule still registered? → execute
 *   5. Execute: guard against cycles and runaway chains, re-read the rule,
 *      evaluate its conditions, hand the steps to the step executor
 *   6. Write run statistics back onto the rule node
 *
 * Manual runs skip steps 2-4.
 *
 * SAFETY:
 *   - A rule already on the execution stack is not started again (cycle).
 *   - No rule starts while the stack is at max depth (runaway chain).
 *   - Both rejections are logged, not recorded as rule errors.
 *   - The stack entry is released however the executor finishes, including
 *     by throwing.
 *
 * Every piece of runtime state (registry, debounce timers, execution stack,
 * proximity memory, recent events) belongs to this instance and is never
 * persisted.
 */
@Service
@Slf4j
public class AutomationEngine {

    private final GraphStore graphStore;
    private final StepExecutor stepExecutor;
    private final TriggerMatcher triggerMatcher;
    private final ConditionEvaluator conditionEvaluator;
    private final AutomationProperties properties;
    private final Clock clock;

    private final RuleRegistry registry = new RuleRegistry();
    private final ProximityMemory proximityMemory = new ProximityMemory();
    private final Debouncer debouncer;

    private final List<String> executionStack = new ArrayList<>();
    private final Set<String> executingRules = new HashSet<>();
    private final Deque<AutomationEvent> recentEvents = new ArrayDeque<>();

    public AutomationEngine(GraphStore graphStore,
                            StepExecutor stepExecutor,
                            TimerService timerService,
                            TriggerMatcher triggerMatcher,
                            ConditionEvaluator conditionEvaluator,
                            AutomationProperties properties,
                            Clock clock) {
        this.graphStore = graphStore;
        this.stepExecutor = stepExecutor;
        this.triggerMatcher = triggerMatcher;
        this.conditionEvaluator = conditionEvaluator;
        this.properties = properties;
        this.clock = clock;
        this.debouncer = new Debouncer(timerService, properties.getEngine().getDebounce());
    }

    // --- Rule store ---

    public void registerRule(String ruleId, AutomationRule rule) {
        registry.register(ruleId, rule);
    }

    /**
     * Stops watching the rule and cancels its pending debounce timers.
     */
    public void unregisterRule(String ruleId) {
        debouncer.cancelRule(ruleId);
        proximityMemory.forgetRule(ruleId);
        registry.unregister(ruleId);
    }

    /**
     * Forgets runtime state kept for a node that left the graph.
     */
    public void forgetNode(String nodeId) {
        proximityMemory.forgetNode(nodeId);
    }

    /**
     * Rebuilds the registry from the current graph. Idempotent.
     */
    public void syncRules() {
        registry.rebuild(graphStore.snapshot());
        debouncer.retainRules(registry.snapshot().keySet());
    }

    public Map<String, AutomationRule> getActiveRules() {
        return registry.snapshot();
    }

    public boolean isRegistered(String ruleId) {
        return registry.contains(ruleId);
    }

    /**
     * Called after every change to the set of registered rules.
     */
    public void onRulesChanged(Runnable listener) {
        registry.addListener(listener);
    }

    // --- Event intake ---

    public void handleEvent(AutomationEvent event) {
        recordRecentEvent(event);
        GraphSnapshot graph = graphStore.snapshot();

        for (Map.Entry<String, AutomationRule> entry : registry.snapshot().entrySet()) {
            String ruleId = entry.getKey();
            boolean matched;
            try {
                matched = triggerMatcher.matches(ruleId, entry.getValue(), event, graph, proximityMemory);
            } catch (RuntimeException e) {
                log.warn("Trigger evaluation failed for rule {}: {}", ruleId, e.getMessage(), e);
                continue;
            }
            if (!matched) {
                continue;
            }

            log.debug("Trigger matched: rule={}, event={}, source={}",
                    ruleId, event.getType(), event.getSourceNodeId());
            debouncer.debounce(ruleId, event.getSourceNodeId(), () -> {
                if (registry.contains(ruleId)) {
                    executeAction(ruleId, event);
                } else {
                    log.debug("Rule unregistered while debouncing: {}", ruleId);
                }
            });
        }
    }

    /**
     * Runs the rule now, without trigger matching or debounce.
     */
    public CompletableFuture<Void> triggerManual(String ruleId) {
        log.info("Manual trigger: rule={}", ruleId);
        return executeAction(ruleId, AutomationEvent.manual(ruleId, clock.instant()));
    }

    // --- Execution ---

    public CompletableFuture<Void> executeAction(String ruleId, AutomationEvent event) {
        AutomationRule rule;
        GraphSnapshot graph;

        synchronized (this) {
            if (executionStack.contains(ruleId)) {
                log.warn("Circular trigger prevented for rule {} (stack={})", ruleId, executionStack);
                return CompletableFuture.completedFuture(null);
            }
            if (executionStack.size() >= properties.getEngine().getMaxStackDepth()) {
                log.warn("Max stack depth {} reached, skipping rule {} (stack={})",
                        properties.getEngine().getMaxStackDepth(), ruleId, executionStack);
                return CompletableFuture.completedFuture(null);
            }

            // the rule may have been edited or disabled since the event was queued
            graph = graphStore.snapshot();
            Optional<AutomationRule> live = graph.findNode(ruleId).map(GraphNode::getRule);
            if (live.isEmpty() || !live.get().isEnabled()) {
                log.debug("Rule gone or disabled, not executing: {}", ruleId);
                return CompletableFuture.completedFuture(null);
            }
            rule = live.get();

            if (!conditionEvaluator.evaluate(rule, event, graph)) {
                log.debug("Conditions not met: rule={}, source={}", ruleId, event.getSourceNodeId());
                return CompletableFuture.completedFuture(null);
            }

            executionStack.add(ruleId);
            executingRules.add(ruleId);
        }

        ExecutionContext context = ExecutionContext.builder()
                .triggerNodeId(event.getSourceNodeId())
                .ruleId(ruleId)
                .event(event)
                .variables(new HashMap<>())
                .startedAt(clock.instant())
                .build();

        log.info("Executing rule {}: event={}, source={}", ruleId, event.getType(), event.getSourceNodeId());

        return invokeExecutor(rule, context, graph)
                .thenAccept(result -> recordResult(ruleId, rule, result))
                .whenComplete((ignored, error) -> {
                    release(ruleId);
                    if (error != null) {
                        log.error("Recording result failed for rule {}: {}", ruleId, error.getMessage(), error);
                    }
                });
    }

    private CompletableFuture<StepResult> invokeExecutor(AutomationRule rule, ExecutionContext context,
                                                         GraphSnapshot graph) {
        CompletableFuture<StepResult> pending;
        try {
            pending = stepExecutor.execute(rule.getActionSteps(), context, graph);
        } catch (RuntimeException e) {
            log.warn("Step executor threw for rule {}: {}", context.getRuleId(), e.getMessage());
            return CompletableFuture.completedFuture(StepResult.failure(messageOf(e)));
        }
        if (pending == null) {
            return CompletableFuture.completedFuture(StepResult.failure("Step executor returned no result"));
        }
        return pending.handle((result, error) -> {
            if (error != null) {
                return StepResult.failure(messageOf(error));
            }
            return result != null ? result : StepResult.failure("Step executor returned no result");
        });
    }

    private void recordResult(String ruleId, AutomationRule rule, StepResult result) {
        RunStats stats;
        if (result.isSuccess()) {
            stats = RunStats.builder()
                    .runCount(rule.getRunCount() + 1)
                    .errorCount(rule.getErrorCount())
                    .lastRun(clock.instant())
                    .lastError(null)
                    .build();
            log.info("Rule {} completed: runCount={}", ruleId, stats.getRunCount());
        } else {
            stats = RunStats.builder()
                    .runCount(rule.getRunCount() + 1)
                    .errorCount(rule.getErrorCount() + 1)
                    .lastRun(clock.instant())
                    .lastError(result.getError())
                    .build();
            log.warn("Rule {} failed: {} (errorCount={})", ruleId, result.getError(), stats.getErrorCount());
        }
        graphStore.updateRunStats(ruleId, stats);
    }

    private synchronized void release(String ruleId) {
        executionStack.remove(ruleId);
        executingRules.remove(ruleId);
    }

    // --- Diagnostics ---

    public synchronized List<String> executionStack() {
        return List.copyOf(executionStack);
    }

    public synchronized boolean isExecuting(String ruleId) {
        return executingRules.contains(ruleId);
    }

    public int pendingDebounceCount() {
        return debouncer.pendingCount();
    }

    public int proximityEntryCount() {
        return proximityMemory.size();
    }

    public synchronized List<AutomationEvent> recentEvents() {
        return List.copyOf(recentEvents);
    }

    private synchronized void recordRecentEvent(AutomationEvent event) {
        recentEvents.addLast(event);
        while (recentEvents.size() > properties.getEngine().getRecentEventLimit()) {
            recentEvents.removeFirst();
        }
    }

    private static String messageOf(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
