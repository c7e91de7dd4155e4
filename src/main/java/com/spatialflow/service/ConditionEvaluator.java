package com.spatialflow.service;

import com.spatialflow.dto.AutomationEvent;
import com.spatialflow.model.AutomationRule;
import com.spatialflow.model.Condition;
import com.spatialflow.model.ConditionOperator;
import com.spatialflow.model.GraphNode;
import com.spatialflow.model.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Evaluates a rule's guard conditions against the current graph.
 *
 * Supported operators:
 *   - equals / not-equals         → string comparison
 *   - contains / not-contains     → substring check on the string form
 *   - greater-than / less-than    → numeric comparison
 *   - is-empty / is-not-empty     → null, "" and [] count as empty
 *   - matches-regex               → regex find on the string form
 *
 * HOW IT WORKS:
 *   1. Resolve the condition's target to a node (trigger node, rule node, or a named one)
 *   2. Read the field from the node's data using the dot path
 *   3. Apply the operator against the condition's value
 *   4. AND all conditions together; an empty list passes
 *
 * Example:
 *   condition = trigger-node "meta.priority" equals "high"
 *   data      = {"meta": {"priority": "high"}}
 *   → resolves "high", compares "high" == "high" → true
 *
 * Nothing here throws on bad rule definitions: a missing node fails the
 * whole evaluation, a bad field path reads as null, a bad regex is false.
 */
@Component
@Slf4j
public class ConditionEvaluator {

    /**
     * Returns true if every condition of the rule passes for this event.
     */
    public boolean evaluate(AutomationRule rule, AutomationEvent event, GraphSnapshot graph) {
        List<Condition> conditions = rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }

        for (Condition condition : conditions) {
            Optional<GraphNode> target = resolveTarget(condition, rule, event, graph);
            if (target.isEmpty()) {
                log.debug("Condition target not found: rule={}, target={}", rule.getId(), condition.getTarget());
                return false;
            }

            Object fieldValue = resolveField(target.get().getData(), condition.getField());
            if (!evaluateOperator(fieldValue, condition.getOperator(), condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    private Optional<GraphNode> resolveTarget(Condition condition, AutomationRule rule,
                                              AutomationEvent event, GraphSnapshot graph) {
        if (condition.getTarget() == null) {
            return Optional.empty();
        }
        return switch (condition.getTarget()) {
            case TRIGGER_NODE -> graph.findNode(event.getSourceNodeId());
            case RULE_NODE -> graph.findNode(rule.getId());
            case SPECIFIC_NODE -> graph.findNode(condition.getTargetNodeId());
        };
    }

    public boolean evaluateOperator(Object fieldValue, ConditionOperator operator, Object conditionValue) {
        if (operator == null) {
            return false;
        }
        return switch (operator) {
            case EQUALS -> stringify(fieldValue).equals(stringify(conditionValue));
            case NOT_EQUALS -> !stringify(fieldValue).equals(stringify(conditionValue));
            case CONTAINS -> stringify(fieldValue).contains(stringify(conditionValue));
            case NOT_CONTAINS -> !stringify(fieldValue).contains(stringify(conditionValue));
            case GREATER_THAN -> toNumber(fieldValue) > toNumber(conditionValue);
            case LESS_THAN -> toNumber(fieldValue) < toNumber(conditionValue);
            case IS_EMPTY -> isEmpty(fieldValue);
            case IS_NOT_EMPTY -> !isEmpty(fieldValue);
            case MATCHES_REGEX -> matchesRegex(fieldValue, conditionValue);
        };
    }

    private boolean matchesRegex(Object fieldValue, Object pattern) {
        try {
            return Pattern.compile(stringify(pattern)).matcher(stringify(fieldValue)).find();
        } catch (PatternSyntaxException e) {
            log.debug("Invalid regex in condition: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Resolves a dotted path like "meta.owner" against nested maps.
     * A missing key or a non-map along the way yields null.
     */
    static Object resolveField(Object root, String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        Object current = root;
        for (String key : path.split("\\.")) {
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    /**
     * String form used by every string operator and by value filters.
     * Integral doubles print without ".0" so 3 and 3.0 compare equal; beyond
     * long precision they print in full decimal form.
     */
    static String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                if (Math.abs(d) < 1e15) {
                    return String.valueOf((long) d);
                }
                return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            }
            return String.valueOf(d);
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(ConditionEvaluator::stringify)
                    .collect(Collectors.joining(","));
        }
        return value.toString();
    }

    /**
     * Numeric form for greater-than / less-than. Unparseable values become NaN,
     * which makes both comparisons false.
     */
    static double toNumber(Object value) {
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static boolean isEmpty(Object value) {
        return value == null
                || "".equals(value)
                || (value instanceof Collection && ((Collection<?>) value).isEmpty());
    }
}
