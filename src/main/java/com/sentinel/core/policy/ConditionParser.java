package com.sentinel.core.policy;

import com.sentinel.core.error.PolicyEvaluationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiles stored condition definitions into {@link Condition} trees.
 * <p>
 * Definition grammar (a JSON object):
 * <ul>
 *   <li>{@code "key": value} exact equality on a scalar value</li>
 *   <li>{@code "key": {"$in": [v1, v2]}} membership</li>
 *   <li>{@code "key": {"$eq": value}} explicit equality</li>
 *   <li>{@code "$all": [def, ...]} every nested definition matches</li>
 *   <li>{@code "$any": [def, ...]} at least one nested definition matches</li>
 * </ul>
 * Sibling entries are combined with AND. Anything else is rejected with
 * {@link PolicyEvaluationException}.
 */
public final class ConditionParser {

    private ConditionParser() {}

    /**
     * Compiles an applicability definition; empty or {@code null} always applies.
     */
    public static Condition compile(Map<String, ?> definition) {
        if (definition == null || definition.isEmpty()) {
            return Condition.ALWAYS;
        }
        List<Condition> operands = new ArrayList<>();
        for (Map.Entry<String, ?> entry : definition.entrySet()) {
            operands.add(compileEntry(entry.getKey(), entry.getValue()));
        }
        return operands.size() == 1 ? operands.get(0) : new Condition.All(operands);
    }

    /**
     * Compiles an auto-deny definition: each entry is an independent trigger and
     * the result matches when any trigger does. Empty or {@code null} never matches.
     */
    public static Condition compileTriggers(Map<String, ?> definition) {
        if (definition == null || definition.isEmpty()) {
            return Condition.NEVER;
        }
        List<Condition> triggers = new ArrayList<>();
        for (Map.Entry<String, ?> entry : definition.entrySet()) {
            triggers.add(compileEntry(entry.getKey(), entry.getValue()));
        }
        return new Condition.AnyOf(triggers);
    }

    private static Condition compileEntry(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new PolicyEvaluationException("Condition key must not be blank");
        }
        if (key.startsWith("$")) {
            return compileCombinator(key, value);
        }
        if (value instanceof Map<?, ?> operator) {
            return compileOperator(key, operator);
        }
        if (value instanceof Collection<?>) {
            throw new PolicyEvaluationException("Condition '" + key + "' compares against a list; use {\"$in\": [...]}");
        }
        return new Condition.Equals(key, value);
    }

    private static Condition compileCombinator(String operator, Object value) {
        if (!(value instanceof Collection<?> items)) {
            throw new PolicyEvaluationException("Operator '" + operator + "' requires a list of conditions");
        }
        List<Condition> operands = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> nested)) {
                throw new PolicyEvaluationException("Operator '" + operator + "' items must be condition objects");
            }
            operands.add(compile(asDefinition(nested)));
        }
        return switch (operator) {
            case "$all" -> new Condition.All(operands);
            case "$any" -> new Condition.AnyOf(operands);
            default -> throw new PolicyEvaluationException("Unknown condition operator '" + operator + "'");
        };
    }

    private static Condition compileOperator(String key, Map<?, ?> operator) {
        if (operator.size() != 1) {
            throw new PolicyEvaluationException("Condition '" + key + "' must use exactly one operator");
        }
        Map.Entry<?, ?> entry = operator.entrySet().iterator().next();
        String name = String.valueOf(entry.getKey());
        Object operand = entry.getValue();
        return switch (name) {
            case "$in" -> {
                if (!(operand instanceof Collection<?> candidates)) {
                    throw new PolicyEvaluationException("Operator '$in' on '" + key + "' requires a list");
                }
                yield new Condition.InSet(key, candidates);
            }
            case "$eq" -> new Condition.Equals(key, operand);
            default -> throw new PolicyEvaluationException("Unknown operator '" + name + "' on '" + key + "'");
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asDefinition(Map<?, ?> nested) {
        for (Object k : nested.keySet()) {
            if (!(k instanceof String)) {
                throw new PolicyEvaluationException("Condition keys must be strings");
            }
        }
        return (Map<String, ?>) nested;
    }
}
