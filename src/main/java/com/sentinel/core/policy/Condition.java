package com.sentinel.core.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Compiled policy condition, evaluated against a request context.
 * Built by {@link ConditionParser}; every node is a pure function of the context.
 */
public interface Condition {

    /** Matches every context. */
    Condition ALWAYS = new All(List.of());

    /** Matches no context. */
    Condition NEVER = new AnyOf(List.of());

    boolean matches(Map<String, ?> context);

    /**
     * Context value under {@code key} equals {@code expected}. A missing key never matches.
     */
    record Equals(String key, Object expected) implements Condition {
        @Override
        public boolean matches(Map<String, ?> context) {
            return context.containsKey(key) && ConditionValues.same(context.get(key), expected);
        }
    }

    /**
     * Context value under {@code key} equals one of {@code candidates}.
     */
    record InSet(String key, Collection<?> candidates) implements Condition {
        public InSet {
            candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        }

        @Override
        public boolean matches(Map<String, ?> context) {
            if (!context.containsKey(key)) {
                return false;
            }
            Object actual = context.get(key);
            for (Object candidate : candidates) {
                if (ConditionValues.same(actual, candidate)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Every operand matches; an empty conjunction always matches.
     */
    record All(List<Condition> operands) implements Condition {
        public All {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean matches(Map<String, ?> context) {
            for (Condition operand : operands) {
                if (!operand.matches(context)) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * At least one operand matches; an empty disjunction never matches.
     */
    record AnyOf(List<Condition> operands) implements Condition {
        public AnyOf {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean matches(Map<String, ?> context) {
            for (Condition operand : operands) {
                if (operand.matches(context)) {
                    return true;
                }
            }
            return false;
        }
    }
}
