package com.sentinel.core.policy;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * A conditional rule producing an allow/deny/review recommendation.
 * <p>
 * Conditions are kept in their stored form (a JSON-like map) so historical
 * evaluations stay reproducible; {@link ConditionParser} compiles them on use.
 * Policies are soft-deleted by deactivation, never removed.
 *
 * @param id                 identity
 * @param key                unique key
 * @param name               display name
 * @param action             recommendation when the policy applies
 * @param conditions         keys that must all match for the policy to apply; empty means always
 * @param autoDenyConditions triggers that force DENY when any of them matches
 * @param priority           evaluation order, lower first
 * @param active             false once soft-deleted
 * @param workflowId         owning workflow (nullable)
 */
public record ControlPolicy(
    String id,
    String key,
    String name,
    PolicyAction action,
    Map<String, Object> conditions,
    Map<String, Object> autoDenyConditions,
    int priority,
    boolean active,
    String workflowId
) {

    /** Ascending priority, ties broken by id. */
    public static final Comparator<ControlPolicy> EVALUATION_ORDER =
            Comparator.comparingInt(ControlPolicy::priority).thenComparing(ControlPolicy::id);

    public ControlPolicy {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(action, "action must not be null");
        key = key == null ? id : key;
        conditions = conditions == null ? Map.of() : conditions;
        autoDenyConditions = autoDenyConditions == null ? Map.of() : autoDenyConditions;
    }

    public ControlPolicy deactivate() {
        return new ControlPolicy(id, key, name, action, conditions, autoDenyConditions, priority, false, workflowId);
    }
}
