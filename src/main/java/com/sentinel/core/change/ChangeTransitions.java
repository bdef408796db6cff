package com.sentinel.core.change;

import com.sentinel.core.error.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The change request transition table: a total function over (state, action).
 * Pairs missing from the table are rejected with {@link InvalidTransitionException}.
 */
public final class ChangeTransitions {

    private static final Map<ChangeStatus, Map<ChangeAction, ChangeStatus>> TABLE = new EnumMap<>(ChangeStatus.class);

    static {
        on(ChangeStatus.DRAFT, ChangeAction.UPDATE, ChangeStatus.DRAFT);
        on(ChangeStatus.DRAFT, ChangeAction.SUBMIT, ChangeStatus.SUBMITTED);
        on(ChangeStatus.DRAFT, ChangeAction.CANCEL, ChangeStatus.CANCELLED);

        on(ChangeStatus.SUBMITTED, ChangeAction.BEGIN_REVIEW, ChangeStatus.UNDER_REVIEW);
        on(ChangeStatus.SUBMITTED, ChangeAction.AUTO_APPROVE, ChangeStatus.APPROVED);
        on(ChangeStatus.SUBMITTED, ChangeAction.REJECT, ChangeStatus.REJECTED);
        on(ChangeStatus.SUBMITTED, ChangeAction.CANCEL, ChangeStatus.CANCELLED);

        on(ChangeStatus.UNDER_REVIEW, ChangeAction.COMPLETE_REVIEW, ChangeStatus.PENDING_APPROVAL);
        on(ChangeStatus.UNDER_REVIEW, ChangeAction.REJECT, ChangeStatus.REJECTED);
        on(ChangeStatus.UNDER_REVIEW, ChangeAction.CANCEL, ChangeStatus.CANCELLED);

        on(ChangeStatus.PENDING_APPROVAL, ChangeAction.APPROVE, ChangeStatus.APPROVED);
        on(ChangeStatus.PENDING_APPROVAL, ChangeAction.REJECT, ChangeStatus.REJECTED);
        on(ChangeStatus.PENDING_APPROVAL, ChangeAction.CANCEL, ChangeStatus.CANCELLED);

        on(ChangeStatus.APPROVED, ChangeAction.SCHEDULE, ChangeStatus.SCHEDULED);
        on(ChangeStatus.APPROVED, ChangeAction.RESCHEDULE, ChangeStatus.SCHEDULED);
        on(ChangeStatus.APPROVED, ChangeAction.BEGIN_EXECUTION, ChangeStatus.IN_PROGRESS);
        on(ChangeStatus.APPROVED, ChangeAction.BLOCK_EXECUTION, ChangeStatus.APPROVED);

        on(ChangeStatus.SCHEDULED, ChangeAction.RESCHEDULE, ChangeStatus.SCHEDULED);
        on(ChangeStatus.SCHEDULED, ChangeAction.BEGIN_EXECUTION, ChangeStatus.IN_PROGRESS);
        on(ChangeStatus.SCHEDULED, ChangeAction.BLOCK_EXECUTION, ChangeStatus.APPROVED);

        on(ChangeStatus.IN_PROGRESS, ChangeAction.COMPLETE_EXECUTION, ChangeStatus.COMPLETED);
        on(ChangeStatus.IN_PROGRESS, ChangeAction.AWAIT_VERIFICATION, ChangeStatus.PENDING_VERIFICATION);
        on(ChangeStatus.IN_PROGRESS, ChangeAction.FAIL_EXECUTION, ChangeStatus.FAILED);
        on(ChangeStatus.IN_PROGRESS, ChangeAction.ROLLBACK, ChangeStatus.ROLLED_BACK);

        on(ChangeStatus.PENDING_VERIFICATION, ChangeAction.VERIFY, ChangeStatus.COMPLETED);
        on(ChangeStatus.PENDING_VERIFICATION, ChangeAction.ROLLBACK, ChangeStatus.ROLLED_BACK);

        on(ChangeStatus.FAILED, ChangeAction.ROLLBACK, ChangeStatus.ROLLED_BACK);
    }

    private ChangeTransitions() {}

    private static void on(ChangeStatus from, ChangeAction action, ChangeStatus to) {
        TABLE.computeIfAbsent(from, s -> new EnumMap<>(ChangeAction.class)).put(action, to);
    }

    public static Optional<ChangeStatus> target(ChangeStatus from, ChangeAction action) {
        return Optional.ofNullable(TABLE.getOrDefault(from, Map.of()).get(action));
    }

    /**
     * @throws InvalidTransitionException when {@code action} is undefined in {@code from}
     */
    public static ChangeStatus next(ChangeStatus from, ChangeAction action) {
        return target(from, action).orElseThrow(() -> new InvalidTransitionException(
                "Cannot " + action.name().toLowerCase().replace('_', ' ') + " a change request in state " + from));
    }

    public static Set<ChangeAction> allowedActions(ChangeStatus from) {
        Map<ChangeAction, ChangeStatus> row = TABLE.get(from);
        return row == null ? Set.of() : Collections.unmodifiableSet(row.keySet());
    }
}
