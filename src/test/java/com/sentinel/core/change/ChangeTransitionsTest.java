package com.sentinel.core.change;

import com.sentinel.core.error.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChangeTransitionsTest {

    @Test
    @DisplayName("happy path for a reviewed change")
    void reviewedPath() {
        ChangeStatus s = ChangeStatus.DRAFT;
        s = ChangeTransitions.next(s, ChangeAction.SUBMIT);
        s = ChangeTransitions.next(s, ChangeAction.BEGIN_REVIEW);
        s = ChangeTransitions.next(s, ChangeAction.COMPLETE_REVIEW);
        s = ChangeTransitions.next(s, ChangeAction.APPROVE);
        s = ChangeTransitions.next(s, ChangeAction.SCHEDULE);
        s = ChangeTransitions.next(s, ChangeAction.BEGIN_EXECUTION);
        s = ChangeTransitions.next(s, ChangeAction.AWAIT_VERIFICATION);
        s = ChangeTransitions.next(s, ChangeAction.VERIFY);
        assertEquals(ChangeStatus.COMPLETED, s);
    }

    @Test
    @DisplayName("only a draft can be edited, and editing keeps it a draft")
    void updateOnlyInDraft() {
        assertEquals(ChangeStatus.DRAFT, ChangeTransitions.next(ChangeStatus.DRAFT, ChangeAction.UPDATE));
        for (ChangeStatus s : ChangeStatus.values()) {
            if (s != ChangeStatus.DRAFT) {
                assertTrue(ChangeTransitions.target(s, ChangeAction.UPDATE).isEmpty(), s.name());
            }
        }
    }

    @Test
    @DisplayName("auto-approval goes from SUBMITTED straight to APPROVED")
    void autoApproval() {
        assertEquals(ChangeStatus.APPROVED, ChangeTransitions.next(ChangeStatus.SUBMITTED, ChangeAction.AUTO_APPROVE));
    }

    @Test
    @DisplayName("approval without review is rejected")
    void approveRequiresReview() {
        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> ChangeTransitions.next(ChangeStatus.SUBMITTED, ChangeAction.APPROVE));
        assertTrue(ex.getMessage().contains("SUBMITTED"));
        assertTrue(ex.getMessage().contains("approve"));
    }

    @Test
    @DisplayName("a blocked execution returns to APPROVED")
    void blockedExecution() {
        assertEquals(ChangeStatus.APPROVED, ChangeTransitions.next(ChangeStatus.SCHEDULED, ChangeAction.BLOCK_EXECUTION));
    }

    @Test
    @DisplayName("rollback is possible while executing, verifying or failed")
    void rollbackSources() {
        for (ChangeStatus from : Set.of(ChangeStatus.IN_PROGRESS, ChangeStatus.PENDING_VERIFICATION, ChangeStatus.FAILED)) {
            assertEquals(ChangeStatus.ROLLED_BACK, ChangeTransitions.next(from, ChangeAction.ROLLBACK), from.name());
        }
        assertThrows(InvalidTransitionException.class,
                () -> ChangeTransitions.next(ChangeStatus.SCHEDULED, ChangeAction.ROLLBACK));
    }

    @Test
    @DisplayName("reject and cancel only before approval")
    void rejectAndCancelBeforeApproval() {
        for (ChangeStatus s : ChangeStatus.values()) {
            boolean cancellable = ChangeTransitions.target(s, ChangeAction.CANCEL).isPresent();
            assertEquals(s.isPreApproval(), cancellable, s.name());
        }
        assertTrue(ChangeTransitions.target(ChangeStatus.DRAFT, ChangeAction.REJECT).isEmpty());
        assertTrue(ChangeTransitions.target(ChangeStatus.APPROVED, ChangeAction.REJECT).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = ChangeStatus.class, names = {"COMPLETED", "ROLLED_BACK", "REJECTED", "CANCELLED"})
    @DisplayName("terminal states accept no action")
    void terminalStatesAreFinal(ChangeStatus terminal) {
        assertTrue(terminal.isTerminal());
        assertTrue(ChangeTransitions.allowedActions(terminal).isEmpty());
        for (ChangeAction action : ChangeAction.values()) {
            assertThrows(InvalidTransitionException.class, () -> ChangeTransitions.next(terminal, action));
        }
    }

    @Test
    @DisplayName("a failed change can only be rolled back")
    void failedOnlyRollsBack() {
        assertEquals(Set.of(ChangeAction.ROLLBACK), ChangeTransitions.allowedActions(ChangeStatus.FAILED));
    }
}
