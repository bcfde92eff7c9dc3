package com.ryuqq.contentflow.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.contentflow.core.statemachine.WorkflowState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (INITIALIZED → ... → COMPLETE) 성공</li>
 *   <li>비종료 상태 → FAILED → ROLLED_BACK 성공</li>
 *   <li>단계 건너뛰기, 역방향 전이, 종료 상태 이후 전이 시 IllegalStateException</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_HappyPath_ReachesComplete() {
        // Given
        WorkflowState state = INITIALIZED;

        // When
        state = StateTransition.transition(state, RESEARCHING);
        state = StateTransition.transition(state, RESEARCH_COMPLETE);
        state = StateTransition.transition(state, WRITING);
        state = StateTransition.transition(state, WRITING_COMPLETE);
        state = StateTransition.transition(state, SAVING);
        state = StateTransition.transition(state, COMPLETE);

        // Then
        assertEquals(COMPLETE, state);
        assertTrue(state.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowState.class, names = {
        "INITIALIZED", "RESEARCHING", "RESEARCH_COMPLETE", "WRITING", "WRITING_COMPLETE", "SAVING"
    })
    void validate_NonTerminalToFailed_Succeeds(WorkflowState from) {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(from, FAILED));
        assertTrue(StateTransition.canFail(from));
    }

    @Test
    void transition_FailedToRolledBack_Succeeds() {
        // When
        WorkflowState state = StateTransition.transition(FAILED, ROLLED_BACK);

        // Then
        assertEquals(ROLLED_BACK, state);
        assertTrue(state.isTerminal());
        assertTrue(state.isFailure());
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_SkippedPhase_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(RESEARCHING, WRITING)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
        assertTrue(exception.getMessage().contains("RESEARCHING"));
        assertTrue(exception.getMessage().contains("WRITING"));
    }

    @Test
    void validate_BackwardTransition_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(SAVING, WRITING));
    }

    @Test
    void validate_SelfTransition_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(WRITING, WRITING));
    }

    @ParameterizedTest
    @EnumSource(WorkflowState.class)
    void validate_FromComplete_AlwaysThrows(WorkflowState to) {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(COMPLETE, to)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @ParameterizedTest
    @EnumSource(WorkflowState.class)
    void validate_FromRolledBack_AlwaysThrows(WorkflowState to) {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(ROLLED_BACK, to));
    }

    @Test
    void validate_FailedToAnythingButRolledBack_Throws() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(FAILED, RESEARCHING));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(FAILED, COMPLETE));
        assertFalse(StateTransition.canFail(FAILED));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, RESEARCHING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(INITIALIZED, null));
    }
}
