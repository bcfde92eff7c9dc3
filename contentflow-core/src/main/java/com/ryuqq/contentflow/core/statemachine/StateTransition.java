package com.ryuqq.contentflow.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 워크플로우 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INITIALIZED → RESEARCHING</li>
 *   <li>RESEARCHING → RESEARCH_COMPLETE</li>
 *   <li>RESEARCH_COMPLETE → WRITING</li>
 *   <li>WRITING → WRITING_COMPLETE</li>
 *   <li>WRITING_COMPLETE → SAVING</li>
 *   <li>SAVING → COMPLETE</li>
 *   <li>비종료 상태 → FAILED</li>
 *   <li>FAILED → ROLLED_BACK</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETE, ROLLED_BACK)에서는 어떤 상태로도 전이 불가</li>
 *   <li>단계 건너뛰기 및 역방향 전이 불가</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkflowState from, WorkflowState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case INITIALIZED -> to == WorkflowState.RESEARCHING || to == WorkflowState.FAILED;
            case RESEARCHING -> to == WorkflowState.RESEARCH_COMPLETE || to == WorkflowState.FAILED;
            case RESEARCH_COMPLETE -> to == WorkflowState.WRITING || to == WorkflowState.FAILED;
            case WRITING -> to == WorkflowState.WRITING_COMPLETE || to == WorkflowState.FAILED;
            case WRITING_COMPLETE -> to == WorkflowState.SAVING || to == WorkflowState.FAILED;
            case SAVING -> to == WorkflowState.COMPLETE || to == WorkflowState.FAILED;
            case FAILED -> to == WorkflowState.ROLLED_BACK;
            case COMPLETE, ROLLED_BACK -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkflowState transition(WorkflowState current, WorkflowState next) {
        validate(current, next);
        return next;
    }

    /**
     * 실패 전이가 가능한 상태인지 확인.
     *
     * @param state 현재 상태
     * @return FAILED로 전이할 수 있으면 true
     */
    public static boolean canFail(WorkflowState state) {
        return state != null && !state.isTerminal() && state != WorkflowState.FAILED;
    }
}
