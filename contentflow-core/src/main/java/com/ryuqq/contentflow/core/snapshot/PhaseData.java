package com.ryuqq.contentflow.core.snapshot;

import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.time.Instant;

/**
 * 단계별 진행 데이터.
 *
 * <p>스냅샷의 {@code data} 안에 단계마다 하나씩 기록되는 구조체입니다.
 * 문자열 키 조회 대신 단계별 타입으로 다룰 수 있도록 sealed interface로 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link ResearchPhaseData}: RESEARCHING, RESEARCH_COMPLETE</li>
 *   <li>{@link WritingPhaseData}: WRITING, WRITING_COMPLETE</li>
 *   <li>{@link SavingPhaseData}: SAVING, COMPLETE</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public sealed interface PhaseData permits ResearchPhaseData, WritingPhaseData, SavingPhaseData {

    /**
     * 단계 시작 시각.
     *
     * @return 시작 시각 (null 가능)
     */
    Instant startedAt();

    /**
     * 단계 완료 시각.
     *
     * @return 완료 시각, 아직 완료되지 않았으면 null
     */
    Instant completedAt();

    /**
     * 단계가 완료되었는지 확인.
     *
     * @return completedAt이 기록되어 있으면 true
     */
    default boolean isComplete() {
        return completedAt() != null;
    }

    /**
     * 이 단계 데이터가 담당하는 상태인지 확인.
     *
     * @param state 워크플로우 상태
     * @return 해당 상태의 데이터이면 true
     */
    boolean covers(WorkflowState state);
}
