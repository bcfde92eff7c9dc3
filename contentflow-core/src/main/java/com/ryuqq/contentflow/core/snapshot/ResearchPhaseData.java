package com.ryuqq.contentflow.core.snapshot;

import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.time.Instant;

/**
 * 리서치 단계 데이터.
 *
 * @param startedAt 시작 시각
 * @param completedAt 완료 시각 (null 가능)
 * @param sourcesFound 사용 가능한 소스 수
 * @param result 리서치 결과 (완료 시 포함, 재개 시 재사용)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record ResearchPhaseData(
    Instant startedAt,
    Instant completedAt,
    int sourcesFound,
    ResearchResult result
) implements PhaseData {

    /**
     * 리서치 시작 시점 데이터 생성.
     *
     * @param startedAt 시작 시각
     * @return 완료 정보가 없는 ResearchPhaseData
     */
    public static ResearchPhaseData started(Instant startedAt) {
        return new ResearchPhaseData(startedAt, null, 0, null);
    }

    /**
     * 완료 정보를 기록한 새 인스턴스 생성.
     *
     * @param completedAt 완료 시각
     * @param result 리서치 결과
     * @return 완료된 ResearchPhaseData
     * @throws IllegalArgumentException result가 null인 경우
     */
    public ResearchPhaseData complete(Instant completedAt, ResearchResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return new ResearchPhaseData(startedAt, completedAt, result.usableSources().size(), result);
    }

    @Override
    public boolean covers(WorkflowState state) {
        return state == WorkflowState.RESEARCHING || state == WorkflowState.RESEARCH_COMPLETE;
    }
}
