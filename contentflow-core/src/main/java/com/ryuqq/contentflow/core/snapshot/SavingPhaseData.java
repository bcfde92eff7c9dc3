package com.ryuqq.contentflow.core.snapshot;

import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.time.Instant;

/**
 * 저장 단계 데이터.
 *
 * @param startedAt 시작 시각
 * @param completedAt 커밋 완료 시각 (null 가능)
 * @param outputPath 커밋된 리뷰 페이지(index.html) 경로 (null 가능)
 * @param published 외부 문서 발행 성공 여부 (발행 시도 전이면 null)
 * @param documentLink 발행된 문서 링크 (null 가능)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record SavingPhaseData(
    Instant startedAt,
    Instant completedAt,
    String outputPath,
    Boolean published,
    String documentLink
) implements PhaseData {

    public static SavingPhaseData started(Instant startedAt) {
        return new SavingPhaseData(startedAt, null, null, null, null);
    }

    public SavingPhaseData committed(Instant completedAt, String outputPath) {
        return new SavingPhaseData(startedAt, completedAt, outputPath, published, documentLink);
    }

    public SavingPhaseData withPublication(boolean published, String documentLink) {
        return new SavingPhaseData(startedAt, completedAt, outputPath, published, documentLink);
    }

    @Override
    public boolean covers(WorkflowState state) {
        return state == WorkflowState.SAVING || state == WorkflowState.COMPLETE;
    }
}
