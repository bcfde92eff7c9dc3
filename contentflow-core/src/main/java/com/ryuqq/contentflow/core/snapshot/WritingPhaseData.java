package com.ryuqq.contentflow.core.snapshot;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.time.Instant;

/**
 * 작성 단계 데이터.
 *
 * @param startedAt 시작 시각
 * @param completedAt 완료 시각 (null 가능)
 * @param wordCount 아티클 단어 수
 * @param article 작성된 아티클 (완료 시 포함, 재개 시 재사용)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record WritingPhaseData(
    Instant startedAt,
    Instant completedAt,
    int wordCount,
    ArticleResult article
) implements PhaseData {

    public static WritingPhaseData started(Instant startedAt) {
        return new WritingPhaseData(startedAt, null, 0, null);
    }

    public WritingPhaseData complete(Instant completedAt, ArticleResult article) {
        if (article == null) {
            throw new IllegalArgumentException("article cannot be null");
        }
        return new WritingPhaseData(startedAt, completedAt, article.wordCount(), article);
    }

    @Override
    public boolean covers(WorkflowState state) {
        return state == WorkflowState.WRITING || state == WorkflowState.WRITING_COMPLETE;
    }
}
