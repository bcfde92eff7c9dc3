package com.ryuqq.contentflow.core.snapshot;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.util.Optional;

/**
 * 워크플로우 진행 데이터 (불변 record).
 *
 * <p>스냅샷의 {@code data} 필드에 대응합니다. 키워드와 재개 여부, 오류 메시지,
 * 그리고 단계별 {@link PhaseData} 구조체를 담습니다.</p>
 *
 * <p>키워드는 스냅샷에서 읽어 온 원본 문자열이므로 null이거나 비어 있을 수 있습니다.
 * 재개 시 오케스트레이터가 검증합니다.</p>
 *
 * @param keyword 키워드 원본 문자열 (null 가능)
 * @param resumed 재개된 실행인지 여부
 * @param error 치명적 오류 메시지 (null 가능)
 * @param research 리서치 단계 데이터 (null 가능)
 * @param writing 작성 단계 데이터 (null 가능)
 * @param saving 저장 단계 데이터 (null 가능)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record WorkflowData(
    String keyword,
    boolean resumed,
    String error,
    ResearchPhaseData research,
    WritingPhaseData writing,
    SavingPhaseData saving
) {

    /**
     * 키워드만 가진 초기 데이터 생성.
     *
     * @param keyword 키워드
     * @return 단계 데이터가 없는 WorkflowData
     */
    public static WorkflowData initial(String keyword) {
        return new WorkflowData(keyword, false, null, null, null, null);
    }

    public WorkflowData withResearch(ResearchPhaseData research) {
        return new WorkflowData(keyword, resumed, error, research, writing, saving);
    }

    public WorkflowData withWriting(WritingPhaseData writing) {
        return new WorkflowData(keyword, resumed, error, research, writing, saving);
    }

    public WorkflowData withSaving(SavingPhaseData saving) {
        return new WorkflowData(keyword, resumed, error, research, writing, saving);
    }

    public WorkflowData withError(String error) {
        return new WorkflowData(keyword, resumed, error, research, writing, saving);
    }

    public WorkflowData markResumed() {
        return new WorkflowData(keyword, true, error, research, writing, saving);
    }

    /**
     * 현재 상태에 해당하는 단계 데이터 조회.
     *
     * @param state 워크플로우 상태
     * @return 해당 단계 데이터, 없으면 빈 Optional
     */
    public Optional<PhaseData> phaseFor(WorkflowState state) {
        if (research != null && research.covers(state)) {
            return Optional.of(research);
        }
        if (writing != null && writing.covers(state)) {
            return Optional.of(writing);
        }
        if (saving != null && saving.covers(state)) {
            return Optional.of(saving);
        }
        return Optional.empty();
    }

    /**
     * 스냅샷에 포함된 리서치 결과.
     *
     * @return 완료된 리서치 결과, 없으면 빈 Optional
     */
    public Optional<ResearchResult> embeddedResearch() {
        return Optional.ofNullable(research).map(ResearchPhaseData::result);
    }

    /**
     * 스냅샷에 포함된 아티클.
     *
     * @return 완료된 아티클, 없으면 빈 Optional
     */
    public Optional<ArticleResult> embeddedArticle() {
        return Optional.ofNullable(writing).map(WritingPhaseData::article);
    }
}
