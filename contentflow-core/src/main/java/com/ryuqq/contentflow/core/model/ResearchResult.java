package com.ryuqq.contentflow.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * 리서치 단계 결과.
 *
 * <p>외부 리서치 operation이 반환하는 불변 결과입니다.
 * 사용 가능한 소스가 하나도 없는 결과는 구조적으로 비어 있는 결과로 취급되며,
 * 오케스트레이터는 이를 재시도 없이 즉시 실패 처리합니다.</p>
 *
 * @param keyword 리서치 대상 키워드
 * @param summary 리서치 요약
 * @param sources 수집된 소스 목록
 * @param findings 주요 발견 사항
 * @param statistics 핵심 통계
 * @param researchGaps 식별된 연구 공백
 * @param totalSourcesAnalyzed 분석한 전체 소스 수
 * @param searchQuery 사용한 검색 쿼리 (null 가능)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record ResearchResult(
    String keyword,
    String summary,
    List<Source> sources,
    List<String> findings,
    List<String> statistics,
    List<String> researchGaps,
    int totalSourcesAnalyzed,
    String searchQuery
) {

    /**
     * Compact Constructor.
     *
     * <p>null 목록은 빈 목록으로 대체되며, 모든 목록은 불변 복사본으로 보관됩니다.</p>
     *
     * @throws IllegalArgumentException keyword가 null이거나 totalSourcesAnalyzed가 음수인 경우
     */
    public ResearchResult {
        if (keyword == null) {
            throw new IllegalArgumentException("keyword cannot be null");
        }
        if (totalSourcesAnalyzed < 0) {
            throw new IllegalArgumentException(
                "totalSourcesAnalyzed must be non-negative (current: " + totalSourcesAnalyzed + ")"
            );
        }
        summary = summary == null ? "" : summary;
        sources = sources == null ? List.of() : List.copyOf(sources);
        findings = findings == null ? List.of() : List.copyOf(findings);
        statistics = statistics == null ? List.of() : List.copyOf(statistics);
        researchGaps = researchGaps == null ? List.of() : List.copyOf(researchGaps);
    }

    /**
     * 인용 가능한 소스 목록.
     *
     * @return URL이 있는 소스만
     */
    public List<Source> usableSources() {
        return sources.stream().filter(Source::isUsable).toList();
    }

    /**
     * 인용 가능한 소스가 하나 이상 있는지 확인.
     *
     * @return 구조적으로 비어 있지 않으면 true
     */
    public boolean hasUsableSources() {
        return sources.stream().anyMatch(Source::isUsable);
    }

    /**
     * 신뢰도 순 상위 소스.
     *
     * @param limit 최대 개수 (0 이상)
     * @return 신뢰도 내림차순으로 정렬된 사용 가능 소스
     * @throws IllegalArgumentException limit이 음수인 경우
     */
    public List<Source> topSources(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
        return usableSources().stream()
            .sorted(Comparator.comparingDouble(Source::credibilityScore).reversed())
            .limit(limit)
            .toList();
    }
}
