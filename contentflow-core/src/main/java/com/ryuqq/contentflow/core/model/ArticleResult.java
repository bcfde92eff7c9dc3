package com.ryuqq.contentflow.core.model;

import java.util.List;

/**
 * 작성 단계 결과.
 *
 * <p>외부 작성 operation이 반환하는 불변 아티클입니다.
 * 인용한 소스 URL이 하나도 없는 아티클은 검증 실패로 처리됩니다.</p>
 *
 * @param title 아티클 제목
 * @param metaDescription 메타 설명
 * @param focusKeyword 대상 키워드
 * @param introduction 서론
 * @param sections 본문 섹션
 * @param conclusion 결론
 * @param wordCount 단어 수
 * @param readingTimeMinutes 예상 읽기 시간 (분)
 * @param keywordDensity 키워드 밀도 (0.0 ~ 1.0)
 * @param sourcesUsed 인용한 소스 URL 목록
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record ArticleResult(
    String title,
    String metaDescription,
    String focusKeyword,
    String introduction,
    List<ArticleSection> sections,
    String conclusion,
    int wordCount,
    int readingTimeMinutes,
    double keywordDensity,
    List<String> sourcesUsed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException title이 null이거나 수치 필드가 음수인 경우
     */
    public ArticleResult {
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        if (wordCount < 0) {
            throw new IllegalArgumentException("wordCount must be non-negative (current: " + wordCount + ")");
        }
        if (readingTimeMinutes < 0) {
            throw new IllegalArgumentException(
                "readingTimeMinutes must be non-negative (current: " + readingTimeMinutes + ")"
            );
        }
        metaDescription = metaDescription == null ? "" : metaDescription;
        focusKeyword = focusKeyword == null ? "" : focusKeyword;
        introduction = introduction == null ? "" : introduction;
        conclusion = conclusion == null ? "" : conclusion;
        sections = sections == null ? List.of() : List.copyOf(sections);
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
    }

    /**
     * 하나 이상의 소스를 인용했는지 확인.
     *
     * @return 비어 있지 않은 인용 URL이 있으면 true
     */
    public boolean citesSources() {
        return sourcesUsed.stream().anyMatch(url -> url != null && !url.isBlank());
    }
}
