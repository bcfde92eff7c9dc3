package com.ryuqq.contentflow.core.model;

/**
 * 리서치 단계에서 수집된 참고 소스.
 *
 * @param title 소스 제목
 * @param url 소스 URL (빈 값이면 사용 불가 소스로 간주)
 * @param excerpt 발췌문 (null 가능)
 * @param domain 도메인 유형 (예: .edu, .gov, null 가능)
 * @param credibilityScore 신뢰도 (0.0 ~ 1.0)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record Source(
    String title,
    String url,
    String excerpt,
    String domain,
    double credibilityScore
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException title이 null이거나 credibilityScore가 범위를 벗어난 경우
     */
    public Source {
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        if (credibilityScore < 0.0 || credibilityScore > 1.0) {
            throw new IllegalArgumentException(
                "credibilityScore must be between 0.0 and 1.0 (current: " + credibilityScore + ")"
            );
        }
    }

    /**
     * 인용 가능한 소스인지 확인.
     *
     * @return URL이 비어 있지 않으면 true
     */
    public boolean isUsable() {
        return url != null && !url.isBlank();
    }
}
