package com.ryuqq.contentflow.core.model;

import com.ryuqq.contentflow.core.exception.WorkflowValidationException;

/**
 * 아티클 생성 대상 키워드.
 *
 * <p>키워드는 세션 ID, 스냅샷 파일명, 최종 출력 디렉토리 이름에 포함되므로
 * 생성 시점에 검증되며, 검증은 어떤 파일 I/O보다 먼저 수행됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>앞뒤 공백 제거 후 빈 문자열 불가</li>
 *   <li>길이: 최대 200자 (공백 제거 후 기준)</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class Keyword {

    /**
     * 허용되는 최대 키워드 길이.
     */
    public static final int MAX_LENGTH = 200;

    private final String value;

    private Keyword(String value) {
        if (value == null || value.isBlank()) {
            throw new WorkflowValidationException("Keyword cannot be empty");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new WorkflowValidationException(
                "Keyword too long: " + trimmed.length() + " characters (max " + MAX_LENGTH + ")"
            );
        }
        this.value = trimmed;
    }

    /**
     * Keyword 생성.
     *
     * @param value 원본 키워드 (앞뒤 공백은 제거됨)
     * @return Keyword 인스턴스
     * @throws WorkflowValidationException 비어 있거나 200자를 초과하는 경우
     */
    public static Keyword of(String value) {
        return new Keyword(value);
    }

    /**
     * 키워드 값 조회.
     *
     * @return 공백이 제거된 키워드
     */
    public String getValue() {
        return value;
    }

    /**
     * 파일 시스템에 안전한 형태로 변환.
     *
     * <p>영문자, 숫자, 하이픈(-), 언더스코어(_)를 제외한 모든 문자를 언더스코어로 치환합니다.</p>
     *
     * @return 정규화된 키워드 (예: "diabetes management" → "diabetes_management")
     */
    public String sanitized() {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '_');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Keyword keyword = (Keyword) o;
        return value.equals(keyword.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Keyword{" + value + '}';
    }
}
