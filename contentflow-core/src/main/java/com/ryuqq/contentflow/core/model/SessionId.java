package com.ryuqq.contentflow.core.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 워크플로우 실행(run)의 고유 식별자.
 *
 * <p>SessionId는 정규화된 키워드와 시작 시각을 결합하여 만들어지며,
 * 스냅샷 파일명({@code .workflow_state_<id>.json}), 스테이징 디렉토리({@code .temp_<id>}),
 * 최종 출력 디렉토리({@code <id>}) 이름에 그대로 사용됩니다.</p>
 *
 * <p>서로 다른 키워드의 동시 실행은 절대 같은 SessionId를 갖지 않습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~230자</li>
 *   <li>패턴: 문자, 숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class SessionId {

    /**
     * 세션 타임스탬프 형식 (밀리초 포함).
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private static final int MAX_LENGTH = 230;

    private final String value;

    private SessionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("SessionId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[\\p{L}\\p{N}\\-_]+$")) {
            throw new IllegalArgumentException("SessionId contains invalid characters. Only letters, digits, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 키워드와 시작 시각으로 SessionId 생성.
     *
     * @param keyword 키워드
     * @param startedAt 실행 시작 시각
     * @return SessionId 인스턴스 (예: diabetes_management_20260101_100000_123)
     * @throws IllegalArgumentException keyword 또는 startedAt이 null인 경우
     */
    public static SessionId of(Keyword keyword, LocalDateTime startedAt) {
        if (keyword == null) {
            throw new IllegalArgumentException("keyword cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        return new SessionId(keyword.sanitized() + "_" + TIMESTAMP_FORMAT.format(startedAt));
    }

    /**
     * 기존 값으로 SessionId 복원.
     *
     * @param value SessionId 값
     * @return SessionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionId of(String value) {
        return new SessionId(value);
    }

    /**
     * SessionId 값 조회.
     *
     * @return SessionId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionId sessionId = (SessionId) o;
        return value.equals(sessionId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SessionId{" + value + '}';
    }
}
