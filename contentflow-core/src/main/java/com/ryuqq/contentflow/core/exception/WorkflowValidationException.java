package com.ryuqq.contentflow.core.exception;

/**
 * 영구적 검증 실패 (재시도 불가).
 *
 * <p>입력이나 결과물이 파이프라인 규칙을 위반하여 재시도해도 성공할 수 없는 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>빈 키워드 또는 200자를 초과하는 키워드</li>
 *   <li>사용 가능한 소스가 하나도 없는 리서치 결과</li>
 *   <li>소스를 하나도 인용하지 않은 아티클</li>
 *   <li>손상되었거나 인식할 수 없는 스냅샷 상태</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class WorkflowValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public WorkflowValidationException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인으로 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public WorkflowValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
