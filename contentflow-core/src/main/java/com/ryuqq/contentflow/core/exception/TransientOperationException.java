package com.ryuqq.contentflow.core.exception;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>외부 리서치 서비스의 네트워크 오류, 타임아웃, Rate Limit 초과 등
 * 재시도하면 성공할 가능성이 있는 경우 collaborator가 던집니다.</p>
 *
 * <p>기본 {@link com.ryuqq.contentflow.core.retry.RetryPolicy}는
 * 원인 체인 어딘가에 이 예외가 있을 때만 재시도합니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class TransientOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public TransientOperationException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인으로 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인 (예: IOException)
     */
    public TransientOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
