package com.ryuqq.contentflow.core.retry;

/**
 * 리서치 호출을 다시 시도하라는 판단.
 *
 * <p>일시적 오류({@link com.ryuqq.contentflow.core.exception.TransientOperationException})로
 * 실패했고 아직 시도 횟수가 남아 있을 때 반환됩니다. 호출자는
 * {@code nextRetryAfterMillis} 만큼 기다린 뒤 {@link #nextAttempt()} 번째 시도를 수행합니다.</p>
 *
 * @param reason 실패한 시도의 오류 메시지
 * @param failedAttempt 방금 실패한 시도 번호 (1부터 시작)
 * @param nextRetryAfterMillis 다음 시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record Retry(
    String reason,
    int failedAttempt,
    long nextRetryAfterMillis
) implements RetryDecision {

    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be positive (current: " + failedAttempt + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException(
                "nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")"
            );
        }
    }

    public int nextAttempt() {
        return failedAttempt + 1;
    }
}
