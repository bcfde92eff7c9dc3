package com.ryuqq.contentflow.core.retry;

/**
 * 재시도 지연 시간 전략.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DelayStrategy {

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param failedAttempt 실패한 시도 횟수 (1부터 시작)
     * @return 대기 시간 (밀리초, 0 이상)
     */
    long delayMillis(int failedAttempt);

    /**
     * 고정 지연 전략.
     *
     * @param delayMs 매 재시도마다 적용할 지연 (밀리초, 0 이상)
     * @return DelayStrategy
     * @throws IllegalArgumentException delayMs가 음수인 경우
     */
    static DelayStrategy fixed(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
        return failedAttempt -> delayMs;
    }
}
