package com.ryuqq.contentflow.core.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>리서치 재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 동시에 실행 중인 여러 오케스트레이터가 같은 시각에 외부 서비스를 다시 호출하지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(failedAttempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=30000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>failedAttempt=1: 1000-1100ms</li>
 *   <li>failedAttempt=2: 2000-2200ms</li>
 *   <li>failedAttempt=3: 4000-4400ms</li>
 *   <li>failedAttempt=6: 30000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class BackoffCalculator implements DelayStrategy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=30000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(1000, 30000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param failedAttempt 실패한 시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    @Override
    public long delayMillis(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }

        // shift는 62에서 잘라 overflow 방지
        int shift = Math.min(failedAttempt - 1, 62);
        long multiplier = 1L << shift;
        long exponential = baseDelayMs > maxDelayMs / multiplier
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
