package com.ryuqq.contentflow.core.retry;

/**
 * 실패한 시도에 대한 재시도 판단 결과.
 *
 * <ul>
 *   <li>{@link Retry}: 일시적 실패, 지연 후 재시도</li>
 *   <li>{@link GiveUp}: 재시도 불가 오류이거나 시도 횟수 소진</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public sealed interface RetryDecision permits Retry, GiveUp {

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isGiveUp() {
        return this instanceof GiveUp;
    }
}
