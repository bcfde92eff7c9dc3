package com.ryuqq.contentflow.core.retry;

/**
 * 재시도 중단.
 *
 * <p>재시도 불가 오류(검증 실패 등)이거나 최대 시도 횟수를 소진한 경우입니다.
 * 호출자는 마지막 오류를 그대로 전파합니다.</p>
 *
 * @param reason 중단 사유
 * @param failedAttempt 마지막으로 실패한 시도 번호 (1 이상)
 * @param exhausted 시도 횟수 소진으로 중단되었으면 true, 재시도 불가 오류면 false
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record GiveUp(
    String reason,
    int failedAttempt,
    boolean exhausted
) implements RetryDecision {

    public GiveUp {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be positive (current: " + failedAttempt + ")");
        }
    }
}
