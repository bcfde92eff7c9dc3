package com.ryuqq.contentflow.core.retry;

import com.ryuqq.contentflow.core.exception.TransientOperationException;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;

/**
 * 리서치 단계 재시도 정책.
 *
 * <p>실패한 시도마다 {@link #decide(int, Throwable)}를 호출하여
 * {@link Retry} 또는 {@link GiveUp}을 얻습니다. 재시도 가능 여부는
 * {@code retryable} 조건으로, 대기 시간은 {@link DelayStrategy}로 결정됩니다.</p>
 *
 * <p>기본 정책({@link #defaults()})은 원인 체인 어딘가에
 * {@link TransientOperationException}이 있을 때만 재시도합니다.</p>
 *
 * @param maxAttempts 최대 시도 횟수 (첫 시도 포함, 1 이상)
 * @param delayStrategy 재시도 전 대기 시간 전략
 * @param retryable 재시도 가능한 오류 판별 조건
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    DelayStrategy delayStrategy,
    Predicate<Throwable> retryable
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        Objects.requireNonNull(delayStrategy, "delayStrategy cannot be null");
        Objects.requireNonNull(retryable, "retryable cannot be null");
    }

    /**
     * 기본 정책: 3회 시도, 1초 기반 지수 백오프 (최대 30초, jitter 0.1), 일시적 오류만 재시도.
     *
     * @return RetryPolicy
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, new BackoffCalculator(), RetryPolicy::isTransient);
    }

    /**
     * 재시도하지 않는 정책.
     *
     * @return RetryPolicy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, DelayStrategy.fixed(0), error -> false);
    }

    /**
     * 실패한 시도에 대한 재시도 판단.
     *
     * @param failedAttempt 방금 실패한 시도 번호 (1부터 시작)
     * @param error 실패 원인
     * @return Retry 또는 GiveUp
     */
    public RetryDecision decide(int failedAttempt, Throwable error) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be positive (current: " + failedAttempt + ")");
        }
        Throwable cause = unwrap(error);
        String message = describe(cause);

        if (!retryable.test(cause)) {
            return new GiveUp("Non-retryable error: " + message, failedAttempt, false);
        }
        if (failedAttempt >= maxAttempts) {
            return new GiveUp("Attempts exhausted (" + failedAttempt + "/" + maxAttempts + "): " + message, failedAttempt, true);
        }
        return new Retry(message, failedAttempt, delayStrategy.delayMillis(failedAttempt));
    }

    /**
     * 원인 체인에 {@link TransientOperationException}이 포함되어 있는지 확인.
     *
     * @param error 검사할 오류 (null 허용)
     * @return 일시적 오류면 true
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 32) {
            if (current instanceof TransientOperationException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    /**
     * CompletableFuture가 감싼 CompletionException 제거.
     *
     * @param error 오류
     * @return 실제 원인
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return (message == null || message.isBlank()) ? error.getClass().getSimpleName() : message;
    }
}
