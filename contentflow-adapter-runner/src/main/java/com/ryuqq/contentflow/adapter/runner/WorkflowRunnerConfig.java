package com.ryuqq.contentflow.adapter.runner;

import com.ryuqq.contentflow.core.retry.BackoffCalculator;
import com.ryuqq.contentflow.core.retry.RetryPolicy;

import java.nio.file.Path;

/**
 * PipelineWorkflowRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>outputRoot: 스냅샷, 스테이징, 산출물이 놓이는 디렉토리 (기본 {@code drafts})</li>
 *   <li>retryMaxAttempts: 리서치 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>retryBaseDelayMs: 백오프 기본 지연 (기본 1000ms)</li>
 *   <li>retryMaxDelayMs: 백오프 최대 지연 (기본 30000ms)</li>
 *   <li>retryJitterFactor: 백오프 jitter 비율 (기본 0.1)</li>
 *   <li>minRecommendedSources: 경고 없이 통과하는 최소 소스 수 (기본 3)</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 * @param outputRoot 출력 루트 디렉토리
 * @param retryMaxAttempts 최대 시도 횟수 (1 이상)
 * @param retryBaseDelayMs 기본 지연 (밀리초, 양수)
 * @param retryMaxDelayMs 최대 지연 (밀리초, retryBaseDelayMs 이상)
 * @param retryJitterFactor jitter 비율 (0.0 ~ 1.0)
 * @param minRecommendedSources 권장 최소 소스 수 (1 이상)
 */
public record WorkflowRunnerConfig(
    Path outputRoot,
    int retryMaxAttempts,
    long retryBaseDelayMs,
    long retryMaxDelayMs,
    double retryJitterFactor,
    int minRecommendedSources
) {

    public static final String DEFAULT_OUTPUT_ROOT = "drafts";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: outputRoot=drafts, retryMaxAttempts=3, retryBaseDelayMs=1000ms,
     * retryMaxDelayMs=30000ms, retryJitterFactor=0.1, minRecommendedSources=3</p>
     */
    public WorkflowRunnerConfig() {
        this(Path.of(DEFAULT_OUTPUT_ROOT), RetryPolicy.DEFAULT_MAX_ATTEMPTS, 1000, 30000, 0.1, 3);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkflowRunnerConfig {
        if (outputRoot == null) {
            throw new IllegalArgumentException("outputRoot cannot be null");
        }
        if (retryMaxAttempts <= 0) {
            throw new IllegalArgumentException(
                "retryMaxAttempts must be positive (current: " + retryMaxAttempts + ")"
            );
        }
        if (retryBaseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "retryBaseDelayMs must be positive (current: " + retryBaseDelayMs + ")"
            );
        }
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new IllegalArgumentException(
                "retryMaxDelayMs must be >= retryBaseDelayMs (current: " + retryMaxDelayMs + " < " + retryBaseDelayMs + ")"
            );
        }
        if (retryJitterFactor < 0.0 || retryJitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "retryJitterFactor must be between 0.0 and 1.0 (current: " + retryJitterFactor + ")"
            );
        }
        if (minRecommendedSources <= 0) {
            throw new IllegalArgumentException(
                "minRecommendedSources must be positive (current: " + minRecommendedSources + ")"
            );
        }
    }

    /**
     * 설정값으로 리서치 재시도 정책 생성 (일시적 오류만 재시도).
     *
     * @return RetryPolicy
     */
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(
            retryMaxAttempts,
            new BackoffCalculator(retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor),
            RetryPolicy::isTransient
        );
    }

    public WorkflowRunnerConfig withOutputRoot(Path outputRoot) {
        return new WorkflowRunnerConfig(outputRoot, retryMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor, minRecommendedSources);
    }

    public WorkflowRunnerConfig withRetryMaxAttempts(int retryMaxAttempts) {
        return new WorkflowRunnerConfig(outputRoot, retryMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor, minRecommendedSources);
    }

    /**
     * 백오프 지연 설정만 변경한 새 인스턴스 생성.
     */
    public WorkflowRunnerConfig withRetryDelays(long retryBaseDelayMs, long retryMaxDelayMs, double retryJitterFactor) {
        return new WorkflowRunnerConfig(outputRoot, retryMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor, minRecommendedSources);
    }

    public WorkflowRunnerConfig withMinRecommendedSources(int minRecommendedSources) {
        return new WorkflowRunnerConfig(outputRoot, retryMaxAttempts, retryBaseDelayMs, retryMaxDelayMs, retryJitterFactor, minRecommendedSources);
    }
}
