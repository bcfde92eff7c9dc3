package com.ryuqq.contentflow.core.snapshot;

import java.nio.file.Path;

/**
 * 스냅샷 저장/삭제 결과.
 *
 * <p>스냅샷 영속화는 best-effort입니다. 실패해도 예외를 던지지 않고
 * {@link Degraded}를 반환하며, 파이프라인은 재개 불가능한 상태로 계속 진행합니다.
 * 테스트는 이 타입으로 degraded 경로를 직접 검증할 수 있습니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public sealed interface PersistenceResult permits PersistenceResult.Persisted, PersistenceResult.Degraded {

    Path path();

    default boolean isDegraded() {
        return this instanceof Degraded;
    }

    /**
     * 성공.
     *
     * @param path 대상 파일 경로
     */
    record Persisted(Path path) implements PersistenceResult {
    }

    /**
     * 실패 (경고만 기록됨).
     *
     * @param path 대상 파일 경로
     * @param reason 실패 사유
     */
    record Degraded(Path path, String reason) implements PersistenceResult {
    }
}
