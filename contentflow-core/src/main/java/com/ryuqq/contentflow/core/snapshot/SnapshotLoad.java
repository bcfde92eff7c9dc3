package com.ryuqq.contentflow.core.snapshot;

import java.nio.file.Path;

/**
 * 스냅샷 로드 결과.
 *
 * <p>스냅샷 로드는 예외를 던지지 않고 다음 네 가지 결과 중 하나를 반환합니다.
 * 치명적인지 여부는 호출자가 결정합니다.</p>
 *
 * <ul>
 *   <li>{@link Loaded}: 정상적으로 디코딩됨</li>
 *   <li>{@link Missing}: 파일이 존재하지 않음</li>
 *   <li>{@link Unreadable}: 읽기 실패 또는 JSON 구조 손상</li>
 *   <li>{@link UnrecognizedState}: JSON은 유효하지만 state 값을 알 수 없음</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public sealed interface SnapshotLoad
    permits SnapshotLoad.Loaded, SnapshotLoad.Missing, SnapshotLoad.Unreadable, SnapshotLoad.UnrecognizedState {

    /**
     * 로드 대상 파일 경로.
     *
     * @return 스냅샷 파일 경로
     */
    Path path();

    /**
     * 로드 성공 여부.
     *
     * @return Loaded인 경우 true
     */
    default boolean isLoaded() {
        return this instanceof Loaded;
    }

    /**
     * 정상 로드.
     *
     * @param path 스냅샷 파일 경로
     * @param snapshot 디코딩된 스냅샷
     */
    record Loaded(Path path, WorkflowSnapshot snapshot) implements SnapshotLoad {
        public Loaded {
            if (snapshot == null) {
                throw new IllegalArgumentException("snapshot cannot be null");
            }
        }
    }

    /**
     * 파일 없음.
     *
     * @param path 스냅샷 파일 경로
     */
    record Missing(Path path) implements SnapshotLoad {
    }

    /**
     * 읽기 실패 또는 손상.
     *
     * @param path 스냅샷 파일 경로
     * @param reason 실패 사유
     */
    record Unreadable(Path path, String reason) implements SnapshotLoad {
    }

    /**
     * 알 수 없는 상태 값.
     *
     * @param path 스냅샷 파일 경로
     * @param rawState 스냅샷에 기록된 state 값 그대로 (null 가능)
     */
    record UnrecognizedState(Path path, String rawState) implements SnapshotLoad {
    }
}
