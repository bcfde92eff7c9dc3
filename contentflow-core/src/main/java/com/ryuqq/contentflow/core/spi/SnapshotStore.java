package com.ryuqq.contentflow.core.spi;

import com.ryuqq.contentflow.core.snapshot.PersistenceResult;
import com.ryuqq.contentflow.core.snapshot.SnapshotLoad;
import com.ryuqq.contentflow.core.snapshot.WorkflowSnapshot;

import java.nio.file.Path;

/**
 * 워크플로우 스냅샷 저장소 SPI.
 *
 * <p>실행 하나당 스냅샷 문서 하나를 저장/조회/삭제합니다.
 * 모든 메서드는 예외를 던지지 않고 결과 타입으로 실패를 알립니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>원자적 저장: 저장 중 크래시가 발생해도 이전 스냅샷 또는 새 스냅샷 중 하나가 온전히 남아야 함</li>
 *   <li>서로 다른 경로에 대한 동시 호출 안전</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * 스냅샷 저장 (덮어쓰기).
     *
     * @param path 스냅샷 파일 경로
     * @param snapshot 저장할 스냅샷
     * @return Persisted 또는 Degraded
     */
    PersistenceResult save(Path path, WorkflowSnapshot snapshot);

    /**
     * 스냅샷 로드.
     *
     * @param path 스냅샷 파일 경로
     * @return Loaded, Missing, Unreadable 또는 UnrecognizedState
     */
    SnapshotLoad load(Path path);

    /**
     * 스냅샷 삭제.
     *
     * <p>파일이 없으면 Persisted를 반환합니다.</p>
     *
     * @param path 스냅샷 파일 경로
     * @return Persisted 또는 Degraded
     */
    PersistenceResult delete(Path path);
}
