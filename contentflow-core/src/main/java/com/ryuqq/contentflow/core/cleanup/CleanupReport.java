package com.ryuqq.contentflow.core.cleanup;

import java.nio.file.Path;
import java.util.List;

/**
 * 정리 작업 결과.
 *
 * <p>고아 파일 정리와 미완료 실행 해제({@code releaseIncomplete}) 모두 이 타입을 반환합니다.
 * 정리 실패는 예외가 아니라 {@code failures}에 기록됩니다.</p>
 *
 * @param snapshotsRemoved 삭제된 스냅샷 파일 수
 * @param directoriesRemoved 삭제된 스테이징 디렉토리 수
 * @param failures 삭제하지 못한 경로
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record CleanupReport(
    int snapshotsRemoved,
    int directoriesRemoved,
    List<Path> failures
) {

    public CleanupReport {
        if (snapshotsRemoved < 0 || directoriesRemoved < 0) {
            throw new IllegalArgumentException(
                "removed counts must be non-negative (snapshots: " + snapshotsRemoved
                    + ", directories: " + directoriesRemoved + ")"
            );
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static CleanupReport empty() {
        return new CleanupReport(0, 0, List.of());
    }

    public int totalRemoved() {
        return snapshotsRemoved + directoriesRemoved;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
