package com.ryuqq.contentflow.adapter.filesystem.orphan;

import java.time.Duration;

/**
 * OrphanCollector 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>olderThan: 이 시간보다 오래된 항목만 삭제 (기본 24시간)</li>
 *   <li>deleteSnapshots: {@code .workflow_state_*.json} 삭제 여부 (기본 true)</li>
 *   <li>deleteStagingDirectories: {@code .temp_*} 삭제 여부 (기본 true)</li>
 * </ul>
 *
 * <p>진행 중인 실행의 파일을 지우지 않도록 olderThan은 가장 긴 실행 시간보다 길게 잡아야 합니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 * @param olderThan 최소 경과 시간 (null 불가, 음수 불가)
 * @param deleteSnapshots 스냅샷 파일 삭제 여부
 * @param deleteStagingDirectories 스테이징 디렉토리 삭제 여부
 */
public record OrphanCollectorConfig(
    Duration olderThan,
    boolean deleteSnapshots,
    boolean deleteStagingDirectories
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: olderThan=24시간, 스냅샷과 스테이징 디렉토리 모두 삭제</p>
     */
    public OrphanCollectorConfig() {
        this(Duration.ofHours(24), true, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrphanCollectorConfig {
        if (olderThan == null) {
            throw new IllegalArgumentException("olderThan cannot be null");
        }
        if (olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan must not be negative (current: " + olderThan + ")");
        }
    }

    /**
     * 시간 단위 임계값으로 생성.
     *
     * @param hours 최소 경과 시간 (시간)
     * @return OrphanCollectorConfig
     */
    public static OrphanCollectorConfig olderThanHours(long hours) {
        return new OrphanCollectorConfig().withOlderThan(Duration.ofHours(hours));
    }

    public OrphanCollectorConfig withOlderThan(Duration olderThan) {
        return new OrphanCollectorConfig(olderThan, deleteSnapshots, deleteStagingDirectories);
    }

    public OrphanCollectorConfig withDeleteSnapshots(boolean deleteSnapshots) {
        return new OrphanCollectorConfig(olderThan, deleteSnapshots, deleteStagingDirectories);
    }

    public OrphanCollectorConfig withDeleteStagingDirectories(boolean deleteStagingDirectories) {
        return new OrphanCollectorConfig(olderThan, deleteSnapshots, deleteStagingDirectories);
    }
}
