package com.ryuqq.contentflow.adapter.filesystem.orphan;

import com.ryuqq.contentflow.adapter.filesystem.output.FileTrees;
import com.ryuqq.contentflow.adapter.filesystem.output.OutputLayout;
import com.ryuqq.contentflow.core.cleanup.CleanupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 고아 파일 수집기.
 *
 * <p>크래시나 강제 종료로 남은 스냅샷 파일과 스테이징 디렉토리를 정리합니다.</p>
 *
 * <p><strong>정리 시나리오:</strong></p>
 * <pre>
 * 1. 실행 도중 프로세스 종료 → .workflow_state_*.json, .temp_* 잔존
 * 2. 재개하지 않은 채 시간 경과
 * 3. sweep(outputRoot) 호출 (예: 하루 한 번)
 * 4. 출력 루트 바로 아래에서 패턴과 일치하는 항목 탐색
 * 5. 수정 시각이 olderThan보다 오래된 항목 삭제
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>패턴 일치 항목 탐색 (하위 디렉토리는 탐색하지 않음)</li>
 *   <li>수정 시각 기준 경과 시간 판정</li>
 *   <li>항목별 삭제 실패 시에도 계속 진행</li>
 * </ul>
 *
 * <p>어떤 경우에도 예외를 던지지 않습니다. 출력 루트가 없으면 빈 결과를 반환합니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class OrphanCollector {

    private static final Logger log = LoggerFactory.getLogger(OrphanCollector.class);

    private final OrphanCollectorConfig config;
    private final Clock clock;
    private final Deleter deleter;

    public OrphanCollector(OrphanCollectorConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock 경과 시간 기준 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OrphanCollector(OrphanCollectorConfig config, Clock clock) {
        this(config, clock, FileTrees::deleteRecursively);
    }

    OrphanCollector(OrphanCollectorConfig config, Clock clock, Deleter deleter) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (deleter == null) {
            throw new IllegalArgumentException("deleter cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.deleter = deleter;
    }

    /**
     * 출력 루트의 고아 항목 정리.
     *
     * @param outputRoot 출력 루트 디렉토리
     * @return 정리 결과
     */
    public CleanupReport sweep(Path outputRoot) {
        if (outputRoot == null || !Files.isDirectory(outputRoot)) {
            log.debug("Orphan sweep skipped, output root does not exist: {}", outputRoot);
            return CleanupReport.empty();
        }

        Instant cutoff = clock.instant().minus(config.olderThan());
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputRoot)) {
            for (Path entry : stream) {
                candidates.add(entry);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to list output root {} for orphan sweep", outputRoot, e);
            return CleanupReport.empty();
        }

        int snapshots = 0;
        int directories = 0;
        List<Path> failures = new ArrayList<>();
        for (Path entry : candidates) {
            boolean snapshot = config.deleteSnapshots() && OutputLayout.isSnapshotFile(entry);
            boolean staging = !snapshot && config.deleteStagingDirectories() && OutputLayout.isStagingDirectory(entry);
            if (!snapshot && !staging) {
                continue;
            }
            if (!isOlderThan(entry, cutoff)) {
                continue;
            }
            if (tryDelete(entry)) {
                if (snapshot) {
                    snapshots++;
                } else {
                    directories++;
                }
            } else {
                failures.add(entry);
            }
        }

        CleanupReport report = new CleanupReport(snapshots, directories, failures);
        log.info("Orphan sweep completed in {}: {} snapshot(s), {} staging dir(s) removed, {} failure(s)",
            outputRoot, snapshots, directories, failures.size());
        return report;
    }

    private boolean isOlderThan(Path entry, Instant cutoff) {
        try {
            Instant modified = Files.getLastModifiedTime(entry, LinkOption.NOFOLLOW_LINKS).toInstant();
            return modified.isBefore(cutoff);
        } catch (IOException e) {
            log.error("Failed to read modification time of {}", entry, e);
            return false;
        }
    }

    /**
     * 개별 항목 삭제 시도.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 항목 정리를 방해하지 않습니다.</p>
     */
    private boolean tryDelete(Path entry) {
        try {
            deleter.delete(entry);
            log.info("Removed orphaned {}", entry);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to remove orphaned {}", entry, e);
            return false;
        }
    }

    @FunctionalInterface
    interface Deleter {
        void delete(Path path) throws IOException;
    }
}
