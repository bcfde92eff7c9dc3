package com.ryuqq.contentflow.core.snapshot;

import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 워크플로우 진행 스냅샷.
 *
 * <p>실행 하나당 JSON 문서 하나로 저장되며, 모든 상태 전이 직후 갱신됩니다.
 * 크래시 후 {@code resumeWorkflow}가 이 스냅샷으로 마지막 완료 단계부터 재개합니다.</p>
 *
 * <pre>
 * { "state": "research_complete", "timestamp": "2026-01-01T10:00:00Z",
 *   "data": { "keyword": "...", "research": { ... } },
 *   "temp_dir": "/out/.temp_keyword_20260101_100000_000" }
 * </pre>
 *
 * @param state 현재 상태
 * @param timestamp 스냅샷 기록 시각
 * @param data 진행 데이터
 * @param stagingDir 스테이징 디렉토리 (생성 전이면 null)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record WorkflowSnapshot(
    WorkflowState state,
    Instant timestamp,
    WorkflowData data,
    Path stagingDir
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException state, timestamp 또는 data가 null인 경우
     */
    public WorkflowSnapshot {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        // stagingDir는 null 허용
    }
}
