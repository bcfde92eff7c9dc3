package com.ryuqq.contentflow.application.orchestrator;

import com.ryuqq.contentflow.core.cleanup.CleanupReport;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 오케스트레이터 스코프 (try-with-resources).
 *
 * <p>스코프를 벗어날 때 실행이 COMPLETE에 도달하지 못했으면
 * {@link WorkflowOrchestrator#releaseIncomplete()}로 스테이징 디렉토리와 스냅샷을 정리합니다.
 * 정리 실패는 경고 로그로만 남고 예외로 전파되지 않습니다.</p>
 *
 * <pre>
 * try (WorkflowScope scope = new WorkflowScope(orchestrator)) {
 *     scope.orchestrator().runFullWorkflow(keyword).join();
 * }
 * CleanupReport report = scope.lastReport();
 * </pre>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class WorkflowScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScope.class);

    private final WorkflowOrchestrator orchestrator;
    private volatile CleanupReport lastReport = CleanupReport.empty();
    private volatile boolean closed;

    /**
     * WorkflowScope 생성.
     *
     * @param orchestrator 감쌀 오케스트레이터
     * @throws IllegalArgumentException orchestrator가 null인 경우
     */
    public WorkflowScope(WorkflowOrchestrator orchestrator) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        this.orchestrator = orchestrator;
    }

    public WorkflowOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * 마지막 close() 정리 결과.
     *
     * @return 정리 결과 (close 전이거나 COMPLETE였으면 빈 결과)
     */
    public CleanupReport lastReport() {
        return lastReport;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        WorkflowState state = orchestrator.currentState();
        if (state == WorkflowState.COMPLETE) {
            return;
        }

        try {
            lastReport = orchestrator.releaseIncomplete();
            if (lastReport.hasFailures()) {
                log.warn("Scope closed with leftovers in state {}: {}", state, lastReport.failures());
            } else {
                log.debug("Scope closed in state {}, released {} item(s)", state, lastReport.totalRemoved());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release incomplete run in state {}: {}", state, e.getMessage(), e);
        }
    }
}
