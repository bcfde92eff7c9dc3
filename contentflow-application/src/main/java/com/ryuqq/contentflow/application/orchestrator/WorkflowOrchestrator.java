package com.ryuqq.contentflow.application.orchestrator;

import com.ryuqq.contentflow.core.cleanup.CleanupReport;
import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.SessionId;
import com.ryuqq.contentflow.core.snapshot.WorkflowData;
import com.ryuqq.contentflow.core.spi.ProgressListener;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 아티클 파이프라인 실행 조정자.
 *
 * <p>리서치 → 작성 → 저장 세 단계를 상태 머신에 따라 순차 실행하고,
 * 모든 전이 직후 스냅샷을 기록하여 크래시 후 재개할 수 있도록 합니다.</p>
 *
 * <p>인스턴스 하나는 실행(run) 하나를 담당합니다. 세션 ID, 스냅샷 경로,
 * 스테이징 디렉토리는 인스턴스 전용이며 다른 인스턴스와 공유되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (WorkflowScope scope = new WorkflowScope(orchestrator)) {
 *     Path index = scope.orchestrator().runFullWorkflow("diabetes management").join();
 * }
 *
 * // 크래시 후 재개
 * Path index = newOrchestrator.resumeWorkflow(snapshotFile).join();
 * </pre>
 *
 * <p><strong>오류 전파:</strong> 반환된 future는 원래 예외로 실패합니다.
 * 도메인 예외로 감싸지 않습니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public interface WorkflowOrchestrator {

    /**
     * 전체 파이프라인 실행.
     *
     * <p>키워드 검증 후 세션과 스냅샷을 열고 리서치, 작성, 원자적 저장을 순서대로 수행합니다.
     * 복구되지 않은 오류는 FAILED 기록, 롤백, ROLLED_BACK 순으로 처리된 뒤 전파됩니다.</p>
     *
     * <p>반환된 future를 취소하면 다음 단계 경계에서 실행이 중단되고
     * {@link #releaseIncomplete()}가 수행됩니다.</p>
     *
     * @param keyword 원본 키워드
     * @return 커밋된 index.html 경로
     * @throws IllegalStateException 이 인스턴스가 이미 실행을 시작한 경우
     */
    CompletableFuture<Path> runFullWorkflow(String keyword);

    /**
     * 리서치 단계 실행 (RESEARCHING → RESEARCH_COMPLETE).
     *
     * <p>일시적 오류는 재시도 정책에 따라 재시도합니다.
     * 사용 가능한 소스가 없는 결과는 재시도 없이 즉시 실패합니다.</p>
     *
     * <p>단계별 호출은 세션을 연 채로 끝날 수 있으므로 {@link WorkflowScope}로 감싸거나
     * 마지막에 {@link #releaseIncomplete()}를 호출해야 합니다.</p>
     *
     * @param keyword 원본 키워드
     * @return 리서치 결과
     */
    CompletableFuture<ResearchResult> runResearch(String keyword);

    /**
     * 작성 단계 실행 (WRITING → WRITING_COMPLETE).
     *
     * <p>한 번만 호출하며, 인용 소스가 없는 아티클은 검증 실패로 처리합니다.</p>
     *
     * @param keyword 원본 키워드
     * @param research 완료된 리서치 결과
     * @return 아티클
     */
    CompletableFuture<ArticleResult> runWriting(String keyword, ResearchResult research);

    /**
     * 스테이징 없이 최종 디렉토리에 직접 저장.
     *
     * <p>상태 전이를 수행하지 않습니다.</p>
     *
     * @param keyword 원본 키워드
     * @param research 리서치 결과
     * @param article 아티클
     * @return 기록된 index.html 경로
     */
    CompletableFuture<Path> saveOutputs(String keyword, ResearchResult research, ArticleResult article);

    /**
     * 스테이징 후 원자적 커밋으로 저장 (SAVING → COMPLETE).
     *
     * @param keyword 원본 키워드
     * @param research 리서치 결과
     * @param article 아티클
     * @return 커밋된 index.html 경로
     */
    CompletableFuture<Path> saveOutputsAtomic(String keyword, ResearchResult research, ArticleResult article);

    /**
     * 스냅샷에서 실행 재개.
     *
     * <p>중단된 실행의 스냅샷 경로와 스테이징 디렉토리를 넘겨받고
     * 마지막으로 완료된 단계 이후부터 진행합니다.</p>
     *
     * @param snapshotFile 스냅샷 파일
     * @return 커밋된 index.html 경로
     */
    CompletableFuture<Path> resumeWorkflow(Path snapshotFile);

    /**
     * 진행 상황 수신자 설정.
     *
     * @param listener 수신자 (null이면 해제)
     */
    void setProgressCallback(ProgressListener listener);

    WorkflowState currentState();

    WorkflowData workflowData();

    Optional<SessionId> sessionId();

    Optional<Path> snapshotPath();

    Optional<Path> stagingDir();

    /**
     * 미완료 실행의 자원 해제 (best-effort).
     *
     * <p>COMPLETE에 도달하지 못한 경우 이 인스턴스의 스테이징 디렉토리와 스냅샷을 삭제합니다.
     * 실패는 로그와 결과에만 기록되며 예외를 던지지 않습니다. 여러 번 호출해도 안전합니다.
     * 이 인스턴스가 점유한 세션 ID도 함께 해제됩니다.</p>
     *
     * @return 정리 결과 (COMPLETE인 경우 빈 결과)
     */
    CleanupReport releaseIncomplete();
}
