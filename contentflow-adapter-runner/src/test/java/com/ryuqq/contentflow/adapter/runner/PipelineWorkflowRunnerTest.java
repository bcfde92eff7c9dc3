package com.ryuqq.contentflow.adapter.runner;

import com.ryuqq.contentflow.adapter.filesystem.output.AtomicOutputCommitter;
import com.ryuqq.contentflow.adapter.filesystem.output.OutputLayout;
import com.ryuqq.contentflow.adapter.filesystem.snapshot.JsonSnapshotStore;
import com.ryuqq.contentflow.core.cleanup.CleanupReport;
import com.ryuqq.contentflow.core.exception.TransientOperationException;
import com.ryuqq.contentflow.core.exception.WorkflowValidationException;
import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.SessionId;
import com.ryuqq.contentflow.core.publish.ArticlePublisher;
import com.ryuqq.contentflow.core.publish.PublishedDocument;
import com.ryuqq.contentflow.core.publish.noop.NoOpArticlePublisher;
import com.ryuqq.contentflow.core.spi.ResearchOperation;
import com.ryuqq.contentflow.core.spi.WritingOperation;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import static com.ryuqq.contentflow.adapter.runner.RunnerFixtures.article;
import static com.ryuqq.contentflow.adapter.runner.RunnerFixtures.failureOf;
import static com.ryuqq.contentflow.adapter.runner.RunnerFixtures.research;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * PipelineWorkflowRunner 유닛 테스트.
 *
 * <p>실제 파일 시스템 어댑터와 mock 리서치/작성 수행자를 사용합니다.
 * Executor는 호출 스레드에서 바로 실행하도록 설정합니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PipelineWorkflowRunnerTest {

    private static final String KEYWORD = "diabetes management";

    @TempDir
    Path root;

    @Mock
    private ResearchOperation researchOperation;

    @Mock
    private WritingOperation writingOperation;

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);
    private final List<String> progress = new CopyOnWriteArrayList<>();

    private AtomicOutputCommitter committer;
    private PipelineWorkflowRunner runner;

    @BeforeEach
    void setUp() {
        committer = new AtomicOutputCommitter(new OutputLayout(root));
        runner = newRunner(committer, new NoOpArticlePublisher());
        runner.setProgressCallback((phase, message) -> progress.add(phase + ": " + message));
    }

    private PipelineWorkflowRunner newRunner(AtomicOutputCommitter outputCommitter, ArticlePublisher publisher) {
        return new PipelineWorkflowRunner(
            RunnerFixtures.fastConfig(root),
            researchOperation,
            writingOperation,
            new JsonSnapshotStore(),
            outputCommitter,
            publisher,
            Runnable::run,
            clock
        );
    }

    private void givenResearch(ResearchResult result) {
        when(researchOperation.research(any())).thenReturn(CompletableFuture.completedFuture(result));
    }

    private void givenArticle(ArticleResult result) {
        when(writingOperation.write(any(), any())).thenReturn(CompletableFuture.completedFuture(result));
    }

    private List<Path> rootEntries() throws IOException {
        try (Stream<Path> entries = Files.list(root)) {
            return entries.toList();
        }
    }

    // ============================================================
    // 1. 전체 실행
    // ============================================================

    @Test
    void runFullWorkflow_정상_완료시_index_경로_반환_스냅샷_스테이징_없음() throws IOException {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(article(KEYWORD));

        // when
        Path index = runner.runFullWorkflow(KEYWORD).join();

        // then
        assertThat(index).isRegularFile();
        assertThat(index.getFileName().toString()).isEqualTo("index.html");
        assertThat(index.getParent().resolve("article.html")).isRegularFile();
        assertThat(index.getParent().resolve("research.json")).isRegularFile();
        assertThat(index.getParent().getFileName().toString()).startsWith("diabetes_management_20260101_100000");

        assertThat(runner.currentState()).isEqualTo(WorkflowState.COMPLETE);
        assertThat(runner.snapshotPath()).isPresent();
        assertThat(runner.snapshotPath().get()).doesNotExist();
        assertThat(runner.stagingDir()).isEmpty();
        assertThat(rootEntries()).containsExactly(index.getParent());
        assertThat(runner.workflowData().saving().published()).isFalse();
        assertThat(progress).anyMatch(p -> p.startsWith("research:"))
            .anyMatch(p -> p.startsWith("research_complete:"))
            .anyMatch(p -> p.startsWith("writing_complete:"))
            .anyMatch(p -> p.startsWith("complete:"));
    }

    @Test
    void runFullWorkflow_빈_키워드는_I_O_없이_실패() throws IOException {
        // when
        Throwable failure = failureOf(runner.runFullWorkflow(""));

        // then
        assertThat(failure).isInstanceOf(WorkflowValidationException.class)
            .hasMessage("Keyword cannot be empty");
        assertThat(rootEntries()).isEmpty();
        assertThat(runner.currentState()).isEqualTo(WorkflowState.INITIALIZED);
        verifyNoInteractions(researchOperation, writingOperation);
    }

    @Test
    void runFullWorkflow_201자_키워드는_너무_길어서_실패() throws IOException {
        // when
        Throwable failure = failureOf(runner.runFullWorkflow("a".repeat(201)));

        // then
        assertThat(failure).isInstanceOf(WorkflowValidationException.class)
            .hasMessageStartingWith("Keyword too long");
        assertThat(rootEntries()).isEmpty();
    }

    @Test
    void runFullWorkflow_소스가_권장보다_적으면_경고_후_완료() {
        // given
        givenResearch(research(KEYWORD, 1));
        givenArticle(article(KEYWORD));

        // when
        Path index = runner.runFullWorkflow(KEYWORD).join();

        // then
        assertThat(index).isRegularFile();
        assertThat(progress).anyMatch(p -> p.contains("Only 1 sources found"));
        assertThat(runner.workflowData().research().sourcesFound()).isEqualTo(1);
    }

    @Test
    void runFullWorkflow_같은_인스턴스로_두번_실행하면_IllegalStateException() {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(article(KEYWORD));
        runner.runFullWorkflow(KEYWORD).join();

        // when & then
        assertThatThrownBy(() -> runner.runFullWorkflow(KEYWORD))
            .isInstanceOf(IllegalStateException.class);
    }

    // ============================================================
    // 2. 리서치 재시도와 검증
    // ============================================================

    @Test
    void runFullWorkflow_일시적_오류는_재시도_후_성공() {
        // given
        when(researchOperation.research(any())).thenReturn(
            CompletableFuture.failedFuture(new TransientOperationException("503 Service Unavailable")),
            CompletableFuture.completedFuture(research(KEYWORD, 4))
        );
        givenArticle(article(KEYWORD));

        // when
        Path index = runner.runFullWorkflow(KEYWORD).join();

        // then
        assertThat(index).isRegularFile();
        verify(researchOperation, times(2)).research(any());
    }

    @Test
    void runFullWorkflow_재시도_소진시_마지막_오류_전파_롤백() {
        // given
        TransientOperationException timeout = new TransientOperationException("timeout");
        when(researchOperation.research(any())).thenReturn(CompletableFuture.failedFuture(timeout));

        // when
        Throwable failure = failureOf(runner.runFullWorkflow(KEYWORD));

        // then
        assertThat(failure).isSameAs(timeout);
        verify(researchOperation, times(3)).research(any());
        verifyNoInteractions(writingOperation);
        assertThat(runner.currentState()).isEqualTo(WorkflowState.ROLLED_BACK);
        assertThat(runner.snapshotPath().get()).doesNotExist();
    }

    @Test
    void runFullWorkflow_사용가능한_소스가_없으면_재시도없이_실패() {
        // given
        givenResearch(research(KEYWORD, 0));

        // when
        Throwable failure = failureOf(runner.runFullWorkflow(KEYWORD));

        // then
        assertThat(failure).isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("No usable sources");
        verify(researchOperation, times(1)).research(any());
        assertThat(runner.currentState()).isEqualTo(WorkflowState.ROLLED_BACK);
        assertThat(runner.workflowData().error()).contains("No usable sources");
    }

    @Test
    void runFullWorkflow_리서치가_동기_예외를_던져도_future_실패로_전파() {
        // given
        IllegalStateException boom = new IllegalStateException("agent misconfigured");
        when(researchOperation.research(any())).thenThrow(boom);

        // when
        Throwable failure = failureOf(runner.runFullWorkflow(KEYWORD));

        // then
        assertThat(failure).isSameAs(boom);
        verify(researchOperation, times(1)).research(any());
    }

    // ============================================================
    // 3. 작성 검증
    // ============================================================

    @Test
    void runFullWorkflow_인용이_없는_아티클은_검증_실패() throws IOException {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(RunnerFixtures.uncitedArticle(KEYWORD));

        // when
        Throwable failure = failureOf(runner.runFullWorkflow(KEYWORD));

        // then
        assertThat(failure).isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("does not cite any sources");
        assertThat(runner.currentState()).isEqualTo(WorkflowState.ROLLED_BACK);
        assertThat(rootEntries()).isEmpty();
        assertThat(progress).anyMatch(p -> p.startsWith("failed:"));
    }

    // ============================================================
    // 4. 커밋 실패, 게시
    // ============================================================

    @Test
    void runFullWorkflow_커밋_실패시_IOException_그대로_전파_스테이징_유지() throws IOException {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(article(KEYWORD));
        AtomicOutputCommitter failingCommitter = spy(committer);
        IOException diskFull = new IOException("disk full");
        doThrow(diskFull).when(failingCommitter).commit(any(), any());
        PipelineWorkflowRunner failingRunner = newRunner(failingCommitter, new NoOpArticlePublisher());
        failingRunner.setProgressCallback((phase, message) -> progress.add(phase + ": " + message));

        // when
        Throwable failure = failureOf(failingRunner.runFullWorkflow(KEYWORD));

        // then
        assertThat(failure).isSameAs(diskFull);
        assertThat(failingRunner.currentState()).isEqualTo(WorkflowState.ROLLED_BACK);
        assertThat(failingRunner.workflowData().error()).isEqualTo("disk full");
        assertThat(progress).contains("failed: disk full");
        assertThat(failingRunner.snapshotPath().get()).doesNotExist();
        assertThat(failingRunner.stagingDir()).isPresent();
        assertThat(failingRunner.stagingDir().get()).isDirectory();
        assertThat(failingRunner.stagingDir().get().resolve("index.html")).isRegularFile();
        assertThat(committer.finalDirectoryFor(failingRunner.sessionId().get())).doesNotExist();
    }

    @Test
    void runFullWorkflow_게시_실패는_실행을_실패시키지_않음() throws IOException {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(article(KEYWORD));
        ArticlePublisher publisher = (html, article) -> {
            throw new IOException("quota exceeded");
        };
        PipelineWorkflowRunner publishingRunner = newRunner(committer, publisher);

        // when
        Path index = publishingRunner.runFullWorkflow(KEYWORD).join();

        // then
        assertThat(index).isRegularFile();
        assertThat(publishingRunner.currentState()).isEqualTo(WorkflowState.COMPLETE);
        assertThat(publishingRunner.workflowData().saving().published()).isFalse();
    }

    @Test
    void runFullWorkflow_게시_성공시_문서_링크_기록() {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(article(KEYWORD));
        ArticlePublisher publisher = (html, article) ->
            Optional.of(new PublishedDocument("doc-1", "https://docs.example/doc-1"));
        PipelineWorkflowRunner publishingRunner = newRunner(committer, publisher);

        // when
        publishingRunner.runFullWorkflow(KEYWORD).join();

        // then
        assertThat(publishingRunner.workflowData().saving().published()).isTrue();
        assertThat(publishingRunner.workflowData().saving().documentLink()).isEqualTo("https://docs.example/doc-1");
    }

    // ============================================================
    // 5. 단계별 호출
    // ============================================================

    @Test
    void 단계별_호출_research_writing_saveOutputsAtomic_순서로_완료() {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(article(KEYWORD));

        // when
        ResearchResult researched = runner.runResearch(KEYWORD).join();
        assertThat(runner.currentState()).isEqualTo(WorkflowState.RESEARCH_COMPLETE);
        assertThat(runner.snapshotPath().get()).isRegularFile();

        ArticleResult written = runner.runWriting(KEYWORD, researched).join();
        assertThat(runner.currentState()).isEqualTo(WorkflowState.WRITING_COMPLETE);

        Path index = runner.saveOutputsAtomic(KEYWORD, researched, written).join();

        // then
        assertThat(index).isRegularFile();
        assertThat(runner.currentState()).isEqualTo(WorkflowState.COMPLETE);
        assertThat(runner.snapshotPath().get()).doesNotExist();
    }

    @Test
    void runWriting_리서치_전에_호출하면_IllegalStateException_부작용_없음() throws IOException {
        // when
        Throwable failure = failureOf(runner.runWriting(KEYWORD, research(KEYWORD, 4)));

        // then
        assertThat(failure).isInstanceOf(IllegalStateException.class);
        assertThat(runner.currentState()).isEqualTo(WorkflowState.INITIALIZED);
        assertThat(rootEntries()).isEmpty();
        verifyNoInteractions(writingOperation);
    }

    @Test
    void saveOutputs_상태_전이_없이_최종_디렉토리에_직접_기록() throws IOException {
        // when
        Path index = runner.saveOutputs(KEYWORD, research(KEYWORD, 4), article(KEYWORD)).join();

        // then
        assertThat(index).isRegularFile();
        assertThat(index.getParent().resolve("article.html")).isRegularFile();
        assertThat(runner.currentState()).isEqualTo(WorkflowState.INITIALIZED);
        assertThat(rootEntries()).containsExactly(index.getParent());
    }

    // ============================================================
    // 6. 취소, 자원 해제
    // ============================================================

    @Test
    void 취소하면_자원을_해제하고_다음_단계로_넘어가지_않음() throws IOException {
        // given
        CompletableFuture<ResearchResult> pending = new CompletableFuture<>();
        when(researchOperation.research(any())).thenReturn(pending);
        CompletableFuture<Path> run = runner.runFullWorkflow(KEYWORD);
        Path snapshot = runner.snapshotPath().orElseThrow();
        assertThat(snapshot).isRegularFile();

        // when
        boolean cancelled = run.cancel(true);

        // then
        assertThat(cancelled).isTrue();
        assertThat(run).isCancelled();
        assertThat(snapshot).doesNotExist();

        // 리서치가 뒤늦게 끝나도 작성 단계는 시작하지 않음
        pending.complete(research(KEYWORD, 4));
        verify(writingOperation, never()).write(any(), any());
        assertThat(runner.currentState()).isEqualTo(WorkflowState.ROLLED_BACK);
        assertThat(rootEntries()).isEmpty();
    }

    @Test
    void releaseIncomplete_미완료_실행의_스냅샷_삭제() {
        // given
        givenResearch(research(KEYWORD, 4));
        runner.runResearch(KEYWORD).join();
        Path snapshot = runner.snapshotPath().orElseThrow();
        SessionId session = runner.sessionId().orElseThrow();
        assertThat(PipelineWorkflowRunner.isSessionClaimed(session)).isTrue();

        // when
        CleanupReport report = runner.releaseIncomplete();

        // then
        assertThat(report.snapshotsRemoved()).isEqualTo(1);
        assertThat(report.hasFailures()).isFalse();
        assertThat(snapshot).doesNotExist();
        assertThat(PipelineWorkflowRunner.isSessionClaimed(session)).isFalse();
        assertThat(runner.releaseIncomplete().totalRemoved()).isZero();
    }

    @Test
    void runResearch_실패하면_롤백과_함께_세션_점유도_해제() {
        // given
        when(researchOperation.research(any()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("search backend down")));

        // when
        Throwable failure = failureOf(runner.runResearch(KEYWORD));

        // then
        assertThat(failure).hasMessage("search backend down");
        assertThat(runner.currentState()).isEqualTo(WorkflowState.ROLLED_BACK);
        assertThat(PipelineWorkflowRunner.isSessionClaimed(runner.sessionId().orElseThrow())).isFalse();
    }

    @Test
    void releaseIncomplete_완료된_실행은_정리할_것이_없음() {
        // given
        givenResearch(research(KEYWORD, 4));
        givenArticle(article(KEYWORD));
        Path index = runner.runFullWorkflow(KEYWORD).join();

        // when
        CleanupReport report = runner.releaseIncomplete();

        // then
        assertThat(report).isEqualTo(CleanupReport.empty());
        assertThat(index).isRegularFile();
    }

    // ============================================================
    // 7. 고아 파일 정리
    // ============================================================

    @Test
    void cleanupOrphanedFiles_기준보다_오래된_항목만_삭제() throws IOException {
        // given
        Path oldSnapshot = Files.writeString(root.resolve(".workflow_state_old_20250101_000000_000.json"), "{}");
        Path freshSnapshot = Files.writeString(root.resolve(".workflow_state_new_20260101_000000_000.json"), "{}");
        Path oldStaging = Files.createDirectory(root.resolve(".temp_old_20250101_000000_000"));
        FileTime twoDaysAgo = FileTime.from(Instant.now().minus(Duration.ofHours(48)));
        Files.setLastModifiedTime(oldSnapshot, twoDaysAgo);
        Files.setLastModifiedTime(oldStaging, twoDaysAgo);

        // when
        CleanupReport report = PipelineWorkflowRunner.cleanupOrphanedFiles(root, 24);

        // then
        assertThat(report.snapshotsRemoved()).isEqualTo(1);
        assertThat(report.directoriesRemoved()).isEqualTo(1);
        assertThat(oldSnapshot).doesNotExist();
        assertThat(oldStaging).doesNotExist();
        assertThat(freshSnapshot).exists();
    }

    @Test
    void cleanupOrphanedFiles_출력_루트가_없으면_빈_결과() {
        // when
        CleanupReport report = PipelineWorkflowRunner.cleanupOrphanedFiles(root.resolve("missing"), 1);

        // then
        assertThat(report.totalRemoved()).isZero();
    }

    // ============================================================
    // 8. 생성자 검증
    // ============================================================

    @Test
    void 생성자_null_의존성은_IllegalArgumentException() {
        assertThatThrownBy(() -> new PipelineWorkflowRunner(null, researchOperation, writingOperation))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> new PipelineWorkflowRunner(new WorkflowRunnerConfig(), null, writingOperation))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("researchOperation cannot be null");
    }
}
