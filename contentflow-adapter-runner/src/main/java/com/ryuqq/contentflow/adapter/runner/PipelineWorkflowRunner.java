package com.ryuqq.contentflow.adapter.runner;

import com.ryuqq.contentflow.adapter.filesystem.orphan.OrphanCollector;
import com.ryuqq.contentflow.adapter.filesystem.orphan.OrphanCollectorConfig;
import com.ryuqq.contentflow.adapter.filesystem.output.AtomicOutputCommitter;
import com.ryuqq.contentflow.adapter.filesystem.output.OutputLayout;
import com.ryuqq.contentflow.adapter.filesystem.snapshot.JsonSnapshotStore;
import com.ryuqq.contentflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.contentflow.application.progress.ProgressPhase;
import com.ryuqq.contentflow.application.progress.ProgressReporter;
import com.ryuqq.contentflow.core.cleanup.CleanupReport;
import com.ryuqq.contentflow.core.exception.WorkflowValidationException;
import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.SessionId;
import com.ryuqq.contentflow.core.publish.ArticlePublisher;
import com.ryuqq.contentflow.core.publish.PublishedDocument;
import com.ryuqq.contentflow.core.publish.noop.NoOpArticlePublisher;
import com.ryuqq.contentflow.core.retry.GiveUp;
import com.ryuqq.contentflow.core.retry.Retry;
import com.ryuqq.contentflow.core.retry.RetryDecision;
import com.ryuqq.contentflow.core.retry.RetryPolicy;
import com.ryuqq.contentflow.core.snapshot.PersistenceResult;
import com.ryuqq.contentflow.core.snapshot.ResearchPhaseData;
import com.ryuqq.contentflow.core.snapshot.SavingPhaseData;
import com.ryuqq.contentflow.core.snapshot.SnapshotLoad;
import com.ryuqq.contentflow.core.snapshot.WorkflowData;
import com.ryuqq.contentflow.core.snapshot.WorkflowSnapshot;
import com.ryuqq.contentflow.core.snapshot.WritingPhaseData;
import com.ryuqq.contentflow.core.spi.OutputCommitter;
import com.ryuqq.contentflow.core.spi.ProgressListener;
import com.ryuqq.contentflow.core.spi.ResearchOperation;
import com.ryuqq.contentflow.core.spi.SnapshotStore;
import com.ryuqq.contentflow.core.spi.WritingOperation;
import com.ryuqq.contentflow.core.statemachine.StateTransition;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 리서치 → 작성 → 저장 파이프라인 실행기.
 *
 * <p>{@link WorkflowOrchestrator}의 기본 구현입니다. 각 단계는 {@link CompletableFuture}로
 * 연결되어 순차 실행되며, 파일 I/O와 단계 후처리는 설정된 {@link Executor}에서 수행됩니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. 키워드 검증 (실패 시 I/O 없이 즉시 실패)
 * 2. 세션 ID 할당, 스냅샷 기록 (INITIALIZED)
 * 3. 리서치 (RESEARCHING → RESEARCH_COMPLETE), 일시적 오류는 지연 후 재시도
 * 4. 작성 (WRITING → WRITING_COMPLETE), 한 번만 호출
 * 5. 저장 (SAVING → COMPLETE): 스테이징 → 산출물 기록 → rename 커밋 → 스냅샷 삭제 → 게시
 * </pre>
 *
 * <p><strong>실패 처리:</strong> 복구되지 않은 오류는 FAILED(오류 기록) → 롤백 → ROLLED_BACK
 * 순으로 처리되고, 반환된 future는 원래 예외로 실패합니다. 커밋 실패 시 스테이징 디렉토리는
 * 조사용으로 남깁니다.</p>
 *
 * <p><strong>세션 점유:</strong> 세션 ID는 실행이 COMPLETE, ROLLED_BACK에 도달하거나
 * {@link #releaseIncomplete()}가 호출될 때 해제됩니다. {@code runResearch}, {@code runWriting}을
 * 단계별로 호출하다 멈추는 호출자는 {@code WorkflowScope}로 감싸거나 직접 {@code releaseIncomplete()}를
 * 호출해야 합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 인스턴스 하나는 실행 하나를 담당합니다.
 * 상태 변경은 내부 lock으로 직렬화되며, 서로 다른 인스턴스는 가변 상태를 공유하지 않습니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class PipelineWorkflowRunner implements WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineWorkflowRunner.class);

    private static final int MAX_SESSION_PROBES = 1000;

    // 같은 프로세스 안에서 진행 중인 세션 ID (동일 밀리초 충돌 방지)
    private static final Set<SessionId> ACTIVE_SESSIONS = ConcurrentHashMap.newKeySet();

    private final WorkflowRunnerConfig config;
    private final ResearchOperation researchOperation;
    private final WritingOperation writingOperation;
    private final SnapshotStore snapshotStore;
    private final OutputCommitter outputCommitter;
    private final ArticlePublisher publisher;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final Clock clock;
    private final OutputLayout layout;
    private final ProgressReporter progress = new ProgressReporter();

    private final Object lock = new Object();
    private final AtomicBoolean runClaimed = new AtomicBoolean(false);

    private volatile WorkflowState state = WorkflowState.INITIALIZED;
    private volatile WorkflowData data = WorkflowData.initial(null);
    private volatile Keyword keyword;
    private volatile SessionId sessionId;
    private volatile Path snapshotPath;
    private volatile Path stagingDir;
    private volatile boolean commitFailed;
    private volatile boolean cancelled;

    /**
     * 기본 어댑터(JSON 스냅샷, 원자적 커밋, 게시 없음)와 공용 ForkJoinPool을 사용하는 생성자.
     *
     * @param config 설정
     * @param researchOperation 리서치 수행자
     * @param writingOperation 작성 수행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineWorkflowRunner(
        WorkflowRunnerConfig config,
        ResearchOperation researchOperation,
        WritingOperation writingOperation
    ) {
        this(
            config,
            researchOperation,
            writingOperation,
            new JsonSnapshotStore(),
            new AtomicOutputCommitter(new OutputLayout(requireConfig(config).outputRoot())),
            new NoOpArticlePublisher(),
            ForkJoinPool.commonPool(),
            Clock.systemDefaultZone()
        );
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param researchOperation 리서치 수행자
     * @param writingOperation 작성 수행자
     * @param snapshotStore 스냅샷 저장소
     * @param outputCommitter 산출물 커밋 수행자
     * @param publisher 게시 대상
     * @param executor I/O와 단계 후처리를 실행할 Executor
     * @param clock 세션 ID와 단계 시각의 기준 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineWorkflowRunner(
        WorkflowRunnerConfig config,
        ResearchOperation researchOperation,
        WritingOperation writingOperation,
        SnapshotStore snapshotStore,
        OutputCommitter outputCommitter,
        ArticlePublisher publisher,
        Executor executor,
        Clock clock
    ) {
        requireConfig(config);
        if (researchOperation == null) {
            throw new IllegalArgumentException("researchOperation cannot be null");
        }
        if (writingOperation == null) {
            throw new IllegalArgumentException("writingOperation cannot be null");
        }
        if (snapshotStore == null) {
            throw new IllegalArgumentException("snapshotStore cannot be null");
        }
        if (outputCommitter == null) {
            throw new IllegalArgumentException("outputCommitter cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.researchOperation = researchOperation;
        this.writingOperation = writingOperation;
        this.snapshotStore = snapshotStore;
        this.outputCommitter = outputCommitter;
        this.publisher = publisher;
        this.retryPolicy = config.retryPolicy();
        this.executor = executor;
        this.clock = clock;
        this.layout = new OutputLayout(config.outputRoot());
    }

    /**
     * 출력 루트에서 오래된 스냅샷과 스테이징 디렉토리 정리.
     *
     * <p>삭제 실패는 로그와 결과에만 기록되며 예외를 던지지 않습니다.</p>
     *
     * @param outputRoot 출력 루트
     * @param olderThanHours 이 시간보다 오래된 항목만 삭제
     * @return 정리 결과
     * @throws IllegalArgumentException olderThanHours가 음수인 경우
     */
    public static CleanupReport cleanupOrphanedFiles(Path outputRoot, long olderThanHours) {
        return new OrphanCollector(OrphanCollectorConfig.olderThanHours(olderThanHours)).sweep(outputRoot);
    }

    @Override
    public CompletableFuture<Path> runFullWorkflow(String rawKeyword) {
        Keyword validated;
        try {
            validated = Keyword.of(rawKeyword);
        } catch (WorkflowValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        claimRun();

        log.info("Starting full workflow for keyword: {}", validated.getValue());
        RunFuture<Path> result = new RunFuture<>(this::requestCancellation);

        CompletableFuture
            .supplyAsync(() -> {
                openSession(validated);
                log.info("Step 1/3: Running research phase...");
                return validated;
            }, executor)
            .thenCompose(this::researchPhase)
            .thenCompose(research -> {
                log.info("Step 2/3: Generating article...");
                return writingPhase(validated, research)
                    .thenCompose(article -> {
                        log.info("Step 3/3: Saving outputs...");
                        return savePhase(validated, research, article);
                    });
            })
            .whenComplete((index, error) -> finish(result, index, error));

        return result;
    }

    @Override
    public CompletableFuture<ResearchResult> runResearch(String rawKeyword) {
        Keyword validated;
        try {
            validated = Keyword.of(rawKeyword);
            checkPreconditions(validated, WorkflowState.RESEARCHING);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return failingOver(
            CompletableFuture
                .supplyAsync(() -> {
                    openSession(validated);
                    return validated;
                }, executor)
                .thenCompose(this::researchPhase)
        );
    }

    @Override
    public CompletableFuture<ArticleResult> runWriting(String rawKeyword, ResearchResult research) {
        Keyword validated;
        try {
            validated = Keyword.of(rawKeyword);
            if (research == null) {
                throw new IllegalArgumentException("research cannot be null");
            }
            checkPreconditions(validated, WorkflowState.WRITING);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return failingOver(writingPhase(validated, research));
    }

    @Override
    public CompletableFuture<Path> saveOutputs(String rawKeyword, ResearchResult research, ArticleResult article) {
        Keyword validated;
        try {
            validated = Keyword.of(rawKeyword);
            requirePayloads(research, article);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(() -> {
            SessionId target = validated.equals(keyword) && sessionId != null
                ? sessionId
                : SessionId.of(validated, LocalDateTime.now(clock));
            try {
                Path directory = outputCommitter.writeDirect(target, validated, article, research);
                log.info("Outputs saved to {}", directory);
                return directory.resolve(OutputLayout.INDEX_FILE);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor).handle(PipelineWorkflowRunner::unwrapped).thenCompose(Function.identity());
    }

    @Override
    public CompletableFuture<Path> saveOutputsAtomic(String rawKeyword, ResearchResult research, ArticleResult article) {
        Keyword validated;
        try {
            validated = Keyword.of(rawKeyword);
            requirePayloads(research, article);
            checkPreconditions(validated, WorkflowState.SAVING);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return failingOver(savePhase(validated, research, article));
    }

    @Override
    public CompletableFuture<Path> resumeWorkflow(Path snapshotFile) {
        if (snapshotFile == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("snapshotFile cannot be null"));
        }
        claimRun();

        log.info("Resuming workflow from snapshot: {}", snapshotFile);
        RunFuture<Path> result = new RunFuture<>(this::requestCancellation);

        CompletableFuture
            .supplyAsync(() -> loadResumable(snapshotFile), executor)
            .thenCompose(this::resumeFrom)
            .whenComplete((index, error) -> finish(result, index, error));

        return result;
    }

    @Override
    public void setProgressCallback(ProgressListener listener) {
        progress.setListener(listener);
    }

    @Override
    public WorkflowState currentState() {
        return state;
    }

    @Override
    public WorkflowData workflowData() {
        return data;
    }

    @Override
    public Optional<SessionId> sessionId() {
        return Optional.ofNullable(sessionId);
    }

    @Override
    public Optional<Path> snapshotPath() {
        return Optional.ofNullable(snapshotPath);
    }

    @Override
    public Optional<Path> stagingDir() {
        return Optional.ofNullable(stagingDir);
    }

    @Override
    public CleanupReport releaseIncomplete() {
        synchronized (lock) {
            if (state == WorkflowState.COMPLETE) {
                return CleanupReport.empty();
            }

            int snapshotsRemoved = 0;
            int directoriesRemoved = 0;
            List<Path> failures = new ArrayList<>();

            Path staging = stagingDir;
            if (staging != null && Files.exists(staging)) {
                if (outputCommitter.discard(staging)) {
                    directoriesRemoved++;
                    stagingDir = null;
                } else {
                    failures.add(staging);
                }
            }

            Path snapshot = snapshotPath;
            if (snapshot != null && Files.exists(snapshot)) {
                if (snapshotStore.delete(snapshot).isDegraded()) {
                    failures.add(snapshot);
                } else {
                    snapshotsRemoved++;
                }
            }

            releaseSessionClaim();
            CleanupReport report = new CleanupReport(snapshotsRemoved, directoriesRemoved, failures);
            if (report.totalRemoved() > 0) {
                log.info("Released incomplete run in state {}: {} snapshot(s), {} staging director(ies)",
                    state, snapshotsRemoved, directoriesRemoved);
            }
            return report;
        }
    }

    // ======== 단계 ========

    private CompletableFuture<ResearchResult> researchPhase(Keyword kw) {
        return CompletableFuture
            .supplyAsync(() -> {
                checkCancelled();
                progress.report(ProgressPhase.RESEARCH, "Researching '" + kw.getValue() + "'");
                synchronized (lock) {
                    moveTo(WorkflowState.RESEARCHING, data.withResearch(ResearchPhaseData.started(clock.instant())));
                }
                return kw;
            }, executor)
            .thenCompose(k -> attemptResearch(k, 1))
            .thenApplyAsync(result -> completeResearch(kw, result), executor);
    }

    private CompletableFuture<ResearchResult> attemptResearch(Keyword kw, int attempt) {
        return invoke(() -> researchOperation.research(kw))
            .<CompletableFuture<ResearchResult>>handle((result, error) -> {
                if (error == null) {
                    return CompletableFuture.completedFuture(result);
                }
                RetryDecision decision = retryPolicy.decide(attempt, error);
                if (decision instanceof Retry retry) {
                    log.warn("Research retry {} after {}ms: {}", attempt, retry.nextRetryAfterMillis(), retry.reason());
                    Executor delayed = CompletableFuture.delayedExecutor(
                        retry.nextRetryAfterMillis(), TimeUnit.MILLISECONDS, executor);
                    return CompletableFuture
                        .supplyAsync(() -> {
                            checkCancelled();
                            return kw;
                        }, delayed)
                        .thenCompose(k -> attemptResearch(k, retry.nextAttempt()));
                }
                GiveUp giveUp = (GiveUp) decision;
                if (giveUp.exhausted()) {
                    log.warn("Research giving up: {}", giveUp.reason());
                }
                return CompletableFuture.failedFuture(RetryPolicy.unwrap(error));
            })
            .thenCompose(Function.identity());
    }

    private ResearchResult completeResearch(Keyword kw, ResearchResult result) {
        checkCancelled();
        if (result == null || !result.hasUsableSources()) {
            throw new WorkflowValidationException(
                "No usable sources found in research results for keyword: " + kw.getValue()
            );
        }
        int usable = result.usableSources().size();
        if (usable < config.minRecommendedSources()) {
            log.warn("Only found {} sources, which is below the recommended minimum of {}",
                usable, config.minRecommendedSources());
            progress.report(ProgressPhase.RESEARCH,
                "Only " + usable + " sources found (recommended minimum: " + config.minRecommendedSources() + ")");
        }

        synchronized (lock) {
            moveTo(WorkflowState.RESEARCH_COMPLETE,
                data.withResearch(researchData().complete(clock.instant(), result)));
        }
        log.info("Research completed successfully: {} sources, {} findings, {} statistics",
            usable, result.findings().size(), result.statistics().size());
        progress.report(ProgressPhase.RESEARCH_COMPLETE, "Found " + usable + " sources");
        return result;
    }

    private CompletableFuture<ArticleResult> writingPhase(Keyword kw, ResearchResult research) {
        return CompletableFuture
            .supplyAsync(() -> {
                checkCancelled();
                progress.report(ProgressPhase.WRITING, "Writing article for '" + kw.getValue() + "'");
                synchronized (lock) {
                    moveTo(WorkflowState.WRITING, data.withWriting(WritingPhaseData.started(clock.instant())));
                }
                return kw;
            }, executor)
            .thenCompose(k -> invoke(() -> writingOperation.write(k, research)))
            .thenApplyAsync(this::completeWriting, executor);
    }

    private CompletableFuture<ArticleResult> reuseArticle(ArticleResult article) {
        return CompletableFuture.supplyAsync(() -> {
            checkCancelled();
            log.info("Reusing article from snapshot: '{}'", article.title());
            synchronized (lock) {
                moveTo(WorkflowState.WRITING, data.withWriting(WritingPhaseData.started(clock.instant())));
            }
            return completeWriting(article);
        }, executor);
    }

    private ArticleResult completeWriting(ArticleResult article) {
        if (article == null || !article.citesSources()) {
            throw new WorkflowValidationException("Generated article does not cite any sources");
        }
        synchronized (lock) {
            moveTo(WorkflowState.WRITING_COMPLETE,
                data.withWriting(writingData().complete(clock.instant(), article)));
        }
        log.info("Article generated successfully: '{}' ({} words, {} min read, {} sources cited)",
            article.title(), article.wordCount(), article.readingTimeMinutes(), article.sourcesUsed().size());
        progress.report(ProgressPhase.WRITING_COMPLETE, "Article written: " + article.wordCount() + " words");
        return article;
    }

    private CompletableFuture<Path> savePhase(Keyword kw, ResearchResult research, ArticleResult article) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return commitOutputs(kw, research, article);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    private Path commitOutputs(Keyword kw, ResearchResult research, ArticleResult article) throws IOException {
        checkCancelled();
        progress.report(ProgressPhase.SAVING, "Saving outputs");
        synchronized (lock) {
            moveTo(WorkflowState.SAVING, data.withSaving(SavingPhaseData.started(clock.instant())));
        }

        Path staging = outputCommitter.stage(sessionId);
        synchronized (lock) {
            stagingDir = staging;
            persist();
        }
        outputCommitter.writeArtifacts(staging, kw, article, research);
        checkCancelled();

        Path finalDir = outputCommitter.finalDirectoryFor(sessionId);
        try {
            outputCommitter.commit(staging, finalDir);
        } catch (IOException e) {
            commitFailed = true;
            throw e;
        }

        Path index = finalDir.resolve(OutputLayout.INDEX_FILE);
        synchronized (lock) {
            stagingDir = null;
            moveTo(WorkflowState.COMPLETE, data.withSaving(savingData().committed(clock.instant(), index.toString())));
        }
        deleteSnapshot();
        publish(finalDir.resolve(OutputLayout.ARTICLE_FILE), article);
        progress.report(ProgressPhase.COMPLETE, "Outputs saved to " + finalDir);
        return index;
    }

    private void publish(Path articleHtml, ArticleResult article) {
        boolean published = false;
        String link = null;
        try {
            Optional<PublishedDocument> document = publisher.publish(articleHtml, article);
            if (document.isPresent()) {
                published = true;
                link = document.get().webLink();
                log.info("Article published: {} ({})", document.get().documentId(), link);
            } else {
                log.warn("Article was not published: {}", articleHtml);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to publish article {}: {}", articleHtml, e.getMessage(), e);
        }
        synchronized (lock) {
            data = data.withSaving(savingData().withPublication(published, link));
        }
    }

    // ======== 재개 ========

    private Resumable loadResumable(Path snapshotFile) {
        SnapshotLoad load = snapshotStore.load(snapshotFile);
        if (load instanceof SnapshotLoad.Missing) {
            throw new WorkflowValidationException(
                "Failed to load workflow state: snapshot file not found: " + snapshotFile);
        }
        if (load instanceof SnapshotLoad.Unreadable unreadable) {
            throw new WorkflowValidationException("Failed to load workflow state: " + unreadable.reason());
        }
        if (load instanceof SnapshotLoad.UnrecognizedState unrecognized) {
            throw new WorkflowValidationException("Unrecognized workflow state: " + unrecognized.rawState());
        }

        WorkflowSnapshot snapshot = ((SnapshotLoad.Loaded) load).snapshot();
        String rawKeyword = snapshot.data().keyword();
        if (rawKeyword == null || rawKeyword.isBlank()) {
            throw new WorkflowValidationException("No keyword found in workflow state");
        }
        WorkflowState interrupted = snapshot.state();
        if (interrupted.isTerminal() || interrupted == WorkflowState.FAILED) {
            throw new WorkflowValidationException(
                "Workflow in state '" + interrupted.wireValue() + "' cannot be resumed");
        }
        return new Resumable(snapshotFile, Keyword.of(rawKeyword), snapshot);
    }

    private CompletableFuture<Path> resumeFrom(Resumable resumable) {
        adopt(resumable);
        Keyword kw = resumable.keyword();
        WorkflowState interrupted = resumable.snapshot().state();

        boolean researchDone = interrupted != WorkflowState.INITIALIZED && interrupted != WorkflowState.RESEARCHING;
        boolean writingDone = interrupted == WorkflowState.WRITING_COMPLETE || interrupted == WorkflowState.SAVING;
        Optional<ResearchResult> research = researchDone ? data.embeddedResearch() : Optional.empty();
        Optional<ArticleResult> article = writingDone ? data.embeddedArticle() : Optional.empty();

        discardLeftoverStaging();

        Path committed = outputCommitter.finalDirectoryFor(sessionId);
        if (Files.exists(committed, LinkOption.NOFOLLOW_LINKS)) {
            if (interrupted == WorkflowState.SAVING && OutputLayout.isCompleteOutput(committed)) {
                return CompletableFuture.supplyAsync(() -> completeCommitted(committed, article), executor);
            }
            reassignSession(kw, committed);
        }

        if (research.isPresent() && article.isPresent()) {
            rewindTo(WorkflowState.WRITING_COMPLETE);
            log.info("Resuming '{}' at saving phase with research and article from snapshot", kw.getValue());
            return savePhase(kw, research.get(), article.get());
        }

        rewindTo(research.isPresent() ? WorkflowState.RESEARCH_COMPLETE : WorkflowState.INITIALIZED);
        CompletableFuture<ResearchResult> researchStep;
        if (research.isPresent()) {
            log.info("Resuming '{}' at writing phase with research from snapshot", kw.getValue());
            progress.report(ProgressPhase.RESEARCH_COMPLETE, "Reusing research from snapshot");
            researchStep = CompletableFuture.completedFuture(research.get());
        } else {
            log.info("Resuming '{}' from research phase", kw.getValue());
            researchStep = researchPhase(kw);
        }

        return researchStep.thenCompose(result -> article
            .map(this::reuseArticle)
            .orElseGet(() -> writingPhase(kw, result))
            .thenCompose(written -> savePhase(kw, result, written)));
    }

    // 커밋 rename 직후, 스냅샷 삭제 전에 중단된 실행
    private Path completeCommitted(Path finalDir, Optional<ArticleResult> article) {
        checkCancelled();
        Path index = finalDir.resolve(OutputLayout.INDEX_FILE);
        log.info("Outputs were already committed before the interruption: {}", finalDir);
        synchronized (lock) {
            moveTo(WorkflowState.COMPLETE, data.withSaving(savingData().committed(clock.instant(), index.toString())));
        }
        deleteSnapshot();
        article.ifPresent(written -> publish(finalDir.resolve(OutputLayout.ARTICLE_FILE), written));
        progress.report(ProgressPhase.COMPLETE, "Outputs saved to " + finalDir);
        return index;
    }

    private void reassignSession(Keyword kw, Path occupied) {
        SessionId fresh;
        synchronized (lock) {
            SessionId previous = sessionId;
            fresh = allocateSessionId(kw);
            ACTIVE_SESSIONS.remove(previous);
            sessionId = fresh;
        }
        log.warn("Final directory {} already exists; committing under new session {}", occupied, fresh.getValue());
    }

    private void adopt(Resumable resumable) {
        WorkflowSnapshot snapshot = resumable.snapshot();
        synchronized (lock) {
            SessionId adopted = OutputLayout.sessionIdFromSnapshot(resumable.snapshotFile())
                .orElseGet(() -> SessionId.of(resumable.keyword(), LocalDateTime.now(clock)));
            ACTIVE_SESSIONS.add(adopted);
            keyword = resumable.keyword();
            sessionId = adopted;
            snapshotPath = resumable.snapshotFile();
            stagingDir = acceptedStagingDir(snapshot.stagingDir());
            data = snapshot.data().markResumed();
            state = snapshot.state();
        }
        log.info("Adopted session {} in state {}", sessionId.getValue(), state);
    }

    // 스냅샷에 기록된 temp_dir은 출력 루트 바로 아래의 .temp_* 디렉토리일 때만 받아들임
    private Path acceptedStagingDir(Path recorded) {
        if (recorded == null) {
            return null;
        }
        Path root = config.outputRoot().toAbsolutePath().normalize();
        Path candidate = recorded.toAbsolutePath().normalize();
        boolean underRoot = root.equals(candidate.getParent());
        if (underRoot && !Files.isSymbolicLink(candidate) && OutputLayout.isStagingDirectory(candidate)) {
            return candidate;
        }
        if (underRoot && Files.notExists(candidate, LinkOption.NOFOLLOW_LINKS)) {
            return null;
        }
        log.warn("Ignoring staging directory recorded in snapshot (not a staging directory under {}): {}",
            root, recorded);
        return null;
    }

    private void discardLeftoverStaging() {
        Path leftover = stagingDir;
        if (leftover == null) {
            return;
        }
        if (outputCommitter.discard(leftover)) {
            log.info("Discarded leftover staging directory: {}", leftover);
            stagingDir = null;
        }
    }

    // 재개 시 스냅샷 상태를 그대로 받아들이는 단계 (전이 검증 대상 아님)
    private void rewindTo(WorkflowState target) {
        synchronized (lock) {
            state = target;
            persist();
        }
    }

    // ======== 상태, 스냅샷 ========

    private void openSession(Keyword kw) {
        synchronized (lock) {
            if (sessionId != null) {
                if (!kw.equals(keyword)) {
                    throw new IllegalStateException(
                        "Orchestrator is bound to keyword '" + keyword.getValue() + "', got '" + kw.getValue() + "'");
                }
                return;
            }
            SessionId allocated = allocateSessionId(kw);
            keyword = kw;
            sessionId = allocated;
            snapshotPath = layout.snapshotPathFor(allocated);
            data = WorkflowData.initial(kw.getValue());
            persist();
            log.info("Workflow session opened: {}", allocated.getValue());
        }
    }

    private SessionId allocateSessionId(Keyword kw) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        for (int i = 0; i < MAX_SESSION_PROBES; i++) {
            SessionId candidate = SessionId.of(kw, startedAt.plus(i, ChronoUnit.MILLIS));
            if (Files.notExists(layout.snapshotPathFor(candidate))
                && Files.notExists(layout.finalDirectoryFor(candidate))
                && ACTIVE_SESSIONS.add(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique session id for keyword: " + kw.getValue());
    }

    static boolean isSessionClaimed(SessionId candidate) {
        return ACTIVE_SESSIONS.contains(candidate);
    }

    private void releaseSessionClaim() {
        SessionId current = sessionId;
        if (current != null) {
            ACTIVE_SESSIONS.remove(current);
        }
    }

    // lock 보유 상태에서 호출
    private void moveTo(WorkflowState next, WorkflowData nextData) {
        state = StateTransition.transition(state, next);
        data = nextData;
        log.debug("State transition → {}", next);
        if (next.isTerminal()) {
            releaseSessionClaim();
        } else {
            persist();
        }
    }

    private void persist() {
        Path target = snapshotPath;
        // 취소 후에는 releaseIncomplete()가 지운 스냅샷을 다시 만들지 않음
        if (target == null || cancelled) {
            return;
        }
        PersistenceResult result = snapshotStore.save(target, new WorkflowSnapshot(state, clock.instant(), data, stagingDir));
        if (result.isDegraded()) {
            log.debug("Run is no longer resumable from {}", target);
        }
    }

    private void deleteSnapshot() {
        Path target = snapshotPath;
        if (target != null) {
            snapshotStore.delete(target);
        }
    }

    private ResearchPhaseData researchData() {
        ResearchPhaseData current = data.research();
        return current != null ? current : ResearchPhaseData.started(clock.instant());
    }

    private WritingPhaseData writingData() {
        WritingPhaseData current = data.writing();
        return current != null ? current : WritingPhaseData.started(clock.instant());
    }

    private SavingPhaseData savingData() {
        SavingPhaseData current = data.saving();
        return current != null ? current : SavingPhaseData.started(clock.instant());
    }

    // ======== 실패, 취소 ========

    private void finish(CompletableFuture<Path> result, Path index, Throwable error) {
        if (error == null) {
            log.info("Workflow completed successfully. Output: {}", index);
            result.complete(index);
            return;
        }
        Throwable cause = RetryPolicy.unwrap(error);
        handleFailure(cause);
        result.completeExceptionally(cause);
    }

    private <T> CompletableFuture<T> failingOver(CompletableFuture<T> phase) {
        CompletableFuture<T> result = new CompletableFuture<>();
        phase.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = RetryPolicy.unwrap(error);
            handleFailure(cause);
            result.completeExceptionally(cause);
        });
        return result;
    }

    private void handleFailure(Throwable cause) {
        String message = describe(cause);
        synchronized (lock) {
            if (sessionId == null || !StateTransition.canFail(state)) {
                return;
            }
            if (cause instanceof CancellationException) {
                log.warn("Workflow cancelled in state {}", state);
            } else {
                log.error("Workflow failed in state {}: {}", state, message, cause);
            }
            moveTo(WorkflowState.FAILED, data.withError(message));
        }
        progress.report(ProgressPhase.FAILED, message);
        rollback();
    }

    private void rollback() {
        synchronized (lock) {
            Path staging = stagingDir;
            if (staging != null) {
                if (commitFailed) {
                    log.warn("Keeping staging directory for inspection after commit failure: {}", staging);
                } else if (outputCommitter.discard(staging)) {
                    stagingDir = null;
                }
            }
            moveTo(WorkflowState.ROLLED_BACK, data);
            deleteSnapshot();
        }
        log.info("Workflow rolled back: {}", sessionId.getValue());
    }

    private void requestCancellation() {
        cancelled = true;
        log.info("Cancellation requested in state {}", state);
        releaseIncomplete();
    }

    private void checkCancelled() {
        if (cancelled) {
            throw new CancellationException("Workflow cancelled");
        }
    }

    private void claimRun() {
        if (!runClaimed.compareAndSet(false, true) || sessionId != null) {
            throw new IllegalStateException("This orchestrator has already started a run; use a new instance per run");
        }
    }

    private void checkPreconditions(Keyword kw, WorkflowState next) {
        StateTransition.validate(state, next);
        Keyword bound = keyword;
        if (bound != null && !bound.equals(kw)) {
            throw new IllegalStateException(
                "Orchestrator is bound to keyword '" + bound.getValue() + "', got '" + kw.getValue() + "'");
        }
    }

    private static void requirePayloads(ResearchResult research, ArticleResult article) {
        if (research == null) {
            throw new IllegalArgumentException("research cannot be null");
        }
        if (article == null) {
            throw new IllegalArgumentException("article cannot be null");
        }
    }

    private static WorkflowRunnerConfig requireConfig(WorkflowRunnerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    private static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> call) {
        try {
            CompletionStage<T> stage = call.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Operation returned no result"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> CompletableFuture<T> unwrapped(T value, Throwable error) {
        return error == null
            ? CompletableFuture.completedFuture(value)
            : CompletableFuture.failedFuture(RetryPolicy.unwrap(error));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return (message == null || message.isBlank()) ? error.getClass().getSimpleName() : message;
    }

    private record Resumable(Path snapshotFile, Keyword keyword, WorkflowSnapshot snapshot) {
    }

    /**
     * 취소 시 다음 단계 경계에서 멈추도록 표시하고, 호출자가 취소를 관찰하기 전에
     * 미완료 자원을 해제하는 future.
     */
    private static final class RunFuture<T> extends CompletableFuture<T> {

        private final Runnable onCancel;

        RunFuture(Runnable onCancel) {
            this.onCancel = onCancel;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (isDone()) {
                return false;
            }
            onCancel.run();
            return super.cancel(mayInterruptIfRunning);
        }
    }
}
