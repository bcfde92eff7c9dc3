/**
 * Runner Adapter Layer - WorkflowOrchestrator 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.adapter.runner.PipelineWorkflowRunner} - 리서치, 작성, 원자적 저장 파이프라인</li>
 *   <li>{@link com.ryuqq.contentflow.adapter.runner.WorkflowRunnerConfig} - 출력 루트, 재시도, 소스 경고 기준 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PipelineWorkflowRunner)
 *   ↓ implements
 * application (WorkflowOrchestrator, WorkflowScope, ProgressReporter)
 *   ↓ depends on
 * core (Keyword, SessionId, WorkflowState, WorkflowSnapshot, RetryPolicy, SPI)
 *
 * adapter-runner → adapter-filesystem (JsonSnapshotStore, AtomicOutputCommitter, OrphanCollector)
 * </pre>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
package com.ryuqq.contentflow.adapter.runner;
