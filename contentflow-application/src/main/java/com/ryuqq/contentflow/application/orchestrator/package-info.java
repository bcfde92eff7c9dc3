/**
 * Contentflow Application Layer - 파이프라인 실행 조정 API.
 *
 * <p>이 패키지는 세 단계 아티클 파이프라인을 구동하는 포트와
 * 실행 단위 자원 관리를 담당합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.application.orchestrator.WorkflowOrchestrator} - 파이프라인 실행 조정자</li>
 *   <li>{@link com.ryuqq.contentflow.application.orchestrator.WorkflowScope} - 미완료 실행 정리 스코프</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>비동기:</strong> 모든 실행 연산은 CompletableFuture를 반환</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
package com.ryuqq.contentflow.application.orchestrator;
