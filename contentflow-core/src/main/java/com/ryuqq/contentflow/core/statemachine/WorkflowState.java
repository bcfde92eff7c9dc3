package com.ryuqq.contentflow.core.statemachine;

import java.util.Optional;

/**
 * 워크플로우 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INITIALIZED
 *    │ (리서치 시작)
 *    ▼
 * RESEARCHING ──► RESEARCH_COMPLETE
 *                     │ (작성 시작)
 *                     ▼
 *                  WRITING ──► WRITING_COMPLETE
 *                                  │ (저장 시작)
 *                                  ▼
 *                               SAVING ──► COMPLETE
 *
 * 비종료 상태 어디서든 ──► FAILED ──► ROLLED_BACK
 *
 * 금지된 전이:
 * - 단계 건너뛰기 (예: RESEARCHING → WRITING) ❌
 * - 역방향 전이 (예: WRITING → RESEARCHING) ❌
 * - COMPLETE / ROLLED_BACK → * ❌
 * </pre>
 *
 * <p>각 상태는 스냅샷 파일에 저장되는 소문자 wire 값을 갖습니다
 * (예: {@code RESEARCH_COMPLETE → "research_complete"}).</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public enum WorkflowState {

    /**
     * 실행 시작 전 (키워드 검증 완료, 스냅샷 생성됨).
     */
    INITIALIZED,

    /**
     * 리서치 진행 중.
     */
    RESEARCHING,

    /**
     * 리서치 완료 (결과가 스냅샷에 포함됨).
     */
    RESEARCH_COMPLETE,

    /**
     * 아티클 작성 중.
     */
    WRITING,

    /**
     * 작성 완료 (아티클이 스냅샷에 포함됨).
     */
    WRITING_COMPLETE,

    /**
     * 스테이징 디렉토리에 산출물 기록 및 커밋 중.
     */
    SAVING,

    /**
     * 완료 (최종 디렉토리 커밋 성공).
     */
    COMPLETE,

    /**
     * 복구 불가능한 오류 발생 (롤백 대기).
     */
    FAILED,

    /**
     * 롤백 완료.
     */
    ROLLED_BACK;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETE, ROLLED_BACK)에서는 더 이상 다른 상태로 전이할 수 없습니다.
     * FAILED는 롤백으로만 빠져나갈 수 있는 중간 상태입니다.</p>
     *
     * @return COMPLETE 또는 ROLLED_BACK인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ROLLED_BACK;
    }

    /**
     * 실패 경로 상태인지 확인.
     *
     * @return FAILED 또는 ROLLED_BACK인 경우 true
     */
    public boolean isFailure() {
        return this == FAILED || this == ROLLED_BACK;
    }

    /**
     * 스냅샷에 기록되는 wire 값.
     *
     * @return 소문자 상태 이름 (예: "research_complete")
     */
    public String wireValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    /**
     * wire 값으로 상태 조회.
     *
     * <p>대소문자를 구분하지 않으며, 알 수 없는 값은 빈 Optional을 반환합니다.</p>
     *
     * @param value wire 값 (null 가능)
     * @return 일치하는 상태 또는 빈 Optional
     */
    public static Optional<WorkflowState> fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (WorkflowState state : values()) {
            if (state.wireValue().equalsIgnoreCase(value.trim())) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
