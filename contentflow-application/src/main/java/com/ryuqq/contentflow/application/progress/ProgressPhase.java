package com.ryuqq.contentflow.application.progress;

/**
 * 진행 상황 단계 이름.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public enum ProgressPhase {

    RESEARCH("research"),
    RESEARCH_COMPLETE("research_complete"),
    WRITING("writing"),
    WRITING_COMPLETE("writing_complete"),
    SAVING("saving"),
    COMPLETE("complete"),
    FAILED("failed");

    private final String value;

    ProgressPhase(String value) {
        this.value = value;
    }

    /**
     * 수신자에게 전달되는 단계 문자열.
     *
     * @return 소문자 단계 이름
     */
    public String value() {
        return value;
    }
}
