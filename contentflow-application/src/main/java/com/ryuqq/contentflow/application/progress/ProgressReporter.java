package com.ryuqq.contentflow.application.progress;

import com.ryuqq.contentflow.core.spi.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 진행 상황 전달자.
 *
 * <p>선택적 {@link ProgressListener}를 보관하고 호출 스레드에서 동기적으로 전달합니다.
 * 수신자가 없으면 아무 동작도 하지 않으며, 수신자가 예외를 던지면 경고 로그만 남깁니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private volatile ProgressListener listener;

    public ProgressReporter() {
    }

    public ProgressReporter(ProgressListener listener) {
        this.listener = listener;
    }

    public void setListener(ProgressListener listener) {
        this.listener = listener;
    }

    public boolean hasListener() {
        return listener != null;
    }

    /**
     * 진행 상황 전달.
     *
     * @param phase 단계
     * @param message 사람이 읽을 메시지
     */
    public void report(ProgressPhase phase, String message) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        ProgressListener current = listener;
        if (current == null) {
            return;
        }
        try {
            current.onProgress(phase.value(), message);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for phase '{}': {}", phase.value(), e.getMessage(), e);
        }
    }
}
