package com.ryuqq.contentflow.core.spi;

/**
 * 진행 상황 수신자.
 *
 * <p>오케스트레이터를 호출한 스레드에서 동기적으로 호출됩니다.
 * 구현은 예외를 던지지 않아야 하며, 던지더라도 실행은 중단되지 않습니다.</p>
 *
 * <p><strong>phase 값:</strong> research, research_complete, writing, writing_complete,
 * saving, complete, failed</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(String phase, String message);
}
