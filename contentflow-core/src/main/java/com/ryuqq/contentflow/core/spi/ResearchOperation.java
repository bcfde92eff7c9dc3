package com.ryuqq.contentflow.core.spi;

import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;

import java.util.concurrent.CompletionStage;

/**
 * 리서치 operation SPI.
 *
 * <p>웹 검색과 LLM 요약을 수행하는 외부 리서치 서비스를 추상화합니다.
 * 오케스트레이터는 반환된 결과의 내용을 해석하지 않고 구조만 검증합니다.</p>
 *
 * <p><strong>오류 계약:</strong></p>
 * <ul>
 *   <li>네트워크/API 장애: {@link com.ryuqq.contentflow.core.exception.TransientOperationException}
 *       (재시도 대상)</li>
 *   <li>그 외 모든 오류: 재시도 없이 즉시 실패</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResearchOperation {

    /**
     * 키워드에 대한 리서치 수행.
     *
     * @param keyword 검증된 키워드
     * @return 리서치 결과를 완료하는 CompletionStage
     */
    CompletionStage<ResearchResult> research(Keyword keyword);
}
