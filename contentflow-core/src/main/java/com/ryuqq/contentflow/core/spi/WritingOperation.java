package com.ryuqq.contentflow.core.spi;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;

import java.util.concurrent.CompletionStage;

/**
 * 아티클 작성 operation SPI.
 *
 * <p>리서치 결과를 바탕으로 SEO 아티클을 생성하는 외부 서비스를 추상화합니다.
 * 오케스트레이터는 작성 단계를 재시도하지 않습니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WritingOperation {

    /**
     * 아티클 작성.
     *
     * @param keyword 검증된 키워드
     * @param research 완료된 리서치 결과
     * @return 아티클을 완료하는 CompletionStage
     */
    CompletionStage<ArticleResult> write(Keyword keyword, ResearchResult research);
}
