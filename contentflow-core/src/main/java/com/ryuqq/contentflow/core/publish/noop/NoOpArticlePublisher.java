package com.ryuqq.contentflow.core.publish.noop;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.publish.ArticlePublisher;
import com.ryuqq.contentflow.core.publish.PublishedDocument;

import java.nio.file.Path;
import java.util.Optional;

/**
 * ArticlePublisher NoOp 구현.
 *
 * <p>아무것도 발행하지 않고 항상 빈 결과를 반환합니다.
 * 외부 문서 저장소 없이 로컬 출력만 생성하고자 할 때 사용합니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class NoOpArticlePublisher implements ArticlePublisher {

    @Override
    public Optional<PublishedDocument> publish(Path articleHtml, ArticleResult article) {
        return Optional.empty();
    }
}
