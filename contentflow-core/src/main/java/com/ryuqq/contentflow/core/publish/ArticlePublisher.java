package com.ryuqq.contentflow.core.publish;

import com.ryuqq.contentflow.core.model.ArticleResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 커밋된 아티클 발행 인터페이스.
 *
 * <p>COMPLETE 이후 커밋된 {@code article.html}을 외부 문서 저장소(예: 클라우드 문서)에
 * 업로드합니다. 발행은 best-effort이며, 실패하거나 빈 결과를 반환해도
 * 워크플로우는 실패하지 않습니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.core.publish.noop.NoOpArticlePublisher}: 발행하지 않음 (기본값)</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public interface ArticlePublisher {

    /**
     * 아티클 발행.
     *
     * @param articleHtml 커밋된 article.html 경로
     * @param article 아티클 (제목 등 메타데이터 용도)
     * @return 발행된 문서, 발행하지 않았으면 빈 Optional
     * @throws IOException 업로드 실패 시
     */
    Optional<PublishedDocument> publish(Path articleHtml, ArticleResult article) throws IOException;
}
