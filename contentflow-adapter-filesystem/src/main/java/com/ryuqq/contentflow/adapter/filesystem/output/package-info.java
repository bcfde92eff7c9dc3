/**
 * 산출물 렌더링과 원자적 커밋.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.adapter.filesystem.output.OutputLayout} - 출력 루트 아래 이름 규칙</li>
 *   <li>{@link com.ryuqq.contentflow.adapter.filesystem.output.AtomicOutputCommitter} - 스테이징 후 rename 커밋</li>
 *   <li>{@link com.ryuqq.contentflow.adapter.filesystem.output.ArticleHtmlRenderer} - article.html</li>
 *   <li>{@link com.ryuqq.contentflow.adapter.filesystem.output.ReviewPageRenderer} - index.html</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Contentflow Team
 */
package com.ryuqq.contentflow.adapter.filesystem.output;
