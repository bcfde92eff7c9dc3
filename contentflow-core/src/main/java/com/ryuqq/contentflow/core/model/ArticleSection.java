package com.ryuqq.contentflow.core.model;

/**
 * 아티클 본문 섹션.
 *
 * @param heading 섹션 제목
 * @param content 섹션 본문
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record ArticleSection(String heading, String content) {

    public ArticleSection {
        if (heading == null) {
            throw new IllegalArgumentException("heading cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }
}
