package com.ryuqq.contentflow.core.publish;

/**
 * 발행된 외부 문서.
 *
 * @param documentId 외부 문서 ID
 * @param webLink 문서 열람 링크 (null 가능)
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public record PublishedDocument(String documentId, String webLink) {

    public PublishedDocument {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId cannot be null or blank");
        }
    }
}
