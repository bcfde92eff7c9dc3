package com.ryuqq.contentflow.adapter.filesystem;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.ArticleSection;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.Source;

import java.util.List;

/**
 * 파일 시스템 어댑터 테스트용 payload.
 */
public final class TestPayloads {

    private TestPayloads() {
    }

    public static ResearchResult research(String keyword) {
        return new ResearchResult(
            keyword,
            "Research summary for " + keyword,
            List.of(
                new Source("NIH overview", "https://nih.example/overview", "excerpt", ".gov", 0.95),
                new Source("University study", "https://uni.example/study", null, ".edu", 0.85),
                new Source("Journal review", "https://journal.example/review", null, ".org", 0.7),
                new Source("Blog post", "https://blog.example/post", null, ".com", 0.4)
            ),
            List.of("Finding one", "Finding two"),
            List.of("42% of adults"),
            List.of("Long-term data missing"),
            12,
            keyword + " research"
        );
    }

    public static ArticleResult article(String keyword) {
        return new ArticleResult(
            "A Guide to " + keyword,
            "Everything about " + keyword,
            keyword,
            "<p>" + "Introduction text. ".repeat(20) + "</p>",
            List.of(
                new ArticleSection("Background", "<p>Background content.</p>"),
                new ArticleSection("Evidence & Results", "<p>Evidence content.</p>")
            ),
            "<p>Conclusion.</p>",
            1450,
            7,
            0.015,
            List.of("https://nih.example/overview", "https://uni.example/study")
        );
    }
}
