package com.ryuqq.contentflow.testkit.contract;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.ArticleSection;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.Source;

import java.util.ArrayList;
import java.util.List;

/**
 * Canned research and article payloads for contract tests.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class Fixtures {

    public static final int DEFAULT_SOURCE_COUNT = 4;

    private static final String[] DOMAINS = {".gov", ".edu", ".org", ".com"};

    private Fixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ResearchResult research(Keyword keyword) {
        return research(keyword.getValue(), DEFAULT_SOURCE_COUNT);
    }

    /**
     * Creates a research result with the given number of usable sources.
     *
     * @param keyword the researched keyword
     * @param sourceCount number of sources, each with a distinct URL
     * @return research result
     */
    public static ResearchResult research(String keyword, int sourceCount) {
        List<Source> sources = new ArrayList<>(sourceCount);
        for (int i = 0; i < sourceCount; i++) {
            sources.add(new Source(
                "Peer-reviewed study " + (i + 1) + " on " + keyword,
                "https://research.example/" + slug(keyword) + "/" + (i + 1),
                "Key excerpt " + (i + 1),
                DOMAINS[i % DOMAINS.length],
                Math.max(0.5, 0.95 - i * 0.1)
            ));
        }
        return new ResearchResult(
            keyword,
            "Evidence summary for " + keyword,
            sources,
            List.of("Main finding about " + keyword, "Secondary finding"),
            List.of("34% of participants improved"),
            List.of("Few long-term studies"),
            sourceCount * 3,
            keyword + " peer reviewed"
        );
    }

    /**
     * Creates an article citing every usable source of the research.
     *
     * @param keyword the article keyword
     * @param research the research the article is based on
     * @return article result
     */
    public static ArticleResult article(Keyword keyword, ResearchResult research) {
        List<String> cited = research.usableSources().stream().map(Source::url).toList();
        return new ArticleResult(
            "The Complete Guide to " + keyword.getValue(),
            "Everything you need to know about " + keyword.getValue(),
            keyword.getValue(),
            "<p>An evidence-based look at " + keyword.getValue() + ".</p>",
            List.of(
                new ArticleSection("What the research says", "<p>Studies show consistent results.</p>"),
                new ArticleSection("Practical steps", "<p>Start small and track progress.</p>")
            ),
            "<p>Talk to a professional before making changes.</p>",
            1500,
            7,
            0.014,
            cited
        );
    }

    private static String slug(String keyword) {
        return keyword.toLowerCase(java.util.Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }
}
