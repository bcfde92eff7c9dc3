package com.ryuqq.contentflow.adapter.filesystem.output;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.Source;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 리뷰 페이지({@code index.html}) 렌더러.
 *
 * <p>지표(단어 수, 읽기 시간, 소스 수, 키워드 밀도), 아티클 미리보기,
 * 신뢰도 상위 3개 소스를 보여주고 {@code article.html}과 {@code research.json}을
 * 상대 경로로 링크합니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class ReviewPageRenderer {

    static final int PREVIEW_LENGTH = 200;
    static final int TOP_SOURCES = 3;

    private static final DateTimeFormatter GENERATED_AT =
        DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH);

    private static final String STYLE = """
            <style>
                body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; margin: 0; padding: 20px; background-color: #f0f0f0; }
                .container { max-width: 1200px; margin: 0 auto; }
                .header { background-color: #2c3e50; color: white; padding: 20px; border-radius: 5px; margin-bottom: 20px; }
                .metrics { display: grid; grid-template-columns: repeat(auto-fit, minmax(200px, 1fr)); gap: 15px; margin-bottom: 20px; }
                .metric { background-color: white; padding: 15px; border-radius: 5px; text-align: center; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }
                .metric-value { font-size: 2em; font-weight: bold; color: #3498db; }
                .metric-label { color: #7f8c8d; font-size: 0.9em; }
                .content-preview { background-color: white; padding: 20px; border-radius: 5px; margin-bottom: 20px; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }
                .actions { display: flex; gap: 10px; margin-top: 20px; }
                .button { padding: 10px 20px; border-radius: 5px; text-decoration: none; display: inline-block; color: white; }
                .button-primary { background-color: #3498db; }
                .button-secondary { background-color: #95a5a6; }
            </style>
        """;

    private final Clock clock;

    public ReviewPageRenderer() {
        this(Clock.systemDefaultZone());
    }

    public ReviewPageRenderer(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 리뷰 페이지 생성.
     *
     * @param keyword 키워드
     * @param article 아티클
     * @param research 리서치 결과
     * @return HTML 문서
     */
    public String render(Keyword keyword, ArticleResult article, ResearchResult research) {
        String escapedKeyword = HtmlText.escape(keyword.getValue());
        StringBuilder html = new StringBuilder(4096);
        html.append("<!DOCTYPE html>\n")
            .append("<html lang=\"en\">\n")
            .append("<head>\n")
            .append("    <meta charset=\"UTF-8\">\n")
            .append("    <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
            .append("    <title>Review: ").append(escapedKeyword).append("</title>\n")
            .append(STYLE)
            .append("</head>\n")
            .append("<body>\n")
            .append("<div class=\"container\">\n")
            .append("    <div class=\"header\">\n")
            .append("        <h1>Content Review: ").append(escapedKeyword).append("</h1>\n")
            .append("        <p>Generated on ").append(GENERATED_AT.format(LocalDateTime.now(clock))).append("</p>\n")
            .append("    </div>\n");

        html.append("    <div class=\"metrics\">\n");
        metric(html, String.valueOf(article.wordCount()), "Words");
        metric(html, String.valueOf(article.readingTimeMinutes()), "Min Read");
        metric(html, String.valueOf(research.usableSources().size()), "Sources");
        metric(html, String.format(Locale.ROOT, "%.1f%%", article.keywordDensity() * 100), "Keyword Density");
        html.append("    </div>\n");

        html.append("    <div class=\"content-preview\">\n")
            .append("        <h2>Article Preview</h2>\n")
            .append("        <h3>").append(HtmlText.escape(article.title())).append("</h3>\n")
            .append("        <p><strong>Meta Description:</strong> ").append(HtmlText.escape(article.metaDescription())).append("</p>\n")
            .append("        <p><strong>Introduction:</strong> ").append(HtmlText.escape(preview(article.introduction()))).append("</p>\n")
            .append("        <div class=\"actions\">\n")
            .append("            <a href=\"").append(OutputLayout.ARTICLE_FILE).append("\" class=\"button button-primary\">View Full Article</a>\n")
            .append("            <a href=\"").append(OutputLayout.RESEARCH_FILE).append("\" class=\"button button-secondary\">View Research Data</a>\n")
            .append("        </div>\n")
            .append("    </div>\n");

        html.append("    <div class=\"content-preview\">\n")
            .append("        <h2>Top Sources Used</h2>\n")
            .append("        <ul>\n");
        for (Source source : research.topSources(TOP_SOURCES)) {
            html.append("            <li><a href=\"").append(HtmlText.escape(source.url())).append("\">")
                .append(HtmlText.escape(source.title())).append("</a> (Credibility: ")
                .append(String.format(Locale.ROOT, "%.2f", source.credibilityScore())).append(")</li>\n");
        }
        html.append("        </ul>\n")
            .append("    </div>\n")
            .append("</div>\n")
            .append("</body>\n")
            .append("</html>\n");
        return html.toString();
    }

    private static void metric(StringBuilder html, String value, String label) {
        html.append("        <div class=\"metric\">\n")
            .append("            <div class=\"metric-value\">").append(value).append("</div>\n")
            .append("            <div class=\"metric-label\">").append(label).append("</div>\n")
            .append("        </div>\n");
    }

    private static String preview(String introduction) {
        if (introduction.length() <= PREVIEW_LENGTH) {
            return introduction;
        }
        return introduction.substring(0, PREVIEW_LENGTH) + "...";
    }
}
