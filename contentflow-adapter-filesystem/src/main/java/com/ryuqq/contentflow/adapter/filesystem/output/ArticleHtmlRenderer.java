package com.ryuqq.contentflow.adapter.filesystem.output;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.ArticleSection;

/**
 * 아티클 HTML 렌더러.
 *
 * <p>제목, 메타 정보, 섹션 제목은 이스케이프하고, 작성 서비스가 만든 본문
 * (서론, 섹션 내용, 결론)은 HTML 조각으로 보고 그대로 삽입합니다.
 * 기본 스타일은 {@code </head>} 바로 앞에 주입됩니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class ArticleHtmlRenderer {

    static final String DEFAULT_CSS = """
        <style>
            body {
                font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif;
                line-height: 1.6;
                color: #333;
                max-width: 800px;
                margin: 0 auto;
                padding: 20px;
                background-color: #f9f9f9;
            }
            h1 {
                color: #2c3e50;
                border-bottom: 3px solid #3498db;
                padding-bottom: 10px;
                margin-bottom: 30px;
            }
            h2 {
                color: #34495e;
                margin-top: 30px;
                margin-bottom: 15px;
            }
            .reading-time {
                color: #7f8c8d;
                font-style: italic;
                margin-bottom: 20px;
            }
            .introduction {
                font-size: 1.1em;
                color: #555;
                background-color: #ecf0f1;
                padding: 15px;
                border-radius: 5px;
                margin-bottom: 30px;
            }
            .conclusion {
                background-color: #e8f8f5;
                padding: 15px;
                border-radius: 5px;
                margin-top: 30px;
                border-left: 4px solid #27ae60;
            }
            .section-content {
                margin-bottom: 20px;
                text-align: justify;
            }
        </style>
        """;

    /**
     * 스타일이 적용된 아티클 HTML 생성.
     *
     * @param article 아티클
     * @return 완성된 HTML 문서
     */
    public String render(ArticleResult article) {
        return injectStyling(renderPlain(article));
    }

    /**
     * 스타일 없는 아티클 HTML 생성.
     *
     * @param article 아티클
     * @return HTML 문서
     */
    public String renderPlain(ArticleResult article) {
        StringBuilder html = new StringBuilder(4096);
        html.append("<!DOCTYPE html>\n")
            .append("<html lang=\"en\">\n")
            .append("<head>\n")
            .append("  <meta charset=\"UTF-8\">\n")
            .append("  <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
            .append("  <title>").append(HtmlText.escape(article.title())).append("</title>\n")
            .append("  <meta name=\"description\" content=\"").append(HtmlText.escape(article.metaDescription())).append("\">\n")
            .append("  <meta name=\"keywords\" content=\"").append(HtmlText.escape(article.focusKeyword())).append("\">\n")
            .append("</head>\n")
            .append("<body>\n")
            .append("  <h1>").append(HtmlText.escape(article.title())).append("</h1>\n")
            .append("  <p class=\"reading-time\">").append(article.readingTimeMinutes()).append(" min read</p>\n")
            .append("  <div class=\"introduction\">").append(article.introduction()).append("</div>\n");

        for (ArticleSection section : article.sections()) {
            html.append("  <h2>").append(HtmlText.escape(section.heading())).append("</h2>\n")
                .append("  <div class=\"section-content\">").append(section.content()).append("</div>\n");
        }

        html.append("  <div class=\"conclusion\">").append(article.conclusion()).append("</div>\n")
            .append("</body>\n")
            .append("</html>\n");
        return html.toString();
    }

    /**
     * 기본 CSS를 {@code </head>} 앞에 주입.
     *
     * <p>{@code </head>}가 없는 문서는 그대로 반환합니다.</p>
     *
     * @param html HTML 문서
     * @return 스타일이 주입된 HTML
     */
    public String injectStyling(String html) {
        int index = html.indexOf("</head>");
        if (index < 0) {
            return html;
        }
        return html.substring(0, index) + DEFAULT_CSS + html.substring(index);
    }
}
