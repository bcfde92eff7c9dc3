package com.ryuqq.contentflow.adapter.filesystem.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.ArticleSection;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.Source;

import java.util.ArrayList;
import java.util.List;

/**
 * 리서치 결과와 아티클의 JSON 트리 변환.
 *
 * <p>스냅샷에 포함되는 payload와 {@code research.json} 모두 이 변환을 사용합니다.
 * 키는 snake_case이며, core 모델에 Jackson 어노테이션을 두지 않기 위해 트리를 직접 구성합니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class PayloadJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PayloadJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectNode toJson(ResearchResult research) {
        ObjectNode node = NODES.objectNode();
        node.put("keyword", research.keyword());
        node.put("summary", research.summary());
        ArrayNode sources = node.putArray("sources");
        for (Source source : research.sources()) {
            ObjectNode s = sources.addObject();
            s.put("title", source.title());
            s.put("url", source.url());
            s.put("excerpt", source.excerpt());
            s.put("domain", source.domain());
            s.put("credibility_score", source.credibilityScore());
        }
        putStrings(node, "main_findings", research.findings());
        putStrings(node, "key_statistics", research.statistics());
        putStrings(node, "research_gaps", research.researchGaps());
        node.put("total_sources_analyzed", research.totalSourcesAnalyzed());
        node.put("search_query", research.searchQuery());
        return node;
    }

    public static ObjectNode toJson(ArticleResult article) {
        ObjectNode node = NODES.objectNode();
        node.put("title", article.title());
        node.put("meta_description", article.metaDescription());
        node.put("focus_keyword", article.focusKeyword());
        node.put("introduction", article.introduction());
        ArrayNode sections = node.putArray("sections");
        for (ArticleSection section : article.sections()) {
            ObjectNode s = sections.addObject();
            s.put("heading", section.heading());
            s.put("content", section.content());
        }
        node.put("conclusion", article.conclusion());
        node.put("word_count", article.wordCount());
        node.put("reading_time_minutes", article.readingTimeMinutes());
        node.put("keyword_density", article.keywordDensity());
        putStrings(node, "sources_used", article.sourcesUsed());
        return node;
    }

    /**
     * JSON 트리에서 리서치 결과 복원.
     *
     * @param node research 객체 노드
     * @return ResearchResult
     * @throws IllegalArgumentException 필수 필드가 없거나 값이 유효하지 않은 경우
     */
    public static ResearchResult researchFrom(JsonNode node) {
        requireObject(node, "research result");
        List<Source> sources = new ArrayList<>();
        for (JsonNode s : node.path("sources")) {
            sources.add(new Source(
                s.path("title").asText(""),
                textOrNull(s, "url"),
                textOrNull(s, "excerpt"),
                textOrNull(s, "domain"),
                s.path("credibility_score").asDouble(0.0)
            ));
        }
        return new ResearchResult(
            requireText(node, "keyword"),
            textOrNull(node, "summary"),
            sources,
            strings(node.path("main_findings")),
            strings(node.path("key_statistics")),
            strings(node.path("research_gaps")),
            node.path("total_sources_analyzed").asInt(sources.size()),
            textOrNull(node, "search_query")
        );
    }

    /**
     * JSON 트리에서 아티클 복원.
     *
     * @param node article 객체 노드
     * @return ArticleResult
     * @throws IllegalArgumentException 필수 필드가 없거나 값이 유효하지 않은 경우
     */
    public static ArticleResult articleFrom(JsonNode node) {
        requireObject(node, "article");
        List<ArticleSection> sections = new ArrayList<>();
        for (JsonNode s : node.path("sections")) {
            sections.add(new ArticleSection(s.path("heading").asText(""), s.path("content").asText("")));
        }
        return new ArticleResult(
            requireText(node, "title"),
            textOrNull(node, "meta_description"),
            textOrNull(node, "focus_keyword"),
            textOrNull(node, "introduction"),
            sections,
            textOrNull(node, "conclusion"),
            node.path("word_count").asInt(0),
            node.path("reading_time_minutes").asInt(0),
            node.path("keyword_density").asDouble(0.0),
            strings(node.path("sources_used"))
        );
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requireText(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value;
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException(what + " must be a JSON object");
        }
    }

    private static void putStrings(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        values.forEach(array::add);
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isNull()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
