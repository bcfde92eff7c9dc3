package com.ryuqq.contentflow.adapter.filesystem.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.contentflow.adapter.filesystem.json.PayloadJson;
import com.ryuqq.contentflow.core.snapshot.ResearchPhaseData;
import com.ryuqq.contentflow.core.snapshot.SavingPhaseData;
import com.ryuqq.contentflow.core.snapshot.WorkflowData;
import com.ryuqq.contentflow.core.snapshot.WorkflowSnapshot;
import com.ryuqq.contentflow.core.snapshot.WritingPhaseData;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 스냅샷 ↔ JSON 트리 변환.
 *
 * <p>wire 형식:</p>
 * <pre>
 * { "state": "research_complete", "timestamp": "2026-01-01T10:00:00Z",
 *   "data": {"keyword": "...", "resumed": false, "error": null,
 *            "research": {"started_at": "...", "completed_at": "...", "sources_found": 4, "result": {...}},
 *            "writing": {...}, "saving": {...}},
 *   "temp_dir": "/out/.temp_..." }
 * </pre>
 *
 * <p>{@code staging_dir} 키도 {@code temp_dir}의 별칭으로 읽습니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
final class SnapshotCodec {

    static final String STATE = "state";
    static final String TEMP_DIR = "temp_dir";
    static final String STAGING_DIR_ALIAS = "staging_dir";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SnapshotCodec() {
    }

    static ObjectNode encode(WorkflowSnapshot snapshot) {
        ObjectNode root = NODES.objectNode();
        root.put(STATE, snapshot.state().wireValue());
        root.put("timestamp", snapshot.timestamp().toString());
        root.set("data", encodeData(snapshot.data()));
        root.put(TEMP_DIR, snapshot.stagingDir() == null ? null : snapshot.stagingDir().toString());
        return root;
    }

    /**
     * JSON 트리를 스냅샷으로 변환.
     *
     * <p>state 값은 호출자가 먼저 확인해야 합니다.</p>
     *
     * @param root 스냅샷 루트 노드
     * @param state 확인된 상태
     * @return WorkflowSnapshot
     * @throws IllegalArgumentException 구조가 손상된 경우
     */
    static WorkflowSnapshot decode(JsonNode root, WorkflowState state) {
        Instant timestamp = instantOrNull(root, "timestamp");
        JsonNode data = root.path("data");
        if (!data.isMissingNode() && !data.isNull() && !data.isObject()) {
            throw new IllegalArgumentException("'data' must be a JSON object");
        }
        return new WorkflowSnapshot(
            state,
            timestamp == null ? Instant.EPOCH : timestamp,
            decodeData(data),
            stagingDir(root)
        );
    }

    private static ObjectNode encodeData(WorkflowData data) {
        ObjectNode node = NODES.objectNode();
        node.put("keyword", data.keyword());
        node.put("resumed", data.resumed());
        node.put("error", data.error());

        ResearchPhaseData research = data.research();
        if (research != null) {
            ObjectNode r = phase(research.startedAt(), research.completedAt());
            r.put("sources_found", research.sourcesFound());
            if (research.result() != null) {
                r.set("result", PayloadJson.toJson(research.result()));
            }
            node.set("research", r);
        }

        WritingPhaseData writing = data.writing();
        if (writing != null) {
            ObjectNode w = phase(writing.startedAt(), writing.completedAt());
            w.put("word_count", writing.wordCount());
            if (writing.article() != null) {
                w.set("article", PayloadJson.toJson(writing.article()));
            }
            node.set("writing", w);
        }

        SavingPhaseData saving = data.saving();
        if (saving != null) {
            ObjectNode s = phase(saving.startedAt(), saving.completedAt());
            s.put("output_path", saving.outputPath());
            if (saving.published() != null) {
                s.put("published", saving.published());
            }
            s.put("document_link", saving.documentLink());
            node.set("saving", s);
        }
        return node;
    }

    private static WorkflowData decodeData(JsonNode node) {
        if (!node.isObject()) {
            return WorkflowData.initial(null);
        }
        ResearchPhaseData research = null;
        JsonNode r = node.get("research");
        if (r != null && r.isObject()) {
            JsonNode result = r.get("result");
            research = new ResearchPhaseData(
                instantOrNull(r, "started_at"),
                instantOrNull(r, "completed_at"),
                r.path("sources_found").asInt(0),
                result == null || result.isNull() ? null : PayloadJson.researchFrom(result)
            );
        }

        WritingPhaseData writing = null;
        JsonNode w = node.get("writing");
        if (w != null && w.isObject()) {
            JsonNode article = w.get("article");
            writing = new WritingPhaseData(
                instantOrNull(w, "started_at"),
                instantOrNull(w, "completed_at"),
                w.path("word_count").asInt(0),
                article == null || article.isNull() ? null : PayloadJson.articleFrom(article)
            );
        }

        SavingPhaseData saving = null;
        JsonNode s = node.get("saving");
        if (s != null && s.isObject()) {
            JsonNode published = s.get("published");
            saving = new SavingPhaseData(
                instantOrNull(s, "started_at"),
                instantOrNull(s, "completed_at"),
                textOrNull(s, "output_path"),
                published == null || published.isNull() ? null : published.asBoolean(),
                textOrNull(s, "document_link")
            );
        }

        return new WorkflowData(
            textOrNull(node, "keyword"),
            node.path("resumed").asBoolean(false),
            textOrNull(node, "error"),
            research,
            writing,
            saving
        );
    }

    private static ObjectNode phase(Instant startedAt, Instant completedAt) {
        ObjectNode node = NODES.objectNode();
        node.put("started_at", startedAt == null ? null : startedAt.toString());
        node.put("completed_at", completedAt == null ? null : completedAt.toString());
        return node;
    }

    private static Path stagingDir(JsonNode root) {
        String value = textOrNull(root, TEMP_DIR);
        if (value == null) {
            value = textOrNull(root, STAGING_DIR_ALIAS);
        }
        return value == null || value.isBlank() ? null : Path.of(value);
    }

    private static Instant instantOrNull(JsonNode node, String field) {
        String value = textOrNull(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (java.time.format.DateTimeParseException e) {
            throw new IllegalArgumentException("invalid timestamp in '" + field + "': " + value, e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
