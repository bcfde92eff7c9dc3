package com.ryuqq.contentflow.adapter.filesystem.output;

import com.ryuqq.contentflow.core.model.SessionId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * OutputLayout 테스트.
 */
class OutputLayoutTest {

    @TempDir
    Path root;

    private final SessionId sessionId = SessionId.of("keto_diet_20260101_100000_000");

    @Test
    void 세션별_경로_규칙() {
        OutputLayout layout = new OutputLayout(root);

        assertThat(layout.snapshotPathFor(sessionId))
            .isEqualTo(root.resolve(".workflow_state_keto_diet_20260101_100000_000.json"));
        assertThat(layout.stagingBaseFor(sessionId)).isEqualTo(root.resolve(".temp_keto_diet_20260101_100000_000"));
        assertThat(layout.finalDirectoryFor(sessionId)).isEqualTo(root.resolve("keto_diet_20260101_100000_000"));
    }

    @Test
    void sessionIdFromSnapshot_파일_이름에서_세션_ID_추출() {
        assertThat(OutputLayout.sessionIdFromSnapshot(root.resolve(".workflow_state_keto_diet_20260101_100000_000.json")))
            .contains(sessionId);
        assertThat(OutputLayout.sessionIdFromSnapshot(root.resolve("state.json"))).isEmpty();
        assertThat(OutputLayout.sessionIdFromSnapshot(root.resolve(".workflow_state_.json"))).isEmpty();
        assertThat(OutputLayout.sessionIdFromSnapshot(root.resolve(".workflow_state_bad name!.json"))).isEmpty();
    }

    @Test
    void 패턴_판별은_파일과_디렉토리_종류까지_확인() throws IOException {
        Path snapshot = Files.writeString(root.resolve(".workflow_state_a.json"), "{}");
        Path snapshotNamedDir = Files.createDirectory(root.resolve(".workflow_state_b.json"));
        Path staging = Files.createDirectory(root.resolve(".temp_a"));
        Path stagingNamedFile = Files.writeString(root.resolve(".temp_b"), "x");

        assertThat(OutputLayout.isSnapshotFile(snapshot)).isTrue();
        assertThat(OutputLayout.isSnapshotFile(snapshotNamedDir)).isFalse();
        assertThat(OutputLayout.isStagingDirectory(staging)).isTrue();
        assertThat(OutputLayout.isStagingDirectory(stagingNamedFile)).isFalse();
    }

    @Test
    void isCompleteOutput_세_파일이_모두_있어야_true() throws IOException {
        Path complete = Files.createDirectory(root.resolve("complete"));
        Files.writeString(complete.resolve(OutputLayout.ARTICLE_FILE), "<html></html>");
        Files.writeString(complete.resolve(OutputLayout.RESEARCH_FILE), "{}");
        Files.writeString(complete.resolve(OutputLayout.INDEX_FILE), "<html></html>");
        Path partial = Files.createDirectory(root.resolve("partial"));
        Files.writeString(partial.resolve(OutputLayout.ARTICLE_FILE), "<html></html>");

        assertThat(OutputLayout.isCompleteOutput(complete)).isTrue();
        assertThat(OutputLayout.isCompleteOutput(partial)).isFalse();
        assertThat(OutputLayout.isCompleteOutput(root.resolve("missing"))).isFalse();
    }
}
