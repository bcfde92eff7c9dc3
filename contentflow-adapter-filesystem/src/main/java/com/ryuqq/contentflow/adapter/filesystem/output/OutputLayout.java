package com.ryuqq.contentflow.adapter.filesystem.output;

import com.ryuqq.contentflow.core.model.SessionId;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 출력 루트 아래 파일 배치 규칙.
 *
 * <pre>
 * &lt;output_root&gt;/
 * ├── .workflow_state_&lt;session_id&gt;.json   스냅샷
 * ├── .temp_&lt;session_id&gt;/                 스테이징 디렉토리
 * └── &lt;session_id&gt;/                       커밋된 산출물
 *     ├── article.html
 *     ├── research.json
 *     └── index.html
 * </pre>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class OutputLayout {

    public static final String SNAPSHOT_PREFIX = ".workflow_state_";
    public static final String SNAPSHOT_SUFFIX = ".json";
    public static final String STAGING_PREFIX = ".temp_";

    public static final String ARTICLE_FILE = "article.html";
    public static final String RESEARCH_FILE = "research.json";
    public static final String INDEX_FILE = "index.html";

    private final Path outputRoot;

    /**
     * 생성자.
     *
     * @param outputRoot 출력 루트 디렉토리
     * @throws IllegalArgumentException outputRoot가 null인 경우
     */
    public OutputLayout(Path outputRoot) {
        if (outputRoot == null) {
            throw new IllegalArgumentException("outputRoot cannot be null");
        }
        this.outputRoot = outputRoot;
    }

    public Path outputRoot() {
        return outputRoot;
    }

    public Path snapshotPathFor(SessionId sessionId) {
        return outputRoot.resolve(SNAPSHOT_PREFIX + sessionId.getValue() + SNAPSHOT_SUFFIX);
    }

    /**
     * 스테이징 디렉토리 기본 경로 (중복 시 숫자 접미사는 committer가 붙임).
     *
     * @param sessionId 세션 ID
     * @return {@code .temp_<session_id>}
     */
    public Path stagingBaseFor(SessionId sessionId) {
        return outputRoot.resolve(STAGING_PREFIX + sessionId.getValue());
    }

    public Path finalDirectoryFor(SessionId sessionId) {
        return outputRoot.resolve(sessionId.getValue());
    }

    /**
     * 커밋된 산출물 디렉토리에 세 파일(article, research, index)이 모두 있는지 확인.
     *
     * @param finalDir 최종 디렉토리
     * @return 세 파일이 모두 일반 파일로 존재하면 true
     */
    public static boolean isCompleteOutput(Path finalDir) {
        return Files.isDirectory(finalDir)
            && Files.isRegularFile(finalDir.resolve(ARTICLE_FILE))
            && Files.isRegularFile(finalDir.resolve(RESEARCH_FILE))
            && Files.isRegularFile(finalDir.resolve(INDEX_FILE));
    }

    /**
     * 스냅샷 파일 이름에서 세션 ID 추출.
     *
     * <p>재개 시 중단된 실행과 같은 최종 디렉토리 이름을 쓰기 위해 사용합니다.</p>
     *
     * @param snapshotFile 스냅샷 파일 경로
     * @return 세션 ID (이름 규칙과 맞지 않으면 empty)
     */
    public static Optional<SessionId> sessionIdFromSnapshot(Path snapshotFile) {
        if (snapshotFile == null || snapshotFile.getFileName() == null) {
            return Optional.empty();
        }
        String name = snapshotFile.getFileName().toString();
        if (!name.startsWith(SNAPSHOT_PREFIX) || !name.endsWith(SNAPSHOT_SUFFIX)
            || name.length() <= SNAPSHOT_PREFIX.length() + SNAPSHOT_SUFFIX.length()) {
            return Optional.empty();
        }
        String raw = name.substring(SNAPSHOT_PREFIX.length(), name.length() - SNAPSHOT_SUFFIX.length());
        try {
            return Optional.of(SessionId.of(raw));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * 스냅샷 파일 이름 패턴({@code .workflow_state_*.json})과 일치하는 일반 파일인지 확인.
     *
     * @param path 검사할 경로
     * @return 스냅샷 파일이면 true
     */
    public static boolean isSnapshotFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        return name.startsWith(SNAPSHOT_PREFIX)
            && name.endsWith(SNAPSHOT_SUFFIX)
            && name.length() > SNAPSHOT_PREFIX.length() + SNAPSHOT_SUFFIX.length()
            && Files.isRegularFile(path);
    }

    /**
     * 스테이징 디렉토리 이름 패턴({@code .temp_*})과 일치하는 디렉토리인지 확인.
     *
     * @param path 검사할 경로
     * @return 스테이징 디렉토리이면 true
     */
    public static boolean isStagingDirectory(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        return name.startsWith(STAGING_PREFIX)
            && name.length() > STAGING_PREFIX.length()
            && Files.isDirectory(path);
    }
}
