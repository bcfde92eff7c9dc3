package com.ryuqq.contentflow.adapter.filesystem.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.contentflow.adapter.filesystem.json.PayloadJson;
import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.SessionId;
import com.ryuqq.contentflow.core.spi.OutputCommitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 스테이징 + rename 방식의 산출물 커밋.
 *
 * <p><strong>커밋 흐름:</strong></p>
 * <pre>
 * 1. stage(sessionId)      → .temp_&lt;session_id&gt;/ 생성 (이미 있으면 _1, _2 ... 접미사)
 * 2. writeArtifacts(...)   → article.html, research.json, index.html 기록
 * 3. commit(staging, dir)  → Files.move(ATOMIC_MOVE) 한 번으로 최종 디렉토리 등장
 * </pre>
 *
 * <p>커밋 실패 시 파일 시스템 예외는 가공 없이 전파되며, 스테이징 디렉토리는
 * 조사용으로 그대로 남습니다.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class AtomicOutputCommitter implements OutputCommitter {

    private static final Logger log = LoggerFactory.getLogger(AtomicOutputCommitter.class);

    private static final int MAX_STAGING_SUFFIX = 1000;

    private final OutputLayout layout;
    private final ObjectMapper objectMapper;
    private final ArticleHtmlRenderer articleRenderer;
    private final ReviewPageRenderer reviewRenderer;

    public AtomicOutputCommitter(OutputLayout layout) {
        this(layout, new ObjectMapper(), new ArticleHtmlRenderer(), new ReviewPageRenderer());
    }

    /**
     * 생성자.
     *
     * @param layout 출력 배치 규칙
     * @param objectMapper research.json 직렬화용 ObjectMapper
     * @param articleRenderer article.html 렌더러
     * @param reviewRenderer index.html 렌더러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AtomicOutputCommitter(OutputLayout layout, ObjectMapper objectMapper,
                                 ArticleHtmlRenderer articleRenderer, ReviewPageRenderer reviewRenderer) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (articleRenderer == null) {
            throw new IllegalArgumentException("articleRenderer cannot be null");
        }
        if (reviewRenderer == null) {
            throw new IllegalArgumentException("reviewRenderer cannot be null");
        }
        this.layout = layout;
        this.objectMapper = objectMapper;
        this.articleRenderer = articleRenderer;
        this.reviewRenderer = reviewRenderer;
    }

    @Override
    public Path stage(SessionId sessionId) throws IOException {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        Files.createDirectories(layout.outputRoot());
        Path base = layout.stagingBaseFor(sessionId);
        for (int suffix = 0; suffix <= MAX_STAGING_SUFFIX; suffix++) {
            Path candidate = suffix == 0 ? base : base.resolveSibling(base.getFileName() + "_" + suffix);
            try {
                Path created = Files.createDirectory(candidate);
                log.debug("Staging directory created: {}", created);
                return created;
            } catch (FileAlreadyExistsException e) {
                log.debug("Staging directory {} already exists, trying next suffix", candidate);
            }
        }
        throw new FileAlreadyExistsException(base.toString(), null,
            "no free staging directory name after " + MAX_STAGING_SUFFIX + " attempts");
    }

    @Override
    public void writeArtifacts(Path directory, Keyword keyword, ArticleResult article, ResearchResult research)
        throws IOException {
        if (directory == null || keyword == null || article == null || research == null) {
            throw new IllegalArgumentException("directory, keyword, article and research cannot be null");
        }
        Path articlePath = directory.resolve(OutputLayout.ARTICLE_FILE);
        Files.writeString(articlePath, articleRenderer.render(article), StandardCharsets.UTF_8);
        log.debug("Saved article to: {}", articlePath);

        Path researchPath = directory.resolve(OutputLayout.RESEARCH_FILE);
        String researchJson = objectMapper.writerWithDefaultPrettyPrinter()
            .writeValueAsString(PayloadJson.toJson(research));
        Files.writeString(researchPath, researchJson, StandardCharsets.UTF_8);
        log.debug("Saved research data to: {}", researchPath);

        Path indexPath = directory.resolve(OutputLayout.INDEX_FILE);
        Files.writeString(indexPath, reviewRenderer.render(keyword, article, research), StandardCharsets.UTF_8);
        log.debug("Created review interface at: {}", indexPath);
    }

    @Override
    public void commit(Path stagingDir, Path finalDir) throws IOException {
        if (stagingDir == null || finalDir == null) {
            throw new IllegalArgumentException("stagingDir and finalDir cannot be null");
        }
        if (Files.exists(finalDir)) {
            throw new FileAlreadyExistsException(finalDir.toString(), stagingDir.toString(),
                "final output directory already exists");
        }
        Files.move(stagingDir, finalDir, StandardCopyOption.ATOMIC_MOVE);
        log.info("Committed outputs: {} -> {}", stagingDir.getFileName(), finalDir);
    }

    @Override
    public Path finalDirectoryFor(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return layout.finalDirectoryFor(sessionId);
    }

    @Override
    public Path writeDirect(SessionId sessionId, Keyword keyword, ArticleResult article, ResearchResult research)
        throws IOException {
        Path directory = finalDirectoryFor(sessionId);
        Files.createDirectories(directory);
        writeArtifacts(directory, keyword, article, research);
        return directory;
    }

    @Override
    public boolean discard(Path stagingDir) {
        if (stagingDir == null) {
            return true;
        }
        try {
            FileTrees.deleteRecursively(stagingDir);
            log.debug("Discarded staging directory: {}", stagingDir);
            return true;
        } catch (IOException e) {
            log.warn("Failed to discard staging directory {}: {}", stagingDir, e.getMessage());
            return false;
        }
    }
}
