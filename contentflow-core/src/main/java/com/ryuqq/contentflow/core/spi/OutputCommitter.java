package com.ryuqq.contentflow.core.spi;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.SessionId;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 산출물 원자적 커밋 SPI.
 *
 * <p>산출물은 먼저 실행 전용 스테이징 디렉토리에 기록된 뒤, 한 번의 이동으로
 * 최종 디렉토리에 나타납니다. 최종 네임스페이스에는 완성된 디렉토리만 보입니다.</p>
 *
 * <pre>
 * Path staging = committer.stage(sessionId);
 * committer.writeArtifacts(staging, keyword, article, research);
 * committer.commit(staging, committer.finalDirectoryFor(sessionId));
 * </pre>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public interface OutputCommitter {

    /**
     * 스테이징 디렉토리 생성.
     *
     * @param sessionId 세션 ID
     * @return 새로 생성된 스테이징 디렉토리 (기존 디렉토리와 겹치지 않음)
     * @throws IOException 디렉토리 생성 실패 시
     */
    Path stage(SessionId sessionId) throws IOException;

    /**
     * 디렉토리에 article.html, research.json, index.html 기록.
     *
     * @param directory 대상 디렉토리 (존재해야 함)
     * @param keyword 키워드
     * @param article 아티클
     * @param research 리서치 결과
     * @throws IOException 파일 기록 실패 시
     */
    void writeArtifacts(Path directory, Keyword keyword, ArticleResult article, ResearchResult research)
        throws IOException;

    /**
     * 스테이징 디렉토리를 최종 디렉토리로 원자적으로 이동.
     *
     * <p>실패 시 스테이징 디렉토리는 그대로 남으며, 파일 시스템 오류는 가공 없이 전파됩니다.</p>
     *
     * @param stagingDir 스테이징 디렉토리
     * @param finalDir 최종 디렉토리 (존재하지 않아야 함)
     * @throws IOException 이동 실패 시
     */
    void commit(Path stagingDir, Path finalDir) throws IOException;

    /**
     * 세션의 최종 출력 디렉토리 경로.
     *
     * @param sessionId 세션 ID
     * @return 최종 디렉토리 경로 (아직 존재하지 않을 수 있음)
     */
    Path finalDirectoryFor(SessionId sessionId);

    /**
     * 스테이징 없이 최종 디렉토리에 직접 기록.
     *
     * @param sessionId 세션 ID
     * @param keyword 키워드
     * @param article 아티클
     * @param research 리서치 결과
     * @return 기록된 디렉토리
     * @throws IOException 기록 실패 시
     */
    Path writeDirect(SessionId sessionId, Keyword keyword, ArticleResult article, ResearchResult research)
        throws IOException;

    /**
     * 스테이징 디렉토리 삭제 (best-effort).
     *
     * @param stagingDir 삭제할 디렉토리 (null이거나 없으면 true)
     * @return 삭제되었거나 원래 없었으면 true
     */
    boolean discard(Path stagingDir);
}
