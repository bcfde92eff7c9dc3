package com.ryuqq.contentflow.testkit.contract;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.model.SessionId;
import com.ryuqq.contentflow.core.spi.OutputCommitter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * OutputCommitter decorator that can fail the commit step on demand.
 *
 * <p>Every other call is delegated unchanged, so staging and artifact writing
 * behave exactly as in production.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class FaultInjectingOutputCommitter implements OutputCommitter {

    private final OutputCommitter delegate;
    private volatile IOException commitFailure;

    public FaultInjectingOutputCommitter(OutputCommitter delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Makes every subsequent commit throw the given exception.
     */
    public void failCommitWith(IOException failure) {
        this.commitFailure = failure;
    }

    @Override
    public Path stage(SessionId sessionId) throws IOException {
        return delegate.stage(sessionId);
    }

    @Override
    public void writeArtifacts(Path directory, Keyword keyword, ArticleResult article, ResearchResult research)
        throws IOException {
        delegate.writeArtifacts(directory, keyword, article, research);
    }

    @Override
    public void commit(Path stagingDir, Path finalDir) throws IOException {
        IOException failure = commitFailure;
        if (failure != null) {
            throw failure;
        }
        delegate.commit(stagingDir, finalDir);
    }

    @Override
    public Path finalDirectoryFor(SessionId sessionId) {
        return delegate.finalDirectoryFor(sessionId);
    }

    @Override
    public Path writeDirect(SessionId sessionId, Keyword keyword, ArticleResult article, ResearchResult research)
        throws IOException {
        return delegate.writeDirect(sessionId, keyword, article, research);
    }

    @Override
    public boolean discard(Path stagingDir) {
        return delegate.discard(stagingDir);
    }
}
