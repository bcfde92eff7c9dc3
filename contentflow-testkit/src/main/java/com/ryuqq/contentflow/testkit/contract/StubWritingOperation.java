package com.ryuqq.contentflow.testkit.contract;

import com.ryuqq.contentflow.core.model.ArticleResult;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.spi.WritingOperation;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * Scriptable WritingOperation for contract tests.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class StubWritingOperation implements WritingOperation {

    private final BiFunction<Keyword, ResearchResult, ArticleResult> responder;
    private final List<Keyword> invocations = new CopyOnWriteArrayList<>();
    private volatile RuntimeException nextFailure;

    /**
     * Creates a stub answering with {@link Fixtures#article(Keyword, ResearchResult)}.
     */
    public StubWritingOperation() {
        this(Fixtures::article);
    }

    public StubWritingOperation(BiFunction<Keyword, ResearchResult, ArticleResult> responder) {
        if (responder == null) {
            throw new IllegalArgumentException("responder cannot be null");
        }
        this.responder = responder;
    }

    /**
     * Makes the next call fail with the given exception.
     */
    public StubWritingOperation failNext(RuntimeException failure) {
        this.nextFailure = failure;
        return this;
    }

    @Override
    public CompletionStage<ArticleResult> write(Keyword keyword, ResearchResult research) {
        invocations.add(keyword);
        RuntimeException failure = nextFailure;
        if (failure != null) {
            nextFailure = null;
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture(responder.apply(keyword, research));
    }

    public int invocationCount() {
        return invocations.size();
    }
}
