package com.ryuqq.contentflow.testkit.contract;

import com.ryuqq.contentflow.core.exception.TransientOperationException;
import com.ryuqq.contentflow.core.model.Keyword;
import com.ryuqq.contentflow.core.model.ResearchResult;
import com.ryuqq.contentflow.core.spi.ResearchOperation;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scriptable ResearchOperation for contract tests.
 *
 * <p>Scripted responses (transient failures, held futures) are consumed in order;
 * once the script is empty every call answers with the responder.</p>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class StubResearchOperation implements ResearchOperation {

    private final Function<Keyword, ResearchResult> responder;
    private final Queue<Function<Keyword, CompletionStage<ResearchResult>>> script = new ConcurrentLinkedQueue<>();
    private final List<Keyword> invocations = new CopyOnWriteArrayList<>();

    /**
     * Creates a stub answering with {@link Fixtures#research(Keyword)}.
     */
    public StubResearchOperation() {
        this(Fixtures::research);
    }

    public StubResearchOperation(Function<Keyword, ResearchResult> responder) {
        if (responder == null) {
            throw new IllegalArgumentException("responder cannot be null");
        }
        this.responder = responder;
    }

    /**
     * Makes the next {@code times} calls fail with a TransientOperationException.
     */
    public StubResearchOperation failTransiently(int times) {
        for (int i = 0; i < times; i++) {
            int attempt = i + 1;
            script.add(keyword -> CompletableFuture.failedFuture(
                new TransientOperationException("Search API unavailable (attempt " + attempt + ")")));
        }
        return this;
    }

    /**
     * Makes the next call return the given future, which the test completes later.
     */
    public StubResearchOperation hold(CompletableFuture<ResearchResult> pending) {
        script.add(keyword -> pending);
        return this;
    }

    @Override
    public CompletionStage<ResearchResult> research(Keyword keyword) {
        invocations.add(keyword);
        Function<Keyword, CompletionStage<ResearchResult>> scripted = script.poll();
        if (scripted != null) {
            return scripted.apply(keyword);
        }
        return CompletableFuture.completedFuture(responder.apply(keyword));
    }

    public int invocationCount() {
        return invocations.size();
    }

    public List<Keyword> invocations() {
        return List.copyOf(invocations);
    }
}
