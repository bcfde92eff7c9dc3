package com.ryuqq.contentflow.testkit.contract;

import com.ryuqq.contentflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.contentflow.core.exception.WorkflowValidationException;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the end-to-end scenarios.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Single usable source → completes with a low-source warning</li>
 *   <li>Empty or overlong keyword → validation failure with zero I/O</li>
 *   <li>Commit failure → IOException propagates, staging kept, run rolled back</li>
 * </ul>
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
class ScenarioContractTest extends AbstractWorkflowContractTest {

    @Test
    void testSingleSource_CompletesWithLowSourceWarning() {
        // Given
        research = new StubResearchOperation(keyword -> Fixtures.research(keyword.getValue(), 1));
        WorkflowOrchestrator orchestrator = newOrchestrator();

        // When
        Path index = await(orchestrator.runFullWorkflow("diabetes management"));

        // Then
        assertCommitted(index);
        assertEquals(WorkflowState.COMPLETE, orchestrator.currentState());
        assertTrue(progress.anyMessageContains("Only 1 sources found"),
            "A low-source warning should be reported: " + progress.events());
        assertTrue(progress.hasPhase("complete"));
        assertEquals(List.of(), snapshotFiles(), "No snapshot should remain after COMPLETE");
        assertEquals(List.of(), stagingDirectories(), "No staging directory should remain after COMPLETE");
    }

    @Test
    void testEmptyKeyword_FailsWithoutAnyIO() {
        // Given
        WorkflowOrchestrator orchestrator = newOrchestrator();

        // When
        Throwable failure = awaitFailure(orchestrator.runFullWorkflow(""));

        // Then
        assertInstanceOf(WorkflowValidationException.class, failure);
        assertEquals("Keyword cannot be empty", failure.getMessage());
        assertEquals(List.of(), outputEntries(), "Validation failures must not touch the filesystem");
        assertEquals(0, research.invocationCount());
        assertEquals(0, writing.invocationCount());
    }

    @Test
    void testOverlongKeyword_FailsWithKeywordTooLong() {
        // Given
        WorkflowOrchestrator orchestrator = newOrchestrator();

        // When
        Throwable failure = awaitFailure(orchestrator.runFullWorkflow("a".repeat(201)));

        // Then
        assertInstanceOf(WorkflowValidationException.class, failure);
        assertTrue(failure.getMessage().startsWith("Keyword too long"), failure.getMessage());
        assertEquals(List.of(), outputEntries());
    }

    @Test
    void testMaximumLengthKeyword_Completes() {
        // Given
        WorkflowOrchestrator orchestrator = newOrchestrator();

        // When
        Path index = await(orchestrator.runFullWorkflow("a".repeat(200)));

        // Then
        assertCommitted(index);
    }

    @Test
    void testCommitFailure_PropagatesIOExceptionAndKeepsStaging() {
        // Given
        IOException diskFull = new IOException("No space left on device");
        committer.failCommitWith(diskFull);
        WorkflowOrchestrator orchestrator = newOrchestrator();

        // When
        Throwable failure = awaitFailure(orchestrator.runFullWorkflow("keto diet"));

        // Then
        assertSame(diskFull, failure, "The commit exception must propagate unmodified");
        assertEquals(WorkflowState.ROLLED_BACK, orchestrator.currentState());
        assertEquals("No space left on device", orchestrator.workflowData().error());
        assertTrue(progress.hasPhase("failed"), "FAILED should be reported before rollback");

        assertTrue(orchestrator.stagingDir().isPresent());
        assertTrue(Files.isDirectory(orchestrator.stagingDir().get()), "Staging directory is kept for inspection");
        assertEquals(List.of(), snapshotFiles(), "Snapshot is deleted on rollback");
        assertNoPartialOutput();
    }

    @Test
    void testWritingFailure_RollsBackWithoutLeftovers() {
        // Given
        IllegalStateException writerDown = new IllegalStateException("model overloaded");
        writing.failNext(writerDown);
        WorkflowOrchestrator orchestrator = newOrchestrator();

        // When
        Throwable failure = awaitFailure(orchestrator.runFullWorkflow("intermittent fasting"));

        // Then
        assertSame(writerDown, failure);
        assertEquals(WorkflowState.ROLLED_BACK, orchestrator.currentState());
        assertEquals(List.of(), outputEntries(), "Neither snapshot nor staging directory remains after ROLLED_BACK");
    }

    @Test
    void testTransientResearchFailures_RetriedWithinBound() {
        // Given
        research.failTransiently(2);
        WorkflowOrchestrator orchestrator = newOrchestrator();

        // When
        Path index = await(orchestrator.runFullWorkflow("sleep hygiene"));

        // Then
        assertCommitted(index);
        assertEquals(3, research.invocationCount());
        assertEquals(1, writing.invocationCount());
    }
}
