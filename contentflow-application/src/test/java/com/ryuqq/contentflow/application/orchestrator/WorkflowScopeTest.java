package com.ryuqq.contentflow.application.orchestrator;

import com.ryuqq.contentflow.core.cleanup.CleanupReport;
import com.ryuqq.contentflow.core.statemachine.WorkflowState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * WorkflowScope 유닛 테스트.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkflowScopeTest {

    @Mock
    private WorkflowOrchestrator orchestrator;

    @Test
    void close_COMPLETE_상태면_정리하지_않음() {
        // given
        when(orchestrator.currentState()).thenReturn(WorkflowState.COMPLETE);

        // when
        try (WorkflowScope scope = new WorkflowScope(orchestrator)) {
            assertThat(scope.orchestrator()).isSameAs(orchestrator);
        }

        // then
        verify(orchestrator, never()).releaseIncomplete();
    }

    @Test
    void close_미완료_상태면_releaseIncomplete_호출() {
        // given
        CleanupReport report = new CleanupReport(1, 1, List.of());
        when(orchestrator.currentState()).thenReturn(WorkflowState.WRITING);
        when(orchestrator.releaseIncomplete()).thenReturn(report);
        WorkflowScope scope = new WorkflowScope(orchestrator);

        // when
        scope.close();

        // then
        verify(orchestrator).releaseIncomplete();
        assertThat(scope.lastReport()).isEqualTo(report);
    }

    @Test
    void close_정리_실패가_보고돼도_예외_없음() {
        // given
        when(orchestrator.currentState()).thenReturn(WorkflowState.SAVING);
        when(orchestrator.releaseIncomplete())
            .thenReturn(new CleanupReport(0, 0, List.of(Path.of("/out/.temp_x"))));
        WorkflowScope scope = new WorkflowScope(orchestrator);

        // when & then
        assertThatCode(scope::close).doesNotThrowAnyException();
        assertThat(scope.lastReport().hasFailures()).isTrue();
    }

    @Test
    void close_releaseIncomplete가_예외를_던져도_전파하지_않음() {
        // given
        when(orchestrator.currentState()).thenReturn(WorkflowState.RESEARCHING);
        when(orchestrator.releaseIncomplete()).thenThrow(new IllegalStateException("boom"));
        WorkflowScope scope = new WorkflowScope(orchestrator);

        // when & then
        assertThatCode(scope::close).doesNotThrowAnyException();
    }

    @Test
    void close_두번_호출해도_한번만_정리() {
        // given
        when(orchestrator.currentState()).thenReturn(WorkflowState.FAILED);
        when(orchestrator.releaseIncomplete()).thenReturn(CleanupReport.empty());
        WorkflowScope scope = new WorkflowScope(orchestrator);

        // when
        scope.close();
        scope.close();

        // then
        verify(orchestrator, times(1)).releaseIncomplete();
    }

    @Test
    void constructor_null_orchestrator_예외() {
        assertThatThrownBy(() -> new WorkflowScope(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("orchestrator cannot be null");
    }
}
