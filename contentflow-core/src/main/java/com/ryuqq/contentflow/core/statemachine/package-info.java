/**
 * Workflow state machine package.
 *
 * <p>This package implements the transition rules of the three-phase pipeline
 * (research, write, save), ensuring monotonic progress through strict invariants.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.core.statemachine.WorkflowState} - Workflow lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.contentflow.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * INITIALIZED → RESEARCHING → RESEARCH_COMPLETE → WRITING → WRITING_COMPLETE → SAVING → COMPLETE
 * (any non-terminal) → FAILED → ROLLED_BACK
 *
 * Forbidden:
 * - COMPLETE → * (terminal state)
 * - ROLLED_BACK → * (terminal state)
 * - Skipped phases (e.g., RESEARCHING → WRITING)
 * - Backward transitions (e.g., SAVING → WRITING)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * WorkflowState state = WorkflowState.INITIALIZED;
 * state = StateTransition.transition(state, WorkflowState.RESEARCHING);
 * state = StateTransition.transition(state, WorkflowState.RESEARCH_COMPLETE);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, WorkflowState.SAVING);
 * </pre>
 *
 * @since 1.0.0
 * @author Contentflow Team
 */
package com.ryuqq.contentflow.core.statemachine;
