/**
 * Recovery state machine package.
 *
 * <p>Retry, Timeout, Fallback and Saga share one lifecycle per execution.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.statemachine.RecoveryState} - recovery lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.workflow.core.statemachine.RecoveryTransition} - transition validation</li>
 *   <li>{@link com.ryuqq.workflow.core.statemachine.RecoveryTracker} - per-execution state holder</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * RUNNING → SUCCEEDED
 * RUNNING → FAILED_RECOVERABLE → RUNNING (retry / fallback / compensation)
 * RUNNING → FAILED_TERMINAL
 * FAILED_RECOVERABLE → FAILED_TERMINAL
 *
 * Forbidden:
 * - SUCCEEDED → * (terminal state)
 * - FAILED_TERMINAL → * (terminal state)
 * </pre>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.statemachine;
