/**
 * Recovery decorators.
 *
 * <p>Each decorator wraps one inner primitive and implements {@code WorkflowPrimitive} itself,
 * so it can be composed like any other primitive.</p>
 *
 * <h2>Decorators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.recovery.RetryPrimitive}: re-runs on failure per {@link com.ryuqq.workflow.core.recovery.RetryStrategy}</li>
 *   <li>{@link com.ryuqq.workflow.core.recovery.TimeoutPrimitive}: bounds execution time, optional fallback</li>
 *   <li>{@link com.ryuqq.workflow.core.recovery.FallbackPrimitive}: alternate path on failure</li>
 *   <li>{@link com.ryuqq.workflow.core.recovery.SagaPrimitive}: forward plus compensating action</li>
 * </ul>
 *
 * <h2>Error identity</h2>
 * <p>Failures reach the caller as the same exception instance the inner primitive threw.
 * Only {@code TimeoutPrimitive} without a fallback introduces its own exception type.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.recovery;
