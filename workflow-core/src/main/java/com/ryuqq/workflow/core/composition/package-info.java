/**
 * Composition operators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.composition.SequentialPrimitive} - output of stage i feeds stage i+1</li>
 *   <li>{@link com.ryuqq.workflow.core.composition.ParallelPrimitive} - identical input to every branch, results in declaration order</li>
 * </ul>
 *
 * <p>Neither operator catches: the first failure propagates unmodified. Both flatten nested
 * composites of the same kind.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.composition;
