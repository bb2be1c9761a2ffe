/**
 * The primitive contract.
 *
 * <p>{@link com.ryuqq.workflow.core.primitive.WorkflowPrimitive} is the single capability every
 * building block exposes. Composition and recovery live in sibling packages and only wrap
 * other primitives.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.primitive;
