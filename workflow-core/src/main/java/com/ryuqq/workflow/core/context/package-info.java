/**
 * Workflow execution context.
 *
 * <p>{@link com.ryuqq.workflow.core.context.WorkflowContext} is created once per top-level request
 * and shared by reference through the whole primitive graph, parallel branches included.
 * Its mutable collections are concurrent containers.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.context;
