package com.ryuqq.workflow.core.primitive;

import com.ryuqq.workflow.core.context.WorkflowContext;

/**
 * {@link LambdaPrimitive}가 감싸는 함수.
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PrimitiveFunction<I, O> {

    O apply(I input, WorkflowContext context) throws Exception;
}
