package com.ryuqq.workflow.core.spi.noop;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.spi.ExecutionListener;
import com.ryuqq.workflow.core.spi.ExecutionObservation;

/**
 * Execution Listener NoOp 구현.
 *
 * <p>실행을 관찰하지 않습니다.
 * 관측 기능 없이 Primitive를 감쌀 때 기본값으로 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>start(): 항상 {@link ExecutionObservation#NOOP} 반환</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class NoOpExecutionListener implements ExecutionListener {

    @Override
    public ExecutionObservation start(String primitiveName, WorkflowContext context) {
        return ExecutionObservation.NOOP;
    }
}
