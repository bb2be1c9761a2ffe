package com.ryuqq.workflow.core.recovery;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import com.ryuqq.workflow.core.statemachine.RecoveryTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 보상 트랜잭션 데코레이터 (로컬, best-effort).
 *
 * <p>forward를 실행하고, 실패하면 동일한 입력과 Context로 compensation을 실행한 뒤
 * <strong>항상 forward의 원래 예외</strong>를 전파합니다. Saga는 결과를 복구하지 않고 부수효과만 되돌립니다.</p>
 *
 * <p><strong>Checkpoint 기록 순서:</strong></p>
 * <pre>
 * saga.start → saga.forward.start → saga.forward.end → saga.end                   (성공)
 * saga.start → saga.forward.start → saga.compensation.start
 *            → saga.compensation.end → saga.end                                   (실패)
 * </pre>
 *
 * <p>compensation 실패는 ERROR로 로그만 남깁니다.
 * forward 예외 객체는 변경 없이 그대로 전파되며, compensation 예외가 이를 대체하는 일은 없습니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class SagaPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(SagaPrimitive.class);

    private final WorkflowPrimitive<I, O> forward;
    private final WorkflowPrimitive<? super I, ?> compensation;

    /**
     * 생성자.
     *
     * @param forward 정방향 Primitive
     * @param compensation 보상 Primitive (결과는 사용되지 않음)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SagaPrimitive(WorkflowPrimitive<I, O> forward, WorkflowPrimitive<? super I, ?> compensation) {
        if (forward == null) {
            throw new IllegalArgumentException("forward cannot be null");
        }
        if (compensation == null) {
            throw new IllegalArgumentException("compensation cannot be null");
        }
        this.forward = forward;
        this.compensation = compensation;
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        RecoveryTracker tracker = RecoveryTracker.start(name());
        context.checkpoint("saga.start");
        context.checkpoint("saga.forward.start");

        O result;
        try {
            result = forward.execute(input, context);
        } catch (Exception forwardFailure) {
            tracker.recoverable();
            compensate(input, context, forwardFailure);
            tracker.terminal();
            context.checkpoint("saga.end");
            throw forwardFailure;
        }

        context.checkpoint("saga.forward.end");
        tracker.succeeded();
        context.checkpoint("saga.end");
        return result;
    }

    private void compensate(I input, WorkflowContext context, Exception forwardFailure) {
        log.warn("{} failed, running compensation {}: {}", forward.name(), compensation.name(), forwardFailure.toString());
        context.checkpoint("saga.compensation.start");
        try {
            compensation.execute(input, context);
        } catch (Exception compensationFailure) {
            if (compensationFailure instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Compensation {} failed for {}", compensation.name(), forward.name(), compensationFailure);
        } finally {
            context.checkpoint("saga.compensation.end");
        }
    }

    @Override
    public String name() {
        return "SagaPrimitive(" + forward.name() + ")";
    }

    public WorkflowPrimitive<I, O> getForward() {
        return forward;
    }

    public WorkflowPrimitive<? super I, ?> getCompensation() {
        return compensation;
    }
}
