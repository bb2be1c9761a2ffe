package com.ryuqq.workflow.core.recovery;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import com.ryuqq.workflow.core.statemachine.RecoveryTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 대체 경로 데코레이터.
 *
 * <p>primary를 먼저 실행하고, 실패하면 동일한 입력과 Context로 fallback을 실행합니다.</p>
 *
 * <p>fallback까지 실패하면 호출자는 fallback의 예외를 받습니다.
 * primary의 예외는 WARN 로그로만 남으며, 전파되는 예외 객체는 변경하지 않습니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class FallbackPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(FallbackPrimitive.class);

    private final WorkflowPrimitive<I, O> primary;
    private final WorkflowPrimitive<I, O> fallback;

    /**
     * 생성자.
     *
     * @param primary 우선 실행할 Primitive
     * @param fallback primary 실패 시 실행할 Primitive
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FallbackPrimitive(WorkflowPrimitive<I, O> primary, WorkflowPrimitive<I, O> fallback) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        RecoveryTracker tracker = RecoveryTracker.start(name());
        try {
            O result = primary.execute(input, context);
            tracker.succeeded();
            return result;
        } catch (Exception primaryFailure) {
            tracker.recoverable();
            log.warn("{} failed, falling back to {}: {}", primary.name(), fallback.name(), primaryFailure.toString());
            tracker.resume();
            try {
                O result = fallback.execute(input, context);
                tracker.succeeded();
                return result;
            } catch (Exception fallbackFailure) {
                tracker.terminal();
                log.warn("{} also failed after {} failed", fallback.name(), primary.name(), primaryFailure);
                throw fallbackFailure;
            }
        }
    }

    @Override
    public String name() {
        return "FallbackPrimitive(" + primary.name() + ")";
    }

    public WorkflowPrimitive<I, O> getPrimary() {
        return primary;
    }

    public WorkflowPrimitive<I, O> getFallback() {
        return fallback;
    }
}
