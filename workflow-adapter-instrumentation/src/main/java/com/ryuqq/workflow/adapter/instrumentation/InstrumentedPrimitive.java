package com.ryuqq.workflow.adapter.instrumentation;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import com.ryuqq.workflow.core.spi.ExecutionListener;
import com.ryuqq.workflow.core.spi.ExecutionObservation;
import com.ryuqq.workflow.core.spi.noop.NoOpExecutionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 실행 관찰 데코레이터.
 *
 * <p>내부 Primitive의 입출력과 실패를 바꾸지 않고, 실행마다 {@link ExecutionListener}에 시작과 결과를 통지합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * observation = listener.start(name, context)
 *   ↓
 * inner.execute(input, context)
 *   ├─ 성공 → observation.success(elapsed) → 결과 반환
 *   └─ 실패 → observation.failure(error, elapsed) → 동일 예외 재던짐
 * </pre>
 *
 * <p>Listener가 던진 예외는 WARN으로 로그하고 실행 결과에 반영하지 않습니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class InstrumentedPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(InstrumentedPrimitive.class);

    private final WorkflowPrimitive<I, O> inner;
    private final ExecutionListener listener;

    public InstrumentedPrimitive(WorkflowPrimitive<I, O> inner) {
        this(inner, new NoOpExecutionListener());
    }

    /**
     * 생성자.
     *
     * @param inner 관찰할 Primitive
     * @param listener 실행 Listener
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InstrumentedPrimitive(WorkflowPrimitive<I, O> inner, ExecutionListener listener) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.inner = inner;
        this.listener = listener;
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        ExecutionObservation observation = start(context);
        long startNanos = System.nanoTime();
        try {
            O result = inner.execute(input, context);
            notifySuccess(observation, Duration.ofNanos(System.nanoTime() - startNanos));
            return result;
        } catch (Exception | Error e) {
            notifyFailure(observation, e, Duration.ofNanos(System.nanoTime() - startNanos));
            throw e;
        }
    }

    private ExecutionObservation start(WorkflowContext context) {
        try {
            ExecutionObservation observation = listener.start(inner.name(), context);
            return observation != null ? observation : ExecutionObservation.NOOP;
        } catch (RuntimeException e) {
            log.warn("Listener start failed for {}: {}", inner.name(), e.toString());
            return ExecutionObservation.NOOP;
        }
    }

    private void notifySuccess(ExecutionObservation observation, Duration elapsed) {
        try {
            observation.success(elapsed);
        } catch (RuntimeException e) {
            log.warn("Listener success callback failed for {}: {}", inner.name(), e.toString());
        }
    }

    private void notifyFailure(ExecutionObservation observation, Throwable error, Duration elapsed) {
        try {
            observation.failure(error, elapsed);
        } catch (RuntimeException e) {
            log.warn("Listener failure callback failed for {}: {}", inner.name(), e.toString());
        }
    }

    /**
     * 내부 Primitive의 이름을 그대로 사용합니다.
     */
    @Override
    public String name() {
        return inner.name();
    }

    public WorkflowPrimitive<I, O> getInner() {
        return inner;
    }

    public ExecutionListener getListener() {
        return listener;
    }
}
