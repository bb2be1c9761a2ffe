package com.ryuqq.workflow.core.recovery;

import com.ryuqq.workflow.core.concurrent.WorkflowExecutors;
import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.exception.Failures;
import com.ryuqq.workflow.core.exception.PrimitiveConfigurationException;
import com.ryuqq.workflow.core.exception.PrimitiveTimeoutException;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import com.ryuqq.workflow.core.statemachine.RecoveryTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 실행 시간 제한 데코레이터.
 *
 * <p>내부 Primitive를 실행기에서 실행하고 {@code Future.get(timeout)}으로 최대 timeout 동안 기다립니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * future = executor.submit(inner)
 *   ↓
 * future.get(timeout)
 *   ├─ 제한 시간 내 성공 → 결과 반환
 *   ├─ 제한 시간 내 실패 → 해당 예외 그대로 전파 (fallback 없음)
 *   └─ 타임아웃
 *        → future.cancel(true) (best-effort)
 *        → (추적 활성 시) timeout_history 추가, timeout_count 증가
 *        ├─ fallback 있음 → fallback.execute(동일 input, 동일 context)
 *        └─ fallback 없음 → PrimitiveTimeoutException
 * </pre>
 *
 * <p><strong>취소 한계:</strong> 취소는 interrupt 전달일 뿐이므로 interrupt에 반응하지 않는
 * 내부 작업은 계속 실행될 수 있습니다. 그 작업이 Context에 쓰는 값은 그대로 남습니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class TimeoutPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    /**
     * 타임아웃 기록 목록 state 키.
     */
    public static final String HISTORY_KEY = "timeout_history";

    /**
     * 타임아웃 횟수 state 키.
     */
    public static final String COUNT_KEY = "timeout_count";

    private static final Logger log = LoggerFactory.getLogger(TimeoutPrimitive.class);

    private final WorkflowPrimitive<I, O> inner;
    private final Duration timeout;
    private final WorkflowPrimitive<I, O> fallback;
    private final boolean trackTimeouts;
    private final ExecutorService executor;

    public TimeoutPrimitive(WorkflowPrimitive<I, O> inner, Duration timeout) {
        this(inner, timeout, null, true, WorkflowExecutors.shared());
    }

    public TimeoutPrimitive(WorkflowPrimitive<I, O> inner, Duration timeout, WorkflowPrimitive<I, O> fallback) {
        this(inner, timeout, fallback, true, WorkflowExecutors.shared());
    }

    public TimeoutPrimitive(
        WorkflowPrimitive<I, O> inner,
        Duration timeout,
        WorkflowPrimitive<I, O> fallback,
        boolean trackTimeouts
    ) {
        this(inner, timeout, fallback, trackTimeouts, WorkflowExecutors.shared());
    }

    /**
     * 생성자.
     *
     * @param inner 제한할 Primitive
     * @param timeout 제한 시간 (양수)
     * @param fallback 타임아웃 시 실행할 Primitive (nullable)
     * @param trackTimeouts 타임아웃 기록을 Context state에 남길지 여부
     * @param executor 내부 Primitive 실행기
     * @throws IllegalArgumentException inner 또는 executor가 null인 경우
     * @throws PrimitiveConfigurationException timeout이 null이거나 양수가 아닌 경우
     */
    public TimeoutPrimitive(
        WorkflowPrimitive<I, O> inner,
        Duration timeout,
        WorkflowPrimitive<I, O> fallback,
        boolean trackTimeouts,
        ExecutorService executor
    ) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new PrimitiveConfigurationException(
                "timeout must be positive (current: " + timeout + ")"
            );
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.inner = inner;
        this.timeout = timeout;
        this.fallback = fallback;
        this.trackTimeouts = trackTimeouts;
        this.executor = executor;
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        RecoveryTracker tracker = RecoveryTracker.start(name());
        Future<O> future = executor.submit(() -> inner.execute(input, context));

        try {
            O result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            tracker.succeeded();
            return result;
        } catch (ExecutionException e) {
            tracker.terminal();
            throw Failures.unwrap(e);
        } catch (InterruptedException e) {
            future.cancel(true);
            tracker.terminal();
            Thread.currentThread().interrupt();
            throw e;
        } catch (TimeoutException e) {
            future.cancel(true);
            if (trackTimeouts) {
                context.appendState(HISTORY_KEY, new TimeoutRecord(inner.name(), timeout, fallback != null));
                context.incrementState(COUNT_KEY);
            }

            if (fallback == null) {
                tracker.terminal();
                throw new PrimitiveTimeoutException(inner.name(), timeout);
            }

            tracker.recoverable();
            log.warn("{} exceeded {} ms, running fallback {}", inner.name(), timeout.toMillis(), fallback.name());
            tracker.resume();
            try {
                O result = fallback.execute(input, context);
                tracker.succeeded();
                return result;
            } catch (Exception fallbackFailure) {
                tracker.terminal();
                throw fallbackFailure;
            }
        }
    }

    @Override
    public String name() {
        return "TimeoutPrimitive(" + inner.name() + ")";
    }

    public WorkflowPrimitive<I, O> getInner() {
        return inner;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Optional<WorkflowPrimitive<I, O>> getFallback() {
        return Optional.ofNullable(fallback);
    }

    public boolean isTrackTimeouts() {
        return trackTimeouts;
    }
}
