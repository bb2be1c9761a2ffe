package com.ryuqq.workflow.core.recovery;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import com.ryuqq.workflow.core.statemachine.RecoveryTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실패 시 재시도하는 데코레이터.
 *
 * <p>내부 Primitive가 실패하면 {@link RetryStrategy}에 따라 최대 maxRetries번 추가로 시도합니다
 * (총 시도 = maxRetries + 1). 시도는 엄격히 순차적이며, 시도 사이에는 호출 스레드만 backoff 동안 대기합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * attempt = 1
 * loop:
 *   inner.execute()
 *     ├─ 성공 → SUCCEEDED, 결과 반환
 *     └─ 실패
 *         ├─ 재시도 가능 (attempt ≤ maxRetries, retryOn 통과)
 *         │    → FAILED_RECOVERABLE → sleep(backoff) → RUNNING → attempt++
 *         └─ 재시도 불가 → FAILED_TERMINAL → 마지막 예외 그대로 재던짐
 * </pre>
 *
 * <p><strong>오류 보존:</strong> 재시도 소진 시 별도의 "exhausted" 예외를 만들지 않고
 * 마지막 실패 예외 인스턴스를 그대로 던집니다. 호출자의 타입 기반 오류 처리가 그대로 동작합니다.</p>
 *
 * <p>backoff 대기 중 인터럽트되면 인터럽트 플래그를 복원하고 마지막 실패를 던집니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class RetryPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    /**
     * 실행 통계가 누적되는 state 키.
     */
    public static final String STATISTICS_KEY = "retry_statistics";

    private static final Logger log = LoggerFactory.getLogger(RetryPrimitive.class);

    private final WorkflowPrimitive<I, O> inner;
    private final RetryStrategy strategy;

    /**
     * 생성자 (기본 전략 사용).
     *
     * @param inner 재시도할 Primitive
     * @throws IllegalArgumentException inner가 null인 경우
     */
    public RetryPrimitive(WorkflowPrimitive<I, O> inner) {
        this(inner, new RetryStrategy());
    }

    /**
     * 생성자.
     *
     * @param inner 재시도할 Primitive
     * @param strategy 재시도 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryPrimitive(WorkflowPrimitive<I, O> inner, RetryStrategy strategy) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        this.inner = inner;
        this.strategy = strategy;
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        RecoveryTracker tracker = RecoveryTracker.start(name());
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                O result = inner.execute(input, context);
                tracker.succeeded();
                recordStatistics(context, attempt, null);
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}/{}", inner.name(), attempt, strategy.maxRetries() + 1);
                }
                return result;
            } catch (Exception e) {
                if (attempt > strategy.maxRetries() || !strategy.shouldRetry(e)) {
                    tracker.terminal();
                    recordStatistics(context, attempt, e);
                    if (attempt > 1) {
                        log.warn("{} failed after {} attempts: {}", inner.name(), attempt, e.toString());
                    }
                    throw e;
                }

                tracker.recoverable();
                long delayMs = strategy.calculateDelay(attempt);
                log.warn("{} attempt {}/{} failed, retrying in {} ms: {}",
                    inner.name(), attempt, strategy.maxRetries() + 1, delayMs, e.toString());

                if (!backoff(delayMs)) {
                    tracker.terminal();
                    recordStatistics(context, attempt, e);
                    throw e;
                }
                tracker.resume();
            }
        }
    }

    @Override
    public String name() {
        return "RetryPrimitive(" + inner.name() + ")";
    }

    public WorkflowPrimitive<I, O> getInner() {
        return inner;
    }

    public RetryStrategy getStrategy() {
        return strategy;
    }

    private void recordStatistics(WorkflowContext context, int attempts, Exception failure) {
        String errorType = failure == null ? null : failure.getClass().getSimpleName();
        context.appendState(STATISTICS_KEY, new RetryStatistics(inner.name(), attempts, failure == null, errorType));
    }

    /**
     * Backoff 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @return 끝까지 대기했으면 true, 인터럽트되었으면 false (플래그 복원됨)
     */
    private boolean backoff(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} backoff interrupted, giving up", inner.name());
            return false;
        }
    }
}
