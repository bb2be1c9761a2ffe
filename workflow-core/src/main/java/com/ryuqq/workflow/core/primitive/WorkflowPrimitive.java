package com.ryuqq.workflow.core.primitive;

import com.ryuqq.workflow.core.composition.ParallelPrimitive;
import com.ryuqq.workflow.core.composition.SequentialPrimitive;
import com.ryuqq.workflow.core.context.WorkflowContext;

/**
 * Workflow를 구성하는 실행 단위.
 *
 * <p>모든 Primitive는 단 하나의 기능 {@code execute(input, context) -> output}만 노출합니다.
 * 실패는 예외를 던져 알리며, 던져진 예외의 타입과 메시지가 호출자가 보는 오류입니다.</p>
 *
 * <p><strong>조합:</strong></p>
 * <ul>
 *   <li>{@link #then(WorkflowPrimitive)}: 순차 실행 (this의 출력이 next의 입력)</li>
 *   <li>{@link #or(WorkflowPrimitive)}: 병렬 실행 (동일 입력, 선언 순서대로 결과 수집)</li>
 * </ul>
 *
 * <p>조합 연산자와 복구 데코레이터는 모두 이 인터페이스를 구현하는 final 클래스이며,
 * 내부 Primitive를 감싸는 방식(composition)으로만 동작합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * WorkflowPrimitive<String, String> workflow = parse
 *     .then(enrich)
 *     .then(new RetryPrimitive<>(store, new RetryStrategy()));
 *
 * String result = workflow.execute("input", WorkflowContext.create());
 * }</pre>
 *
 * <p><strong>동시성:</strong> 구현체는 여러 스레드에서 동시에 execute될 수 있어야 합니다
 * (Parallel branch, 동시 요청).</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public interface WorkflowPrimitive<I, O> {

    /**
     * Primitive 실행.
     *
     * @param input 입력
     * @param context 실행 Context (실행 트리 전체가 공유)
     * @return 출력
     * @throws Exception 실행 실패 시
     */
    O execute(I input, WorkflowContext context) throws Exception;

    /**
     * 로깅 / 추적용 이름.
     *
     * @return 기본값은 구현 클래스의 simple name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * 순차 조합: this 다음에 next 실행.
     *
     * <p>this 또는 next가 이미 Sequential이면 단계 목록을 평탄화합니다.</p>
     *
     * @param next 다음 단계
     * @param <R> 최종 출력 타입
     * @return 평탄화된 Sequential
     */
    default <R> SequentialPrimitive<I, R> then(WorkflowPrimitive<? super O, ? extends R> next) {
        return SequentialPrimitive.chain(this, next);
    }

    /**
     * 병렬 조합: this와 other를 동일 입력으로 동시 실행.
     *
     * <p><strong>평탄화 주의:</strong> this가 이미 {@link ParallelPrimitive}이면 {@code or}는 평탄화하지 않습니다.
     * 출력 타입이 {@code List<O>}인 Parallel이 하나의 branch가 되어 중첩 Parallel이 만들어집니다.
     * 기존 Parallel에 branch를 평탄하게 추가하려면 {@link ParallelPrimitive#with(WorkflowPrimitive)},
     * 두 Parallel을 합치려면 {@link ParallelPrimitive#with(ParallelPrimitive)}를 사용합니다.</p>
     *
     * @param other 함께 실행할 Primitive
     * @return 두 branch를 가진 Parallel
     */
    default ParallelPrimitive<I, O> or(WorkflowPrimitive<? super I, ? extends O> other) {
        return ParallelPrimitive.<I, O>of(this, other);
    }
}
