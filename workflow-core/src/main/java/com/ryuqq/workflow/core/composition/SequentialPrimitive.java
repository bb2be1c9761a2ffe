package com.ryuqq.workflow.core.composition;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.exception.PrimitiveConfigurationException;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 순차 조합 Primitive.
 *
 * <p>단계 i의 출력을 단계 i+1의 입력으로 전달하며, 모든 단계에 같은 Context를 사용합니다.</p>
 *
 * <p><strong>실패 규칙:</strong></p>
 * <ul>
 *   <li>처음 실패한 단계에서 즉시 중단, 이후 단계는 실행되지 않음</li>
 *   <li>실패는 가공 없이 그대로 호출자에게 전파 (catch 하지 않음)</li>
 * </ul>
 *
 * <p><strong>평탄화:</strong> Sequential끼리 또는 Sequential과 다른 Primitive를 조합하면
 * 중첩 래퍼가 아닌 하나의 평탄한 단계 목록이 만들어집니다.</p>
 * <pre>
 * (a.then(b)).then(c)  → Sequential[a, b, c]
 * a.then(b.then(c))    → Sequential[a, b, c]
 * </pre>
 *
 * <p>단계 간 입출력 타입은 {@link WorkflowPrimitive#then(WorkflowPrimitive)}에서 컴파일 타임에 검증되며,
 * 내부 목록은 타입이 지워진 형태로 보관됩니다.</p>
 *
 * @param <I> 첫 단계 입력 타입
 * @param <O> 마지막 단계 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class SequentialPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    private final List<WorkflowPrimitive<Object, Object>> stages;

    private SequentialPrimitive(List<WorkflowPrimitive<Object, Object>> stages) {
        this.stages = Collections.unmodifiableList(stages);
    }

    /**
     * 단계 목록으로 생성 (Sequential 단계는 평탄화).
     *
     * <p>단계 간 타입 호환성은 호출자가 보장해야 합니다.</p>
     *
     * @param stages 단계 목록 (비어 있으면 안 됨)
     * @return Sequential
     * @throws PrimitiveConfigurationException 목록이 null이거나 비어 있는 경우
     * @throws IllegalArgumentException 목록에 null 단계가 있는 경우
     */
    public static <I, O> SequentialPrimitive<I, O> of(List<? extends WorkflowPrimitive<?, ?>> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new PrimitiveConfigurationException("SequentialPrimitive requires at least one stage");
        }
        List<WorkflowPrimitive<Object, Object>> flattened = new ArrayList<>();
        for (WorkflowPrimitive<?, ?> stage : stages) {
            appendFlattened(flattened, stage);
        }
        return new SequentialPrimitive<>(flattened);
    }

    public static <I, O> SequentialPrimitive<I, O> of(WorkflowPrimitive<?, ?>... stages) {
        if (stages == null) {
            throw new PrimitiveConfigurationException("SequentialPrimitive requires at least one stage");
        }
        return of(Arrays.asList(stages));
    }

    /**
     * 두 Primitive를 타입 안전하게 연결.
     *
     * @param first 첫 단계
     * @param second 다음 단계
     * @return 평탄화된 Sequential
     */
    public static <I, M, O> SequentialPrimitive<I, O> chain(WorkflowPrimitive<I, M> first,
                                                           WorkflowPrimitive<? super M, ? extends O> second) {
        return of(Arrays.asList(first, second));
    }

    @Override
    @SuppressWarnings("unchecked")
    public O execute(I input, WorkflowContext context) throws Exception {
        Object current = input;
        for (WorkflowPrimitive<Object, Object> stage : stages) {
            current = stage.execute(current, context);
        }
        return (O) current;
    }

    /**
     * 평탄화된 단계 목록 조회.
     *
     * @return 읽기 전용 단계 목록
     */
    public List<WorkflowPrimitive<Object, Object>> getStages() {
        return stages;
    }

    public int size() {
        return stages.size();
    }

    @SuppressWarnings("unchecked")
    private static void appendFlattened(List<WorkflowPrimitive<Object, Object>> target, WorkflowPrimitive<?, ?> stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (stage instanceof SequentialPrimitive<?, ?> sequential) {
            target.addAll(sequential.stages);
            return;
        }
        target.add((WorkflowPrimitive<Object, Object>) stage);
    }
}
