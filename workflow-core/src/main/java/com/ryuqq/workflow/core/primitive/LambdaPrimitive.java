package com.ryuqq.workflow.core.primitive;

import com.ryuqq.workflow.core.context.WorkflowContext;

import java.util.function.Function;

/**
 * 일반 함수를 감싸는 Primitive.
 *
 * <p>간단한 변환이나 어댑터를 Workflow에 끼워 넣을 때 사용합니다.</p>
 *
 * <pre>{@code
 * WorkflowPrimitive<String, String> upper = LambdaPrimitive.of("upper", (input, ctx) -> input.toUpperCase());
 * WorkflowPrimitive<String, Integer> length = LambdaPrimitive.map(String::length);
 * }</pre>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class LambdaPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    private final String name;
    private final PrimitiveFunction<I, O> function;

    /**
     * 생성자.
     *
     * @param name 이름 (로깅 / 추적용)
     * @param function 실행할 함수
     * @throws IllegalArgumentException name이 비어 있거나 function이 null인 경우
     */
    public LambdaPrimitive(String name, PrimitiveFunction<I, O> function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        this.name = name;
        this.function = function;
    }

    public static <I, O> LambdaPrimitive<I, O> of(PrimitiveFunction<I, O> function) {
        return new LambdaPrimitive<>("LambdaPrimitive", function);
    }

    public static <I, O> LambdaPrimitive<I, O> of(String name, PrimitiveFunction<I, O> function) {
        return new LambdaPrimitive<>(name, function);
    }

    /**
     * Context를 사용하지 않는 함수로 생성.
     *
     * @param function 입력 → 출력
     * @return LambdaPrimitive
     */
    public static <I, O> LambdaPrimitive<I, O> map(Function<I, O> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        return new LambdaPrimitive<>("LambdaPrimitive", (input, context) -> function.apply(input));
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        return function.apply(input, context);
    }

    @Override
    public String name() {
        return name;
    }
}
