package com.ryuqq.workflow.core.cache;

import com.ryuqq.workflow.core.context.WorkflowContext;

/**
 * 캐시 키 생성 함수.
 *
 * <p>같은 키는 같은 결과를 의미해야 합니다. 키 충돌 시 다른 입력의 결과가 반환될 수 있습니다.</p>
 *
 * @param <I> 입력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CacheKeyFunction<I> {

    /**
     * 입력과 Context로부터 캐시 키 생성.
     *
     * @param input 입력
     * @param context 실행 Context
     * @return 캐시 키 (null 불가)
     */
    String key(I input, WorkflowContext context);

    /**
     * 입력의 {@code String.valueOf}를 키로 사용하는 함수.
     *
     * @param <I> 입력 타입
     * @return CacheKeyFunction
     */
    static <I> CacheKeyFunction<I> byInput() {
        return (input, context) -> String.valueOf(input);
    }
}
