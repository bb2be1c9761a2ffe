package com.ryuqq.workflow.core.exception;

import java.util.concurrent.ExecutionException;

/**
 * 스레드 경계를 넘어온 실패를 원래 형태로 복원하는 유틸리티.
 *
 * <p>Parallel / Timeout은 내부 Primitive를 다른 스레드에서 실행하므로
 * 실패가 {@link ExecutionException}으로 감싸져 돌아옵니다.
 * 호출자가 원래 예외 타입으로 처리할 수 있도록 cause를 꺼내 그대로 반환합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class Failures {

    // Utility class - prevent instantiation
    private Failures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * ExecutionException에서 원래 예외 추출.
     *
     * <p>cause가 {@link Error}이면 그대로 던집니다. cause가 없으면 ExecutionException 자체를 반환합니다.</p>
     *
     * @param e 감싸진 실패
     * @return 원래 예외
     */
    public static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        return e;
    }
}
