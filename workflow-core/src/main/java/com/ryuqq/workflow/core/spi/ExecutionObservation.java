package com.ryuqq.workflow.core.spi;

import java.time.Duration;

/**
 * 단일 Primitive 실행의 관찰 핸들.
 *
 * <p>{@link ExecutionListener#start}가 반환하며, 실행이 끝나면 {@link #success} 또는
 * {@link #failure} 중 정확히 하나가 한 번 호출됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface ExecutionObservation {

    /**
     * 아무 동작도 하지 않는 관찰 객체.
     */
    ExecutionObservation NOOP = new ExecutionObservation() {
        @Override
        public void success(Duration elapsed) {
            // NoOp
        }

        @Override
        public void failure(Throwable error, Duration elapsed) {
            // NoOp
        }
    };

    /**
     * 실행 성공 통지.
     *
     * @param elapsed 실행 소요 시간
     */
    void success(Duration elapsed);

    /**
     * 실행 실패 통지.
     *
     * @param error 실행 중 발생한 예외 (호출자에게 그대로 전파됨)
     * @param elapsed 실행 소요 시간
     */
    void failure(Throwable error, Duration elapsed);
}
