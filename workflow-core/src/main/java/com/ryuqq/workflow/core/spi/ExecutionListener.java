package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.context.WorkflowContext;

/**
 * Primitive 실행 관찰 SPI (Service Provider Interface).
 *
 * <p>Primitive 실행 시작 시 호출되며, 해당 실행의 결과를 받을 {@link ExecutionObservation}을 반환합니다.
 * 로깅, 트레이싱, 메트릭 등 관측 기능은 이 SPI의 구현으로 연결됩니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>관찰 실패가 Primitive 실행에 영향을 주지 않도록 예외를 던지지 않을 것</li>
 *   <li>여러 스레드에서 동시에 호출될 수 있으므로 thread-safe할 것</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public class CountingListener implements ExecutionListener {
 *     private final AtomicLong started = new AtomicLong();
 *
 *     {@literal @}Override
 *     public ExecutionObservation start(String primitiveName, WorkflowContext context) {
 *         started.incrementAndGet();
 *         return ExecutionObservation.NOOP;
 *     }
 * }
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface ExecutionListener {

    /**
     * 실행 시작 통지.
     *
     * @param primitiveName 실행되는 Primitive 이름
     * @param context 실행 Context
     * @return 이번 실행의 결과를 받을 관찰 객체 (null 불가)
     */
    ExecutionObservation start(String primitiveName, WorkflowContext context);
}
