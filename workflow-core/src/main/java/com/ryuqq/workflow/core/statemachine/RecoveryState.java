package com.ryuqq.workflow.core.statemachine;

/**
 * 복구 데코레이터(Retry, Timeout, Fallback, Saga)의 실행 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>RUNNING → SUCCEEDED (성공)</li>
 *   <li>RUNNING → FAILED_RECOVERABLE (실패, 복구 수단 남음)</li>
 *   <li>RUNNING → FAILED_TERMINAL (실패, 복구 수단 없음)</li>
 *   <li>FAILED_RECOVERABLE → RUNNING (재시도 / fallback / 보상 실행)</li>
 *   <li>FAILED_RECOVERABLE → FAILED_TERMINAL (복구 포기)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * RUNNING ──────────────► SUCCEEDED
 *    │  ▲
 *    │  │ (복구 실행)
 *    ▼  │
 * FAILED_RECOVERABLE
 *    │
 *    ▼
 * FAILED_TERMINAL (re-raise)
 *
 * 금지된 전이:
 * - SUCCEEDED → * ❌
 * - FAILED_TERMINAL → * ❌
 * - FAILED_RECOVERABLE → SUCCEEDED ❌ (반드시 RUNNING을 거쳐야 함)
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum RecoveryState {

    /**
     * 실행 중 (최초 상태).
     */
    RUNNING,

    /**
     * 성공.
     */
    SUCCEEDED,

    /**
     * 실패했으나 데코레이터의 복구 수단이 남아 있음.
     */
    FAILED_RECOVERABLE,

    /**
     * 복구 수단 소진, 예외를 호출자에게 전파.
     */
    FAILED_TERMINAL;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 FAILED_TERMINAL인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TERMINAL;
    }
}
