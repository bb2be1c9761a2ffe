package com.ryuqq.workflow.core.statemachine;

/**
 * 복구 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>RUNNING → SUCCEEDED</li>
 *   <li>RUNNING → FAILED_RECOVERABLE</li>
 *   <li>RUNNING → FAILED_TERMINAL</li>
 *   <li>FAILED_RECOVERABLE → RUNNING</li>
 *   <li>FAILED_RECOVERABLE → FAILED_TERMINAL</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(SUCCEEDED, FAILED_TERMINAL)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class RecoveryTransition {

    // Utility class - prevent instantiation
    private RecoveryTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RecoveryState from, RecoveryState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case RUNNING -> to == RecoveryState.SUCCEEDED
                || to == RecoveryState.FAILED_RECOVERABLE
                || to == RecoveryState.FAILED_TERMINAL;
            case FAILED_RECOVERABLE -> to == RecoveryState.RUNNING || to == RecoveryState.FAILED_TERMINAL;
            case SUCCEEDED, FAILED_TERMINAL -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RecoveryState transition(RecoveryState current, RecoveryState next) {
        validate(current, next);
        return next;
    }
}
