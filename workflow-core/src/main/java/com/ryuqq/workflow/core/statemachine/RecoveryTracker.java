package com.ryuqq.workflow.core.statemachine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 단일 실행 동안의 복구 상태 추적기.
 *
 * <p>데코레이터는 execute() 호출마다 새 tracker를 만들고,
 * 실행 흐름에 맞춰 상태를 전이시킵니다. 모든 전이는 {@link RecoveryTransition}으로 검증되며
 * DEBUG 레벨로 기록됩니다.</p>
 *
 * <p>execute() 호출 스레드 안에서만 사용되므로 동기화하지 않습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class RecoveryTracker {

    private static final Logger log = LoggerFactory.getLogger(RecoveryTracker.class);

    private final String primitiveName;
    private RecoveryState state;

    private RecoveryTracker(String primitiveName) {
        this.primitiveName = primitiveName;
        this.state = RecoveryState.RUNNING;
    }

    /**
     * RUNNING 상태로 추적 시작.
     *
     * @param primitiveName 데코레이터 이름 (로깅용)
     * @return 새 tracker
     */
    public static RecoveryTracker start(String primitiveName) {
        return new RecoveryTracker(primitiveName);
    }

    /**
     * 다음 상태로 전이.
     *
     * @param next 다음 상태
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public void moveTo(RecoveryState next) {
        RecoveryState previous = state;
        state = RecoveryTransition.transition(previous, next);
        log.debug("{}: {} → {}", primitiveName, previous, next);
    }

    public void succeeded() {
        moveTo(RecoveryState.SUCCEEDED);
    }

    public void recoverable() {
        moveTo(RecoveryState.FAILED_RECOVERABLE);
    }

    public void resume() {
        moveTo(RecoveryState.RUNNING);
    }

    public void terminal() {
        moveTo(RecoveryState.FAILED_TERMINAL);
    }

    /**
     * 현재 상태 조회.
     *
     * @return 현재 상태
     */
    public RecoveryState state() {
        return state;
    }
}
