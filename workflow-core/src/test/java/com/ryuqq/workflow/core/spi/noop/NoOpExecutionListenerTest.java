package com.ryuqq.workflow.core.spi.noop;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.spi.ExecutionListener;
import com.ryuqq.workflow.core.spi.ExecutionObservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpExecutionListener 유닛 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@DisplayName("NoOpExecutionListener 테스트")
class NoOpExecutionListenerTest {

    @Test
    @DisplayName("start() 는 항상 NOOP 관찰 객체를 반환한다")
    void start_항상_NOOP_반환() {
        // given
        ExecutionListener listener = new NoOpExecutionListener();

        // when
        ExecutionObservation observation = listener.start("test", WorkflowContext.create());

        // then
        assertSame(ExecutionObservation.NOOP, observation);
    }

    @Test
    @DisplayName("결과 통지는 예외 없이 실행된다")
    void 결과_통지_예외_없이_실행() {
        // given
        ExecutionObservation observation = new NoOpExecutionListener().start("test", WorkflowContext.create());

        // when & then
        assertDoesNotThrow(() -> observation.success(Duration.ofMillis(1)));
        assertDoesNotThrow(() -> observation.failure(new IOException("x"), Duration.ofMillis(1)));
    }
}
