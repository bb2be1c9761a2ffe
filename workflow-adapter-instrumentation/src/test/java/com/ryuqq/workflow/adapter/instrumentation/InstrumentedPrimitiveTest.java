package com.ryuqq.workflow.adapter.instrumentation;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.LambdaPrimitive;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import com.ryuqq.workflow.core.spi.ExecutionListener;
import com.ryuqq.workflow.core.spi.ExecutionObservation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * InstrumentedPrimitive 유닛 테스트.
 *
 * <ul>
 *   <li>성공 시 success 통지, 결과 그대로 반환</li>
 *   <li>실패 시 failure 통지, 동일 예외 전파</li>
 *   <li>Listener 오류는 실행 결과에 영향 없음</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InstrumentedPrimitiveTest {

    @Mock
    private ExecutionListener listener;

    @Mock
    private ExecutionObservation observation;

    private final WorkflowContext context = WorkflowContext.of("instrumented-test");

    @Test
    void execute_성공_시_success_통지() throws Exception {
        // given
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("upper", (input, ctx) -> input.toUpperCase());
        when(listener.start("upper", context)).thenReturn(observation);

        // when
        String result = new InstrumentedPrimitive<>(inner, listener).execute("abc", context);

        // then
        assertThat(result).isEqualTo("ABC");
        verify(observation).success(any(Duration.class));
        verify(observation, never()).failure(any(), any());
    }

    @Test
    void execute_실패_시_failure_통지_후_동일_예외_전파() throws Exception {
        // given
        IOException failure = new IOException("boom");
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("broken", (input, ctx) -> {
            throw failure;
        });
        when(listener.start("broken", context)).thenReturn(observation);

        // when & then
        assertThatThrownBy(() -> new InstrumentedPrimitive<>(inner, listener).execute("abc", context))
            .isSameAs(failure);
        verify(observation).failure(eq(failure), any(Duration.class));
        verify(observation, never()).success(any());
    }

    @Test
    void execute_listener_오류는_무시하고_결과_반환() throws Exception {
        // given
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("ok", (input, ctx) -> "done");
        when(listener.start("ok", context)).thenReturn(observation);
        doThrow(new IllegalStateException("listener bug")).when(observation).success(any());

        // when
        String result = new InstrumentedPrimitive<>(inner, listener).execute("abc", context);

        // then
        assertThat(result).isEqualTo("done");
    }

    @Test
    void execute_start_오류도_실행을_막지_않음() throws Exception {
        // given
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("ok", (input, ctx) -> "done");
        when(listener.start("ok", context)).thenThrow(new IllegalStateException("listener bug"));

        // when
        String result = new InstrumentedPrimitive<>(inner, listener).execute("abc", context);

        // then
        assertThat(result).isEqualTo("done");
    }

    @Test
    void name_은_내부_이름() {
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("inner-name", (input, ctx) -> input);

        assertThat(new InstrumentedPrimitive<>(inner).name()).isEqualTo("inner-name");
    }
}
