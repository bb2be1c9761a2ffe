package com.ryuqq.workflow.adapter.instrumentation;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.LambdaPrimitive;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Slf4jExecutionListener 유닛 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class Slf4jExecutionListenerTest {

    private final WorkflowContext context = WorkflowContext.builder()
        .workflowId("wf-42")
        .correlationId("corr-42")
        .traceId("trace-42")
        .build();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void 실행_중_MDC에_trace_속성이_채워짐() throws Exception {
        // given
        Map<String, String> seen = new HashMap<>();
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("capture", (input, ctx) -> {
            seen.put("workflow.id", MDC.get("workflow.id"));
            seen.put("workflow.correlation_id", MDC.get("workflow.correlation_id"));
            seen.put("trace.id", MDC.get("trace.id"));
            return input;
        });

        // when
        new InstrumentedPrimitive<>(inner, new Slf4jExecutionListener()).execute("in", context);

        // then
        assertThat(seen)
            .containsEntry("workflow.id", "wf-42")
            .containsEntry("workflow.correlation_id", "corr-42")
            .containsEntry("trace.id", "trace-42");
    }

    @Test
    void 실행_후_MDC는_이전_상태로_복원() throws Exception {
        // given
        MDC.put("request.id", "req-1");
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("noop", (input, ctx) -> input);

        // when
        new InstrumentedPrimitive<>(inner, new Slf4jExecutionListener()).execute("in", context);

        // then
        assertThat(MDC.get("request.id")).isEqualTo("req-1");
        assertThat(MDC.get("workflow.id")).isNull();
    }

    @Test
    void 실패해도_MDC는_복원() {
        // given
        WorkflowPrimitive<String, String> inner = LambdaPrimitive.of("broken", (input, ctx) -> {
            throw new IOException("boom");
        });

        // when
        assertThatThrownBy(() -> new InstrumentedPrimitive<>(inner, new Slf4jExecutionListener()).execute("in", context))
            .isInstanceOf(IOException.class);

        // then
        assertThat(MDC.get("workflow.id")).isNull();
    }
}
