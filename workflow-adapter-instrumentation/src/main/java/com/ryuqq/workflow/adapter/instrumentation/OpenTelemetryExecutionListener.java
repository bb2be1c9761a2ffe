package com.ryuqq.workflow.adapter.instrumentation;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.spi.ExecutionListener;
import com.ryuqq.workflow.core.spi.ExecutionObservation;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.Map;

/**
 * OpenTelemetry 기반 실행 Listener.
 *
 * <p>실행마다 span 하나를 만들고 Context의 trace 속성을 span 속성으로 기록합니다.
 * span은 실행 동안 현재 span이 되므로 내부 Primitive가 만드는 span은 자식으로 연결됩니다.</p>
 *
 * <p><strong>Metrics:</strong></p>
 * <ul>
 *   <li>{@code workflow.primitive.executions} (counter): 실행 횟수</li>
 *   <li>{@code workflow.primitive.failures} (counter): 실패 횟수 ({@code error.type} 속성 포함)</li>
 *   <li>{@code workflow.primitive.duration} (histogram, ms): 실행 소요 시간</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class OpenTelemetryExecutionListener implements ExecutionListener {

    static final String INSTRUMENTATION_NAME = "com.ryuqq.workflow";

    static final AttributeKey<String> PRIMITIVE_KEY = AttributeKey.stringKey("workflow.primitive");
    static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");

    private final Tracer tracer;
    private final LongCounter executions;
    private final LongCounter failures;
    private final DoubleHistogram duration;

    /**
     * GlobalOpenTelemetry를 사용하는 생성자.
     */
    public OpenTelemetryExecutionListener() {
        this(GlobalOpenTelemetry.get());
    }

    /**
     * 생성자.
     *
     * @param openTelemetry Tracer와 Meter를 제공할 OpenTelemetry 인스턴스
     * @throws IllegalArgumentException openTelemetry가 null인 경우
     */
    public OpenTelemetryExecutionListener(OpenTelemetry openTelemetry) {
        if (openTelemetry == null) {
            throw new IllegalArgumentException("openTelemetry cannot be null");
        }
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        Meter meter = openTelemetry.getMeter(INSTRUMENTATION_NAME);

        this.executions = meter.counterBuilder("workflow.primitive.executions")
                .setDescription("Number of primitive executions")
                .setUnit("1")
                .build();

        this.failures = meter.counterBuilder("workflow.primitive.failures")
                .setDescription("Number of failed primitive executions")
                .setUnit("1")
                .build();

        this.duration = meter.histogramBuilder("workflow.primitive.duration")
                .setDescription("Primitive execution duration in milliseconds")
                .setUnit("ms")
                .build();
    }

    @Override
    public ExecutionObservation start(String primitiveName, WorkflowContext context) {
        SpanBuilder builder = tracer.spanBuilder(primitiveName)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(PRIMITIVE_KEY, primitiveName);

        for (Map.Entry<String, Object> attribute : context.exportTraceAttributes().entrySet()) {
            Object value = attribute.getValue();
            if (value instanceof Long number) {
                builder.setAttribute(attribute.getKey(), number.longValue());
            } else if (value != null) {
                builder.setAttribute(attribute.getKey(), String.valueOf(value));
            }
        }

        Span span = builder.startSpan();
        Scope scope = span.makeCurrent();
        return new SpanObservation(primitiveName, span, scope);
    }

    private final class SpanObservation implements ExecutionObservation {

        private final String primitiveName;
        private final Span span;
        private final Scope scope;

        private SpanObservation(String primitiveName, Span span, Scope scope) {
            this.primitiveName = primitiveName;
            this.span = span;
            this.scope = scope;
        }

        @Override
        public void success(Duration elapsed) {
            Attributes attributes = Attributes.of(PRIMITIVE_KEY, primitiveName, OUTCOME_KEY, "success");
            executions.add(1, attributes);
            duration.record(toMillis(elapsed), attributes);

            span.setStatus(StatusCode.OK);
            end();
        }

        @Override
        public void failure(Throwable error, Duration elapsed) {
            Attributes attributes = Attributes.of(PRIMITIVE_KEY, primitiveName, OUTCOME_KEY, "failure");
            executions.add(1, attributes);
            duration.record(toMillis(elapsed), attributes);
            failures.add(1, Attributes.of(PRIMITIVE_KEY, primitiveName, ERROR_TYPE_KEY, error.getClass().getSimpleName()));

            span.recordException(error);
            span.setStatus(StatusCode.ERROR, error.getClass().getSimpleName());
            end();
        }

        private void end() {
            try {
                scope.close();
            } finally {
                span.end();
            }
        }

        private double toMillis(Duration elapsed) {
            return elapsed.toNanos() / 1_000_000.0;
        }
    }
}
