package com.ryuqq.workflow.adapter.instrumentation;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.spi.ExecutionListener;
import com.ryuqq.workflow.core.spi.ExecutionObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;

/**
 * SLF4J 기반 실행 Listener.
 *
 * <p>실행 동안 {@link WorkflowContext#exportTraceAttributes()}를 MDC에 채워
 * 내부 Primitive가 남기는 로그에 workflow/trace 식별자가 붙도록 합니다.
 * 실행이 끝나면 결과를 로그하고 MDC를 시작 전 상태로 되돌립니다.</p>
 *
 * <p><strong>로그 레벨:</strong></p>
 * <ul>
 *   <li>시작: DEBUG</li>
 *   <li>성공: DEBUG</li>
 *   <li>실패: WARN</li>
 * </ul>
 *
 * <p>MDC는 스레드 로컬이므로 시작과 결과 통지가 같은 스레드에서 일어나야 합니다
 * ({@link InstrumentedPrimitive}가 보장).</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class Slf4jExecutionListener implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(Slf4jExecutionListener.class);

    @Override
    public ExecutionObservation start(String primitiveName, WorkflowContext context) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        for (Map.Entry<String, Object> attribute : context.exportTraceAttributes().entrySet()) {
            if (attribute.getValue() != null) {
                MDC.put(attribute.getKey(), String.valueOf(attribute.getValue()));
            }
        }
        log.debug("Executing {}", primitiveName);
        return new MdcObservation(primitiveName, previous);
    }

    private static final class MdcObservation implements ExecutionObservation {

        private final String primitiveName;
        private final Map<String, String> previous;

        private MdcObservation(String primitiveName, Map<String, String> previous) {
            this.primitiveName = primitiveName;
            this.previous = previous;
        }

        @Override
        public void success(Duration elapsed) {
            try {
                log.debug("{} succeeded in {} ms", primitiveName, elapsed.toMillis());
            } finally {
                restore();
            }
        }

        @Override
        public void failure(Throwable error, Duration elapsed) {
            try {
                log.warn("{} failed after {} ms: {}", primitiveName, elapsed.toMillis(), error.toString());
            } finally {
                restore();
            }
        }

        private void restore() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
