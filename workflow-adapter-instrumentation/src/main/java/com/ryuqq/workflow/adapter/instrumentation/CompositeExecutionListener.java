package com.ryuqq.workflow.adapter.instrumentation;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.spi.ExecutionListener;
import com.ryuqq.workflow.core.spi.ExecutionObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 여러 Listener에 실행을 통지하는 Listener.
 *
 * <p>시작은 등록 순서대로, 결과 통지는 역순으로 전달합니다
 * (MDC나 현재 span처럼 스택 형태로 복원되어야 하는 상태를 위해).</p>
 *
 * <p><strong>격리:</strong> 각 Listener의 {@code start}, {@code success}, {@code failure} 호출은
 * 개별적으로 보호됩니다. 한 Listener가 예외를 던지면 WARN으로 로그하고 나머지 Listener는 계속 통지합니다.
 * {@code start}에 실패한 Listener는 결과 통지에서 제외되고, 이미 시작된 관찰은 그대로 종료 통지를 받습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class CompositeExecutionListener implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeExecutionListener.class);

    private final List<ExecutionListener> listeners;

    public CompositeExecutionListener(List<? extends ExecutionListener> listeners) {
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        for (ExecutionListener listener : listeners) {
            if (listener == null) {
                throw new IllegalArgumentException("listener cannot be null");
            }
        }
        this.listeners = Collections.unmodifiableList(new ArrayList<>(listeners));
    }

    public static CompositeExecutionListener of(ExecutionListener... listeners) {
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        return new CompositeExecutionListener(Arrays.asList(listeners));
    }

    @Override
    public ExecutionObservation start(String primitiveName, WorkflowContext context) {
        List<ExecutionObservation> observations = new ArrayList<>(listeners.size());
        for (ExecutionListener listener : listeners) {
            try {
                ExecutionObservation observation = listener.start(primitiveName, context);
                if (observation != null) {
                    observations.add(observation);
                }
            } catch (RuntimeException e) {
                log.warn("Listener {} failed to start for {}: {}",
                    listener.getClass().getName(), primitiveName, e.toString());
            }
        }
        Collections.reverse(observations);

        return new ExecutionObservation() {
            @Override
            public void success(Duration elapsed) {
                for (ExecutionObservation observation : observations) {
                    try {
                        observation.success(elapsed);
                    } catch (RuntimeException e) {
                        log.warn("Observation success callback failed for {}: {}", primitiveName, e.toString());
                    }
                }
            }

            @Override
            public void failure(Throwable error, Duration elapsed) {
                for (ExecutionObservation observation : observations) {
                    try {
                        observation.failure(error, elapsed);
                    } catch (RuntimeException e) {
                        log.warn("Observation failure callback failed for {}: {}", primitiveName, e.toString());
                    }
                }
            }
        };
    }

    public List<ExecutionListener> getListeners() {
        return listeners;
    }
}
