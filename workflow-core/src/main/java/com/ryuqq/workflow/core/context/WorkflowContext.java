package com.ryuqq.workflow.core.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * 실행 트리 전체에 전달되는 Workflow Context.
 *
 * <p>식별자(workflow, correlation, trace/span, session, actor), 공유 state,
 * tag, metadata, 체크포인트와 시작 시각을 담습니다.</p>
 *
 * <p><strong>공유 규칙:</strong></p>
 * <ul>
 *   <li>하나의 인스턴스가 실행 트리 전체(병렬 branch 포함)에서 참조로 공유됩니다.</li>
 *   <li>state / tags / metadata / checkpoints 변경은 같은 Context를 가진 모든 곳에 즉시 보입니다.</li>
 *   <li>{@code withXxx()} 메서드는 식별자 하나만 바꾼 새 Context를 반환하며,
 *       state / tags / metadata / checkpoints는 원본과 같은 컬렉션을 공유합니다.</li>
 *   <li>체크포인트 삭제나 state 되돌리기 연산은 없습니다.</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 가변 컬렉션은 {@link ConcurrentHashMap}과
 * {@link CopyOnWriteArrayList}로 보호됩니다. 값 읽기-수정-쓰기가 필요하면
 * {@link #updateState(String, UnaryOperator)}를 사용해야 병렬 branch 간 경쟁이 없습니다.
 * Concurrent Map 특성상 null 값은 저장할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * WorkflowContext context = WorkflowContext.builder()
 *     .workflowId("order-flow")
 *     .sessionId("session-1")
 *     .tag("tenant", "acme")
 *     .build();
 *
 * context.checkpoint("validation.done");
 * context.putState("orderId", 42L);
 * }</pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class WorkflowContext {

    static final String UNKNOWN = "unknown";

    private final String workflowId;
    private final String correlationId;
    private final String causationId;
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final String sessionId;
    private final String actorId;

    private final ConcurrentMap<String, Object> state;
    private final ConcurrentMap<String, String> tags;
    private final ConcurrentMap<String, Object> metadata;
    private final List<Checkpoint> checkpoints;
    private final Instant startTime;
    private final Clock clock;

    private WorkflowContext(Builder builder,
                            ConcurrentMap<String, Object> state,
                            ConcurrentMap<String, String> tags,
                            ConcurrentMap<String, Object> metadata,
                            List<Checkpoint> checkpoints,
                            Instant startTime) {
        this.workflowId = builder.workflowId;
        this.correlationId = builder.correlationId != null ? builder.correlationId : UUID.randomUUID().toString();
        this.causationId = builder.causationId;
        this.traceId = builder.traceId;
        this.spanId = builder.spanId;
        this.parentSpanId = builder.parentSpanId;
        this.sessionId = builder.sessionId;
        this.actorId = builder.actorId;
        this.clock = builder.clock;
        this.state = state;
        this.tags = tags;
        this.metadata = metadata;
        this.checkpoints = checkpoints;
        this.startTime = startTime != null ? startTime : clock.instant();
    }

    /**
     * 기본값으로 새 Context 생성 (correlationId는 무작위 UUID).
     *
     * @return 새 Context
     */
    public static WorkflowContext create() {
        return builder().build();
    }

    /**
     * workflowId만 지정해 새 Context 생성.
     *
     * @param workflowId Workflow ID
     * @return 새 Context
     */
    public static WorkflowContext of(String workflowId) {
        return builder().workflowId(workflowId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ============================================================
    // Checkpoint / 시간
    // ============================================================

    /**
     * 체크포인트 기록.
     *
     * @param name 체크포인트 이름
     * @throws IllegalArgumentException name이 비어 있는 경우
     */
    public void checkpoint(String name) {
        checkpoints.add(new Checkpoint(name, clock.instant()));
    }

    /**
     * 기록된 체크포인트 조회 (기록 순서).
     *
     * @return 읽기 전용 체크포인트 목록
     */
    public List<Checkpoint> getCheckpoints() {
        return Collections.unmodifiableList(checkpoints);
    }

    /**
     * 시작 이후 경과 시간.
     *
     * @return 경과 시간
     */
    public Duration elapsed() {
        return Duration.between(startTime, clock.instant());
    }

    // ============================================================
    // State / Tag / Metadata
    // ============================================================

    /**
     * state 값 저장.
     *
     * @param key 키
     * @param value 값 (null 불가)
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public void putState(String key, Object value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("state value cannot be null (key: " + key + ")");
        }
        state.put(key, value);
    }

    /**
     * state 값 조회.
     *
     * @param key 키
     * @return 값, 없으면 null
     */
    public Object getState(String key) {
        requireKey(key);
        return state.get(key);
    }

    /**
     * state 값을 기대 타입으로 조회.
     *
     * @param key 키
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return 값, 없으면 null
     * @throws ClassCastException 저장된 값이 type이 아닌 경우
     */
    public <T> T getState(String key, Class<T> type) {
        return type.cast(getState(key));
    }

    public boolean hasState(String key) {
        requireKey(key);
        return state.containsKey(key);
    }

    /**
     * state 값 원자적 갱신.
     *
     * <p>현재 값(없으면 null)을 받아 새 값을 계산합니다. 같은 키에 대한 동시 갱신은 직렬화됩니다.
     * updater가 null을 반환하면 키가 제거되지 않고 {@link IllegalArgumentException}이 발생합니다.</p>
     *
     * @param key 키
     * @param updater 현재 값 → 새 값
     * @return 갱신된 값
     */
    public Object updateState(String key, UnaryOperator<Object> updater) {
        requireKey(key);
        if (updater == null) {
            throw new IllegalArgumentException("updater cannot be null");
        }
        return state.compute(key, (k, current) -> {
            Object next = updater.apply(current);
            if (next == null) {
                throw new IllegalArgumentException("state value cannot be null (key: " + k + ")");
            }
            return next;
        });
    }

    /**
     * state의 목록 값에 항목을 원자적으로 추가.
     *
     * <p>키가 없으면 새 목록을 만듭니다. 저장되는 목록은 매번 새로 만든 불변 목록이므로
     * 조회한 목록을 반복하는 동안 다른 branch가 추가해도 안전합니다.</p>
     *
     * @param key 키
     * @param item 추가할 항목
     * @throws IllegalStateException 기존 값이 List가 아닌 경우
     */
    public void appendState(String key, Object item) {
        if (item == null) {
            throw new IllegalArgumentException("state item cannot be null (key: " + key + ")");
        }
        updateState(key, current -> {
            List<Object> next = new ArrayList<>();
            if (current instanceof List<?> existing) {
                next.addAll(existing);
            } else if (current != null) {
                throw new IllegalStateException("state value is not a list (key: " + key + ")");
            }
            next.add(item);
            return Collections.unmodifiableList(next);
        });
    }

    /**
     * state의 카운터 값을 원자적으로 1 증가.
     *
     * @param key 키
     * @return 증가된 값
     * @throws IllegalStateException 기존 값이 Number가 아닌 경우
     */
    public long incrementState(String key) {
        Object updated = updateState(key, current -> {
            if (current == null) {
                return 1L;
            }
            if (current instanceof Number number) {
                return number.longValue() + 1;
            }
            throw new IllegalStateException("state value is not a number (key: " + key + ")");
        });
        return (Long) updated;
    }

    /**
     * state 전체의 읽기 전용 view.
     *
     * @return state view
     */
    public Map<String, Object> getStateView() {
        return Collections.unmodifiableMap(state);
    }

    public void putTag(String key, String value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("tag value cannot be null (key: " + key + ")");
        }
        tags.put(key, value);
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public void putMetadata(String key, Object value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("metadata value cannot be null (key: " + key + ")");
        }
        metadata.put(key, value);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // ============================================================
    // Copy-on-write 식별자 교체
    // ============================================================

    /**
     * workflowId만 바꾼 새 Context 생성.
     *
     * <p>state / tags / metadata / checkpoints는 원본과 공유됩니다.</p>
     *
     * @param workflowId 새 Workflow ID
     * @return 새 Context
     */
    public WorkflowContext withWorkflowId(String workflowId) {
        return shared(toBuilder().workflowId(workflowId));
    }

    public WorkflowContext withSessionId(String sessionId) {
        return shared(toBuilder().sessionId(sessionId));
    }

    public WorkflowContext withActorId(String actorId) {
        return shared(toBuilder().actorId(actorId));
    }

    public WorkflowContext withTraceId(String traceId) {
        return shared(toBuilder().traceId(traceId));
    }

    public WorkflowContext withSpanId(String spanId) {
        return shared(toBuilder().spanId(spanId));
    }

    /**
     * 하위 Workflow용 자식 Context 생성.
     *
     * <p>trace / correlation / session / actor / workflow 식별자를 상속하고,
     * 현재 spanId가 자식의 parentSpanId가, 현재 correlationId가 자식의 causationId가 됩니다.
     * state / tags / metadata는 복사되어 이후 변경이 서로 보이지 않으며, 체크포인트는 비어 있습니다.</p>
     *
     * @return 자식 Context
     */
    public WorkflowContext createChild() {
        Builder child = toBuilder()
            .spanId(null)
            .parentSpanId(spanId)
            .causationId(correlationId);
        return new WorkflowContext(
            child,
            new ConcurrentHashMap<>(state),
            new ConcurrentHashMap<>(tags),
            new ConcurrentHashMap<>(metadata),
            new CopyOnWriteArrayList<>(),
            null
        );
    }

    // ============================================================
    // Trace export
    // ============================================================

    /**
     * 외부 tracer용 평탄화된 속성 생성.
     *
     * <p>없는 식별자는 {@code "unknown"}으로 내보내며, tag는 {@code workflow.tag.<key>}로 추가됩니다.</p>
     *
     * @return 속성 map (삽입 순서 유지)
     */
    public Map<String, Object> exportTraceAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("workflow.id", orUnknown(workflowId));
        attributes.put("workflow.session_id", orUnknown(sessionId));
        attributes.put("workflow.actor_id", orUnknown(actorId));
        attributes.put("workflow.correlation_id", correlationId);
        if (causationId != null) {
            attributes.put("workflow.causation_id", causationId);
        }
        if (traceId != null) {
            attributes.put("trace.id", traceId);
        }
        if (spanId != null) {
            attributes.put("span.id", spanId);
        }
        if (parentSpanId != null) {
            attributes.put("span.parent_id", parentSpanId);
        }
        attributes.put("workflow.elapsed_ms", elapsed().toMillis());
        tags.forEach((key, value) -> attributes.put("workflow.tag." + key, value));
        return attributes;
    }

    // ============================================================
    // Getters
    // ============================================================

    public String getWorkflowId() {
        return workflowId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getCausationId() {
        return causationId;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getSpanId() {
        return spanId;
    }

    public String getParentSpanId() {
        return parentSpanId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getActorId() {
        return actorId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Clock getClock() {
        return clock;
    }

    private WorkflowContext shared(Builder builder) {
        return new WorkflowContext(builder, state, tags, metadata, checkpoints, startTime);
    }

    private Builder toBuilder() {
        return new Builder()
            .workflowId(workflowId)
            .correlationId(correlationId)
            .causationId(causationId)
            .traceId(traceId)
            .spanId(spanId)
            .parentSpanId(parentSpanId)
            .sessionId(sessionId)
            .actorId(actorId)
            .clock(clock);
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static String orUnknown(String value) {
        return value != null ? value : UNKNOWN;
    }

    @Override
    public String toString() {
        return "WorkflowContext{"
            + "workflowId=" + workflowId
            + ", correlationId=" + correlationId
            + ", checkpoints=" + checkpoints.size()
            + '}';
    }

    /**
     * WorkflowContext Builder.
     */
    public static final class Builder {

        private String workflowId;
        private String correlationId;
        private String causationId;
        private String traceId;
        private String spanId;
        private String parentSpanId;
        private String sessionId;
        private String actorId;
        private Clock clock = Clock.systemUTC();
        private final Map<String, String> tags = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder parentSpanId(String parentSpanId) {
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder tag(String key, String value) {
            requireKey(key);
            if (value == null) {
                throw new IllegalArgumentException("tag value cannot be null (key: " + key + ")");
            }
            this.tags.put(key, value);
            return this;
        }

        public Builder metadata(String key, Object value) {
            requireKey(key);
            if (value == null) {
                throw new IllegalArgumentException("metadata value cannot be null (key: " + key + ")");
            }
            this.metadata.put(key, value);
            return this;
        }

        /**
         * 시각 기준 Clock 지정 (테스트용).
         *
         * @param clock Clock
         * @return this
         */
        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        public WorkflowContext build() {
            return new WorkflowContext(
                this,
                new ConcurrentHashMap<>(),
                new ConcurrentHashMap<>(tags),
                new ConcurrentHashMap<>(metadata),
                new CopyOnWriteArrayList<>(),
                null
            );
        }
    }
}
