package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.PrimitiveFunction;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable test double for {@link WorkflowPrimitive}.
 *
 * <p>Records every call (input and context) and answers from a queue of scripted answers
 * before falling back to the default answer. An optional delay is applied before answering;
 * if the delay is interrupted the mock records it and rethrows.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * MockPrimitive&lt;String, String&gt; flaky = MockPrimitive.&lt;String, String&gt;returning("ok")
 *     .thenFailOnce(new IOException("boom"))
 *     .thenFailOnce(new IOException("boom"));
 *
 * // 3rd call returns "ok"
 * </pre>
 *
 * <p>Thread-safe: may be used as a branch of a parallel primitive.</p>
 *
 * @param <I> input type
 * @param <O> output type
 * @author Workflow Team
 * @since 1.0.0
 */
public final class MockPrimitive<I, O> implements WorkflowPrimitive<I, O> {

    private final Queue<PrimitiveFunction<I, O>> scripted = new ConcurrentLinkedQueue<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicBoolean interrupted = new AtomicBoolean();
    private final List<I> inputs = Collections.synchronizedList(new ArrayList<>());
    private final List<WorkflowContext> contexts = Collections.synchronizedList(new ArrayList<>());

    private volatile PrimitiveFunction<I, O> defaultAnswer;
    private volatile Duration delay = Duration.ZERO;
    private volatile String name = "MockPrimitive";

    private MockPrimitive(PrimitiveFunction<I, O> defaultAnswer) {
        this.defaultAnswer = defaultAnswer;
    }

    /**
     * Creates a mock that returns the given value.
     */
    public static <I, O> MockPrimitive<I, O> returning(O value) {
        return new MockPrimitive<>((input, context) -> value);
    }

    /**
     * Creates a mock that always throws the given exception instance.
     */
    public static <I, O> MockPrimitive<I, O> failing(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new MockPrimitive<>((input, context) -> {
            throw error;
        });
    }

    /**
     * Creates a mock that delegates to the given function.
     */
    public static <I, O> MockPrimitive<I, O> answering(PrimitiveFunction<I, O> answer) {
        if (answer == null) {
            throw new IllegalArgumentException("answer cannot be null");
        }
        return new MockPrimitive<>(answer);
    }

    public MockPrimitive<I, O> named(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
        return this;
    }

    /**
     * Sleeps for the given duration before answering.
     */
    public MockPrimitive<I, O> withDelay(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
        this.delay = delay;
        return this;
    }

    /**
     * Queues one failure ahead of the default answer.
     */
    public MockPrimitive<I, O> thenFailOnce(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        scripted.add((input, context) -> {
            throw error;
        });
        return this;
    }

    /**
     * Queues one return value ahead of the default answer.
     */
    public MockPrimitive<I, O> thenReturnOnce(O value) {
        scripted.add((input, context) -> value);
        return this;
    }

    /**
     * Replaces the default answer.
     */
    public MockPrimitive<I, O> willAnswer(PrimitiveFunction<I, O> answer) {
        if (answer == null) {
            throw new IllegalArgumentException("answer cannot be null");
        }
        this.defaultAnswer = answer;
        return this;
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        calls.incrementAndGet();
        inputs.add(input);
        contexts.add(context);

        Duration currentDelay = delay;
        if (!currentDelay.isZero()) {
            try {
                Thread.sleep(currentDelay.toMillis());
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
                throw e;
            }
        }

        PrimitiveFunction<I, O> answer = scripted.poll();
        return (answer != null ? answer : defaultAnswer).apply(input, context);
    }

    @Override
    public String name() {
        return name;
    }

    public int callCount() {
        return calls.get();
    }

    public List<I> getInputs() {
        synchronized (inputs) {
            return new ArrayList<>(inputs);
        }
    }

    public List<WorkflowContext> getContexts() {
        synchronized (contexts) {
            return new ArrayList<>(contexts);
        }
    }

    /**
     * Whether a delayed call was interrupted (e.g. cancelled by a timeout).
     */
    public boolean wasInterrupted() {
        return interrupted.get();
    }
}
