package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.adapter.instrumentation.CompositeExecutionListener;
import com.ryuqq.workflow.adapter.instrumentation.InstrumentedPrimitive;
import com.ryuqq.workflow.adapter.instrumentation.Slf4jExecutionListener;
import com.ryuqq.workflow.core.recovery.RetryPrimitive;
import com.ryuqq.workflow.core.recovery.RetryStrategy;
import com.ryuqq.workflow.core.spi.noop.NoOpExecutionListener;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for instrumentation transparency.
 *
 * <p>Wrapping a primitive with a listener must not change its observable input/output
 * or failure behaviour.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class InstrumentationContractTest extends AbstractPrimitiveContractTest {

    private final CompositeExecutionListener listener =
            CompositeExecutionListener.of(new Slf4jExecutionListener(), new NoOpExecutionListener());

    @Test
    void testInstrumented_Success_SameResult() throws Exception {
        // Given
        MockPrimitive<String, String> inner = MockPrimitive.answering((input, ctx) -> input.toUpperCase());

        // When
        String result = new InstrumentedPrimitive<>(inner, listener).execute("abc", context);

        // Then
        assertEquals("ABC", result);
        assertEquals(1, inner.callCount());
    }

    @Test
    void testInstrumented_Failure_SameException() {
        // Given
        IOException failure = new IOException("boom");
        MockPrimitive<String, String> inner = MockPrimitive.failing(failure);
        InstrumentedPrimitive<String, String> instrumented = new InstrumentedPrimitive<>(inner, listener);

        // When / Then
        assertFailsWithSameInstance(failure, () -> instrumented.execute("abc", context));
    }

    @Test
    void testInstrumented_InsideRetry_EachAttemptObserved() throws Exception {
        // Given
        MockPrimitive<String, String> inner = MockPrimitive.<String, String>returning("ok")
                .thenFailOnce(new IOException("flaky"));
        RetryPrimitive<String, String> retry = new RetryPrimitive<>(
                new InstrumentedPrimitive<>(inner, listener),
                RetryStrategy.of(1, Duration.ofMillis(5)));

        // When
        String result = retry.execute("in", context);

        // Then
        assertEquals("ok", result);
        assertEquals(2, inner.callCount());
    }
}
