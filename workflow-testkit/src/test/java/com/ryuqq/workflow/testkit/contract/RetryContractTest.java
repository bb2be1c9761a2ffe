package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.recovery.RetryPrimitive;
import com.ryuqq.workflow.core.recovery.RetryStatistics;
import com.ryuqq.workflow.core.recovery.RetryStrategy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for retry.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Always failing inner is called exactly maxRetries + 1 times</li>
 *   <li>The caller observes the identical last exception</li>
 *   <li>Recovery after transient failures returns the eventual result</li>
 *   <li>Exceptions rejected by the strategy are not retried</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractPrimitiveContractTest {

    private static final RetryStrategy FAST = RetryStrategy.of(2, Duration.ofMillis(10));

    @Test
    void testRetry_AlwaysFailing_CalledMaxRetriesPlusOneTimes() {
        // Given
        IOException failure = new IOException("unavailable");
        MockPrimitive<String, String> inner = MockPrimitive.failing(failure);
        RetryPrimitive<String, String> retry = new RetryPrimitive<>(inner, FAST);

        // When / Then
        assertFailsWithSameInstance(failure, () -> retry.execute("in", context));
        assertEquals(3, inner.callCount());
    }

    @Test
    void testRetry_TransientFailures_ReturnsEventualResult() throws Exception {
        // Given: fails twice, then succeeds
        MockPrimitive<String, String> inner = MockPrimitive.<String, String>returning("ok")
                .thenFailOnce(new IOException("1st"))
                .thenFailOnce(new IOException("2nd"));
        RetryPrimitive<String, String> retry = new RetryPrimitive<>(inner, FAST);

        // When
        String result = retry.execute("in", context);

        // Then
        assertEquals("ok", result);
        assertEquals(3, inner.callCount());
    }

    @Test
    void testRetry_EveryAttemptReceivesIdenticalInputAndContext() {
        // Given
        Object input = new Object();
        MockPrimitive<Object, String> inner = MockPrimitive.failing(new IOException("down"));
        RetryPrimitive<Object, String> retry = new RetryPrimitive<>(inner, FAST);

        // When
        assertThrows(IOException.class, () -> retry.execute(input, context));

        // Then
        assertEquals(3, inner.callCount());
        inner.getInputs().forEach(seen -> assertSame(input, seen));
        inner.getContexts().forEach(seen -> assertSame(context, seen));
    }

    @Test
    void testRetry_NonRetryableException_NotRetried() {
        // Given
        IllegalArgumentException invalid = new IllegalArgumentException("bad input");
        MockPrimitive<String, String> inner = MockPrimitive.failing(invalid);
        RetryPrimitive<String, String> retry = new RetryPrimitive<>(inner, FAST.retryingOnly(IOException.class));

        // When / Then
        assertFailsWithSameInstance(invalid, () -> retry.execute("in", context));
        assertEquals(1, inner.callCount());
    }

    @Test
    void testRetry_ZeroRetries_SingleAttempt() {
        // Given
        MockPrimitive<String, String> inner = MockPrimitive.failing(new IOException("once"));
        RetryPrimitive<String, String> retry = new RetryPrimitive<>(inner, FAST.withMaxRetries(0));

        // When / Then
        assertThrows(IOException.class, () -> retry.execute("in", context));
        assertEquals(1, inner.callCount());
    }

    @Test
    void testRetry_RecordsStatisticsInContext() throws Exception {
        // Given
        MockPrimitive<String, String> inner = MockPrimitive.<String, String>returning("ok")
                .named("payment")
                .thenFailOnce(new IOException("flaky"));

        // When
        new RetryPrimitive<>(inner, FAST).execute("in", context);

        // Then
        @SuppressWarnings("unchecked")
        List<RetryStatistics> statistics = (List<RetryStatistics>) context.getState(RetryPrimitive.STATISTICS_KEY);
        assertEquals(List.of(new RetryStatistics("payment", 2, true, null)), statistics);
    }
}
