package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.recovery.FallbackPrimitive;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for fallback.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Primary success never calls the fallback</li>
 *   <li>Primary failure returns the fallback result for the same input and context</li>
 *   <li>When both fail the caller observes the fallback's exception</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class FallbackContractTest extends AbstractPrimitiveContractTest {

    @Test
    void testFallback_PrimarySucceeds_FallbackNotCalled() throws Exception {
        // Given
        MockPrimitive<String, String> primary = MockPrimitive.returning("primary");
        MockPrimitive<String, String> fallback = MockPrimitive.returning("fallback");

        // When
        String result = new FallbackPrimitive<>(primary, fallback).execute("in", context);

        // Then
        assertEquals("primary", result);
        assertEquals(0, fallback.callCount());
    }

    @Test
    void testFallback_PrimaryFails_ReturnsFallbackResult() throws Exception {
        // Given
        Object input = new Object();
        MockPrimitive<Object, String> primary = MockPrimitive.failing(new IOException("primary down"));
        MockPrimitive<Object, String> fallback = MockPrimitive.returning("fallback");

        // When
        String result = new FallbackPrimitive<>(primary, fallback).execute(input, context);

        // Then
        assertEquals("fallback", result);
        assertSame(input, fallback.getInputs().get(0));
        assertSame(context, fallback.getContexts().get(0));
    }

    @Test
    void testFallback_BothFail_FallbackErrorWins() {
        // Given
        IOException primaryFailure = new IOException("primary down");
        IllegalStateException fallbackFailure = new IllegalStateException("fallback down");
        MockPrimitive<String, String> primary = MockPrimitive.failing(primaryFailure);
        MockPrimitive<String, String> fallback = MockPrimitive.failing(fallbackFailure);
        FallbackPrimitive<String, String> primitive = new FallbackPrimitive<>(primary, fallback);

        // When / Then
        assertFailsWithSameInstance(fallbackFailure, () -> primitive.execute("in", context));
        assertEquals(0, fallbackFailure.getSuppressed().length);
    }
}
