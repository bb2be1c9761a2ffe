package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.composition.SequentialPrimitive;
import com.ryuqq.workflow.core.exception.PrimitiveConfigurationException;
import com.ryuqq.workflow.core.primitive.LambdaPrimitive;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for sequential composition.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Output of stage k is the input of stage k+1</li>
 *   <li>A failing stage aborts the chain with the identical exception</li>
 *   <li>Nested sequentials flatten</li>
 *   <li>Empty composition is rejected at construction</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class SequentialContractTest extends AbstractPrimitiveContractTest {

    @Test
    void testSequential_FoldsStagesInOrder() throws Exception {
        // Given
        WorkflowPrimitive<Integer, Integer> addOne = LambdaPrimitive.map(x -> x + 1);
        WorkflowPrimitive<Integer, Integer> timesTwo = LambdaPrimitive.map(x -> x * 2);
        WorkflowPrimitive<Integer, String> describe = LambdaPrimitive.map(x -> "value=" + x);

        // When
        String result = addOne.then(timesTwo).then(describe).execute(3, context);

        // Then: (3 + 1) * 2
        assertEquals("value=8", result);
    }

    @Test
    void testSequential_FailingStage_AbortsWithSameException() {
        // Given
        IOException failure = new IOException("stage 2 failed");
        MockPrimitive<String, String> first = MockPrimitive.returning("a");
        MockPrimitive<String, String> second = MockPrimitive.failing(failure);
        MockPrimitive<String, String> third = MockPrimitive.returning("c");
        SequentialPrimitive<String, String> chain = SequentialPrimitive.of(first, second, third);

        // When / Then
        assertFailsWithSameInstance(failure, () -> chain.execute("in", context));
        assertEquals(1, first.callCount());
        assertEquals(1, second.callCount());
        assertEquals(0, third.callCount(), "Stages after the failure must not run");
    }

    @Test
    void testSequential_AllStagesShareTheSameContext() throws Exception {
        // Given
        MockPrimitive<String, String> first = MockPrimitive.answering((input, ctx) -> {
            ctx.putState("seen", input);
            return input + "!";
        });
        MockPrimitive<String, String> second = MockPrimitive.answering((input, ctx) -> ctx.getState("seen") + "|" + input);

        // When
        String result = first.then(second).execute("hi", context);

        // Then
        assertEquals("hi|hi!", result);
        assertSame(context, first.getContexts().get(0));
        assertSame(context, second.getContexts().get(0));
    }

    @Test
    void testSequential_NestedChains_Flatten() {
        // Given
        WorkflowPrimitive<Integer, Integer> a = LambdaPrimitive.map(x -> x);
        WorkflowPrimitive<Integer, Integer> b = LambdaPrimitive.map(x -> x);
        WorkflowPrimitive<Integer, Integer> c = LambdaPrimitive.map(x -> x);

        // When
        SequentialPrimitive<Integer, Integer> left = a.then(b).then(c);
        SequentialPrimitive<Integer, Integer> right = a.then(b.then(c));

        // Then
        assertEquals(3, left.size());
        assertEquals(3, right.size());
        assertEquals(List.of(a, b, c), List.copyOf(left.getStages()));
    }

    @Test
    void testSequential_EmptyStages_RejectedAtConstruction() {
        assertThrows(PrimitiveConfigurationException.class, () -> SequentialPrimitive.of(List.of()));
        assertThrows(PrimitiveConfigurationException.class, () -> SequentialPrimitive.of());
    }
}
