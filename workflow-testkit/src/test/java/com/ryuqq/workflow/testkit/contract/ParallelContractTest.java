package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.composition.ParallelPrimitive;
import com.ryuqq.workflow.core.exception.PrimitiveConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for parallel composition.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Results are in declaration order even when completion order differs</li>
 *   <li>Every branch receives the identical input and context object</li>
 *   <li>Branches run concurrently</li>
 *   <li>Any failing branch fails the whole parallel with that exception</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class ParallelContractTest extends AbstractPrimitiveContractTest {

    @Test
    void testParallel_StaggeredDelays_ResultsInDeclarationOrder() throws Exception {
        // Given: first declared finishes last
        MockPrimitive<String, String> slow = MockPrimitive.<String, String>returning("slow").withDelay(Duration.ofMillis(200));
        MockPrimitive<String, String> medium = MockPrimitive.<String, String>returning("medium").withDelay(Duration.ofMillis(100));
        MockPrimitive<String, String> fast = MockPrimitive.returning("fast");
        ParallelPrimitive<String, String> parallel = new ParallelPrimitive<>(List.of(slow, medium, fast), executor);

        // When
        List<String> results = parallel.execute("in", context);

        // Then
        assertEquals(List.of("slow", "medium", "fast"), results);
    }

    @Test
    void testParallel_AllBranchesReceiveIdenticalInputAndContext() throws Exception {
        // Given
        Object input = new Object();
        MockPrimitive<Object, Integer> a = MockPrimitive.returning(1);
        MockPrimitive<Object, Integer> b = MockPrimitive.returning(2);
        MockPrimitive<Object, Integer> c = MockPrimitive.returning(3);

        // When
        new ParallelPrimitive<>(List.of(a, b, c), executor).execute(input, context);

        // Then
        for (MockPrimitive<Object, Integer> branch : List.of(a, b, c)) {
            assertEquals(1, branch.callCount());
            assertSame(input, branch.getInputs().get(0));
            assertSame(context, branch.getContexts().get(0));
        }
    }

    @Test
    void testParallel_BranchesOverlapInTime() throws Exception {
        // Given: three branches of 300ms each
        MockPrimitive<String, String> a = MockPrimitive.<String, String>returning("a").withDelay(Duration.ofMillis(300));
        MockPrimitive<String, String> b = MockPrimitive.<String, String>returning("b").withDelay(Duration.ofMillis(300));
        MockPrimitive<String, String> c = MockPrimitive.<String, String>returning("c").withDelay(Duration.ofMillis(300));
        ParallelPrimitive<String, String> parallel = new ParallelPrimitive<>(List.of(a, b, c), executor);

        // When
        long start = System.nanoTime();
        parallel.execute("in", context);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        // Then: well under the 900ms a sequential run would take
        assertTrue(elapsedMs < 800, "Branches should run concurrently but took " + elapsedMs + "ms");
    }

    @Test
    void testParallel_FailingBranch_FailsWithSameException() {
        // Given
        IllegalStateException failure = new IllegalStateException("branch b failed");
        MockPrimitive<String, String> a = MockPrimitive.returning("a");
        MockPrimitive<String, String> b = MockPrimitive.failing(failure);
        ParallelPrimitive<String, String> parallel = new ParallelPrimitive<>(List.of(a, b), executor);

        // When / Then
        assertFailsWithSameInstance(failure, () -> parallel.execute("in", context));
    }

    @Test
    void testParallel_WithOtherParallel_Flattens() {
        // Given
        MockPrimitive<String, String> a = MockPrimitive.returning("a");
        MockPrimitive<String, String> b = MockPrimitive.returning("b");
        MockPrimitive<String, String> c = MockPrimitive.returning("c");

        // When
        ParallelPrimitive<String, String> combined = a.or(b).with(ParallelPrimitive.<String, String>of(c));

        // Then
        assertEquals(3, combined.size());
    }

    @Test
    void testParallel_EmptyBranches_RejectedAtConstruction() {
        assertThrows(PrimitiveConfigurationException.class,
                () -> new ParallelPrimitive<String, String>(List.of(), executor));
    }
}
