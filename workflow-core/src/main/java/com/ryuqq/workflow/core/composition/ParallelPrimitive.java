package com.ryuqq.workflow.core.composition;

import com.ryuqq.workflow.core.concurrent.WorkflowExecutors;
import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.exception.Failures;
import com.ryuqq.workflow.core.exception.PrimitiveConfigurationException;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 병렬 조합 Primitive.
 *
 * <p>모든 branch가 동일한 입력과 동일한 Context 객체를 받아 동시에 시작합니다.
 * 결과는 완료 순서와 관계없이 선언 순서대로 반환됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(input, context)
 *   ↓
 * 모든 branch를 ExecutorService에 제출 (fan-out)
 *   ↓
 * 완료되는 순서대로 수집 (fan-in)
 *   ├─ 성공: results.set(branchIndex, value)
 *   └─ 실패: 나머지 branch cancel → 해당 예외 그대로 전파
 *   ↓
 * results (선언 순서)
 * </pre>
 *
 * <p><strong>실패 규칙:</strong> branch 하나라도 실패하면 전체가 실패합니다.
 * 부분 결과는 반환하지 않으며, 성공과 실패를 병합하지도 않습니다.
 * 나머지 branch의 취소는 interrupt 기반 best-effort입니다.</p>
 *
 * <p><strong>평탄화:</strong> {@link #with(ParallelPrimitive)}는 branch 목록을 이어 붙여
 * 중첩 Parallel 대신 하나의 평탄한 Parallel을 만듭니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> branch 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ParallelPrimitive<I, O> implements WorkflowPrimitive<I, List<O>> {

    private final List<WorkflowPrimitive<? super I, ? extends O>> branches;
    private final ExecutorService executor;

    /**
     * 생성자 (공유 실행기 사용).
     *
     * @param branches branch 목록 (비어 있으면 안 됨)
     * @throws PrimitiveConfigurationException 목록이 null이거나 비어 있는 경우
     */
    public ParallelPrimitive(List<? extends WorkflowPrimitive<? super I, ? extends O>> branches) {
        this(branches, WorkflowExecutors.shared());
    }

    /**
     * 생성자 (실행기 지정).
     *
     * @param branches branch 목록 (비어 있으면 안 됨)
     * @param executor branch 실행기
     * @throws PrimitiveConfigurationException 목록이 null이거나 비어 있는 경우
     * @throws IllegalArgumentException executor가 null이거나 목록에 null branch가 있는 경우
     */
    public ParallelPrimitive(List<? extends WorkflowPrimitive<? super I, ? extends O>> branches, ExecutorService executor) {
        if (branches == null || branches.isEmpty()) {
            throw new PrimitiveConfigurationException("ParallelPrimitive requires at least one branch");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        for (WorkflowPrimitive<? super I, ? extends O> branch : branches) {
            if (branch == null) {
                throw new IllegalArgumentException("branch cannot be null");
            }
        }
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
        this.executor = executor;
    }

    @SafeVarargs
    public static <I, O> ParallelPrimitive<I, O> of(WorkflowPrimitive<? super I, ? extends O>... branches) {
        if (branches == null) {
            throw new PrimitiveConfigurationException("ParallelPrimitive requires at least one branch");
        }
        return new ParallelPrimitive<I, O>(Arrays.asList(branches));
    }

    /**
     * branch 하나를 추가한 새 Parallel 생성.
     *
     * @param branch 추가할 branch
     * @return 평탄한 Parallel (실행기 유지)
     */
    public ParallelPrimitive<I, O> with(WorkflowPrimitive<? super I, ? extends O> branch) {
        List<WorkflowPrimitive<? super I, ? extends O>> combined = new ArrayList<>(branches);
        combined.add(branch);
        return new ParallelPrimitive<I, O>(combined, executor);
    }

    /**
     * 다른 Parallel의 branch를 이어 붙인 새 Parallel 생성.
     *
     * @param other 이어 붙일 Parallel
     * @return 평탄한 Parallel (this의 실행기 유지)
     */
    public ParallelPrimitive<I, O> with(ParallelPrimitive<I, O> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        List<WorkflowPrimitive<? super I, ? extends O>> combined = new ArrayList<>(branches);
        combined.addAll(other.branches);
        return new ParallelPrimitive<I, O>(combined, executor);
    }

    @Override
    public List<O> execute(I input, WorkflowContext context) throws Exception {
        int size = branches.size();
        CompletionService<BranchResult<O>> completion = new ExecutorCompletionService<>(executor);
        List<Future<BranchResult<O>>> futures = new ArrayList<>(size);

        for (int i = 0; i < size; i++) {
            final int index = i;
            final WorkflowPrimitive<? super I, ? extends O> branch = branches.get(i);
            futures.add(completion.submit(() -> new BranchResult<>(index, branch.execute(input, context))));
        }

        List<O> results = new ArrayList<>(Collections.nCopies(size, null));
        try {
            for (int completed = 0; completed < size; completed++) {
                BranchResult<O> result = completion.take().get();
                results.set(result.index(), result.value());
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw Failures.unwrap(e);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw e;
        }

        return Collections.unmodifiableList(results);
    }

    /**
     * branch 목록 조회 (선언 순서).
     *
     * @return 읽기 전용 branch 목록
     */
    public List<WorkflowPrimitive<? super I, ? extends O>> getBranches() {
        return branches;
    }

    public int size() {
        return branches.size();
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private record BranchResult<T>(int index, T value) {
    }
}
