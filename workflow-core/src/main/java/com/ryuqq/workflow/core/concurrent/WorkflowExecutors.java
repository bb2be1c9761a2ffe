package com.ryuqq.workflow.core.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Parallel / Timeout이 기본으로 사용하는 실행기.
 *
 * <p>공유 실행기는 daemon 스레드를 사용하는 cached pool이므로 JVM 종료를 막지 않습니다.
 * 스레드 수 상한이 필요하면 각 Primitive 생성자에 직접 만든 {@link ExecutorService}를 전달합니다.</p>
 *
 * <p><strong>주의:</strong> 중첩된 Parallel / Timeout은 바깥 작업이 안쪽 작업을 기다리며 스레드를 점유합니다.
 * 고정 크기 pool을 공유하면 중첩 깊이만큼 스레드가 필요합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class WorkflowExecutors {

    private static final String THREAD_NAME_PREFIX = "workflow-primitive-";

    // Utility class - prevent instantiation
    private WorkflowExecutors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 공유 실행기 조회 (lazy 생성).
     *
     * @return 공유 daemon cached pool
     */
    public static ExecutorService shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * 고정 크기 daemon pool 생성.
     *
     * @param threads 스레드 수 (양수)
     * @return 새 ExecutorService (호출자가 shutdown 책임)
     * @throws IllegalArgumentException threads가 양수가 아닌 경우
     */
    public static ExecutorService newFixedPool(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
        }
        return Executors.newFixedThreadPool(threads, new DaemonThreadFactory());
    }

    private static final class SharedHolder {
        private static final ExecutorService INSTANCE = Executors.newCachedThreadPool(new DaemonThreadFactory());
    }

    private static final class DaemonThreadFactory implements ThreadFactory {

        private static final AtomicInteger SEQUENCE = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, THREAD_NAME_PREFIX + SEQUENCE.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
