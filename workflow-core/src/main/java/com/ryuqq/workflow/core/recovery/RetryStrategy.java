package com.ryuqq.workflow.core.recovery;

import com.ryuqq.workflow.core.exception.PrimitiveConfigurationException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * 재시도 전략 (불변 record).
 *
 * <p>몇 번 재시도할지, 어떤 실패를 재시도할지, 시도 사이에 얼마나 기다릴지를 정의합니다.</p>
 *
 * <p><strong>Backoff 알고리즘:</strong></p>
 * <pre>
 * delay = min(backoffBase * 2^(attempt-1), maxBackoff)
 * jitter 사용 시: delay = min(delay * random(0.5, 1.5), maxBackoff)
 * </pre>
 *
 * <p><strong>예시 (backoffBase=1000ms, maxBackoff=60000ms, jitter=false):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000ms</li>
 *   <li>attempt=2: 2000ms</li>
 *   <li>attempt=3: 4000ms</li>
 *   <li>attempt=7: 60000ms (capped)</li>
 * </ul>
 *
 * <p><strong>재시도 대상:</strong> {@code retryOn}이 true를 반환한 예외만 재시도합니다.
 * 기본값은 모든 예외입니다. {@link InterruptedException}은 전략과 관계없이 재시도하지 않습니다.</p>
 *
 * @param maxRetries 최대 재시도 횟수 (0 이상, 총 시도 = maxRetries + 1)
 * @param backoffBase 첫 재시도 전 대기 시간 (양수)
 * @param maxBackoff 최대 대기 시간 (backoffBase 이상)
 * @param jitter 무작위 jitter 적용 여부
 * @param retryOn 재시도 대상 판별 조건
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record RetryStrategy(
    int maxRetries,
    Duration backoffBase,
    Duration maxBackoff,
    boolean jitter,
    Predicate<Exception> retryOn
) {

    private static final int MAX_SHIFT = 30;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, backoffBase=1s, maxBackoff=60s, jitter=true, 모든 예외 재시도</p>
     */
    public RetryStrategy() {
        this(3, Duration.ofSeconds(1), Duration.ofSeconds(60), true, e -> true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws PrimitiveConfigurationException 파라미터 검증 실패 시
     */
    public RetryStrategy {
        if (maxRetries < 0) {
            throw new PrimitiveConfigurationException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (backoffBase == null || backoffBase.isNegative() || backoffBase.isZero()) {
            throw new PrimitiveConfigurationException(
                "backoffBase must be positive (current: " + backoffBase + ")"
            );
        }
        if (maxBackoff == null || maxBackoff.compareTo(backoffBase) < 0) {
            throw new PrimitiveConfigurationException(
                "maxBackoff must be >= backoffBase (base: " + backoffBase + ", max: " + maxBackoff + ")"
            );
        }
        if (retryOn == null) {
            throw new PrimitiveConfigurationException("retryOn cannot be null");
        }
    }

    /**
     * jitter 없는 전략 생성.
     *
     * <p>maxBackoff는 60초와 backoffBase 중 큰 값입니다.</p>
     *
     * @param maxRetries 최대 재시도 횟수
     * @param backoffBase 첫 재시도 전 대기 시간
     * @return RetryStrategy
     */
    public static RetryStrategy of(int maxRetries, Duration backoffBase) {
        Duration defaultMax = Duration.ofSeconds(60);
        Duration max = backoffBase != null && backoffBase.compareTo(defaultMax) > 0 ? backoffBase : defaultMax;
        return new RetryStrategy(maxRetries, backoffBase, max, false, e -> true);
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public RetryStrategy withMaxRetries(int maxRetries) {
        return new RetryStrategy(maxRetries, backoffBase, maxBackoff, jitter, retryOn);
    }

    /**
     * backoffBase만 변경한 새 인스턴스 생성.
     */
    public RetryStrategy withBackoffBase(Duration backoffBase) {
        return new RetryStrategy(maxRetries, backoffBase, maxBackoff, jitter, retryOn);
    }

    /**
     * maxBackoff만 변경한 새 인스턴스 생성.
     */
    public RetryStrategy withMaxBackoff(Duration maxBackoff) {
        return new RetryStrategy(maxRetries, backoffBase, maxBackoff, jitter, retryOn);
    }

    /**
     * jitter만 변경한 새 인스턴스 생성.
     */
    public RetryStrategy withJitter(boolean jitter) {
        return new RetryStrategy(maxRetries, backoffBase, maxBackoff, jitter, retryOn);
    }

    /**
     * 재시도 대상 조건만 변경한 새 인스턴스 생성.
     */
    public RetryStrategy withRetryOn(Predicate<Exception> retryOn) {
        return new RetryStrategy(maxRetries, backoffBase, maxBackoff, jitter, retryOn);
    }

    /**
     * 특정 타입의 예외만 재시도하는 새 인스턴스 생성.
     *
     * @param type 재시도할 예외 타입 (하위 타입 포함)
     * @return RetryStrategy
     */
    public RetryStrategy retryingOnly(Class<? extends Exception> type) {
        if (type == null) {
            throw new PrimitiveConfigurationException("type cannot be null");
        }
        return withRetryOn(type::isInstance);
    }

    /**
     * 실패가 재시도 대상인지 판별.
     *
     * @param failure 발생한 예외
     * @return 재시도 대상이면 true
     */
    public boolean shouldRetry(Exception failure) {
        if (failure instanceof InterruptedException) {
            return false;
        }
        return retryOn.test(failure);
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 실패한 시도 번호 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculateDelay(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        long baseMs = backoffBase.toMillis();
        long maxMs = maxBackoff.toMillis();

        // overflow 방지: shift 상한 + 곱셈 전 상한 비교
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long multiplier = 1L << shift;
        long exponential = baseMs > maxMs / multiplier ? maxMs : Math.min(baseMs * multiplier, maxMs);

        if (!jitter) {
            return exponential;
        }

        double factor = 0.5 + ThreadLocalRandom.current().nextDouble();
        return Math.min((long) (exponential * factor), maxMs);
    }
}
