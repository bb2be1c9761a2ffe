package com.ryuqq.workflow.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * 결과 캐싱 데코레이터.
 *
 * <p>키 함수로 만든 키에 대해 유효한 항목이 있으면 내부 Primitive를 호출하지 않고 저장된 값을 반환합니다.
 * 없거나 만료되었으면 내부 Primitive를 실행하고 {@code expiry = now + ttl}로 저장합니다.</p>
 *
 * <p><strong>저장소:</strong> Caffeine {@link Cache}
 * ({@code expireAfterWrite(ttl)}, {@code maximumSize(maxEntries)}, {@code recordStats()}).
 * 만료 판단은 주입된 {@link Clock}을 {@link Ticker}로 연결해 수행합니다.</p>
 *
 * <p><strong>용량:</strong> 최대 {@link CacheConfig#maxEntries()}개까지 보관하며,
 * 초과 시 Caffeine의 빈도 기반(Window TinyLFU) 정책으로 항목을 제거합니다.</p>
 *
 * <p><strong>실패:</strong> 내부 Primitive의 실패는 캐시하지 않고 그대로 전파합니다.</p>
 *
 * <p><strong>동시성:</strong> 내부 Primitive 실행은 캐시 밖에서 이루어집니다.
 * 같은 키로 동시에 miss가 나면 내부 Primitive가 여러 번 실행될 수 있고, 마지막 저장이 남습니다.</p>
 *
 * <p><strong>Context 카운터:</strong> hit 시 {@code state["cache_hits"]}, miss 시 {@code state["cache_misses"]}를
 * 1 증가시킵니다. 해당 사건이 없었다면 키는 기록되지 않습니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class CachePrimitive<I, O> implements WorkflowPrimitive<I, O> {

    public static final String HITS_KEY = "cache_hits";
    public static final String MISSES_KEY = "cache_misses";

    private static final Logger log = LoggerFactory.getLogger(CachePrimitive.class);

    private final WorkflowPrimitive<I, O> inner;
    private final CacheKeyFunction<? super I> keyFunction;
    private final CacheConfig config;
    private final Clock clock;
    private final Cache<String, CacheEntry<O>> entries;
    private final LongAdder expired = new LongAdder();

    public CachePrimitive(WorkflowPrimitive<I, O> inner, CacheKeyFunction<? super I> keyFunction, Duration ttl) {
        this(inner, keyFunction, new CacheConfig().withTtl(ttl), Clock.systemUTC());
    }

    public CachePrimitive(WorkflowPrimitive<I, O> inner, CacheKeyFunction<? super I> keyFunction, CacheConfig config) {
        this(inner, keyFunction, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param inner 캐시할 Primitive
     * @param keyFunction 캐시 키 함수
     * @param config TTL과 용량 설정
     * @param clock 만료 판단 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CachePrimitive(
        WorkflowPrimitive<I, O> inner,
        CacheKeyFunction<? super I> keyFunction,
        CacheConfig config,
        Clock clock
    ) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        if (keyFunction == null) {
            throw new IllegalArgumentException("keyFunction cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.inner = inner;
        this.keyFunction = keyFunction;
        this.config = config;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
            .expireAfterWrite(config.ttl())
            .maximumSize(config.maxEntries())
            .ticker(clockTicker(clock))
            .executor(Runnable::run)
            .evictionListener((String key, CacheEntry<O> entry, RemovalCause cause) -> {
                if (cause == RemovalCause.EXPIRED) {
                    expired.increment();
                }
            })
            .recordStats()
            .build();
    }

    // Caffeine은 상대 nanos만 비교하므로 생성 시각을 기준점으로 사용
    private static Ticker clockTicker(Clock clock) {
        Instant origin = clock.instant();
        return () -> Duration.between(origin, clock.instant()).toNanos();
    }

    @Override
    public O execute(I input, WorkflowContext context) throws Exception {
        String key = keyFunction.key(input, context);
        if (key == null) {
            throw new IllegalArgumentException("cache key cannot be null");
        }

        CacheEntry<O> cached = entries.getIfPresent(key);
        if (cached != null) {
            context.incrementState(HITS_KEY);
            log.debug("Cache hit: {} key={}", inner.name(), key);
            return cached.value();
        }

        context.incrementState(MISSES_KEY);
        log.debug("Cache miss: {} key={}", inner.name(), key);

        O result = inner.execute(input, context);
        entries.put(key, new CacheEntry<>(key, result, clock.instant().plus(config.ttl())));
        return result;
    }

    /**
     * 통계 스냅샷 조회.
     *
     * <p>대기 중인 만료/용량 정리를 먼저 수행하므로 {@code size}는 살아 있는 항목 수입니다.</p>
     *
     * @return CacheStats
     */
    public CacheStats stats() {
        entries.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats snapshot = entries.stats();
        return new CacheStats(
            snapshot.hitCount(),
            snapshot.missCount(),
            Math.toIntExact(entries.estimatedSize()),
            snapshot.evictionCount()
        );
    }

    /**
     * 모든 항목 제거 (통계는 유지).
     */
    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    /**
     * 만료된 항목 제거.
     *
     * @return 이번 정리에서 제거된 만료 항목 수
     */
    public int evictExpired() {
        long before = expired.sum();
        entries.cleanUp();
        int removed = Math.toIntExact(expired.sum() - before);
        if (removed > 0) {
            log.debug("Evicted {} expired entries from {}", removed, name());
        }
        return removed;
    }

    @Override
    public String name() {
        return "CachePrimitive(" + inner.name() + ")";
    }

    public WorkflowPrimitive<I, O> getInner() {
        return inner;
    }

    public CacheConfig getConfig() {
        return config;
    }
}
