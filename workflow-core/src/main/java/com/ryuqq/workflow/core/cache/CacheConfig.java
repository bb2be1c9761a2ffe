package com.ryuqq.workflow.core.cache;

import com.ryuqq.workflow.core.exception.PrimitiveConfigurationException;

import java.time.Duration;

/**
 * CachePrimitive 설정 (불변 record).
 *
 * @param ttl 항목 유효 기간 (양수)
 * @param maxEntries 최대 항목 수 (양수, 초과 시 빈도 기반 제거)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record CacheConfig(
    Duration ttl,
    int maxEntries
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: ttl=1h, maxEntries=1000</p>
     */
    public CacheConfig() {
        this(Duration.ofHours(1), 1000);
    }

    public CacheConfig {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new PrimitiveConfigurationException(
                "ttl must be positive (current: " + ttl + ")"
            );
        }
        if (maxEntries <= 0) {
            throw new PrimitiveConfigurationException(
                "maxEntries must be positive (current: " + maxEntries + ")"
            );
        }
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(ttl, maxEntries);
    }

    public CacheConfig withMaxEntries(int maxEntries) {
        return new CacheConfig(ttl, maxEntries);
    }
}
