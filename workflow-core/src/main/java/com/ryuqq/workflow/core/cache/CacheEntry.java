package com.ryuqq.workflow.core.cache;

import java.time.Instant;

/**
 * 캐시 항목.
 *
 * @param key 캐시 키
 * @param value 저장된 결과
 * @param expiry 만료 시각
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record CacheEntry<V>(
    String key,
    V value,
    Instant expiry
) {

    public CacheEntry {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (expiry == null) {
            throw new IllegalArgumentException("expiry cannot be null");
        }
    }

    /**
     * 주어진 시각 기준으로 유효한지 확인 ({@code now < expiry}).
     *
     * @param now 현재 시각
     * @return 유효하면 true
     */
    public boolean isValid(Instant now) {
        return now.isBefore(expiry);
    }
}
