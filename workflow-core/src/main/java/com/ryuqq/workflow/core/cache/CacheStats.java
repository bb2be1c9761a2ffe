package com.ryuqq.workflow.core.cache;

/**
 * 캐시 통계 스냅샷.
 *
 * @param hits 누적 hit 횟수
 * @param misses 누적 miss 횟수 (만료 포함)
 * @param size 현재 항목 수
 * @param evictions 용량 초과 또는 만료로 제거된 항목 수
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record CacheStats(
    long hits,
    long misses,
    int size,
    long evictions
) {

    /**
     * Hit 비율 (백분율, 소수점 둘째 자리 반올림).
     *
     * <p>조회가 한 번도 없으면 0.0입니다. 예: hit 2, miss 1 → 66.67</p>
     *
     * @return hit 비율 (0.0 ~ 100.0)
     */
    public double hitRate() {
        long total = hits + misses;
        if (total == 0) {
            return 0.0;
        }
        return Math.round(hits * 10000.0 / total) / 100.0;
    }
}
