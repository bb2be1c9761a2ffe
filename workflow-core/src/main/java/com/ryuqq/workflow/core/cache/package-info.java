/**
 * Result caching.
 *
 * <p>{@link com.ryuqq.workflow.core.cache.CachePrimitive} memoizes inner results per key with a TTL
 * and a bounded capacity, backed by a Caffeine cache. The clock is bridged to a Caffeine ticker so
 * expiry can be tested deterministically.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.cache;
