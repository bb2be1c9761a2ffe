/**
 * Service Provider Interfaces for observing primitive executions.
 *
 * <p>The core module ships no logging, tracing or metrics backend of its own beyond SLF4J.
 * Adapters implement {@link com.ryuqq.workflow.core.spi.ExecutionListener} and are attached
 * by wrapping a primitive.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * observation = listener.start(name, context)
 *   ├─ success → observation.success(elapsed)
 *   └─ failure → observation.failure(error, elapsed)
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.spi;
