/**
 * Primitive error taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.exception.PrimitiveConfigurationException} - invalid construction</li>
 *   <li>{@link com.ryuqq.workflow.core.exception.PrimitiveTimeoutException} - deadline exceeded, carries the configured duration</li>
 * </ul>
 *
 * <p>Any other failure is whatever the wrapped primitive threw. Decorators rethrow the same
 * instance when their recovery option is exhausted, so callers can keep handling errors by type.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.exception;
