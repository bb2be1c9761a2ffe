/**
 * Instrumentation adapter.
 *
 * <p>Implements the {@code core.spi.ExecutionListener} SPI on top of SLF4J (MDC plus outcome logging)
 * and OpenTelemetry (spans, counters, duration histogram), and provides
 * {@link com.ryuqq.workflow.adapter.instrumentation.InstrumentedPrimitive} to attach a listener
 * to any primitive without changing its behaviour.</p>
 *
 * <h2>Usage</h2>
 * <pre>
 * ExecutionListener listener = CompositeExecutionListener.of(
 *     new Slf4jExecutionListener(),
 *     new OpenTelemetryExecutionListener(openTelemetry)
 * );
 * WorkflowPrimitive&lt;Order, Receipt&gt; observed = new InstrumentedPrimitive&lt;&gt;(checkout, listener);
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.instrumentation;
