/**
 * OpenTelemetry tracing for the constraint compiler.
 *
 * <p>Spans are exported via the OTLP protocol to a collector such as
 * Jaeger.</p>
 *
 * @see com.graphd.query.tracing.TracingUtil
 */
package com.graphd.query.tracing;
