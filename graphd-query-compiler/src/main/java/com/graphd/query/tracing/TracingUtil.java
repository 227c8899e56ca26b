package com.graphd.query.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracing for the constraint compiler.
 *
 * <p>Holds the compiler's span attribute keys and the helpers that open
 * and fail phase spans. The shared tracer exports over OTLP and is set
 * up on first use from the environment:</p>
 * <ul>
 *   <li>{@code OTEL_SDK_DISABLED} - {@code true} turns tracing into a
 *       no-op</li>
 *   <li>{@code OTEL_SERVICE_NAME} - defaults to
 *       {@code graphd-query-compiler}</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - defaults to
 *       {@code http://localhost:4317}</li>
 * </ul>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Instrumentation scope of the constraint compiler. */
    public static final String SCOPE_COMPILER =
        "com.graphd.query.ConstraintCompiler";

    /** Attribute key for the request kind. */
    public static final AttributeKey<String> ATTR_REQUEST_KIND =
        AttributeKey.stringKey("graphd.request.kind");

    /** Attribute key for the number of constraints, or-branches included. */
    public static final AttributeKey<Long> ATTR_CONSTRAINT_COUNT =
        AttributeKey.longKey("graphd.constraint.count");

    /** Attribute key for the number of constraints that match nothing. */
    public static final AttributeKey<Long> ATTR_FALSE_COUNT =
        AttributeKey.longKey("graphd.constraint.false_count");

    /** Attribute key for the category of a failed compilation. */
    public static final AttributeKey<String> ATTR_ERROR_CATEGORY =
        AttributeKey.stringKey("graphd.error.category");

    /** Service name unless the environment names one. */
    static final String DEFAULT_SERVICE_NAME = "graphd-query-compiler";

    /** OTLP endpoint unless the environment names one. */
    static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /** Shared instance, built on first use. */
    private static volatile OpenTelemetry openTelemetry;

    /** Lock for initialization. */
    private static final Object INIT_LOCK = new Object();

    /** Prevent instantiation. */
    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * The tracer the compiler uses unless it is given one.
     *
     * @return the tracer for {@link #SCOPE_COMPILER}
     */
    public static Tracer compilerTracer() {
        return openTelemetry().getTracer(SCOPE_COMPILER);
    }

    /**
     * Start an internal span; the caller makes it current and ends it.
     *
     * @param tracer the tracer
     * @param name the span name, a phase or the whole compilation
     * @return the started span
     */
    public static Span startSpan(final Tracer tracer, final String name) {
        return tracer.spanBuilder(name)
            .setSpanKind(SpanKind.INTERNAL)
            .startSpan();
    }

    /**
     * Mark a span failed and attach the exception as an event.
     *
     * @param span the span
     * @param e the failure
     */
    public static void recordFailure(final Span span, final Throwable e) {
        span.setStatus(StatusCode.ERROR, e.getMessage());
        span.recordException(e);
    }

    /**
     * Whether an {@code OTEL_SDK_DISABLED} value turns tracing off.
     *
     * @param value null or the variable's text
     * @return true for {@code true} in any case
     */
    static boolean isDisabled(final String value) {
        return value != null && Boolean.parseBoolean(value.trim());
    }

    static OpenTelemetry openTelemetry() {
        if (openTelemetry == null) {
            synchronized (INIT_LOCK) {
                if (openTelemetry == null) {
                    openTelemetry = build();
                }
            }
        }
        return openTelemetry;
    }

    private static OpenTelemetry build() {
        if (isDisabled(System.getenv("OTEL_SDK_DISABLED"))) {
            LOGGER.info("compiler tracing is disabled");
            return OpenTelemetry.noop();
        }
        String service = envOr("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME);
        String endpoint = envOr("OTEL_EXPORTER_OTLP_ENDPOINT",
            DEFAULT_OTLP_ENDPOINT);
        LOGGER.info("compiler tracing to {} as {}", endpoint, service);

        SdkTracerProvider provider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(
                OtlpGrpcSpanExporter.builder().setEndpoint(endpoint).build())
                .build())
            .setResource(Resource.getDefault().merge(Resource.create(
                Attributes.of(ServiceAttributes.SERVICE_NAME, service))))
            .build();

        // Pending spans are flushed on exit.
        Runtime.getRuntime().addShutdownHook(new Thread(provider::shutdown));

        return OpenTelemetrySdk.builder()
            .setTracerProvider(provider)
            .setPropagators(ContextPropagators.create(
                W3CTraceContextPropagator.getInstance()))
            .build();
    }

    private static String envOr(final String name, final String fallback) {
        String value = System.getenv(name);
        return value == null || value.isEmpty() ? fallback : value;
    }
}
