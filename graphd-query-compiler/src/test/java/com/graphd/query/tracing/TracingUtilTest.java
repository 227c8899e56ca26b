package com.graphd.query.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TracingUtil class.
 */
public class TracingUtilTest {

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;

    @BeforeEach
    public void setUp() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
            .build();
    }

    @AfterEach
    public void tearDown() {
        tracerProvider.close();
    }

    @Test
    @DisplayName("The compiler scope names the compiler class")
    public void testScopeConstant() {
        assertEquals("com.graphd.query.ConstraintCompiler",
            TracingUtil.SCOPE_COMPILER);
    }

    @Test
    @DisplayName("Attribute keys live under the graphd namespace")
    public void testAttributeKeys() {
        assertEquals("graphd.request.kind",
            TracingUtil.ATTR_REQUEST_KIND.getKey());
        assertEquals("graphd.constraint.count",
            TracingUtil.ATTR_CONSTRAINT_COUNT.getKey());
        assertEquals("graphd.constraint.false_count",
            TracingUtil.ATTR_FALSE_COUNT.getKey());
        assertEquals("graphd.error.category",
            TracingUtil.ATTR_ERROR_CATEGORY.getKey());
    }

    @Test
    @DisplayName("The shared OpenTelemetry instance is built once")
    public void testOpenTelemetrySingleton() {
        OpenTelemetry first = TracingUtil.openTelemetry();
        assertNotNull(first);
        assertSame(first, TracingUtil.openTelemetry());
        assertNotNull(TracingUtil.compilerTracer());
    }

    @Test
    @DisplayName("Only a true OTEL_SDK_DISABLED turns tracing off")
    public void testIsDisabled() {
        assertFalse(TracingUtil.isDisabled(null));
        assertFalse(TracingUtil.isDisabled(""));
        assertFalse(TracingUtil.isDisabled("false"));
        assertFalse(TracingUtil.isDisabled("yes"));
        assertTrue(TracingUtil.isDisabled("true"));
        assertTrue(TracingUtil.isDisabled(" TRUE "));
    }

    @Test
    @DisplayName("startSpan opens an internal span with the given name")
    public void testStartSpan() {
        Span span = TracingUtil.startSpan(
            tracerProvider.get("com.graphd.query.test"), "semantic-check");
        span.end();

        SpanData data = spanExporter.getFinishedSpanItems().get(0);
        assertEquals("semantic-check", data.getName());
        assertEquals(SpanKind.INTERNAL, data.getKind());
    }

    @Test
    @DisplayName("recordFailure sets ERROR status and records the exception")
    public void testRecordFailure() {
        Span span = TracingUtil.startSpan(
            tracerProvider.get("com.graphd.query.test"), "guid-convert");
        TracingUtil.recordFailure(span,
            new IllegalStateException("no lineage"));
        span.end();

        SpanData data = spanExporter.getFinishedSpanItems().get(0);
        assertEquals(StatusCode.ERROR, data.getStatus().getStatusCode());
        assertEquals("no lineage", data.getStatus().getDescription());
        assertEquals(1, data.getEvents().size());
        assertEquals("exception", data.getEvents().get(0).getName());
    }

    @Test
    @DisplayName("TracingUtil cannot be instantiated")
    public void testPrivateConstructor() {
        var constructors = TracingUtil.class.getDeclaredConstructors();
        assertEquals(1, constructors.length);
        assertFalse(constructors[0].canAccess(null));
    }
}
