package com.graphd.query;

import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintLinkage;
import com.graphd.query.constraint.ConstraintOr;
import com.graphd.query.constraint.Linkage;
import com.graphd.query.constraint.Operator;
import com.graphd.query.constraint.StringConstraint;
import com.graphd.query.guid.Guid;
import com.graphd.query.guid.GuidSet;
import com.graphd.query.guid.InMemoryStorageOracle;
import com.graphd.query.guid.StorageException;
import com.graphd.query.guid.StorageOracle;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.tracing.TracingUtil;
import com.graphd.query.variable.Assignments;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConstraintCompiler.
 */
public class ConstraintCompilerTest {

    private static final Guid G1 = new Guid(42, 0);

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;
    private ConstraintCompiler compiler;
    private InMemoryStorageOracle store;

    @BeforeEach
    public void setUp() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
            .build();
        compiler = new ConstraintCompiler(
            tracerProvider.get("com.graphd.query.test"));
        store = new InMemoryStorageOracle().lineage(G1);
    }

    @AfterEach
    public void tearDown() {
        tracerProvider.close();
    }

    private SpanData span(final String name) {
        return spanExporter.getFinishedSpanItems().stream()
            .filter(s -> s.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no span " + name));
    }

    private List<String> spanNames() {
        return spanExporter.getFinishedSpanItems().stream()
            .map(SpanData::getName)
            .collect(Collectors.toList());
    }

    /** {@code (guid=G1 result=(name value))}. */
    private static Constraint guidNameValue() {
        Constraint root = new Constraint();
        root.getGuid().merge(root, Operator.EQ, GuidSet.of(G1));
        root.setResult(Pattern.list(PatternType.NAME, PatternType.VALUE));
        return root;
    }

    @Test
    @DisplayName("A single GUID read compiles to one frame and no variables")
    public void testSingleGuidRead() throws SemanticException {
        Constraint root = guidNameValue();

        compiler.compile(QueryRequest.of(RequestKind.READ, root, store));

        assertFalse(root.isFalse());
        assertEquals("(name, value)", root.getResult().toString());
        assertTrue(root.getAssignments().isEmpty());
        assertTrue(root.getDeclarations().isEmpty());
        assertEquals(1, root.getDeclaredFrameCount());
        assertEquals(1, root.getId());
    }

    @Test
    @DisplayName("Each phase of a read gets a child span of the compile span")
    public void testReadSpans() throws SemanticException {
        Constraint root = guidNameValue();
        Constraint sub = new Constraint();
        sub.setLinkage(ConstraintLinkage.my(Linkage.LEFT));
        root.addSub(sub);

        compiler.compile(QueryRequest.of(RequestKind.READ, root, store));

        assertEquals(List.of("complete-parse", "semantic-check",
            "variable-analysis", "guid-convert", "set-size",
            "ConstraintCompiler.compile"), spanNames());

        SpanData compile = span("ConstraintCompiler.compile");
        assertEquals(StatusCode.OK, compile.getStatus().getStatusCode());
        assertEquals("READ", compile.getAttributes().get(
            TracingUtil.ATTR_REQUEST_KIND));
        assertEquals(2L, compile.getAttributes().get(
            TracingUtil.ATTR_CONSTRAINT_COUNT));
        assertEquals(0L, compile.getAttributes().get(
            TracingUtil.ATTR_FALSE_COUNT));

        SpanData check = span("semantic-check");
        assertEquals(compile.getSpanId(), check.getParentSpanId());
        assertEquals(compile.getTraceId(), check.getTraceId());
        assertEquals(StatusCode.OK, check.getStatus().getStatusCode());
    }

    @Test
    @DisplayName("Writes skip variable analysis and set sizes")
    public void testWriteSpans() throws SemanticException {
        Constraint root = new Constraint();
        root.getNameQueue().add(new StringConstraint(Operator.EQ, "a"));

        compiler.compile(QueryRequest.of(RequestKind.WRITE, root, store));

        assertEquals(List.of("complete-parse", "semantic-check",
            "guid-convert", "ConstraintCompiler.compile"), spanNames());
        assertFalse(root.getNewest().isValid());
    }

    @Test
    @DisplayName("Constraints that cannot match are counted, not rejected")
    public void testFalseCount() throws SemanticException {
        Constraint root = new Constraint();
        root.getGuid().merge(root, Operator.EQ, new GuidSet());

        compiler.compile(QueryRequest.of(RequestKind.READ, root, store));

        assertTrue(root.isFalse());
        assertEquals(1L, span("ConstraintCompiler.compile").getAttributes()
            .get(TracingUtil.ATTR_FALSE_COUNT));
    }

    @Test
    @DisplayName("A variable assigned in nested constraints fails the semantic check")
    public void testNestedDoubleAssignment() {
        Constraint root = new Constraint();
        Assignments.alloc(root, "$x").setResult(
            Pattern.list(PatternType.NAME));
        Constraint sub = new Constraint();
        sub.setLinkage(ConstraintLinkage.my(Linkage.TYPEGUID));
        Assignments.alloc(sub, "$x").setResult(
            Pattern.list(PatternType.VALUE));
        root.addSub(sub);
        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(result, root.getDeclarations().get("$x"));
        root.setResult(result);

        SemanticException e = assertThrows(SemanticException.class,
            () -> compiler.compile(QueryRequest.of(RequestKind.READ, root,
                store)));

        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertEquals("variable $x is assigned to twice in nested "
            + "constraints", e.getDetail());

        assertEquals(List.of("complete-parse", "semantic-check",
            "ConstraintCompiler.compile"), spanNames());
        SpanData compile = span("ConstraintCompiler.compile");
        assertEquals(StatusCode.ERROR, compile.getStatus().getStatusCode());
        assertEquals("SYNTAX", compile.getAttributes().get(
            TracingUtil.ATTR_ERROR_CATEGORY));
        assertEquals(StatusCode.ERROR,
            span("semantic-check").getStatus().getStatusCode());
        assertFalse(compile.getEvents().isEmpty());
    }

    @Test
    @DisplayName("Storage failures surface as system errors")
    public void testStorageFailure() throws StorageException {
        StorageOracle failing = mock(StorageOracle.class);
        when(failing.totalPrimitiveCount())
            .thenThrow(new StorageException("disk gone"));
        Constraint root = new Constraint();
        root.setResult(Pattern.list(PatternType.GUID));

        SemanticException e = assertThrows(SemanticException.class,
            () -> compiler.compile(QueryRequest.of(RequestKind.READ, root,
                failing)));

        assertEquals(SemanticException.Category.SYSTEM, e.getCategory());
        assertEquals("storage failure during set-size: disk gone",
            e.getDetail());
        assertInstanceOf(StorageException.class, e.getCause());
        assertEquals("SYSTEM", span("ConstraintCompiler.compile")
            .getAttributes().get(TracingUtil.ATTR_ERROR_CATEGORY));
    }

    @Test
    @DisplayName("The default constructor traces through TracingUtil")
    public void testDefaultTracer() {
        Constraint root = guidNameValue();

        assertDoesNotThrow(() -> new ConstraintCompiler().compile(
            QueryRequest.of(RequestKind.READ, root, store)));
        assertFalse(root.isFalse());
    }

    @Test
    @DisplayName("Or-branches that match nothing are counted once each")
    public void testFalseCountInBranches() {
        Constraint root = new Constraint();
        Constraint head = new Constraint();
        Constraint tail = new Constraint();
        ConstraintOr cor = new ConstraintOr(head, tail, false);
        cor.setPrototype(root);
        root.getOrs().add(cor);
        head.setOr(cor);
        tail.setOr(cor);
        Constraint shared = new Constraint();
        tail.addSub(shared);
        root.getSubs().add(shared);

        tail.markFalse();
        shared.markFalse();

        assertEquals(4, ConstraintCompiler.countAll(root));
        assertEquals(2L, ConstraintCompiler.countFalse(root));

        head.markFalse();
        assertEquals(3L, ConstraintCompiler.countFalse(root));
    }
}
