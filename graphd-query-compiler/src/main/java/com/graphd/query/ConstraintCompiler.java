package com.graphd.query;

import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintOr;
import com.graphd.query.constraint.SetSizeEstimator;
import com.graphd.query.guid.GenerationConverter;
import com.graphd.query.guid.StorageException;
import com.graphd.query.semantic.ParseCompletion;
import com.graphd.query.semantic.SemanticChecker;
import com.graphd.query.tracing.TracingUtil;
import com.graphd.query.variable.VariableAnalysis;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a parsed constraint tree into an executable plan.
 *
 * <p>The phases run in a fixed order, each under its own span:</p>
 * <ol>
 *   <li>{@code complete-parse}: merge clauses, fill local defaults,
 *       infer anchors</li>
 *   <li>{@code semantic-check}: scoping, linkage and key checks; result,
 *       page size and sort defaults; ids</li>
 *   <li>{@code variable-analysis} (reads only): alias resolution, sort
 *       roots, assignment order, pattern frames</li>
 *   <li>{@code guid-convert}: lower version-relative GUID
 *       constraints</li>
 *   <li>{@code set-size} (reads only): bound each constraint's
 *       result set</li>
 * </ol>
 *
 * <p>The first error aborts compilation. A constraint found to match
 * nothing is not an error; it is marked false.</p>
 */
public final class ConstraintCompiler {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ConstraintCompiler.class);

    /** One step of the pipeline. */
    @FunctionalInterface
    private interface Phase {
        void run() throws SemanticException, StorageException;
    }

    /** Tracer for compiler spans. */
    private final Tracer tracer;

    /**
     * Create a compiler that traces through {@link TracingUtil}.
     */
    public ConstraintCompiler() {
        this(TracingUtil.compilerTracer());
    }

    /**
     * Create a compiler with its own tracer.
     *
     * @param tracer the tracer
     */
    public ConstraintCompiler(final Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Compile a request's constraint tree in place.
     *
     * @param request the request
     * @throws SemanticException if the request cannot be compiled; storage
     *     failures arrive as {@link SemanticException.Category#SYSTEM}
     */
    public void compile(final QueryRequest request) throws SemanticException {
        Constraint root = request.root();
        RequestKind kind = request.kind();

        Span span = TracingUtil.startSpan(tracer, "ConstraintCompiler.compile");
        span.setAttribute(TracingUtil.ATTR_REQUEST_KIND, kind.name());

        try (Scope scope = span.makeCurrent()) {
            phase("complete-parse", () -> ParseCompletion.complete(root));
            span.setAttribute(TracingUtil.ATTR_CONSTRAINT_COUNT,
                (long) countAll(root));

            phase("semantic-check",
                () -> SemanticChecker.completeSubtree(request, root));
            if (kind.isRead()) {
                phase("variable-analysis", () -> VariableAnalysis.analyze(root));
            }
            phase("guid-convert", () -> new GenerationConverter(
                request.oracle(), request.asOf(), kind.isRead()).convert(root));
            if (kind.isRead()) {
                phase("set-size", () -> estimateSetSizes(request, root));
            }

            long falseCount = countFalse(root);
            span.setAttribute(TracingUtil.ATTR_FALSE_COUNT, falseCount);
            span.setStatus(StatusCode.OK);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("compiled {} request: {} ({} false)", kind, root,
                    falseCount);
            }
        } catch (SemanticException e) {
            span.setAttribute(TracingUtil.ATTR_ERROR_CATEGORY,
                e.getCategory().name());
            TracingUtil.recordFailure(span, e);
            LOGGER.debug("{} request fails: {}", kind, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private void phase(final String name, final Phase body)
            throws SemanticException {
        Span span = TracingUtil.startSpan(tracer, name);
        try (Scope scope = span.makeCurrent()) {
            body.run();
            span.setStatus(StatusCode.OK);
        } catch (StorageException e) {
            TracingUtil.recordFailure(span, e);
            throw new SemanticException(SemanticException.Category.SYSTEM,
                "storage failure during " + name + ": " + e.getMessage(), e);
        } catch (SemanticException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void estimateSetSizes(final QueryRequest request,
            final Constraint con) throws StorageException {
        SetSizeEstimator.initialize(request.oracle(), con);
        SetSizeEstimator.refine(request.oracle(), con);
        for (Constraint sub : con.getSubs()) {
            estimateSetSizes(request, sub);
        }
    }

    /**
     * Number of constraints in a tree, or-branches included.
     *
     * @param con the root
     * @return the count
     */
    static int countAll(final Constraint con) {
        int n = 1;
        for (ConstraintOr cor : con.getOrs()) {
            n += countAll(cor.getHead());
            if (cor.getTail() != null) {
                n += countAll(cor.getTail());
            }
        }
        for (Constraint sub : con.getSubs()) {
            if (sub.getParent() == con) {
                n += countAll(sub);
            }
        }
        return n;
    }

    /**
     * Number of constraints in a tree, or-branches included, that match
     * nothing.
     *
     * @param con the root
     * @return the count
     */
    static long countFalse(final Constraint con) {
        long n = con.isFalse() ? 1 : 0;
        for (ConstraintOr cor : con.getOrs()) {
            n += countFalse(cor.getHead());
            if (cor.getTail() != null) {
                n += countFalse(cor.getTail());
            }
        }
        for (Constraint sub : con.getSubs()) {
            if (sub.getParent() == con) {
                n += countFalse(sub);
            }
        }
        return n;
    }
}
