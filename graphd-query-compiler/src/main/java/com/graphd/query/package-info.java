/**
 * Compiler for graphd query constraint trees.
 *
 * <p>{@link com.graphd.query.ConstraintCompiler} takes a
 * {@link com.graphd.query.QueryRequest} whose root constraint came out
 * of the parser and turns it, in place, into the annotated tree the
 * execution engine runs. Errors are reported as
 * {@link com.graphd.query.SemanticException}.</p>
 *
 * @see com.graphd.query.CompilerConfig
 */
package com.graphd.query;
