/**
 * Variables, assignments and the analysis that lays out a constraint's
 * result frames.
 *
 * <p>{@link com.graphd.query.variable.VariableAnalysis} runs the
 * per-request pipeline over a checked read request.</p>
 */
package com.graphd.query.variable;
