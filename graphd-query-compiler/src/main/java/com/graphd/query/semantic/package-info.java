/**
 * Parse completion and semantic checks of constraint trees.
 *
 * <ul>
 *   <li>{@link com.graphd.query.semantic.ParseCompletion} - merges parsed
 *       clauses and fills in request-independent defaults</li>
 *   <li>{@link com.graphd.query.semantic.SemanticChecker} - validates
 *       variable scoping, linkages, keys, and fills in result patterns
 *       and page sizes</li>
 * </ul>
 */
package com.graphd.query.semantic;
