/**
 * The constraint tree: constraints, parsed clauses, alternations and
 * per-constraint filters.
 */
package com.graphd.query.constraint;
