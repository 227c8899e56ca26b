/**
 * Value comparators selectable with {@code comparator=}.
 */
package com.graphd.query.comparator;
