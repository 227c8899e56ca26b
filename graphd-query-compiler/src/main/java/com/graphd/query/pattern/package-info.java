/**
 * Result and sort pattern trees.
 */
package com.graphd.query.pattern;
