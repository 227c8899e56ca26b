/**
 * Sort compilation and sort roots.
 */
package com.graphd.query.sort;
