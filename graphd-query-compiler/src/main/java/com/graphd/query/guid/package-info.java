/**
 * GUID sets, GUID constraints, and their conversion against the
 * version lineages kept by storage.
 *
 * <p>Storage is reached only through
 * {@link com.graphd.query.guid.StorageOracle}.</p>
 */
package com.graphd.query.guid;
