package com.graphd.query.guid;

import com.graphd.query.constraint.Linkage;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The questions the compiler asks the primitive store.
 *
 * <p>Calls are synchronous. An empty result means "not found" and is
 * interpreted by the caller; {@link StorageException} is a real
 * failure and aborts compilation.</p>
 */
public interface StorageOracle {

    /**
     * Translate a GUID into the store's local id.
     *
     * @param guid the GUID
     * @return the local id, or empty if the GUID is unknown
     * @throws StorageException on store failure
     */
    OptionalLong resolveGuidToLocalId(Guid guid) throws StorageException;

    /**
     * Describe the lineage a GUID belongs to.
     *
     * @param guid any member of the lineage
     * @param asOf null, or the horizon past which versions are ignored
     * @return the lineage's newest id and length, or empty
     * @throws StorageException on store failure
     */
    Optional<LineageInfo> lineageLastGeneration(Guid guid, Long asOf)
        throws StorageException;

    /**
     * Find the n'th generation of a GUID's lineage.
     *
     * @param guid any member of the lineage
     * @param asOf null, or the horizon past which versions are ignored
     * @param fromNewest count back from the newest rather than forward
     *     from the original
     * @param n the generation offset
     * @return the generation's GUID, or empty if there is none
     * @throws StorageException on store failure
     */
    Optional<Guid> nthGeneration(Guid guid, Long asOf, boolean fromNewest,
        long n) throws StorageException;

    /**
     * Locate a GUID inside its lineage.
     *
     * @param guid the GUID
     * @return the lineage id and generation index, or empty
     * @throws StorageException on store failure
     */
    Optional<LineagePosition> guidToLineagePosition(Guid guid)
        throws StorageException;

    /**
     * Rough number of primitives in an id range whose linkage points to
     * a given primitive.
     *
     * @param linkage the linkage
     * @param endpoint the primitive the linkage points to
     * @param low first local id of the range
     * @param high local id just past the range
     * @return the estimate
     * @throws StorageException on store failure
     */
    long estimateSetSize(Linkage linkage, Guid endpoint, long low, long high)
        throws StorageException;

    /**
     * Number of primitives in the store.
     *
     * @return the count
     * @throws StorageException on store failure
     */
    long totalPrimitiveCount() throws StorageException;
}
