package io.contractdb.core.database;

import io.contractdb.core.value.TupleTypeSignature;

import java.util.Optional;
import java.util.Set;

/**
 * Named collection of typed maps owned by one contract.
 * Backends (in-memory, RocksDB) implement the same contract so callers can swap them.
 *
 * Notes:
 * - A missing map is {@code Optional.empty()}, never an error.
 * - Many read handles or one read-write handle per name may be open at a time;
 *   conflicting requests throw {@link IllegalStateException}.
 * - Handles must be closed to release their borrow.
 */
public interface ContractDatabase extends AutoCloseable {

    /** Shared read handle, if the map exists. */
    Optional<DataMapView> getDataMap(String mapName);

    /** Exclusive read-write handle, if the map exists. */
    Optional<DataMap> getMutDataMap(String mapName);

    /**
     * Install a new empty map under {@code mapName}.
     * Replaces any existing map of that name, entries included.
     */
    void createMap(String mapName, TupleTypeSignature keyType, TupleTypeSignature valueType);

    /** Names of all maps, sorted. */
    Set<String> mapNames();

    boolean hasMap(String mapName);

    /** True while any read or read-write handle on {@code mapName} is open. */
    boolean isBorrowed(String mapName);

    /** Release storage; handles still open become unusable. */
    @Override
    void close();
}
