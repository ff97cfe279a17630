package io.contractdb.core.database;

import io.contractdb.core.metrics.DatabaseMetrics;
import io.contractdb.core.value.TupleTypeSignature;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Borrow bookkeeping, metrics and logging shared by every backend.
 * Subclasses only look up and install the underlying maps.
 */
public abstract class AbstractContractDatabase implements ContractDatabase {
    private static final Logger LOG = Logger.getLogger(AbstractContractDatabase.class.getName());

    private final BorrowRegistry borrows = new BorrowRegistry();
    private final boolean metricsEnabled;

    protected AbstractContractDatabase(boolean metricsEnabled) {
        this.metricsEnabled = metricsEnabled;
    }

    /** Backend map for {@code mapName}, or null if absent. */
    protected abstract DataMap lookup(String mapName);

    /** Replace whatever is stored under {@code mapName} with an empty map. */
    protected abstract void install(String mapName, TupleTypeSignature keyType, TupleTypeSignature valueType);

    @Override
    public Optional<DataMapView> getDataMap(String mapName) {
        DataMap map = mapName == null ? null : lookup(mapName);
        if (map == null) return Optional.empty();
        return Optional.of(MapHandles.read(map, borrows.acquireShared(mapName), metricsEnabled));
    }

    @Override
    public Optional<DataMap> getMutDataMap(String mapName) {
        DataMap map = mapName == null ? null : lookup(mapName);
        if (map == null) return Optional.empty();
        return Optional.of(MapHandles.write(map, borrows.acquireExclusive(mapName), metricsEnabled));
    }

    @Override
    public void createMap(String mapName, TupleTypeSignature keyType, TupleTypeSignature valueType) {
        if (mapName == null || mapName.isEmpty()) {
            throw new IllegalArgumentException("Map name must not be empty");
        }
        if (keyType == null || valueType == null) {
            throw new IllegalArgumentException("Key and value types are required");
        }
        borrows.ensureNotBorrowed(mapName);
        if (hasMap(mapName)) {
            LOG.warning("Replacing existing map '" + mapName + "'; its entries are discarded");
        }
        install(mapName, keyType, valueType);
        if (metricsEnabled) DatabaseMetrics.recordMapCreated();
    }

    @Override
    public boolean isBorrowed(String mapName) {
        return mapName != null && borrows.isBorrowed(mapName);
    }

    /** Invalidate all handles still open; call from close() before freeing storage. */
    protected final void releaseAllBorrows() {
        int released = borrows.releaseAll();
        if (released > 0) {
            LOG.warning("Closing database with " + released + " open handle(s); they are now invalid");
        }
    }

    @Override
    public boolean hasMap(String mapName) {
        return mapName != null && lookup(mapName) != null;
    }

    public boolean metricsEnabled() {
        return metricsEnabled;
    }
}
