package io.contractdb.core.database;

import io.contractdb.core.value.TupleTypeSignature;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory contract database. Resets every process run unless snapshotted.
 */
public final class MemoryContractDatabase extends AbstractContractDatabase {

    private final Map<String, MemoryDataMap> maps = new HashMap<>();

    public MemoryContractDatabase() {
        this(true);
    }

    public MemoryContractDatabase(boolean metricsEnabled) {
        super(metricsEnabled);
    }

    @Override
    protected DataMap lookup(String mapName) {
        return maps.get(mapName);
    }

    @Override
    protected void install(String mapName, TupleTypeSignature keyType, TupleTypeSignature valueType) {
        maps.put(mapName, new MemoryDataMap(keyType, valueType));
    }

    @Override
    public Set<String> mapNames() {
        return Collections.unmodifiableSet(new TreeSet<>(maps.keySet()));
    }

    @Override
    public void close() {
        releaseAllBorrows();
    }
}
