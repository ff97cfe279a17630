package io.contractdb.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contractdb.core.codec.JsonCodec;
import io.contractdb.core.database.AbstractContractDatabase;
import io.contractdb.core.database.DataMap;
import io.contractdb.core.database.TypedSchemas;
import io.contractdb.core.value.TupleTypeSignature;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Persistent contract database using RocksDB.
 *
 * Layout (column families):
 *  - "schemas" : key = map name (UTF-8), val = {"keyType":..., "valueType":...} JSON
 *  - "entries" : key = len(name) | name | ValueCodec(key), val = ValueCodec(value)
 *
 * Schemas are cached in memory at open; entries are always read from RocksDB.
 */
public final class RocksDBContractDatabase extends AbstractContractDatabase {
    private static final Logger LOG = Logger.getLogger(RocksDBContractDatabase.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfSchemas;
    private final ColumnFamilyHandle cfEntries;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;
    private final String dataDir;

    private final TreeMap<String, RocksDBDataMap> maps = new TreeMap<>();
    private boolean closed;

    private RocksDBContractDatabase(RocksDB db,
                                    List<ColumnFamilyHandle> handles,
                                    DBOptions dbOptions,
                                    String dataDir,
                                    boolean metricsEnabled) {
        super(metricsEnabled);
        this.db = db;
        this.handles = handles;
        this.cfSchemas = handles.get(1);
        this.cfEntries = handles.get(2);
        this.dbOptions = dbOptions;
        this.dataDir = dataDir;
    }

    /** Factory: open/create a database in the given directory path. */
    public static RocksDBContractDatabase open(String dataDir) {
        return open(dataDir, true);
    }

    public static RocksDBContractDatabase open(String dataDir, boolean metricsEnabled) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("schemas".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("entries".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);

            RocksDBContractDatabase store = new RocksDBContractDatabase(db, cfHandles, dbOpts, dataDir, metricsEnabled);
            try {
                store.loadSchemas();
            } catch (RuntimeException e) {
                // release the directory lock so a later open reports the same failure
                store.freeNative();
                throw e;
            }
            LOG.info("Opened contract database at " + dataDir + " (" + store.maps.size() + " maps)");
            return store;
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new RuntimeException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    private void loadSchemas() {
        try (RocksIterator it = db.newIterator(cfSchemas)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                String name = new String(it.key(), StandardCharsets.UTF_8);
                TypedSchemas types = decodeSchemas(name, it.value());
                maps.put(name, new RocksDBDataMap(this, db, cfEntries, name, types));
            }
        }
    }

    // -------------- ContractDatabase API ----------------

    @Override
    protected DataMap lookup(String mapName) {
        ensureOpen();
        return maps.get(mapName);
    }

    @Override
    protected void install(String mapName, TupleTypeSignature keyType, TupleTypeSignature valueType) {
        ensureOpen();
        TypedSchemas types = new TypedSchemas(keyType, valueType);
        byte[] prefix = RocksDBDataMap.prefixFor(mapName);

        // schema row and removal of old entries land in one batch
        try (WriteOptions wo = new WriteOptions();
             WriteBatch batch = new WriteBatch();
             RocksIterator it = db.newIterator(cfEntries)) {
            for (it.seek(prefix); it.isValid() && RocksDBDataMap.hasPrefix(it.key(), prefix); it.next()) {
                batch.delete(cfEntries, it.key());
            }
            batch.put(cfSchemas, mapName.getBytes(StandardCharsets.UTF_8), encodeSchemas(types));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new RuntimeException("createMap failed", e);
        }
        maps.put(mapName, new RocksDBDataMap(this, db, cfEntries, mapName, types));
    }

    @Override
    public Set<String> mapNames() {
        ensureOpen();
        return Collections.unmodifiableSet(new TreeSet<>(maps.keySet()));
    }

    public String dataDir() {
        return dataDir;
    }

    @Override
    public void close() {
        if (closed) return;
        releaseAllBorrows();
        freeNative();
        LOG.info("Closed contract database at " + dataDir);
    }

    private void freeNative() {
        closed = true;
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle h : handles) {
            h.close();
        }
        db.close();
        dbOptions.close();
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Database at " + dataDir + " is closed");
        }
    }

    // -------------- helpers ----------------

    private static byte[] encodeSchemas(TypedSchemas types) {
        ObjectNode node = JsonCodec.mapper().createObjectNode();
        node.set("keyType", JsonCodec.tupleTypeToJson(types.keyTuple()));
        node.set("valueType", JsonCodec.tupleTypeToJson(types.valueTuple()));
        try {
            return JsonCodec.mapper().writeValueAsBytes(node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode schemas", e);
        }
    }

    private static TypedSchemas decodeSchemas(String mapName, byte[] raw) {
        try {
            JsonNode node = JsonCodec.mapper().readTree(raw);
            return new TypedSchemas(
                    JsonCodec.tupleTypeFromJson(node.get("keyType")),
                    JsonCodec.tupleTypeFromJson(node.get("valueType")));
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Corrupt schema row for map '" + mapName + "'", e);
        }
    }
}
