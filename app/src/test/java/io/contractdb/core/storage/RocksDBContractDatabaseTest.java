package io.contractdb.core.storage;

import io.contractdb.core.database.ContractDatabase;
import io.contractdb.core.database.ContractDatabaseContractTest;
import io.contractdb.core.database.DataMap;
import io.contractdb.core.database.DataMapView;
import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.TypeSignature;
import io.contractdb.core.value.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RocksDBContractDatabaseTest extends ContractDatabaseContractTest {

    private static final TupleTypeSignature NAME = TupleTypeSignature.builder()
            .field("name", TypeSignature.PRINCIPAL).build();
    private static final TupleTypeSignature COUNT = TupleTypeSignature.builder()
            .field("count", TypeSignature.INT).build();

    @TempDir
    Path tmp;

    @Override
    protected ContractDatabase newDatabase() {
        return RocksDBContractDatabase.open(tmp.resolve("db").toString(), false);
    }

    private static Value name(String n) {
        return Value.tupleBuilder().putPrincipal("name", n).build();
    }

    private static Value count(long c) {
        return Value.tupleBuilder().putInt("count", c).build();
    }

    @Test
    void reopenKeepsNamesSchemasAndEntries() {
        String dir = tmp.resolve("persist").toString();
        try (RocksDBContractDatabase first = RocksDBContractDatabase.open(dir, false)) {
            first.createMap("counters", NAME, COUNT);
            try (DataMap map = first.getMutDataMap("counters").orElseThrow()) {
                map.setEntry(name("alice"), count(3));
                map.setEntry(name("bob"), count(4));
                map.deleteEntry(name("bob"));
            }
        }

        try (RocksDBContractDatabase second = RocksDBContractDatabase.open(dir, false)) {
            assertTrue(second.hasMap("counters"));
            try (DataMapView map = second.getDataMap("counters").orElseThrow()) {
                assertEquals(NAME, map.keyType());
                assertEquals(COUNT, map.valueType());
                assertEquals(count(3), map.fetchEntry(name("alice")));
                assertTrue(map.fetchEntry(name("bob")).isVoid());
                assertEquals(1, map.size());
            }
        }
    }

    @Test
    void recreateRemovesPersistedRows() {
        String dir = tmp.resolve("recreate").toString();
        try (RocksDBContractDatabase store = RocksDBContractDatabase.open(dir, false)) {
            store.createMap("counters", NAME, COUNT);
            try (DataMap map = store.getMutDataMap("counters").orElseThrow()) {
                map.setEntry(name("alice"), count(1));
            }
            store.createMap("counters", NAME, COUNT);
        }
        try (RocksDBContractDatabase store = RocksDBContractDatabase.open(dir, false)) {
            try (DataMapView map = store.getDataMap("counters").orElseThrow()) {
                assertEquals(0, map.size());
                assertTrue(map.fetchEntry(name("alice")).isVoid());
            }
        }
    }

    @Test
    void mapsWithPrefixedNamesStaySeparate() {
        db.createMap("a", NAME, COUNT);
        db.createMap("ab", NAME, COUNT);
        try (DataMap a = db.getMutDataMap("a").orElseThrow();
             DataMap ab = db.getMutDataMap("ab").orElseThrow()) {
            a.setEntry(name("x"), count(1));
            ab.setEntry(name("x"), count(2));
            ab.setEntry(name("y"), count(3));
            assertEquals(1, a.size());
            assertEquals(2, ab.size());
        }
        db.createMap("a", NAME, COUNT);
        try (DataMapView ab = db.getDataMap("ab").orElseThrow()) {
            assertEquals(count(2), ab.fetchEntry(name("x")));
        }
    }

    @Test
    void forEachEntryDecodesKeysAndValues() {
        db.createMap("counters", NAME, COUNT);
        try (DataMap map = db.getMutDataMap("counters").orElseThrow()) {
            map.setEntry(name("alice"), count(1));
            map.setEntry(name("bob"), count(2));
            Map<Value, Value> seen = new HashMap<>();
            map.forEachEntry(seen::put);
            assertEquals(Map.of(name("alice"), count(1), name("bob"), count(2)), seen);
        }
    }

    @Test
    void closedDatabaseRejectsLookups() {
        RocksDBContractDatabase store = RocksDBContractDatabase.open(tmp.resolve("closed").toString(), false);
        store.close();
        store.close();
        assertThrows(IllegalStateException.class, () -> store.getDataMap("balances"));
    }

    @Test
    void readHandleFailsCleanlyAfterStoreClose() {
        RocksDBContractDatabase store = RocksDBContractDatabase.open(tmp.resolve("closing").toString(), false);
        store.createMap("counters", NAME, COUNT);
        DataMapView view = store.getDataMap("counters").orElseThrow();
        store.close();

        assertThrows(IllegalStateException.class, () -> view.fetchEntry(name("alice")));
        assertThrows(IllegalStateException.class, view::size);
        assertFalse(store.isBorrowed("counters"));
    }

    @Test
    void corruptSchemaRowReleasesLock() throws Exception {
        String dir = tmp.resolve("corrupt").toString();
        try (RocksDBContractDatabase store = RocksDBContractDatabase.open(dir, false)) {
            store.createMap("counters", NAME, COUNT);
        }
        overwriteSchemaRow(dir, "counters", "not json".getBytes(StandardCharsets.UTF_8));

        for (int attempt = 0; attempt < 2; attempt++) {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> RocksDBContractDatabase.open(dir, false));
            assertEquals("Corrupt schema row for map 'counters'", ex.getMessage());
        }
    }

    private static void overwriteSchemaRow(String dir, String mapName, byte[] raw) throws Exception {
        List<ColumnFamilyDescriptor> descs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("schemas".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("entries".getBytes(StandardCharsets.UTF_8)));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try (DBOptions opts = new DBOptions()) {
            RocksDB db = RocksDB.open(opts, dir, descs, handles);
            try {
                db.put(handles.get(1), mapName.getBytes(StandardCharsets.UTF_8), raw);
            } finally {
                for (ColumnFamilyHandle h : handles) {
                    h.close();
                }
                db.close();
            }
        }
    }
}
