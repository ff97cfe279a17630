package io.contractdb.core.storage;

import io.contractdb.core.codec.ValueCodec;
import io.contractdb.core.database.DataMap;
import io.contractdb.core.database.TypedSchemas;
import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.Value;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.BiConsumer;

/**
 * Typed map stored as rows of the "entries" column family.
 * Row key = len(name) | name | ValueCodec(key), row value = ValueCodec(value).
 */
final class RocksDBDataMap implements DataMap {

    private final RocksDBContractDatabase owner;
    private final RocksDB db;
    private final ColumnFamilyHandle cfEntries;
    private final byte[] prefix;
    private final TypedSchemas types;

    RocksDBDataMap(RocksDBContractDatabase owner, RocksDB db, ColumnFamilyHandle cfEntries,
                   String mapName, TypedSchemas types) {
        this.owner = owner;
        this.db = db;
        this.cfEntries = cfEntries;
        this.prefix = prefixFor(mapName);
        this.types = types;
    }

    @Override
    public Value fetchEntry(Value key) {
        types.checkKey(key);
        owner.ensureOpen();
        try {
            byte[] raw = db.get(cfEntries, rowKey(key));
            return raw == null ? Value.voidValue() : ValueCodec.fromBytes(raw);
        } catch (RocksDBException e) {
            throw new RuntimeException("fetchEntry failed", e);
        }
    }

    @Override
    public void setEntry(Value key, Value value) {
        types.checkEntry(key, value);
        owner.ensureOpen();
        try {
            db.put(cfEntries, rowKey(key), ValueCodec.toBytes(value));
        } catch (RocksDBException e) {
            throw new RuntimeException("setEntry failed", e);
        }
    }

    @Override
    public boolean insertEntry(Value key, Value value) {
        types.checkEntry(key, value);
        owner.ensureOpen();
        byte[] row = rowKey(key);
        try {
            if (db.get(cfEntries, row) != null) {
                return false;
            }
            db.put(cfEntries, row, ValueCodec.toBytes(value));
            return true;
        } catch (RocksDBException e) {
            throw new RuntimeException("insertEntry failed", e);
        }
    }

    @Override
    public boolean deleteEntry(Value key) {
        types.checkKey(key);
        owner.ensureOpen();
        byte[] row = rowKey(key);
        try {
            if (db.get(cfEntries, row) == null) {
                return false;
            }
            db.delete(cfEntries, row);
            return true;
        } catch (RocksDBException e) {
            throw new RuntimeException("deleteEntry failed", e);
        }
    }

    @Override
    public TupleTypeSignature keyType() {
        return types.keyTuple();
    }

    @Override
    public TupleTypeSignature valueType() {
        return types.valueTuple();
    }

    @Override
    public long size() {
        owner.ensureOpen();
        try (RocksIterator it = db.newIterator(cfEntries)) {
            long n = 0;
            for (it.seek(prefix); it.isValid() && hasPrefix(it.key(), prefix); it.next()) n++;
            return n;
        }
    }

    @Override
    public void forEachEntry(BiConsumer<Value, Value> visitor) {
        owner.ensureOpen();
        try (RocksIterator it = db.newIterator(cfEntries)) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] row = it.key();
                if (!hasPrefix(row, prefix)) break;
                Value key = ValueCodec.fromBytes(Arrays.copyOfRange(row, prefix.length, row.length));
                visitor.accept(key, ValueCodec.fromBytes(it.value()));
            }
        }
    }

    private byte[] rowKey(Value key) {
        byte[] k = ValueCodec.toBytes(key);
        byte[] out = new byte[prefix.length + k.length];
        System.arraycopy(prefix, 0, out, 0, prefix.length);
        System.arraycopy(k, 0, out, prefix.length, k.length);
        return out;
    }

    // -------------- helpers ----------------

    static byte[] prefixFor(String mapName) {
        byte[] name = mapName.getBytes(StandardCharsets.UTF_8);
        ByteBuffer b = ByteBuffer.allocate(4 + name.length);
        b.putInt(name.length);
        b.put(name);
        return b.array();
    }

    static boolean hasPrefix(byte[] row, byte[] prefix) {
        if (row.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (row[i] != prefix[i]) return false;
        }
        return true;
    }
}
