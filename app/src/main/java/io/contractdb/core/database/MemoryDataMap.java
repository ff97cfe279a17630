package io.contractdb.core.database;

import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.Value;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Typed map kept in a HashMap. Not persistent on its own; see DatabaseSnapshots.
 */
public final class MemoryDataMap implements DataMap {

    private final Map<Value, Value> map = new HashMap<>();
    private final TypedSchemas types;

    public MemoryDataMap(TupleTypeSignature keyType, TupleTypeSignature valueType) {
        this.types = new TypedSchemas(keyType, valueType);
    }

    @Override
    public Value fetchEntry(Value key) {
        types.checkKey(key);
        Value v = map.get(key);
        return v == null ? Value.voidValue() : v;
    }

    @Override
    public void setEntry(Value key, Value value) {
        types.checkEntry(key, value);
        map.put(key, value);
    }

    @Override
    public boolean insertEntry(Value key, Value value) {
        types.checkEntry(key, value);
        return map.putIfAbsent(key, value) == null;
    }

    @Override
    public boolean deleteEntry(Value key) {
        types.checkKey(key);
        return map.remove(key) != null;
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
        return map.size();
    }

    @Override
    public void forEachEntry(BiConsumer<Value, Value> visitor) {
        map.forEach(visitor);
    }
}
