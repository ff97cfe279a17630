package io.contractdb.core.database;

import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.TypeSignature;
import io.contractdb.core.value.Value;

/**
 * Key/value schema pair fixed at map creation, shared by every backend so that
 * admission behaves identically everywhere.
 */
public final class TypedSchemas {
    private final TupleTypeSignature keyTuple;
    private final TupleTypeSignature valueTuple;
    private final TypeSignature keyType;
    private final TypeSignature valueType;

    public TypedSchemas(TupleTypeSignature keyTuple, TupleTypeSignature valueTuple) {
        if (keyTuple == null || valueTuple == null) {
            throw new IllegalArgumentException("Key and value types are required");
        }
        this.keyTuple = keyTuple;
        this.valueTuple = valueTuple;
        this.keyType = keyTuple.asType();
        this.valueType = valueTuple.asType();
    }

    public TupleTypeSignature keyTuple() { return keyTuple; }
    public TupleTypeSignature valueTuple() { return valueTuple; }

    public void checkKey(Value key) {
        if (!keyType.admits(key)) {
            throw new TypeMismatchException(keyType, key);
        }
    }

    public void checkEntry(Value key, Value value) {
        checkKey(key);
        if (!valueType.admits(value)) {
            throw new TypeMismatchException(valueType, value);
        }
    }
}
