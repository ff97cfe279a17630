package io.contractdb.core.database;

import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.Value;

import java.util.function.BiConsumer;

/**
 * Read access to one typed map.
 * Handles returned by {@link ContractDatabase#getDataMap(String)} hold a shared
 * borrow on the map until closed.
 */
public interface DataMapView extends AutoCloseable {

    /**
     * Stored value for {@code key}, or {@link Value#voidValue()} if there is none.
     *
     * @throws TypeMismatchException if the key type does not admit {@code key}
     */
    Value fetchEntry(Value key);

    TupleTypeSignature keyType();

    TupleTypeSignature valueType();

    /** Number of entries (debug/snapshots). */
    long size();

    /** Visit every entry; order is backend-specific. */
    void forEachEntry(BiConsumer<Value, Value> visitor);

    /** Release the borrow. Plain maps have nothing to release. */
    @Override
    default void close() {}
}
