package io.contractdb.core.database;

import io.contractdb.core.value.Value;

/**
 * Read-write access to one typed map.
 * Every mutator validates its arguments first; a failed call changes nothing.
 */
public interface DataMap extends DataMapView {

    /** Insert or overwrite the entry for {@code key}. */
    void setEntry(Value key, Value value);

    /**
     * Insert only if {@code key} has no entry.
     * @return true if inserted, false if an entry already existed (nothing written)
     */
    boolean insertEntry(Value key, Value value);

    /** @return true if an entry existed and was removed */
    boolean deleteEntry(Value key);
}
