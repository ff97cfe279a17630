package io.contractdb.core.database;

import io.contractdb.core.value.Schema;
import io.contractdb.core.value.Value;

/**
 * A key or value was not admitted by its map's schema.
 * Raised before any mutation; the map is left unchanged.
 */
public final class TypeMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final transient Schema expected;
    private final transient Value actual;

    public TypeMismatchException(Schema expected, Value actual) {
        super("Type mismatch: expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    /** The schema that was violated. */
    public Schema expected() {
        return expected;
    }

    /** The offending key or value. */
    public Value actual() {
        return actual;
    }
}
