package io.contractdb.core.value;

import java.util.Locale;
import java.util.Objects;

/**
 * Type of a value: an atom (void, bool, int, principal, bounded buffer) or a tuple.
 */
public final class TypeSignature implements Schema {

    public static final TypeSignature VOID = new TypeSignature(Value.Kind.VOID, 0, null);
    public static final TypeSignature BOOL = new TypeSignature(Value.Kind.BOOL, 0, null);
    public static final TypeSignature INT = new TypeSignature(Value.Kind.INT, 0, null);
    public static final TypeSignature PRINCIPAL = new TypeSignature(Value.Kind.PRINCIPAL, 0, null);

    private final Value.Kind kind;
    private final int maxLength;              // BUFFER only
    private final TupleTypeSignature tuple;   // TUPLE only

    private TypeSignature(Value.Kind kind, int maxLength, TupleTypeSignature tuple) {
        this.kind = kind;
        this.maxLength = maxLength;
        this.tuple = tuple;
    }

    public static TypeSignature buffer(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("Buffer length must be positive: " + maxLength);
        }
        return new TypeSignature(Value.Kind.BUFFER, maxLength, null);
    }

    public static TypeSignature tuple(TupleTypeSignature tuple) {
        return new TypeSignature(Value.Kind.TUPLE, 0, Objects.requireNonNull(tuple, "tuple"));
    }

    /** Atom signature for the given kind; buffers and tuples need their own factories. */
    public static TypeSignature atom(Value.Kind kind) {
        switch (kind) {
            case VOID: return VOID;
            case BOOL: return BOOL;
            case INT: return INT;
            case PRINCIPAL: return PRINCIPAL;
            default:
                throw new IllegalArgumentException("Not an atom without parameters: " + kind);
        }
    }

    public Value.Kind kind() {
        return kind;
    }

    public int maxLength() {
        return maxLength;
    }

    public TupleTypeSignature tupleType() {
        if (tuple == null) {
            throw new IllegalStateException("Not a tuple type: " + this);
        }
        return tuple;
    }

    @Override
    public boolean admits(Value value) {
        if (value == null || value.kind() != kind) {
            return false;
        }
        switch (kind) {
            case BUFFER:
                return value.asBuffer().length <= maxLength;
            case TUPLE:
                return tuple.admits(value);
            default:
                return true;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeSignature)) return false;
        TypeSignature other = (TypeSignature) o;
        return kind == other.kind && maxLength == other.maxLength && Objects.equals(tuple, other.tuple);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, maxLength, tuple);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BUFFER: return "(buff " + maxLength + ")";
            case TUPLE: return tuple.toString();
            default: return kind.name().toLowerCase(Locale.ROOT);
        }
    }
}
