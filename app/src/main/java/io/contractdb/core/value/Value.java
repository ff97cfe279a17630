package io.contractdb.core.value;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runtime datum stored in contract maps.
 * Immutable; equals/hashCode are value-based so instances can be used as map keys.
 *
 * Tuple fields are kept sorted by name, so two tuples built in a different
 * field order are equal.
 */
public final class Value {

    public enum Kind { VOID, BOOL, INT, PRINCIPAL, BUFFER, TUPLE }

    public static final BigInteger INT_MIN = BigInteger.ONE.shiftLeft(127).negate();
    public static final BigInteger INT_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

    private static final Value VOID = new Value(Kind.VOID, null);
    private static final Value TRUE = new Value(Kind.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Kind.BOOL, Boolean.FALSE);

    private final Kind kind;
    // Boolean, BigInteger, String or byte[]; null for void and tuples
    private final Object data;
    // tuples only, unmodifiable and sorted by name
    private final SortedMap<String, Value> fields;
    private final int hash;

    private Value(Kind kind, Object data) {
        this.kind = kind;
        this.data = data;
        this.fields = null;
        this.hash = computeHash(kind, data);
    }

    private Value(SortedMap<String, Value> fields) {
        this.kind = Kind.TUPLE;
        this.data = null;
        this.fields = fields;
        this.hash = computeHash(Kind.TUPLE, fields);
    }

    public static Value voidValue() {
        return VOID;
    }

    public static Value bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Value integer(long v) {
        return integer(BigInteger.valueOf(v));
    }

    public static Value integer(BigInteger v) {
        Objects.requireNonNull(v, "v");
        if (v.compareTo(INT_MIN) < 0 || v.compareTo(INT_MAX) > 0) {
            throw new IllegalArgumentException("Integer out of 128-bit range: " + v);
        }
        return new Value(Kind.INT, v);
    }

    public static Value principal(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Principal address must not be blank");
        }
        return new Value(Kind.PRINCIPAL, address);
    }

    public static Value buffer(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new Value(Kind.BUFFER, bytes.clone());
    }

    public static Value tuple(Map<String, Value> fields) {
        Objects.requireNonNull(fields, "fields");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Tuple must have at least one field");
        }
        TreeMap<String, Value> copy = new TreeMap<>();
        for (Map.Entry<String, Value> e : fields.entrySet()) {
            String name = e.getKey();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Tuple field name must not be blank");
            }
            copy.put(name, Objects.requireNonNull(e.getValue(), "tuple field " + name));
        }
        return new Value(Collections.unmodifiableSortedMap(copy));
    }

    public static TupleBuilder tupleBuilder() {
        return new TupleBuilder();
    }

    public Kind kind() {
        return kind;
    }

    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    public boolean asBool() {
        require(Kind.BOOL);
        return (Boolean) data;
    }

    public BigInteger asInt() {
        require(Kind.INT);
        return (BigInteger) data;
    }

    public String asPrincipal() {
        require(Kind.PRINCIPAL);
        return (String) data;
    }

    public byte[] asBuffer() {
        require(Kind.BUFFER);
        return ((byte[]) data).clone();
    }

    /** Tuple fields in name order. */
    public Map<String, Value> asTuple() {
        require(Kind.TUPLE);
        return fields;
    }

    /** Field of a tuple, or null if absent. */
    public Value field(String name) {
        return asTuple().get(name);
    }

    private void require(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " value but was " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (kind != other.kind || hash != other.hash) return false;
        if (kind == Kind.BUFFER) {
            return Arrays.equals((byte[]) data, (byte[]) other.data);
        }
        return Objects.equals(data, other.data) && Objects.equals(fields, other.fields);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    private static int computeHash(Kind kind, Object data) {
        int h = kind.ordinal();
        if (data instanceof byte[]) {
            return 31 * h + Arrays.hashCode((byte[]) data);
        }
        return 31 * h + Objects.hashCode(data);
    }

    @Override
    public String toString() {
        switch (kind) {
            case VOID:
                return "void";
            case BUFFER:
                return "0x" + toHex((byte[]) data);
            case PRINCIPAL:
                return "'" + data;
            case TUPLE: {
                StringBuilder sb = new StringBuilder("(tuple");
                for (Map.Entry<String, Value> e : asTuple().entrySet()) {
                    sb.append(" (").append(e.getKey()).append(' ').append(e.getValue()).append(')');
                }
                return sb.append(')').toString();
            }
            default:
                return String.valueOf(data);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /** Fluent tuple construction: {@code Value.tupleBuilder().put("owner", p).build()}. */
    public static final class TupleBuilder {
        private final Map<String, Value> fields = new TreeMap<>();

        private TupleBuilder() {}

        public TupleBuilder put(String name, Value value) {
            fields.put(name, value);
            return this;
        }

        public TupleBuilder putInt(String name, long v) {
            return put(name, integer(v));
        }

        public TupleBuilder putPrincipal(String name, String address) {
            return put(name, principal(address));
        }

        public TupleBuilder putBool(String name, boolean b) {
            return put(name, bool(b));
        }

        public Value build() {
            return tuple(fields);
        }
    }
}
