package io.contractdb.core.value;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Named fields, each with its own type. Admits a tuple value iff the field names
 * match exactly and every field value is admitted by its field type.
 */
public final class TupleTypeSignature implements Schema {

    private final SortedMap<String, TypeSignature> fields;

    public TupleTypeSignature(Map<String, TypeSignature> fields) {
        Objects.requireNonNull(fields, "fields");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Tuple type must have at least one field");
        }
        TreeMap<String, TypeSignature> copy = new TreeMap<>();
        for (Map.Entry<String, TypeSignature> e : fields.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new IllegalArgumentException("Tuple field name must not be blank");
            }
            copy.put(e.getKey(), Objects.requireNonNull(e.getValue(), "type of " + e.getKey()));
        }
        this.fields = Collections.unmodifiableSortedMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Field types in name order. */
    public SortedMap<String, TypeSignature> fields() {
        return fields;
    }

    public TypeSignature asType() {
        return TypeSignature.tuple(this);
    }

    @Override
    public boolean admits(Value value) {
        if (value == null || value.kind() != Value.Kind.TUPLE) {
            return false;
        }
        Map<String, Value> values = value.asTuple();
        if (!values.keySet().equals(fields.keySet())) {
            return false;
        }
        for (Map.Entry<String, TypeSignature> e : fields.entrySet()) {
            if (!e.getValue().admits(values.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TupleTypeSignature)) return false;
        return fields.equals(((TupleTypeSignature) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(tuple");
        for (Map.Entry<String, TypeSignature> e : fields.entrySet()) {
            sb.append(" (").append(e.getKey()).append(' ').append(e.getValue()).append(')');
        }
        return sb.append(')').toString();
    }

    public static final class Builder {
        private final Map<String, TypeSignature> fields = new TreeMap<>();

        private Builder() {}

        public Builder field(String name, TypeSignature type) {
            fields.put(name, type);
            return this;
        }

        public TupleTypeSignature build() {
            return new TupleTypeSignature(fields);
        }
    }
}
