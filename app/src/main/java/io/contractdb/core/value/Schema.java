package io.contractdb.core.value;

/**
 * Describes the admissible shape of a {@link Value}.
 * Storage only ever asks whether a value conforms.
 */
@FunctionalInterface
public interface Schema {
    boolean admits(Value value);
}
