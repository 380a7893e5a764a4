package io.github.eutro.kcse.ir;

import io.github.eutro.kcse.ops.KernelOps;

import java.util.*;

/**
 * The fields that a {@link KernelOps#LOOP_UNIQUE} value is known to index uniquely
 * within its loop. Only ever grows.
 */
public final class Coverage {
    private final Set<Field> fields = new LinkedHashSet<>();

    public Coverage(Collection<Field> fields) {
        this.fields.addAll(fields);
    }

    public Coverage(Field... fields) {
        this(Arrays.asList(fields));
    }

    public Set<Field> getFields() {
        return Collections.unmodifiableSet(fields);
    }

    /**
     * Add all the fields of {@code other} to this.
     *
     * @param other The other coverage.
     * @return Whether this changed.
     */
    public boolean unionWith(Coverage other) {
        return fields.addAll(other.fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((Coverage) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
