package io.github.eutro.kcse.ir;

/**
 * A global field that kernels read and write through {@link GlobalPtr address statements}.
 * <p>
 * Fields are compared by identity.
 */
public final class Field {
    public final String name;
    public final int dims;

    public Field(String name, int dims) {
        this.name = name;
        this.dims = dims;
    }

    @Override
    public String toString() {
        return name;
    }
}
