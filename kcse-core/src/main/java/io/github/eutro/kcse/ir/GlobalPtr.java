package io.github.eutro.kcse.ir;

import io.github.eutro.kcse.ops.KernelOps;

import java.util.Objects;

/**
 * The intermediate of a {@link KernelOps#GLOBAL_PTR} statement.
 */
public final class GlobalPtr {
    /**
     * The field the address is in.
     */
    public final Field field;
    /**
     * Whether evaluating the address first activates the sparse storage backing it.
     */
    public final boolean activate;

    public GlobalPtr(Field field, boolean activate) {
        this.field = Objects.requireNonNull(field);
        this.activate = activate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GlobalPtr that = (GlobalPtr) o;
        return activate == that.activate && field == that.field;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, activate);
    }

    @Override
    public String toString() {
        return activate ? field + " activate" : field.toString();
    }
}
