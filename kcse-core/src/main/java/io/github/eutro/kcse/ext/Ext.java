package io.github.eutro.kcse.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value of type {@code T} can be attached to an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity; {@link #compareTo(Ext)} orders them by creation,
 * which only matters for the layout of {@link ExtHolder}.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * {@code type} may be the erasure of {@code R}, since class literals cannot be generic.
     *
     * @param type The erased type of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The erased type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    public Class<T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
