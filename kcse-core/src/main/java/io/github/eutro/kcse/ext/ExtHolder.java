package io.github.eutro.kcse.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An {@link ExtContainer} backed by a lazily allocated {@link Map}.
 * <p>
 * Subclasses keep hot exts in fields and fall back to this for the rest.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null; // most statements never get a slow-path ext

    @NotNull
    private Map<Ext<?>, Object> getMap() {
        if (map == null) {
            map = new TreeMap<>();
        }
        return map;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        getMap().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        map.remove(ext);
        if (map.isEmpty()) {
            map = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) map.get(ext);
    }
}
