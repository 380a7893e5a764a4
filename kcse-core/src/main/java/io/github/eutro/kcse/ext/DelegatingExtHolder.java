package io.github.eutro.kcse.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that looks exts up in another container when it does not have them itself.
 * <p>
 * This is how a statement inherits {@link CommonExts#IS_PURE} from its op, and the op from its key.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T localExt = super.getNullable(ext);
        if (localExt != null) return localExt;
        ExtContainer delegate = getDelegate();
        if (delegate != null) return delegate.getNullable(ext);
        return null;
    }
}
