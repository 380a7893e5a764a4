package io.github.eutro.kcse.ops;

import io.github.eutro.kcse.ext.ExtHolder;

/**
 * An operation key, representing a type of operation, without intermediates.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;
    public final StmtKind kind;

    public OpKey(String mnemonic, StmtKind kind) {
        this.mnemonic = mnemonic;
        this.kind = kind;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
