package io.github.eutro.kcse.ops;

import io.github.eutro.kcse.ext.DelegatingExtHolder;
import io.github.eutro.kcse.ext.ExtContainer;
import io.github.eutro.kcse.ir.Stmt;

import java.util.Arrays;
import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    public StmtKind kind() {
        return key.kind;
    }

    /**
     * Whether this op computes the same thing as another, given the same operands.
     *
     * @param other The other op.
     * @return Whether the two are interchangeable.
     */
    public boolean sameAs(Op other) {
        return key == other.key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Stmt stmt(Stmt... operands) {
        return new Stmt(this, Arrays.asList(operands));
    }

    public Stmt stmt(List<Stmt> operands) {
        return new Stmt(this, operands);
    }
}
