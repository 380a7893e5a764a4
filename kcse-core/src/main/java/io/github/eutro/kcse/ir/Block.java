package io.github.eutro.kcse.ir;

import io.github.eutro.kcse.ext.CommonExts;
import io.github.eutro.kcse.ext.Ext;
import io.github.eutro.kcse.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered sequence of statements, nested in a container statement or forming a kernel body.
 * <p>
 * Statements in a block can be used by later statements in the same block, and by
 * statements in blocks nested within it.
 */
public final class Block extends ExtHolder {
    private final List<Stmt> statements = new TrackedList<Stmt>(new ArrayList<>()) {
        @Override
        protected void onAdded(Stmt elt) {
            Block parent = elt.getParent();
            if (parent != null) {
                throw new IllegalArgumentException(String.format(
                        "statement is already in a block\n  statement: %s\n  block: %s",
                        elt.toHeaderString(),
                        parent));
            }
            elt.attachExt(CommonExts.OWNING_BLOCK, Block.this);
        }

        @Override
        protected void onRemoved(Stmt elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    /**
     * The statements of this block. Changes to the list keep statement ownership up to date,
     * but removing through it does not {@link #erase(int) erase} the statement.
     *
     * @return The statement list.
     */
    public List<Stmt> getStatements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public Stmt get(int index) {
        return statements.get(index);
    }

    public Stmt first() {
        return statements.get(0);
    }

    public Stmt last() {
        return statements.get(statements.size() - 1);
    }

    public int indexOf(Stmt stmt) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == stmt) return i;
        }
        return -1;
    }

    public void add(Stmt stmt) {
        statements.add(stmt);
    }

    public void insertBefore(Stmt anchor, Stmt stmt) {
        statements.add(indexOfOrThrow(anchor), stmt);
    }

    public void insertAfter(Stmt anchor, Stmt stmt) {
        statements.add(indexOfOrThrow(anchor) + 1, stmt);
    }

    /**
     * Detach a statement from this block, to be moved elsewhere. Its operands and users are kept.
     *
     * @param index The index of the statement.
     * @return The detached statement.
     */
    public Stmt extract(int index) {
        return statements.remove(index);
    }

    public Stmt extract(Stmt stmt) {
        return extract(indexOfOrThrow(stmt));
    }

    /**
     * Remove a statement from this block for good. It and everything nested in it stop using their operands.
     *
     * @param index The index of the statement.
     * @throws IllegalStateException If anything still uses the statement.
     */
    public void erase(int index) {
        statements.remove(index).release();
    }

    public void erase(Stmt stmt) {
        erase(indexOfOrThrow(stmt));
    }

    void releaseStatements() {
        for (int i = statements.size() - 1; i >= 0; i--) {
            statements.get(i).release();
        }
    }

    private int indexOfOrThrow(Stmt stmt) {
        int index = indexOf(stmt);
        if (index == -1) {
            throw new IllegalStateException(String.format(
                    "statement not in block\n  statement: %s\n  in block: %s",
                    stmt.toHeaderString(),
                    this));
        }
        return index;
    }

    /**
     * The container statement this block is nested in.
     *
     * @return The container, or null if this is a kernel body or detached.
     */
    public @Nullable Stmt getParentStmt() {
        return owner;
    }

    /**
     * Whether the statement is in this block, or in a block nested within it.
     *
     * @param stmt The statement.
     * @return Whether this block encloses it.
     */
    public boolean encloses(Stmt stmt) {
        Block block = stmt.getParent();
        while (block != null) {
            if (block == this) return true;
            Stmt container = block.getParentStmt();
            block = container == null ? null : container.getParent();
        }
        return false;
    }

    void print(StringBuilder sb, String indent) {
        for (Stmt stmt : statements) {
            stmt.print(sb, indent);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{\n");
        print(sb, "  ");
        return sb.append('}').toString();
    }

    // exts
    private @Nullable Stmt owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_STMT) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_STMT) {
            owner = (Stmt) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_STMT) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
