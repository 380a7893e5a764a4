package io.github.eutro.kcse.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Records structural edits while a pass walks the IR, and applies them all at once afterwards,
 * so the walk never changes a block it is iterating.
 */
public final class DelayedIRModifier {
    private final List<Stmt[]> toInsertBefore = new ArrayList<>();
    private final List<Stmt[]> toInsertAfter = new ArrayList<>();
    private final List<Stmt> toErase = new ArrayList<>();

    /**
     * Schedule a statement to be erased from its block.
     *
     * @param stmt The statement.
     */
    public void erase(Stmt stmt) {
        toErase.add(stmt);
    }

    /**
     * Schedule a detached statement to be inserted immediately before {@code anchor}.
     *
     * @param anchor The statement to insert before.
     * @param stmt   The statement to insert.
     */
    public void insertBefore(Stmt anchor, Stmt stmt) {
        toInsertBefore.add(new Stmt[]{anchor, stmt});
    }

    /**
     * Schedule a detached statement to be inserted immediately after {@code anchor}.
     *
     * @param anchor The statement to insert after.
     * @param stmt   The statement to insert.
     */
    public void insertAfter(Stmt anchor, Stmt stmt) {
        toInsertAfter.add(new Stmt[]{anchor, stmt});
    }

    public boolean isEmpty() {
        return toInsertBefore.isEmpty() && toInsertAfter.isEmpty() && toErase.isEmpty();
    }

    /**
     * Apply every scheduled edit: insertions before, then insertions after, then erasures.
     *
     * @return Whether anything was scheduled.
     */
    public boolean modifyIR() {
        if (isEmpty()) return false;
        for (Stmt[] insertion : toInsertBefore) {
            parentOf(insertion[0]).insertBefore(insertion[0], insertion[1]);
        }
        toInsertBefore.clear();
        for (Stmt[] insertion : toInsertAfter) {
            parentOf(insertion[0]).insertAfter(insertion[0], insertion[1]);
        }
        toInsertAfter.clear();
        for (Stmt stmt : toErase) {
            parentOf(stmt).erase(stmt);
        }
        toErase.clear();
        return true;
    }

    private static Block parentOf(Stmt stmt) {
        Block parent = stmt.getParent();
        if (parent == null) {
            throw new IllegalStateException(String.format(
                    "statement is not in a block\n  statement: %s",
                    stmt.toHeaderString()));
        }
        return parent;
    }
}
