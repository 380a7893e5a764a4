package io.github.eutro.kcse.ext;

import io.github.eutro.kcse.ir.Block;
import io.github.eutro.kcse.ir.Stmt;
import io.github.eutro.kcse.ops.Op;
import io.github.eutro.kcse.ops.OpKey;

import java.util.Set;

/**
 * The {@link Ext}s used throughout the kernel IR.
 */
public class CommonExts {
    /**
     * Attached to a {@link Stmt}, {@link Op} or {@link OpKey}.
     * Whether the statement has no observable side effects.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");
    /**
     * Attached to a {@link Stmt}, {@link Op} or {@link OpKey}.
     * Whether the statement may be replaced by an equivalent earlier one.
     * Defaults to {@link #IS_PURE} when absent.
     */
    public static final Ext<Boolean> CSE_ELIGIBLE = Ext.create(Boolean.class, "CSE_ELIGIBLE");

    /**
     * Attached to a {@link Stmt}. The block the statement is currently in.
     */
    public static final Ext<Block> OWNING_BLOCK = Ext.create(Block.class, "OWNING_BLOCK");
    /**
     * Attached to a {@link Block}. The container statement the block is nested in,
     * absent for a kernel body.
     */
    public static final Ext<Stmt> OWNING_STMT = Ext.create(Stmt.class, "OWNING_STMT");
    /**
     * Attached to a {@link Stmt}. The statements that have it as an operand.
     * Maintained as operands change, never recomputed.
     */
    public static final Ext<Set<Stmt>> USED_AT = Ext.create(Set.class, "USED_AT");

    /**
     * Mark something as pure, by attaching {@link #IS_PURE} {@code = true} to it.
     *
     * @param t   The thing to mark as pure.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
