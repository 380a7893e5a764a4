package io.github.eutro.kcse.ir;

import io.github.eutro.kcse.ext.CommonExts;
import io.github.eutro.kcse.ext.DelegatingExtHolder;
import io.github.eutro.kcse.ext.Ext;
import io.github.eutro.kcse.ext.ExtContainer;
import io.github.eutro.kcse.ops.Op;
import io.github.eutro.kcse.ops.StmtKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A statement: an {@link Op} applied to operand statements, possibly with nested {@link Block}s.
 * <p>
 * A statement is its own result; other statements refer to it directly. Every statement
 * knows the statements that use it, see {@link #getUsers()}.
 */
public final class Stmt extends DelegatingExtHolder {
    /**
     * Whether statements should record where they were constructed, for diagnostics.
     */
    public static boolean TRACK_STMT_CREATIONS = System.getenv("KCSE_TRACK_STMT_CREATIONS") != null;

    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    /**
     * The identity of this statement, never shared with another statement.
     */
    public final int id = ID_COUNTER.getAndIncrement();
    public final @Nullable Throwable created = TRACK_STMT_CREATIONS ? new Throwable("constructed") : null;
    public Op op;

    private final Set<Stmt> users = new LinkedHashSet<>();
    private final List<Stmt> operands = new TrackedList<Stmt>(new ArrayList<>()) {
        @Override
        protected void onAdded(Stmt elt) {
            elt.users.add(Stmt.this);
        }

        @Override
        protected void onRemoved(Stmt elt) {
            // the same operand may appear more than once
            if (!contains(elt)) elt.users.remove(Stmt.this);
        }
    };
    private final @Nullable Block[] blocks;

    public Stmt(Op op, List<Stmt> operands) {
        this.op = op;
        this.blocks = new Block[op.kind().blockCount];
        this.operands.addAll(operands);
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    public StmtKind kind() {
        return op.kind();
    }

    public boolean isPure() {
        return getExt(CommonExts.IS_PURE).orElse(false);
    }

    /**
     * Whether this statement may be replaced by an equivalent earlier statement.
     *
     * @return Whether this is eligible for elimination.
     */
    public boolean isEligible() {
        Boolean eligible = getNullable(CommonExts.CSE_ELIGIBLE);
        return eligible != null ? eligible : isPure();
    }

    /**
     * The operands of this statement. Changes to the list keep {@link #getUsers()} of the operands up to date.
     *
     * @return The operand list.
     */
    public List<Stmt> getOperands() {
        return operands;
    }

    public Stmt getOperand(int index) {
        return operands.get(index);
    }

    public boolean hasOperand(Stmt candidate) {
        for (Stmt operand : operands) {
            if (operand == candidate) return true;
        }
        return false;
    }

    /**
     * Replace every occurrence of {@code old} in the operands with {@code replacement}.
     *
     * @param old         The operand to replace.
     * @param replacement The replacement.
     * @return Whether any operand was replaced.
     */
    public boolean replaceOperand(Stmt old, Stmt replacement) {
        boolean replaced = false;
        ListIterator<Stmt> it = operands.listIterator();
        while (it.hasNext()) {
            if (it.next() == old) {
                it.set(replacement);
                replaced = true;
            }
        }
        return replaced;
    }

    /**
     * The statements that have this as an operand, in the order they started using it.
     *
     * @return An unmodifiable view of the users.
     */
    public Set<Stmt> getUsers() {
        return Collections.unmodifiableSet(users);
    }

    public @Nullable Block getBlock(int slot) {
        return blocks[slot];
    }

    /**
     * Set a nested block of this statement.
     *
     * @param slot  The slot, less than the {@link StmtKind#blockCount} of this statement's kind.
     * @param block The block, or null to leave the slot empty.
     */
    public void setBlock(int slot, @Nullable Block block) {
        if (block != null && block.getParentStmt() != null) {
            throw new IllegalArgumentException(String.format(
                    "block is already nested in another statement\n  block: %s\n  parent: %s",
                    block,
                    block.getParentStmt()));
        }
        Block old = blocks[slot];
        if (old != null) {
            old.removeExt(CommonExts.OWNING_STMT);
        }
        blocks[slot] = block;
        if (block != null) {
            block.attachExt(CommonExts.OWNING_STMT, this);
        }
    }

    /**
     * The nested blocks of this statement, including empty slots.
     *
     * @return An unmodifiable view of the block slots.
     */
    public List<@Nullable Block> getBlocks() {
        return Collections.unmodifiableList(Arrays.asList(blocks));
    }

    public @Nullable Block getParent() {
        return owner;
    }

    /**
     * Drop everything this statement refers to, after it has been removed from its block.
     */
    void release() {
        for (int i = blocks.length - 1; i >= 0; i--) {
            Block block = blocks[i];
            if (block != null) block.releaseStatements();
        }
        operands.clear();
        if (!users.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "erased statement is still in use\n  statement: %s\n  users: %s",
                    toHeaderString(),
                    users), created);
        }
    }

    public String toTargetString() {
        return "$" + id;
    }

    /**
     * Print this statement without nested blocks.
     *
     * @return The statement header.
     */
    public String toHeaderString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(" = ").append(op);
        for (Stmt operand : operands) {
            sb.append(' ').append(operand.toTargetString());
        }
        return sb.toString();
    }

    void print(StringBuilder sb, String indent) {
        sb.append(indent).append(toHeaderString());
        for (int i = 0; i < blocks.length; i++) {
            Block block = blocks[i];
            sb.append(i == 0 ? " {\n" : indent + "} {\n");
            if (block != null) block.print(sb, indent + "  ");
        }
        if (blocks.length != 0) sb.append(indent).append('}');
        sb.append('\n');
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, "");
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }

    // exts
    private @Nullable Block owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(@NotNull Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        } else if (ext == CommonExts.USED_AT) {
            return (T) getUsers();
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (Block) value;
            return;
        } else if (ext == CommonExts.USED_AT) {
            throw new UnsupportedOperationException("users are maintained by operand lists");
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        } else if (ext == CommonExts.USED_AT) {
            throw new UnsupportedOperationException("users are maintained by operand lists");
        }
        super.removeExt(ext);
    }
}
