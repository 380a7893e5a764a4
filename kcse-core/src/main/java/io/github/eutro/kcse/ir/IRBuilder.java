package io.github.eutro.kcse.ir;

import io.github.eutro.kcse.ops.BinaryOpType;
import io.github.eutro.kcse.ops.KernelOps;
import io.github.eutro.kcse.ops.Op;
import io.github.eutro.kcse.ops.UnaryOpType;

import java.util.Arrays;

/**
 * A statement builder, which appends statements to the end of a block.
 */
public class IRBuilder {
    /**
     * The kernel being built.
     */
    public final Kernel kernel;
    private Block block;

    /**
     * Construct a builder inserting at the end of the kernel body.
     *
     * @param kernel The kernel.
     */
    public IRBuilder(Kernel kernel) {
        this(kernel, kernel.body);
    }

    public IRBuilder(Kernel kernel, Block block) {
        this.kernel = kernel;
        this.block = block;
    }

    public Block getBlock() {
        return block;
    }

    /**
     * Set the block this builder should append to.
     *
     * @param block The block.
     */
    public void setBlock(Block block) {
        this.block = block;
    }

    public Stmt insert(Stmt stmt) {
        block.add(stmt);
        return stmt;
    }

    public Stmt insert(Op op, Stmt... operands) {
        return insert(op.stmt(operands));
    }

    public Stmt constant(Object value) {
        return insert(KernelOps.constant(value));
    }

    public Stmt arg(int index) {
        return insert(KernelOps.ARG.create(index).stmt());
    }

    public Stmt binary(BinaryOpType type, Stmt lhs, Stmt rhs) {
        return insert(KernelOps.BINARY.create(type), lhs, rhs);
    }

    public Stmt unary(UnaryOpType type, Stmt operand) {
        return insert(KernelOps.UNARY.create(type), operand);
    }

    public Stmt select(Stmt cond, Stmt ifTrue, Stmt ifFalse) {
        return insert(KernelOps.SELECT, cond, ifTrue, ifFalse);
    }

    public Stmt globalPtr(Field field, boolean activate, Stmt... indices) {
        if (indices.length != field.dims) {
            throw new IllegalArgumentException(String.format(
                    "field %s has %d dimensions, got %d indices",
                    field, field.dims, indices.length));
        }
        return insert(KernelOps.GLOBAL_PTR.create(new GlobalPtr(field, activate)), indices);
    }

    public Stmt loopUnique(Stmt input, Field... covers) {
        return insert(KernelOps.LOOP_UNIQUE.create(new Coverage(covers)), input);
    }

    public Stmt globalLoad(Stmt ptr) {
        return insert(KernelOps.GLOBAL_LOAD, ptr);
    }

    public Stmt globalStore(Stmt ptr, Stmt value) {
        return insert(KernelOps.GLOBAL_STORE, ptr, value);
    }

    public Stmt atomicAdd(Stmt ptr, Stmt value) {
        return insert(KernelOps.ATOMIC_ADD, ptr, value);
    }

    public Stmt alloca() {
        return insert(KernelOps.ALLOCA);
    }

    public Stmt localLoad(Stmt alloca) {
        return insert(KernelOps.LOCAL_LOAD, alloca);
    }

    public Stmt localStore(Stmt alloca, Stmt value) {
        return insert(KernelOps.LOCAL_STORE, alloca, value);
    }

    public Stmt print(String label, Stmt... values) {
        return insert(KernelOps.PRINT.create(label).stmt(Arrays.asList(values)));
    }

    /**
     * Insert an if statement with two empty arms. Use {@link #setBlock(Block)} to fill them.
     *
     * @param cond The condition.
     * @return The if statement.
     */
    public Stmt ifThenElse(Stmt cond) {
        Stmt ifStmt = KernelOps.IF.stmt(cond);
        ifStmt.setBlock(KernelOps.TRUE_ARM, new Block());
        ifStmt.setBlock(KernelOps.FALSE_ARM, new Block());
        return insert(ifStmt);
    }

    /**
     * Insert a range for loop with an empty body. Use {@link #setBlock(Block)} to fill it.
     *
     * @param begin The first index.
     * @param end   The index to stop before.
     * @return The loop statement.
     */
    public Stmt rangeFor(Stmt begin, Stmt end) {
        Stmt loop = KernelOps.RANGE_FOR.stmt(begin, end);
        loop.setBlock(KernelOps.BODY, new Block());
        return insert(loop);
    }

    public Stmt loopIndex(Stmt loop) {
        return insert(KernelOps.LOOP_INDEX.create(0), loop);
    }
}
