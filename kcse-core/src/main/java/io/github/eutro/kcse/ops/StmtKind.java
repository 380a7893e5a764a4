package io.github.eutro.kcse.ops;

/**
 * The closed set of statement shapes.
 * <p>
 * Two statements can only ever be equivalent if they have the same kind.
 */
public enum StmtKind {
    CONST,
    ARG,
    BINARY,
    UNARY,
    SELECT,
    LOOP_INDEX,
    /**
     * An address statement, naming a location in a field.
     */
    GLOBAL_PTR,
    /**
     * A value known to be unique per loop iteration over some fields.
     */
    LOOP_UNIQUE,

    GLOBAL_LOAD,
    GLOBAL_STORE,
    ATOMIC_ADD,
    ALLOCA,
    LOCAL_LOAD,
    LOCAL_STORE,
    PRINT,

    /**
     * Blocks: the true arm, then the false arm.
     */
    IF(2),
    /**
     * Blocks: the loop body.
     */
    RANGE_FOR(1),
    ;

    /**
     * The number of nested block slots a statement of this kind has.
     */
    public final int blockCount;

    StmtKind() {
        this(0);
    }

    StmtKind(int blockCount) {
        this.blockCount = blockCount;
    }

    public boolean isContainer() {
        return blockCount != 0;
    }
}
