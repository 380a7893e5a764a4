package io.github.eutro.kcse.ops;

import io.github.eutro.kcse.ext.CommonExts;
import io.github.eutro.kcse.ir.Coverage;
import io.github.eutro.kcse.ir.GlobalPtr;
import io.github.eutro.kcse.ir.Stmt;

/**
 * The operations of the kernel IR.
 * <p>
 * Unless noted, a statement produces a single value and its operands are values.
 */
public class KernelOps {
    /**
     * Pure: the constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const", StmtKind.CONST);
    /**
     * Pure: the {@code n}th argument of the kernel.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg", StmtKind.ARG);
    /**
     * Pure: {@code lhs op rhs}.
     */
    public static final UnaryOpKey<BinaryOpType> BINARY = new UnaryOpKey<>("binary", StmtKind.BINARY);
    /**
     * Pure: {@code op operand}.
     */
    public static final UnaryOpKey<UnaryOpType> UNARY = new UnaryOpKey<>("unary", StmtKind.UNARY);
    /**
     * Pure: {@code cond ? a : b}.
     */
    public static final Op SELECT = new SimpleOpKey("select", StmtKind.SELECT).create();
    /**
     * Pure: the current value of the given axis of the loop that is its only operand.
     */
    public static final UnaryOpKey<Integer> LOOP_INDEX = new UnaryOpKey<>("loop_index", StmtKind.LOOP_INDEX);
    /**
     * An address in a field, indexed by its operands. Activates the sparse storage
     * backing the address if {@link GlobalPtr#activate} is set.
     * <p>
     * Not pure, but eligible for elimination under the address subsumption rule.
     */
    public static final UnaryOpKey<GlobalPtr> GLOBAL_PTR = new UnaryOpKey<>("global_ptr", StmtKind.GLOBAL_PTR);
    /**
     * Pure: its operand, which is known to be unique per loop iteration
     * when accessing any of the fields in its {@link Coverage}.
     */
    public static final UnaryOpKey<Coverage> LOOP_UNIQUE = new UnaryOpKey<>("loop_unique", StmtKind.LOOP_UNIQUE);

    /**
     * Loads from the address given by its operand.
     */
    public static final Op GLOBAL_LOAD = new SimpleOpKey("global_load", StmtKind.GLOBAL_LOAD).create();
    /**
     * Stores its second operand to the address given by its first, produces no value.
     */
    public static final Op GLOBAL_STORE = new SimpleOpKey("global_store", StmtKind.GLOBAL_STORE).create();
    /**
     * Adds its second operand to the address given by its first, producing the old value.
     */
    public static final Op ATOMIC_ADD = new SimpleOpKey("atomic_add", StmtKind.ATOMIC_ADD).create();
    /**
     * A fresh local variable, initialised to zero.
     */
    public static final Op ALLOCA = new SimpleOpKey("alloca", StmtKind.ALLOCA).create();
    /**
     * Loads the local variable given by its operand.
     */
    public static final Op LOCAL_LOAD = new SimpleOpKey("local_load", StmtKind.LOCAL_LOAD).create();
    /**
     * Stores its second operand to the local variable given by its first, produces no value.
     */
    public static final Op LOCAL_STORE = new SimpleOpKey("local_store", StmtKind.LOCAL_STORE).create();
    /**
     * Prints its operands with the given format, produces no value.
     */
    public static final UnaryOpKey<String> PRINT = new UnaryOpKey<>("print", StmtKind.PRINT, fmt -> '"' + fmt + '"');

    /**
     * Runs the true arm if its operand is non-zero, otherwise the false arm.
     */
    public static final Op IF = new SimpleOpKey("if", StmtKind.IF).create();
    /**
     * Runs its body once for each value from its first operand (inclusive) to its second (exclusive).
     */
    public static final Op RANGE_FOR = new SimpleOpKey("range_for", StmtKind.RANGE_FOR).create();

    /**
     * Block slot of the true arm of an {@link #IF}.
     */
    public static final int TRUE_ARM = 0;
    /**
     * Block slot of the false arm of an {@link #IF}.
     */
    public static final int FALSE_ARM = 1;
    /**
     * Block slot of the body of a {@link #RANGE_FOR}.
     */
    public static final int BODY = 0;

    static {
        for (OpKey key : new OpKey[]{
                CONST,
                ARG,
                BINARY,
                UNARY,
                SELECT.key,
                LOOP_INDEX,
                LOOP_UNIQUE,
        }) {
            CommonExts.markPure(key);
        }
        GLOBAL_PTR.attachExt(CommonExts.CSE_ELIGIBLE, true);
    }

    /**
     * Create a constant statement.
     *
     * @param k The constant.
     * @return The statement.
     */
    public static Stmt constant(Object k) {
        return CONST.create(k).stmt();
    }
}
