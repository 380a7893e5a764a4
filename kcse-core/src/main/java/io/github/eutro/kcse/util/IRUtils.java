package io.github.eutro.kcse.util;

import io.github.eutro.kcse.ir.Block;
import io.github.eutro.kcse.ir.GlobalPtr;
import io.github.eutro.kcse.ir.Stmt;
import io.github.eutro.kcse.ops.KernelOps;
import io.github.eutro.kcse.ops.StmtKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural queries and rewiring helpers over the kernel IR.
 */
public class IRUtils {
    /**
     * Make every statement that uses {@code old} use {@code replacement} instead.
     *
     * @param old         The statement to stop using.
     * @param replacement The statement to use instead.
     * @return The statements that were rewired.
     */
    public static List<Stmt> replaceAllUsagesWith(Stmt old, Stmt replacement) {
        return replaceAllUsagesWith(null, old, replacement);
    }

    /**
     * Make every statement in {@code scope} that uses {@code old} use {@code replacement} instead.
     *
     * @param scope       The block to restrict rewiring to, or null for everywhere.
     * @param old         The statement to stop using.
     * @param replacement The statement to use instead.
     * @return The statements that were rewired.
     */
    public static List<Stmt> replaceAllUsagesWith(@Nullable Block scope, Stmt old, Stmt replacement) {
        List<Stmt> rewired = new ArrayList<>();
        if (old == replacement) return rewired;
        for (Stmt user : new ArrayList<>(old.getUsers())) {
            if (scope == null || scope.encloses(user)) {
                user.replaceOperand(old, replacement);
                rewired.add(user);
            }
        }
        return rewired;
    }

    /**
     * Whether two statements are copies of each other: same op, same operands in the same order,
     * and the same nested blocks. Operands must be the same statements, except that statements
     * nested in {@code a} may correspond to their counterparts nested in {@code b}.
     *
     * @param a The first statement.
     * @param b The second statement.
     * @return Whether they are structurally the same.
     */
    public static boolean sameStatements(Stmt a, Stmt b) {
        return new StmtComparator().compare(a, b);
    }

    /**
     * Whether two statements are known to always evaluate to the same value at any point both are available.
     * <p>
     * This holds if they are the same statement, or if both are pure and compute the same
     * op over operands that have the same value.
     *
     * @param a The first statement.
     * @param b The second statement.
     * @return Whether they have the same value.
     */
    public static boolean sameValue(Stmt a, Stmt b) {
        if (a == b) return true;
        if (a.kind() != b.kind()) return false;
        if (a.kind() == StmtKind.GLOBAL_PTR) return sameAddress(a, b);
        if (!a.isPure() || !b.isPure()) return false;
        // coverage does not affect the value
        if (a.kind() == StmtKind.LOOP_UNIQUE) return sameValue(a.getOperand(0), b.getOperand(0));
        if (!a.op.sameAs(b.op)) return false;
        return sameOperandValues(a, b);
    }

    /**
     * Whether two address statements definitely name the same location. Activation is not considered.
     *
     * @param a The first address statement.
     * @param b The second address statement.
     * @return Whether they are the same address.
     */
    public static boolean sameAddress(Stmt a, Stmt b) {
        if (a == b) return true;
        GlobalPtr ptrA = KernelOps.GLOBAL_PTR.cast(a.op).arg;
        GlobalPtr ptrB = KernelOps.GLOBAL_PTR.cast(b.op).arg;
        return ptrA.field == ptrB.field && sameOperandValues(a, b);
    }

    private static boolean sameOperandValues(Stmt a, Stmt b) {
        List<Stmt> as = a.getOperands();
        List<Stmt> bs = b.getOperands();
        if (as.size() != bs.size()) return false;
        for (int i = 0; i < as.size(); i++) {
            if (!sameValue(as.get(i), bs.get(i))) return false;
        }
        return true;
    }

    private static class StmtComparator {
        private final Map<Stmt, Stmt> correspondence = new HashMap<>();

        boolean compare(Stmt a, Stmt b) {
            if (a == b) return true;
            if (a.kind() != b.kind() || !a.op.sameAs(b.op)) return false;
            List<Stmt> as = a.getOperands();
            List<Stmt> bs = b.getOperands();
            if (as.size() != bs.size()) return false;
            for (int i = 0; i < as.size(); i++) {
                Stmt opA = as.get(i);
                if (opA != bs.get(i) && correspondence.get(opA) != bs.get(i)) return false;
            }
            correspondence.put(a, b);
            List<Block> blocksA = a.getBlocks();
            List<Block> blocksB = b.getBlocks();
            for (int i = 0; i < blocksA.size(); i++) {
                if (!compareBlocks(blocksA.get(i), blocksB.get(i))) return false;
            }
            return true;
        }

        private boolean compareBlocks(@Nullable Block a, @Nullable Block b) {
            if (a == null || b == null) return a == b;
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!compare(a.get(i), b.get(i))) return false;
            }
            return true;
        }
    }
}
