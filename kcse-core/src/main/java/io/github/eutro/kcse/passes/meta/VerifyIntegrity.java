package io.github.eutro.kcse.passes.meta;

import io.github.eutro.kcse.ir.Block;
import io.github.eutro.kcse.ir.Kernel;
import io.github.eutro.kcse.ir.Stmt;
import io.github.eutro.kcse.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Checks that a kernel is well-formed, throwing {@link IllegalStateException} if not.
 * <p>
 * Every operand must be defined earlier in the same block or an enclosing one, or be an enclosing
 * container statement. Ownership links and the users of every statement must match the tree.
 */
public class VerifyIntegrity implements InPlaceIRPass<Kernel> {
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Kernel kernel) {
        if (kernel.body.getParentStmt() != null) {
            throw new IllegalStateException("kernel body is nested in a statement");
        }
        new Verifier().verifyBlock(kernel.body);
    }

    private static class Verifier {
        private final Set<Stmt> seen = new HashSet<>();
        private final Set<Stmt> visible = new HashSet<>();

        void verifyBlock(Block block) {
            List<Stmt> defined = new ArrayList<>();
            for (Stmt stmt : block.getStatements()) {
                verifyStmt(block, stmt);
                visible.add(stmt);
                defined.add(stmt);
            }
            visible.removeAll(defined);
        }

        private void verifyStmt(Block block, Stmt stmt) {
            if (!seen.add(stmt)) {
                throw fail("statement occurs twice", stmt, block);
            }
            if (stmt.getParent() != block) {
                throw fail("statement not owned by its block", stmt, block);
            }
            for (Stmt operand : stmt.getOperands()) {
                if (!visible.contains(operand)) {
                    throw fail(String.format("operand %s is not defined before use",
                            operand.toTargetString()), stmt, block);
                }
                if (!operand.getUsers().contains(stmt)) {
                    throw fail(String.format("operand %s does not list the statement as a user",
                            operand.toTargetString()), stmt, block);
                }
            }
            for (Stmt user : stmt.getUsers()) {
                if (!user.hasOperand(stmt)) {
                    throw fail(String.format("user %s does not use the statement",
                            user.toTargetString()), stmt, block);
                }
            }
            if (!stmt.kind().isContainer()) return;
            visible.add(stmt);
            for (@Nullable Block nested : stmt.getBlocks()) {
                if (nested == null) continue;
                if (nested.getParentStmt() != stmt) {
                    throw fail("nested block not owned by its statement", stmt, block);
                }
                verifyBlock(nested);
            }
            visible.remove(stmt);
        }

        private static IllegalStateException fail(String message, Stmt stmt, Block block) {
            return new IllegalStateException(String.format(
                    "%s\n  statement: %s\n  in block: %s",
                    message,
                    stmt.toHeaderString(),
                    block), stmt.created);
        }
    }
}
