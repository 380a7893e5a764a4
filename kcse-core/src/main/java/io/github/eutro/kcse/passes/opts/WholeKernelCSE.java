package io.github.eutro.kcse.passes.opts;

import io.github.eutro.kcse.ir.*;
import io.github.eutro.kcse.ops.KernelOps;
import io.github.eutro.kcse.ops.StmtKind;
import io.github.eutro.kcse.passes.InPlaceIRPass;
import io.github.eutro.kcse.passes.meta.VerifyIntegrity;
import io.github.eutro.kcse.util.IRUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Common subexpression elimination across a whole kernel.
 * <p>
 * Walks the kernel in program order, keeping the eligible statements seen so far in a stack of scopes,
 * one per enclosing block. A statement equivalent to an available one is replaced by it. The shared
 * first and last statements of the two arms of an if are moved out of the if.
 * <p>
 * Edits are collected during a walk and applied after it. Walks are repeated until one changes nothing,
 * since every change can expose more.
 */
public class WholeKernelCSE implements InPlaceIRPass<Kernel> {
    /**
     * An instance of this pass.
     */
    public static final WholeKernelCSE INSTANCE = new WholeKernelCSE();

    /**
     * Whether {@link VerifyIntegrity} should be run after every iteration.
     */
    public static boolean VERIFY_ITERATIONS = System.getenv("KCSE_VERIFY_ITERATIONS") != null;

    private static final Logger logger = LoggerFactory.getLogger(WholeKernelCSE.class);

    @Override
    public void runInPlace(Kernel kernel) {
        runToFixpoint(kernel);
    }

    /**
     * Run the pass to a fixpoint.
     * <p>
     * Empty arms of ifs are dropped along the way, but do not count as a change on their own.
     *
     * @param kernel The kernel to optimise.
     * @return Whether any statement was eliminated or hoisted.
     */
    public static boolean runToFixpoint(Kernel kernel) {
        Eliminator eliminator = new Eliminator();
        boolean modified = false;
        int iterations = 0;
        while (true) {
            iterations++;
            eliminator.visitBlock(kernel.body);
            if (!eliminator.commit()) break;
            modified = true;
            logger.debug("kernel {}: iteration {} changed the IR", kernel.name, iterations);
            if (VERIFY_ITERATIONS) {
                VerifyIntegrity.INSTANCE.runInPlace(kernel);
            }
        }
        logger.debug("kernel {}: fixpoint after {} iterations, {} eliminated, {} hoisted",
                kernel.name, iterations, eliminator.eliminated, eliminator.hoisted);
        return modified;
    }

    /**
     * Whether {@code stmt} can be replaced by {@code prev}, an available statement of the same kind before it.
     * <p>
     * An earlier activating address subsumes any later access to the same address,
     * but a later activating address is never subsumed by an earlier non-activating one.
     *
     * @param stmt The later statement.
     * @param prev The earlier statement.
     * @return Whether {@code stmt} is redundant.
     * @throws IllegalStateException If the kinds differ, or the kind is never eligible.
     */
    public static boolean eliminable(Stmt stmt, Stmt prev) {
        if (stmt.kind() != prev.kind()) {
            throw new IllegalStateException(String.format(
                    "comparing statements of different kinds\n  statement: %s\n  previous: %s",
                    stmt.toHeaderString(),
                    prev.toHeaderString()));
        }
        switch (stmt.kind()) {
            case GLOBAL_PTR: {
                GlobalPtr thisPtr = KernelOps.GLOBAL_PTR.cast(stmt.op).arg;
                GlobalPtr prevPtr = KernelOps.GLOBAL_PTR.cast(prev.op).arg;
                return IRUtils.sameAddress(stmt, prev)
                        && (thisPtr.activate == prevPtr.activate || prevPtr.activate);
            }
            case LOOP_UNIQUE:
                return IRUtils.sameValue(stmt.getOperand(0), prev.getOperand(0));
            case CONST:
            case ARG:
            case BINARY:
            case UNARY:
            case SELECT:
            case LOOP_INDEX:
                return IRUtils.sameStatements(stmt, prev);
            case GLOBAL_LOAD:
            case GLOBAL_STORE:
            case ATOMIC_ADD:
            case ALLOCA:
            case LOCAL_LOAD:
            case LOCAL_STORE:
            case PRINT:
            case IF:
            case RANGE_FOR:
                // only reachable if a statement was made eligible explicitly
                if (stmt.isEligible() && prev.isEligible()) {
                    return IRUtils.sameStatements(stmt, prev);
                }
                break;
        }
        throw new IllegalStateException(String.format(
                "statement of kind %s is not eligible for elimination\n  statement: %s",
                stmt.kind(),
                stmt.toHeaderString()));
    }

    /**
     * Carry over what {@code stmt} knows to {@code prev}, which is replacing it.
     *
     * @param stmt The statement being eliminated.
     * @param prev The statement replacing it.
     */
    public static void merge(Stmt stmt, Stmt prev) {
        if (stmt.kind() == StmtKind.LOOP_UNIQUE) {
            KernelOps.LOOP_UNIQUE.cast(prev.op).arg
                    .unionWith(KernelOps.LOOP_UNIQUE.cast(stmt.op).arg);
        }
    }

    private static class Eliminator {
        // ids of statements compared against everything available to them, and registered
        final Set<Integer> done = new HashSet<>();
        final Scopes scopes = new Scopes();
        final DelayedIRModifier modifier = new DelayedIRModifier();
        int eliminated = 0;
        int hoisted = 0;
        // a hoisted statement is a new candidate for statements already compared
        boolean forgetDone = false;

        boolean commit() {
            if (forgetDone) {
                done.clear();
                forgetDone = false;
            }
            return modifier.modifyIR();
        }

        void visitBlock(Block block) {
            scopes.push();
            for (Stmt stmt : block.getStatements()) {
                visit(stmt);
            }
            scopes.pop();
        }

        void visit(Stmt stmt) {
            switch (stmt.kind()) {
                case IF:
                    visitIf(stmt);
                    return;
                case RANGE_FOR:
                    visitNested(stmt);
                    return;
                default:
                    break;
            }
            if (stmt.isEligible()) {
                visitEligible(stmt);
            }
        }

        void visitNested(Stmt container) {
            for (@Nullable Block block : container.getBlocks()) {
                if (block != null) visitBlock(block);
            }
        }

        void visitEligible(Stmt stmt) {
            if (done.contains(stmt.id)) {
                scopes.register(stmt);
                return;
            }
            Stmt prev = scopes.findEquivalent(stmt);
            if (prev != null) {
                markUndone(stmt);
                merge(stmt, prev);
                IRUtils.replaceAllUsagesWith(stmt, prev);
                modifier.erase(stmt);
                eliminated++;
                if (logger.isTraceEnabled()) {
                    logger.trace("eliminated {} in favour of {}", stmt.toHeaderString(), prev.toHeaderString());
                }
                return;
            }
            scopes.register(stmt);
            done.add(stmt.id);
        }

        /**
         * Every user of {@code modified} has to be compared again, the next time it is visited.
         */
        void markUndone(Stmt modified) {
            for (Stmt user : modified.getUsers()) {
                done.remove(user.id);
            }
        }

        void visitIf(Stmt ifStmt) {
            dropIfEmpty(ifStmt, KernelOps.TRUE_ARM);
            dropIfEmpty(ifStmt, KernelOps.FALSE_ARM);

            Block trueArm = ifStmt.getBlock(KernelOps.TRUE_ARM);
            Block falseArm = ifStmt.getBlock(KernelOps.FALSE_ARM);
            if (trueArm != null && falseArm != null) {
                // the arms are visited after this, so changing them directly is fine
                if (IRUtils.sameStatements(trueArm.first(), falseArm.first())) {
                    modifier.insertBefore(ifStmt, hoist(trueArm, falseArm, 0, 0));
                }
                if (!trueArm.isEmpty() && !falseArm.isEmpty()
                        && IRUtils.sameStatements(trueArm.last(), falseArm.last())) {
                    modifier.insertAfter(ifStmt, hoist(trueArm, falseArm, trueArm.size() - 1, falseArm.size() - 1));
                }
            }

            visitNested(ifStmt);
        }

        void dropIfEmpty(Stmt ifStmt, int slot) {
            Block arm = ifStmt.getBlock(slot);
            if (arm != null && arm.isEmpty()) {
                ifStmt.setBlock(slot, null);
            }
        }

        Stmt hoist(Block trueArm, Block falseArm, int trueIndex, int falseIndex) {
            Stmt common = trueArm.extract(trueIndex);
            Stmt duplicate = falseArm.get(falseIndex);
            forgetDone = true;
            IRUtils.replaceAllUsagesWith(falseArm, duplicate, common);
            falseArm.erase(falseIndex);
            hoisted++;
            if (logger.isTraceEnabled()) {
                logger.trace("hoisted {} out of if", common.toHeaderString());
            }
            return common;
        }
    }

    /**
     * The eligible statements available at the current point of the walk, by kind, one table per enclosing block.
     */
    private static class Scopes {
        private final Deque<Map<StmtKind, Set<Stmt>>> stack = new ArrayDeque<>();

        void push() {
            stack.addLast(new EnumMap<>(StmtKind.class));
        }

        void pop() {
            stack.removeLast();
        }

        void register(Stmt stmt) {
            stack.getLast().computeIfAbsent(stmt.kind(), $ -> new LinkedHashSet<>()).add(stmt);
        }

        /**
         * Find an available statement that {@code stmt} can be replaced with, searching outermost scopes first.
         *
         * @param stmt The statement.
         * @return The statement to replace it with, or null if there is none.
         */
        @Nullable
        Stmt findEquivalent(Stmt stmt) {
            for (Map<StmtKind, Set<Stmt>> scope : stack) {
                Set<Stmt> candidates = scope.get(stmt.kind());
                if (candidates == null) continue;
                for (Stmt prev : candidates) {
                    if (eliminable(stmt, prev)) return prev;
                }
            }
            return null;
        }
    }
}
