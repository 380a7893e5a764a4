package io.github.eutro.kcse.test;

import io.github.eutro.kcse.ir.*;
import io.github.eutro.kcse.ops.BinaryOpType;
import io.github.eutro.kcse.ops.KernelOps;
import io.github.eutro.kcse.ops.UnaryOpType;

import java.util.*;

/**
 * Runs a kernel, recording everything a kernel can be observed doing.
 */
public class KernelInterpreter {
    private static final int MAX_STEPS = 100_000;

    public static final class Address {
        final Field field;
        final List<Long> indices;

        Address(Field field, List<Long> indices) {
            this.field = field;
            this.indices = indices;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Address)) return false;
            Address that = (Address) o;
            return field == that.field && indices.equals(that.indices);
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(field) * 31 + indices.hashCode();
        }

        @Override
        public String toString() {
            return field + "" + indices;
        }
    }

    /**
     * What a kernel did when run.
     */
    public static final class Trace {
        public final List<String> printed = new ArrayList<>();
        public final Map<Address, Long> storage = new HashMap<>();
        public final Set<Address> activated = new HashSet<>();

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Trace)) return false;
            Trace that = (Trace) o;
            return printed.equals(that.printed)
                    && storage.equals(that.storage)
                    && activated.equals(that.activated);
        }

        @Override
        public int hashCode() {
            return Objects.hash(printed, storage, activated);
        }

        @Override
        public String toString() {
            return "printed: " + printed + "\nstorage: " + storage + "\nactivated: " + activated;
        }
    }

    private final long[] args;
    private final Trace trace = new Trace();
    private final Map<Stmt, Object> values = new HashMap<>();
    private int steps = 0;

    private KernelInterpreter(long[] args) {
        this.args = args;
    }

    public static Trace run(Kernel kernel, long... args) {
        KernelInterpreter interpreter = new KernelInterpreter(args);
        interpreter.runBlock(kernel.body);
        return interpreter.trace;
    }

    private void runBlock(Block block) {
        for (Stmt stmt : block.getStatements()) {
            if (++steps > MAX_STEPS) {
                throw new IllegalStateException("kernel ran for too long");
            }
            runStmt(stmt);
        }
    }

    private long num(Stmt stmt) {
        return (Long) value(stmt);
    }

    private Object value(Stmt stmt) {
        Object value = values.get(stmt);
        if (value == null) {
            throw new IllegalStateException("no value for " + stmt.toHeaderString());
        }
        return value;
    }

    private void runStmt(Stmt stmt) {
        Object result = null;
        switch (stmt.kind()) {
            case CONST:
                result = ((Number) KernelOps.CONST.cast(stmt.op).arg).longValue();
                break;
            case ARG:
                result = args[KernelOps.ARG.cast(stmt.op).arg];
                break;
            case BINARY:
                result = binary(KernelOps.BINARY.cast(stmt.op).arg, num(stmt.getOperand(0)), num(stmt.getOperand(1)));
                break;
            case UNARY:
                result = unary(KernelOps.UNARY.cast(stmt.op).arg, num(stmt.getOperand(0)));
                break;
            case SELECT:
                result = num(stmt.getOperand(0)) != 0 ? num(stmt.getOperand(1)) : num(stmt.getOperand(2));
                break;
            case LOOP_INDEX:
            case LOOP_UNIQUE:
                result = num(stmt.getOperand(0));
                break;
            case GLOBAL_PTR: {
                GlobalPtr ptr = KernelOps.GLOBAL_PTR.cast(stmt.op).arg;
                List<Long> indices = new ArrayList<>();
                for (Stmt operand : stmt.getOperands()) {
                    indices.add(num(operand));
                }
                Address address = new Address(ptr.field, indices);
                if (ptr.activate) trace.activated.add(address);
                result = address;
                break;
            }
            case GLOBAL_LOAD:
                result = trace.storage.getOrDefault((Address) value(stmt.getOperand(0)), 0L);
                break;
            case GLOBAL_STORE:
                trace.storage.put((Address) value(stmt.getOperand(0)), num(stmt.getOperand(1)));
                break;
            case ATOMIC_ADD: {
                Address address = (Address) value(stmt.getOperand(0));
                long old = trace.storage.getOrDefault(address, 0L);
                trace.storage.put(address, old + num(stmt.getOperand(1)));
                result = old;
                break;
            }
            case ALLOCA:
                result = new long[1];
                break;
            case LOCAL_LOAD:
                result = ((long[]) value(stmt.getOperand(0)))[0];
                break;
            case LOCAL_STORE:
                ((long[]) value(stmt.getOperand(0)))[0] = num(stmt.getOperand(1));
                break;
            case PRINT: {
                StringBuilder sb = new StringBuilder(KernelOps.PRINT.cast(stmt.op).arg);
                for (Stmt operand : stmt.getOperands()) {
                    sb.append(' ').append(num(operand));
                }
                trace.printed.add(sb.toString());
                break;
            }
            case IF: {
                Block arm = stmt.getBlock(num(stmt.getOperand(0)) != 0 ? KernelOps.TRUE_ARM : KernelOps.FALSE_ARM);
                if (arm != null) runBlock(arm);
                break;
            }
            case RANGE_FOR: {
                long end = num(stmt.getOperand(1));
                Block body = stmt.getBlock(KernelOps.BODY);
                for (long i = num(stmt.getOperand(0)); i < end; i++) {
                    values.put(stmt, i);
                    if (body != null) runBlock(body);
                }
                break;
            }
        }
        if (result != null) values.put(stmt, result);
    }

    private static long binary(BinaryOpType type, long a, long b) {
        switch (type) {
            case ADD:
                return a + b;
            case SUB:
                return a - b;
            case MUL:
                return a * b;
            case DIV:
                return b == 0 ? 0 : a / b;
            case MOD:
                return b == 0 ? 0 : a % b;
            case MIN:
                return Math.min(a, b);
            case MAX:
                return Math.max(a, b);
            case BIT_AND:
                return a & b;
            case BIT_OR:
                return a | b;
            case BIT_XOR:
                return a ^ b;
            case CMP_LT:
                return a < b ? 1 : 0;
            case CMP_EQ:
                return a == b ? 1 : 0;
            default:
                throw new IllegalArgumentException(type.toString());
        }
    }

    private static long unary(UnaryOpType type, long a) {
        switch (type) {
            case NEG:
                return -a;
            case ABS:
                return Math.abs(a);
            case BIT_NOT:
                return ~a;
            case LOGIC_NOT:
                return a == 0 ? 1 : 0;
            default:
                throw new IllegalArgumentException(type.toString());
        }
    }
}
