package io.github.eutro.kcse.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * A key for operations with a single intermediate of type {@code T}.
 *
 * @param <T> The type of the intermediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, StmtKind kind, Function<T, String> printer) {
        super(mnemonic, kind);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic, StmtKind kind) {
        this(mnemonic, kind, Objects::toString);
    }

    public class UnaryOp extends Op {
        public T arg;

        public UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @SuppressWarnings("unchecked")
        @Override
        public boolean sameAs(Op other) {
            return other.key == key && Objects.equals(arg, ((UnaryOp) other).arg);
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    @Nullable
    public UnaryOp checkNullable(Op val) {
        if (val.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) val;
            return ret;
        }
        return null;
    }

    public UnaryOp cast(Op val) {
        UnaryOp op = checkNullable(val);
        if (op == null) {
            throw new ClassCastException(String.format("expected %s op, got %s", mnemonic, val));
        }
        return op;
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException(mnemonic + " argument is null");
        }
        return new UnaryOp(arg);
    }
}
