package io.github.eutro.kcse.ops;

/**
 * The operators of {@link KernelOps#UNARY} statements.
 */
public enum UnaryOpType {
    NEG("neg"),
    ABS("abs"),
    BIT_NOT("bit_not"),
    LOGIC_NOT("logic_not"),
    ;

    public final String mnemonic;

    UnaryOpType(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
