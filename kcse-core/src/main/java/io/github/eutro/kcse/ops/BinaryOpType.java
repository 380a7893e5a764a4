package io.github.eutro.kcse.ops;

/**
 * The operators of {@link KernelOps#BINARY} statements.
 */
public enum BinaryOpType {
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    MOD("mod"),
    MIN("min"),
    MAX("max"),
    BIT_AND("bit_and"),
    BIT_OR("bit_or"),
    BIT_XOR("bit_xor"),
    CMP_LT("cmp_lt"),
    CMP_EQ("cmp_eq"),
    ;

    public final String mnemonic;

    BinaryOpType(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
