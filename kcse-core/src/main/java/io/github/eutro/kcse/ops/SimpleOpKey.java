package io.github.eutro.kcse.ops;

/**
 * A key for operations without intermediates, which all share one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic, StmtKind kind) {
        super(mnemonic, kind);
    }

    public Op create() {
        return op;
    }
}
