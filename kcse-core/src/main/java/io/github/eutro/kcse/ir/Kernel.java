package io.github.eutro.kcse.ir;

import io.github.eutro.kcse.ext.ExtHolder;

/**
 * A kernel, the root of the IR tree.
 */
public final class Kernel extends ExtHolder {
    public final String name;
    public final Block body = new Block();

    public Kernel(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("kernel ").append(name).append(" {\n");
        body.print(sb, "  ");
        return sb.append('}').toString();
    }
}
