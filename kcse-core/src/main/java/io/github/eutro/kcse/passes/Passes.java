package io.github.eutro.kcse.passes;

import io.github.eutro.kcse.ir.Kernel;
import io.github.eutro.kcse.passes.meta.VerifyIntegrity;
import io.github.eutro.kcse.passes.opts.WholeKernelCSE;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Whole kernel common subexpression elimination, then a check that the result is well-formed.
     */
    public static final IRPass<Kernel, Kernel> CSE_VERIFIED =
            VerifyIntegrity.INSTANCE
                    .then(WholeKernelCSE.INSTANCE)
                    .then(VerifyIntegrity.INSTANCE);
}
