package io.github.eutro.kcse.test;

import io.github.eutro.kcse.ir.IRBuilder;
import io.github.eutro.kcse.ir.Kernel;
import io.github.eutro.kcse.ir.Stmt;
import io.github.eutro.kcse.ops.BinaryOpType;
import io.github.eutro.kcse.ops.KernelOps;
import io.github.eutro.kcse.ops.UnaryOpType;
import io.github.eutro.kcse.passes.IRPass;
import io.github.eutro.kcse.passes.InPlaceIRPass;
import io.github.eutro.kcse.passes.Passes;
import io.github.eutro.kcse.passes.opts.WholeKernelCSE;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void verifiedCse() {
        Kernel kernel = new Kernel("chained");
        IRBuilder ib = new IRBuilder(kernel);
        Stmt x = ib.arg(0);
        Stmt a = ib.binary(BinaryOpType.ADD, x, x);
        Stmt b = ib.binary(BinaryOpType.ADD, x, x);
        Stmt p = ib.print("ab", a, b);

        assertTrue(Passes.CSE_VERIFIED.isInPlace());
        assertSame(kernel, Passes.CSE_VERIFIED.run(kernel));
        assertEquals(Arrays.asList(a, a), p.getOperands());
    }

    @Test
    void cseIsAnInPlacePass() {
        Kernel kernel = new Kernel("instance");
        IRBuilder ib = new IRBuilder(kernel);
        Stmt x = ib.arg(0);
        Stmt a = ib.unary(UnaryOpType.ABS, x);
        Stmt b = ib.unary(UnaryOpType.ABS, x);
        Stmt p = ib.print("ab", a, b);

        IRPass<Kernel, Kernel> pass = WholeKernelCSE.INSTANCE;
        assertTrue(pass.isInPlace());
        assertSame(kernel, pass.run(kernel));
        assertEquals(Arrays.asList(a, a), p.getOperands());
        assertFalse(WholeKernelCSE.runToFixpoint(kernel));
    }

    @Test
    void chainReportsFailingPass() {
        Kernel kernel = new Kernel("broken");
        Stmt x = KernelOps.ARG.create(0).stmt();
        kernel.body.add(KernelOps.PRINT.create("x").stmt(x));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Passes.CSE_VERIFIED.run(kernel));
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 0 (VerifyIntegrity) in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void chainsRunInOrder() {
        StringBuilder sb = new StringBuilder();
        InPlaceIRPass<Kernel> first = k -> sb.append("first ");
        InPlaceIRPass<Kernel> second = k -> sb.append(k.name);
        IRPass<Kernel, Kernel> chain = first.then(WholeKernelCSE.INSTANCE).then(second);

        chain.run(new Kernel("k"));
        assertEquals("first k", sb.toString());
    }
}
