package io.github.eutro.kcse.test;

import io.github.eutro.kcse.ir.*;
import io.github.eutro.kcse.ops.BinaryOpType;
import io.github.eutro.kcse.ops.KernelOps;
import io.github.eutro.kcse.ops.UnaryOpType;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

/**
 * Generates random well-formed kernels, biased towards repeated computations.
 * The same seed always generates the same kernel.
 */
public class KernelGenerator {
    public static final Field F1 = new Field("f1", 1);
    public static final Field F2 = new Field("f2", 2);
    public static final int ARG_COUNT = 2;

    private static final int MAX_DEPTH = 3;
    private static final BinaryOpType[] BINARY_OPS = {
            BinaryOpType.ADD,
            BinaryOpType.SUB,
            BinaryOpType.MUL,
            BinaryOpType.MOD,
            BinaryOpType.CMP_LT,
            BinaryOpType.MAX,
    };

    private final Random random;

    private KernelGenerator(long seed) {
        random = new Random(seed);
    }

    public static Kernel generate(long seed) {
        KernelGenerator generator = new KernelGenerator(seed);
        Kernel kernel = new Kernel("random_" + seed);
        IRBuilder ib = new IRBuilder(kernel);
        Pool pool = new Pool();
        for (int i = 0; i < ARG_COUNT; i++) {
            pool.values.add(ib.arg(i));
        }
        generator.genBlock(ib, pool, 0, 4 + generator.random.nextInt(10));
        return kernel;
    }

    private static class Pool {
        final List<Stmt> values = new ArrayList<>();
        final List<Stmt> ptrs = new ArrayList<>();
        final List<Stmt> allocas = new ArrayList<>();

        Pool copy() {
            Pool pool = new Pool();
            pool.values.addAll(values);
            pool.ptrs.addAll(ptrs);
            pool.allocas.addAll(allocas);
            return pool;
        }
    }

    private <T> T pick(List<T> list) {
        return list.get(random.nextInt(list.size()));
    }

    private void genBlock(IRBuilder ib, Pool pool, int depth, int count) {
        for (int i = 0; i < count; i++) {
            genStmt(ib, pool, depth);
        }
    }

    private void genStmt(IRBuilder ib, Pool pool, int depth) {
        switch (random.nextInt(depth < MAX_DEPTH ? 15 : 13)) {
            case 0:
            case 1:
                pool.values.add(ib.constant((long) random.nextInt(3)));
                break;
            case 2:
            case 3:
                pool.values.add(ib.binary(BINARY_OPS[random.nextInt(BINARY_OPS.length)], pick(pool.values), pick(pool.values)));
                break;
            case 4:
                pool.values.add(ib.unary(UnaryOpType.values()[random.nextInt(UnaryOpType.values().length)], pick(pool.values)));
                break;
            case 5:
                pool.values.add(ib.select(pick(pool.values), pick(pool.values), pick(pool.values)));
                break;
            case 6:
                pool.ptrs.add(genPtr(ib, pool));
                break;
            case 7:
                if (pool.ptrs.isEmpty()) pool.ptrs.add(genPtr(ib, pool));
                pool.values.add(ib.globalLoad(pick(pool.ptrs)));
                break;
            case 8:
                if (pool.ptrs.isEmpty()) pool.ptrs.add(genPtr(ib, pool));
                if (random.nextBoolean()) {
                    ib.globalStore(pick(pool.ptrs), pick(pool.values));
                } else {
                    pool.values.add(ib.atomicAdd(pick(pool.ptrs), pick(pool.values)));
                }
                break;
            case 9: {
                List<Field> covers = new ArrayList<>();
                if (random.nextBoolean()) covers.add(F1);
                if (random.nextBoolean()) covers.add(F2);
                pool.values.add(ib.loopUnique(pick(pool.values), covers.toArray(new Field[0])));
                break;
            }
            case 10:
                ib.print("v", pick(pool.values));
                break;
            case 11:
                if (pool.allocas.isEmpty() || random.nextInt(3) == 0) {
                    pool.allocas.add(ib.alloca());
                }
                ib.localStore(pick(pool.allocas), pick(pool.values));
                break;
            case 12:
                if (pool.allocas.isEmpty()) {
                    pool.allocas.add(ib.alloca());
                }
                pool.values.add(ib.localLoad(pick(pool.allocas)));
                break;
            case 13:
                genIf(ib, pool, depth);
                break;
            case 14:
                genLoop(ib, pool, depth);
                break;
        }
    }

    private Stmt genPtr(IRBuilder ib, Pool pool) {
        if (random.nextBoolean()) {
            return ib.globalPtr(F1, random.nextBoolean(), pick(pool.values));
        } else {
            return ib.globalPtr(F2, random.nextBoolean(), pick(pool.values), pick(pool.values));
        }
    }

    /**
     * A statement to emit identically at the same end of both arms of an if.
     */
    private Function<IRBuilder, Stmt> genShared(Pool pool) {
        Stmt a = pick(pool.values);
        Stmt b = pick(pool.values);
        switch (random.nextInt(4)) {
            case 0: {
                long k = random.nextInt(3);
                return ib -> ib.constant(k);
            }
            case 1: {
                BinaryOpType type = BINARY_OPS[random.nextInt(BINARY_OPS.length)];
                return ib -> ib.binary(type, a, b);
            }
            case 2: {
                boolean activate = random.nextBoolean();
                return ib -> ib.globalPtr(F1, activate, a);
            }
            default:
                return ib -> ib.print("shared", a, b);
        }
    }

    private void genIf(IRBuilder ib, Pool pool, int depth) {
        Stmt ifStmt = ib.ifThenElse(pick(pool.values));
        Block outer = ib.getBlock();
        Function<IRBuilder, Stmt> prefix = random.nextBoolean() ? genShared(pool) : null;
        Function<IRBuilder, Stmt> suffix = random.nextBoolean() ? genShared(pool) : null;
        for (int slot : new int[]{KernelOps.TRUE_ARM, KernelOps.FALSE_ARM}) {
            ib.setBlock(ifStmt.getBlock(slot));
            Pool armPool = pool.copy();
            if (prefix != null) addToPool(armPool, prefix.apply(ib));
            genBlock(ib, armPool, depth + 1, random.nextInt(5));
            if (suffix != null) suffix.apply(ib);
        }
        ib.setBlock(outer);
    }

    private void genLoop(IRBuilder ib, Pool pool, int depth) {
        Stmt begin = ib.constant(0L);
        Stmt end = ib.constant((long) random.nextInt(4));
        Stmt loop = ib.rangeFor(begin, end);
        pool.values.add(begin);
        pool.values.add(end);
        Block outer = ib.getBlock();
        ib.setBlock(loop.getBlock(KernelOps.BODY));
        Pool bodyPool = pool.copy();
        bodyPool.values.add(ib.loopIndex(loop));
        genBlock(ib, bodyPool, depth + 1, 1 + random.nextInt(5));
        ib.setBlock(outer);
    }

    private static void addToPool(Pool pool, Stmt stmt) {
        switch (stmt.kind()) {
            case CONST:
            case BINARY:
                pool.values.add(stmt);
                break;
            case GLOBAL_PTR:
                pool.ptrs.add(stmt);
                break;
            default:
                break;
        }
    }
}
