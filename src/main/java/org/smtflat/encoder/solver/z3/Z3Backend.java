package org.smtflat.encoder.solver.z3;

import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Version;
import com.microsoft.z3.Z3Exception;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.config.SolverOptions;
import org.smtflat.encoder.solver.SmtFunction;
import org.smtflat.encoder.solver.SolverBackend;
import org.smtflat.encoder.solver.SolverException;
import org.smtflat.encoder.solver.SolverStatus;
import org.smtflat.encoder.solver.SolverTerm;
import org.smtflat.encoder.sort.Sort;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SolverBackend} on top of the Z3 Java API. Not thread-safe; one
 * instance per encoding session.
 */
public class Z3Backend implements SolverBackend {

    private static final Logger LOG = LoggerFactory.getLogger(Z3Backend.class);

    private final Context ctx;
    private final Solver solver;
    private final Map<Sort, com.microsoft.z3.Sort> sorts = new HashMap<>();
    private Model model;

    /**
     * Opens a Z3 context and a solver for the configured logic.
     * @param options The solver options.
     */
    public Z3Backend(SolverOptions options) {
        try {
            this.ctx = new Context(Map.of("model", "true"));
            this.solver = ctx.mkSolver(options.logic());
            if (options.timeoutMillis() > 0) {
                Params params = ctx.mkParams();
                params.add("timeout", (int) Math.min(Integer.MAX_VALUE, options.timeoutMillis()));
                solver.setParameters(params);
            }
        } catch (Z3Exception | UnsatisfiedLinkError e) {
            throw new SolverException("Failed to initialize Z3", e);
        }
        LOG.debug("Opened {} for logic {}", solverText(), options.logic());
    }

    @Override
    public String solverText() {
        return "Z3 " + Version.getFullVersion();
    }

    @Override
    public SolverTerm mkSymbol(String name, Sort sort) {
        return new Z3Term(ctx.mkConst(name, toZ3(sort)), sort);
    }

    @Override
    public SolverTerm mkFuncApp(Sort sort, SmtFunction function, List<SolverTerm> args) {
        checkArity(function, args);
        try {
            return new Z3Term(apply(function, args), sort);
        } catch (Z3Exception e) {
            throw new SolverException("Z3 rejected " + function + " over " + args, e);
        }
    }

    private static void checkArity(SmtFunction function, List<SolverTerm> args) {
        boolean ok = function.isVariadic() ? args.size() >= 1 : args.size() == function.arity();
        if (!ok) {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "mkFuncApp",
                    function + " applied to " + args.size() + " arguments");
        }
    }

    private Expr<?> apply(SmtFunction function, List<SolverTerm> args) {
        Expr<?> a = args.isEmpty() ? null : expr(args.get(0));
        Expr<?> b = args.size() > 1 ? expr(args.get(1)) : null;
        switch (function) {
            case EQ:
                if (args.get(0).sort() instanceof Sort.BoolSort) return ctx.mkIff(bool(a), bool(b));
                return ctx.mkEq(a, b);
            case NOTEQ:
                return ctx.mkNot(ctx.mkEq(a, b));
            case AND:
                return ctx.mkAnd(bools(args));
            case OR:
                return ctx.mkOr(bools(args));
            case XOR:
                return ctx.mkXor(bool(a), bool(b));
            case IMPLIES:
                return ctx.mkImplies(bool(a), bool(b));
            case NOT:
                return ctx.mkNot(bool(a));
            case ITE:
                return ctx.mkITE(bool(a), any(b), any(expr(args.get(2))));
            case BVADD:
                return ctx.mkBVAdd(bv(a), bv(b));
            case BVSUB:
                return ctx.mkBVSub(bv(a), bv(b));
            case BVMUL:
                return ctx.mkBVMul(bv(a), bv(b));
            case BVAND:
                return ctx.mkBVAND(bv(a), bv(b));
            case BVOR:
                return ctx.mkBVOR(bv(a), bv(b));
            case BVXOR:
                return ctx.mkBVXOR(bv(a), bv(b));
            case BVSHL:
                return ctx.mkBVSHL(bv(a), bv(b));
            case BVLSHR:
                return ctx.mkBVLSHR(bv(a), bv(b));
            case BVASHR:
                return ctx.mkBVASHR(bv(a), bv(b));
            case BVULT:
                return ctx.mkBVULT(bv(a), bv(b));
            case BVULTE:
                return ctx.mkBVULE(bv(a), bv(b));
            case BVUGT:
                return ctx.mkBVUGT(bv(a), bv(b));
            case BVUGTE:
                return ctx.mkBVUGE(bv(a), bv(b));
            case BVSLT:
                return ctx.mkBVSLT(bv(a), bv(b));
            case BVSLTE:
                return ctx.mkBVSLE(bv(a), bv(b));
            case BVSGT:
                return ctx.mkBVSGT(bv(a), bv(b));
            case BVSGTE:
                return ctx.mkBVSGE(bv(a), bv(b));
            case STORE:
                return ctx.mkStore(array(a), any(b), any(expr(args.get(2))));
            case SELECT:
                return ctx.mkSelect(array(a), any(b));
            case CONCAT:
                return ctx.mkConcat(bv(a), bv(b));
            default:
                throw new IllegalStateException("Unhandled function " + function);
        }
    }

    @Override
    public SolverTerm mkExtract(SolverTerm term, int high, int low, Sort sort) {
        return new Z3Term(ctx.mkExtract(high, low, bv(expr(term))), sort);
    }

    @Override
    public SolverTerm mkBvInt(BigInteger value, boolean signed, int width) {
        BigInteger reduced = value.mod(BigInteger.ONE.shiftLeft(width));
        return new Z3Term(ctx.mkBV(reduced.toString(), width), new Sort.BitVectorSort(width, signed));
    }

    @Override
    public SolverTerm mkBool(boolean value) {
        return new Z3Term(ctx.mkBool(value), new Sort.BoolSort());
    }

    @Override
    public void assertFormula(SolverTerm formula) {
        if (!(formula.sort() instanceof Sort.BoolSort)) {
            throw new EncodingContractException(EncodingErrorCode.NON_BOOLEAN_ASSERTION, "assert",
                    "formula has sort " + formula.sort());
        }
        model = null;
        solver.add(bool(expr(formula)));
    }

    @Override
    public SolverStatus check() {
        Status status;
        try {
            status = solver.check();
        } catch (Z3Exception e) {
            throw new SolverException("Z3 failed while checking satisfiability", e);
        }
        switch (status) {
            case SATISFIABLE:
                model = solver.getModel();
                return SolverStatus.SATISFIABLE;
            case UNSATISFIABLE:
                model = null;
                return SolverStatus.UNSATISFIABLE;
            default:
                model = null;
                LOG.warn("Z3 answered unknown: {}", solver.getReasonUnknown());
                return SolverStatus.UNKNOWN;
        }
    }

    @Override
    public boolean getBool(SolverTerm term) {
        Expr<?> value = currentModel().eval(expr(term), true);
        if (value.isTrue()) return true;
        if (value.isFalse()) return false;
        throw new SolverException("Model has no boolean value for " + term);
    }

    @Override
    public BigInteger getBv(SolverTerm term) {
        Expr<?> value = currentModel().eval(expr(term), true);
        if (value instanceof BitVecNum num) return num.getBigInteger();
        throw new SolverException("Model has no bit-vector value for " + term);
    }

    private Model currentModel() {
        if (model == null) throw new SolverException("No model available; the last check was not satisfiable");
        return model;
    }

    @Override
    public void close() {
        ctx.close();
    }

    // --- Sort lowering ---

    private com.microsoft.z3.Sort toZ3(Sort sort) {
        com.microsoft.z3.Sort cached = sorts.get(sort);
        if (cached != null) return cached;
        com.microsoft.z3.Sort created;
        if (sort instanceof Sort.BoolSort) {
            created = ctx.getBoolSort();
        } else if (sort instanceof Sort.BitVectorSort bv) {
            created = ctx.mkBitVecSort(bv.width());
        } else if (sort instanceof Sort.ArraySort arr && arr.range().isScalar()) {
            created = ctx.mkArraySort(ctx.mkBitVecSort(arr.domainWidth()), toZ3(arr.range()));
        } else {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "toZ3",
                    "composite sort cannot be handed to the solver: " + sort);
        }
        sorts.put(sort, created);
        return created;
    }

    // --- Unchecked views of Z3 expressions ---

    private static Expr<?> expr(SolverTerm term) {
        return ((Z3Term) term).expr();
    }

    @SuppressWarnings("unchecked")
    private static Expr<BoolSort> bool(Expr<?> e) {
        return (Expr<BoolSort>) e;
    }

    @SuppressWarnings("unchecked")
    private static Expr<BoolSort>[] bools(List<SolverTerm> args) {
        Expr<BoolSort>[] out = (Expr<BoolSort>[]) new Expr[args.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bool(expr(args.get(i)));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Expr<BitVecSort> bv(Expr<?> e) {
        return (Expr<BitVecSort>) e;
    }

    @SuppressWarnings("unchecked")
    private static Expr<com.microsoft.z3.Sort> any(Expr<?> e) {
        return (Expr<com.microsoft.z3.Sort>) e;
    }

    @SuppressWarnings("unchecked")
    private static Expr<ArraySort<com.microsoft.z3.Sort, com.microsoft.z3.Sort>> array(Expr<?> e) {
        return (Expr<ArraySort<com.microsoft.z3.Sort, com.microsoft.z3.Sort>>) e;
    }
}
