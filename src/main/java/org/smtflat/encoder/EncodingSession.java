package org.smtflat.encoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.ast.ArrayAst;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.config.EncoderOptions;
import org.smtflat.encoder.diagnostics.DiagnosticsEngine;
import org.smtflat.encoder.pointer.PointerConvention;
import org.smtflat.encoder.pointer.PointerTable;
import org.smtflat.encoder.solver.SmtFunction;
import org.smtflat.encoder.solver.SolverBackend;
import org.smtflat.encoder.solver.SolverTerm;
import org.smtflat.encoder.sort.Sort;
import org.smtflat.encoder.sort.SortRegistry;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one conversion session: the fresh-name counter, the sort registry,
 * the pointer table, collected diagnostics and the solver backend. Every Ast
 * operation receives the session explicitly; nothing is process-global, so
 * independent sessions may run on separate threads.
 * <p>
 * Not thread-safe. A session and every Ast created through it must stay on
 * one thread.
 */
public final class EncodingSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EncodingSession.class);

    private final EncoderOptions options;
    private final SolverBackend backend;
    private final SortRegistry sorts;
    private final PointerTable pointerTable = new PointerTable();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private long freshCounter;
    private ScalarAst trueAst;

    /**
     * @param options The encoder options.
     * @param backend The solver backend; the session closes it.
     */
    public EncodingSession(EncoderOptions options, SolverBackend backend) {
        this.options = options;
        this.backend = backend;
        this.sorts = new SortRegistry(options.infiniteDomainWidth(), new PointerConvention(options.pointerWidth()));
    }

    public EncoderOptions options() {
        return options;
    }

    public SolverBackend backend() {
        return backend;
    }

    public SortRegistry sorts() {
        return sorts;
    }

    public PointerTable pointerTable() {
        return pointerTable;
    }

    public PointerConvention pointers() {
        return sorts.pointers();
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * @param prefix A tag describing what the name is for.
     * @return {@code prefix} followed by the next value of the session counter.
     */
    public String freshName(String prefix) {
        return prefix + (freshCounter++);
    }

    // --- Scalar construction ---

    /**
     * Applies a solver operator and wraps the result.
     * @param sort The result sort.
     * @param function The operator.
     * @param args The scalar operands.
     * @return A new scalar Ast.
     */
    public ScalarAst apply(Sort sort, SmtFunction function, ScalarAst... args) {
        List<SolverTerm> terms = new ArrayList<>(args.length);
        for (ScalarAst a : args) {
            terms.add(a.term());
        }
        return new ScalarAst(freshName("smt::"), sort, backend.mkFuncApp(sort, function, terms));
    }

    /**
     * Creates a named free scalar symbol.
     */
    public ScalarAst symbol(String name, Sort sort) {
        return new ScalarAst(name, sort, backend.mkSymbol(name, sort));
    }

    public ScalarAst bvConstant(BigInteger value, int width, boolean signed) {
        return new ScalarAst(freshName("const::"), sorts.bitVector(width, signed),
                backend.mkBvInt(value, signed, width));
    }

    public ScalarAst boolConstant(boolean value) {
        if (value && trueAst != null) return trueAst;
        ScalarAst created = new ScalarAst(freshName("const::"), sorts.bool(), backend.mkBool(value));
        if (value) trueAst = created;
        return created;
    }

    /**
     * @param index A constant index.
     * @param domainWidth The array's domain width.
     * @return The index as an unsigned bit-vector of the domain width.
     */
    public ScalarAst indexConstant(long index, int domainWidth) {
        return bvConstant(BigInteger.valueOf(index), domainWidth, false);
    }

    /**
     * Zero-extends or truncates an index to the domain width of an array.
     * @param index A bit-vector index.
     * @param domainWidth The required width.
     * @return The adjusted index.
     */
    public ScalarAst fitIndex(ScalarAst index, int domainWidth) {
        if (!(index.sort() instanceof Sort.BitVectorSort bv)) {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "index",
                    "array index is not a bit-vector: " + index.sort(), index.name());
        }
        int width = bv.width();
        if (width == domainWidth) return index;
        if (width > domainWidth) {
            return extract(index, domainWidth - 1, 0);
        }
        ScalarAst zeros = indexConstant(0, domainWidth - width);
        return apply(sorts.bitVector(domainWidth, false), SmtFunction.CONCAT, zeros, index);
    }

    /**
     * Bits {@code [high:low]} of a bit-vector as an unsigned bit-vector.
     */
    public ScalarAst extract(ScalarAst source, int high, int low) {
        Sort target = sorts.bitVector(high - low + 1, false);
        return new ScalarAst(freshName("smt::"), target, backend.mkExtract(source.term(), high, low, target));
    }

    /**
     * Conjunction of boolean Asts; {@code true} for none.
     */
    public ScalarAst conjunct(List<ScalarAst> conjuncts) {
        if (conjuncts.isEmpty()) return boolConstant(true);
        if (conjuncts.size() == 1) return conjuncts.get(0);
        return apply(sorts.bool(), SmtFunction.AND, conjuncts.toArray(new ScalarAst[0]));
    }

    // --- Fresh composite values ---

    /**
     * Creates an unconstrained value of any sort: an unmaterialized tuple, an
     * array of tuples with free sub-arrays, or a free scalar symbol.
     * @param sort The sort.
     * @param name The name of the new identity.
     * @return The fresh Ast.
     */
    public Ast fresh(Sort sort, String name) {
        if (sort instanceof Sort.TupleSort ts) return new TupleAst(ts, name);
        if (sort instanceof Sort.ArraySort as && as.isTupleArray()) return ArrayAst.fresh(this, as, name);
        return symbol(name, sort);
    }

    /**
     * Asserts a boolean Ast.
     * @param formula A bool-sorted Ast.
     */
    public void assertAst(Ast formula) {
        ScalarAst f = ScalarAst.requireBool(formula, "assert");
        LOG.trace("assert {}", f.term());
        backend.assertFormula(f.term());
    }

    @Override
    public void close() {
        backend.close();
    }
}
