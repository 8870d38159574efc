package org.smtflat.encoder.ast;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.solver.SmtFunction;
import org.smtflat.encoder.solver.SolverTerm;
import org.smtflat.encoder.sort.Sort;

/**
 * A value the solver represents natively: a boolean, a bit-vector or an array
 * with a scalar range.
 */
public final class ScalarAst implements Ast {

    private final String name;
    private final Sort sort;
    private final SolverTerm term;

    public ScalarAst(String name, Sort sort, SolverTerm term) {
        this.name = name;
        this.sort = sort;
        this.term = term;
    }

    @Override
    public Sort sort() {
        return sort;
    }

    @Override
    public String name() {
        return name;
    }

    public SolverTerm term() {
        return term;
    }

    @Override
    public ScalarAst eq(EncodingSession session, Ast other) {
        ScalarAst o = requireScalar(other, "eq");
        return session.apply(session.sorts().bool(), SmtFunction.EQ, this, o);
    }

    @Override
    public ScalarAst ite(EncodingSession session, Ast cond, Ast falseValue) {
        ScalarAst c = requireBool(cond, "ite");
        ScalarAst f = requireScalar(falseValue, "ite");
        return session.apply(sort, SmtFunction.ITE, c, this, f);
    }

    @Override
    public ScalarAst update(EncodingSession session, Ast value, long index) {
        Sort.ArraySort arr = requireArray(EncodingErrorCode.UPDATE_ON_NON_ARRAY, "update");
        return update(session, value, session.indexConstant(index, arr.domainWidth()));
    }

    @Override
    public ScalarAst update(EncodingSession session, Ast value, Ast index) {
        Sort.ArraySort arr = requireArray(EncodingErrorCode.UPDATE_ON_NON_ARRAY, "update");
        ScalarAst idx = session.fitIndex(requireScalar(index, "update"), arr.domainWidth());
        return session.apply(sort, SmtFunction.STORE, this, idx, requireScalar(value, "update"));
    }

    @Override
    public ScalarAst select(EncodingSession session, Ast index) {
        Sort.ArraySort arr = requireArray(EncodingErrorCode.SELECT_ON_NON_ARRAY, "select");
        ScalarAst idx = session.fitIndex(requireScalar(index, "select"), arr.domainWidth());
        return session.apply(arr.range(), SmtFunction.SELECT, this, idx);
    }

    @Override
    public Ast project(EncodingSession session, int index) {
        throw new EncodingContractException(EncodingErrorCode.PROJECT_ON_NON_TUPLE, "project",
                "cannot project field " + index + " from " + sort, name);
    }

    private Sort.ArraySort requireArray(EncodingErrorCode code, String operation) {
        if (sort instanceof Sort.ArraySort arr) return arr;
        throw new EncodingContractException(code, operation, "operand of sort " + sort + " is not an array", name);
    }

    /**
     * @param ast An operand expected to be scalar.
     * @param operation The operation, for the error message.
     * @return The operand as a scalar.
     */
    static ScalarAst requireScalar(Ast ast, String operation) {
        if (ast instanceof ScalarAst s) return s;
        throw new EncodingContractException(EncodingErrorCode.VARIANT_MISMATCH, operation,
                "expected a scalar operand, got " + ast.sort(), ast.name());
    }

    /**
     * @param ast An operand expected to be a boolean.
     * @param operation The operation, for the error message.
     * @return The operand as a boolean scalar.
     */
    public static ScalarAst requireBool(Ast ast, String operation) {
        if (ast instanceof ScalarAst s && s.sort() instanceof Sort.BoolSort) return s;
        throw new EncodingContractException(EncodingErrorCode.NON_BOOLEAN_ASSERTION, operation,
                "expected a boolean, got " + ast.sort(), ast.name());
    }

    @Override
    public String toString() {
        return name + ":" + sort;
    }
}
