package org.smtflat.encoder.solver.z3;

import com.microsoft.z3.Expr;
import org.smtflat.encoder.solver.SolverTerm;
import org.smtflat.encoder.sort.Sort;

/**
 * A Z3 expression together with the encoder sort it was built for.
 * @param expr The Z3 expression.
 * @param sort The encoder sort.
 */
record Z3Term(Expr<?> expr, Sort sort) implements SolverTerm {
    @Override
    public String toString() {
        return expr.toString();
    }
}
