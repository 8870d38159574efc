package org.smtflat.encoder.ast;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.sort.Sort;

/**
 * A solver-side value. The variant is fixed by the sort: tuple sorts are
 * {@link TupleAst}s, arrays of tuples are {@link ArrayAst}s, everything else
 * is a {@link ScalarAst} that wraps one solver term.
 * <p>
 * Operations never mutate their operands, except for the explicit one-shot
 * {@code assign} on tuples and tuple arrays. Every operation receives the
 * session it runs in.
 */
public sealed interface Ast permits ScalarAst, TupleAst, ArrayAst {

    Sort sort();

    /**
     * @return The unique name of this value within its session.
     */
    String name();

    /**
     * Builds the boolean equality of this value and {@code other}. For
     * composites this is the conjunction of the per-field equalities.
     */
    ScalarAst eq(EncodingSession session, Ast other);

    /**
     * Builds {@code cond ? this : falseValue}.
     * @param cond A boolean Ast.
     * @param falseValue A value of the same sort.
     */
    Ast ite(EncodingSession session, Ast cond, Ast falseValue);

    /**
     * Non-destructively replaces the element at a constant index: a field for
     * tuples, an array element for arrays.
     */
    Ast update(EncodingSession session, Ast value, long index);

    /**
     * Non-destructively replaces the element at a symbolic index. Only arrays
     * accept a symbolic index.
     */
    Ast update(EncodingSession session, Ast value, Ast index);

    /**
     * Reads the element at {@code index} of an array.
     */
    Ast select(EncodingSession session, Ast index);

    /**
     * Reads field {@code index} of a tuple, or the sub-array holding that
     * field of an array of tuples.
     */
    Ast project(EncodingSession session, int index);

    default Ast select(EncodingSession session, long index) {
        int width = sort() instanceof Sort.ArraySort arr ? arr.domainWidth() : 1;
        return select(session, session.indexConstant(index, width));
    }
}
