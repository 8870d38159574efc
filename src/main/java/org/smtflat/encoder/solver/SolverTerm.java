package org.smtflat.encoder.solver;

import org.smtflat.encoder.sort.Sort;

/**
 * Opaque handle to an expression owned by a {@link SolverBackend}. Terms are
 * only meaningful to the backend that created them.
 */
public interface SolverTerm {

    /**
     * @return The sort the term was created with.
     */
    Sort sort();
}
