package org.smtflat.encoder.solver;

/**
 * Answer of a satisfiability check. {@link #UNKNOWN} means the verification is
 * inconclusive and must not be read as either of the other answers.
 */
public enum SolverStatus {
    SATISFIABLE,
    UNSATISFIABLE,
    UNKNOWN
}
