package org.smtflat.encoder.solver;

/**
 * A fault inside the solver backend itself, e.g. a native error or a model
 * query without a satisfiable answer.
 */
public class SolverException extends RuntimeException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
