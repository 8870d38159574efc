package org.smtflat.encoder.solver;

import org.smtflat.encoder.sort.Sort;

import java.math.BigInteger;
import java.util.List;

/**
 * What the encoder needs from a concrete solver. Implementations lower the
 * encoder's scalar {@link Sort}s (bool, bit-vector, scalar-ranged array) to
 * their own sorts; tuple sorts never reach a backend.
 */
public interface SolverBackend extends AutoCloseable {

    /**
     * @return A human-readable name and version of the solver.
     */
    String solverText();

    /**
     * Creates (or looks up) a named free symbol.
     * @param name The symbol name.
     * @param sort A scalar sort.
     * @return The symbol term.
     */
    SolverTerm mkSymbol(String name, Sort sort);

    /**
     * Applies an operator.
     * @param sort The sort of the result.
     * @param function The operator.
     * @param args The arguments; their count must match the operator's arity.
     * @return The application term.
     */
    SolverTerm mkFuncApp(Sort sort, SmtFunction function, List<SolverTerm> args);

    /**
     * Extracts bits {@code [high:low]} of a bit-vector.
     */
    SolverTerm mkExtract(SolverTerm term, int high, int low, Sort sort);

    /**
     * @param value The value; reduced modulo 2^width.
     * @param width The bit width.
     * @return A bit-vector literal.
     */
    SolverTerm mkBvInt(BigInteger value, boolean signed, int width);

    SolverTerm mkBool(boolean value);

    /**
     * Adds a formula to the assertion set.
     * @param formula A boolean term.
     */
    void assertFormula(SolverTerm formula);

    /**
     * Checks the current assertion set. Blocks until the solver answers.
     * @return The answer.
     */
    SolverStatus check();

    /**
     * Model value of a boolean term after a satisfiable answer.
     */
    boolean getBool(SolverTerm term);

    /**
     * Model value of a bit-vector term after a satisfiable answer, unsigned.
     */
    BigInteger getBv(SolverTerm term);

    @Override
    void close();
}
