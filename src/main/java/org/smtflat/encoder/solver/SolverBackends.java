package org.smtflat.encoder.solver;

import org.smtflat.encoder.config.SolverOptions;
import org.smtflat.encoder.solver.z3.Z3Backend;

import java.util.Locale;

/**
 * Creates solver backends by configured name.
 */
public final class SolverBackends {

    private SolverBackends() {}

    /**
     * @param options The solver options.
     * @return A new backend; the caller owns and closes it.
     * @throws IllegalArgumentException if the backend name is unknown.
     */
    public static SolverBackend create(SolverOptions options) {
        return switch (options.backend().toLowerCase(Locale.ROOT)) {
            case "z3" -> new Z3Backend(options);
            default -> throw new IllegalArgumentException("Unknown solver backend: " + options.backend());
        };
    }
}
