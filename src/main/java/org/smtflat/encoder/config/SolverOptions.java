package org.smtflat.encoder.config;

import com.typesafe.config.Config;

/**
 * Backend selection and solver settings, read from the {@code smtflat.solver} block.
 *
 * @param backend Backend name, e.g. {@code z3}.
 * @param logic SMT-LIB logic passed to the solver.
 * @param timeoutMillis Per-check timeout; 0 disables it.
 */
public record SolverOptions(String backend, String logic, long timeoutMillis) {

    private static final String PATH = "smtflat.solver";

    /**
     * @param config A resolved configuration containing {@code smtflat.solver}.
     * @return The options.
     */
    public static SolverOptions fromConfig(Config config) {
        Config c = config.getConfig(PATH);
        return new SolverOptions(
                c.getString("backend"),
                c.getString("logic"),
                c.getDuration("timeout").toMillis());
    }

    /**
     * @return The options from {@code reference.conf} alone.
     */
    public static SolverOptions defaults() {
        return fromConfig(com.typesafe.config.ConfigFactory.parseResources("reference.conf").resolve());
    }
}
