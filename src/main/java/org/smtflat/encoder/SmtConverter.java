package org.smtflat.encoder;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.api.ConversionResult;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.ast.ArrayAst;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.config.ConfigLoader;
import org.smtflat.encoder.config.EncoderOptions;
import org.smtflat.encoder.config.SolverOptions;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.ExprConverterRegistry;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrValue;
import org.smtflat.encoder.readback.ModelReader;
import org.smtflat.encoder.solver.SolverBackend;
import org.smtflat.encoder.solver.SolverBackends;
import org.smtflat.encoder.solver.SolverStatus;

/**
 * Entry point of the encoder: converts typed IR expressions into solver
 * constraints, asserts them, checks satisfiability and reads models back.
 * <p>
 * One converter owns one {@link EncodingSession} and one solver backend.
 * Instances are not thread-safe; use one per thread.
 */
public final class SmtConverter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SmtConverter.class);

    private final EncodingSession session;
    private final ConversionContext context;
    private final ModelReader reader;

    /**
     * @param options The encoder options.
     * @param backend The solver backend; closed together with this converter.
     */
    public SmtConverter(EncoderOptions options, SolverBackend backend) {
        this.session = new EncodingSession(options, backend);
        this.context = new ConversionContext(session, ExprConverterRegistry.initializeWithDefaults());
        this.reader = new ModelReader(session);
        LOG.debug("Encoding session opened on {}", backend.solverText());
    }

    /**
     * Creates a converter from a resolved configuration.
     * @param config A configuration containing the {@code smtflat} block.
     * @return A converter with the configured backend.
     */
    public static SmtConverter create(Config config) {
        return new SmtConverter(EncoderOptions.fromConfig(config),
                SolverBackends.create(SolverOptions.fromConfig(config)));
    }

    /**
     * @return A converter configured through {@link ConfigLoader#load()}.
     */
    public static SmtConverter create() {
        return create(ConfigLoader.load());
    }

    public EncodingSession session() {
        return session;
    }

    /**
     * Converts an expression.
     * @param expr A typed IR expression.
     * @return Its Ast.
     * @throws org.smtflat.encoder.api.EncodingException if the input is refused or malformed.
     */
    public Ast convert(IrExpr expr) {
        return context.convert(expr);
    }

    /**
     * Converts an expression, reporting refused constructs instead of throwing.
     * Contract violations still propagate.
     * @param expr A typed IR expression.
     * @return The Ast, or the refusal.
     */
    public ConversionResult tryConvert(IrExpr expr) {
        try {
            return new ConversionResult.Converted(convert(expr));
        } catch (UnsupportedEncodingException e) {
            LOG.warn("Refused to encode {}: {}", expr.getClass().getSimpleName(), e.getMessage());
            session.diagnostics().reportError(e.code(), expr.getClass().getSimpleName(), e.getMessage());
            return new ConversionResult.Refused(e.code(), e.getMessage());
        }
    }

    /**
     * Records the SSA assignment {@code lhs := rhs}. A destination that is
     * still free is bound to the value directly; otherwise equality is asserted.
     * @param lhs The assigned symbol.
     * @param rhs The assigned value.
     */
    public void assign(IrExpr.Symbol lhs, IrExpr rhs) {
        Ast destination = convert(lhs);
        Ast value = convert(rhs);
        if (destination instanceof TupleAst tuple && !tuple.isMaterialized()) {
            tuple.assign(session, value);
        } else if (destination instanceof ArrayAst array && array.isStillFree()) {
            array.assign(value);
        } else {
            session.assertAst(destination.eq(session, value));
        }
    }

    /**
     * Asserts a boolean Ast.
     */
    public void assertTrue(Ast formula) {
        session.assertAst(formula);
    }

    /**
     * Converts and asserts a boolean expression.
     */
    public void assertTrue(IrExpr formula) {
        assertTrue(convert(formula));
    }

    /**
     * Checks the asserted constraints.
     * @return The solver's answer; {@link SolverStatus#UNKNOWN} is returned as is.
     */
    public SolverStatus check() {
        SolverStatus status = session.backend().check();
        if (status == SolverStatus.UNKNOWN) {
            session.diagnostics().reportWarning(null, "check", "solver returned unknown; result inconclusive");
        }
        LOG.info("Satisfiability check: {}", status);
        return status;
    }

    /**
     * Reads the model value of an expression after a satisfiable check.
     */
    public IrValue readback(IrExpr expr) {
        return readback(convert(expr));
    }

    public IrValue readback(Ast ast) {
        return reader.readback(ast);
    }

    /**
     * @return Reader over the current model, for direct scalar access.
     */
    public ModelReader reader() {
        return reader;
    }

    @Override
    public void close() {
        session.close();
        LOG.debug("Encoding session closed");
    }
}
