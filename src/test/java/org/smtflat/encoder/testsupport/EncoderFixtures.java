package org.smtflat.encoder.testsupport;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.SmtConverter;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.config.EncoderOptions;
import org.smtflat.encoder.config.SolverOptions;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.solver.SmtFunction;
import org.smtflat.encoder.solver.SolverBackend;
import org.smtflat.encoder.solver.SolverStatus;
import org.smtflat.encoder.solver.z3.Z3Backend;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared types and helpers for encoder tests.
 */
public final class EncoderFixtures {

    public static final IrType.BitVectorType U4 = IrType.unsignedBv(4);
    public static final IrType.BitVectorType U8 = IrType.unsignedBv(8);
    public static final IrType.BitVectorType U32 = IrType.unsignedBv(32);

    /** {x: bv4, y: bv4} */
    public static final IrType.StructType POINT = IrType.struct("point",
            IrType.member("x", U4), IrType.member("y", U4));

    /** {tag: bv8, at: point, flag: bool} */
    public static final IrType.StructType SHAPE = IrType.struct("shape",
            IrType.member("tag", U8), IrType.member("at", POINT), IrType.member("flag", IrType.BOOL));

    public static final IrType.PointerType INT_PTR = new IrType.PointerType("int");

    private EncoderFixtures() {}

    public static SmtConverter newConverter() {
        return new SmtConverter(EncoderOptions.defaults(), new Z3Backend(SolverOptions.defaults()));
    }

    public static SmtConverter newConverter(SolverBackend backend) {
        return new SmtConverter(EncoderOptions.defaults(), backend);
    }

    public static ScalarAst bv(EncodingSession session, long value, int width) {
        return session.bvConstant(BigInteger.valueOf(value), width, false);
    }

    public static ScalarAst not(EncodingSession session, Ast formula) {
        return session.apply(session.sorts().bool(), SmtFunction.NOT, ScalarAst.requireBool(formula, "not"));
    }

    /**
     * Asserts that {@code formula} holds in every model of the current
     * assertions by checking that its negation is unsatisfiable. Adds the
     * negation to the converter's assertion set.
     */
    public static void assertValid(SmtConverter converter, Ast formula) {
        converter.assertTrue(not(converter.session(), formula));
        assertThat(converter.check()).isEqualTo(SolverStatus.UNSATISFIABLE);
    }
}
