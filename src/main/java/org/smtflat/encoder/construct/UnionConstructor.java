package org.smtflat.encoder.construct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;

import java.util.List;

/**
 * Builds union values. A union is a tuple with one field per member and no
 * discriminator: every member whose type equals the initializer's type is
 * constrained equal to the initializer, all other members stay unconstrained.
 */
public final class UnionConstructor {

    private static final Logger LOG = LoggerFactory.getLogger(UnionConstructor.class);

    private UnionConstructor() {}

    /**
     * @param literal A union literal with exactly one initializer.
     * @param ctx The conversion context.
     * @return A materialized tuple of the union's sort.
     * @throws EncodingContractException if there is not exactly one initializer,
     *         or no member has the initializer's type.
     */
    public static TupleAst create(IrExpr.UnionConstant literal, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        List<IrExpr> inits = literal.initializers();
        if (inits.size() != 1) {
            throw new EncodingContractException(EncodingErrorCode.UNION_INITIALIZER_COUNT, "union_create",
                    "expected exactly one initializer for " + literal.type().name() + ", got " + inits.size());
        }
        IrExpr init = inits.get(0);
        Ast initAst = ctx.convert(init);

        TupleAst union = new TupleAst(TupleConstructor.tupleSort(session, literal.type()),
                session.freshName("union_create::"));
        union.materialize(session);

        List<IrType.Member> members = literal.type().members();
        int matched = 0;
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).type().equals(init.type())) {
                session.assertAst(union.project(session, i).eq(session, initAst));
                matched++;
            }
        }
        if (matched == 0) {
            throw new EncodingContractException(EncodingErrorCode.UNION_INITIALIZER_TYPE, "union_create",
                    "no member of " + literal.type().name() + " has type " + init.type(),
                    union.name(), initAst.name());
        }
        LOG.debug("Created {} constraining {} of {} members", union.name(), matched, members.size());
        return union;
    }
}
