package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.solver.SmtFunction;

/**
 * Converts signed and unsigned bit-vector comparisons.
 */
public final class BvCompareConverter implements IExprConverter<IrExpr.BvCompare> {

    @Override
    public Ast convert(IrExpr.BvCompare node, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        return session.apply(session.sorts().bool(), function(node.kind()),
                ctx.convertScalar(node.lhs()), ctx.convertScalar(node.rhs()));
    }

    private static SmtFunction function(IrExpr.BvCompareKind kind) {
        return switch (kind) {
            case ULT -> SmtFunction.BVULT;
            case ULE -> SmtFunction.BVULTE;
            case UGT -> SmtFunction.BVUGT;
            case UGE -> SmtFunction.BVUGTE;
            case SLT -> SmtFunction.BVSLT;
            case SLE -> SmtFunction.BVSLTE;
            case SGT -> SmtFunction.BVSGT;
            case SGE -> SmtFunction.BVSGTE;
        };
    }
}
