package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.solver.SmtFunction;

/**
 * Converts binary boolean connectives.
 */
public final class BoolOpConverter implements IExprConverter<IrExpr.BoolOp> {

    @Override
    public Ast convert(IrExpr.BoolOp node, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        ScalarAst lhs = ScalarAst.requireBool(ctx.convert(node.lhs()), node.kind().name());
        ScalarAst rhs = ScalarAst.requireBool(ctx.convert(node.rhs()), node.kind().name());
        return session.apply(session.sorts().bool(), function(node.kind()), lhs, rhs);
    }

    private static SmtFunction function(IrExpr.BoolOpKind kind) {
        return switch (kind) {
            case AND -> SmtFunction.AND;
            case OR -> SmtFunction.OR;
            case XOR -> SmtFunction.XOR;
            case IMPLIES -> SmtFunction.IMPLIES;
        };
    }
}
