package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.solver.SmtFunction;

/**
 * Converts inequality as the negation of structural equality.
 */
public final class NotEqualConverter implements IExprConverter<IrExpr.NotEqual> {

    @Override
    public Ast convert(IrExpr.NotEqual node, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        ScalarAst eq = ctx.convert(node.lhs()).eq(session, ctx.convert(node.rhs()));
        return session.apply(session.sorts().bool(), SmtFunction.NOT, eq);
    }
}
