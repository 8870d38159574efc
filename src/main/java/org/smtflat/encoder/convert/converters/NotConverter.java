package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.solver.SmtFunction;

public final class NotConverter implements IExprConverter<IrExpr.Not> {

    @Override
    public Ast convert(IrExpr.Not node, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        ScalarAst operand = ScalarAst.requireBool(ctx.convert(node.operand()), "not");
        return session.apply(session.sorts().bool(), SmtFunction.NOT, operand);
    }
}
