package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts integer literals into bit-vector constants of the literal's width.
 */
public final class IntConstantConverter implements IExprConverter<IrExpr.IntConstant> {

    @Override
    public Ast convert(IrExpr.IntConstant node, ConversionContext ctx) {
        return ctx.session().bvConstant(node.value(), node.type().width(), node.type().signed());
    }
}
