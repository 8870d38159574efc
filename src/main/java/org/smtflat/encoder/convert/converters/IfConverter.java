package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts conditional values of any sort.
 */
public final class IfConverter implements IExprConverter<IrExpr.If> {

    @Override
    public Ast convert(IrExpr.If node, ConversionContext ctx) {
        Ast cond = ctx.convert(node.cond());
        Ast trueValue = ctx.convert(node.trueValue());
        Ast falseValue = ctx.convert(node.falseValue());
        return trueValue.ite(ctx.session(), cond, falseValue);
    }
}
