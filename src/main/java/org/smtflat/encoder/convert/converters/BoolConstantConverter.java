package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts boolean literals.
 */
public final class BoolConstantConverter implements IExprConverter<IrExpr.BoolConstant> {

    @Override
    public Ast convert(IrExpr.BoolConstant node, ConversionContext ctx) {
        return ctx.session().boolConstant(node.value());
    }
}
