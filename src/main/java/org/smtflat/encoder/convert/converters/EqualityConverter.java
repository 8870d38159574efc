package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts structural equality; composites compare field by field.
 */
public final class EqualityConverter implements IExprConverter<IrExpr.Equality> {

    @Override
    public Ast convert(IrExpr.Equality node, ConversionContext ctx) {
        return ctx.convert(node.lhs()).eq(ctx.session(), ctx.convert(node.rhs()));
    }
}
