package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts member access into a field projection.
 */
public final class MemberOfConverter implements IExprConverter<IrExpr.MemberOf> {

    @Override
    public Ast convert(IrExpr.MemberOf node, ConversionContext ctx) {
        return ctx.convert(node.source()).project(ctx.session(), node.index());
    }
}
