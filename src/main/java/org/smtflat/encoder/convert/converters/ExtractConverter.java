package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts bit-vector extraction into an unsigned bit-vector of {@code high - low + 1} bits.
 */
public final class ExtractConverter implements IExprConverter<IrExpr.Extract> {

    @Override
    public Ast convert(IrExpr.Extract node, ConversionContext ctx) {
        return ctx.session().extract(ctx.convertScalar(node.source()), node.high(), node.low());
    }
}
