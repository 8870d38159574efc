package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.construct.TupleConstructor;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts structure literals into materialized tuples.
 */
public final class StructConstantConverter implements IExprConverter<IrExpr.StructConstant> {

    @Override
    public Ast convert(IrExpr.StructConstant node, ConversionContext ctx) {
        return TupleConstructor.create(node, ctx);
    }
}
