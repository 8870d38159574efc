package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.construct.ArrayConstructor;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts array broadcasts.
 */
public final class ArrayOfConverter implements IExprConverter<IrExpr.ArrayOf> {

    @Override
    public Ast convert(IrExpr.ArrayOf node, ConversionContext ctx) {
        return ArrayConstructor.arrayOf(node, ctx);
    }
}
