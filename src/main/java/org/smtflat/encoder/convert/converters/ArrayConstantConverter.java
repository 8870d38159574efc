package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.construct.ArrayConstructor;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts array literals.
 */
public final class ArrayConstantConverter implements IExprConverter<IrExpr.ArrayConstant> {

    @Override
    public Ast convert(IrExpr.ArrayConstant node, ConversionContext ctx) {
        return ArrayConstructor.create(node, ctx);
    }
}
