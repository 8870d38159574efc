package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.pointer.PointerObject;

/**
 * Converts the address of a named object into {@code {id, 0}}, registering
 * the object in the pointer table on first use.
 */
public final class AddressOfConverter implements IExprConverter<IrExpr.AddressOf> {

    @Override
    public Ast convert(IrExpr.AddressOf node, ConversionContext ctx) {
        PointerObject object = ctx.session().pointerTable().register(node.objectName());
        return ctx.pointerConstant(node.type(), object, 0);
    }
}
