package org.smtflat.encoder.convert;

import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Fallback for node types without a registered converter: refuses them.
 */
public final class DefaultExprConverter implements IExprConverter<IrExpr> {

    @Override
    public Ast convert(IrExpr node, ConversionContext ctx) {
        throw new UnsupportedEncodingException(EncodingErrorCode.UNSUPPORTED_EXPRESSION,
                node.getClass().getSimpleName());
    }
}
