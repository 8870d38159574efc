package org.smtflat.encoder.convert;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts one IR node family into an {@link Ast}.
 * <p>
 * Implementations are stateless. Operands are converted through
 * {@link ConversionContext#convert(IrExpr)}.
 *
 * @param <T> The concrete IR node type handled by this converter.
 */
public interface IExprConverter<T extends IrExpr> {

    /**
     * Converts the given node.
     *
     * @param node The IR node to convert.
     * @param ctx  The conversion context.
     * @return The resulting Ast.
     */
    Ast convert(T node, ConversionContext ctx);
}
