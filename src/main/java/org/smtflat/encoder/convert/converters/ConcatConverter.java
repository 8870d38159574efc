package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.solver.SmtFunction;

/**
 * Converts bit-vector concatenation; the high operand takes the most significant bits.
 */
public final class ConcatConverter implements IExprConverter<IrExpr.Concat> {

    @Override
    public Ast convert(IrExpr.Concat node, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        ScalarAst high = ctx.convertScalar(node.high());
        ScalarAst low = ctx.convertScalar(node.low());
        int width = ((IrType.BitVectorType) node.type()).width();
        return session.apply(session.sorts().bitVector(width, false), SmtFunction.CONCAT, high, low);
    }
}
