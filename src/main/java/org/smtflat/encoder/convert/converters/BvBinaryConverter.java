package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.solver.SmtFunction;

/**
 * Converts bit-vector arithmetic, bitwise and shift operations. Both operands
 * have the result's width.
 */
public final class BvBinaryConverter implements IExprConverter<IrExpr.BvBinary> {

    @Override
    public Ast convert(IrExpr.BvBinary node, ConversionContext ctx) {
        ScalarAst lhs = ctx.convertScalar(node.lhs());
        ScalarAst rhs = ctx.convertScalar(node.rhs());
        return ctx.session().apply(lhs.sort(), function(node.kind()), lhs, rhs);
    }

    private static SmtFunction function(IrExpr.BvOpKind kind) {
        return switch (kind) {
            case ADD -> SmtFunction.BVADD;
            case SUB -> SmtFunction.BVSUB;
            case MUL -> SmtFunction.BVMUL;
            case SHL -> SmtFunction.BVSHL;
            case LSHR -> SmtFunction.BVLSHR;
            case ASHR -> SmtFunction.BVASHR;
            case AND -> SmtFunction.BVAND;
            case OR -> SmtFunction.BVOR;
            case XOR -> SmtFunction.BVXOR;
        };
    }
}
