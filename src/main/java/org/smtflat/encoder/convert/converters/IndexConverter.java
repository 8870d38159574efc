package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Converts array selection. Over arrays of arrays, a chain
 * {@code a[i][j]} selects once from the flattened array with the
 * concatenated index {@code i ++ j}.
 */
public final class IndexConverter implements IExprConverter<IrExpr.Index> {

    @Override
    public Ast convert(IrExpr.Index node, ConversionContext ctx) {
        if (node.type() instanceof IrType.ArrayType) {
            throw new UnsupportedEncodingException(EncodingErrorCode.NESTED_ARRAY_SHAPE,
                    "selection of a whole inner array");
        }
        Deque<IrExpr> indices = new ArrayDeque<>();
        indices.push(node.index());
        IrExpr base = node.source();
        while (base instanceof IrExpr.Index inner && inner.type() instanceof IrType.ArrayType) {
            indices.push(inner.index());
            base = inner.source();
        }
        if (!(base.type() instanceof IrType.ArrayType arrayType)) {
            throw new EncodingContractException(EncodingErrorCode.SELECT_ON_NON_ARRAY, "index",
                    "cannot index into " + base.type());
        }
        Ast array = ctx.convert(base);
        ScalarAst index = ctx.flatIndex(arrayType, new ArrayList<>(indices));
        return array.select(ctx.session(), index);
    }
}
