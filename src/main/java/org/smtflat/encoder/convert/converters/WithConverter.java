package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;

import java.util.List;

/**
 * Converts functional updates. Composites are updated at a constant member
 * index, arrays at any index. On an array of arrays only the shape
 * {@code a with [i] := (a[i] with [j] := v)} is accepted; it stores {@code v}
 * at the flattened index {@code i ++ j}.
 */
public final class WithConverter implements IExprConverter<IrExpr.With> {

    @Override
    public Ast convert(IrExpr.With node, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        IrType type = node.source().type();

        if (!(type instanceof IrType.ArrayType arrayType)) {
            if (!(node.index() instanceof IrExpr.IntConstant constant)) {
                throw new EncodingContractException(EncodingErrorCode.NON_CONSTANT_FIELD_INDEX, "update",
                        "member update of " + type + " with a symbolic index");
            }
            Ast source = ctx.convert(node.source());
            return source.update(session, ctx.convert(node.value()), constant.value().longValueExact());
        }

        if (arrayType.elementType() instanceof IrType.ArrayType) {
            return nestedUpdate(node, arrayType, ctx);
        }
        Ast source = ctx.convert(node.source());
        return source.update(session, ctx.convert(node.value()), ctx.convertScalar(node.index()));
    }

    private Ast nestedUpdate(IrExpr.With node, IrType.ArrayType arrayType, ConversionContext ctx) {
        if (!(node.value() instanceof IrExpr.With inner)
                || !(inner.source() instanceof IrExpr.Index innerSource)
                || !innerSource.source().equals(node.source())
                || !innerSource.index().equals(node.index())
                || inner.source().type() instanceof IrType.ArrayType innerType
                        && innerType.elementType() instanceof IrType.ArrayType) {
            throw new UnsupportedEncodingException(EncodingErrorCode.NESTED_ARRAY_SHAPE,
                    "update of an array of arrays other than a[i][j] := v");
        }
        Ast source = ctx.convert(node.source());
        ScalarAst index = ctx.flatIndex(arrayType, List.of(node.index(), inner.index()));
        return source.update(ctx.session(), ctx.convert(inner.value()), index);
    }
}
