package org.smtflat.encoder.convert.converters;

import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.construct.UnionConstructor;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;

/**
 * Converts union literals. Equal literals convert to the same tuple, so that
 * converting an expression again adds no constraints.
 */
public final class UnionConstantConverter implements IExprConverter<IrExpr.UnionConstant> {

    @Override
    public Ast convert(IrExpr.UnionConstant node, ConversionContext ctx) {
        TupleAst cached = ctx.cachedUnion(node);
        if (cached != null) return cached;

        TupleAst created = UnionConstructor.create(node, ctx);
        ctx.cacheUnion(node, created);
        return created;
    }
}
