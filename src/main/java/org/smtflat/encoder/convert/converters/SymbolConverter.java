package org.smtflat.encoder.convert.converters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.ast.ArrayAst;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.convert.IExprConverter;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.sort.Sort;

/**
 * Converts program symbols. Composite symbols become unmaterialized tuples,
 * arrays of composites get one free sub-array per field named
 * {@code <symbol>[].<field>}, everything else becomes a solver symbol.
 * <p>
 * Pointer symbols named {@code NULL} or {@code 0} denote the null pointer and
 * {@code INVALID} denotes the invalid-pointer object.
 */
public final class SymbolConverter implements IExprConverter<IrExpr.Symbol> {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolConverter.class);

    /**
     * {@inheritDoc}
     * <p>
     * Results are cached per session.
     */
    @Override
    public Ast convert(IrExpr.Symbol node, ConversionContext ctx) {
        Ast cached = ctx.cachedSymbol(node);
        if (cached != null) return cached;

        Ast created = create(node, ctx);
        ctx.cacheSymbol(node, created);
        return created;
    }

    private Ast create(IrExpr.Symbol node, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        if (node.type() instanceof IrType.PointerType) {
            switch (node.name()) {
                case IrExpr.NULL_NAME:
                case IrExpr.ZERO_NAME:
                    return ctx.pointerConstant(node.type(), session.pointerTable().nullObject(), 0);
                case IrExpr.INVALID_NAME:
                    return ctx.pointerConstant(node.type(), session.pointerTable().invalidObject(), 0);
                default:
                    break;
            }
        }

        Sort sort = session.sorts().convert(node.type());
        if (sort instanceof Sort.TupleSort ts) {
            return new TupleAst(ts, node.name());
        }
        if (sort instanceof Sort.ArraySort as && as.isTupleArray()) {
            LOG.debug("Creating array of tuples for symbol {}", node.name());
            return ArrayAst.fresh(session, as, node.name() + "[]");
        }
        return session.symbol(node.name(), sort);
    }
}
