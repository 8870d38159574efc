package org.smtflat.encoder.convert;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.pointer.PointerObject;
import org.smtflat.encoder.solver.SmtFunction;
import org.smtflat.encoder.sort.Sort;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable context passed to converters. Resolves converters for operands and
 * caches the Ast of every program symbol, so that all references to one
 * variable share one value and one set of lazily created field symbols.
 * Union literals are cached too: converting one asserts its member
 * constraints, which must happen once per literal.
 */
public final class ConversionContext {

    private final EncodingSession session;
    private final ExprConverterRegistry registry;
    private final Map<IrExpr.Symbol, Ast> symbols = new HashMap<>();
    private final Map<IrExpr.UnionConstant, TupleAst> unions = new HashMap<>();

    /**
     * @param session The encoding session.
     * @param registry The registry for resolving node converters.
     */
    public ConversionContext(EncodingSession session, ExprConverterRegistry registry) {
        this.session = session;
        this.registry = registry;
    }

    /**
     * Converts the given node by resolving and invoking the appropriate converter.
     * @param node The node to convert.
     * @return The resulting Ast.
     */
    public Ast convert(IrExpr node) {
        return registry.resolve(node).convert(node, this);
    }

    /**
     * Converts a node expected to yield a scalar.
     */
    public ScalarAst convertScalar(IrExpr node) {
        Ast ast = convert(node);
        if (ast instanceof ScalarAst s) return s;
        throw new EncodingContractException(EncodingErrorCode.VARIANT_MISMATCH, "convert",
                "expected a scalar for " + node.getClass().getSimpleName() + ", got " + ast.sort(), ast.name());
    }

    public EncodingSession session() {
        return session;
    }

    /**
     * @return The cached Ast of a symbol, if the symbol was converted before.
     */
    public Ast cachedSymbol(IrExpr.Symbol symbol) {
        return symbols.get(symbol);
    }

    public void cacheSymbol(IrExpr.Symbol symbol, Ast ast) {
        symbols.put(symbol, ast);
    }

    /**
     * @return The tuple built for an equal union literal before, if any.
     */
    public TupleAst cachedUnion(IrExpr.UnionConstant literal) {
        return unions.get(literal);
    }

    public void cacheUnion(IrExpr.UnionConstant literal, TupleAst union) {
        unions.put(literal, union);
    }

    /**
     * Builds the pointer tuple {@code {object.id, offset}}.
     * @param type The pointer type of the result.
     * @param object The object pointed to.
     * @param offset The offset into the object.
     * @return A materialized pointer tuple.
     */
    public TupleAst pointerConstant(IrType type, PointerObject object, long offset) {
        int width = session.pointers().width();
        Sort.TupleSort sort = session.sorts().tuple(type);
        return new TupleAst(sort, session.freshName("pointer::"), List.of(
                session.bvConstant(BigInteger.valueOf(object.id()), width, false),
                session.bvConstant(BigInteger.valueOf(offset), width, false)));
    }

    /**
     * Computes the flattened index of an access into an array of arrays:
     * each level's index is fitted to that level's width, outermost level in
     * the most significant bits.
     * @param type The outermost array type.
     * @param indices One index per nesting level, outermost first.
     * @return An index of the array's full domain width.
     */
    public ScalarAst flatIndex(IrType.ArrayType type, List<IrExpr> indices) {
        ScalarAst combined = null;
        IrType level = type;
        for (IrExpr index : indices) {
            if (!(level instanceof IrType.ArrayType arr)) {
                throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "index",
                        indices.size() + " indices into " + type);
            }
            ScalarAst part = session.fitIndex(convertScalar(index), session.sorts().levelWidth(arr));
            if (combined == null) {
                combined = part;
            } else {
                Sort.BitVectorSort a = (Sort.BitVectorSort) combined.sort();
                Sort.BitVectorSort b = (Sort.BitVectorSort) part.sort();
                combined = session.apply(session.sorts().bitVector(a.width() + b.width(), false),
                        SmtFunction.CONCAT, combined, part);
            }
            level = arr.elementType();
        }
        return combined;
    }
}
