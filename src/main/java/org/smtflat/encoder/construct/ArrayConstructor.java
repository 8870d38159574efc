package org.smtflat.encoder.construct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.ast.ArrayAst;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.sort.Sort;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds arrays from array literals and from broadcast ({@code array_of})
 * expressions, for scalar elements and composite elements alike.
 */
public final class ArrayConstructor {

    private static final Logger LOG = LoggerFactory.getLogger(ArrayConstructor.class);

    private ArrayConstructor() {}

    /**
     * Converts an array literal into a fresh array updated once per index, in
     * ascending index order. Unbounded arrays yield an unconstrained array.
     * @param literal The array literal.
     * @param ctx The conversion context.
     * @return The array.
     * @throws UnsupportedEncodingException for a non-constant size or array-typed elements.
     */
    public static Ast create(IrExpr.ArrayConstant literal, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        IrType.ArrayType type = literal.type();
        if (type.elementType() instanceof IrType.ArrayType) {
            throw new UnsupportedEncodingException(EncodingErrorCode.NESTED_ARRAY_SHAPE,
                    "array literal with array-typed elements");
        }
        Sort.ArraySort sort = arraySort(session, type);
        String prefix = sort.isTupleArray() ? "tuple_array_create::" : "array_create::";
        Ast result = session.fresh(sort, session.freshName(prefix));
        if (type.infinite()) {
            LOG.debug("Unbounded array literal {} left unconstrained", result.name());
            return result;
        }
        if (!type.hasConstantSize()) {
            throw new UnsupportedEncodingException(EncodingErrorCode.NON_CONSTANT_ARRAY_SIZE,
                    "array literal of non-constant size");
        }
        long size = type.constantSize();
        if (literal.elements().size() != size) {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "array_create",
                    literal.elements().size() + " elements for an array of size " + size, result.name());
        }
        for (int i = 0; i < size; i++) {
            result = result.update(session, ctx.convert(literal.elements().get(i)), i);
        }
        return result;
    }

    /**
     * Converts a broadcast. Nested broadcasts over arrays of arrays collapse
     * into one broadcast of the innermost initializer over the combined domain.
     * @param arrayOf The broadcast expression.
     * @param ctx The conversion context.
     * @return The array.
     */
    public static Ast arrayOf(IrExpr.ArrayOf arrayOf, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        IrExpr init = arrayOf.initializer();
        while (init instanceof IrExpr.ArrayOf inner) {
            init = inner.initializer();
        }
        if (init.type() instanceof IrType.ArrayType) {
            throw new UnsupportedEncodingException(EncodingErrorCode.NESTED_ARRAY_SHAPE,
                    "broadcast of an array value");
        }
        if (init.type() instanceof IrType.PointerType && !isNullPointer(init)) {
            throw new UnsupportedEncodingException(EncodingErrorCode.POINTER_ARRAY_INITIALIZER,
                    "pointer array initialized with " + init);
        }
        return broadcast(session, arraySort(session, arrayOf.type()), ctx.convert(init));
    }

    /**
     * Builds an array holding {@code init} at every index of its domain.
     * Arrays of tuples broadcast each field into its own sub-array.
     * @param session The session.
     * @param sort The array sort.
     * @param init The element value.
     * @return The array.
     * @throws UnsupportedEncodingException if a scalar broadcast would have to
     *         enumerate more indices than configured.
     */
    public static Ast broadcast(EncodingSession session, Sort.ArraySort sort, Ast init) {
        if (sort.isTupleArray()) {
            if (!(init instanceof TupleAst tuple)) {
                throw new EncodingContractException(EncodingErrorCode.VARIANT_MISMATCH, "array_of",
                        "array of tuples initialized with " + init.sort(), init.name());
            }
            List<IrType.Member> members = session.sorts().members((Sort.TupleSort) sort.range());
            List<Ast> subArrays = new ArrayList<>(members.size());
            for (int i = 0; i < members.size(); i++) {
                IrType.Member m = members.get(i);
                if (m.type() instanceof IrType.ArrayType) {
                    throw new UnsupportedEncodingException(EncodingErrorCode.NESTED_TUPLE_ARRAY,
                            "broadcast of array-typed field '" + m.name() + "'");
                }
                subArrays.add(broadcast(session, session.sorts().fieldArraySort(sort.domainWidth(), m.type()),
                        tuple.project(session, i)));
            }
            return new ArrayAst(sort, session.freshName("tuple_array_of::"), subArrays);
        }

        int width = sort.domainWidth();
        if (width > session.options().maxBroadcastWidth()) {
            throw new UnsupportedEncodingException(EncodingErrorCode.BROADCAST_TOO_WIDE,
                    "broadcast over a " + width + "-bit domain");
        }
        Ast result = session.symbol(session.freshName("array_of::"), sort);
        long count = 1L << width;
        for (long i = 0; i < count; i++) {
            result = result.update(session, init, i);
        }
        LOG.debug("Broadcast into {} over {} indices", result.name(), count);
        return result;
    }

    private static boolean isNullPointer(IrExpr init) {
        return init instanceof IrExpr.Symbol sym
                && (IrExpr.NULL_NAME.equals(sym.name()) || IrExpr.ZERO_NAME.equals(sym.name()));
    }

    private static Sort.ArraySort arraySort(EncodingSession session, IrType.ArrayType type) {
        return (Sort.ArraySort) session.sorts().convert(type);
    }
}
