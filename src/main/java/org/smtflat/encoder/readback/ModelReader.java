package org.smtflat.encoder.readback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.ast.ArrayAst;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.ScalarAst;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.ir.IrValue;
import org.smtflat.encoder.pointer.PointerObject;
import org.smtflat.encoder.sort.Sort;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reconstructs program values from the model of the last satisfiable check.
 * <p>
 * Tuples are read field by field in declaration order; a tuple that was never
 * materialized reads as {@link IrValue.NoValue} in every field. Pointer tuples
 * are translated into {@link IrValue.Pointer}s through the session's pointer
 * table. Arrays of tuples cannot be read back.
 */
public final class ModelReader {

    private static final Logger LOG = LoggerFactory.getLogger(ModelReader.class);

    private final EncodingSession session;

    public ModelReader(EncodingSession session) {
        this.session = session;
    }

    public boolean getBool(ScalarAst ast) {
        return session.backend().getBool(ast.term());
    }

    public BigInteger getBv(ScalarAst ast) {
        return session.backend().getBv(ast.term());
    }

    /**
     * Reads back any value.
     * @param ast The value.
     * @return The model value.
     * @throws UnsupportedEncodingException for arrays of tuples.
     */
    public IrValue readback(Ast ast) {
        if (ast instanceof TupleAst tuple) return tupleReadback(tuple);
        if (ast instanceof ArrayAst array) {
            throw new UnsupportedEncodingException(EncodingErrorCode.TUPLE_ARRAY_READBACK,
                    "readback of array of tuples " + array.name());
        }
        return scalarReadback((ScalarAst) ast);
    }

    /**
     * Reads a tuple back recursively.
     * @param tuple The tuple.
     * @return An {@link IrValue.Struct}, or an {@link IrValue.Pointer} for pointer tuples.
     * @throws UnsupportedEncodingException if a pointer's object identifier exceeds the signed 64-bit range.
     */
    public IrValue tupleReadback(TupleAst tuple) {
        IrType type = tuple.sort().structuralType();
        List<IrType.Member> members = session.sorts().members(type);
        if (!tuple.isMaterialized()) {
            LOG.debug("Tuple {} was never materialized, reading no values", tuple.name());
            return new IrValue.Struct(type, Collections.nCopies(members.size(), IrValue.NO_VALUE));
        }

        List<IrValue> values = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            Ast field = tuple.elements().get(i);
            if (field instanceof ArrayAst) {
                throw new UnsupportedEncodingException(EncodingErrorCode.TUPLE_ARRAY_READBACK,
                        "readback of array-of-tuples field '" + members.get(i).name() + "' in " + tuple.name());
            }
            values.add(readback(field));
        }

        if (session.pointers().isPointer(type)) {
            return pointer(tuple, values);
        }
        return new IrValue.Struct(type, values);
    }

    private IrValue pointer(TupleAst tuple, List<IrValue> values) {
        if (!(values.get(0) instanceof IrValue.BitVector object)
                || !(values.get(1) instanceof IrValue.BitVector offset)) {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "readback",
                    "pointer fields are not bit-vectors: " + values, tuple.name());
        }
        if (object.value().bitLength() > 63) {
            throw new UnsupportedEncodingException(EncodingErrorCode.POINTER_ID_OUT_OF_RANGE,
                    "object_id " + object.value() + " of " + tuple.name() + " does not fit a pointer table identifier");
        }
        PointerObject target = session.pointerTable().resolve(object.value().longValueExact());
        return new IrValue.Pointer(target, offset.value());
    }

    private IrValue scalarReadback(ScalarAst ast) {
        Sort sort = ast.sort();
        if (sort instanceof Sort.BoolSort) {
            return new IrValue.Bool(getBool(ast));
        }
        if (sort instanceof Sort.BitVectorSort bv) {
            return new IrValue.BitVector(getBv(ast), bv.width(), bv.signed());
        }
        return arrayReadback(ast);
    }

    /**
     * Reads the leading elements of a scalar-ranged array: {@code 2^w} of them,
     * where {@code w} is the domain width capped at {@code readback.max-domain-width}.
     * @param array An array-sorted scalar.
     * @return The elements, index 0 first.
     */
    public IrValue.Array arrayReadback(ScalarAst array) {
        Sort.ArraySort sort = (Sort.ArraySort) array.sort();
        int width = Math.min(sort.domainWidth(), session.options().readbackMaxDomainWidth());
        long count = 1L << width;
        List<IrValue> elements = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            ScalarAst element = array.select(session, session.indexConstant(i, sort.domainWidth()));
            elements.add(scalarReadback(element));
        }
        return new IrValue.Array(elements);
    }
}
