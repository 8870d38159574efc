package org.smtflat.encoder.ast;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.sort.Sort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A structure, union or pointer value held as one Ast per field.
 * <p>
 * A tuple starts out unmaterialized: no field symbols exist yet. The first
 * operation that needs fields creates a fresh symbol per field, named
 * {@code <tuple name>.<field name>}. An unmaterialized tuple may instead be
 * bound to another tuple's fields once with {@link #assign}; no equality
 * constraint is emitted for that.
 */
public final class TupleAst implements Ast {

    private final Sort.TupleSort sort;
    private final String name;
    private List<Ast> elements;

    /**
     * Creates an unmaterialized tuple.
     */
    public TupleAst(Sort.TupleSort sort, String name) {
        this.sort = sort;
        this.name = name;
        this.elements = null;
    }

    /**
     * Creates a tuple from already existing field values.
     * @param elements One Ast per member, in declaration order.
     */
    public TupleAst(Sort.TupleSort sort, String name, List<Ast> elements) {
        this.sort = sort;
        this.name = name;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public Sort.TupleSort sort() {
        return sort;
    }

    @Override
    public String name() {
        return name;
    }

    public boolean isMaterialized() {
        return elements != null;
    }

    /**
     * @return The field values; empty if not yet materialized.
     */
    public List<Ast> elements() {
        return elements == null ? List.of() : elements;
    }

    /**
     * Creates a fresh free value for each field unless this tuple already has fields.
     */
    public void materialize(EncodingSession session) {
        if (elements != null) return;
        List<IrType.Member> members = session.sorts().members(sort);
        List<Ast> fresh = new ArrayList<>(members.size());
        for (IrType.Member m : members) {
            Sort memberSort = session.sorts().convert(m.type());
            fresh.add(session.fresh(memberSort, name + "." + m.name()));
        }
        elements = Collections.unmodifiableList(fresh);
    }

    /**
     * Binds this unmaterialized tuple to the fields of {@code source}. Both
     * tuples then share the same field values.
     * @throws EncodingContractException if this tuple is already materialized.
     */
    public void assign(EncodingSession session, Ast source) {
        TupleAst src = requireTuple(source, "assign");
        if (elements != null) {
            throw new EncodingContractException(EncodingErrorCode.ASSIGN_TO_MATERIALIZED_TUPLE, "assign",
                    "destination already has fields", name, src.name);
        }
        src.materialize(session);
        elements = src.elements;
    }

    @Override
    public ScalarAst eq(EncodingSession session, Ast other) {
        TupleAst o = requireTuple(other, "eq");
        materialize(session);
        o.materialize(session);
        List<ScalarAst> conjuncts = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            conjuncts.add(elements.get(i).eq(session, o.elements.get(i)));
        }
        return session.conjunct(conjuncts);
    }

    @Override
    public TupleAst ite(EncodingSession session, Ast cond, Ast falseValue) {
        TupleAst f = requireTuple(falseValue, "ite");
        materialize(session);
        f.materialize(session);
        List<Ast> result = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            result.add(elements.get(i).ite(session, cond, f.elements.get(i)));
        }
        return new TupleAst(sort, session.freshName("tuple_ite::"), result);
    }

    @Override
    public TupleAst update(EncodingSession session, Ast value, long index) {
        materialize(session);
        checkFieldIndex(index, "update");
        List<Ast> result = new ArrayList<>(elements);
        result.set((int) index, value);
        return new TupleAst(sort, session.freshName("tuple_update::"), result);
    }

    @Override
    public Ast update(EncodingSession session, Ast value, Ast index) {
        throw new EncodingContractException(EncodingErrorCode.NON_CONSTANT_FIELD_INDEX, "update",
                "tuple fields must be addressed by a constant index", name, index.name());
    }

    @Override
    public Ast select(EncodingSession session, Ast index) {
        throw new EncodingContractException(EncodingErrorCode.SELECT_ON_NON_ARRAY, "select",
                "cannot select from tuple " + sort, name);
    }

    @Override
    public Ast project(EncodingSession session, int index) {
        materialize(session);
        checkFieldIndex(index, "project");
        return elements.get(index);
    }

    private void checkFieldIndex(long index, String operation) {
        if (index < 0 || index >= elements.size()) {
            throw new EncodingContractException(EncodingErrorCode.FIELD_INDEX_OUT_OF_BOUNDS, operation,
                    "field " + index + " of " + elements.size(), name);
        }
    }

    static TupleAst requireTuple(Ast ast, String operation) {
        if (ast instanceof TupleAst t) return t;
        throw new EncodingContractException(EncodingErrorCode.VARIANT_MISMATCH, operation,
                "expected a tuple operand, got " + ast.sort(), ast.name());
    }

    @Override
    public String toString() {
        return name + ":" + sort + (elements == null ? " (free)" : "");
    }
}
