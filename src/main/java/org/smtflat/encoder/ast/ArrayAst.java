package org.smtflat.encoder.ast;

import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.sort.Sort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An array of tuples, stored as one array per field of the element type
 * (structure of arrays). Field {@code i} of element {@code k} lives at index
 * {@code k} of sub-array {@code i}.
 * <p>
 * A freshly created array is free and may be bound once to another array's
 * sub-arrays with {@link #assign}. It stops being free as soon as any
 * operation reads its sub-arrays; from then on it is constrained by equality.
 */
public final class ArrayAst implements Ast {

    private final Sort.ArraySort sort;
    private final String name;
    private List<Ast> elements;
    private boolean stillFree;

    /**
     * @param sort An array sort whose range is a tuple sort.
     * @param elements One sub-array per member of the element type.
     */
    public ArrayAst(Sort.ArraySort sort, String name, List<Ast> elements) {
        if (!sort.isTupleArray()) {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "array",
                    "not an array of tuples: " + sort, name);
        }
        this.sort = sort;
        this.name = name;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.stillFree = true;
    }

    /**
     * Creates an unconstrained array of tuples. Sub-array {@code i} is named
     * {@code <name>.<member i>}.
     */
    public static ArrayAst fresh(EncodingSession session, Sort.ArraySort sort, String name) {
        Sort.TupleSort range = (Sort.TupleSort) sort.range();
        List<Ast> subArrays = new ArrayList<>();
        for (IrType.Member m : session.sorts().members(range)) {
            Sort.ArraySort fieldSort = session.sorts().fieldArraySort(sort.domainWidth(), m.type());
            subArrays.add(session.fresh(fieldSort, name + "." + m.name()));
        }
        return new ArrayAst(sort, name, subArrays);
    }

    @Override
    public Sort.ArraySort sort() {
        return sort;
    }

    @Override
    public String name() {
        return name;
    }

    public Sort.TupleSort elementSort() {
        return (Sort.TupleSort) sort.range();
    }

    public List<Ast> elements() {
        return elements;
    }

    public boolean isStillFree() {
        return stillFree;
    }

    /**
     * Binds this array to the sub-arrays of {@code source}. Allowed once, and
     * only while nothing has been assigned to it or read from it.
     */
    public void assign(Ast source) {
        ArrayAst src = requireArray(source, "assign");
        if (!stillFree) {
            throw new EncodingContractException(EncodingErrorCode.ASSIGN_TO_NON_FREE_ARRAY, "assign",
                    "destination was already assigned", name, src.name);
        }
        elements = src.elements;
        stillFree = false;
    }

    @Override
    public ScalarAst eq(EncodingSession session, Ast other) {
        ArrayAst o = requireArray(other, "eq");
        markRead();
        o.markRead();
        List<ScalarAst> conjuncts = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            conjuncts.add(elements.get(i).eq(session, o.elements.get(i)));
        }
        return session.conjunct(conjuncts);
    }

    @Override
    public ArrayAst ite(EncodingSession session, Ast cond, Ast falseValue) {
        ArrayAst f = requireArray(falseValue, "ite");
        markRead();
        f.markRead();
        List<Ast> result = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            result.add(elements.get(i).ite(session, cond, f.elements.get(i)));
        }
        return new ArrayAst(sort, session.freshName("tuple_array_ite::"), result);
    }

    @Override
    public ArrayAst update(EncodingSession session, Ast value, long index) {
        return update(session, value, session.indexConstant(index, sort.domainWidth()));
    }

    @Override
    public ArrayAst update(EncodingSession session, Ast value, Ast index) {
        TupleAst tuple = TupleAst.requireTuple(value, "update");
        markRead();
        List<IrType.Member> members = session.sorts().members(elementSort());
        List<Ast> result = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            rejectArrayField(members.get(i));
            result.add(elements.get(i).update(session, tuple.project(session, i), index));
        }
        return new ArrayAst(sort, session.freshName("tuple_array_update::"), result);
    }

    @Override
    public TupleAst select(EncodingSession session, Ast index) {
        markRead();
        List<IrType.Member> members = session.sorts().members(elementSort());
        List<Ast> fields = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            rejectArrayField(members.get(i));
            fields.add(elements.get(i).select(session, index));
        }
        return new TupleAst(elementSort(), session.freshName("tuple_array_select::"), fields);
    }

    @Override
    public TupleAst select(EncodingSession session, long index) {
        return select(session, session.indexConstant(index, sort.domainWidth()));
    }

    /**
     * @return The sub-array holding field {@code index} of every element.
     */
    @Override
    public Ast project(EncodingSession session, int index) {
        if (index < 0 || index >= elements.size()) {
            throw new EncodingContractException(EncodingErrorCode.FIELD_INDEX_OUT_OF_BOUNDS, "project",
                    "field " + index + " of " + elements.size(), name);
        }
        markRead();
        return elements.get(index);
    }

    private void markRead() {
        stillFree = false;
    }

    // A field that is itself an array is stored flattened; element access
    // through it would need the inner index, which is not modelled.
    private static void rejectArrayField(IrType.Member member) {
        if (member.type() instanceof IrType.ArrayType) {
            throw new UnsupportedEncodingException(EncodingErrorCode.NESTED_TUPLE_ARRAY,
                    "array-typed field '" + member.name() + "' inside an array of composites");
        }
    }

    static ArrayAst requireArray(Ast ast, String operation) {
        if (ast instanceof ArrayAst a) return a;
        throw new EncodingContractException(EncodingErrorCode.VARIANT_MISMATCH, operation,
                "expected an array of tuples, got " + ast.sort(), ast.name());
    }

    @Override
    public String toString() {
        return name + ":" + sort;
    }
}
