package org.smtflat.encoder.construct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtflat.encoder.EncodingSession;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.ast.Ast;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.convert.ConversionContext;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.sort.Sort;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds tuples from structure literals and fresh tuple values.
 */
public final class TupleConstructor {

    private static final Logger LOG = LoggerFactory.getLogger(TupleConstructor.class);

    private TupleConstructor() {}

    /**
     * Creates a materialized tuple whose fields are the converted member
     * expressions of a structure literal.
     * @param literal The structure (or pointer pair) literal.
     * @param ctx The conversion context.
     * @return The new tuple.
     */
    public static TupleAst create(IrExpr.StructConstant literal, ConversionContext ctx) {
        EncodingSession session = ctx.session();
        Sort.TupleSort sort = tupleSort(session, literal.type());
        List<IrType.Member> members = session.sorts().members(sort);
        if (members.size() != literal.members().size()) {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "tuple_create",
                    literal.members().size() + " values for " + members.size() + " members of " + literal.type());
        }
        List<Ast> elements = new ArrayList<>(members.size());
        for (IrExpr member : literal.members()) {
            elements.add(ctx.convert(member));
        }
        TupleAst tuple = new TupleAst(sort, session.freshName("tuple_create::"), elements);
        LOG.debug("Created {} with {} fields", tuple.name(), elements.size());
        return tuple;
    }

    /**
     * Creates an unconstrained tuple or array of tuples.
     * @param session The session.
     * @param sort A tuple sort or an array sort with a tuple range.
     * @param name The name, or {@code null} for a generated one.
     * @return An unmaterialized tuple or a free array of tuples.
     */
    public static Ast fresh(EncodingSession session, Sort sort, String name) {
        if (sort.isScalar()) {
            throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "tuple_fresh",
                    "not a composite sort: " + sort);
        }
        String actual = name != null ? name : session.freshName("tuple_fresh::");
        return session.fresh(sort, actual);
    }

    static Sort.TupleSort tupleSort(EncodingSession session, IrType type) {
        if (session.sorts().convert(type) instanceof Sort.TupleSort ts) return ts;
        throw new EncodingContractException(EncodingErrorCode.SORT_MISMATCH, "tuple_create",
                "not a composite type: " + type);
    }
}
