package org.smtflat.encoder.sort;

import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.pointer.PointerConvention;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interns {@link Sort}s and lowers IR types to them. One registry belongs to
 * one encoding session.
 * <p>
 * Arrays of arrays are flattened: their sort is a single array whose domain is
 * the concatenation of the outer and inner index domains.
 */
public final class SortRegistry {

    private final Map<Sort, Sort> interned = new HashMap<>();
    private final int infiniteDomainWidth;
    private final PointerConvention pointers;
    private final Sort.BoolSort bool;

    /**
     * @param infiniteDomainWidth Index width used for unbounded and non-constant sized arrays.
     * @param pointers The pointer convention of the session.
     */
    public SortRegistry(int infiniteDomainWidth, PointerConvention pointers) {
        this.infiniteDomainWidth = infiniteDomainWidth;
        this.pointers = pointers;
        this.bool = intern(new Sort.BoolSort());
    }

    public Sort.BoolSort bool() {
        return bool;
    }

    public Sort.BitVectorSort bitVector(int width, boolean signed) {
        return intern(new Sort.BitVectorSort(width, signed));
    }

    public Sort.ArraySort array(int domainWidth, Sort range) {
        return intern(new Sort.ArraySort(domainWidth, range));
    }

    public Sort.TupleSort tuple(IrType structuralType) {
        return intern(new Sort.TupleSort(structuralType));
    }

    /**
     * @return The number of distinct sorts created so far.
     */
    public int size() {
        return interned.size();
    }

    @SuppressWarnings("unchecked")
    private <S extends Sort> S intern(S sort) {
        return (S) interned.computeIfAbsent(sort, s -> s);
    }

    /**
     * Lowers an IR type to its sort.
     * @param type The IR type.
     * @return The shared sort instance.
     */
    public Sort convert(IrType type) {
        if (type instanceof IrType.BoolType) return bool;
        if (type instanceof IrType.BitVectorType bv) return bitVector(bv.width(), bv.signed());
        if (type instanceof IrType.ArrayType arr) {
            return array(domainWidth(arr), elementSort(IrType.innermostElement(arr)));
        }
        return tuple(type);
    }

    /**
     * Sort of the sub-array holding one field of an array of composites.
     * @param domainWidth Domain width of the enclosing array of composites.
     * @param fieldType The declared type of the field.
     * @return An array sort; flattened if the field is itself an array.
     */
    public Sort.ArraySort fieldArraySort(int domainWidth, IrType fieldType) {
        if (fieldType instanceof IrType.ArrayType inner) {
            return array(domainWidth + domainWidth(inner), elementSort(IrType.innermostElement(inner)));
        }
        return array(domainWidth, elementSort(fieldType));
    }

    private Sort elementSort(IrType element) {
        return element.isComposite() ? tuple(element) : convert(element);
    }

    /**
     * Computes the index domain width of an array type, adding up the widths
     * of nested array levels.
     * @param type The array type.
     * @return The domain width in bits.
     */
    public int domainWidth(IrType.ArrayType type) {
        int own = (type.infinite() || !type.hasConstantSize())
                ? infiniteDomainWidth
                : bitsFor(type.constantSize());
        if (type.elementType() instanceof IrType.ArrayType inner) {
            return own + domainWidth(inner);
        }
        return own;
    }

    /**
     * @param type An array type, possibly with array elements.
     * @return The index width of the outermost level alone.
     */
    public int levelWidth(IrType.ArrayType type) {
        if (type.elementType() instanceof IrType.ArrayType inner) {
            return domainWidth(type) - domainWidth(inner);
        }
        return domainWidth(type);
    }

    /**
     * @param size An element count.
     * @return The number of index bits needed to address {@code size} elements, at least 1.
     */
    public static int bitsFor(long size) {
        if (size <= 2) return 1;
        return 64 - Long.numberOfLeadingZeros(size - 1);
    }

    /**
     * Looks up the ordered member list of a composite type. Pointers resolve to
     * the fixed object/offset pair.
     * @param type A structure, union or pointer type.
     * @return The members in declaration order.
     */
    public List<IrType.Member> members(IrType type) {
        if (type instanceof IrType.StructType s) return s.members();
        if (type instanceof IrType.UnionType u) return u.members();
        if (type instanceof IrType.PointerType) return pointers.definition().members();
        throw new EncodingContractException(EncodingErrorCode.PROJECT_ON_NON_TUPLE, "members",
                "type has no members: " + type);
    }

    /**
     * @param sort A tuple sort.
     * @return The members of its structural type.
     */
    public List<IrType.Member> members(Sort.TupleSort sort) {
        return members(sort.structuralType());
    }

    public PointerConvention pointers() {
        return pointers;
    }
}
