package org.smtflat.encoder.sort;

import org.smtflat.encoder.ir.IrType;

/**
 * Immutable descriptor of an encoded type. Two sorts are equal iff variant
 * and payload match; {@link SortRegistry} hands out one shared instance per
 * distinct shape.
 * <p>
 * An {@link ArraySort} whose range is a {@link TupleSort} describes an array
 * of composites. Such a sort is never lowered to the solver: the value is
 * kept as one homogeneous array per field.
 */
public sealed interface Sort permits Sort.BoolSort, Sort.BitVectorSort, Sort.ArraySort, Sort.TupleSort {

    record BoolSort() implements Sort {
        @Override
        public String toString() {
            return "Bool";
        }
    }

    /**
     * @param width The number of bits.
     * @param signed Signedness of the source type, kept for readback.
     */
    record BitVectorSort(int width, boolean signed) implements Sort {
        @Override
        public String toString() {
            return "BV" + width;
        }
    }

    /**
     * @param domainWidth Bit width of the index domain.
     * @param range Sort of the elements.
     */
    record ArraySort(int domainWidth, Sort range) implements Sort {
        @Override
        public String toString() {
            return "Array[" + domainWidth + " -> " + range + "]";
        }
    }

    /**
     * @param structuralType The structure, union or pointer type whose members
     *                       make up the tuple.
     */
    record TupleSort(IrType structuralType) implements Sort {
        @Override
        public String toString() {
            return "Tuple[" + structuralType + "]";
        }
    }

    /**
     * @return {@code true} if values of this sort are arrays of composites.
     */
    default boolean isTupleArray() {
        return this instanceof ArraySort a && a.range() instanceof TupleSort;
    }

    /**
     * @return {@code true} if the solver can represent values of this sort directly.
     */
    default boolean isScalar() {
        return !(this instanceof TupleSort) && !isTupleArray();
    }
}
