package org.smtflat.encoder.pointer;

import org.smtflat.encoder.ir.IrType;

/**
 * The fixed tuple shape every pointer is encoded as: an object identifier and
 * an offset into that object, both machine-word wide. There is no other
 * pointer representation.
 */
public final class PointerConvention {

    public static final String OBJECT_FIELD = "object_id";
    public static final String OFFSET_FIELD = "offset";
    public static final int OBJECT_INDEX = 0;
    public static final int OFFSET_INDEX = 1;

    private final int width;
    private final IrType.StructType definition;

    /**
     * @param width The machine word width in bits.
     */
    public PointerConvention(int width) {
        this.width = width;
        this.definition = IrType.struct("pointer_struct",
                IrType.member(OBJECT_FIELD, IrType.unsignedBv(width)),
                IrType.member(OFFSET_FIELD, IrType.unsignedBv(width)));
    }

    public int width() {
        return width;
    }

    /**
     * @return The structure every pointer tuple follows.
     */
    public IrType.StructType definition() {
        return definition;
    }

    /**
     * @param type A structural type.
     * @return {@code true} if tuples of this type are pointers.
     */
    public boolean isPointer(IrType type) {
        return type instanceof IrType.PointerType || definition.equals(type);
    }
}
