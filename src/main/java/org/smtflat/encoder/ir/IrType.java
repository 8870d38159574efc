package org.smtflat.encoder.ir;

import java.math.BigInteger;
import java.util.List;

/**
 * Types of the frontend IR that the encoder consumes. Composite types
 * (structures, unions, pointers) have no native counterpart in the solver and
 * are flattened into tuples of scalar symbols.
 */
public sealed interface IrType permits IrType.BoolType, IrType.BitVectorType, IrType.ArrayType,
        IrType.StructType, IrType.UnionType, IrType.PointerType {

	/**
	 * The boolean type.
	 */
	record BoolType() implements IrType {
		@Override
		public String toString() {
			return "bool";
		}
	}

	/**
	 * A fixed-width integer.
	 * @param width The number of bits.
	 * @param signed Whether the value is interpreted as two's complement.
	 */
	record BitVectorType(int width, boolean signed) implements IrType {
		public BitVectorType {
			if (width <= 0) throw new IllegalArgumentException("Bit-vector width must be positive: " + width);
		}

		@Override
		public String toString() {
			return (signed ? "s" : "u") + "bv" + width;
		}
	}

	/**
	 * An array. The size is either a constant element count, an arbitrary
	 * (non-constant) expression, or infinite.
	 * @param elementType The element type.
	 * @param size The element count; ignored when {@code infinite} is set.
	 * @param infinite Whether the array is unbounded.
	 */
	record ArrayType(IrType elementType, IrExpr size, boolean infinite) implements IrType {
		/**
		 * @return {@code true} if the size is a compile-time constant.
		 */
		public boolean hasConstantSize() {
			return !infinite && size instanceof IrExpr.IntConstant;
		}

		/**
		 * @return The constant element count.
		 * @throws IllegalStateException if the size is not a constant.
		 */
		public long constantSize() {
			if (!hasConstantSize()) throw new IllegalStateException("Array size is not constant: " + this);
			return ((IrExpr.IntConstant) size).value().longValueExact();
		}

		@Override
		public String toString() {
			return elementType + "[" + (infinite ? "inf" : String.valueOf(size)) + "]";
		}
	}

	/**
	 * A named structure with ordered members.
	 * @param name The tag name.
	 * @param members The members in declaration order.
	 */
	record StructType(String name, List<Member> members) implements IrType {
		public StructType {
			members = List.copyOf(members);
		}

		@Override
		public String toString() {
			return "struct " + name;
		}
	}

	/**
	 * A named union. Members overlay each other; there is no discriminator.
	 * @param name The tag name.
	 * @param members The members in declaration order.
	 */
	record UnionType(String name, List<Member> members) implements IrType {
		public UnionType {
			members = List.copyOf(members);
		}

		@Override
		public String toString() {
			return "union " + name;
		}
	}

	/**
	 * A pointer. Always encoded as the two-field object/offset tuple.
	 * @param target Name of the pointee type, informational only.
	 */
	record PointerType(String target) implements IrType {
		@Override
		public String toString() {
			return target + "*";
		}
	}

	/**
	 * A structure or union member.
	 * @param name The member name.
	 * @param type The member type.
	 */
	record Member(String name, IrType type) {}

	/**
	 * @return {@code true} for structures, unions and pointers.
	 */
	default boolean isComposite() {
		return this instanceof StructType || this instanceof UnionType || this instanceof PointerType;
	}

	/**
	 * @return {@code true} for arrays whose innermost element type is composite.
	 */
	default boolean isCompositeArray() {
		return this instanceof ArrayType a && innermostElement(a).isComposite();
	}

	/**
	 * Walks through nested array types down to the first non-array element type.
	 * @param array The outer array type.
	 * @return The innermost element type.
	 */
	static IrType innermostElement(ArrayType array) {
		IrType t = array.elementType();
		while (t instanceof ArrayType inner) {
			t = inner.elementType();
		}
		return t;
	}

	// --- Factories ---

	BoolType BOOL = new BoolType();

	static BitVectorType unsignedBv(int width) {
		return new BitVectorType(width, false);
	}

	static BitVectorType signedBv(int width) {
		return new BitVectorType(width, true);
	}

	static ArrayType array(IrType elementType, long size) {
		return new ArrayType(elementType, new IrExpr.IntConstant(BigInteger.valueOf(size), unsignedBv(64)), false);
	}

	static ArrayType infiniteArray(IrType elementType) {
		return new ArrayType(elementType, new IrExpr.IntConstant(BigInteger.ZERO, unsignedBv(64)), true);
	}

	static StructType struct(String name, Member... members) {
		return new StructType(name, List.of(members));
	}

	static UnionType union(String name, Member... members) {
		return new UnionType(name, List.of(members));
	}

	static Member member(String name, IrType type) {
		return new Member(name, type);
	}
}
