package org.smtflat.encoder.ir;

import java.math.BigInteger;
import java.util.List;

/**
 * Typed expression tree produced by a language frontend. Every node carries
 * its type; the encoder never infers types on its own.
 */
public sealed interface IrExpr permits IrExpr.Symbol, IrExpr.IntConstant, IrExpr.BoolConstant,
        IrExpr.StructConstant, IrExpr.UnionConstant, IrExpr.ArrayConstant, IrExpr.ArrayOf,
        IrExpr.MemberOf, IrExpr.With, IrExpr.Index, IrExpr.If, IrExpr.Equality, IrExpr.NotEqual,
        IrExpr.Not, IrExpr.BoolOp, IrExpr.BvBinary, IrExpr.BvCompare, IrExpr.Extract, IrExpr.Concat,
        IrExpr.AddressOf {

	/** Pointer symbol names with a fixed meaning. */
	String NULL_NAME = "NULL";
	String ZERO_NAME = "0";
	String INVALID_NAME = "INVALID";

	/**
	 * @return The type of the value this expression denotes.
	 */
	IrType type();

	/**
	 * A program variable (usually an SSA name).
	 * @param name The symbol name.
	 * @param type The declared type.
	 */
	record Symbol(String name, IrType type) implements IrExpr {}

	/**
	 * An integer literal.
	 * @param value The value; negative values are stored in two's complement.
	 * @param type The bit-vector type.
	 */
	record IntConstant(BigInteger value, IrType.BitVectorType type) implements IrExpr {
		@Override
		public String toString() {
			return value.toString();
		}
	}

	/**
	 * A boolean literal.
	 * @param value The value.
	 */
	record BoolConstant(boolean value) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.BOOL;
		}
	}

	/**
	 * A structure literal (also used for literal pointer pairs).
	 * @param type A {@link IrType.StructType} or {@link IrType.PointerType}.
	 * @param members One expression per member, in declaration order.
	 */
	record StructConstant(IrType type, List<IrExpr> members) implements IrExpr {
		public StructConstant {
			members = List.copyOf(members);
		}
	}

	/**
	 * A union literal. Well-formed input carries exactly one initializer.
	 * @param type The union type.
	 * @param initializers The initializer members.
	 */
	record UnionConstant(IrType.UnionType type, List<IrExpr> initializers) implements IrExpr {
		public UnionConstant {
			initializers = List.copyOf(initializers);
		}
	}

	/**
	 * An array literal with one expression per element.
	 * @param type The array type.
	 * @param elements The elements, index 0 first.
	 */
	record ArrayConstant(IrType.ArrayType type, List<IrExpr> elements) implements IrExpr {
		public ArrayConstant {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * An array whose every element is the same initializer.
	 * @param type The array type.
	 * @param initializer The repeated element value.
	 */
	record ArrayOf(IrType.ArrayType type, IrExpr initializer) implements IrExpr {}

	/**
	 * Projection of one member out of a structure, union or pointer.
	 * @param source The composite value.
	 * @param index The member index.
	 * @param type The member type.
	 */
	record MemberOf(IrExpr source, int index, IrType type) implements IrExpr {}

	/**
	 * Functional update: {@code source} with one member or element replaced.
	 * For composites the index must be an {@link IntConstant}; for arrays it
	 * may be any expression.
	 * @param source The value to update.
	 * @param index The member index or array index.
	 * @param value The new member or element value.
	 */
	record With(IrExpr source, IrExpr index, IrExpr value) implements IrExpr {
		@Override
		public IrType type() {
			return source.type();
		}
	}

	/**
	 * Array element selection.
	 * @param source The array.
	 * @param index The index expression.
	 * @param type The element type.
	 */
	record Index(IrExpr source, IrExpr index, IrType type) implements IrExpr {}

	/**
	 * Conditional value.
	 * @param cond The boolean condition.
	 * @param trueValue Value when the condition holds.
	 * @param falseValue Value otherwise.
	 */
	record If(IrExpr cond, IrExpr trueValue, IrExpr falseValue) implements IrExpr {
		@Override
		public IrType type() {
			return trueValue.type();
		}
	}

	/**
	 * Structural equality of two values of the same type.
	 */
	record Equality(IrExpr lhs, IrExpr rhs) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.BOOL;
		}
	}

	/**
	 * Negated structural equality.
	 */
	record NotEqual(IrExpr lhs, IrExpr rhs) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.BOOL;
		}
	}

	/**
	 * Boolean negation.
	 */
	record Not(IrExpr operand) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.BOOL;
		}
	}

	/**
	 * Binary boolean connective.
	 */
	record BoolOp(BoolOpKind kind, IrExpr lhs, IrExpr rhs) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.BOOL;
		}
	}

	/**
	 * Binary bit-vector arithmetic, bitwise or shift operation.
	 */
	record BvBinary(BvOpKind kind, IrExpr lhs, IrExpr rhs) implements IrExpr {
		@Override
		public IrType type() {
			return lhs.type();
		}
	}

	/**
	 * Bit-vector comparison.
	 */
	record BvCompare(BvCompareKind kind, IrExpr lhs, IrExpr rhs) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.BOOL;
		}
	}

	/**
	 * Bit range {@code [high:low]} of a bit-vector.
	 */
	record Extract(IrExpr source, int high, int low) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.unsignedBv(high - low + 1);
		}
	}

	/**
	 * Concatenation; {@code high} supplies the most significant bits.
	 */
	record Concat(IrExpr high, IrExpr low) implements IrExpr {
		@Override
		public IrType type() {
			return IrType.unsignedBv(((IrType.BitVectorType) high.type()).width()
					+ ((IrType.BitVectorType) low.type()).width());
		}
	}

	/**
	 * Address of a named object, offset zero.
	 * @param objectName The object the pointer refers to.
	 * @param type The pointer type.
	 */
	record AddressOf(String objectName, IrType.PointerType type) implements IrExpr {}

	enum BoolOpKind { AND, OR, XOR, IMPLIES }

	enum BvOpKind { ADD, SUB, MUL, SHL, LSHR, ASHR, AND, OR, XOR }

	enum BvCompareKind { ULT, ULE, UGT, UGE, SLT, SLE, SGT, SGE }

	// --- Factories ---

	static Symbol symbol(String name, IrType type) {
		return new Symbol(name, type);
	}

	static IntConstant bv(long value, int width) {
		return new IntConstant(BigInteger.valueOf(value), IrType.unsignedBv(width));
	}

	static IntConstant bv(long value, IrType.BitVectorType type) {
		return new IntConstant(BigInteger.valueOf(value), type);
	}

	static BoolConstant bool(boolean value) {
		return new BoolConstant(value);
	}

	static StructConstant struct(IrType type, IrExpr... members) {
		return new StructConstant(type, List.of(members));
	}

	static Symbol nullPointer(IrType.PointerType type) {
		return new Symbol(NULL_NAME, type);
	}

	/**
	 * Builds a member projection, taking the member type from the
	 * structure or union declaration.
	 */
	static MemberOf member(IrExpr source, int index) {
		IrType t = source.type();
		if (t instanceof IrType.StructType s) return new MemberOf(source, index, s.members().get(index).type());
		if (t instanceof IrType.UnionType u) return new MemberOf(source, index, u.members().get(index).type());
		throw new IllegalArgumentException("Member type of " + t + " must be given explicitly");
	}

	static With with(IrExpr source, long constantIndex, IrExpr value) {
		return new With(source, bv(constantIndex, 32), value);
	}

	/**
	 * Builds an array selection, taking the element type from the array type.
	 */
	static Index index(IrExpr source, IrExpr index) {
		if (source.type() instanceof IrType.ArrayType a) return new Index(source, index, a.elementType());
		throw new IllegalArgumentException("Not an array: " + source.type());
	}

	static Equality eq(IrExpr lhs, IrExpr rhs) {
		return new Equality(lhs, rhs);
	}

	static If ite(IrExpr cond, IrExpr trueValue, IrExpr falseValue) {
		return new If(cond, trueValue, falseValue);
	}
}
