package org.smtflat.encoder.ir;

import org.smtflat.encoder.pointer.PointerObject;

import java.math.BigInteger;
import java.util.List;

/**
 * Concrete program values reconstructed from a satisfying model.
 */
public sealed interface IrValue permits IrValue.Bool, IrValue.BitVector, IrValue.Struct, IrValue.Array,
        IrValue.Pointer, IrValue.NoValue {

	/**
	 * A boolean value.
	 * @param value The value.
	 */
	record Bool(boolean value) implements IrValue {}

	/**
	 * A bit-vector value.
	 * @param value The unsigned value as reported by the solver.
	 * @param width The bit width.
	 * @param signed Whether the declared type is signed.
	 */
	record BitVector(BigInteger value, int width, boolean signed) implements IrValue {
		/**
		 * @return The value interpreted according to the declared signedness.
		 */
		public BigInteger asDeclared() {
			if (signed && value.testBit(width - 1)) {
				return value.subtract(BigInteger.ONE.shiftLeft(width));
			}
			return value;
		}

		public long longValue() {
			return asDeclared().longValue();
		}
	}

	/**
	 * A structure or union value.
	 * @param type The structure or union type.
	 * @param members One value per member, in declaration order.
	 */
	record Struct(IrType type, List<IrValue> members) implements IrValue {
		public Struct {
			members = List.copyOf(members);
		}
	}

	/**
	 * The leading elements of an array value.
	 * @param elements The element values, index 0 first.
	 */
	record Array(List<IrValue> elements) implements IrValue {
		public Array {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * A pointer translated through the pointer table.
	 * @param object The object the pointer refers to.
	 * @param offset The byte offset into the object.
	 */
	record Pointer(PointerObject object, BigInteger offset) implements IrValue {}

	/**
	 * Placeholder for a value the model does not determine, e.g. a field of a
	 * tuple that was never read while solving.
	 */
	record NoValue() implements IrValue {
		@Override
		public String toString() {
			return "<no value>";
		}
	}

	NoValue NO_VALUE = new NoValue();
}
