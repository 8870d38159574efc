package org.smtflat.encoder.api;

/**
 * Defines unique, testable error codes for every failure the encoder reports.
 * This decouples the test logic from the exception messages.
 */
public enum EncodingErrorCode {
    // region Contract violations (an upstream IR invariant was broken)
    /** A field was projected out of an Ast that is not a tuple. */
    PROJECT_ON_NON_TUPLE,
    /** An index was selected out of an Ast that is not array-sorted. */
    SELECT_ON_NON_ARRAY,
    /** An indexed store was applied to an Ast that is not array-sorted. */
    UPDATE_ON_NON_ARRAY,
    /** A field index was not smaller than the member count. */
    FIELD_INDEX_OUT_OF_BOUNDS,
    /** A structure field was updated with a symbolic index. */
    NON_CONSTANT_FIELD_INDEX,
    /** A union initializer did not carry exactly one member. */
    UNION_INITIALIZER_COUNT,
    /** A union initializer type matches none of the union's members. */
    UNION_INITIALIZER_TYPE,
    /** A tuple was assigned into after its fields had been materialized. */
    ASSIGN_TO_MATERIALIZED_TUPLE,
    /** An array of tuples was assigned into a second time. */
    ASSIGN_TO_NON_FREE_ARRAY,
    /** Two operands of a binary Ast operation are different variants. */
    VARIANT_MISMATCH,
    /** A formula handed to the solver is not boolean-sorted. */
    NON_BOOLEAN_ASSERTION,
    /** An operand has a sort the operation cannot accept. */
    SORT_MISMATCH,
    // endregion

    // region Unsupported input
    /** Reading back a whole array whose elements are tuples. */
    TUPLE_ARRAY_READBACK,
    /** Arrays of tuples that contain arrays, beyond the flattening heuristic. */
    NESTED_TUPLE_ARRAY,
    /** A constant array whose size is not a compile-time constant. */
    NON_CONSTANT_ARRAY_SIZE,
    /** A broadcast whose index domain is too wide to enumerate. */
    BROADCAST_TOO_WIDE,
    /** A pointer array initializer other than the null pointer. */
    POINTER_ARRAY_INITIALIZER,
    /** A nested array expression shape outside the flattening heuristic. */
    NESTED_ARRAY_SHAPE,
    /** A model assigns a pointer an object identifier of 2^63 or more. */
    POINTER_ID_OUT_OF_RANGE,
    /** An IR node the encoder has no converter for. */
    UNSUPPORTED_EXPRESSION
    // endregion
}
