package org.smtflat.encoder.solver;

/**
 * The fixed operator set every backend must be able to apply.
 */
public enum SmtFunction {
    EQ(2), NOTEQ(2),
    AND(2), OR(2), XOR(2), IMPLIES(2), NOT(1),
    ITE(3),
    BVADD(2), BVSUB(2), BVMUL(2),
    BVAND(2), BVOR(2), BVXOR(2),
    BVSHL(2), BVLSHR(2), BVASHR(2),
    BVULT(2), BVULTE(2), BVUGT(2), BVUGTE(2),
    BVSLT(2), BVSLTE(2), BVSGT(2), BVSGTE(2),
    STORE(3), SELECT(2),
    CONCAT(2);

    private final int arity;

    SmtFunction(int arity) {
        this.arity = arity;
    }

    /**
     * @return The number of arguments the operator takes; {@code AND} and
     *         {@code OR} also accept more.
     */
    public int arity() {
        return arity;
    }

    public boolean isVariadic() {
        return this == AND || this == OR;
    }
}
