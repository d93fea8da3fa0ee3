package org.snrasm.compiler.frontend.semantics;

/**
 * The static type of an expression value.
 */
public enum ValueKind {
    /** A plain 32-bit integer. */
    INT,
    /** A fixed point number with three decimals, stored as value * 1000. */
    REAL;

    public String describe() {
        return this == INT ? "integer" : "real";
    }
}
