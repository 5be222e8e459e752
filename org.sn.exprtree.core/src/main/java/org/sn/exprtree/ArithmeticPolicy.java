package org.sn.exprtree;


/**
 * What to do when an operation has no real result.
 */
public enum ArithmeticPolicy {
    /**
     * Fail with DIVISION_BY_ZERO when dividing by zero or raising zero to a negative power.
     * Fail with INVALID_POWER when an exponentiation gives NaN, as in (0 - 8) ^ (1 / 3),
     * and with UNDEFINED_RESULT when another operator gives NaN, as in Infinity - Infinity.
     * Overflow to Infinity is not an error.
     */
    STRICT,

    /**
     * Return whatever Java double arithmetic returns, so 1 / 0 is Infinity and 0 / 0 is NaN.
     */
    IEEE_754
}
