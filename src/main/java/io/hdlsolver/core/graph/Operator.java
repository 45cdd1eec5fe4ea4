/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

public enum Operator {

    // canonical basis
    ADD("+", Family.ARITHMETIC, 2, -1, true, true, true),
    MULTIPLY("*", Family.ARITHMETIC, 2, -1, true, true, true),
    POWER("^", Family.ARITHMETIC, 2, 2, true, false, false),
    ROUND("round", Family.ARITHMETIC, 1, 1, true, false, false),
    ABS("abs", Family.ARITHMETIC, 1, 1, true, false, false),
    SIN("sin", Family.ARITHMETIC, 1, 1, true, false, false),
    LOG("log", Family.ARITHMETIC, 1, 1, true, false, false),
    OR("or", Family.LOGIC, 1, -1, true, true, true),
    NOT("not", Family.LOGIC, 1, 1, true, false, false),
    UNION("union", Family.SET, 1, -1, true, true, true),
    SYMMETRIC_DIFFERENCE("symdiff", Family.SET, 2, 2, true, true, false),
    GREATER_OR_EQUAL(">=", Family.RELATION, 2, 2, true, false, false),
    IS_SUBSET("subset", Family.RELATION, 2, 2, true, false, false),
    IS("is", Family.RELATION, 2, 2, true, true, false),

    // lowered by canonicalization
    SUBTRACT("-", Family.ARITHMETIC, 2, -1, false, false, false),
    DIVIDE("/", Family.ARITHMETIC, 2, -1, false, false, false),
    SQRT("sqrt", Family.ARITHMETIC, 1, 1, false, false, false),
    FLOOR("floor", Family.ARITHMETIC, 1, 1, false, false, false),
    CEIL("ceil", Family.ARITHMETIC, 1, 1, false, false, false),
    COS("cos", Family.ARITHMETIC, 1, 1, false, false, false),
    MIN("min", Family.ARITHMETIC, 1, -1, false, true, false),
    MAX("max", Family.ARITHMETIC, 1, -1, false, true, false),
    AND("and", Family.LOGIC, 1, -1, false, true, false),
    IMPLIES("implies", Family.LOGIC, 2, 2, false, false, false),
    XOR("xor", Family.LOGIC, 2, -1, false, true, false),
    INTERSECTION("intersection", Family.SET, 2, -1, false, true, false),
    DIFFERENCE("difference", Family.SET, 2, -1, false, false, false),
    CARDINALITY("cardinality", Family.SET, 1, 1, false, false, false),
    LESS_OR_EQUAL("<=", Family.RELATION, 2, 2, false, false, false),
    LESS_THAN("<", Family.RELATION, 2, 2, false, false, false),
    GREATER_THAN(">", Family.RELATION, 2, 2, false, false, false),
    IS_SUPERSET("superset", Family.RELATION, 2, 2, false, false, false);

    public enum Family {ARITHMETIC, LOGIC, SET, RELATION}

    private final String symbol;
    private final Family family;
    private final int minOperands;
    private final int maxOperands;
    private final boolean isCanonical;
    private final boolean isCommutative;
    private final boolean isAssociative;

    Operator(String symbol, Family family, int minOperands, int maxOperands,
             boolean isCanonical, boolean isCommutative, boolean isAssociative) {
        this.symbol = symbol;
        this.family = family;
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
        this.isCanonical = isCanonical;
        this.isCommutative = isCommutative;
        this.isAssociative = isAssociative;
    }

    public String symbol() {
        return symbol;
    }

    public Family family() {
        return family;
    }

    public boolean isCanonical() {
        return isCanonical;
    }

    public boolean isCommutative() {
        return isCommutative;
    }

    public boolean isAssociative() {
        return isAssociative;
    }

    public boolean isPredicate() {
        return family == Family.RELATION;
    }

    /**
     * Whether an expression with this operator evaluates to a boolean and therefore can be asserted.
     */
    public boolean isBooleanValued() {
        return family == Family.RELATION || family == Family.LOGIC;
    }

    public boolean acceptsOperandCount(int count) {
        return count >= minOperands && (maxOperands < 0 || count <= maxOperands);
    }
}
