/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.common.exception;

public abstract class ErrorMessage {

    private final String code;
    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;
        this.code = String.format("%s%02d", codePrefix, codeNumber);
    }

    public String code() {
        return code;
    }

    public String codePrefix() {
        return codePrefix;
    }

    public int codeNumber() {
        return codeNumber;
    }

    public String message(Object... parameters) {
        String message = String.format(toString(), parameters);
        assert !message.contains("%s");
        return message;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code, messagePrefix, messageBody);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return code.equals(((ErrorMessage) o).code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_ARGUMENT =
                new Internal(2, "Illegal argument provided.");
        public static final Internal ILLEGAL_CAST =
                new Internal(3, "Illegal casting operation from '%s' to '%s'.");
        public static final Internal UNRECOGNISED_VALUE =
                new Internal(4, "Unrecognised value '%s'.");
        public static final Internal ROUND_LIMIT_EXCEEDED =
                new Internal(5, "The solver did not reach a fixpoint within %s rounds.");
        public static final Internal NON_CANONICAL_GENERATION =
                new Internal(6, "Generation %s is not canonical: node '%s' (%s) remains after canonicalization.");
        public static final Internal MISSING_PROVENANCE =
                new Internal(7, "Node created by '%s' has no provenance.");
        public static final Internal FOREIGN_NODE =
                new Internal(8, "Node '%s' does not belong to generation %s.");
        public static final Internal MUTATOR_CLOSED =
                new Internal(9, "The mutator of generation %s has already been closed.");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Literal extends ErrorMessage {
        public static final Literal KIND_MISMATCH =
                new Literal(1, "Cannot combine a literal of kind '%s' with a literal of kind '%s'.");
        public static final Literal INCOMMENSURABLE_UNITS =
                new Literal(2, "The units '%s' and '%s' are not commensurable.");
        public static final Literal INVALID_INTERVAL =
                new Literal(3, "The interval [%s, %s] is invalid.");
        public static final Literal NOT_SINGLETON =
                new Literal(4, "The literal '%s' does not hold exactly one value.");
        public static final Literal UNKNOWN_UNIT =
                new Literal(5, "The unit symbol '%s' is not recognised.");
        public static final Literal UNIT_WITH_OFFSET =
                new Literal(6, "The unit '%s' has an offset and cannot be multiplied, divided or raised to a power.");
        public static final Literal NON_INTEGRAL_UNIT_POWER =
                new Literal(7, "The unit '%s' cannot be raised to the power %s.");
        public static final Literal UNSUPPORTED_OPERATION =
                new Literal(8, "The operation '%s' is not defined for '%s'.");
        public static final Literal ENUM_MEMBER_UNKNOWN =
                new Literal(9, "The enum '%s' has no member '%s'.");

        private static final String codePrefix = "LIT";
        private static final String messagePrefix = "Invalid Literal Operation";

        Literal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Graph extends ErrorMessage {
        public static final Graph UNKNOWN_NODE =
                new Graph(1, "The node '%s' does not exist in generation %s.");
        public static final Graph INVALID_OPERAND_COUNT =
                new Graph(2, "The operator '%s' does not accept %s operand(s).");
        public static final Graph EXPRESSION_EXPECTED =
                new Graph(3, "The node '%s' is not an expression.");
        public static final Graph PREDICATE_EXPECTED =
                new Graph(4, "Only predicates can be constrained, but '%s' is not a predicate.");
        public static final Graph PARAMETER_EXPECTED =
                new Graph(5, "The node '%s' is not a parameter.");
        public static final Graph DUPLICATE_PARAMETER_NAME =
                new Graph(6, "The parameter name '%s' is already in use.");

        private static final String codePrefix = "GRA";
        private static final String messagePrefix = "Invalid Graph Operation";

        Graph(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Solver extends ErrorMessage {
        public static final Solver CONTRADICTIONS =
                new Solver(1, "The constraints are unsatisfiable, %s contradiction(s) found:\n%s");
        public static final Solver INCOMMENSURABLE_OPERANDS =
                new Solver(2, "The operands of '%s' have incommensurable units '%s' and '%s'.");
        public static final Solver NON_DIMENSIONLESS_ARGUMENT =
                new Solver(3, "The argument of '%s' must be dimensionless, but has unit '%s'.");
        public static final Solver EMPTY_SUPERSET =
                new Solver(4, "The parameter '%s' has no admissible value.");
        public static final Solver FALSE_PREDICATE =
                new Solver(5, "The constraint '%s' can never hold.");
        public static final Solver STRICT_BOUND_DOWNGRADED =
                new Solver(6, "Strict comparison '%s' is treated as its non-strict counterpart.");
        public static final Solver UNSUPPORTED_OPERATOR_DROPPED =
                new Solver(7, "The operator '%s' is not supported and its constraint is dropped.");

        private static final String codePrefix = "SLV";
        private static final String messagePrefix = "Solver Error";

        Solver(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
