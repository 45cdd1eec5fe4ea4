/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;

import java.util.Objects;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * The declared type of a parameter. A domain knows the widest literal its parameter can take, and
 * whether that literal actually restricts anything.
 */
public abstract class Domain {

    public static Numbers numbers() {
        return Numbers.REALS;
    }

    public static Numbers nonNegative() {
        return Numbers.NON_NEGATIVE;
    }

    public static Domain booleans() {
        return Booleans.INSTANCE;
    }

    public static Enums enums(EnumType type) {
        return new Enums(type);
    }

    public static Domain strings() {
        return Strings.INSTANCE;
    }

    /**
     * Every value of the domain, in canonical form.
     */
    public abstract Literal universe();

    /**
     * Whether {@link #universe()} is narrower than the universe of its literal kind, so that lowering
     * it into a constraint adds information.
     */
    public abstract boolean isBounding();

    public abstract Literal.Kind kind();

    public boolean isNumbers() {
        return false;
    }

    public Numbers asNumbers() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), Numbers.class.getSimpleName());
    }

    public static class Numbers extends Domain {

        private static final Numbers REALS = new Numbers(false);
        private static final Numbers NON_NEGATIVE = new Numbers(true);

        private final boolean nonNegative;

        private Numbers(boolean nonNegative) {
            this.nonNegative = nonNegative;
        }

        public boolean isNonNegative() {
            return nonNegative;
        }

        @Override
        public Literal.Quantity universe() {
            NumericSet values = nonNegative ? NumericSet.nonNegative() : NumericSet.unbounded();
            return Literal.quantity(values, Units.DIMENSIONLESS);
        }

        @Override
        public boolean isBounding() {
            return nonNegative;
        }

        @Override
        public Literal.Kind kind() {
            return Literal.Kind.QUANTITY;
        }

        @Override
        public boolean isNumbers() {
            return true;
        }

        @Override
        public Numbers asNumbers() {
            return this;
        }

        @Override
        public String toString() {
            return nonNegative ? "non-negative" : "real";
        }
    }

    static class Booleans extends Domain {

        private static final Booleans INSTANCE = new Booleans();

        @Override
        public Literal universe() {
            return Literal.Booleans.ANY;
        }

        @Override
        public boolean isBounding() {
            return false;
        }

        @Override
        public Literal.Kind kind() {
            return Literal.Kind.BOOLEANS;
        }

        @Override
        public String toString() {
            return "boolean";
        }
    }

    public static class Enums extends Domain {

        private final EnumType type;

        private Enums(EnumType type) {
            this.type = type;
        }

        public EnumType type() {
            return type;
        }

        @Override
        public Literal universe() {
            return Literal.Enums.all(type);
        }

        @Override
        public boolean isBounding() {
            return true;
        }

        @Override
        public Literal.Kind kind() {
            return Literal.Kind.ENUMS;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return type == ((Enums) o).type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(type.name());
        }

        @Override
        public String toString() {
            return "enum " + type;
        }
    }

    static class Strings extends Domain {

        private static final Strings INSTANCE = new Strings();

        @Override
        public Literal universe() {
            return Literal.Strings.ALL;
        }

        @Override
        public boolean isBounding() {
            return false;
        }

        @Override
        public Literal.Kind kind() {
            return Literal.Kind.STRINGS;
        }

        @Override
        public String toString() {
            return "string";
        }
    }
}
