/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.INCOMMENSURABLE_UNITS;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.KIND_MISMATCH;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.NOT_SINGLETON;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.UNSUPPORTED_OPERATION;
import static java.util.Collections.unmodifiableSet;

/**
 * An immutable set of admissible values. A literal is never mutated: every operation returns a new
 * literal, so literals are freely shared between generations and threads.
 */
public abstract class Literal {

    public enum Kind {QUANTITY, BOOLEANS, ENUMS, STRINGS}

    public abstract Kind kind();

    public abstract boolean isEmpty();

    public abstract boolean isSingleton();

    /**
     * @return the only admissible value
     * @throws SolverException if the literal does not hold exactly one value
     */
    public abstract Object single();

    public abstract Literal union(Literal other);

    public abstract Literal intersect(Literal other);

    public abstract Literal difference(Literal other);

    public abstract boolean isSubsetOf(Literal other);

    public Literal symmetricDifference(Literal other) {
        return difference(other).union(other.difference(this));
    }

    public boolean isSupersetOf(Literal other) {
        return other.isSubsetOf(this);
    }

    /**
     * Whether the literal is stored in the unit-free form the solver works in.
     */
    public boolean isCanonical() {
        return true;
    }

    public boolean isQuantity() {
        return false;
    }

    public Quantity asQuantity() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), Quantity.class.getSimpleName());
    }

    public boolean isBooleans() {
        return false;
    }

    public Booleans asBooleans() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), Booleans.class.getSimpleName());
    }

    public boolean isEnums() {
        return false;
    }

    public Enums asEnums() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), Enums.class.getSimpleName());
    }

    public boolean isStrings() {
        return false;
    }

    public Strings asStrings() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), Strings.class.getSimpleName());
    }

    void validateKind(Literal other) {
        if (kind() != other.kind()) throw SolverException.of(KIND_MISMATCH, kind(), other.kind());
    }

    public static Quantity quantity(double value) {
        return new Quantity(NumericSet.single(value), Units.DIMENSIONLESS);
    }

    public static Quantity quantity(double value, Unit unit) {
        return new Quantity(NumericSet.single(value), unit);
    }

    public static Quantity quantity(double min, double max) {
        return new Quantity(NumericSet.closed(min, max), Units.DIMENSIONLESS);
    }

    public static Quantity quantity(double min, double max, Unit unit) {
        return new Quantity(NumericSet.closed(min, max), unit);
    }

    public static Quantity quantity(NumericSet values, Unit unit) {
        return new Quantity(values, unit);
    }

    /**
     * A nominal value with a relative tolerance, e.g. {@code 10 kΩ ± 1%}.
     */
    public static Quantity tolerance(double nominal, double relative, Unit unit) {
        double delta = Math.abs(nominal * relative);
        return new Quantity(NumericSet.closed(nominal - delta, nominal + delta), unit);
    }

    public static class Quantity extends Literal {

        private final NumericSet values;
        private final Unit unit;
        private final int hash;

        Quantity(NumericSet values, Unit unit) {
            this.values = values;
            this.unit = unit;
            this.hash = Objects.hash(baseValues(values, unit), unit.base());
        }

        public NumericSet values() {
            return values;
        }

        public Unit unit() {
            return unit;
        }

        public NumericSet baseValues() {
            return baseValues(values, unit);
        }

        private static NumericSet baseValues(NumericSet values, Unit unit) {
            if (unit.multiplier() == 1 && unit.offset() == 0) return values;
            return values.mapBounds(unit::toBase);
        }

        /**
         * The same values in base units, stored without a unit.
         */
        public Quantity canonical() {
            if (isCanonical()) return this;
            return new Quantity(baseValues(), Units.DIMENSIONLESS);
        }

        /**
         * Reads this quantity's values as base-unit values of the target dimension and expresses them in
         * the target unit. The inverse of {@link #canonical()}.
         */
        public Quantity restore(Unit target) {
            if (!isCanonical()) return in(target);
            if (target.multiplier() == 1 && target.offset() == 0) return new Quantity(values, target);
            return new Quantity(values.mapBounds(target::fromBase), target);
        }

        public Quantity in(Unit target) {
            validateUnit(target);
            if (unit.equals(target)) return this;
            return new Quantity(baseValues().mapBounds(target::fromBase), target);
        }

        private Quantity inOwnUnit(NumericSet baseValues) {
            if (unit.multiplier() == 1 && unit.offset() == 0) return new Quantity(baseValues, unit);
            return new Quantity(baseValues.mapBounds(unit::fromBase), unit);
        }

        private NumericSet baseOf(Literal other) {
            validateKind(other);
            Quantity quantity = other.asQuantity();
            validateUnit(quantity.unit);
            return quantity.baseValues();
        }

        private void validateUnit(Unit other) {
            if (!unit.isCommensurableWith(other)) throw SolverException.of(INCOMMENSURABLE_UNITS, unit, other);
        }

        @Override
        public Kind kind() {
            return Kind.QUANTITY;
        }

        @Override
        public boolean isCanonical() {
            return unit.isCanonical();
        }

        @Override
        public boolean isEmpty() {
            return values.isEmpty();
        }

        @Override
        public boolean isSingleton() {
            return values.isSingleton();
        }

        @Override
        public Double single() {
            return values.single();
        }

        public double min() {
            return values.min();
        }

        public double max() {
            return values.max();
        }

        @Override
        public Quantity union(Literal other) {
            return inOwnUnit(baseValues().union(baseOf(other)));
        }

        @Override
        public Quantity intersect(Literal other) {
            return inOwnUnit(baseValues().intersect(baseOf(other)));
        }

        @Override
        public Quantity difference(Literal other) {
            return inOwnUnit(baseValues().difference(baseOf(other)));
        }

        @Override
        public Quantity symmetricDifference(Literal other) {
            return inOwnUnit(baseValues().symmetricDifference(baseOf(other)));
        }

        @Override
        public boolean isSubsetOf(Literal other) {
            return baseValues().isSubsetOf(baseOf(other));
        }

        public Quantity add(Quantity other) {
            return inOwnUnit(baseValues().add(baseOf(other)));
        }

        public Quantity subtract(Quantity other) {
            return inOwnUnit(baseValues().subtract(baseOf(other)));
        }

        public Quantity negate() {
            return new Quantity(values.negate(), unit);
        }

        public Quantity multiply(Quantity other) {
            Unit product = unit.multiply(other.unit);
            NumericSet base = baseValues().multiply(other.baseValues());
            return inDerivedUnit(base, product);
        }

        private static Quantity inDerivedUnit(NumericSet base, Unit derived) {
            if (derived.multiplier() == 1) return new Quantity(base, derived);
            return new Quantity(base.mapBounds(derived::fromBase), derived);
        }

        public Quantity invert() {
            Unit inverse = unit.power(-1);
            return inDerivedUnit(baseValues().invert(), inverse);
        }

        public Quantity divide(Quantity other) {
            return multiply(other.invert());
        }

        public boolean canRaiseTo(Quantity exponent) {
            if (!exponent.unit.isDimensionless()) return false;
            if (!unit.isCanonical() && !(exponent.isSingleton() && unit.canRaiseTo(exponent.baseValues().single()))) {
                return false;
            }
            return values.canRaiseTo(exponent.baseValues());
        }

        public Quantity power(Quantity exponent) {
            if (!canRaiseTo(exponent)) throw SolverException.of(UNSUPPORTED_OPERATION, "power " + exponent, this);
            Unit powered = unit.isCanonical() ? unit : unit.power(exponent.baseValues().single());
            return inDerivedUnit(baseValues().power(exponent.baseValues()), powered);
        }

        public Quantity round() {
            return new Quantity(values.round(), unit);
        }

        public Quantity abs() {
            return new Quantity(values.abs(), unit);
        }

        public Quantity sin() {
            if (!unit.isDimensionless() && !unit.isCommensurableWith(Units.RADIAN)) {
                throw SolverException.of(UNSUPPORTED_OPERATION, "sin", this);
            }
            return new Quantity(baseValues().sin(), Units.DIMENSIONLESS);
        }

        public boolean canLog() {
            return unit.isDimensionless() && baseValues().canLog();
        }

        public Quantity log() {
            if (!canLog()) throw SolverException.of(UNSUPPORTED_OPERATION, "log", this);
            return new Quantity(baseValues().log(), Units.DIMENSIONLESS);
        }

        public Booleans greaterOrEqual(Quantity other) {
            return baseValues().greaterOrEqual(baseOf(other));
        }

        public Booleans greaterThan(Quantity other) {
            return baseValues().greaterThan(baseOf(other));
        }

        @Override
        public boolean isQuantity() {
            return true;
        }

        @Override
        public Quantity asQuantity() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Quantity that = (Quantity) o;
            return unit.isCommensurableWith(that.unit) && baseValues().equals(that.baseValues());
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return unit.symbol().isEmpty() ? values.toString() : values + " " + unit.symbol();
        }
    }

    public static class Booleans extends Literal {

        public static final Booleans NONE = new Booleans(false, false);
        public static final Booleans TRUE = new Booleans(true, false);
        public static final Booleans FALSE = new Booleans(false, true);
        public static final Booleans ANY = new Booleans(true, true);

        private final boolean canBeTrue;
        private final boolean canBeFalse;

        private Booleans(boolean canBeTrue, boolean canBeFalse) {
            this.canBeTrue = canBeTrue;
            this.canBeFalse = canBeFalse;
        }

        public static Booleans of(boolean canBeTrue, boolean canBeFalse) {
            if (canBeTrue) return canBeFalse ? ANY : TRUE;
            else return canBeFalse ? FALSE : NONE;
        }

        public static Booleans of(boolean value) {
            return value ? TRUE : FALSE;
        }

        public boolean canBeTrue() {
            return canBeTrue;
        }

        public boolean canBeFalse() {
            return canBeFalse;
        }

        public boolean isTrue() {
            return this == TRUE;
        }

        public boolean isFalse() {
            return this == FALSE;
        }

        public Booleans not() {
            return of(canBeFalse, canBeTrue);
        }

        public Booleans or(Booleans other) {
            if (isEmpty() || other.isEmpty()) return NONE;
            return of(canBeTrue || other.canBeTrue, canBeFalse && other.canBeFalse);
        }

        @Override
        public Kind kind() {
            return Kind.BOOLEANS;
        }

        @Override
        public boolean isEmpty() {
            return this == NONE;
        }

        @Override
        public boolean isSingleton() {
            return this == TRUE || this == FALSE;
        }

        @Override
        public Boolean single() {
            if (!isSingleton()) throw SolverException.of(NOT_SINGLETON, this);
            return canBeTrue;
        }

        @Override
        public Booleans union(Literal other) {
            validateKind(other);
            Booleans that = other.asBooleans();
            return of(canBeTrue || that.canBeTrue, canBeFalse || that.canBeFalse);
        }

        @Override
        public Booleans intersect(Literal other) {
            validateKind(other);
            Booleans that = other.asBooleans();
            return of(canBeTrue && that.canBeTrue, canBeFalse && that.canBeFalse);
        }

        @Override
        public Booleans difference(Literal other) {
            validateKind(other);
            Booleans that = other.asBooleans();
            return of(canBeTrue && !that.canBeTrue, canBeFalse && !that.canBeFalse);
        }

        @Override
        public boolean isSubsetOf(Literal other) {
            validateKind(other);
            Booleans that = other.asBooleans();
            return (!canBeTrue || that.canBeTrue) && (!canBeFalse || that.canBeFalse);
        }

        @Override
        public boolean isBooleans() {
            return true;
        }

        @Override
        public Booleans asBooleans() {
            return this;
        }

        @Override
        public String toString() {
            if (this == NONE) return "{}";
            if (this == ANY) return "{false, true}";
            return "{" + canBeTrue + "}";
        }
    }

    public static class Enums extends Literal {

        private final EnumType type;
        private final Set<EnumType.Member> members;
        private final int hash;

        private Enums(EnumType type, Collection<EnumType.Member> members) {
            this.type = type;
            this.members = unmodifiableSet(new TreeSet<>(members));
            this.hash = Objects.hash(type.name(), this.members);
        }

        public static Enums of(EnumType.Member... members) {
            if (members.length == 0) throw SolverException.of(ILLEGAL_ARGUMENT);
            EnumType type = members[0].type();
            for (EnumType.Member member : members) {
                if (member.type() != type) throw SolverException.of(KIND_MISMATCH, type, member.type());
            }
            return new Enums(type, Arrays.asList(members));
        }

        public static Enums all(EnumType type) {
            return new Enums(type, type.members());
        }

        public static Enums none(EnumType type) {
            return new Enums(type, Set.of());
        }

        public EnumType type() {
            return type;
        }

        public Set<EnumType.Member> members() {
            return members;
        }

        private Set<EnumType.Member> membersOf(Literal other) {
            validateKind(other);
            Enums that = other.asEnums();
            if (that.type != type) throw SolverException.of(KIND_MISMATCH, type, that.type);
            return that.members;
        }

        @Override
        public Kind kind() {
            return Kind.ENUMS;
        }

        @Override
        public boolean isEmpty() {
            return members.isEmpty();
        }

        @Override
        public boolean isSingleton() {
            return members.size() == 1;
        }

        @Override
        public EnumType.Member single() {
            if (!isSingleton()) throw SolverException.of(NOT_SINGLETON, this);
            return members.iterator().next();
        }

        @Override
        public Enums union(Literal other) {
            Set<EnumType.Member> union = new TreeSet<>(members);
            union.addAll(membersOf(other));
            return new Enums(type, union);
        }

        @Override
        public Enums intersect(Literal other) {
            Set<EnumType.Member> intersection = new TreeSet<>(members);
            intersection.retainAll(membersOf(other));
            return new Enums(type, intersection);
        }

        @Override
        public Enums difference(Literal other) {
            Set<EnumType.Member> difference = new TreeSet<>(members);
            difference.removeAll(membersOf(other));
            return new Enums(type, difference);
        }

        @Override
        public boolean isSubsetOf(Literal other) {
            return membersOf(other).containsAll(members);
        }

        @Override
        public boolean isEnums() {
            return true;
        }

        @Override
        public Enums asEnums() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Enums that = (Enums) o;
            return type == that.type && members.equals(that.members);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return members.stream().map(EnumType.Member::toString).collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * A finite set of strings, or the set of all strings. Operations that would need a complement of a
     * finite set keep the universal set, which over-approximates.
     */
    public static class Strings extends Literal {

        public static final Strings ALL = new Strings(true, Set.of());

        private final boolean universal;
        private final Set<String> values;
        private final int hash;

        private Strings(boolean universal, Collection<String> values) {
            this.universal = universal;
            this.values = unmodifiableSet(new TreeSet<>(values));
            this.hash = Objects.hash(universal, this.values);
        }

        public static Strings of(String... values) {
            return new Strings(false, Arrays.asList(values));
        }

        public boolean isUniversal() {
            return universal;
        }

        public Set<String> values() {
            return values;
        }

        @Override
        public Kind kind() {
            return Kind.STRINGS;
        }

        @Override
        public boolean isEmpty() {
            return !universal && values.isEmpty();
        }

        @Override
        public boolean isSingleton() {
            return !universal && values.size() == 1;
        }

        @Override
        public String single() {
            if (!isSingleton()) throw SolverException.of(NOT_SINGLETON, this);
            return values.iterator().next();
        }

        @Override
        public Strings union(Literal other) {
            validateKind(other);
            Strings that = other.asStrings();
            if (universal || that.universal) return ALL;
            Set<String> union = new TreeSet<>(values);
            union.addAll(that.values);
            return new Strings(false, union);
        }

        @Override
        public Strings intersect(Literal other) {
            validateKind(other);
            Strings that = other.asStrings();
            if (universal) return that;
            if (that.universal) return this;
            Set<String> intersection = new TreeSet<>(values);
            intersection.retainAll(that.values);
            return new Strings(false, intersection);
        }

        @Override
        public Strings difference(Literal other) {
            validateKind(other);
            Strings that = other.asStrings();
            if (that.universal) return new Strings(false, Set.of());
            if (universal) return ALL;
            Set<String> difference = new TreeSet<>(values);
            difference.removeAll(that.values);
            return new Strings(false, difference);
        }

        @Override
        public boolean isSubsetOf(Literal other) {
            validateKind(other);
            Strings that = other.asStrings();
            if (that.universal) return true;
            return !universal && that.values.containsAll(values);
        }

        @Override
        public boolean isStrings() {
            return true;
        }

        @Override
        public Strings asStrings() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Strings that = (Strings) o;
            return universal == that.universal && values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            if (universal) return "{*}";
            return values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", ", "{", "}"));
        }
    }
}
