/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;

import java.util.Arrays;
import java.util.Objects;

import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.NON_INTEGRAL_UNIT_POWER;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.UNIT_WITH_OFFSET;

/**
 * A physical unit: an exponent vector over the SI base dimensions, a multiplier relative to the
 * coherent SI unit of the same dimension, and an additive offset (for units such as degree Celsius).
 * A value {@code v} in this unit equals {@code v * multiplier + offset} in base units.
 */
public class Unit {

    public enum Dimension {
        AMPERE("A"), SECOND("s"), METER("m"), KILOGRAM("kg"), KELVIN("K"),
        MOLE("mol"), CANDELA("cd"), RADIAN("rad"), STERADIAN("sr"), BIT("bit");

        private final String symbol;

        Dimension(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private static final int DIMENSIONS = Dimension.values().length;

    private final int[] basis;
    private final double multiplier;
    private final double offset;
    private final String symbol;
    private final int hash;

    Unit(int[] basis, double multiplier, double offset, String symbol) {
        assert basis.length == DIMENSIONS;
        this.basis = basis;
        this.multiplier = multiplier;
        this.offset = offset;
        this.symbol = symbol;
        this.hash = Objects.hash(Arrays.hashCode(basis), multiplier, offset);
    }

    static Unit dimensionless(double multiplier, String symbol) {
        return new Unit(new int[DIMENSIONS], multiplier, 0, symbol);
    }

    static Unit of(Dimension dimension, String symbol) {
        int[] basis = new int[DIMENSIONS];
        basis[dimension.ordinal()] = 1;
        return new Unit(basis, 1, 0, symbol);
    }

    public int exponent(Dimension dimension) {
        return basis[dimension.ordinal()];
    }

    public double multiplier() {
        return multiplier;
    }

    public double offset() {
        return offset;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isDimensionless() {
        for (int e : basis) if (e != 0) return false;
        return true;
    }

    /**
     * The plain dimensionless unit: multiplier one, no offset. Canonical quantities are stored in it.
     */
    public boolean isCanonical() {
        return isDimensionless() && multiplier == 1 && offset == 0;
    }

    public boolean isCommensurableWith(Unit other) {
        return Arrays.equals(basis, other.basis);
    }

    public Unit base() {
        if (multiplier == 1 && offset == 0) return this;
        return new Unit(basis, 1, 0, baseSymbol(basis));
    }

    public Unit named(String symbol) {
        return new Unit(basis, multiplier, offset, symbol);
    }

    public Unit scaled(double factor, String symbol) {
        if (offset != 0) throw SolverException.of(UNIT_WITH_OFFSET, this.symbol);
        return new Unit(basis, multiplier * factor, 0, symbol);
    }

    public Unit withOffset(double offset, String symbol) {
        return new Unit(basis, multiplier, offset, symbol);
    }

    public Unit multiply(Unit other) {
        if (offset != 0) throw SolverException.of(UNIT_WITH_OFFSET, symbol);
        if (other.offset != 0) throw SolverException.of(UNIT_WITH_OFFSET, other.symbol);
        if (isCanonical()) return other;
        if (other.isCanonical()) return this;
        int[] product = new int[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) product[i] = basis[i] + other.basis[i];
        return new Unit(product, multiplier * other.multiplier, 0, symbol + "*" + other.symbol);
    }

    public Unit divide(Unit other) {
        return multiply(other.power(-1));
    }

    public boolean canRaiseTo(double exponent) {
        if (offset != 0 && exponent != 1) return false;
        for (int e : basis) {
            if (e * exponent != Math.rint(e * exponent)) return false;
        }
        return true;
    }

    public Unit power(double exponent) {
        if (exponent == 1) return this;
        if (offset != 0) throw SolverException.of(UNIT_WITH_OFFSET, symbol);
        if (isCanonical()) return this;
        int[] powered = new int[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            double e = basis[i] * exponent;
            if (e != Math.rint(e)) throw SolverException.of(NON_INTEGRAL_UNIT_POWER, symbol, exponent);
            powered[i] = (int) e;
        }
        String exp = exponent == Math.rint(exponent) ? String.valueOf((long) exponent) : String.valueOf(exponent);
        return new Unit(powered, Math.pow(multiplier, exponent), 0, symbol + "^" + exp);
    }

    public double toBase(double value) {
        if (Double.isInfinite(value)) return value;
        return value * multiplier + offset;
    }

    public double fromBase(double value) {
        if (Double.isInfinite(value)) return value;
        return (value - offset) / multiplier;
    }

    private static String baseSymbol(int[] basis) {
        StringBuilder symbol = new StringBuilder();
        for (Dimension d : Dimension.values()) {
            int e = basis[d.ordinal()];
            if (e == 0) continue;
            if (symbol.length() > 0) symbol.append("*");
            symbol.append(d.symbol());
            if (e != 1) symbol.append("^").append(e);
        }
        return symbol.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Unit that = (Unit) o;
        return Arrays.equals(basis, that.basis) && multiplier == that.multiplier && offset == that.offset;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
