/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;

import java.util.Objects;

import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.INVALID_INTERVAL;

/**
 * A closed interval of reals. Either bound may be infinite on its own side.
 */
public class Interval implements Comparable<Interval> {

    private final double min;
    private final double max;
    private final int hash;

    private Interval(double min, double max) {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max ||
                min == Double.POSITIVE_INFINITY || max == Double.NEGATIVE_INFINITY) {
            throw SolverException.of(INVALID_INTERVAL, min, max);
        }
        // normalises -0.0
        this.min = min + 0.0;
        this.max = max + 0.0;
        this.hash = Objects.hash(this.min, this.max);
    }

    public static Interval of(double min, double max) {
        return new Interval(min, max);
    }

    public static Interval single(double value) {
        return new Interval(value, value);
    }

    public static Interval unbounded() {
        return new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public static Interval atLeast(double min) {
        return new Interval(min, Double.POSITIVE_INFINITY);
    }

    public static Interval atMost(double max) {
        return new Interval(Double.NEGATIVE_INFINITY, max);
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public boolean isSingleton() {
        return min == max;
    }

    public boolean isBounded() {
        return !Double.isInfinite(min) && !Double.isInfinite(max);
    }

    public boolean contains(double value) {
        return min <= value && value <= max;
    }

    public boolean contains(Interval other) {
        return min <= other.min && other.max <= max;
    }

    public boolean overlaps(Interval other) {
        return min <= other.max && other.min <= max;
    }

    Interval add(Interval other) {
        return new Interval(min + other.min, max + other.max);
    }

    Interval negate() {
        return new Interval(-max, -min);
    }

    Interval multiply(Interval other) {
        double[] products = {
                guardedProduct(min, other.min), guardedProduct(min, other.max),
                guardedProduct(max, other.min), guardedProduct(max, other.max)
        };
        double lo = products[0];
        double hi = products[0];
        for (double p : products) {
            lo = Math.min(lo, p);
            hi = Math.max(hi, p);
        }
        return new Interval(lo, hi);
    }

    private static double guardedProduct(double a, double b) {
        if (a == 0 || b == 0) return 0;
        return a * b;
    }

    Interval abs() {
        if (min >= 0) return this;
        if (max <= 0) return negate();
        return new Interval(0, Math.max(-min, max));
    }

    Interval sin() {
        if (!isBounded() || max - min >= 2 * Math.PI) return new Interval(-1, 1);
        double lo = Math.min(Math.sin(min), Math.sin(max));
        double hi = Math.max(Math.sin(min), Math.sin(max));
        if (containsPhase(Math.PI / 2)) hi = 1;
        if (containsPhase(-Math.PI / 2)) lo = -1;
        return new Interval(lo, hi);
    }

    private boolean containsPhase(double phase) {
        double k = Math.ceil((min - phase) / (2 * Math.PI));
        return phase + k * 2 * Math.PI <= max;
    }

    @Override
    public int compareTo(Interval other) {
        int cmp = Double.compare(min, other.min);
        return cmp != 0 ? cmp : Double.compare(max, other.max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Interval that = (Interval) o;
        return min == that.min && max == that.max;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (isSingleton()) return "{" + format(min) + "}";
        return "[" + format(min) + ", " + format(max) + "]";
    }

    static String format(double value) {
        if (value == Double.POSITIVE_INFINITY) return "inf";
        if (value == Double.NEGATIVE_INFINITY) return "-inf";
        if (value == Math.rint(value) && Math.abs(value) < 1e15) return String.valueOf((long) value);
        return String.valueOf(value);
    }
}
