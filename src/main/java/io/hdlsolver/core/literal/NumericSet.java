/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.literal;

import io.hdlsolver.core.common.exception.SolverException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.NOT_SINGLETON;
import static io.hdlsolver.core.common.exception.ErrorMessage.Literal.UNSUPPORTED_OPERATION;
import static java.util.Collections.unmodifiableList;

/**
 * A finite union of disjoint closed intervals, kept sorted with overlapping and touching
 * intervals merged. Every operation returns a normalised set.
 */
public class NumericSet {

    private static final NumericSet EMPTY = new NumericSet(new ArrayList<>());
    private static final NumericSet UNBOUNDED = new NumericSet(new ArrayList<>(List.of(Interval.unbounded())));

    private final List<Interval> intervals;
    private final int hash;

    private NumericSet(List<Interval> normalised) {
        this.intervals = unmodifiableList(normalised);
        this.hash = intervals.hashCode();
    }

    public static NumericSet empty() {
        return EMPTY;
    }

    public static NumericSet unbounded() {
        return UNBOUNDED;
    }

    public static NumericSet nonNegative() {
        return of(Interval.atLeast(0));
    }

    public static NumericSet single(double value) {
        return of(Interval.single(value));
    }

    public static NumericSet closed(double min, double max) {
        return of(Interval.of(min, max));
    }

    public static NumericSet of(Interval... intervals) {
        return of(Arrays.asList(intervals));
    }

    public static NumericSet of(Collection<Interval> intervals) {
        if (intervals.isEmpty()) return EMPTY;
        List<Interval> sorted = new ArrayList<>(intervals);
        sorted.sort(null);
        List<Interval> merged = new ArrayList<>();
        Interval current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            Interval next = sorted.get(i);
            if (next.min() <= current.max()) {
                current = Interval.of(current.min(), Math.max(current.max(), next.max()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return new NumericSet(merged);
    }

    public List<Interval> intervals() {
        return intervals;
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public boolean isSingleton() {
        return intervals.size() == 1 && intervals.get(0).isSingleton();
    }

    public double single() {
        if (!isSingleton()) throw SolverException.of(NOT_SINGLETON, this);
        return intervals.get(0).min();
    }

    public boolean isUnbounded() {
        return equals(UNBOUNDED);
    }

    public double min() {
        if (isEmpty()) throw SolverException.of(UNSUPPORTED_OPERATION, "min", this);
        return intervals.get(0).min();
    }

    public double max() {
        if (isEmpty()) throw SolverException.of(UNSUPPORTED_OPERATION, "max", this);
        return intervals.get(intervals.size() - 1).max();
    }

    public boolean contains(double value) {
        for (Interval interval : intervals) {
            if (interval.contains(value)) return true;
        }
        return false;
    }

    public double closest(double target) {
        if (isEmpty()) throw SolverException.of(UNSUPPORTED_OPERATION, "closest", this);
        double best = Double.NaN;
        double distance = Double.POSITIVE_INFINITY;
        for (Interval interval : intervals) {
            double candidate = Math.max(interval.min(), Math.min(interval.max(), target));
            double d = Math.abs(candidate - target);
            if (d < distance) {
                best = candidate;
                distance = d;
            }
        }
        return best;
    }

    public boolean isSubsetOf(NumericSet other) {
        for (Interval interval : intervals) {
            boolean covered = false;
            for (Interval candidate : other.intervals) {
                if (candidate.contains(interval)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) return false;
        }
        return true;
    }

    public boolean isSupersetOf(NumericSet other) {
        return other.isSubsetOf(this);
    }

    public NumericSet union(NumericSet other) {
        if (isEmpty()) return other;
        if (other.isEmpty()) return this;
        List<Interval> all = new ArrayList<>(intervals);
        all.addAll(other.intervals);
        return of(all);
    }

    public NumericSet intersect(NumericSet other) {
        List<Interval> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < intervals.size() && j < other.intervals.size()) {
            Interval a = intervals.get(i);
            Interval b = other.intervals.get(j);
            if (a.overlaps(b)) result.add(Interval.of(Math.max(a.min(), b.min()), Math.min(a.max(), b.max())));
            if (a.max() < b.max()) i++;
            else j++;
        }
        return of(result);
    }

    /**
     * Set difference over closed intervals. Shared boundary points are kept, so the result is a
     * closed over-approximation of the exact difference.
     */
    public NumericSet difference(NumericSet other) {
        List<Interval> remaining = new ArrayList<>(intervals);
        for (Interval cut : other.intervals) {
            List<Interval> next = new ArrayList<>();
            for (Interval piece : remaining) {
                if (!piece.overlaps(cut)) {
                    next.add(piece);
                    continue;
                }
                if (piece.min() < cut.min()) next.add(Interval.of(piece.min(), cut.min()));
                if (piece.max() > cut.max()) next.add(Interval.of(cut.max(), piece.max()));
            }
            remaining = next;
        }
        return of(remaining);
    }

    public NumericSet symmetricDifference(NumericSet other) {
        return difference(other).union(other.difference(this));
    }

    public NumericSet add(NumericSet other) {
        return pairwise(other, Interval::add);
    }

    public NumericSet negate() {
        return map(i -> of(i.negate()));
    }

    public NumericSet subtract(NumericSet other) {
        return add(other.negate());
    }

    public NumericSet multiply(NumericSet other) {
        return pairwise(other, Interval::multiply);
    }

    public NumericSet invert() {
        return map(NumericSet::invert);
    }

    private static NumericSet invert(Interval i) {
        if (i.min() == 0 && i.max() == 0) return EMPTY;
        if (i.min() == 0) return of(Interval.atLeast(1 / i.max()));
        if (i.max() == 0) return of(Interval.atMost(1 / i.min()));
        if (i.min() < 0 && i.max() > 0) return of(Interval.atMost(1 / i.min()), Interval.atLeast(1 / i.max()));
        return of(Interval.of(1 / i.max(), 1 / i.min()));
    }

    public NumericSet divide(NumericSet other) {
        return multiply(other.invert());
    }

    public boolean canRaiseTo(NumericSet exponent) {
        for (Interval base : intervals) {
            for (Interval e : exponent.intervals) {
                if (base.min() < 0 && !isIntegerSingleton(e)) return false;
            }
        }
        return true;
    }

    public NumericSet power(NumericSet exponent) {
        if (!canRaiseTo(exponent)) throw SolverException.of(UNSUPPORTED_OPERATION, "power " + exponent, this);
        NumericSet result = EMPTY;
        for (Interval base : intervals) {
            for (Interval e : exponent.intervals) result = result.union(power(base, e));
        }
        return result;
    }

    private static NumericSet power(Interval base, Interval exponent) {
        if (exponent.min() < 0 && exponent.max() <= 0) return power(base, exponent.negate()).invert();
        if (exponent.min() < 0) {
            return power(base, Interval.of(exponent.min(), 0)).union(power(base, Interval.of(0, exponent.max())));
        }
        if (isIntegerSingleton(exponent)) {
            double n = exponent.min();
            if (n == 0) return single(1);
            double lo = Math.pow(base.min(), n);
            double hi = Math.pow(base.max(), n);
            if (n % 2 == 1 || base.min() >= 0) return of(Interval.of(Math.min(lo, hi), Math.max(lo, hi)));
            if (base.max() <= 0) return of(Interval.of(hi, lo));
            return of(Interval.of(0, Math.max(lo, hi)));
        }
        double[] corners = {
                Math.pow(base.min(), exponent.min()), Math.pow(base.min(), exponent.max()),
                Math.pow(base.max(), exponent.min()), Math.pow(base.max(), exponent.max())
        };
        double lo = corners[0];
        double hi = corners[0];
        for (double c : corners) {
            lo = Math.min(lo, c);
            hi = Math.max(hi, c);
        }
        return of(Interval.of(lo, hi));
    }

    private static boolean isIntegerSingleton(Interval interval) {
        return interval.isSingleton() && interval.min() == Math.rint(interval.min()) && interval.isBounded();
    }

    /**
     * Rounds to the nearest integer. An exact tie rounds to both neighbours: the lower bound of an
     * interval rounds half-down and the upper bound half-up, and a tied singleton becomes two points.
     */
    public NumericSet round() {
        return map(i -> {
            double lo = Math.ceil(i.min() - 0.5);
            double hi = Math.floor(i.max() + 0.5);
            if (i.isSingleton() && lo != hi) return of(Interval.single(lo), Interval.single(hi));
            return of(Interval.of(lo, hi));
        });
    }

    public NumericSet abs() {
        return map(i -> of(i.abs()));
    }

    public NumericSet sin() {
        return map(i -> of(i.sin()));
    }

    public boolean canLog() {
        return isEmpty() || min() >= 0;
    }

    public NumericSet log() {
        if (!canLog()) throw SolverException.of(UNSUPPORTED_OPERATION, "log", this);
        return map(i -> {
            if (i.max() == 0) return EMPTY;
            return of(Interval.of(Math.log(i.min()), Math.log(i.max())));
        });
    }

    /**
     * The possible outcomes of {@code this >= other} for some choice of values in each set.
     */
    public Literal.Booleans greaterOrEqual(NumericSet other) {
        if (isEmpty() || other.isEmpty()) return Literal.Booleans.NONE;
        boolean canHold = max() >= other.min();
        boolean canFail = min() < other.max();
        return Literal.Booleans.of(canHold, canFail);
    }

    public Literal.Booleans greaterThan(NumericSet other) {
        if (isEmpty() || other.isEmpty()) return Literal.Booleans.NONE;
        boolean canHold = max() > other.min();
        boolean canFail = min() <= other.max();
        return Literal.Booleans.of(canHold, canFail);
    }

    public NumericSet mapBounds(Function<Double, Double> monotonicIncreasing) {
        return map(i -> of(Interval.of(monotonicIncreasing.apply(i.min()), monotonicIncreasing.apply(i.max()))));
    }

    private NumericSet map(Function<Interval, NumericSet> function) {
        NumericSet result = EMPTY;
        for (Interval interval : intervals) result = result.union(function.apply(interval));
        return result;
    }

    private NumericSet pairwise(NumericSet other, BinaryOperator<Interval> operator) {
        List<Interval> result = new ArrayList<>();
        for (Interval a : intervals) {
            for (Interval b : other.intervals) result.add(operator.apply(a, b));
        }
        return of(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return intervals.equals(((NumericSet) o).intervals);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (isEmpty()) return "{}";
        return intervals.stream().map(Interval::toString).collect(Collectors.joining(" | "));
    }
}
