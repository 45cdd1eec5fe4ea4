/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.Unit;
import io.hdlsolver.core.literal.Units;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * An unknown of the design, e.g. a resistance or a supply voltage.
 */
public class ParameterNode extends Node {

    private final String name;
    private final Domain domain;
    private final Unit unit;
    @Nullable
    private final Literal within;
    @Nullable
    private final Literal softSet;
    @Nullable
    private final Literal guess;
    private final boolean likelyConstrained;
    private final boolean boundsLowered;
    private final int hash;

    private ParameterNode(String name, Domain domain, Unit unit, @Nullable Literal within, @Nullable Literal softSet,
                          @Nullable Literal guess, boolean likelyConstrained, boolean boundsLowered) {
        this.name = name;
        this.domain = domain;
        this.unit = unit;
        this.within = within;
        this.softSet = softSet;
        this.guess = guess;
        this.likelyConstrained = likelyConstrained;
        this.boundsLowered = boundsLowered;
        this.hash = Objects.hash(name, domain, unit, within, softSet, guess, likelyConstrained, boundsLowered);
    }

    public static ParameterNode of(Domain domain) {
        return of(domain, Units.DIMENSIONLESS);
    }

    public static ParameterNode of(Domain domain, Unit unit) {
        return new ParameterNode(null, domain, unit, null, null, null, false, false);
    }

    @Nullable
    public String name() {
        return name;
    }

    public Domain domain() {
        return domain;
    }

    public Unit unit() {
        return unit;
    }

    @Nullable
    public Literal within() {
        return within;
    }

    @Nullable
    public Literal softSet() {
        return softSet;
    }

    @Nullable
    public Literal guess() {
        return guess;
    }

    public boolean isLikelyConstrained() {
        return likelyConstrained;
    }

    /**
     * Whether the domain and {@code within} bounds have already been turned into subset constraints.
     */
    public boolean boundsLowered() {
        return boundsLowered;
    }

    public ParameterNode withName(String name) {
        return new ParameterNode(name, domain, unit, within, softSet, guess, likelyConstrained, boundsLowered);
    }

    public ParameterNode withWithin(@Nullable Literal within) {
        return new ParameterNode(name, domain, unit, within, softSet, guess, likelyConstrained, boundsLowered);
    }

    public ParameterNode withSoftSet(@Nullable Literal softSet) {
        return new ParameterNode(name, domain, unit, within, softSet, guess, likelyConstrained, boundsLowered);
    }

    public ParameterNode withGuess(@Nullable Literal guess) {
        return new ParameterNode(name, domain, unit, within, softSet, guess, likelyConstrained, boundsLowered);
    }

    public ParameterNode withLikelyConstrained(boolean likelyConstrained) {
        return new ParameterNode(name, domain, unit, within, softSet, guess, likelyConstrained, boundsLowered);
    }

    public ParameterNode withBoundsLowered() {
        return new ParameterNode(name, domain, unit, null, softSet, guess, likelyConstrained, true);
    }

    @Override
    public boolean isParameter() {
        return true;
    }

    @Override
    public ParameterNode asParameter() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterNode that = (ParameterNode) o;
        return likelyConstrained == that.likelyConstrained && boundsLowered == that.boundsLowered &&
                Objects.equals(name, that.name) && domain.equals(that.domain) && unit.equals(that.unit) &&
                Objects.equals(within, that.within) && Objects.equals(softSet, that.softSet) &&
                Objects.equals(guess, that.guess);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder(name == null ? "?" : name).append(": ").append(domain);
        if (!unit.symbol().isEmpty()) str.append(" ").append(unit);
        if (within != null) str.append(" within ").append(within);
        if (softSet != null) str.append(" soft ").append(softSet);
        if (guess != null) str.append(" guess ").append(guess);
        return str.toString();
    }
}
