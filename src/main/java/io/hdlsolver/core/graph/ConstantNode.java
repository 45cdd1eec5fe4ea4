/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import io.hdlsolver.core.literal.EnumType;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.Unit;
import io.hdlsolver.core.literal.Units;

import java.util.Objects;

/**
 * A raw constant as written in the source, before canonicalization turns it into a {@link LiteralNode}.
 */
public class ConstantNode extends Node {

    private final Object value;
    private final Unit unit;
    private final int hash;

    private ConstantNode(Object value, Unit unit) {
        this.value = value;
        this.unit = unit;
        this.hash = Objects.hash(value, unit);
    }

    public static ConstantNode of(double value, Unit unit) {
        return new ConstantNode(value, unit);
    }

    public static ConstantNode of(boolean value) {
        return new ConstantNode(value, Units.DIMENSIONLESS);
    }

    public static ConstantNode of(EnumType.Member value) {
        return new ConstantNode(value, Units.DIMENSIONLESS);
    }

    public static ConstantNode of(String value) {
        return new ConstantNode(value, Units.DIMENSIONLESS);
    }

    public Object value() {
        return value;
    }

    public Unit unit() {
        return unit;
    }

    /**
     * The singleton literal of this constant, still in its source unit.
     */
    public Literal toLiteral() {
        if (value instanceof Double) return Literal.quantity((Double) value, unit);
        else if (value instanceof Boolean) return Literal.Booleans.of((Boolean) value);
        else if (value instanceof EnumType.Member) return Literal.Enums.of((EnumType.Member) value);
        else return Literal.Strings.of((String) value);
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public ConstantNode asConstant() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstantNode that = (ConstantNode) o;
        return value.equals(that.value) && unit.equals(that.unit);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return unit.symbol().isEmpty() ? String.valueOf(value) : value + " " + unit;
    }
}
