/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.Unit;

import java.util.Objects;
import javax.annotation.Nullable;

public class LiteralNode extends Node {

    private final Literal literal;
    @Nullable
    private final Unit strippedUnit;
    private final int hash;

    private LiteralNode(Literal literal, @Nullable Unit strippedUnit) {
        this.literal = literal;
        this.strippedUnit = strippedUnit;
        this.hash = Objects.hash(literal, strippedUnit);
    }

    public static LiteralNode of(Literal literal) {
        return new LiteralNode(literal, null);
    }

    public static LiteralNode canonical(Literal literal, Unit strippedUnit) {
        return new LiteralNode(literal, strippedUnit);
    }

    public Literal literal() {
        return literal;
    }

    /**
     * The unit the literal carried before it was converted to canonical form, if it had one.
     */
    @Nullable
    public Unit strippedUnit() {
        return strippedUnit;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public LiteralNode asLiteral() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LiteralNode that = (LiteralNode) o;
        return literal.equals(that.literal) && Objects.equals(strippedUnit, that.strippedUnit);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return literal.toString();
    }
}
