/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import java.util.Objects;

public class ExpressionNode extends Node {

    private final Operator operator;
    private final boolean asserted;
    private final int hash;

    private ExpressionNode(Operator operator, boolean asserted) {
        this.operator = operator;
        this.asserted = asserted;
        this.hash = Objects.hash(operator, asserted);
    }

    public static ExpressionNode of(Operator operator) {
        return new ExpressionNode(operator, false);
    }

    public static ExpressionNode asserted(Operator operator) {
        return new ExpressionNode(operator, true);
    }

    public Operator operator() {
        return operator;
    }

    /**
     * Whether the expression must hold, i.e. it is a constraint rather than a value.
     */
    public boolean isAsserted() {
        return asserted;
    }

    public ExpressionNode withAsserted(boolean asserted) {
        if (asserted == this.asserted) return this;
        return new ExpressionNode(operator, asserted);
    }

    @Override
    public boolean isExpression() {
        return true;
    }

    @Override
    public ExpressionNode asExpression() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpressionNode that = (ExpressionNode) o;
        return operator == that.operator && asserted == that.asserted;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return asserted ? operator.symbol() + "!" : operator.symbol();
    }
}
