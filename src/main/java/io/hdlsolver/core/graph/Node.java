/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import io.hdlsolver.core.common.exception.SolverException;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * Payload of a node in a generation. Payloads are immutable and hold no edges: operands live in the
 * edge table of the {@link Generation}, so an unchanged payload is shared by consecutive generations.
 */
public abstract class Node {

    public boolean isParameter() {
        return false;
    }

    public ParameterNode asParameter() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), ParameterNode.class.getSimpleName());
    }

    public boolean isExpression() {
        return false;
    }

    public ExpressionNode asExpression() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), ExpressionNode.class.getSimpleName());
    }

    public boolean isLiteral() {
        return false;
    }

    public LiteralNode asLiteral() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), LiteralNode.class.getSimpleName());
    }

    public boolean isConstant() {
        return false;
    }

    public ConstantNode asConstant() {
        throw SolverException.of(ILLEGAL_CAST, getClass().getSimpleName(), ConstantNode.class.getSimpleName());
    }
}
