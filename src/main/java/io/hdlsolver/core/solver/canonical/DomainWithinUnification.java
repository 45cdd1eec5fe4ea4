/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.canonical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.graph.ParameterNode;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;

import java.util.List;

/**
 * Lowers the declared domain and the {@code within} bound of every parameter into explicit
 * {@code p ⊆ literal} constraints, so that later passes see a single kind of bound.
 */
public class DomainWithinUnification implements Algorithm {

    @Override
    public String name() {
        return "domain-within-unification";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.parameters()) {
            ParameterNode parameter = input.parameter(id);
            if (parameter.boundsLowered()) continue;
            if (parameter.domain().isBounding()) constrainSubset(mutator, id, parameter.domain().universe());
            if (parameter.within() != null) constrainSubset(mutator, id, parameter.within());
            mutator.mutateParameter(id, parameter.withBoundsLowered());
        }
    }

    private static void constrainSubset(Mutator mutator, NodeId parameter, Literal bound) {
        NodeId literal = mutator.createLiteral(bound, List.of(parameter));
        mutator.createExpression(Operator.IS_SUBSET, List.of(parameter, literal), true, List.of(parameter));
    }
}
