/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.canonical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;

import java.util.List;

/**
 * Rewrites every asserted predicate {@code e} into {@code Is(e, true)}, asserted, and clears the flag
 * on {@code e}. Afterwards "must hold" is expressed in exactly one way.
 */
public class AliasPredicatesToTrue implements Algorithm {

    @Override
    public String name() {
        return "alias-predicates-to-true";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.expressionsByDepth()) {
            if (!input.expression(id).isAsserted() || input.isAliasToTrue(id)) continue;
            NodeId predicate = mutator.mutateExpression(id, false);
            NodeId isTrue = mutator.createLiteral(Literal.Booleans.TRUE, List.of(id));
            mutator.createExpression(Operator.IS, List.of(predicate, isTrue), true, List.of(id));
        }
    }
}
