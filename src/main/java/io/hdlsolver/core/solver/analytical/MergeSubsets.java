/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.analytical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collapses all holding {@code p ⊆ L_i} constraints of one parameter into a single {@code p ⊆ ∩ L_i}
 * that carries the provenance of every constraint it replaces.
 */
public class MergeSubsets implements Algorithm {

    @Override
    public String name() {
        return "merge-subsets";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId parameter : input.parameters()) {
            Literal.Kind kind = input.parameter(parameter).domain().kind();
            List<NodeId> subsets = new ArrayList<>();
            Literal intersection = null;
            for (NodeId user : input.users(parameter)) {
                Optional<Literal> bound = subsetBound(input, parameter, user);
                if (bound.isEmpty() || bound.get().kind() != kind) continue;
                subsets.add(user);
                intersection = intersection == null ? bound.get() : intersection.intersect(bound.get());
            }
            if (subsets.size() < 2) continue;
            NodeId literal = mutator.createLiteral(intersection, subsets);
            mutator.createExpression(Operator.IS_SUBSET, List.of(parameter, literal), true, subsets);
            subsets.forEach(mutator::remove);
        }
    }

    static Optional<Literal> subsetBound(Generation input, NodeId parameter, NodeId user) {
        if (!input.isOperator(user, Operator.IS_SUBSET) || !input.holds(user)) return Optional.empty();
        List<NodeId> operands = input.operands(user);
        if (!operands.get(0).equals(parameter)) return Optional.empty();
        return input.literal(operands.get(1)).filter(Literal::isCanonical);
    }
}
