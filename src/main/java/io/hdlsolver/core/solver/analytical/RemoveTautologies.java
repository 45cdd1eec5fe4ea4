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
import io.hdlsolver.core.solver.LiteralEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes holding predicates that cannot fail: reflexive ones, those over literals that evaluate to
 * true, and subset bounds no narrower than the parameter's domain.
 */
public class RemoveTautologies implements Algorithm {

    @Override
    public String name() {
        return "remove-tautologies";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.expressionsByDepth()) {
            Operator operator = input.expression(id).operator();
            if (!operator.isPredicate() || !input.holds(id) || input.isAliasToTrue(id)) continue;
            if (isTautology(input, id, operator)) mutator.remove(id);
        }
    }

    private static boolean isTautology(Generation input, NodeId id, Operator operator) {
        List<NodeId> operands = input.operands(id);
        if (operands.get(0).equals(operands.get(1))) return true;
        List<Literal> literals = new ArrayList<>();
        for (NodeId op : operands) input.literal(op).ifPresent(literals::add);
        if (literals.size() == operands.size()) {
            Optional<Literal> result = LiteralEvaluator.evaluate(operator, literals);
            return result.isPresent() && result.get().equals(Literal.Booleans.TRUE);
        }
        if (operator == Operator.IS_SUBSET && input.node(operands.get(0)).isParameter() && literals.size() == 1) {
            Literal bound = literals.get(0);
            Literal universe = input.parameter(operands.get(0)).domain().universe();
            return bound.isCanonical() && bound.kind() == universe.kind() && universe.isSubsetOf(bound);
        }
        return false;
    }
}
