/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.analytical;

import io.hdlsolver.core.graph.ExpressionNode;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;
import io.hdlsolver.core.solver.LiteralEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces expressions over literals by the literal they evaluate to. Constraints are kept: a holding
 * predicate over literals is left for the tautology and contradiction checks.
 */
public class FoldLiterals implements Algorithm {

    private static final Logger LOG = LoggerFactory.getLogger(FoldLiterals.class);

    @Override
    public String name() {
        return "fold-literals";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.expressionsByDepth()) {
            ExpressionNode expression = input.expression(id);
            if (expression.isAsserted() || (expression.operator().isPredicate() && input.holds(id))) continue;
            List<Literal> operands = new ArrayList<>();
            for (NodeId op : input.operands(id)) {
                Optional<Literal> literal = input.literal(op);
                if (literal.isEmpty()) break;
                operands.add(literal.get());
            }
            if (operands.size() != input.operands(id).size()) continue;
            Optional<Literal> result = LiteralEvaluator.evaluate(expression.operator(), operands);
            if (result.isPresent()) {
                if (LOG.isTraceEnabled()) LOG.trace("Folded {} to {}", input.repr(id), result.get());
                mutator.replace(id, mutator.createLiteral(result.get(), List.of(id)), List.of());
            }
        }
    }
}
