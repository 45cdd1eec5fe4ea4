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

/**
 * Pushes "must hold" through holding logic expressions onto their operands:
 * <ul>
 * <li>{@code not(or(not a, b, ..))} holding makes {@code a} hold and {@code b} false</li>
 * <li>{@code not(not a)} holding makes {@code a} hold</li>
 * <li>{@code not(x)} holding makes {@code x} false</li>
 * <li>{@code or(a)} holding makes {@code a} hold</li>
 * </ul>
 * The constraint on the logic expression is dropped; each operand gets its own constraint carrying the
 * provenance of the one it came from.
 */
public class FoldHoldingLogic implements Algorithm {

    @Override
    public String name() {
        return "fold-holding-logic";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.expressionsByDepth()) {
            if (!input.holds(id)) continue;
            if (input.isOperator(id, Operator.NOT)) foldNot(mutator, id);
            else if (input.isOperator(id, Operator.OR) && input.operands(id).size() == 1) {
                mustHold(mutator, input.operands(id).get(0), constraints(input, id));
                release(mutator, id);
            }
        }
    }

    private static void foldNot(Mutator mutator, NodeId id) {
        Generation input = mutator.input();
        List<NodeId> from = constraints(input, id);
        NodeId negated = input.operands(id).get(0);
        if (input.isOperator(negated, Operator.OR)) {
            for (NodeId op : input.operands(negated)) mustFail(mutator, op, from);
        } else {
            mustFail(mutator, negated, from);
        }
        release(mutator, id);
    }

    private static void mustFail(Mutator mutator, NodeId id, List<NodeId> from) {
        Generation input = mutator.input();
        if (input.isOperator(id, Operator.NOT)) {
            mustHold(mutator, input.operands(id).get(0), from);
        } else {
            NodeId isFalse = mutator.createExpression(
                    Operator.IS, List.of(id, mutator.createLiteral(Literal.Booleans.FALSE, from)), false, from);
            mustHold(mutator, isFalse, from);
        }
    }

    private static void mustHold(Mutator mutator, NodeId id, List<NodeId> from) {
        NodeId isTrue = mutator.createLiteral(Literal.Booleans.TRUE, from);
        mutator.createExpression(Operator.IS, List.of(id, isTrue), true, from);
    }

    /**
     * The expression and every constraint that makes it hold.
     */
    private static List<NodeId> constraints(Generation input, NodeId id) {
        List<NodeId> constraints = new ArrayList<>();
        constraints.add(id);
        for (NodeId user : input.users(id)) {
            if (input.isAliasToTrue(user)) constraints.add(user);
        }
        return constraints;
    }

    private static void release(Mutator mutator, NodeId id) {
        Generation input = mutator.input();
        if (input.expression(id).isAsserted()) mutator.mutateExpression(id, false);
        for (NodeId user : input.users(id)) {
            if (input.isAliasToTrue(user)) mutator.remove(user);
        }
    }
}
