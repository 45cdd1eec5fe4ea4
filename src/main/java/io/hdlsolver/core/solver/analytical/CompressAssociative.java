/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.analytical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens nested associative operators, {@code (a + b) + c} to {@code a + b + c}, and replaces a
 * single-operand application by its operand.
 */
public class CompressAssociative implements Algorithm {

    @Override
    public String name() {
        return "compress-associative";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.expressionsByDepth()) {
            Operator operator = input.expression(id).operator();
            if (!operator.isAssociative() || input.holds(id)) continue;
            List<NodeId> operands = input.operands(id);
            if (operands.size() == 1) {
                mutator.replace(id, operands.get(0), List.of());
                continue;
            }
            List<NodeId> flattened = new ArrayList<>();
            boolean nested = false;
            for (NodeId op : operands) {
                if (input.isOperator(op, operator) && !input.holds(op)) {
                    flattened.addAll(input.operands(op));
                    nested = true;
                } else {
                    flattened.add(op);
                }
            }
            if (nested) mutator.mutateExpression(id, operator, flattened);
        }
    }
}
