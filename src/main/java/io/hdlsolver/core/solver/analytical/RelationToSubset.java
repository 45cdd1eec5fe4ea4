/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.analytical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Interval;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.NumericSet;
import io.hdlsolver.core.literal.Units;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;

import java.util.List;
import java.util.Optional;

/**
 * Turns holding relations against literals into subset constraints.
 * <p>
 * {@code a >= X} only requires some value of {@code a} to reach some value of {@code X}, so it bounds
 * {@code a} from below by the smallest value of {@code X}: {@code a ⊆ [min X, inf)}. Symmetrically
 * {@code X >= a} gives {@code a ⊆ (-inf, max X]}. When the literal side is a union of literals, as
 * produced for {@code min} and {@code max}, each member must be comparable on its own: {@code ∪X >= a}
 * gives {@code a ⊆ (-inf, min_i max X_i]} and {@code a >= ∪X} gives {@code a ⊆ [max_i min X_i, inf)}.
 * A holding {@code Is(a, X)} becomes {@code a ⊆ X}.
 */
public class RelationToSubset implements Algorithm {

    @Override
    public String name() {
        return "relation-to-subset";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.expressionsByDepth()) {
            if (!input.holds(id)) continue;
            Operator operator = input.expression(id).operator();
            if (operator == Operator.GREATER_OR_EQUAL) greaterOrEqual(mutator, id);
            else if (operator == Operator.IS && !input.isAliasToTrue(id)) equality(mutator, id);
        }
    }

    private static void greaterOrEqual(Mutator mutator, NodeId id) {
        Generation input = mutator.input();
        NodeId left = input.operands(id).get(0);
        NodeId right = input.operands(id).get(1);
        if (isBound(input, left) == isBound(input, right)) return;
        if (isBound(input, right)) {
            lowerBound(input, right).ifPresent(min -> toSubset(mutator, id, left, Interval.atLeast(min)));
        } else {
            upperBound(input, left).ifPresent(max -> toSubset(mutator, id, right, Interval.atMost(max)));
        }
    }

    private static void equality(Mutator mutator, NodeId id) {
        Generation input = mutator.input();
        NodeId left = input.operands(id).get(0);
        NodeId right = input.operands(id).get(1);
        if (input.isLiteral(left) == input.isLiteral(right)) return;
        NodeId subject = input.isLiteral(left) ? right : left;
        NodeId literal = input.isLiteral(left) ? left : right;
        mutator.mutateExpression(id, Operator.IS_SUBSET, List.of(subject, literal));
    }

    private static void toSubset(Mutator mutator, NodeId id, NodeId subject, Interval bound) {
        NodeId literal = mutator.createLiteral(Literal.quantity(NumericSet.of(bound), Units.DIMENSIONLESS), List.of(id));
        mutator.mutateExpression(id, Operator.IS_SUBSET, List.of(subject, literal));
    }

    /**
     * A numeric literal, or a union of numeric literals.
     */
    private static boolean isBound(Generation input, NodeId id) {
        if (input.isLiteral(id)) return numeric(input, id).isPresent();
        if (!input.isOperator(id, Operator.UNION)) return false;
        for (NodeId op : input.operands(id)) {
            if (numeric(input, op).isEmpty()) return false;
        }
        return true;
    }

    private static Optional<NumericSet> numeric(Generation input, NodeId id) {
        return input.literal(id)
                .filter(l -> l.isQuantity() && l.isCanonical() && !l.isEmpty())
                .map(l -> l.asQuantity().values());
    }

    private static List<NodeId> members(Generation input, NodeId id) {
        return input.isLiteral(id) ? List.of(id) : input.operands(id);
    }

    private static Optional<Double> lowerBound(Generation input, NodeId bound) {
        double max = Double.NEGATIVE_INFINITY;
        for (NodeId member : members(input, bound)) max = Math.max(max, numeric(input, member).get().min());
        return max == Double.NEGATIVE_INFINITY ? Optional.empty() : Optional.of(max);
    }

    private static Optional<Double> upperBound(Generation input, NodeId bound) {
        double min = Double.POSITIVE_INFINITY;
        for (NodeId member : members(input, bound)) min = Math.min(min, numeric(input, member).get().max());
        return min == Double.POSITIVE_INFINITY ? Optional.empty() : Optional.of(min);
    }
}
