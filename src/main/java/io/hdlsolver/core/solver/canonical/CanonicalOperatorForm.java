/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.canonical;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.graph.ParameterNode;
import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.UNRECOGNISED_VALUE;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.STRICT_BOUND_DOWNGRADED;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.UNSUPPORTED_OPERATOR_DROPPED;

/**
 * Rewrites every operator outside the canonical basis into canonical operators:
 * <ul>
 *     <li>{@code a - b} to {@code a + b * -1}, {@code a / b} to {@code a * b^-1}, {@code sqrt(x)} to {@code x^0.5}</li>
 *     <li>{@code floor(x)} to {@code round(x - 1/2)}, {@code ceil(x)} to {@code round(x + 1/2)},
 *     {@code cos(x)} to {@code sin(x + pi/2)}</li>
 *     <li>{@code and}, {@code implies} and {@code xor} to {@code or} and {@code not}</li>
 *     <li>{@code <=}, {@code <} and {@code >} to {@code >=}; {@code ⊇} to {@code ⊆}</li>
 *     <li>{@code a ∩ b} to {@code (a △ b) △ (a ∪ b)}, {@code a − b} to {@code (a ∪ b) △ b}</li>
 *     <li>{@code min} and {@code max} to a fresh witness parameter bounded by the union of the operands</li>
 * </ul>
 * Strict comparisons lose their strictness and cardinality constraints are dropped, each with a warning.
 */
public class CanonicalOperatorForm implements Algorithm {

    private static final Logger LOG = LoggerFactory.getLogger(CanonicalOperatorForm.class);

    @Override
    public String name() {
        return "canonical-operator-form";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.expressionsByDepth()) {
            Operator operator = input.expression(id).operator();
            if (operator.isCanonical()) continue;
            if (LOG.isTraceEnabled()) LOG.trace("Canonicalizing {}", input.repr(id));
            new Rewrite(mutator, id).apply(operator);
        }
    }

    private static class Rewrite {

        private final Mutator mutator;
        private final Generation input;
        private final NodeId id;
        private final List<NodeId> operands;

        private Rewrite(Mutator mutator, NodeId id) {
            this.mutator = mutator;
            this.input = mutator.input();
            this.id = id;
            this.operands = input.operands(id);
        }

        private void apply(Operator operator) {
            switch (operator) {
                case SUBTRACT:
                    mutate(Operator.ADD, prepend(operands.get(0), mapRest(op -> create(Operator.MULTIPLY, op, number(-1)))));
                    break;
                case DIVIDE:
                    mutate(Operator.MULTIPLY, prepend(operands.get(0), mapRest(op -> create(Operator.POWER, op, number(-1)))));
                    break;
                case SQRT:
                    mutate(Operator.POWER, operands.get(0), number(0.5));
                    break;
                case FLOOR:
                    mutate(Operator.ROUND, create(Operator.ADD, operands.get(0), number(-0.5)));
                    break;
                case CEIL:
                    mutate(Operator.ROUND, create(Operator.ADD, operands.get(0), number(0.5)));
                    break;
                case COS:
                    mutate(Operator.SIN, create(Operator.ADD, operands.get(0), number(Math.PI / 2)));
                    break;
                case AND:
                    mutate(Operator.NOT, create(Operator.OR, negateAll(operands)));
                    break;
                case IMPLIES:
                    mutate(Operator.OR, create(Operator.NOT, operands.get(0)), operands.get(1));
                    break;
                case XOR:
                    NodeId noneTrue = create(Operator.NOT, create(Operator.OR, operands));
                    NodeId noneFalse = create(Operator.NOT, create(Operator.OR, negateAll(operands)));
                    mutate(Operator.NOT, create(Operator.OR, noneTrue, noneFalse));
                    break;
                case INTERSECTION:
                    intersection();
                    break;
                case DIFFERENCE:
                    difference();
                    break;
                case LESS_OR_EQUAL:
                    mutate(Operator.GREATER_OR_EQUAL, operands.get(1), operands.get(0));
                    break;
                case LESS_THAN:
                    mutator.warn(STRICT_BOUND_DOWNGRADED, id, input.repr(id));
                    mutate(Operator.GREATER_OR_EQUAL, operands.get(1), operands.get(0));
                    break;
                case GREATER_THAN:
                    mutator.warn(STRICT_BOUND_DOWNGRADED, id, input.repr(id));
                    mutate(Operator.GREATER_OR_EQUAL, operands.get(0), operands.get(1));
                    break;
                case IS_SUPERSET:
                    mutate(Operator.IS_SUBSET, operands.get(1), operands.get(0));
                    break;
                case MIN:
                case MAX:
                    extremum(operator == Operator.MIN);
                    break;
                case CARDINALITY:
                    mutator.warn(UNSUPPORTED_OPERATOR_DROPPED, id, operator.symbol());
                    mutator.remove(id);
                    break;
                default:
                    throw SolverException.of(UNRECOGNISED_VALUE, operator);
            }
        }

        private void intersection() {
            NodeId accumulated = operands.get(0);
            for (int i = 1; i < operands.size(); i++) {
                NodeId next = operands.get(i);
                NodeId symmetric = create(Operator.SYMMETRIC_DIFFERENCE, accumulated, next);
                NodeId union = create(Operator.UNION, accumulated, next);
                if (i == operands.size() - 1) mutate(Operator.SYMMETRIC_DIFFERENCE, symmetric, union);
                else accumulated = create(Operator.SYMMETRIC_DIFFERENCE, symmetric, union);
            }
        }

        /**
         * {@code a − (b ∪ c ...)} is {@code (a ∪ b ∪ c ...) △ (b ∪ c ...)}.
         */
        private void difference() {
            List<NodeId> subtracted = operands.subList(1, operands.size());
            NodeId removed = subtracted.size() == 1 ? subtracted.get(0) : create(Operator.UNION, subtracted);
            mutate(Operator.SYMMETRIC_DIFFERENCE, create(Operator.UNION, operands), removed);
        }

        private void extremum(boolean isMin) {
            ParameterNode witness = ParameterNode.of(Domain.numbers()).withBoundsLowered();
            NodeId parameter = mutator.createParameter(witness, List.of(id));
            NodeId union = create(Operator.UNION, operands);
            mutator.createExpression(Operator.IS_SUBSET, List.of(parameter, union), true, List.of(id));
            List<NodeId> bound = isMin ? List.of(union, parameter) : List.of(parameter, union);
            mutator.createExpression(Operator.GREATER_OR_EQUAL, bound, true, List.of(id));
            mutator.replace(id, parameter, List.of());
        }

        private List<NodeId> mapRest(UnaryOperator<NodeId> function) {
            List<NodeId> mapped = new ArrayList<>();
            for (NodeId op : operands.subList(1, operands.size())) mapped.add(function.apply(op));
            return mapped;
        }

        private List<NodeId> negateAll(List<NodeId> ops) {
            List<NodeId> negated = new ArrayList<>();
            for (NodeId op : ops) negated.add(create(Operator.NOT, op));
            return negated;
        }

        private static List<NodeId> prepend(NodeId first, List<NodeId> rest) {
            List<NodeId> all = new ArrayList<>();
            all.add(first);
            all.addAll(rest);
            return all;
        }

        private NodeId number(double value) {
            return mutator.createLiteral(Literal.quantity(value), List.of(id));
        }

        private NodeId create(Operator operator, NodeId... ops) {
            return create(operator, List.of(ops));
        }

        private NodeId create(Operator operator, List<NodeId> ops) {
            return mutator.createExpression(operator, ops, false, List.of(id));
        }

        private void mutate(Operator operator, NodeId... ops) {
            mutate(operator, List.of(ops));
        }

        private void mutate(Operator operator, List<NodeId> ops) {
            mutator.mutateExpression(id, operator, ops);
        }
    }
}
