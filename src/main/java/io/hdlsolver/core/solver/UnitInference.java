/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver;

import io.hdlsolver.core.common.exception.ErrorMessage;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.LiteralNode;
import io.hdlsolver.core.graph.Node;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.Unit;
import io.hdlsolver.core.literal.Units;
import io.hdlsolver.core.solver.diagnostic.Contradiction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.INCOMMENSURABLE_OPERANDS;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.NON_DIMENSIONLESS_ARGUMENT;

/**
 * Infers the unit of every node of a generation and reports operands whose units cannot be combined.
 * A quantity literal stored without a unit, as created by the solver, fits any unit and has none
 * inferred for it.
 */
public class UnitInference {

    private final Generation generation;
    private final Map<NodeId, Unit> units;
    private final List<Contradiction> errors;

    private UnitInference(Generation generation) {
        this.generation = generation;
        this.units = new HashMap<>();
        this.errors = new ArrayList<>();
    }

    public static List<Contradiction> check(Generation generation) {
        UnitInference inference = new UnitInference(generation);
        for (NodeId id : generation.ids()) inference.unit(id);
        return inference.errors;
    }

    @Nullable
    public static Unit unitOf(Generation generation, NodeId id) {
        return new UnitInference(generation).unit(id);
    }

    @Nullable
    private Unit unit(NodeId id) {
        if (units.containsKey(id)) return units.get(id);
        Unit unit = infer(id);
        units.put(id, unit);
        return unit;
    }

    @Nullable
    private Unit infer(NodeId id) {
        Node node = generation.node(id);
        if (node.isParameter()) {
            return node.asParameter().domain().isNumbers() ? node.asParameter().unit() : Units.DIMENSIONLESS;
        } else if (node.isConstant()) {
            return node.asConstant().unit();
        } else if (node.isLiteral()) {
            LiteralNode literal = node.asLiteral();
            if (literal.strippedUnit() != null) return literal.strippedUnit();
            if (!literal.literal().isQuantity()) return Units.DIMENSIONLESS;
            Unit unit = literal.literal().asQuantity().unit();
            return unit.isCanonical() ? null : unit;
        } else {
            return inferExpression(id, node.asExpression().operator());
        }
    }

    @Nullable
    private Unit inferExpression(NodeId id, Operator operator) {
        List<NodeId> operands = generation.operands(id);
        List<Unit> opUnits = new ArrayList<>();
        for (NodeId op : operands) opUnits.add(unit(op));
        Unit first = opUnits.get(0);
        if (!operator.isBooleanValued() && opUnits.contains(null)) {
            if (operator.family() != Operator.Family.ARITHMETIC || opUnits.stream().allMatch(Objects::isNull)) return null;
            if (operator != Operator.MULTIPLY && operator != Operator.DIVIDE && operator != Operator.POWER) {
                return opUnits.stream().filter(Objects::nonNull).findFirst().orElse(null);
            }
            return null;
        }
        switch (operator) {
            case ADD:
            case SUBTRACT:
            case MIN:
            case MAX:
            case UNION:
            case INTERSECTION:
            case DIFFERENCE:
            case SYMMETRIC_DIFFERENCE:
                requireCommensurable(id, opUnits);
                return first;
            case ROUND:
            case ABS:
            case FLOOR:
            case CEIL:
                return first;
            case GREATER_OR_EQUAL:
            case GREATER_THAN:
            case LESS_OR_EQUAL:
            case LESS_THAN:
            case IS:
            case IS_SUBSET:
            case IS_SUPERSET:
                requireCommensurable(id, opUnits);
                return Units.DIMENSIONLESS;
            case MULTIPLY:
            case DIVIDE:
                Unit product = first;
                for (int i = 1; i < opUnits.size(); i++) {
                    Unit next = opUnits.get(i);
                    if (product.offset() != 0 || next.offset() != 0) {
                        error(INCOMMENSURABLE_OPERANDS, id, product, next);
                        return first;
                    }
                    product = operator == Operator.MULTIPLY ? product.multiply(next) : product.divide(next);
                }
                return product;
            case POWER:
                return power(id, first, operands.get(1), opUnits.get(1));
            case SQRT:
                if (!first.canRaiseTo(0.5)) {
                    error(NON_DIMENSIONLESS_ARGUMENT, id, first);
                    return first;
                }
                return first.power(0.5);
            case SIN:
            case COS:
                if (!first.isDimensionless() && !first.isCommensurableWith(Units.RADIAN)) {
                    error(NON_DIMENSIONLESS_ARGUMENT, id, first);
                }
                return Units.DIMENSIONLESS;
            case LOG:
                if (!first.isDimensionless()) error(NON_DIMENSIONLESS_ARGUMENT, id, first);
                return Units.DIMENSIONLESS;
            default:
                return Units.DIMENSIONLESS;
        }
    }

    private Unit power(NodeId id, Unit base, NodeId exponent, Unit exponentUnit) {
        if (!exponentUnit.isDimensionless()) {
            error(NON_DIMENSIONLESS_ARGUMENT, id, exponentUnit);
            return base;
        }
        if (base.isDimensionless() && base.multiplier() == 1) return base;
        Optional<Double> value = singleValue(exponent);
        if (value.isEmpty() || !base.canRaiseTo(value.get())) {
            error(NON_DIMENSIONLESS_ARGUMENT, id, base);
            return base;
        }
        return base.power(value.get());
    }

    private Optional<Double> singleValue(NodeId id) {
        Node node = generation.node(id);
        Literal literal;
        if (node.isLiteral()) literal = node.asLiteral().literal();
        else if (node.isConstant()) literal = node.asConstant().toLiteral();
        else return Optional.empty();
        if (!literal.isQuantity() || !literal.isSingleton()) return Optional.empty();
        return Optional.of(literal.asQuantity().canonical().single());
    }

    private void requireCommensurable(NodeId id, List<Unit> opUnits) {
        Unit reference = null;
        for (Unit unit : opUnits) {
            if (unit == null) continue;
            if (reference == null) reference = unit;
            else if (!unit.isCommensurableWith(reference)) {
                error(INCOMMENSURABLE_OPERANDS, id, reference, unit);
                return;
            }
        }
    }

    private void error(ErrorMessage error, NodeId id, Object... units) {
        Object[] parameters = new Object[units.length + 1];
        parameters[0] = generation.repr(id);
        System.arraycopy(units, 0, parameters, 1, units.length);
        errors.add(new Contradiction(error, generation.origins(id), parameters));
    }
}
