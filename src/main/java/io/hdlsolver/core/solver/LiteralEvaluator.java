/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver;

import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.Literal.Booleans;
import io.hdlsolver.core.literal.Literal.Quantity;
import io.hdlsolver.core.literal.NumericSet;
import io.hdlsolver.core.literal.Units;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates an operator over literal operands. Operators are evaluated on sets: the result holds every
 * value the expression can take for some choice of operand values, except for the set relations
 * ({@code is}, {@code subset}), which compare the operand sets themselves.
 */
public class LiteralEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(LiteralEvaluator.class);

    /**
     * @return the resulting literal, or empty if the operator is not defined for these operands
     */
    public static Optional<Literal> evaluate(Operator operator, List<Literal> operands) {
        if (!operator.acceptsOperandCount(operands.size())) return Optional.empty();
        Optional<Literal> result;
        switch (operator.family()) {
            case ARITHMETIC:
                result = quantities(operands).flatMap(qs -> arithmetic(operator, qs));
                break;
            case LOGIC:
                result = booleans(operands).map(bs -> logic(operator, bs));
                break;
            case SET:
                result = set(operator, operands);
                break;
            case RELATION:
                result = relation(operator, operands);
                break;
            default:
                result = Optional.empty();
        }
        if (result.isEmpty() && LOG.isTraceEnabled()) LOG.trace("Cannot evaluate {} over {}", operator, operands);
        return result;
    }

    private static Optional<List<Quantity>> quantities(List<Literal> operands) {
        List<Quantity> quantities = new ArrayList<>();
        for (Literal operand : operands) {
            if (!operand.isQuantity()) return Optional.empty();
            quantities.add(operand.asQuantity());
        }
        return Optional.of(quantities);
    }

    private static Optional<List<Booleans>> booleans(List<Literal> operands) {
        List<Booleans> booleans = new ArrayList<>();
        for (Literal operand : operands) {
            if (!operand.isBooleans()) return Optional.empty();
            booleans.add(operand.asBooleans());
        }
        return Optional.of(booleans);
    }

    private static boolean commensurable(List<Quantity> quantities) {
        for (Quantity q : quantities) {
            if (!q.unit().isCommensurableWith(quantities.get(0).unit())) return false;
        }
        return true;
    }

    private static Optional<Literal> arithmetic(Operator operator, List<Quantity> qs) {
        Quantity first = qs.get(0);
        switch (operator) {
            case ADD:
            case SUBTRACT:
                if (!commensurable(qs)) return Optional.empty();
                Quantity sum = first;
                for (Quantity q : qs.subList(1, qs.size())) sum = operator == Operator.ADD ? sum.add(q) : sum.subtract(q);
                return Optional.of(sum);
            case MULTIPLY:
            case DIVIDE:
                for (Quantity q : qs) {
                    if (q.unit().offset() != 0) return Optional.empty();
                }
                Quantity product = first;
                for (Quantity q : qs.subList(1, qs.size())) {
                    product = operator == Operator.MULTIPLY ? product.multiply(q) : product.divide(q);
                }
                return Optional.of(product);
            case POWER:
                return first.canRaiseTo(qs.get(1)) ? Optional.of(first.power(qs.get(1))) : Optional.empty();
            case SQRT:
                Quantity half = Literal.quantity(0.5);
                return first.canRaiseTo(half) ? Optional.of(first.power(half)) : Optional.empty();
            case ROUND:
                return Optional.of(first.round());
            case FLOOR:
                return Optional.of(first.add(shift(-0.5, first)).round());
            case CEIL:
                return Optional.of(first.add(shift(0.5, first)).round());
            case ABS:
                return Optional.of(first.abs());
            case SIN:
            case COS:
                if (!first.unit().isDimensionless() && !first.unit().isCommensurableWith(Units.RADIAN)) {
                    return Optional.empty();
                }
                Quantity angle = operator == Operator.SIN ? first.canonical()
                        : first.canonical().add(Literal.quantity(Math.PI / 2));
                return Optional.of(angle.sin());
            case LOG:
                return first.canLog() ? Optional.of(first.log()) : Optional.empty();
            case MIN:
            case MAX:
                return extremum(operator, qs);
            default:
                return Optional.empty();
        }
    }

    private static Quantity shift(double value, Quantity like) {
        return Literal.quantity(value, like.unit());
    }

    private static Optional<Literal> extremum(Operator operator, List<Quantity> qs) {
        if (!commensurable(qs)) return Optional.empty();
        Quantity first = qs.get(0);
        for (Quantity q : qs) {
            if (q.isEmpty()) return Optional.of(Literal.quantity(NumericSet.empty(), first.unit()));
        }
        double lo = operator == Operator.MIN ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        double hi = lo;
        for (Quantity q : qs) {
            NumericSet values = q.in(first.unit()).values();
            if (operator == Operator.MIN) {
                lo = Math.min(lo, values.min());
                hi = Math.min(hi, values.max());
            } else {
                lo = Math.max(lo, values.min());
                hi = Math.max(hi, values.max());
            }
        }
        Quantity bounds = Literal.quantity(NumericSet.closed(lo, hi), first.unit());
        Quantity union = first;
        for (Quantity q : qs) union = union.union(q);
        return Optional.of(union.intersect(bounds));
    }

    private static Literal logic(Operator operator, List<Booleans> bs) {
        switch (operator) {
            case NOT:
                return bs.get(0).not();
            case OR:
                return or(bs);
            case AND:
                return or(not(bs)).not();
            case IMPLIES:
                return bs.get(0).not().or(bs.get(1));
            case XOR:
                return or(List.of(or(bs).not(), or(not(bs)).not())).not();
            default:
                return Booleans.NONE;
        }
    }

    private static Booleans or(List<Booleans> bs) {
        Booleans result = bs.get(0);
        for (Booleans b : bs.subList(1, bs.size())) result = result.or(b);
        return result;
    }

    private static List<Booleans> not(List<Booleans> bs) {
        List<Booleans> negated = new ArrayList<>();
        for (Booleans b : bs) negated.add(b.not());
        return negated;
    }

    private static boolean sameKind(List<Literal> operands) {
        for (Literal operand : operands) {
            if (operand.kind() != operands.get(0).kind()) return false;
            if (operand.isQuantity() && !operand.asQuantity().unit().isCommensurableWith(operands.get(0).asQuantity().unit())) {
                return false;
            }
            if (operand.isEnums() && operand.asEnums().type() != operands.get(0).asEnums().type()) return false;
        }
        return true;
    }

    private static Optional<Literal> set(Operator operator, List<Literal> operands) {
        if (operator == Operator.CARDINALITY || !sameKind(operands)) return Optional.empty();
        Literal first = operands.get(0);
        Literal result = first;
        switch (operator) {
            case UNION:
                for (Literal l : operands.subList(1, operands.size())) result = result.union(l);
                return Optional.of(result);
            case INTERSECTION:
                for (Literal l : operands.subList(1, operands.size())) result = result.intersect(l);
                return Optional.of(result);
            case DIFFERENCE:
                for (Literal l : operands.subList(1, operands.size())) result = result.difference(l);
                return Optional.of(result);
            case SYMMETRIC_DIFFERENCE:
                return Optional.of(first.symmetricDifference(operands.get(1)));
            default:
                return Optional.empty();
        }
    }

    private static Optional<Literal> relation(Operator operator, List<Literal> operands) {
        Literal a = operands.get(0);
        Literal b = operands.get(1);
        if (!sameKind(operands)) return Optional.empty();
        switch (operator) {
            case IS:
                return Optional.of(Booleans.of(a.equals(b)));
            case IS_SUBSET:
                return Optional.of(Booleans.of(a.isSubsetOf(b)));
            case IS_SUPERSET:
                return Optional.of(Booleans.of(b.isSubsetOf(a)));
            default:
                break;
        }
        if (!a.isQuantity()) return Optional.empty();
        Quantity qa = a.asQuantity();
        Quantity qb = b.asQuantity();
        switch (operator) {
            case GREATER_OR_EQUAL:
                return Optional.of(qa.greaterOrEqual(qb));
            case GREATER_THAN:
                return Optional.of(qa.greaterThan(qb));
            case LESS_OR_EQUAL:
                return Optional.of(qb.greaterOrEqual(qa));
            case LESS_THAN:
                return Optional.of(qb.greaterThan(qa));
            default:
                return Optional.empty();
        }
    }
}
