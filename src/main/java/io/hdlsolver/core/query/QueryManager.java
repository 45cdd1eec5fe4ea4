/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.query;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.graph.ParameterNode;
import io.hdlsolver.core.literal.Interval;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.NumericSet;
import io.hdlsolver.core.literal.Units;
import io.hdlsolver.core.solver.LiteralEvaluator;
import io.hdlsolver.core.solver.diagnostic.Contradiction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.EMPTY_SUPERSET;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.FALSE_PREDICATE;

/**
 * Read-only queries over one generation. Never mutates the generation, so a query manager can be
 * used from any number of threads.
 */
public class QueryManager {

    private final Generation generation;

    public QueryManager(Generation generation) {
        this.generation = generation;
    }

    public Generation generation() {
        return generation;
    }

    /**
     * The tightest set known to contain every admissible value of the parameter, in its declared unit.
     */
    public Literal superset(NodeId parameter) {
        ParameterNode node = generation.parameter(parameter);
        Literal superset = canonicalSuperset(parameter);
        if (superset.isQuantity()) return superset.asQuantity().restore(node.unit());
        return superset;
    }

    public Optional<Literal> trySingle(NodeId parameter) {
        Literal superset = superset(parameter);
        return superset.isSingleton() ? Optional.of(superset) : Optional.empty();
    }

    private Literal canonicalSuperset(NodeId parameter) {
        ParameterNode node = generation.parameter(parameter);
        Literal superset = node.domain().universe();
        if (node.within() != null) superset = narrow(superset, node.within());
        for (NodeId user : generation.users(parameter)) {
            if (!generation.holds(user)) continue;
            Optional<Literal> bound = bound(parameter, user);
            if (bound.isPresent()) superset = narrow(superset, bound.get());
        }
        return superset;
    }

    private static Literal narrow(Literal superset, Literal bound) {
        Literal canonical = bound.isQuantity() ? bound.asQuantity().canonical() : bound;
        if (canonical.kind() != superset.kind()) return superset;
        if (canonical.isEnums() && canonical.asEnums().type() != superset.asEnums().type()) return superset;
        return superset.intersect(canonical);
    }

    private Optional<Literal> bound(NodeId parameter, NodeId constraint) {
        List<NodeId> operands = generation.operands(constraint);
        Operator operator = generation.expression(constraint).operator();
        if (operands.size() != 2) return Optional.empty();
        NodeId left = operands.get(0);
        NodeId right = operands.get(1);
        switch (operator) {
            case IS_SUBSET:
                return left.equals(parameter) ? generation.literal(right) : Optional.empty();
            case IS:
                if (generation.isAliasToTrue(constraint)) return Optional.empty();
                return left.equals(parameter) ? generation.literal(right) : generation.literal(left);
            case GREATER_OR_EQUAL:
                if (left.equals(parameter)) {
                    return numericBound(right).map(x -> x.isEmpty() ? x : NumericSet.of(Interval.atLeast(x.min())))
                            .map(x -> Literal.quantity(x, Units.DIMENSIONLESS));
                } else {
                    return numericBound(left).map(x -> x.isEmpty() ? x : NumericSet.of(Interval.atMost(x.max())))
                            .map(x -> Literal.quantity(x, Units.DIMENSIONLESS));
                }
            default:
                return Optional.empty();
        }
    }

    private Optional<NumericSet> numericBound(NodeId id) {
        return generation.literal(id).filter(Literal::isQuantity).map(l -> l.asQuantity().canonical().values());
    }

    /**
     * Constraints that provably cannot hold: a parameter left with no admissible value, or a holding
     * predicate over literals that evaluates to false.
     */
    public List<Contradiction> contradictions() {
        List<Contradiction> contradictions = new ArrayList<>();
        for (NodeId parameter : generation.parameters()) {
            if (!canonicalSuperset(parameter).isEmpty()) continue;
            SortedSet<NodeId> origins = new TreeSet<>(generation.origins(parameter));
            for (NodeId user : generation.users(parameter)) {
                if (generation.holds(user) && bound(parameter, user).isPresent()) origins.addAll(constraintOrigins(user));
            }
            contradictions.add(new Contradiction(EMPTY_SUPERSET, origins, generation.parameter(parameter).name()));
        }
        for (NodeId id : generation.expressionsByDepth()) {
            if (!generation.expression(id).operator().isPredicate() || !generation.holds(id)) continue;
            List<Literal> literals = new ArrayList<>();
            for (NodeId op : generation.operands(id)) generation.literal(op).ifPresent(literals::add);
            if (literals.size() != generation.operands(id).size()) continue;
            Optional<Literal> result = LiteralEvaluator.evaluate(generation.expression(id).operator(), literals);
            if (result.isPresent() && result.get().equals(Literal.Booleans.FALSE)) {
                contradictions.add(new Contradiction(FALSE_PREDICATE, constraintOrigins(id), generation.repr(id)));
            }
        }
        return contradictions;
    }

    public boolean isSatisfiable() {
        return contradictions().isEmpty();
    }

    private SortedSet<NodeId> constraintOrigins(NodeId constraint) {
        SortedSet<NodeId> origins = new TreeSet<>(generation.origins(constraint));
        for (NodeId user : generation.users(constraint)) {
            if (generation.isAliasToTrue(user)) origins.addAll(generation.origins(user));
        }
        return origins;
    }
}
