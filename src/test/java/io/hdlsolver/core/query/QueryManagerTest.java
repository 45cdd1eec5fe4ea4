/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.query;

import io.hdlsolver.core.graph.GraphBuilder;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.graph.ParameterNode;
import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.Units;
import io.hdlsolver.core.solver.diagnostic.Contradiction;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.EMPTY_SUPERSET;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.FALSE_PREDICATE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class QueryManagerTest {

    @Test
    public void test_superset_of_two_sided_bound() {
        GraphBuilder builder = new GraphBuilder();
        NodeId p = builder.parameter("P", Domain.numbers());
        builder.constrain(Operator.GREATER_OR_EQUAL, p, builder.literal(Literal.quantity(2)));
        builder.constrain(Operator.GREATER_OR_EQUAL, builder.literal(Literal.quantity(5)), p);
        QueryManager query = new QueryManager(builder.build());

        assertEquals(Literal.quantity(2, 5), query.superset(p));
        assertEquals(Optional.empty(), query.trySingle(p));
        assertTrue(query.isSatisfiable());
    }

    @Test
    public void test_constraints_that_do_not_hold_are_ignored() {
        GraphBuilder builder = new GraphBuilder();
        NodeId p = builder.parameter("P", Domain.nonNegative());
        builder.expression(Operator.IS_SUBSET, p, builder.literal(Literal.quantity(3)));
        QueryManager query = new QueryManager(builder.build());

        assertEquals(Domain.nonNegative().universe(), query.superset(p));
    }

    @Test
    public void test_predicate_aliased_to_true_bounds_the_parameter() {
        GraphBuilder builder = new GraphBuilder();
        NodeId p = builder.parameter("P", Domain.numbers());
        NodeId subset = builder.expression(Operator.IS_SUBSET, p, builder.literal(Literal.quantity(3)));
        builder.constrain(Operator.IS, subset, builder.literal(Literal.Booleans.TRUE));
        QueryManager query = new QueryManager(builder.build());

        assertEquals(Optional.of(Literal.quantity(3)), query.trySingle(p));
    }

    @Test
    public void test_superset_is_reported_in_declared_unit() {
        GraphBuilder builder = new GraphBuilder();
        NodeId r = builder.parameter(ParameterNode.of(Domain.nonNegative(), Units.OHM)
                .withWithin(Literal.quantity(1, 2, Units.of("kΩ"))));
        Literal superset = new QueryManager(builder.build()).superset(r);

        assertEquals(Units.OHM.symbol(), superset.asQuantity().unit().symbol());
        assertEquals(Literal.quantity(1000, 2000, Units.OHM), superset);
    }

    @Test
    public void test_empty_superset_is_a_contradiction() {
        GraphBuilder builder = new GraphBuilder();
        NodeId p = builder.parameter("P", Domain.numbers());
        NodeId subset = builder.constrain(Operator.IS_SUBSET, p, builder.literal(Literal.quantity(0, 1)));
        NodeId bound = builder.constrain(Operator.GREATER_OR_EQUAL, p, builder.literal(Literal.quantity(2)));
        QueryManager query = new QueryManager(builder.build());

        assertTrue(query.superset(p).isEmpty());
        List<Contradiction> contradictions = query.contradictions();
        assertEquals(1, contradictions.size());
        assertEquals(EMPTY_SUPERSET, contradictions.get(0).error());
        assertTrue(contradictions.get(0).origins().contains(p));
        assertTrue(contradictions.get(0).origins().contains(subset));
        assertTrue(contradictions.get(0).origins().contains(bound));
        assertFalse(query.isSatisfiable());
    }

    @Test
    public void test_false_predicate_over_literals_is_a_contradiction() {
        GraphBuilder builder = new GraphBuilder();
        NodeId never = builder.constrain(Operator.GREATER_OR_EQUAL,
                builder.literal(Literal.quantity(1)), builder.literal(Literal.quantity(2)));
        List<Contradiction> contradictions = new QueryManager(builder.build()).contradictions();

        assertEquals(1, contradictions.size());
        assertEquals(FALSE_PREDICATE, contradictions.get(0).error());
        assertTrue(contradictions.get(0).origins().contains(never));
    }
}
