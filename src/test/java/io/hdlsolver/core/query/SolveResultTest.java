/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.query;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.GraphBuilder;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.solver.diagnostic.Contradiction;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.PARAMETER_EXPECTED;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.CONTRADICTIONS;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.FALSE_PREDICATE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SolveResultTest {

    private static SolveResult unsolved(Generation generation, List<Contradiction> contradictions) {
        return new SolveResult(List.of(generation), List.of(), List.of(), contradictions, 0);
    }

    @Test
    public void test_superset_of_a_single_generation() {
        GraphBuilder builder = new GraphBuilder();
        NodeId p = builder.parameter("P", Domain.numbers());
        builder.constrain(Operator.IS_SUBSET, p, builder.literal(Literal.quantity(4)));
        SolveResult result = unsolved(builder.build(), List.of());

        assertEquals(Optional.of(p), result.lookup(p));
        assertEquals(Optional.of(Literal.quantity(4)), result.trySingle(p));
        result.requireSatisfiable();
    }

    @Test
    public void test_superset_of_an_expression_is_rejected() {
        GraphBuilder builder = new GraphBuilder();
        NodeId p = builder.parameter("P", Domain.numbers());
        NodeId sum = builder.expression(Operator.ADD, p, p);
        SolveResult result = unsolved(builder.build(), List.of());
        try {
            result.superset(sum);
            fail();
        } catch (SolverException e) {
            assertEquals(PARAMETER_EXPECTED, e.errorMessage());
        }
    }

    @Test
    public void test_unsatisfiable_result_lists_every_contradiction() {
        GraphBuilder builder = new GraphBuilder();
        NodeId p = builder.parameter("P", Domain.numbers());
        Generation generation = builder.build();
        Contradiction first = new Contradiction(FALSE_PREDICATE, List.of(p), "first");
        Contradiction second = new Contradiction(FALSE_PREDICATE, List.of(p), "second");
        SolveResult result = unsolved(generation, List.of(first, second));
        try {
            result.requireSatisfiable();
            fail();
        } catch (SolverException e) {
            assertEquals(CONTRADICTIONS, e.errorMessage());
            assertTrue(e.getMessage().contains("2 contradiction(s)"));
            assertTrue(e.getMessage().contains("'first'"));
            assertTrue(e.getMessage().contains("'second'"));
        }
    }
}
