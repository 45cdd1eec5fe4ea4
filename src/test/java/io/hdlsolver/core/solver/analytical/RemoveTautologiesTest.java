/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.analytical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.GraphBuilder;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RemoveTautologiesTest {

    private static Mutator.Result run(Generation generation) {
        Mutator mutator = new Mutator(generation, "test");
        new RemoveTautologies().run(mutator);
        return mutator.close();
    }

    @Test
    public void test_reflexive_relation_is_removed() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId relation = builder.constrain(Operator.GREATER_OR_EQUAL, a, a);
        assertFalse(run(builder.build()).mapping().containsKey(relation));
    }

    @Test
    public void test_true_literal_relation_is_removed() {
        GraphBuilder builder = new GraphBuilder();
        NodeId relation = builder.constrain(Operator.GREATER_OR_EQUAL,
                builder.literal(Literal.quantity(5, 6)), builder.literal(Literal.quantity(1, 5)));
        assertFalse(run(builder.build()).mapping().containsKey(relation));
    }

    @Test
    public void test_false_literal_relation_is_kept() {
        GraphBuilder builder = new GraphBuilder();
        builder.constrain(Operator.GREATER_OR_EQUAL, builder.literal(Literal.quantity(1)), builder.literal(Literal.quantity(2)));
        assertFalse(run(builder.build()).isDirty());
    }

    @Test
    public void test_subset_of_a_superset_of_the_domain_is_removed() {
        GraphBuilder builder = new GraphBuilder();
        NodeId r = builder.parameter("R", Domain.nonNegative());
        NodeId loose = builder.constrain(Operator.IS_SUBSET, r, builder.literal(Literal.quantity(-1, Double.POSITIVE_INFINITY)));
        NodeId tight = builder.constrain(Operator.IS_SUBSET, r, builder.literal(Literal.quantity(0, 10)));
        Mutator.Result result = run(builder.build());
        assertFalse(result.mapping().containsKey(loose));
        assertTrue(result.mapping().containsKey(tight));
    }

    @Test
    public void test_removal_takes_the_wrapper_along() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId relation = builder.expression(Operator.IS, a, a);
        NodeId wrapper = builder.alias(relation, builder.literal(Literal.Booleans.TRUE));
        Mutator.Result result = run(builder.build());
        assertFalse(result.mapping().containsKey(relation));
        assertFalse(result.mapping().containsKey(wrapper));
    }
}
