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

import java.util.Optional;

import static io.hdlsolver.core.common.collection.Collections.set;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SubstituteSingletonsTest {

    private static Mutator.Result run(Generation generation) {
        Mutator mutator = new Mutator(generation, "test");
        new SubstituteSingletons().run(mutator);
        return mutator.close();
    }

    @Test
    public void test_resolved_parameter_is_replaced_in_its_uses() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId x = builder.parameter("X", Domain.numbers());
        NodeId bound = builder.constrain(Operator.IS_SUBSET, a, builder.literal(Literal.quantity(2)));
        NodeId sum = builder.expression(Operator.ADD, a, builder.literal(Literal.quantity(1)));
        builder.alias(x, sum);
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        NodeId value = output.operands(result.mapping().get(sum)).get(0);
        assertEquals(Optional.of(Literal.quantity(2)), output.literal(value));
        assertEquals(set(a, bound), output.origins(value));
        NodeId parameter = result.mapping().get(a);
        assertEquals(1, output.users(parameter).size());
        assertEquals(result.mapping().get(bound), output.users(parameter).get(0));
    }

    @Test
    public void test_parameter_with_several_values_is_kept() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        builder.constrain(Operator.IS_SUBSET, a, builder.literal(Literal.quantity(2, 3)));
        builder.expression(Operator.ADD, a, builder.literal(Literal.quantity(1)));
        assertFalse(run(builder.build()).isDirty());
    }

    @Test
    public void test_bounds_that_do_not_hold_are_ignored() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId maybe = builder.expression(Operator.IS_SUBSET, a, builder.literal(Literal.quantity(2)));
        builder.constrain(Operator.OR, maybe);
        Mutator.Result result = run(builder.build());
        assertFalse(result.isDirty());
        assertTrue(result.generation().users(result.mapping().get(a)).contains(result.mapping().get(maybe)));
    }
}
