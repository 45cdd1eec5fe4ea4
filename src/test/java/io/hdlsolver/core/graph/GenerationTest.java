/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.Literal;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static io.hdlsolver.core.common.collection.Collections.list;
import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.EXPRESSION_EXPECTED;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.FOREIGN_NODE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GenerationTest {

    @Test
    public void test_users_and_depth() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId b = builder.parameter("B", Domain.numbers());
        NodeId sum = builder.expression(Operator.ADD, a, b, a);
        NodeId relation = builder.constrain(Operator.GREATER_OR_EQUAL, sum, b);
        Generation generation = builder.build();

        assertEquals(list(sum), generation.users(a));
        assertEquals(list(sum, relation), generation.users(b));
        assertEquals(0, generation.depth(a));
        assertEquals(1, generation.depth(sum));
        assertEquals(2, generation.depth(relation));
        assertEquals(list(sum, relation), generation.expressionsByDepth());
        assertEquals(list(a, b), generation.parameters());
    }

    @Test
    public void test_predicate_aliased_to_true_holds() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId relation = builder.expression(Operator.GREATER_OR_EQUAL, a, builder.constant(1));
        NodeId wrapper = builder.alias(relation, builder.literal(Literal.Booleans.TRUE));
        NodeId loose = builder.expression(Operator.GREATER_OR_EQUAL, a, builder.constant(2));
        Generation generation = builder.build();

        assertTrue(generation.isAliasToTrue(wrapper));
        assertEquals(relation, generation.aliased(wrapper));
        assertTrue(generation.holds(relation));
        assertTrue(generation.holds(wrapper));
        assertFalse(generation.holds(loose));
        assertFalse(generation.isAliasToTrue(relation));
    }

    @Test
    public void test_parameter_lookup_by_name() {
        GraphBuilder builder = new GraphBuilder();
        NodeId r = builder.parameter("R", Domain.nonNegative());
        Generation generation = builder.build();
        assertEquals(r, generation.parameter("R").get());
        assertFalse(generation.parameter("C").isPresent());
    }

    @Test
    public void test_repr_renders_expressions_recursively() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId b = builder.parameter("B", Domain.numbers());
        NodeId relation = builder.expression(Operator.GREATER_OR_EQUAL, builder.expression(Operator.ADD, a, b), b);
        assertEquals(">=(+(A, B), B)", builder.build().repr(relation));
    }

    @Test
    public void test_ids_of_another_generation_are_rejected() {
        GraphBuilder builder = new GraphBuilder();
        builder.parameter("A", Domain.numbers());
        Generation generation = builder.build();
        try {
            generation.node(NodeId.of(3, 0));
            fail();
        } catch (SolverException e) {
            assertEquals(FOREIGN_NODE, e.errorMessage());
        }
        assertFalse(generation.contains(NodeId.of(3, 0)));
    }

    @Test
    public void test_expression_access_on_a_leaf_throws() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        try {
            builder.build().expression(a);
            fail();
        } catch (SolverException e) {
            assertEquals(EXPRESSION_EXPECTED, e.errorMessage());
        }
    }

    @Test
    public void test_operands_must_belong_to_the_generation() {
        List<Node> nodes = new ArrayList<>();
        nodes.add(ParameterNode.of(Domain.numbers()).withName("A"));
        nodes.add(ExpressionNode.of(Operator.ABS));
        List<List<NodeId>> operands = new ArrayList<>();
        operands.add(new ArrayList<>());
        operands.add(list(NodeId.of(1, 0)));
        List<Provenance> provenance = new ArrayList<>();
        provenance.add(Provenance.origin(NodeId.of(0, 0)));
        provenance.add(Provenance.origin(NodeId.of(0, 1)));
        try {
            Generation.of(2, nodes, operands, provenance);
            fail();
        } catch (SolverException e) {
            assertEquals(FOREIGN_NODE, e.errorMessage());
        }
    }

    @Test
    public void test_printing_is_stable() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        builder.constrain(Operator.GREATER_OR_EQUAL, a, builder.literal(Literal.quantity(1)));
        String printed = builder.build().toString();
        assertEquals("generation 0 {\n  0: A: real\n  1: {1}\n  2: >=!(0, 1)\n}", printed);
    }
}
