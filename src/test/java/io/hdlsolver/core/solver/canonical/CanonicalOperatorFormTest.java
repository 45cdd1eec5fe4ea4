/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.canonical;

import io.hdlsolver.core.common.parameters.Options;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.GraphBuilder;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.diagnostic.Diagnostics;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static io.hdlsolver.core.common.collection.Collections.list;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.STRICT_BOUND_DOWNGRADED;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.UNSUPPORTED_OPERATOR_DROPPED;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CanonicalOperatorFormTest {

    private final Diagnostics diagnostics = new Diagnostics();

    private Mutator.Result run(Generation generation) {
        Mutator mutator = new Mutator(generation, "test", new Options.Solve(), diagnostics);
        new CanonicalOperatorForm().run(mutator);
        return mutator.close();
    }

    private static List<NodeId> withOperator(Generation generation, Operator operator) {
        return generation.expressions().stream()
                .filter(id -> generation.isOperator(id, operator))
                .collect(Collectors.toList());
    }

    @Test
    public void test_subtraction_adds_the_negation() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId b = builder.parameter("B", Domain.numbers());
        NodeId difference = builder.expression(Operator.SUBTRACT, a, b);
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        NodeId sum = result.mapping().get(difference);
        assertTrue(output.isOperator(sum, Operator.ADD));
        assertEquals("+(A, *(B, {-1}))", output.repr(sum));
    }

    @Test
    public void test_strict_comparison_is_downgraded_with_a_warning() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId b = builder.parameter("B", Domain.numbers());
        NodeId greater = builder.constrain(Operator.GREATER_THAN, a, b);
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        assertTrue(withOperator(output, Operator.GREATER_THAN).isEmpty());
        NodeId relation = result.mapping().get(greater);
        assertTrue(output.isOperator(relation, Operator.GREATER_OR_EQUAL));
        assertTrue(output.expression(relation).isAsserted());
        assertEquals(list(result.mapping().get(a), result.mapping().get(b)), output.operands(relation));
        assertEquals(1, diagnostics.warnings().size());
        assertEquals(STRICT_BOUND_DOWNGRADED, diagnostics.warnings().get(0).error());
    }

    @Test
    public void test_less_than_swaps_the_operands() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId b = builder.parameter("B", Domain.numbers());
        NodeId less = builder.constrain(Operator.LESS_THAN, a, b);
        NodeId atMost = builder.constrain(Operator.LESS_OR_EQUAL, a, b);
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        List<NodeId> swapped = list(result.mapping().get(b), result.mapping().get(a));
        assertEquals(swapped, output.operands(result.mapping().get(less)));
        assertEquals(swapped, output.operands(result.mapping().get(atMost)));
        assertEquals(1, diagnostics.warnings().size());
    }

    @Test
    public void test_minimum_becomes_a_bounded_witness() {
        GraphBuilder builder = new GraphBuilder();
        NodeId x = builder.parameter("X", Domain.numbers());
        NodeId first = builder.literal(Literal.quantity(1, 4));
        NodeId second = builder.literal(Literal.quantity(2, 6));
        NodeId minimum = builder.expression(Operator.MIN, first, second);
        NodeId alias = builder.alias(x, minimum);
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        NodeId witness = result.mapping().get(minimum);
        assertTrue(output.node(witness).isParameter());
        assertEquals("_A", output.parameter(witness).name());
        assertTrue(output.parameter(witness).boundsLowered());
        assertEquals(witness, output.operands(result.mapping().get(alias)).get(1));

        List<NodeId> unions = withOperator(output, Operator.UNION);
        assertEquals(1, unions.size());
        NodeId union = unions.get(0);
        List<NodeId> subsets = withOperator(output, Operator.IS_SUBSET);
        assertEquals(1, subsets.size());
        assertTrue(output.expression(subsets.get(0)).isAsserted());
        assertEquals(list(witness, union), output.operands(subsets.get(0)));
        List<NodeId> bounds = withOperator(output, Operator.GREATER_OR_EQUAL);
        assertEquals(1, bounds.size());
        assertTrue(output.expression(bounds.get(0)).isAsserted());
        assertEquals(list(union, witness), output.operands(bounds.get(0)));
        assertTrue(output.origins(witness).contains(minimum));
    }

    @Test
    public void test_maximum_bounds_the_witness_from_below() {
        GraphBuilder builder = new GraphBuilder();
        NodeId maximum = builder.expression(Operator.MAX, builder.literal(Literal.quantity(1)), builder.literal(Literal.quantity(3)));
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        NodeId witness = result.mapping().get(maximum);
        NodeId bound = withOperator(output, Operator.GREATER_OR_EQUAL).get(0);
        assertEquals(witness, output.operands(bound).get(0));
    }

    @Test
    public void test_conjunction_becomes_negated_disjunction() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId p = builder.expression(Operator.GREATER_OR_EQUAL, a, builder.constant(1));
        NodeId q = builder.expression(Operator.GREATER_OR_EQUAL, builder.constant(5), a);
        NodeId both = builder.constrain(Operator.AND, p, q);
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        NodeId negated = result.mapping().get(both);
        assertTrue(output.isOperator(negated, Operator.NOT));
        assertTrue(output.expression(negated).isAsserted());
        assertEquals("not(or(not(>=(A, 1.0)), not(>=(5.0, A))))", output.repr(negated));
    }

    @Test
    public void test_superset_swaps_to_subset() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId range = builder.literal(Literal.quantity(0, 10));
        NodeId superset = builder.constrain(Operator.IS_SUPERSET, range, a);
        Mutator.Result result = run(builder.build());
        Generation output = result.generation();

        NodeId subset = result.mapping().get(superset);
        assertTrue(output.isOperator(subset, Operator.IS_SUBSET));
        assertEquals(list(result.mapping().get(a), result.mapping().get(range)), output.operands(subset));
    }

    @Test
    public void test_cardinality_is_dropped_with_a_warning() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId count = builder.expression(Operator.CARDINALITY, a);
        Mutator.Result result = run(builder.build());

        assertFalse(result.mapping().containsKey(count));
        assertEquals(1, diagnostics.warnings().size());
        assertEquals(UNSUPPORTED_OPERATOR_DROPPED, diagnostics.warnings().get(0).error());
    }

    @Test
    public void test_canonical_expressions_are_left_alone() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        builder.constrain(Operator.GREATER_OR_EQUAL, builder.expression(Operator.ADD, a, a), a);
        assertFalse(run(builder.build()).isDirty());
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    public void test_every_rewritten_operator_leaves_the_canonical_basis() {
        GraphBuilder builder = new GraphBuilder();
        NodeId a = builder.parameter("A", Domain.numbers());
        NodeId b = builder.parameter("B", Domain.numbers());
        NodeId s = builder.literal(Literal.quantity(0, 3));
        NodeId t = builder.literal(Literal.quantity(2, 5));
        NodeId p = builder.expression(Operator.GREATER_OR_EQUAL, a, b);
        NodeId q = builder.expression(Operator.GREATER_OR_EQUAL, b, a);
        builder.expression(Operator.DIVIDE, a, b);
        builder.expression(Operator.SQRT, a);
        builder.expression(Operator.FLOOR, a);
        builder.expression(Operator.CEIL, a);
        builder.expression(Operator.COS, a);
        builder.expression(Operator.IMPLIES, p, q);
        builder.expression(Operator.XOR, p, q);
        builder.expression(Operator.INTERSECTION, s, t, s);
        builder.expression(Operator.DIFFERENCE, s, t);
        Generation output = run(builder.build()).generation();
        for (NodeId id : output.expressions()) {
            assertTrue(output.repr(id), output.expression(id).operator().isCanonical());
        }
    }
}
