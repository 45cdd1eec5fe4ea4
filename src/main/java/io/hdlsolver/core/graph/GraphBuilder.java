/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.literal.Domain;
import io.hdlsolver.core.literal.EnumType;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.literal.Unit;
import io.hdlsolver.core.literal.Units;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.DUPLICATE_PARAMETER_NAME;
import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.INVALID_OPERAND_COUNT;
import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.PREDICATE_EXPECTED;
import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.UNKNOWN_NODE;
import static java.util.Arrays.asList;

/**
 * Builds generation 0 from the elaborated design. This is the only mutable view of a graph.
 */
public class GraphBuilder {

    private final List<Node> nodes;
    private final List<List<NodeId>> operands;
    private final Set<String> names;
    private int unnamed;

    public GraphBuilder() {
        this.nodes = new ArrayList<>();
        this.operands = new ArrayList<>();
        this.names = new HashSet<>();
        this.unnamed = 0;
    }

    private NodeId add(Node node, List<NodeId> ops) {
        for (NodeId op : ops) {
            if (op.generation() != 0 || op.index() >= nodes.size()) throw SolverException.of(UNKNOWN_NODE, op, 0);
        }
        nodes.add(node);
        operands.add(new ArrayList<>(ops));
        return NodeId.of(0, nodes.size() - 1);
    }

    public NodeId parameter(Domain domain) {
        return parameter(ParameterNode.of(domain));
    }

    public NodeId parameter(String name, Domain domain) {
        return parameter(ParameterNode.of(domain).withName(name));
    }

    public NodeId parameter(String name, Domain domain, Unit unit) {
        return parameter(ParameterNode.of(domain, unit).withName(name));
    }

    public NodeId parameter(ParameterNode parameter) {
        String name = parameter.name();
        if (name == null) {
            do {
                name = shortName(unnamed++);
            } while (names.contains(name));
            parameter = parameter.withName(name);
        }
        if (!names.add(name)) throw SolverException.of(DUPLICATE_PARAMETER_NAME, name);
        return add(parameter, List.of());
    }

    public NodeId literal(Literal literal) {
        return add(LiteralNode.of(literal), List.of());
    }

    public NodeId constant(double value) {
        return constant(value, Units.DIMENSIONLESS);
    }

    public NodeId constant(double value, Unit unit) {
        return add(ConstantNode.of(value, unit), List.of());
    }

    public NodeId constant(boolean value) {
        return add(ConstantNode.of(value), List.of());
    }

    public NodeId constant(EnumType.Member value) {
        return add(ConstantNode.of(value), List.of());
    }

    public NodeId constant(String value) {
        return add(ConstantNode.of(value), List.of());
    }

    public NodeId expression(Operator operator, NodeId... ops) {
        if (!operator.acceptsOperandCount(ops.length)) throw SolverException.of(INVALID_OPERAND_COUNT, operator, ops.length);
        return add(ExpressionNode.of(operator), asList(ops));
    }

    /**
     * Marks a boolean-valued expression as a constraint that must hold.
     */
    public NodeId constrain(NodeId expression) {
        Node node = nodes.get(expression.index());
        if (!node.isExpression() || !node.asExpression().operator().isBooleanValued()) {
            throw SolverException.of(PREDICATE_EXPECTED, node);
        }
        nodes.set(expression.index(), node.asExpression().withAsserted(true));
        return expression;
    }

    public NodeId constrain(Operator operator, NodeId... ops) {
        return constrain(expression(operator, ops));
    }

    /**
     * A field assignment {@code target = value}, lowered to an asserted equality.
     */
    public NodeId alias(NodeId target, NodeId value) {
        return constrain(expression(Operator.IS, target, value));
    }

    public Generation build() {
        List<Provenance> provenance = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) provenance.add(Provenance.origin(NodeId.of(0, i)));
        return Generation.of(0, nodes, operands, provenance);
    }

    /**
     * A, B, ..., Z, AA, AB, ...
     */
    public static String shortName(int index) {
        StringBuilder name = new StringBuilder();
        int i = index;
        do {
            name.insert(0, (char) ('A' + i % 26));
            i = i / 26 - 1;
        } while (i >= 0);
        return name.toString();
    }
}
