/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.literal.Literal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.stream.Collectors;

import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.EXPRESSION_EXPECTED;
import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.INVALID_OPERAND_COUNT;
import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.UNKNOWN_NODE;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.FOREIGN_NODE;
import static java.util.Collections.unmodifiableList;

/**
 * An immutable snapshot of the constraint graph. Nodes live in an arena indexed by {@link NodeId};
 * operand edges are kept in a table of their own, next to the provenance of every node. A generation
 * is never modified once published, so any number of readers may share it.
 */
public class Generation {

    private final int number;
    private final List<Node> nodes;
    private final List<List<NodeId>> operands;
    private final List<List<NodeId>> users;
    private final List<Provenance> provenance;
    private final int[] depths;
    private final List<NodeId> expressionsByDepth;

    private Generation(int number, List<Node> nodes, List<List<NodeId>> operands, List<Provenance> provenance) {
        this.number = number;
        this.nodes = unmodifiableList(new ArrayList<>(nodes));
        this.provenance = unmodifiableList(new ArrayList<>(provenance));
        List<List<NodeId>> frozen = new ArrayList<>();
        List<List<NodeId>> reverse = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) reverse.add(new ArrayList<>());
        for (int i = 0; i < nodes.size(); i++) {
            List<NodeId> ops = operands.get(i);
            frozen.add(unmodifiableList(new ArrayList<>(ops)));
            NodeId user = NodeId.of(number, i);
            for (NodeId op : ops) {
                List<NodeId> opUsers = reverse.get(index(op));
                if (opUsers.isEmpty() || !opUsers.get(opUsers.size() - 1).equals(user)) opUsers.add(user);
            }
        }
        this.operands = unmodifiableList(frozen);
        this.users = reverse.stream().map(l -> unmodifiableList(l)).collect(Collectors.toList());
        this.depths = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) depths[i] = -1;
        for (int i = 0; i < nodes.size(); i++) computeDepth(i);
        this.expressionsByDepth = unmodifiableList(ids().stream()
                .filter(id -> node(id).isExpression())
                .sorted(Comparator.comparingInt(this::depth).thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList()));
    }

    /**
     * @param operands the ordered operands of each node, empty for leaves, all tagged with {@code number}
     */
    public static Generation of(int number, List<Node> nodes, List<List<NodeId>> operands, List<Provenance> provenance) {
        assert nodes.size() == operands.size() && nodes.size() == provenance.size();
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.isExpression()) {
                Operator operator = node.asExpression().operator();
                if (!operator.acceptsOperandCount(operands.get(i).size())) {
                    throw SolverException.of(INVALID_OPERAND_COUNT, operator, operands.get(i).size());
                }
            }
            for (NodeId op : operands.get(i)) {
                if (op.generation() != number) throw SolverException.of(FOREIGN_NODE, op, number);
                if (op.index() < 0 || op.index() >= nodes.size()) throw SolverException.of(UNKNOWN_NODE, op, number);
            }
        }
        return new Generation(number, nodes, operands, provenance);
    }

    private int computeDepth(int index) {
        if (depths[index] >= 0) return depths[index];
        int depth = 0;
        for (NodeId op : operands.get(index)) depth = Math.max(depth, computeDepth(op.index()) + 1);
        depths[index] = depth;
        return depth;
    }

    private int index(NodeId id) {
        if (id.generation() != number) throw SolverException.of(FOREIGN_NODE, id, number);
        if (id.index() < 0 || id.index() >= nodes.size()) throw SolverException.of(UNKNOWN_NODE, id, number);
        return id.index();
    }

    public int number() {
        return number;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(NodeId id) {
        return id.generation() == number && id.index() >= 0 && id.index() < nodes.size();
    }

    public NodeId id(int index) {
        return NodeId.of(number, index);
    }

    public List<NodeId> ids() {
        List<NodeId> ids = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) ids.add(id(i));
        return ids;
    }

    public Node node(NodeId id) {
        return nodes.get(index(id));
    }

    public ParameterNode parameter(NodeId id) {
        return node(id).asParameter();
    }

    public ExpressionNode expression(NodeId id) {
        Node node = node(id);
        if (!node.isExpression()) throw SolverException.of(EXPRESSION_EXPECTED, repr(id));
        return node.asExpression();
    }

    public Optional<Literal> literal(NodeId id) {
        Node node = node(id);
        if (node.isLiteral()) return Optional.of(node.asLiteral().literal());
        else return Optional.empty();
    }

    public boolean isLiteral(NodeId id) {
        return node(id).isLiteral();
    }

    public boolean isOperator(NodeId id, Operator operator) {
        Node node = node(id);
        return node.isExpression() && node.asExpression().operator() == operator;
    }

    public List<NodeId> operands(NodeId id) {
        return operands.get(index(id));
    }

    public List<NodeId> users(NodeId id) {
        return users.get(index(id));
    }

    public int depth(NodeId id) {
        return depths[index(id)];
    }

    public Provenance provenance(NodeId id) {
        return provenance.get(index(id));
    }

    public SortedSet<NodeId> origins(NodeId id) {
        return provenance(id).origins();
    }

    public List<NodeId> parameters() {
        return ids().stream().filter(id -> node(id).isParameter()).collect(Collectors.toList());
    }

    public List<NodeId> literals() {
        return ids().stream().filter(id -> node(id).isLiteral()).collect(Collectors.toList());
    }

    public List<NodeId> constants() {
        return ids().stream().filter(id -> node(id).isConstant()).collect(Collectors.toList());
    }

    public List<NodeId> expressions() {
        return ids().stream().filter(id -> node(id).isExpression()).collect(Collectors.toList());
    }

    /**
     * Expressions ordered by depth, shallowest first, then by index. Passes traverse in this order so
     * that their output does not depend on hash ordering.
     */
    public List<NodeId> expressionsByDepth() {
        return expressionsByDepth;
    }

    public Optional<NodeId> parameter(String name) {
        return parameters().stream().filter(id -> name.equals(parameter(id).name())).findFirst();
    }

    /**
     * An asserted equality {@code Is(e, true)} that makes the expression {@code e} hold.
     */
    public boolean isAliasToTrue(NodeId id) {
        if (!isOperator(id, Operator.IS) || !expression(id).isAsserted()) return false;
        List<NodeId> ops = operands(id);
        boolean hasTrue = false;
        boolean hasExpression = false;
        for (NodeId op : ops) {
            Optional<Literal> literal = literal(op);
            if (literal.isPresent() && literal.get().equals(Literal.Booleans.TRUE)) hasTrue = true;
            else if (node(op).isExpression()) hasExpression = true;
        }
        return hasTrue && hasExpression;
    }

    /**
     * Whether the expression must hold: it is asserted itself, or aliased to true by an asserted equality.
     */
    public boolean holds(NodeId id) {
        Node node = node(id);
        if (!node.isExpression()) return false;
        if (node.asExpression().isAsserted()) return true;
        for (NodeId user : users(id)) {
            if (isAliasToTrue(user)) return true;
        }
        return false;
    }

    /**
     * The expression a predicate alias {@code Is(e, true)} wraps.
     */
    public NodeId aliased(NodeId alias) {
        assert isAliasToTrue(alias);
        for (NodeId op : operands(alias)) {
            if (node(op).isExpression()) return op;
        }
        throw SolverException.of(EXPRESSION_EXPECTED, repr(alias));
    }

    public String repr(NodeId id) {
        Node node = node(id);
        if (node.isParameter()) {
            String name = node.asParameter().name();
            return name != null ? name : id.toString();
        } else if (node.isExpression()) {
            return node.asExpression().operator().symbol() + operands(id).stream()
                    .map(this::repr).collect(Collectors.joining(", ", "(", ")"));
        } else {
            return node.toString();
        }
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder("generation ").append(number).append(" {\n");
        for (NodeId id : ids()) {
            str.append("  ").append(id.index()).append(": ").append(node(id));
            List<NodeId> ops = operands(id);
            if (!ops.isEmpty()) {
                str.append(ops.stream().map(op -> String.valueOf(op.index())).collect(Collectors.joining(", ", "(", ")")));
            }
            str.append("\n");
        }
        return str.append("}").toString();
    }
}
