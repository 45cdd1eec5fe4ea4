/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.mutator;

import io.hdlsolver.core.common.collection.Pair;
import io.hdlsolver.core.common.exception.ErrorMessage;
import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.common.parameters.Options;
import io.hdlsolver.core.graph.ExpressionNode;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.GraphBuilder;
import io.hdlsolver.core.graph.LiteralNode;
import io.hdlsolver.core.graph.Node;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.graph.ParameterNode;
import io.hdlsolver.core.graph.Provenance;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.solver.diagnostic.Diagnostics;
import io.hdlsolver.core.solver.diagnostic.Warning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.MISSING_PROVENANCE;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.MUTATOR_CLOSED;
import static java.util.Collections.unmodifiableMap;

/**
 * Derives the next generation from an input generation that it never modifies.
 * <p>
 * Operations take references that are either ids of the input generation or provisional ids handed
 * out by this mutator for nodes it created. On {@link #close()} every untouched input node is copied,
 * removals cascade to the expressions that used a removed node, provisional ids are resolved and the
 * provenance of every output node is merged from the nodes it was derived from.
 */
public class Mutator {

    private static final Logger LOG = LoggerFactory.getLogger(Mutator.class);

    private final Generation input;
    private final int output;
    private final String algorithm;
    private final Options.Solve options;
    private final Diagnostics diagnostics;
    private final List<Staged> staged;
    private final Map<NodeId, NodeId> redirects;
    private final Map<NodeId, Set<NodeId>> extraFrom;
    private final Set<NodeId> removed;
    private final Set<String> names;
    private int freshNames;
    private boolean closed;

    public Mutator(Generation input, String algorithm, Options.Solve options, Diagnostics diagnostics) {
        this.input = input;
        this.output = input.number() + 1;
        this.algorithm = algorithm;
        this.options = options;
        this.diagnostics = diagnostics;
        this.staged = new ArrayList<>();
        this.redirects = new HashMap<>();
        this.extraFrom = new HashMap<>();
        this.removed = new HashSet<>();
        this.names = input.parameters().stream().map(p -> input.parameter(p).name()).collect(Collectors.toSet());
        this.freshNames = 0;
        this.closed = false;
    }

    public Mutator(Generation input, String algorithm) {
        this(input, algorithm, new Options.Solve(), new Diagnostics());
    }

    private static class Staged {

        private Node node;
        private List<NodeId> operands;
        private final Set<NodeId> from;

        private Staged(Node node, List<NodeId> operands, Collection<NodeId> from) {
            this.node = node;
            this.operands = new ArrayList<>(operands);
            this.from = new HashSet<>(from);
        }
    }

    public Generation input() {
        return input;
    }

    public String algorithm() {
        return algorithm;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    private boolean isProvisional(NodeId ref) {
        return ref.generation() == output;
    }

    private void validateOpen() {
        if (closed) throw SolverException.of(MUTATOR_CLOSED, input.number());
    }

    private NodeId stage(Node node, List<NodeId> operands, Collection<NodeId> from) {
        validateOpen();
        for (NodeId op : operands) validateRef(op);
        staged.add(new Staged(node, operands, from));
        return NodeId.of(output, staged.size() - 1);
    }

    private void validateRef(NodeId ref) {
        if (isProvisional(ref)) {
            if (ref.index() >= staged.size()) throw SolverException.of(ILLEGAL_STATE);
        } else if (!input.contains(ref)) {
            throw SolverException.of(ErrorMessage.Internal.FOREIGN_NODE, ref, input.number());
        }
    }

    /**
     * The reference that currently stands for an input node: itself, or the node it was mutated into
     * or replaced by during this pass.
     */
    public NodeId current(NodeId ref) {
        NodeId current = ref;
        while (redirects.containsKey(current)) current = redirects.get(current);
        return current;
    }

    public boolean isTouched(NodeId id) {
        return redirects.containsKey(id) || removed.contains(id);
    }

    public NodeId mutateParameter(NodeId id, ParameterNode replacement) {
        validateOpen();
        NodeId current = redirects.get(id);
        if (current != null && isProvisional(current) && staged.get(current.index()).from.contains(id)) {
            staged.get(current.index()).node = replacement;
            return current;
        }
        if (input.parameter(id).equals(replacement)) return id;
        NodeId mutated = stage(replacement, List.of(), List.of(id));
        redirects.put(id, mutated);
        return mutated;
    }

    public NodeId mutateExpression(NodeId id, ExpressionNode replacement, List<NodeId> operands) {
        validateOpen();
        input.expression(id);
        NodeId current = redirects.get(id);
        if (current != null && isProvisional(current) && staged.get(current.index()).from.contains(id)) {
            for (NodeId op : operands) validateRef(op);
            Staged entry = staged.get(current.index());
            entry.node = replacement;
            entry.operands = new ArrayList<>(operands);
            return current;
        }
        if (input.node(id).equals(replacement) && input.operands(id).equals(operands)) return id;
        NodeId mutated = stage(replacement, operands, List.of(id));
        redirects.put(id, mutated);
        return mutated;
    }

    public NodeId mutateExpression(NodeId id, Operator operator, List<NodeId> operands) {
        return mutateExpression(id, ExpressionNode.of(operator).withAsserted(pending(id).node.asExpression().isAsserted()), operands);
    }

    public NodeId mutateExpression(NodeId id, UnaryOperator<NodeId> operandTransform) {
        Staged pending = pending(id);
        List<NodeId> operands = pending.operands.stream().map(operandTransform).collect(Collectors.toList());
        return mutateExpression(id, pending.node.asExpression(), operands);
    }

    public NodeId mutateExpression(NodeId id, boolean asserted) {
        Staged pending = pending(id);
        return mutateExpression(id, pending.node.asExpression().withAsserted(asserted), pending.operands);
    }

    /**
     * The payload and operands an input expression has so far in this pass, including earlier mutations.
     */
    private Staged pending(NodeId id) {
        NodeId current = redirects.get(id);
        if (current != null && isProvisional(current) && staged.get(current.index()).from.contains(id)) {
            return staged.get(current.index());
        }
        return new Staged(input.expression(id), input.operands(id), List.of(id));
    }

    public NodeId createExpression(Operator operator, List<NodeId> operands, boolean asserted, Collection<NodeId> from) {
        validateFrom(from);
        return stage(ExpressionNode.of(operator).withAsserted(asserted), operands, from);
    }

    public NodeId createLiteral(Literal literal, Collection<NodeId> from) {
        return createLiteral(LiteralNode.of(literal), from);
    }

    public NodeId createLiteral(LiteralNode literal, Collection<NodeId> from) {
        validateFrom(from);
        return stage(literal, List.of(), from);
    }

    /**
     * Creates a parameter, giving it a fresh diagnostic name when it has none.
     */
    public NodeId createParameter(ParameterNode parameter, Collection<NodeId> from) {
        validateFrom(from);
        if (parameter.name() == null) {
            String name;
            do {
                name = "_" + GraphBuilder.shortName(freshNames++);
            } while (names.contains(name));
            parameter = parameter.withName(name);
        }
        names.add(parameter.name());
        return stage(parameter, List.of(), from);
    }

    private void validateFrom(Collection<NodeId> from) {
        if (from.isEmpty()) throw SolverException.of(MISSING_PROVENANCE, algorithm);
        for (NodeId ref : from) validateRef(ref);
    }

    /**
     * Redirects every user of an input node to another node, which inherits the replaced node's provenance.
     */
    public void replace(NodeId id, NodeId replacement, Collection<NodeId> from) {
        validateOpen();
        validateRef(replacement);
        if (id.equals(replacement)) return;
        redirects.put(id, replacement);
        Set<NodeId> extra = extraFrom.computeIfAbsent(replacement, r -> new HashSet<>());
        extra.add(id);
        extra.addAll(from);
    }

    /**
     * Removes a node. Expressions that use it, directly or transitively, are removed on close.
     */
    public void remove(NodeId ref) {
        validateOpen();
        validateRef(ref);
        removed.add(ref);
        if (LOG.isTraceEnabled()) LOG.trace("{} removes {}", algorithm, ref);
    }

    public void warn(ErrorMessage error, NodeId origin, Object... parameters) {
        diagnostics.warn(new Warning(error, origins(origin), parameters));
    }

    private SortedSet<NodeId> origins(NodeId ref) {
        SortedSet<NodeId> origins = new TreeSet<>();
        for (NodeId id : inputSources(ref, new HashSet<>())) origins.addAll(input.origins(id));
        return origins;
    }

    private Set<NodeId> inputSources(NodeId ref, Set<NodeId> visited) {
        Set<NodeId> sources = new HashSet<>();
        if (!visited.add(ref)) return sources;
        if (!isProvisional(ref)) {
            sources.add(ref);
        } else {
            for (NodeId from : staged.get(ref.index()).from) sources.addAll(inputSources(from, visited));
        }
        Set<NodeId> extra = extraFrom.get(ref);
        if (extra != null) for (NodeId from : extra) sources.addAll(inputSources(from, visited));
        return sources;
    }

    public Result close() {
        validateOpen();
        closed = true;

        // one entry per output candidate: mutated or copied input nodes in input order, then created nodes
        List<NodeId> entries = new ArrayList<>();
        Map<NodeId, Integer> entryOf = new HashMap<>();
        Set<Integer> mutationsPlaced = new HashSet<>();
        for (NodeId id : input.ids()) {
            NodeId target = redirects.get(id);
            if (target == null) {
                entryOf.put(id, entries.size());
                entries.add(id);
            } else if (isProvisional(target) && staged.get(target.index()).from.contains(id)
                    && mutationsPlaced.add(target.index())) {
                entryOf.put(target, entries.size());
                entries.add(target);
            }
        }
        for (int i = 0; i < staged.size(); i++) {
            NodeId ref = NodeId.of(output, i);
            if (!entryOf.containsKey(ref)) {
                entryOf.put(ref, entries.size());
                entries.add(ref);
            }
        }

        int[] resolved = new int[entries.size()];
        boolean[] alive = new boolean[entries.size()];
        for (int e = 0; e < entries.size(); e++) alive[e] = !removed.contains(entries.get(e));

        // removal cascade
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int e = 0; e < entries.size(); e++) {
                if (!alive[e]) continue;
                for (NodeId op : operandRefs(entries.get(e))) {
                    Integer target = resolve(op, entryOf);
                    if (target == null || !alive[target]) {
                        alive[e] = false;
                        changed = true;
                        break;
                    }
                }
            }
        }

        int[] canonicalEntry = new int[entries.size()];
        for (int e = 0; e < entries.size(); e++) canonicalEntry[e] = e;
        int merged = options.deduplicate() ? deduplicate(entries, entryOf, alive, canonicalEntry) : 0;

        int size = 0;
        for (int e = 0; e < entries.size(); e++) {
            resolved[e] = alive[e] && canonicalEntry[e] == e ? size++ : -1;
        }

        List<Node> nodes = new ArrayList<>(size);
        List<List<NodeId>> operands = new ArrayList<>(size);
        List<Set<NodeId>> sources = new ArrayList<>(size);
        for (int e = 0; e < entries.size(); e++) {
            if (resolved[e] < 0) continue;
            NodeId ref = entries.get(e);
            nodes.add(payload(ref));
            List<NodeId> ops = new ArrayList<>();
            for (NodeId op : operandRefs(ref)) {
                ops.add(NodeId.of(output, resolved[canonicalEntry[resolve(op, entryOf)]]));
            }
            operands.add(ops);
            sources.add(inputSources(ref, new HashSet<>()));
        }
        for (int e = 0; e < entries.size(); e++) {
            if (alive[e] && canonicalEntry[e] != e) {
                sources.get(resolved[canonicalEntry[e]]).addAll(inputSources(entries.get(e), new HashSet<>()));
            }
        }

        List<Provenance> provenance = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Set<NodeId> derivedFrom = sources.get(i);
            if (derivedFrom.isEmpty()) throw SolverException.of(MISSING_PROVENANCE, algorithm);
            Set<NodeId> origins = new TreeSet<>();
            for (NodeId id : derivedFrom) origins.addAll(input.origins(id));
            provenance.add(Provenance.derived(derivedFrom, origins));
        }

        Map<NodeId, NodeId> mapping = new LinkedHashMap<>();
        for (NodeId id : input.ids()) {
            Integer entry = resolve(id, entryOf);
            if (entry != null && alive[entry]) mapping.put(id, NodeId.of(output, resolved[canonicalEntry[entry]]));
        }

        boolean dirty = !staged.isEmpty() || !removed.isEmpty() || !redirects.isEmpty() || merged > 0;
        Generation generation = Generation.of(output, nodes, operands, provenance);
        if (dirty && LOG.isDebugEnabled()) {
            LOG.debug("{} published generation {}: {} staged, {} removed, {} redirected, {} merged",
                    algorithm, output, staged.size(), removed.size(), redirects.size(), merged);
        }
        return new Result(algorithm, generation, mapping, dirty);
    }

    private Node payload(NodeId ref) {
        return isProvisional(ref) ? staged.get(ref.index()).node : input.node(ref);
    }

    private List<NodeId> operandRefs(NodeId ref) {
        return isProvisional(ref) ? staged.get(ref.index()).operands : input.operands(ref);
    }

    private Integer resolve(NodeId ref, Map<NodeId, Integer> entryOf) {
        Set<NodeId> visited = new HashSet<>();
        NodeId current = ref;
        while (true) {
            if (removed.contains(current)) return null;
            Integer entry = entryOf.get(current);
            NodeId next = redirects.get(current);
            if (next == null) return entry;
            if (!visited.add(current)) throw SolverException.of(ILLEGAL_STATE);
            current = next;
        }
    }

    /**
     * Merges congruent expressions: same payload and the same operands, up to order for commutative
     * operators. Processed shallowest first so that merges of operands are visible to their users.
     */
    private int deduplicate(List<NodeId> entries, Map<NodeId, Integer> entryOf, boolean[] alive, int[] canonicalEntry) {
        int[] depth = new int[entries.size()];
        for (int e = 0; e < entries.size(); e++) depth[e] = -1;
        List<Integer> order = new ArrayList<>();
        for (int e = 0; e < entries.size(); e++) {
            if (alive[e]) order.add(e);
        }
        order.sort((a, b) -> {
            int cmp = Integer.compare(depth(a, entries, entryOf, depth), depth(b, entries, entryOf, depth));
            return cmp != 0 ? cmp : Integer.compare(a, b);
        });
        Map<Pair<Node, List<Integer>>, Integer> seen = new HashMap<>();
        int merged = 0;
        for (int e : order) {
            Node node = payload(entries.get(e));
            if (!node.isExpression()) continue;
            List<Integer> ops = new ArrayList<>();
            for (NodeId op : operandRefs(entries.get(e))) ops.add(canonicalEntry[resolve(op, entryOf)]);
            if (node.asExpression().operator().isCommutative()) ops.sort(null);
            Pair<Node, List<Integer>> key = new Pair<>(node, ops);
            Integer first = seen.putIfAbsent(key, e);
            if (first != null) {
                canonicalEntry[e] = first;
                merged++;
            }
        }
        return merged;
    }

    private int depth(int entry, List<NodeId> entries, Map<NodeId, Integer> entryOf, int[] depth) {
        if (depth[entry] >= 0) return depth[entry];
        int d = 0;
        for (NodeId op : operandRefs(entries.get(entry))) {
            d = Math.max(d, depth(resolve(op, entryOf), entries, entryOf, depth) + 1);
        }
        depth[entry] = d;
        return d;
    }

    public static class Result {

        private final String algorithm;
        private final Generation generation;
        private final Map<NodeId, NodeId> mapping;
        private final boolean dirty;

        Result(String algorithm, Generation generation, Map<NodeId, NodeId> mapping, boolean dirty) {
            this.algorithm = algorithm;
            this.generation = generation;
            this.mapping = unmodifiableMap(mapping);
            this.dirty = dirty;
        }

        public String algorithm() {
            return algorithm;
        }

        public Generation generation() {
            return generation;
        }

        /**
         * Input node to output node, for every input node that survived.
         */
        public Map<NodeId, NodeId> mapping() {
            return mapping;
        }

        public boolean isDirty() {
            return dirty;
        }
    }
}
