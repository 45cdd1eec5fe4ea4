/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.query;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.solver.diagnostic.Contradiction;
import io.hdlsolver.core.solver.diagnostic.Warning;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.PARAMETER_EXPECTED;
import static io.hdlsolver.core.common.exception.ErrorMessage.Graph.UNKNOWN_NODE;
import static io.hdlsolver.core.common.exception.ErrorMessage.Solver.CONTRADICTIONS;
import static java.util.Collections.unmodifiableList;

/**
 * The outcome of a solve: every published generation, the id mappings between them, and the
 * diagnostics of the solve. Immutable.
 */
public class SolveResult {

    private final List<Generation> generations;
    private final List<Map<NodeId, NodeId>> mappings;
    private final List<Warning> warnings;
    private final List<Contradiction> contradictions;
    private final int rounds;
    private final QueryManager query;

    public SolveResult(List<Generation> generations, List<Map<NodeId, NodeId>> mappings, List<Warning> warnings,
                       List<Contradiction> contradictions, int rounds) {
        assert generations.size() == mappings.size() + 1;
        this.generations = unmodifiableList(new ArrayList<>(generations));
        this.mappings = unmodifiableList(new ArrayList<>(mappings));
        this.warnings = unmodifiableList(new ArrayList<>(warnings));
        this.contradictions = unmodifiableList(new ArrayList<>(contradictions));
        this.rounds = rounds;
        this.query = new QueryManager(result());
    }

    public Generation input() {
        return generations.get(0);
    }

    public Generation result() {
        return generations.get(generations.size() - 1);
    }

    public List<Generation> generations() {
        return generations;
    }

    public int rounds() {
        return rounds;
    }

    public QueryManager query() {
        return query;
    }

    /**
     * Follows a node of any published generation to the node that represents it in the final one.
     *
     * @return empty if the node was removed along the way
     */
    public Optional<NodeId> lookup(NodeId id) {
        int position = id.generation() - input().number();
        if (position < 0 || position >= generations.size() || !generations.get(position).contains(id)) {
            throw SolverException.of(UNKNOWN_NODE, id, id.generation());
        }
        NodeId current = id;
        for (int i = position; i < mappings.size(); i++) {
            current = mappings.get(i).get(current);
            if (current == null) return Optional.empty();
        }
        return Optional.of(current);
    }

    public Literal superset(NodeId parameter) {
        NodeId current = lookup(parameter).orElseThrow(() -> SolverException.of(UNKNOWN_NODE, parameter, result().number()));
        if (!result().node(current).isParameter()) throw SolverException.of(PARAMETER_EXPECTED, result().repr(current));
        return query.superset(current);
    }

    public Optional<Literal> trySingle(NodeId parameter) {
        Literal superset = superset(parameter);
        return superset.isSingleton() ? Optional.of(superset) : Optional.empty();
    }

    public List<Warning> warnings() {
        return warnings;
    }

    public List<Contradiction> contradictions() {
        return contradictions;
    }

    public boolean isSatisfiable() {
        return contradictions.isEmpty();
    }

    /**
     * @throws SolverException listing every contradiction, if there is any
     */
    public void requireSatisfiable() {
        if (isSatisfiable()) return;
        String listing = contradictions.stream().map(c -> "- " + c).collect(Collectors.joining("\n"));
        throw SolverException.of(CONTRADICTIONS, contradictions.size(), listing);
    }
}
