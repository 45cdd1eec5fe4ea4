/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver;

import io.hdlsolver.core.common.exception.SolverException;
import io.hdlsolver.core.common.parameters.Options;
import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.Node;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.Operator;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.query.QueryManager;
import io.hdlsolver.core.query.SolveResult;
import io.hdlsolver.core.solver.analytical.CompressAssociative;
import io.hdlsolver.core.solver.analytical.FoldHoldingLogic;
import io.hdlsolver.core.solver.analytical.FoldLiterals;
import io.hdlsolver.core.solver.analytical.MergeSubsets;
import io.hdlsolver.core.solver.analytical.RelationToSubset;
import io.hdlsolver.core.solver.analytical.RemoveTautologies;
import io.hdlsolver.core.solver.analytical.RemoveUnconstrained;
import io.hdlsolver.core.solver.analytical.SubstituteSingletons;
import io.hdlsolver.core.solver.canonical.AliasPredicatesToTrue;
import io.hdlsolver.core.solver.canonical.CanonicalLiteralForm;
import io.hdlsolver.core.solver.canonical.CanonicalOperatorForm;
import io.hdlsolver.core.solver.canonical.DomainWithinUnification;
import io.hdlsolver.core.solver.diagnostic.Contradiction;
import io.hdlsolver.core.solver.diagnostic.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.hdlsolver.core.common.collection.Collections.list;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.NON_CANONICAL_GENERATION;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ROUND_LIMIT_EXCEEDED;

/**
 * Runs the passes in a fixed order, round after round, until a whole round leaves the graph unchanged.
 * Every pass that changes something publishes a new generation; passes that change nothing publish none.
 */
public class Solver {

    private static final Logger LOG = LoggerFactory.getLogger(Solver.class);

    private final Options.Solve options;
    private final List<Algorithm> algorithms;

    public Solver() {
        this(new Options.Solve());
    }

    public Solver(Options.Solve options) {
        this(options, defaultAlgorithms());
    }

    public Solver(Options.Solve options, List<Algorithm> algorithms) {
        this.options = options;
        this.algorithms = list(algorithms);
    }

    public static List<Algorithm> defaultAlgorithms() {
        return list(
                new DomainWithinUnification(),
                new AliasPredicatesToTrue(),
                new CanonicalLiteralForm(),
                new CanonicalOperatorForm(),
                new CompressAssociative(),
                new FoldHoldingLogic(),
                new RelationToSubset(),
                new FoldLiterals(),
                new MergeSubsets(),
                new SubstituteSingletons(),
                new RemoveTautologies(),
                new RemoveUnconstrained()
        );
    }

    public List<Algorithm> algorithms() {
        return algorithms;
    }

    public SolveResult solve(Generation input) {
        Diagnostics diagnostics = new Diagnostics();
        for (Contradiction error : UnitInference.check(input)) diagnostics.contradiction(error);

        List<Generation> generations = new ArrayList<>();
        List<Map<NodeId, NodeId>> mappings = new ArrayList<>();
        generations.add(input);
        Generation current = input;
        int rounds = 0;
        boolean dirty = true;
        while (dirty) {
            if (rounds == options.maxRounds()) throw SolverException.of(ROUND_LIMIT_EXCEEDED, options.maxRounds());
            rounds++;
            dirty = false;
            for (Algorithm algorithm : algorithms) {
                Mutator mutator = new Mutator(current, algorithm.name(), options, diagnostics);
                algorithm.run(mutator);
                Mutator.Result result = mutator.close();
                if (!result.isDirty()) continue;
                dirty = true;
                current = result.generation();
                generations.add(current);
                mappings.add(result.mapping());
                if (options.traceGenerations() && LOG.isDebugEnabled()) {
                    LOG.debug("Round {}, {}:\n{}", rounds, algorithm.name(), current);
                }
            }
        }
        if (containsCanonicalization()) validateCanonical(current);

        for (Contradiction contradiction : new QueryManager(current).contradictions()) {
            diagnostics.contradiction(contradiction);
        }
        LOG.debug("Solved in {} round(s), {} generation(s) published, {} contradiction(s)",
                rounds, generations.size() - 1, diagnostics.contradictions().size());
        return new SolveResult(generations, mappings, diagnostics.warnings(), diagnostics.contradictions(), rounds);
    }

    private boolean containsCanonicalization() {
        boolean literals = false;
        boolean operators = false;
        for (Algorithm algorithm : algorithms) {
            if (algorithm instanceof CanonicalLiteralForm) literals = true;
            if (algorithm instanceof CanonicalOperatorForm) operators = true;
        }
        return literals && operators;
    }

    /**
     * A canonical generation has no raw constant, no quantity carrying a unit, and no operator outside
     * the canonical basis.
     */
    static void validateCanonical(Generation generation) {
        for (NodeId id : generation.ids()) {
            Node node = generation.node(id);
            if (node.isConstant()) {
                throw SolverException.of(NON_CANONICAL_GENERATION, generation.number(), generation.repr(id), "constant");
            } else if (node.isLiteral() && !node.asLiteral().literal().isCanonical()) {
                throw SolverException.of(NON_CANONICAL_GENERATION, generation.number(), generation.repr(id), "unit");
            } else if (node.isExpression()) {
                Operator operator = node.asExpression().operator();
                if (!operator.isCanonical()) {
                    throw SolverException.of(NON_CANONICAL_GENERATION, generation.number(), generation.repr(id), operator);
                }
            }
        }
    }
}
