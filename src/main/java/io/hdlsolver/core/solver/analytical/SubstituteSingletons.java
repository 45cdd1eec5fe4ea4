/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.analytical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces a parameter by its value wherever it is used, once its subset bounds leave a single value.
 * The parameter keeps its bounds so that it can still be queried; the expressions that used it can
 * then be folded.
 */
public class SubstituteSingletons implements Algorithm {

    private static final Logger LOG = LoggerFactory.getLogger(SubstituteSingletons.class);

    @Override
    public String name() {
        return "substitute-singletons";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId parameter : input.parameters()) {
            Literal.Kind kind = input.parameter(parameter).domain().kind();
            List<NodeId> bounds = new ArrayList<>();
            List<NodeId> uses = new ArrayList<>();
            Literal value = null;
            for (NodeId user : input.users(parameter)) {
                Optional<Literal> bound = MergeSubsets.subsetBound(input, parameter, user);
                if (bound.isEmpty()) {
                    uses.add(user);
                } else {
                    bounds.add(user);
                    if (bound.get().kind() == kind) value = value == null ? bound.get() : value.intersect(bound.get());
                }
            }
            if (value == null || uses.isEmpty() || !value.isSingleton()) continue;
            if (LOG.isTraceEnabled()) LOG.trace("Substituting {} by {}", input.repr(parameter), value);
            List<NodeId> from = new ArrayList<>(bounds);
            from.add(parameter);
            NodeId literal = mutator.createLiteral(value, from);
            for (NodeId use : uses) {
                mutator.mutateExpression(use, op -> op.equals(parameter) ? literal : op);
            }
        }
    }
}
