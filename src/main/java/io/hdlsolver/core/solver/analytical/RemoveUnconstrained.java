/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.analytical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.Node;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;

/**
 * Removes expressions and literals nothing depends on. Parameters always stay, so that they can be
 * queried even when unconstrained.
 */
public class RemoveUnconstrained implements Algorithm {

    @Override
    public String name() {
        return "remove-unconstrained";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.ids()) {
            Node node = input.node(id);
            if (node.isParameter() || !input.users(id).isEmpty()) continue;
            if (node.isExpression() && node.asExpression().isAsserted()) continue;
            mutator.remove(id);
        }
    }
}
