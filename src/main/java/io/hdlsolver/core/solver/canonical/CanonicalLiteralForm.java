/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.canonical;

import io.hdlsolver.core.graph.Generation;
import io.hdlsolver.core.graph.LiteralNode;
import io.hdlsolver.core.graph.NodeId;
import io.hdlsolver.core.graph.ParameterNode;
import io.hdlsolver.core.literal.Literal;
import io.hdlsolver.core.mutator.Mutator;
import io.hdlsolver.core.solver.Algorithm;

import java.util.List;
import javax.annotation.Nullable;

/**
 * Turns raw constants into literal nodes and stores every quantity in base units without a unit.
 * The stripped unit stays on the literal node; parameters keep their own declared unit.
 */
public class CanonicalLiteralForm implements Algorithm {

    @Override
    public String name() {
        return "canonical-literal-form";
    }

    @Override
    public void run(Mutator mutator) {
        Generation input = mutator.input();
        for (NodeId id : input.constants()) {
            Literal literal = input.node(id).asConstant().toLiteral();
            mutator.replace(id, mutator.createLiteral(canonical(literal), List.of(id)), List.of());
        }
        for (NodeId id : input.literals()) {
            Literal literal = input.node(id).asLiteral().literal();
            if (literal.isCanonical()) continue;
            mutator.replace(id, mutator.createLiteral(canonical(literal), List.of(id)), List.of());
        }
        for (NodeId id : input.parameters()) {
            ParameterNode parameter = input.parameter(id);
            ParameterNode canonical = parameter
                    .withWithin(canonicalValue(parameter.within()))
                    .withSoftSet(canonicalValue(parameter.softSet()))
                    .withGuess(canonicalValue(parameter.guess()));
            mutator.mutateParameter(id, canonical);
        }
    }

    private static LiteralNode canonical(Literal literal) {
        if (literal.isQuantity() && !literal.isCanonical()) {
            return LiteralNode.canonical(literal.asQuantity().canonical(), literal.asQuantity().unit());
        }
        return LiteralNode.of(literal);
    }

    @Nullable
    private static Literal canonicalValue(@Nullable Literal literal) {
        if (literal == null || !literal.isQuantity()) return literal;
        return literal.asQuantity().canonical();
    }
}
