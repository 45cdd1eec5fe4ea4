/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver;

import io.hdlsolver.core.mutator.Mutator;

/**
 * A pass of the solver. A pass reads the mutator's input generation and records its rewrites on the
 * mutator; it never keeps state between runs.
 */
public interface Algorithm {

    String name();

    void run(Mutator mutator);
}
