/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.common.parameters;

import io.hdlsolver.core.common.exception.SolverException;

import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static io.hdlsolver.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

public abstract class Options<PARENT extends Options<?, ?>, SELF extends Options<?, ?>> {

    public static final int DEFAULT_MAX_ROUNDS = 64;
    public static final boolean DEFAULT_DEDUPLICATE = false;
    public static final boolean DEFAULT_TRACE_GENERATIONS = false;

    private PARENT parent;
    private Integer maxRounds = null;
    private Boolean deduplicate = null;
    private Boolean traceGenerations = null;

    abstract SELF getThis();

    public SELF parent(PARENT parent) {
        this.parent = parent;
        return getThis();
    }

    public int maxRounds() {
        if (maxRounds != null) return maxRounds;
        else if (parent != null) return parent.maxRounds();
        else return DEFAULT_MAX_ROUNDS;
    }

    public SELF maxRounds(int maxRounds) {
        if (maxRounds < 1) throw SolverException.of(ILLEGAL_ARGUMENT);
        this.maxRounds = maxRounds;
        return getThis();
    }

    /**
     * Whether the mutator merges congruent expressions when it publishes a generation.
     * Correctness never depends on this being enabled.
     */
    public boolean deduplicate() {
        if (deduplicate != null) return deduplicate;
        else if (parent != null) return parent.deduplicate();
        else return DEFAULT_DEDUPLICATE;
    }

    public SELF deduplicate(boolean deduplicate) {
        this.deduplicate = deduplicate;
        return getThis();
    }

    public boolean traceGenerations() {
        if (traceGenerations != null) return traceGenerations;
        else if (parent != null) return parent.traceGenerations();
        else return DEFAULT_TRACE_GENERATIONS;
    }

    public SELF traceGenerations(boolean traceGenerations) {
        this.traceGenerations = traceGenerations;
        return getThis();
    }

    public static class Global extends Options<Options<?, ?>, Global> {

        @Override
        Global getThis() {
            return this;
        }

        @Override
        public Global parent(Options<?, ?> parent) {
            throw SolverException.of(ILLEGAL_STATE);
        }
    }

    public static class Solve extends Options<Global, Solve> {

        @Override
        Solve getThis() {
            return this;
        }
    }
}
