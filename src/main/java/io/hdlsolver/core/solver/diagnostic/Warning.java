/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.solver.diagnostic;

import io.hdlsolver.core.common.exception.ErrorMessage;
import io.hdlsolver.core.graph.NodeId;

import java.util.Collection;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Collections.unmodifiableSortedSet;

/**
 * A construct the solver could not represent exactly and therefore weakened or dropped.
 */
public class Warning {

    private final ErrorMessage error;
    private final String message;
    private final SortedSet<NodeId> origins;

    public Warning(ErrorMessage error, Collection<NodeId> origins, Object... parameters) {
        this.error = error;
        this.message = error.message(parameters);
        this.origins = unmodifiableSortedSet(new TreeSet<>(origins));
    }

    public ErrorMessage error() {
        return error;
    }

    public String message() {
        return message;
    }

    public SortedSet<NodeId> origins() {
        return origins;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Warning that = (Warning) o;
        return error.equals(that.error) && message.equals(that.message) && origins.equals(that.origins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error, message, origins);
    }

    @Override
    public String toString() {
        return message + " (origins: " + origins + ")";
    }
}
