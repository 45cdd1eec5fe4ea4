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
 * A user constraint that cannot be satisfied, traced back to the generation-0 nodes it came from.
 */
public class Contradiction {

    private final ErrorMessage error;
    private final String message;
    private final SortedSet<NodeId> origins;
    private final int hash;

    public Contradiction(ErrorMessage error, Collection<NodeId> origins, Object... parameters) {
        this.error = error;
        this.message = error.message(parameters);
        this.origins = unmodifiableSortedSet(new TreeSet<>(origins));
        this.hash = Objects.hash(error, message, this.origins);
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
        Contradiction that = (Contradiction) o;
        return error.equals(that.error) && message.equals(that.message) && origins.equals(that.origins);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return message + " (origins: " + origins + ")";
    }
}
