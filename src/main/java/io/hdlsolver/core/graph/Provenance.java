/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Collections.unmodifiableSortedSet;

/**
 * Where a node came from: the nodes of the previous generation it was derived from, and the
 * generation-0 nodes it ultimately traces back to.
 */
public class Provenance {

    private final SortedSet<NodeId> derivedFrom;
    private final SortedSet<NodeId> origins;
    private final int hash;

    private Provenance(SortedSet<NodeId> derivedFrom, SortedSet<NodeId> origins) {
        this.derivedFrom = unmodifiableSortedSet(derivedFrom);
        this.origins = unmodifiableSortedSet(origins);
        this.hash = Objects.hash(derivedFrom, origins);
    }

    public static Provenance origin(NodeId id) {
        assert id.generation() == 0;
        return new Provenance(new TreeSet<>(), new TreeSet<>(Set.of(id)));
    }

    public static Provenance derived(Collection<NodeId> derivedFrom, Collection<NodeId> origins) {
        assert !origins.isEmpty();
        return new Provenance(new TreeSet<>(derivedFrom), new TreeSet<>(origins));
    }

    public SortedSet<NodeId> derivedFrom() {
        return derivedFrom;
    }

    public SortedSet<NodeId> origins() {
        return origins;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Provenance that = (Provenance) o;
        return derivedFrom.equals(that.derivedFrom) && origins.equals(that.origins);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "from " + derivedFrom + " origins " + origins;
    }
}
