/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.graph;

import java.util.Objects;

/**
 * Position of a node in the arena of one generation. The generation tag lets a generation reject
 * ids that belong to another one.
 */
public class NodeId implements Comparable<NodeId> {

    private final int generation;
    private final int index;
    private final int hash;

    private NodeId(int generation, int index) {
        this.generation = generation;
        this.index = index;
        this.hash = Objects.hash(generation, index);
    }

    public static NodeId of(int generation, int index) {
        return new NodeId(generation, index);
    }

    public int generation() {
        return generation;
    }

    public int index() {
        return index;
    }

    @Override
    public int compareTo(NodeId other) {
        int cmp = Integer.compare(generation, other.generation);
        return cmp != 0 ? cmp : Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeId that = (NodeId) o;
        return generation == that.generation && index == that.index;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "#" + generation + "." + index;
    }
}
