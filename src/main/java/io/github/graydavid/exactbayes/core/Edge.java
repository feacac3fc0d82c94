/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.Objects;

/**
 * A realized edge in a network: a connection from a parent node to a child node that declares it as a parent. Edges
 * only exist once both endpoints are part of the same {@link NetworkGraph}.
 *
 * @apiNote Edges refer to nodes by name rather than by Node, because they are meant to *describe* a network's
 *          structure, and names are what declarations of parents use.
 */
public class Edge {
    private final String parent;
    private final String child;

    public Edge(String parent, String child) {
        this.parent = Objects.requireNonNull(parent);
        this.child = Objects.requireNonNull(child);
    }

    public String getParent() {
        return parent;
    }

    public String getChild() {
        return child;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Edge)) {
            return false;
        }

        Edge other = (Edge) object;
        return Objects.equals(this.parent, other.parent) && Objects.equals(this.child, other.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, child);
    }

    @Override
    public String toString() {
        return "{" + parent + "}->{" + child + "}";
    }
}
