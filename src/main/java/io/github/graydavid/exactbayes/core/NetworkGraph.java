/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.github.graydavid.exactbayes.core.NetworkObservers.Observer;
import io.github.graydavid.exactbayes.core.NetworkObservers.Rejection;

/**
 * A Bayesian network: a set of {@link Node}s linked into a directed acyclic graph by their declared parents.
 *
 * Networks are built incrementally, one node at a time, and in any order. A node may name a parent that hasn't been
 * added yet. That edge is kept pending, keyed by the missing parent, and is realized the moment the parent is added.
 * The realized graph (nodes plus realized edges, ignoring pending ones) is always acyclic: an addition that would
 * introduce a cycle is rejected and leaves the network exactly as it was. To guarantee that, tentative edges are
 * applied to a throwaway copy of the realized graph and checked there, rather than applied and rolled back.
 *
 * Construction problems (duplicate names, cycles, self-referencing parents) are expected while assembling a network
 * in stages, and so they are reported as boolean outcomes and {@link Observer} events, not as exceptions.
 *
 * This class is not thread-safe.
 */
public class NetworkGraph {
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> pendingParentToChildren = new LinkedHashMap<>();
    private final Observer observer;
    private DirectedGraph realized = DirectedGraph.empty();

    private NetworkGraph(Observer observer) {
        this.observer = Objects.requireNonNull(observer);
    }

    /** Creates an empty network that observes nothing. */
    public static NetworkGraph empty() {
        return empty(Observer.doNothing());
    }

    /** Creates an empty network whose construction events are reported to observer. */
    public static NetworkGraph empty(Observer observer) {
        return new NetworkGraph(observer);
    }

    /**
     * Creates a network seeded by calling {@link #addNode(Node)} for each node, in iteration order. Nodes refused by
     * addNode are simply left out.
     */
    public static NetworkGraph fromNodes(Collection<Node> nodes) {
        return fromNodes(nodes, Observer.doNothing());
    }

    /** Same as {@link #fromNodes(Collection)}, except reporting construction events to observer. */
    public static NetworkGraph fromNodes(Collection<Node> nodes, Observer observer) {
        NetworkGraph network = empty(observer);
        nodes.forEach(network::addNode);
        return network;
    }

    /**
     * Tries to add node to this network.
     *
     * The node's edges are linked on a copy of the realized graph first: an edge from each declared parent that's
     * already present, and an edge to each child left pending on this node. If that copy contains a cycle, the node
     * is refused. Otherwise, the copy becomes the realized graph, parents that are still missing are recorded as
     * pending, pending edges waiting on this node are resolved, and the node is stored.
     *
     * A parent naming the node itself is skipped rather than treated as a cycle: the node is still added, minus that
     * edge, and {@link Observer#observeSelfParentSkipped(Node)} is notified.
     *
     * @return true if the node was added; false if the network already has a node with the same name or if adding
     *         it would have created a cycle. In the latter cases, the network is left unchanged.
     */
    public boolean addNode(Node node) {
        String name = node.getName();
        if (nodes.containsKey(name)) {
            observer.observeNodeRejected(node, Rejection.DUPLICATE_NAME, List.of());
            return false;
        }

        DirectedGraph tentative = realized.copy();
        tentative.addNode(name);
        List<String> missingParents = new ArrayList<>();
        boolean hasSelfParent = false;
        for (String parent : node.getParents()) {
            if (parent.equals(name)) {
                hasSelfParent = true;
            } else if (tentative.containsNode(parent)) {
                tentative.addEdge(parent, name);
            } else {
                missingParents.add(parent);
            }
        }
        pendingParentToChildren.getOrDefault(name, List.of()).forEach(child -> tentative.addEdge(name, child));

        Optional<List<String>> cycle = tentative.findCycle();
        if (cycle.isPresent()) {
            observer.observeNodeRejected(node, Rejection.CYCLE, cycle.get());
            return false;
        }

        realized = tentative;
        missingParents.forEach(
                parent -> pendingParentToChildren.computeIfAbsent(parent, p -> new ArrayList<>()).add(name));
        pendingParentToChildren.remove(name);
        nodes.put(name, node);
        if (hasSelfParent) {
            observer.observeSelfParentSkipped(node);
        }
        observer.observeNodeAdded(node);
        return true;
    }

    /**
     * Removes the node with the given name: its record, its realized edges, and its place in every list of children
     * waiting on a missing parent (lists left empty are dropped). Children of the removed node keep declaring it as a
     * parent, and so their edges from it become pending again: re-adding a node with that name realizes them, and is
     * refused if they would close a cycle.
     *
     * @return true if the node was present and is now removed; false if it was absent, in which case nothing changes.
     */
    public boolean removeNode(String name) {
        Node removed = nodes.remove(name);
        if (removed == null) {
            return false;
        }

        pendingParentToChildren.values().forEach(children -> children.remove(name));
        pendingParentToChildren.values().removeIf(List::isEmpty);
        List<String> childrenOfRemoved = new ArrayList<>(realized.getChildrenOf(name));
        if (!childrenOfRemoved.isEmpty()) {
            pendingParentToChildren.put(name, childrenOfRemoved);
        }
        realized.removeNode(name);
        observer.observeNodeRemoved(removed);
        return true;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public Optional<Node> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /** Returns all nodes, keyed by name, in the order they were added. */
    public Map<String, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /** Returns the realized edges of this network. Pending edges are not included. */
    public Set<Edge> getAllEdges() {
        return realized.getEdges();
    }

    /**
     * Returns a snapshot of the pending edges: a mapping from each missing parent name to the names of the children
     * waiting on it, in the order they were added.
     */
    public Map<String, List<String>> getPendingEdges() {
        Map<String, List<String>> snapshot = new LinkedHashMap<>();
        pendingParentToChildren.forEach((parent, children) -> snapshot.put(parent, List.copyOf(children)));
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Returns the names of the parents of name linked through realized edges.
     *
     * @throws IllegalArgumentException if name is not part of this network.
     */
    public Set<String> getParentsOf(String name) {
        return realized.getParentsOf(name);
    }

    /**
     * Returns the names of the children of name linked through realized edges.
     *
     * @throws IllegalArgumentException if name is not part of this network.
     */
    public Set<String> getChildrenOf(String name) {
        return realized.getChildrenOf(name);
    }

    /**
     * Returns the node names in an order consistent with the realized edges: parents come before their children.
     * Each iteration lazily computes a fresh order over the network as it is when the iteration starts, with ties
     * broken by the order nodes were added.
     */
    public Iterable<String> topologicalOrder() {
        return () -> realized.topologicalIterator();
    }

    /** Returns the mapping from each node name to its values, in the order nodes were added. */
    public Map<String, List<String>> symbolTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        nodes.forEach((name, node) -> table.put(name, node.getValues()));
        return Collections.unmodifiableMap(table);
    }

    /**
     * Returns the ancestral closure of names: the names themselves plus every name reachable by repeatedly following
     * declared parents. These are the only variables needed to calculate joint probabilities over names exactly.
     *
     * @throws IllegalArgumentException if any of names is not part of this network.
     * @throws IllegalStateException if a node in the closure declares a parent that is not part of this network,
     *         since that node's CPT can't be evaluated.
     */
    public Set<String> ancestralClosure(Collection<String> names) {
        names.forEach(name -> {
            if (!nodes.containsKey(name)) {
                String message = String.format("Node '%s' is not part of this network: %s", name, nodes.keySet());
                throw new IllegalArgumentException(message);
            }
        });

        Set<String> closure = new LinkedHashSet<>();
        Deque<String> toVisit = new ArrayDeque<>(names);
        while (!toVisit.isEmpty()) {
            String name = toVisit.removeFirst();
            if (closure.add(name)) {
                Node node = nodes.get(name);
                for (String parent : node.getParents()) {
                    if (!nodes.containsKey(parent)) {
                        String message = String.format(
                                "Node '%s' declares parent '%s', which is not part of this network", name, parent);
                        throw new IllegalStateException(message);
                    }
                    toVisit.addLast(parent);
                }
            }
        }
        return closure;
    }

    @Override
    public String toString() {
        return nodes.keySet().stream().collect(Collectors.joining(", ", "nodes=(", ")")) + ";edges="
                + realized.getEdges();
    }
}
