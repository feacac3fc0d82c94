/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The bare structure of a network: node names and the edges between them, with nothing else attached. Iteration
 * order everywhere is insertion order, which is what makes topological orders deterministic.
 *
 * This class doesn't guard against cycles itself. Instead, {@link NetworkGraph} applies tentative changes to a
 * {@link #copy()} and only adopts the copy if {@link #findCycle()} comes up empty.
 */
class DirectedGraph {
    private final Map<String, Set<String>> nodeToChildren;
    private final Map<String, Set<String>> nodeToParents;

    private DirectedGraph(Map<String, Set<String>> nodeToChildren, Map<String, Set<String>> nodeToParents) {
        this.nodeToChildren = nodeToChildren;
        this.nodeToParents = nodeToParents;
    }

    static DirectedGraph empty() {
        return new DirectedGraph(new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /** Creates an independent copy: changes to either graph are invisible to the other. */
    DirectedGraph copy() {
        return new DirectedGraph(deepCopy(nodeToChildren), deepCopy(nodeToParents));
    }

    private static Map<String, Set<String>> deepCopy(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        adjacency.forEach((node, neighbors) -> copy.put(node, new LinkedHashSet<>(neighbors)));
        return copy;
    }

    boolean containsNode(String node) {
        return nodeToChildren.containsKey(node);
    }

    Set<String> getNodes() {
        return Collections.unmodifiableSet(nodeToChildren.keySet());
    }

    /** Adds the node if it's not already present. */
    void addNode(String node) {
        nodeToChildren.putIfAbsent(node, new LinkedHashSet<>());
        nodeToParents.putIfAbsent(node, new LinkedHashSet<>());
    }

    /** @throws IllegalArgumentException if either endpoint is not part of this graph. */
    void addEdge(String parent, String child) {
        requireContains(parent);
        requireContains(child);
        nodeToChildren.get(parent).add(child);
        nodeToParents.get(child).add(parent);
    }

    private void requireContains(String node) {
        if (!containsNode(node)) {
            String message = String.format("Node '%s' is not part of this graph: %s", node, getNodes());
            throw new IllegalArgumentException(message);
        }
    }

    /** Removes the node along with every edge incident to it. Does nothing if the node isn't present. */
    void removeNode(String node) {
        Set<String> children = nodeToChildren.remove(node);
        Set<String> parents = nodeToParents.remove(node);
        if (children == null) {
            return;
        }
        children.forEach(child -> nodeToParents.get(child).remove(node));
        parents.forEach(parent -> nodeToChildren.get(parent).remove(node));
    }

    Set<String> getChildrenOf(String node) {
        requireContains(node);
        return Collections.unmodifiableSet(nodeToChildren.get(node));
    }

    Set<String> getParentsOf(String node) {
        requireContains(node);
        return Collections.unmodifiableSet(nodeToParents.get(node));
    }

    Set<Edge> getEdges() {
        return nodeToChildren.entrySet()
                .stream()
                .flatMap(entry -> entry.getValue().stream().map(child -> new Edge(entry.getKey(), child)))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Searches for a cycle with a depth-first traversal from every node.
     *
     * @return the nodes of the first cycle found, in edge order, with the starting node repeated at the end (e.g.
     *         [A, C, B, A]); or empty if the graph is acyclic.
     */
    Optional<List<String>> findCycle() {
        Set<String> alreadyCheckedNodes = new HashSet<>();
        for (String node : nodeToChildren.keySet()) {
            Optional<List<String>> cycle = checkNode(node, new LinkedHashSet<>(), alreadyCheckedNodes);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> checkNode(String node, Set<String> currentPath, Set<String> alreadyCheckedNodes) {
        // Base case 1 (Fail): we've already encountered this node in the current path
        if (currentPath.contains(node)) {
            List<String> path = List.copyOf(currentPath);
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            cycle.add(node);
            return Optional.of(cycle);
        }

        // Base case 2 (Pass): we've already checked this node (optimization)
        if (alreadyCheckedNodes.contains(node)) {
            return Optional.empty();
        }

        // Recurse
        currentPath.add(node);
        for (String child : nodeToChildren.get(node)) {
            Optional<List<String>> cycle = checkNode(child, currentPath, alreadyCheckedNodes);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        currentPath.remove(node);
        alreadyCheckedNodes.add(node);
        return Optional.empty();
    }

    /**
     * Returns an iterator over the node names in topological order: every parent comes before its children. The
     * order is computed lazily, one node per call to next, over a snapshot of this graph taken now, so later changes
     * to the graph don't affect an iterator already created. Ties are broken by insertion order.
     *
     * @throws IllegalStateException from {@link Iterator#next()} if the snapshot turns out to contain a cycle.
     */
    Iterator<String> topologicalIterator() {
        return new TopologicalIterator(copy());
    }

    /** Kahn's algorithm, advanced one node at a time. */
    private static class TopologicalIterator implements Iterator<String> {
        private final DirectedGraph snapshot;
        private final Map<String, Integer> remainingParentCounts = new HashMap<>();
        private final Deque<String> ready = new ArrayDeque<>();
        private int emitted = 0;

        TopologicalIterator(DirectedGraph snapshot) {
            this.snapshot = snapshot;
            snapshot.nodeToParents.forEach((node, parents) -> {
                remainingParentCounts.put(node, parents.size());
                if (parents.isEmpty()) {
                    ready.addLast(node);
                }
            });
        }

        @Override
        public boolean hasNext() {
            if (ready.isEmpty() && emitted < remainingParentCounts.size()) {
                throw new IllegalStateException("Graph contains a cycle: " + snapshot.findCycle().orElseThrow());
            }
            return !ready.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String node = ready.removeFirst();
            emitted++;
            for (String child : snapshot.nodeToChildren.get(node)) {
                int remaining = remainingParentCounts.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    ready.addLast(child);
                }
            }
            return node;
        }
    }
}
