/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * A random variable in a Bayesian network: its name, the values it can take, the names of its parents, and its
 * conditional probability table (CPT). Nodes are immutable and only describe a variable; it's
 * {@link NetworkGraph} that links them together.
 *
 * The CPT is keyed by {@link #cptKey(List)} of a combination: the parent values in declared parent order followed
 * by this node's own value. Completeness of the table can only be judged against the parents' value sets, which a
 * Node doesn't know, and so that is left to whoever builds the Node (e.g.
 * {@link io.github.graydavid.exactbayes.definition.NetworkDefinitionReader}). Each key is still checked for shape
 * here: one component per parent plus one declared own value.
 *
 * Parents may name Nodes that have not been added to a network yet. A parent naming the Node itself is accepted:
 * NetworkGraph skips that edge when the Node is added.
 */
public class Node {
    private static final Pattern CPT_KEY = Pattern.compile("\\([^(),\\s]+(,[^(),\\s]+)*\\)");

    private final String name;
    private final List<String> values;
    private final List<String> parents;
    private final Map<String, Double> cpt;

    private Node(String name, List<String> values, List<String> parents, Map<String, Double> cpt) {
        this.name = requireValidName(name);
        this.values = requireDistinct("values", List.copyOf(values));
        this.parents = requireDistinct("parents", List.copyOf(parents));
        if (this.values.isEmpty()) {
            throw new IllegalArgumentException(String.format("Node '%s' must have at least one value", name));
        }
        this.cpt = Collections.unmodifiableMap(new LinkedHashMap<>(requireValidCpt(cpt)));
    }

    private static String requireValidName(String name) {
        if (name.isBlank()) {
            StringJoiner codePoints = name.codePoints()
                    .collect(() -> new StringJoiner(", ", "[", "]"),
                            (joiner, point) -> joiner.add(String.valueOf(point)), StringJoiner::merge);
            throw new IllegalArgumentException(
                    "Node names must not be blank but found whitespace character in code points: " + codePoints);
        }
        return name;
    }

    private List<String> requireDistinct(String description, List<String> elements) {
        Set<String> seen = new HashSet<>();
        for (String element : elements) {
            if (!seen.add(element)) {
                String message = String.format("Node '%s' declares %s '%s' more than once: %s", name, description,
                        element, elements);
                throw new IllegalArgumentException(message);
            }
        }
        return elements;
    }

    private Map<String, Double> requireValidCpt(Map<String, Double> cpt) {
        cpt.forEach((key, probability) -> {
            Objects.requireNonNull(probability);
            if (!CPT_KEY.matcher(key).matches()) {
                String message = String.format(
                        "Node '%s' has CPT key '%s' which is not of the form '(v1,v2,...,vn)'", name, key);
                throw new IllegalArgumentException(message);
            }
            List<String> components = Arrays.asList(key.substring(1, key.length() - 1).split(","));
            if (components.size() != parents.size() + 1) {
                String message = String.format(
                        "Node '%s' has CPT key '%s' with %d components, but expected one per parent %s plus own value",
                        name, key, components.size(), parents);
                throw new IllegalArgumentException(message);
            }
            String ownValue = components.get(components.size() - 1);
            if (!values.contains(ownValue)) {
                String message = String.format("Node '%s' has CPT key '%s' ending in undeclared value '%s': %s", name,
                        key, ownValue, values);
                throw new IllegalArgumentException(message);
            }
            if (!(probability >= 0.0 && probability <= 1.0)) {
                String message = String.format("Node '%s' has CPT entry '%s' with probability %s outside of [0, 1]",
                        name, key, probability);
                throw new IllegalArgumentException(message);
            }
        });
        return cpt;
    }

    /**
     * Creates a Node from its complete description.
     *
     * @throws NullPointerException if any argument or any element of them is null.
     * @throws IllegalArgumentException if name is blank, values is empty, values or parents contain duplicates, or
     *         any CPT entry is malformed (see class javadoc) or has a probability outside of [0, 1].
     */
    public static Node of(String name, List<String> values, List<String> parents, Map<String, Double> cpt) {
        return new Node(name, values, parents, cpt);
    }

    /** Starts building a Node with the given name. */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Renders a combination of values as a CPT key: the values joined with commas (no spaces) and surrounded by
     * parentheses. E.g. "(t,f,t)".
     */
    public static String cptKey(List<String> combination) {
        return combination.stream().collect(() -> new StringJoiner(",", "(", ")"), StringJoiner::add,
                StringJoiner::merge).toString();
    }

    public String getName() {
        return name;
    }

    public List<String> getValues() {
        return values;
    }

    public List<String> getParents() {
        return parents;
    }

    public Map<String, Double> getCpt() {
        return cpt;
    }

    /**
     * Looks up P(this=value | parents=values) where every value comes from the context: the parents' values in
     * declared order followed by this node's own value. A pure lookup: nothing is interpolated or renormalized.
     *
     * @param context a mapping from variable name to the value fixed for it.
     *
     * @throws VariableNotInContextException if the context lacks a value for this node or one of its parents.
     * @throws IllegalStateException if the CPT has no entry for the combination found in the context.
     */
    public double probability(Map<String, String> context) {
        List<String> combination = new ArrayList<>(parents.size() + 1);
        for (String parent : parents) {
            combination.add(requireContextValue(parent, context));
        }
        combination.add(requireContextValue(name, context));

        String key = cptKey(combination);
        Double probability = cpt.get(key);
        if (probability == null) {
            String message = String.format("Node '%s' has no CPT entry for '%s' found in context %s", name, key,
                    context);
            throw new IllegalStateException(message);
        }
        return probability;
    }

    private String requireContextValue(String variable, Map<String, String> context) {
        String value = context.get(variable);
        if (value == null) {
            String message = String.format("Evaluating node '%s' requires a value for '%s', but context only has %s",
                    name, variable, context);
            throw new VariableNotInContextException(variable, message);
        }
        return value;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }

        if (!(object instanceof Node)) {
            return false;
        }

        Node other = (Node) object;
        return Objects.equals(name, other.name) && Objects.equals(values, other.values)
                && Objects.equals(parents, other.parents) && Objects.equals(cpt, other.cpt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values, parents, cpt);
    }

    @Override
    public String toString() {
        return "Node(" + name + ", values=" + values + ", parents=" + parents + ")";
    }

    /** Builds Nodes step by step. Builders are not thread-safe and can be reused after calling {@link #build()}. */
    public static class Builder {
        private final String name;
        private final List<String> values = new ArrayList<>();
        private final List<String> parents = new ArrayList<>();
        private final Map<String, Double> cpt = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name);
        }

        /** Appends values this variable can take, in order. */
        public Builder values(String... values) {
            this.values.addAll(Arrays.asList(values));
            return this;
        }

        /** Appends parent names, in order. The order determines the layout of CPT keys. */
        public Builder parents(String... parents) {
            this.parents.addAll(Arrays.asList(parents));
            return this;
        }

        /**
         * Sets the probability for the combination of parent values (in parent order) followed by this node's own
         * value.
         */
        public Builder probability(double probability, String... combination) {
            return probability(cptKey(Arrays.asList(combination)), probability);
        }

        /** Sets the probability for an already-rendered CPT key. */
        public Builder probability(String key, double probability) {
            cpt.put(Objects.requireNonNull(key), probability);
            return this;
        }

        /** @throws IllegalArgumentException under the same conditions as {@link Node#of}. */
        public Node build() {
            return Node.of(name, values, parents, cpt);
        }
    }
}
