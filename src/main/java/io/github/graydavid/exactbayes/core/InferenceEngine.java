/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.github.graydavid.exactbayes.core.NetworkObservers.Observer;

/**
 * Answers queries against a {@link NetworkGraph} by exact inference. A query P(Q | E) is calculated as the ratio of
 * two joint probabilities, P(Q, E) / P(E), and each joint probability is calculated by the chain rule:
 *
 * <pre>
 * P(x1, ..., xn) = product over i of P(xi | parents(xi))
 * </pre>
 *
 * Only the ancestral closure of the variables in a joint probability takes part in its calculation: every other
 * variable in the network sums out to 1 and is pruned up front. Variables in the closure but not in the query are
 * hidden and are summed out over all of their values. Sub-results are not memoized, and so cost grows exponentially
 * with the number of hidden variables.
 *
 * The engine reads the network on every call, and so it always answers against the network's current state.
 */
public class InferenceEngine {
    private final NetworkGraph network;
    private final Observer observer;

    private InferenceEngine(NetworkGraph network, Observer observer) {
        this.network = Objects.requireNonNull(network);
        this.observer = Objects.requireNonNull(observer);
    }

    /** Creates an engine for network that observes nothing. */
    public static InferenceEngine forNetwork(NetworkGraph network) {
        return forNetwork(network, Observer.doNothing());
    }

    /** Creates an engine for network that reports pruning and factor evaluation to observer. */
    public static InferenceEngine forNetwork(NetworkGraph network, Observer observer) {
        return new InferenceEngine(network, observer);
    }

    /** Shorthand for {@code forNetwork(network).probability(query)}. */
    public static InferenceResult P(NetworkGraph network, String query) {
        return forNetwork(network).probability(query);
    }

    /**
     * Calculates the exact posterior probability of query, written in the grammar described by {@link QueryParser}.
     *
     * @return a single probability if every query variable is bound to a value; otherwise, a distribution over every
     *         combination of the unbound query variables' values.
     *
     * @throws InvalidQueryException if query doesn't match the grammar.
     * @throws NonUniqueVariablesException if a variable appears more than once in query.
     * @throws VariableNotInContextException if a variable or value in query is not part of the network.
     * @throws ArithmeticException if the evidence has zero probability, in which case the posterior is undefined.
     * @throws IllegalStateException if a variable involved in the calculation declares a parent missing from the
     *         network.
     */
    public InferenceResult probability(String query) {
        ParsedQuery parsed = QueryParser.parse(query, network.symbolTable())
                .orElseThrow(() -> new InvalidQueryException(query));

        InferenceResult numerator = jointProbability(parsed.getAllVariables());
        double denominator = jointProbability(parsed.getEvidences()).getProbability();
        if (denominator == 0.0) {
            String message = String.format("Evidence %s has zero probability, so '%s' is undefined",
                    parsed.getEvidences(), query);
            throw new ArithmeticException(message);
        }
        return numerator.dividedBy(denominator);
    }

    /**
     * Calculates the joint probability of variables. The result is a single probability if every variable is bound
     * and a mapping over every combination of the unbound variables' values otherwise.
     */
    InferenceResult jointProbability(List<QueryVariable> variables) {
        Map<String, QueryVariable> needed = new LinkedHashMap<>();
        variables.forEach(variable -> needed.putIfAbsent(variable.getName(), variable));
        Set<String> closure = network.ancestralClosure(needed.keySet());
        observer.observePruning(needed.keySet(), closure);
        List<ProbabilityFactor> order = decideCalculationOrder(needed, closure);

        List<String> unbound = needed.values()
                .stream()
                .filter(variable -> !variable.isBound())
                .map(QueryVariable::getName)
                .collect(Collectors.toList());
        if (unbound.isEmpty()) {
            return InferenceResult.ofProbability(evaluate(order, Map.of(), 0));
        }

        List<List<String>> valueSets = unbound.stream()
                .map(name -> network.getNode(name).orElseThrow().getValues())
                .collect(Collectors.toList());
        Map<String, Double> distribution = new LinkedHashMap<>();
        for (List<String> combination : Combinations.cartesianProduct(valueSets)) {
            Map<String, String> context = new LinkedHashMap<>();
            for (int i = 0; i < unbound.size(); ++i) {
                context.put(unbound.get(i), combination.get(i));
            }
            distribution.put(combinationKey(context), evaluate(order, context, 0));
        }
        return InferenceResult.ofDistribution(distribution);
    }

    /**
     * Orders the closure so that every variable comes after its parents, which is what makes each factor's local
     * probability well-defined by the time it's evaluated.
     */
    private List<ProbabilityFactor> decideCalculationOrder(Map<String, QueryVariable> needed, Set<String> closure) {
        Map<String, Integer> topologicalPosition = new HashMap<>();
        for (String name : network.topologicalOrder()) {
            topologicalPosition.put(name, topologicalPosition.size());
        }

        return closure.stream()
                .sorted(Comparator.comparing(topologicalPosition::get))
                .map(name -> {
                    QueryVariable variable = needed.get(name);
                    return variable == null ? ProbabilityFactor.of(name, Optional.empty(), true)
                            : ProbabilityFactor.of(name, variable.getValue(), false);
                })
                .collect(Collectors.toList());
    }

    /** Evaluates the product of the factors in order, given the values already fixed in context. */
    private double evaluate(List<ProbabilityFactor> order, Map<String, String> context, int depth) {
        if (order.isEmpty()) {
            return 1.0;
        }

        ProbabilityFactor first = order.get(0);
        List<ProbabilityFactor> rest = order.subList(1, order.size());
        Node node = network.getNode(first.getName()).orElseThrow();
        observer.observeFactor(depth, first, context);
        switch (first.getKind()) {
            case QUERY:
                return node.probability(context) * evaluate(rest, context, depth + 1);
            case KNOWN:
                Map<String, String> knownContext = new HashMap<>(context);
                knownContext.put(first.getName(), first.getValue().orElseThrow());
                return node.probability(knownContext) * evaluate(rest, knownContext, depth + 1);
            case HIDDEN:
                double sum = 0.0;
                for (String value : node.getValues()) {
                    List<ProbabilityFactor> bound = new ArrayList<>(order.size());
                    bound.add(ProbabilityFactor.known(first.getName(), value));
                    bound.addAll(rest);
                    sum += evaluate(bound, context, depth + 1);
                }
                return sum;
            default:
                throw new InvalidProbabilityFactorException("Unexpected probability factor for " + first.getName());
        }
    }

    /**
     * Renders a combination of variable values as a distribution key, preserving the context's iteration order. E.g.
     * "{'A': 'a', 'B': 'b'}".
     */
    public static String combinationKey(Map<String, String> combination) {
        return combination.entrySet()
                .stream()
                .map(entry -> "'" + entry.getKey() + "': '" + entry.getValue() + "'")
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
