package io.github.graydavid.exactbayes.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Networks and helper calculations shared across tests. */
public class TestNetworks {
    private TestNetworks() {}

    /** Creates a node with values t and f, the given parents, and an empty CPT: only useful for structural tests. */
    public static Node structural(String name, String... parents) {
        return Node.builder(name).values("t", "f").parents(parents).build();
    }

    /** The nodes D, I, G(D, I), and K, which produce two realized edges. */
    public static List<Node> sampleNodes() {
        return List.of(structural("D"), structural("I"), structural("G", "D", "I"), structural("K"));
    }

    public static Node burglary() {
        return Node.builder("Burglary").values("t", "f").probability(0.001, "t").probability(0.999, "f").build();
    }

    public static Node earthquake() {
        return Node.builder("Earthquake").values("t", "f").probability(0.002, "t").probability(0.998, "f").build();
    }

    public static Node alarm() {
        return Node.builder("Alarm")
                .values("t", "f")
                .parents("Burglary", "Earthquake")
                .probability(0.95, "t", "t", "t")
                .probability(0.05, "t", "t", "f")
                .probability(0.94, "t", "f", "t")
                .probability(0.06, "t", "f", "f")
                .probability(0.29, "f", "t", "t")
                .probability(0.71, "f", "t", "f")
                .probability(0.001, "f", "f", "t")
                .probability(0.999, "f", "f", "f")
                .build();
    }

    public static Node johnCalls() {
        return Node.builder("JohnCalls")
                .values("t", "f")
                .parents("Alarm")
                .probability(0.90, "t", "t")
                .probability(0.10, "t", "f")
                .probability(0.05, "f", "t")
                .probability(0.95, "f", "f")
                .build();
    }

    public static Node maryCalls() {
        return Node.builder("MaryCalls")
                .values("t", "f")
                .parents("Alarm")
                .probability(0.70, "t", "t")
                .probability(0.30, "t", "f")
                .probability(0.01, "f", "t")
                .probability(0.99, "f", "f")
                .build();
    }

    /** The classic burglary alarm network, in topological order. */
    public static List<Node> alarmNodes() {
        return List.of(burglary(), earthquake(), alarm(), johnCalls(), maryCalls());
    }

    public static NetworkGraph alarmNetwork() {
        return NetworkGraph.fromNodes(alarmNodes());
    }

    /**
     * Calculates the marginal probability of the assignment by brute force: summing the full joint distribution over
     * every assignment of all network variables that agrees with it.
     */
    public static double bruteForceProbability(NetworkGraph network, Map<String, String> assignment) {
        List<String> names = new ArrayList<>(network.getNodes().keySet());
        List<List<String>> valueSets = new ArrayList<>();
        names.forEach(name -> valueSets.add(network.getNode(name).get().getValues()));

        double sum = 0.0;
        for (List<String> combination : Combinations.cartesianProduct(valueSets)) {
            Map<String, String> full = new HashMap<>();
            for (int i = 0; i < names.size(); ++i) {
                full.put(names.get(i), combination.get(i));
            }
            boolean agrees = assignment.entrySet()
                    .stream()
                    .allMatch(entry -> entry.getValue().equals(full.get(entry.getKey())));
            if (agrees) {
                double product = 1.0;
                for (Node node : network.getNodes().values()) {
                    product *= node.probability(full);
                }
                sum += product;
            }
        }
        return sum;
    }
}
