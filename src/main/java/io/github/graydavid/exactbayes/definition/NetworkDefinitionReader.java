/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.definition;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.graydavid.exactbayes.core.Combinations;
import io.github.graydavid.exactbayes.core.NetworkGraph;
import io.github.graydavid.exactbayes.core.NetworkObservers.Observer;
import io.github.graydavid.exactbayes.core.Node;
import io.github.graydavid.exactbayes.definition.InvalidNetworkDefinitionException.Reason;

/**
 * Reads network definitions from JSON documents. A document is an object with one member per node, in the order the
 * nodes should be added to a network:
 *
 * <pre>
 * {
 *   "Burglary": { "predecessors": [], "random_variables": ["t", "f"],
 *                 "probabilities": { "(t)": 0.001, "(f)": 0.999 } },
 *   "Alarm":    { "predecessors": ["Burglary"], "random_variables": ["t", "f"],
 *                 "probabilities": { "(t, t)": 0.94, "(t, f)": 0.06, "(f, t)": 0.001, "(f, f)": 0.999 } }
 * }
 * </pre>
 *
 * Whitespace in probability keys is insignificant. Each node definition is validated before any node is created:
 * required fields, at least one value, every predecessor defined in the document, and exactly one probability for
 * every combination of predecessor values followed by the node's own value. Validation failures are reported as
 * {@link InvalidNetworkDefinitionException}s; documents that aren't JSON at all fail with Jackson's own exceptions.
 */
public class NetworkDefinitionReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkDefinitionReader.class);

    public static final String PREDECESSORS_FIELD = "predecessors";
    public static final String RANDOM_VARIABLES_FIELD = "random_variables";
    public static final String PROBABILITIES_FIELD = "probabilities";
    private static final List<String> REQUIRED_FIELDS = List.of(PREDECESSORS_FIELD, RANDOM_VARIABLES_FIELD,
            PROBABILITIES_FIELD);

    private final ObjectMapper mapper;

    public NetworkDefinitionReader() {
        this(new ObjectMapper());
    }

    public NetworkDefinitionReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    /** Reads and validates the node definitions in reader, in document order. */
    public List<Node> read(Reader reader) throws IOException {
        return parse(mapper.readTree(reader));
    }

    /** Same as {@link #read(Reader)}, except reading from a stream. */
    public List<Node> read(InputStream input) throws IOException {
        return parse(mapper.readTree(input));
    }

    /** Same as {@link #read(Reader)}, except reading from a UTF-8 encoded file. */
    public List<Node> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /** Reads the nodes in reader and adds them, in document order, to a new network. */
    public NetworkGraph readNetwork(Reader reader, Observer observer) throws IOException {
        return NetworkGraph.fromNodes(read(reader), observer);
    }

    /** Same as {@link #readNetwork(Reader, Observer)}, except reading from a UTF-8 encoded file. */
    public NetworkGraph readNetwork(Path path, Observer observer) throws IOException {
        return NetworkGraph.fromNodes(read(path), observer);
    }

    /**
     * Validates an already-parsed document and creates its nodes.
     *
     * @throws InvalidNetworkDefinitionException if the document doesn't describe a valid network.
     */
    public List<Node> parse(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new InvalidNetworkDefinitionException(Reason.MALFORMED_DOCUMENT, null,
                    "Network definition must be a JSON object with one member per node, but found: " + document);
        }

        Map<String, JsonNode> definitions = new LinkedHashMap<>();
        document.fields().forEachRemaining(member -> definitions.put(member.getKey(), member.getValue()));

        // Values are gathered up front, because each node's probabilities are validated against its parents' values
        Map<String, List<String>> nodeToValues = new LinkedHashMap<>();
        definitions.forEach((name, definition) -> nodeToValues.put(name, readValues(name, definition)));

        List<Node> nodes = new ArrayList<>(definitions.size());
        definitions.forEach((name, definition) -> nodes.add(readNode(name, definition, nodeToValues)));
        LOGGER.debug("Read {} node definitions: {}", nodes.size(), definitions.keySet());
        return nodes;
    }

    private static List<String> readValues(String name, JsonNode definition) {
        if (!definition.isObject()) {
            throw new InvalidNetworkDefinitionException(Reason.MALFORMED_DOCUMENT, name,
                    String.format("Node %s must be defined by a JSON object, but found: %s", name, definition));
        }
        for (String field : REQUIRED_FIELDS) {
            if (!definition.has(field)) {
                throw new InvalidNetworkDefinitionException(Reason.INCOMPLETE_NODE_DATA, name,
                        String.format("Check node %s, it lacks of %s field.", name, field));
            }
        }

        List<String> values = readStrings(name, RANDOM_VARIABLES_FIELD, definition.get(RANDOM_VARIABLES_FIELD));
        if (values.isEmpty()) {
            throw new InvalidNetworkDefinitionException(Reason.NO_VALUES, name,
                    String.format("Node %s should have at least one random variable.", name));
        }
        return values;
    }

    private static List<String> readStrings(String name, String field, JsonNode array) {
        if (!array.isArray()) {
            throw new InvalidNetworkDefinitionException(Reason.MALFORMED_DOCUMENT, name,
                    String.format("Field %s of node %s must be an array, but found: %s", field, name, array));
        }
        List<String> strings = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isValueNode() || element.isNull()) {
                throw new InvalidNetworkDefinitionException(Reason.MALFORMED_DOCUMENT, name, String
                        .format("Field %s of node %s must only contain scalars, but found: %s", field, name, element));
            }
            strings.add(element.asText());
        }
        return strings;
    }

    private static Node readNode(String name, JsonNode definition, Map<String, List<String>> nodeToValues) {
        List<String> parents = readStrings(name, PREDECESSORS_FIELD, definition.get(PREDECESSORS_FIELD));
        List<List<String>> valueSets = new ArrayList<>(parents.size() + 1);
        for (String parent : parents) {
            List<String> parentValues = nodeToValues.get(parent);
            if (parentValues == null) {
                throw new InvalidNetworkDefinitionException(Reason.PARENT_NOT_IN_NETWORK, name,
                        String.format("No predecessor %s of node %s exists in network.", parent, name));
            }
            valueSets.add(parentValues);
        }
        List<String> values = nodeToValues.get(name);
        valueSets.add(values);

        Map<String, Double> cpt = readProbabilities(name, definition.get(PROBABILITIES_FIELD));
        Set<String> expectedKeys = new LinkedHashSet<>();
        Combinations.cartesianProduct(valueSets).forEach(combination -> expectedKeys.add(Node.cptKey(combination)));
        for (String key : expectedKeys) {
            if (!cpt.containsKey(key)) {
                throw new InvalidNetworkDefinitionException(Reason.MISSING_PROBABILITY, name,
                        String.format("Expected probability %s not exist among %s probabilities.", key, name));
            }
        }
        for (String key : cpt.keySet()) {
            if (!expectedKeys.contains(key)) {
                throw new InvalidNetworkDefinitionException(Reason.UNEXPECTED_PROBABILITY, name, String.format(
                        "Probability %s of node %s matches none of the expected combinations: %s", key, name,
                        expectedKeys));
            }
        }

        try {
            return Node.of(name, values, parents, cpt);
        } catch (IllegalArgumentException e) {
            throw new InvalidNetworkDefinitionException(Reason.MALFORMED_DOCUMENT, name, e.getMessage(), e);
        }
    }

    private static Map<String, Double> readProbabilities(String name, JsonNode probabilities) {
        if (!probabilities.isObject()) {
            throw new InvalidNetworkDefinitionException(Reason.MALFORMED_DOCUMENT, name, String.format(
                    "Field %s of node %s must be an object, but found: %s", PROBABILITIES_FIELD, name, probabilities));
        }
        Map<String, Double> cpt = new LinkedHashMap<>();
        probabilities.fields().forEachRemaining(entry -> {
            String key = entry.getKey().replaceAll("\\s", "");
            JsonNode probability = entry.getValue();
            if (!probability.isNumber()) {
                throw new InvalidNetworkDefinitionException(Reason.MALFORMED_DOCUMENT, name, String
                        .format("Probability %s of node %s must be a number, but found: %s", key, name, probability));
            }
            double value = probability.asDouble();
            if (value < 0.0 || value > 1.0) {
                throw new InvalidNetworkDefinitionException(Reason.INVALID_PROBABILITY, name,
                        String.format("Probability %s of node %s is %s, which is outside of [0, 1]", key, name, value));
            }
            cpt.put(key, value);
        });
        return cpt;
    }
}
