package io.github.graydavid.exactbayes.definition;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.graydavid.exactbayes.core.InferenceEngine;
import io.github.graydavid.exactbayes.core.NetworkGraph;
import io.github.graydavid.exactbayes.core.NetworkObservers.Observer;
import io.github.graydavid.exactbayes.core.Node;
import io.github.graydavid.exactbayes.core.TestNetworks;
import io.github.graydavid.exactbayes.definition.InvalidNetworkDefinitionException.Reason;

public class NetworkDefinitionReaderTest {
    private final NetworkDefinitionReader reader = new NetworkDefinitionReader();

    // Single quotes keep the inline documents readable
    private static String json(String singleQuoted) {
        return singleQuoted.replace('\'', '"');
    }

    private List<Node> read(String singleQuoted) throws IOException {
        return reader.read(new StringReader(json(singleQuoted)));
    }

    private InvalidNetworkDefinitionException assertInvalid(Reason reason, String singleQuoted) {
        InvalidNetworkDefinitionException exception = assertThrows(InvalidNetworkDefinitionException.class,
                () -> read(singleQuoted));
        assertThat(exception.getReason(), is(reason));
        return exception;
    }

    private InputStream alarmResource() {
        return getClass().getResourceAsStream("/networks/alarm.json");
    }

    @Test
    public void constructorThrowsExceptionGivenNullMapper() {
        assertThrows(NullPointerException.class, () -> new NetworkDefinitionReader(null));
    }

    @Test
    public void readCreatesNodesInDocumentOrderWithNormalizedKeys() throws IOException {
        List<Node> nodes;
        try (InputStream input = alarmResource()) {
            nodes = reader.read(input);
        }

        assertThat(nodes.stream().map(Node::getName).collect(Collectors.toList()),
                contains("Burglary", "Earthquake", "Alarm", "JohnCalls", "MaryCalls"));
        assertThat(nodes, is(TestNetworks.alarmNodes()));
    }

    @Test
    public void readAcceptsFiles(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("network.json");
        Files.writeString(file, json("{'Über': {'predecessors': [], 'random_variables': ['ja', 'nein'],"
                + " 'probabilities': {'(ja)': 0.25, '( nein )': 0.75}}}"), StandardCharsets.UTF_8);

        List<Node> nodes = reader.read(file);

        assertThat(nodes, is(List.of(Node.builder("Über")
                .values("ja", "nein")
                .probability(0.25, "ja")
                .probability(0.75, "nein")
                .build())));
    }

    @Test
    public void readNetworkAnswersQueries() throws IOException {
        Observer observer = mock(Observer.class);
        String document = new String(alarmResource().readAllBytes(), StandardCharsets.UTF_8);

        NetworkGraph network = reader.readNetwork(new StringReader(document), observer);

        assertThat(network.getAllEdges().size(), is(4));
        verify(observer).observeNodeAdded(TestNetworks.alarm());
        Map<String, Double> distribution = InferenceEngine.P(network, "Burglary | JohnCalls=t, MaryCalls=t")
                .getDistribution();
        assertThat(distribution.get("{'Burglary': 't'}"), closeTo(0.284, 5e-4));
    }

    @Test
    public void readAllowsChildrenBeforeParents() throws IOException {
        List<Node> nodes = read("{'B': {'predecessors': ['A'], 'random_variables': ['t'],"
                + " 'probabilities': {'(t,t)': 1.0}},"
                + " 'A': {'predecessors': [], 'random_variables': ['t'], 'probabilities': {'(t)': 1.0}}}");

        NetworkGraph network = NetworkGraph.fromNodes(nodes);

        assertThat(network.getParentsOf("B"), contains("A"));
        assertThat(network.getPendingEdges(), is(Map.of()));
    }

    @Test
    public void readWorksWithCustomMapper() throws IOException {
        NetworkDefinitionReader custom = new NetworkDefinitionReader(new ObjectMapper());

        List<Node> nodes = custom.read(new StringReader(
                json("{'A': {'predecessors': [], 'random_variables': ['t'], 'probabilities': {'(t)': 1}}}")));

        assertThat(nodes.get(0).getCpt(), is(Map.of("(t)", 1.0)));
    }

    @Test
    public void readThrowsJacksonExceptionGivenMalformedJson() {
        assertThrows(JsonProcessingException.class, () -> read("{'A': "));
    }

    @Test
    public void readThrowsExceptionGivenNonObjectDocument() {
        InvalidNetworkDefinitionException exception = assertInvalid(Reason.MALFORMED_DOCUMENT, "['A']");

        assertThat(exception.getNodeName(), is(nullValue()));
    }

    @Test
    public void readThrowsExceptionGivenNonObjectNode() {
        InvalidNetworkDefinitionException exception = assertInvalid(Reason.MALFORMED_DOCUMENT, "{'A': 3}");

        assertThat(exception.getNodeName(), is("A"));
    }

    @ParameterizedTest
    @ValueSource(strings = {NetworkDefinitionReader.PREDECESSORS_FIELD, NetworkDefinitionReader.RANDOM_VARIABLES_FIELD,
            NetworkDefinitionReader.PROBABILITIES_FIELD})
    public void readThrowsExceptionGivenMissingField(String field) {
        String complete = "{'A': {'predecessors': [], 'random_variables': ['t'], 'probabilities': {'(t)': 1.0}}}";
        String incomplete = complete.replace("'" + field + "'", "'unrelated'");

        InvalidNetworkDefinitionException exception = assertInvalid(Reason.INCOMPLETE_NODE_DATA, incomplete);

        assertThat(exception.getMessage(), containsString(field));
        assertThat(exception.getNodeName(), is("A"));
    }

    @Test
    public void readThrowsExceptionGivenNoValues() {
        assertInvalid(Reason.NO_VALUES, "{'A': {'predecessors': [], 'random_variables': [], 'probabilities': {}}}");
    }

    @Test
    public void readThrowsExceptionGivenNonArrayFields() {
        assertInvalid(Reason.MALFORMED_DOCUMENT,
                "{'A': {'predecessors': [], 'random_variables': 't', 'probabilities': {'(t)': 1.0}}}");
        assertInvalid(Reason.MALFORMED_DOCUMENT,
                "{'A': {'predecessors': 'B', 'random_variables': ['t'], 'probabilities': {'(t)': 1.0}}}");
        assertInvalid(Reason.MALFORMED_DOCUMENT,
                "{'A': {'predecessors': [], 'random_variables': [['t']], 'probabilities': {'(t)': 1.0}}}");
    }

    @Test
    public void readThrowsExceptionGivenParentNotInDocument() {
        InvalidNetworkDefinitionException exception = assertInvalid(Reason.PARENT_NOT_IN_NETWORK,
                "{'P': {'predecessors': [], 'random_variables': ['t'], 'probabilities': {'(t)': 1.0}},"
                        + " 'A': {'predecessors': ['P', 'B'], 'random_variables': ['t'], 'probabilities': {}}}");

        assertThat(exception.getMessage(), containsString("B"));
        assertThat(exception.getNodeName(), is("A"));
    }

    @Test
    public void readChecksFieldsOfEveryNodeBeforeParents() {
        assertInvalid(Reason.INCOMPLETE_NODE_DATA,
                "{'A': {'predecessors': ['Missing'], 'random_variables': ['t'], 'probabilities': {}},"
                        + " 'B': {'predecessors': [], 'random_variables': ['t']}}");
    }

    @Test
    public void readThrowsExceptionGivenMissingProbability() {
        InvalidNetworkDefinitionException exception = assertInvalid(Reason.MISSING_PROBABILITY,
                "{'P': {'predecessors': [], 'random_variables': ['0', '1'], 'probabilities': {'(0)': 0.5, '(1)': 0.5}},"
                        + " 'A': {'predecessors': ['P'], 'random_variables': ['1', '2', '3'], 'probabilities':"
                        + " {'(0,1)': 0.5, '(0,2)': 0.5, '(0,3)': 0.5, '(1,2)': 0.5, '(1,3)': 0.5}}}");

        assertThat(exception.getMessage(), containsString("(1,1)"));
    }

    @Test
    public void readAcceptsSpacesInProbabilityKeys() throws IOException {
        List<Node> nodes = read(
                "{'P': {'predecessors': [], 'random_variables': ['0', '1'], 'probabilities': {'(0)': 0.5, '(1)': 0.5}},"
                        + " 'A': {'predecessors': ['P'], 'random_variables': ['1', '2', '3'], 'probabilities':"
                        + " {'(0,1)': 0.5, '(0,2)': 0.5, '(0,3)': 0.5, '(1, 1)': 0.5, '(1,2)': 0.5, '(1,3)': 0.5}}}");

        assertThat(nodes.get(1).getCpt().get("(1,1)"), is(0.5));
    }

    @Test
    public void readIgnoresAnyWhitespaceInProbabilityKeys() throws IOException {
        List<Node> nodes = read("{'P': {'predecessors': [], 'random_variables': ['t'], 'probabilities': {'(t)': 1.0}},"
                + " 'A': {'predecessors': ['P'], 'random_variables': ['t', 'f'],"
                + " 'probabilities': {'(t,\\tt)': 0.4, '(\\nt, f )': 0.6}}}");

        assertThat(nodes.get(1).getCpt(), is(Map.of("(t,t)", 0.4, "(t,f)", 0.6)));
    }

    @Test
    public void readThrowsExceptionGivenUnexpectedProbability() {
        assertInvalid(Reason.UNEXPECTED_PROBABILITY, "{'A': {'predecessors': [], 'random_variables': ['t'],"
                + " 'probabilities': {'(t)': 1.0, '(f)': 0.0}}}");
    }

    @Test
    public void readThrowsExceptionGivenProbabilityOutsideOfUnitInterval() {
        assertInvalid(Reason.INVALID_PROBABILITY, "{'A': {'predecessors': [], 'random_variables': ['t', 'f'],"
                + " 'probabilities': {'(t)': 1.5, '(f)': -0.5}}}");
    }

    @Test
    public void readThrowsExceptionGivenNonNumericProbability() {
        assertInvalid(Reason.MALFORMED_DOCUMENT, "{'A': {'predecessors': [], 'random_variables': ['t'],"
                + " 'probabilities': {'(t)': 'high'}}}");
    }

    @Test
    public void readWrapsNodeValidationFailures() {
        InvalidNetworkDefinitionException exception = assertInvalid(Reason.MALFORMED_DOCUMENT,
                "{'A': {'predecessors': [], 'random_variables': ['t', 't'], 'probabilities': {'(t)': 1.0}}}");

        assertThat(exception.getCause(), instanceOf(IllegalArgumentException.class));
    }
}
