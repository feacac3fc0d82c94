package io.github.graydavid.exactbayes.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class ParsedQueryTest {

    @Test
    public void ofThrowsExceptionGivenUnboundEvidence() {
        assertThrows(IllegalArgumentException.class,
                () -> ParsedQuery.of(List.of(QueryVariable.of("A")), List.of(QueryVariable.of("B"))));
    }

    @Test
    public void getAllVariablesListsQueriesThenEvidences() {
        ParsedQuery query = ParsedQuery.of(List.of(QueryVariable.of("A"), QueryVariable.of("B", "b")),
                List.of(QueryVariable.of("C", "c")));

        assertThat(query.getAllVariables(),
                is(List.of(QueryVariable.of("A"), QueryVariable.of("B", "b"), QueryVariable.of("C", "c"))));
    }

    @Test
    public void toStringRendersQueryGrammar() {
        ParsedQuery withEvidence = ParsedQuery.of(List.of(QueryVariable.of("A")), List.of(QueryVariable.of("C", "c")));
        ParsedQuery withoutEvidence = ParsedQuery.of(List.of(QueryVariable.of("A"), QueryVariable.of("B", "b")),
                List.of());

        assertThat(withEvidence.toString(), is("A | C=c"));
        assertThat(withoutEvidence.toString(), is("A, B=b"));
    }

    @Test
    public void queryVariableExposesOptionalValue() {
        assertThat(QueryVariable.of("A").isBound(), is(false));
        assertThat(QueryVariable.of("A").getValue(), is(Optional.empty()));
        assertThat(QueryVariable.of("A", "a").isBound(), is(true));
        assertThat(QueryVariable.of("A", "a").getValue(), is(Optional.of("a")));
        assertThrows(NullPointerException.class, () -> QueryVariable.of("A", null));
    }

    @Test
    public void equalsObeysContract() {
        assertThat(QueryVariable.of("A", "a"), equalTo(QueryVariable.of("A", "a")));
        assertThat(QueryVariable.of("A", "a"), not(equalTo(QueryVariable.of("A"))));
        assertThat(ParsedQuery.of(List.of(QueryVariable.of("A")), List.of()),
                equalTo(ParsedQuery.of(List.of(QueryVariable.of("A")), List.of())));
        assertThat(ParsedQuery.of(List.of(QueryVariable.of("A")), List.of()).hashCode(),
                equalTo(ParsedQuery.of(List.of(QueryVariable.of("A")), List.of()).hashCode()));
    }
}
