/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** The structured form of a query string: the query side and the evidence side, each in left-to-right order. */
public class ParsedQuery {
    private final List<QueryVariable> queries;
    private final List<QueryVariable> evidences;

    private ParsedQuery(List<QueryVariable> queries, List<QueryVariable> evidences) {
        this.queries = List.copyOf(queries);
        this.evidences = List.copyOf(evidences);
    }

    /** @throws IllegalArgumentException if any evidence variable is unbound. */
    public static ParsedQuery of(List<QueryVariable> queries, List<QueryVariable> evidences) {
        evidences.forEach(evidence -> {
            if (!evidence.isBound()) {
                throw new IllegalArgumentException("Evidence variables must carry a value: " + evidence);
            }
        });
        return new ParsedQuery(queries, evidences);
    }

    /** The variables left of the '|' separator. Each may or may not carry a value. */
    public List<QueryVariable> getQueries() {
        return queries;
    }

    /** The variables right of the '|' separator. Each carries a value. Empty if there was no separator. */
    public List<QueryVariable> getEvidences() {
        return evidences;
    }

    /** The query variables followed by the evidence variables. */
    public List<QueryVariable> getAllVariables() {
        return Stream.concat(queries.stream(), evidences.stream()).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof ParsedQuery)) {
            return false;
        }

        ParsedQuery other = (ParsedQuery) object;
        return Objects.equals(queries, other.queries) && Objects.equals(evidences, other.evidences);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queries, evidences);
    }

    @Override
    public String toString() {
        String querySide = queries.stream().map(Object::toString).collect(Collectors.joining(", "));
        if (evidences.isEmpty()) {
            return querySide;
        }
        return querySide + " | " + evidences.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
