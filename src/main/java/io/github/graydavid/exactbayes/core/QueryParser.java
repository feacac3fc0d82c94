/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses query strings. The grammar, where whitespace around tokens is insignificant and NAME and VALUE are runs of
 * word characters:
 *
 * <pre>
 * query          := terms ('|' evidence_terms)?
 * terms          := term (',' term)*
 * term           := NAME ('=' VALUE)?
 * evidence_terms := evidence_term (',' evidence_term)*
 * evidence_term  := NAME '=' VALUE
 * </pre>
 *
 * E.g. "Burglary", "Burglary, Alarm = t", or "JohnCalls = t, MaryCalls = t | Burglary = f". The whole string must
 * match: there is no partial parsing.
 */
public class QueryParser {
    private static final String WORD = "\\s*\\w+\\s*";
    private static final String TERM = "(?:" + WORD + "(?:=" + WORD + ")?)";
    private static final String EVIDENCE_TERM = "(?:" + WORD + "=" + WORD + ")";
    private static final String TERMS = TERM + "(?:," + TERM + ")*";
    private static final String EVIDENCE_TERMS = EVIDENCE_TERM + "(?:," + EVIDENCE_TERM + ")*";
    private static final Pattern QUERY = Pattern.compile(TERMS + "(?:\\s*\\|\\s*" + EVIDENCE_TERMS + ")?",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SURROUNDING_WHITESPACE = Pattern.compile("^\\s+|\\s+$",
            Pattern.UNICODE_CHARACTER_CLASS);

    private QueryParser() {}

    /**
     * Parses query without validating it against any network.
     *
     * @return the parsed query, or empty if query doesn't match the grammar.
     */
    public static Optional<ParsedQuery> parse(String query) {
        if (!QUERY.matcher(query).matches()) {
            return Optional.empty();
        }

        int separator = query.indexOf('|');
        String querySide = separator < 0 ? query : query.substring(0, separator);
        List<QueryVariable> queries = parseTerms(querySide);
        List<QueryVariable> evidences = separator < 0 ? List.of() : parseTerms(query.substring(separator + 1));
        return Optional.of(ParsedQuery.of(queries, evidences));
    }

    // Only called on strings already known to match the grammar
    private static List<QueryVariable> parseTerms(String terms) {
        List<QueryVariable> variables = new ArrayList<>();
        for (String term : terms.split(",")) {
            String[] nameAndValue = term.split("=", 2);
            String name = trim(nameAndValue[0]);
            variables.add(nameAndValue.length == 1 ? QueryVariable.of(name)
                    : QueryVariable.of(name, trim(nameAndValue[1])));
        }
        return variables;
    }

    // Trims the same whitespace the grammar allows around tokens, which includes non-ASCII spaces
    private static String trim(String token) {
        return SURROUNDING_WHITESPACE.matcher(token).replaceAll("");
    }

    /**
     * Parses query and validates it against a network's symbol table (see {@link NetworkGraph#symbolTable()}).
     *
     * @return the parsed query, or empty if query doesn't match the grammar.
     *
     * @throws NonUniqueVariablesException if any variable name appears more than once across both sides of the query.
     * @throws VariableNotInContextException if any variable is missing from symbolTable or carries a value not
     *         declared for it there.
     */
    public static Optional<ParsedQuery> parse(String query, Map<String, List<String>> symbolTable) {
        Optional<ParsedQuery> parsed = parse(query);
        parsed.ifPresent(parsedQuery -> validate(parsedQuery, symbolTable));
        return parsed;
    }

    private static void validate(ParsedQuery query, Map<String, List<String>> symbolTable) {
        List<QueryVariable> variables = query.getAllVariables();
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        variables.forEach(variable -> {
            if (!seen.add(variable.getName())) {
                duplicates.add(variable.getName());
            }
        });
        if (!duplicates.isEmpty()) {
            throw new NonUniqueVariablesException(duplicates);
        }

        for (QueryVariable variable : variables) {
            List<String> values = symbolTable.get(variable.getName());
            if (values == null) {
                String message = String.format("Variable '%s' is not in the network: %s", variable.getName(),
                        symbolTable.keySet());
                throw new VariableNotInContextException(variable.getName(), message);
            }
            if (variable.getValue().isPresent() && !values.contains(variable.getValue().get())) {
                String message = String.format("Variable '%s' has no value '%s': %s", variable.getName(),
                        variable.getValue().get(), values);
                throw new VariableNotInContextException(variable.getName(), message);
            }
        }
    }
}
