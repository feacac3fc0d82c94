/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

/** Indicates that a query string does not match the query grammar at all. */
public class InvalidQueryException extends InferenceException {
    private static final long serialVersionUID = 1;

    private final String query;

    public InvalidQueryException(String query) {
        super(String.format("Query '%s' does not fully match the query grammar", query));
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
