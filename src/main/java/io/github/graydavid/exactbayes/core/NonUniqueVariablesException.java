/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.Set;

/** Indicates that the same variable name appears more than once across the query and evidence sides of a query. */
public class NonUniqueVariablesException extends InferenceException {
    private static final long serialVersionUID = 1;

    private final Set<String> duplicates;

    public NonUniqueVariablesException(Set<String> duplicates) {
        super("Non-unique variables in query: " + duplicates);
        this.duplicates = Set.copyOf(duplicates);
    }

    /** The names that appeared more than once. */
    public Set<String> getDuplicates() {
        return duplicates;
    }
}
