/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.Objects;
import java.util.Optional;

/**
 * A variable named in a query. A variable without a value is a query target whose distribution is being asked for. A
 * variable with a value is either evidence or a query variable pinned to that value.
 */
public class QueryVariable {
    private final String name;
    private final String value;

    private QueryVariable(String name, String value) {
        this.name = Objects.requireNonNull(name);
        this.value = value;
    }

    /** Creates an unbound variable. */
    public static QueryVariable of(String name) {
        return new QueryVariable(name, null);
    }

    /** Creates a variable bound to value. */
    public static QueryVariable of(String name, String value) {
        return new QueryVariable(name, Objects.requireNonNull(value));
    }

    public String getName() {
        return name;
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isBound() {
        return value != null;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof QueryVariable)) {
            return false;
        }

        QueryVariable other = (QueryVariable) object;
        return Objects.equals(name, other.name) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return value == null ? name : name + "=" + value;
    }
}
