/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the calculation order that {@link InferenceEngine} evaluates: a variable plus how its value is
 * determined. There are exactly three kinds, and the fourth combination of "value present" and "sum out" that a pair
 * of flags would allow is unrepresentable: {@link #of(String, Optional, boolean)} rejects it.
 */
public final class ProbabilityFactor {
    /** The ways a factor's value can be determined. */
    public enum Kind {
        /** A query variable whose value is supplied by the evaluation context. */
        QUERY,
        /** A variable whose value the factor itself fixes, such as evidence. */
        KNOWN,
        /** A variable absent from the query that must be summed out over all of its values. */
        HIDDEN
    }

    private final String name;
    private final String value;
    private final Kind kind;

    private ProbabilityFactor(String name, String value, Kind kind) {
        this.name = Objects.requireNonNull(name);
        this.value = value;
        this.kind = kind;
    }

    static ProbabilityFactor query(String name) {
        return new ProbabilityFactor(name, null, Kind.QUERY);
    }

    static ProbabilityFactor known(String name, String value) {
        return new ProbabilityFactor(name, Objects.requireNonNull(value), Kind.KNOWN);
    }

    static ProbabilityFactor hidden(String name) {
        return new ProbabilityFactor(name, null, Kind.HIDDEN);
    }

    /**
     * Classifies a variable by whether it carries a value and whether it must be summed out.
     *
     * @throws InvalidProbabilityFactorException if value is present and sumOut is true, which has no meaning.
     */
    static ProbabilityFactor of(String name, Optional<String> value, boolean sumOut) {
        if (value.isPresent() && sumOut) {
            String message = String.format("Unexpected probability factor for %s: it has value '%s' but is summed out",
                    name, value.get());
            throw new InvalidProbabilityFactorException(message);
        }
        if (sumOut) {
            return hidden(name);
        }
        return value.map(v -> known(name, v)).orElseGet(() -> query(name));
    }

    public String getName() {
        return name;
    }

    /** Present only for {@link Kind#KNOWN} factors. */
    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSummedOut() {
        return kind == Kind.HIDDEN;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof ProbabilityFactor)) {
            return false;
        }

        ProbabilityFactor other = (ProbabilityFactor) object;
        return Objects.equals(name, other.name) && Objects.equals(value, other.value) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, kind);
    }

    @Override
    public String toString() {
        switch (kind) {
            case QUERY:
                return "Query variable " + name;
            case KNOWN:
                return "Known variable " + name + "=" + value;
            default:
                return "Hidden variable " + name;
        }
    }
}
