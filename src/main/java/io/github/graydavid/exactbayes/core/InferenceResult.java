/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The answer to a query: a single probability when every query variable is bound to a value, or a distribution
 * otherwise. A distribution maps each combination of the unbound query variables' values to its probability, keyed by
 * {@link InferenceEngine#combinationKey(Map)}, e.g. "{'Burglary': 't'}". Distribution keys are ordered by the
 * enumeration order of the combinations.
 */
public class InferenceResult {
    private final Double probability;
    private final Map<String, Double> distribution;

    private InferenceResult(Double probability, Map<String, Double> distribution) {
        this.probability = probability;
        this.distribution = distribution;
    }

    public static InferenceResult ofProbability(double probability) {
        return new InferenceResult(probability, null);
    }

    public static InferenceResult ofDistribution(Map<String, Double> distribution) {
        return new InferenceResult(null, Collections.unmodifiableMap(new LinkedHashMap<>(distribution)));
    }

    public boolean isDistribution() {
        return distribution != null;
    }

    /** @throws IllegalStateException if this result is a distribution. */
    public double getProbability() {
        if (isDistribution()) {
            throw new IllegalStateException("Result is a distribution, not a single probability: " + distribution);
        }
        return probability;
    }

    /** @throws IllegalStateException if this result is a single probability. */
    public Map<String, Double> getDistribution() {
        if (!isDistribution()) {
            throw new IllegalStateException("Result is a single probability, not a distribution: " + probability);
        }
        return distribution;
    }

    /** Returns a result with every probability in this one divided by divisor. */
    InferenceResult dividedBy(double divisor) {
        if (!isDistribution()) {
            return ofProbability(probability / divisor);
        }
        Map<String, Double> quotients = new LinkedHashMap<>();
        distribution.forEach((combination, value) -> quotients.put(combination, value / divisor));
        return ofDistribution(quotients);
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof InferenceResult)) {
            return false;
        }

        InferenceResult other = (InferenceResult) object;
        return Objects.equals(probability, other.probability) && Objects.equals(distribution, other.distribution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(probability, distribution);
    }

    @Override
    public String toString() {
        return isDistribution() ? distribution.toString() : probability.toString();
    }
}
