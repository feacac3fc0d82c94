/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.ArrayList;
import java.util.List;

/** Utility for enumerating combinations of variable values. */
public class Combinations {
    private Combinations() {}

    /**
     * Returns every combination of one value from each of valueSets, in order, with the last set varying fastest. E.g.
     * [[t, f], [a, b]] yields [[t, a], [t, b], [f, a], [f, b]]. No sets at all yield a single, empty combination.
     */
    public static List<List<String>> cartesianProduct(List<List<String>> valueSets) {
        List<List<String>> combinations = List.of(List.of());
        for (List<String> values : valueSets) {
            List<List<String>> extended = new ArrayList<>(combinations.size() * values.size());
            for (List<String> prefix : combinations) {
                for (String value : values) {
                    List<String> combination = new ArrayList<>(prefix);
                    combination.add(value);
                    extended.add(List.copyOf(combination));
                }
            }
            combinations = extended;
        }
        return List.copyOf(combinations);
    }
}
