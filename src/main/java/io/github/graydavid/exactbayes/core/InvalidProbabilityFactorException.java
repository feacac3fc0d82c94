/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

/**
 * Indicates that a probability factor reached the evaluator with both a fixed value and the sum-out marker. That
 * combination has no meaning; its presence means the calculation order was derived incorrectly, not that the user's
 * input was wrong.
 */
public class InvalidProbabilityFactorException extends InferenceException {
    private static final long serialVersionUID = 1;

    public InvalidProbabilityFactorException(String message) {
        super(message);
    }
}
