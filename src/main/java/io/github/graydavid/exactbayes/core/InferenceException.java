/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

/**
 * The root of the failures raised while parsing queries or answering them against a network. These are not
 * recoverable within the library: retrying the same call with the same input will fail the same way.
 */
public class InferenceException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public InferenceException(String message) {
        super(message);
    }
}
