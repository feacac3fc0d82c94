/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

/**
 * Indicates that a variable is unknown to the context it was used in: either the network has no node of that name,
 * the asserted value is not one of the node's declared values, or a CPT lookup needed a value the evaluation context
 * did not supply.
 */
public class VariableNotInContextException extends InferenceException {
    private static final long serialVersionUID = 1;

    private final String variable;

    public VariableNotInContextException(String variable, String message) {
        super(message);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
