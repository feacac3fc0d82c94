/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.definition;

import java.util.Objects;

/** Indicates that a network definition document is well-formed JSON but doesn't describe a valid network. */
public class InvalidNetworkDefinitionException extends RuntimeException {
    private static final long serialVersionUID = 1;

    /** What's wrong with the definition. */
    public enum Reason {
        /** The document or one of its nodes doesn't have the expected JSON structure. */
        MALFORMED_DOCUMENT,
        /** A node lacks one of the required fields. */
        INCOMPLETE_NODE_DATA,
        /** A node declares no values. */
        NO_VALUES,
        /** A node declares a parent that the document doesn't define. */
        PARENT_NOT_IN_NETWORK,
        /** A node's CPT lacks an entry for some combination of parent values and own value. */
        MISSING_PROBABILITY,
        /** A node's CPT has an entry that matches no combination of parent values and own value. */
        UNEXPECTED_PROBABILITY,
        /** A node's CPT has a probability outside of [0, 1]. */
        INVALID_PROBABILITY
    }

    private final Reason reason;
    private final String nodeName;

    public InvalidNetworkDefinitionException(Reason reason, String nodeName, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason);
        this.nodeName = nodeName;
    }

    public InvalidNetworkDefinitionException(Reason reason, String nodeName, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
        this.nodeName = nodeName;
    }

    public Reason getReason() {
        return reason;
    }

    /** The node whose definition is invalid, or null if the problem is with the document as a whole. */
    public String getNodeName() {
        return nodeName;
    }
}
