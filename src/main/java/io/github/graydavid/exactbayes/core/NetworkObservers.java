/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.exactbayes.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Houses definitions of observers of network construction and inference, plus a few ready-made implementations.
 * Nothing is observed unless the user attaches an Observer: both {@link NetworkGraph} and {@link InferenceEngine}
 * default to {@link Observer#doNothing()}.
 */
public class NetworkObservers {
    private NetworkObservers() {}

    /** The reasons a node can be refused by {@link NetworkGraph#addNode(Node)}. */
    public enum Rejection {
        /** A node with the same name is already part of the network. */
        DUPLICATE_NAME,
        /** Linking the node's edges would have created a cycle. */
        CYCLE
    }

    /**
     * Defines the events that can be observed while building a network and answering queries against it. This is
     * the hook for tracing, debugging, and metrics.
     *
     * Implementations are called synchronously, on the thread making the observed call, and so they should be quick
     * executing. An exception thrown by an Observer propagates to the caller unless the Observer is wrapped with
     * {@link #faultTolerant(Observer, ObservationFailureObserver)}.
     *
     * The default implementation of each method does nothing.
     */
    public interface Observer {
        /** Observes that node has been added to a network. */
        default void observeNodeAdded(Node node) {}

        /**
         * Observes that node was refused by a network, which was left unchanged.
         *
         * @param cycle the cycle that adding the node would have created (with the first node repeated at the end),
         *        if rejection is {@link Rejection#CYCLE}; empty otherwise.
         */
        default void observeNodeRejected(Node node, Rejection rejection, List<String> cycle) {}

        /**
         * Observes that node declares itself as a parent. The node is still added, but that edge is skipped, since it
         * would be a cycle of one.
         */
        default void observeSelfParentSkipped(Node node) {}

        /** Observes that node has been removed from a network. */
        default void observeNodeRemoved(Node node) {}

        /**
         * Observes the result of ancestral pruning for one joint-probability calculation.
         *
         * @param needed the names of the variables the calculation was asked about.
         * @param closure needed plus all of their ancestors: the only variables that take part in the calculation.
         */
        default void observePruning(Set<String> needed, Set<String> closure) {}

        /**
         * Observes the evaluation of a single factor during the recursive joint-probability calculation.
         *
         * @param depth the recursion depth, starting from 0 for the first factor of a calculation order.
         * @param context the variable values fixed when the factor is reached.
         */
        default void observeFactor(int depth, ProbabilityFactor factor, Map<String, String> context) {}

        /** Returns an Observer that does nothing. */
        static Observer doNothing() {
            return DO_NOTHING;
        }

        /** Returns an Observer that passes every event to each of the components, in order. */
        static Observer composite(List<? extends Observer> components) {
            return new CompositeObserver(components);
        }

        /**
         * Decorates another Observer so that any exception it throws is handed to observationFailureObserver instead
         * of interrupting the call being observed.
         */
        static Observer faultTolerant(Observer decorated, ObservationFailureObserver observationFailureObserver) {
            return new FaultTolerantObserver(decorated, observationFailureObserver);
        }
    }

    private static final Observer DO_NOTHING = new Observer() {};

    /**
     * Receives the exceptions thrown by the Observer that a {@link Observer#faultTolerant fault-tolerant} Observer
     * decorates.
     */
    @FunctionalInterface
    public interface ObservationFailureObserver {
        /**
         * Observes the failure. Exceptions thrown from here are not caught: they propagate to the caller of the
         * observed operation.
         */
        void observe(ObservationException exception);
    }

    /** A wrapper describing an exception thrown by an Observer. */
    public static final class ObservationException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private final String event;

        public ObservationException(String event, Throwable cause) {
            super(String.format("Failed to observe %s", event), cause);
            this.event = event;
        }

        /** The name of the Observer method that failed, e.g. "observeNodeAdded". */
        public String getEvent() {
            return event;
        }
    }

    /**
     * Returns an Observer that logs every event through SLF4J: rejections and skipped self-parents as warnings,
     * additions, removals and pruning at debug, and factor evaluations at trace, indented by recursion depth.
     */
    public static Observer logging() {
        return LOGGING;
    }

    private static final Observer LOGGING = new LoggingObserver(LoggerFactory.getLogger(NetworkObservers.class));

    /** See {@link NetworkObservers#logging()}. Package private to allow testing against a mock Logger. */
    static class LoggingObserver implements Observer {
        private final Logger logger;

        LoggingObserver(Logger logger) {
            this.logger = Objects.requireNonNull(logger);
        }

        @Override
        public void observeNodeAdded(Node node) {
            logger.debug("{} is successfully added without violation of acyclic state of graph.", node.getName());
        }

        @Override
        public void observeNodeRejected(Node node, Rejection rejection, List<String> cycle) {
            if (rejection == Rejection.CYCLE) {
                logger.warn("{} cannot be added since acyclic condition does not hold: {}", node.getName(),
                        String.join("->", cycle));
            } else {
                logger.warn("{} cannot be added since the network already has a node with that name.",
                        node.getName());
            }
        }

        @Override
        public void observeSelfParentSkipped(Node node) {
            logger.warn("{} has itself as parent.", node.getName());
        }

        @Override
        public void observeNodeRemoved(Node node) {
            logger.debug("{} is successfully removed from the network.", node.getName());
        }

        @Override
        public void observePruning(Set<String> needed, Set<String> closure) {
            logger.debug("Variable elimination reduced {} to necessary variables {}", needed, closure);
        }

        @Override
        public void observeFactor(int depth, ProbabilityFactor factor, Map<String, String> context) {
            if (logger.isTraceEnabled()) {
                logger.trace("{}{} with context: {}", "\t".repeat(depth), factor, context);
            }
        }
    }

    /** The composite design pattern as applied to Observers. */
    private static class CompositeObserver implements Observer {
        private final List<Observer> components;

        CompositeObserver(List<? extends Observer> components) {
            this.components = List.copyOf(components);
        }

        @Override
        public void observeNodeAdded(Node node) {
            components.forEach(component -> component.observeNodeAdded(node));
        }

        @Override
        public void observeNodeRejected(Node node, Rejection rejection, List<String> cycle) {
            components.forEach(component -> component.observeNodeRejected(node, rejection, cycle));
        }

        @Override
        public void observeSelfParentSkipped(Node node) {
            components.forEach(component -> component.observeSelfParentSkipped(node));
        }

        @Override
        public void observeNodeRemoved(Node node) {
            components.forEach(component -> component.observeNodeRemoved(node));
        }

        @Override
        public void observePruning(Set<String> needed, Set<String> closure) {
            components.forEach(component -> component.observePruning(needed, closure));
        }

        @Override
        public void observeFactor(int depth, ProbabilityFactor factor, Map<String, String> context) {
            components.forEach(component -> component.observeFactor(depth, factor, context));
        }
    }

    /** An observer that doesn't allow observation to interfere with the observed operation. */
    private static class FaultTolerantObserver implements Observer {
        private final Observer decorated;
        private final ObservationFailureObserver observationFailureObserver;

        FaultTolerantObserver(Observer decorated, ObservationFailureObserver observationFailureObserver) {
            this.decorated = Objects.requireNonNull(decorated);
            this.observationFailureObserver = Objects.requireNonNull(observationFailureObserver);
        }

        private void observe(String event, Runnable observation) {
            try {
                observation.run();
            } catch (Throwable t) {
                observationFailureObserver.observe(new ObservationException(event, t));
            }
        }

        @Override
        public void observeNodeAdded(Node node) {
            observe("observeNodeAdded", () -> decorated.observeNodeAdded(node));
        }

        @Override
        public void observeNodeRejected(Node node, Rejection rejection, List<String> cycle) {
            observe("observeNodeRejected", () -> decorated.observeNodeRejected(node, rejection, cycle));
        }

        @Override
        public void observeSelfParentSkipped(Node node) {
            observe("observeSelfParentSkipped", () -> decorated.observeSelfParentSkipped(node));
        }

        @Override
        public void observeNodeRemoved(Node node) {
            observe("observeNodeRemoved", () -> decorated.observeNodeRemoved(node));
        }

        @Override
        public void observePruning(Set<String> needed, Set<String> closure) {
            observe("observePruning", () -> decorated.observePruning(needed, closure));
        }

        @Override
        public void observeFactor(int depth, ProbabilityFactor factor, Map<String, String> context) {
            observe("observeFactor", () -> decorated.observeFactor(depth, factor, context));
        }
    }
}
