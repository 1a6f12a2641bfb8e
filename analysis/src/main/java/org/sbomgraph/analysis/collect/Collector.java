/*
 * This file is part of SBOM Graph.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) The SBOM Graph Authors. All Rights Reserved.
 */
package org.sbomgraph.analysis.collect;

import org.jspecify.annotations.Nullable;
import org.sbomgraph.analysis.graph.Direction;
import org.sbomgraph.analysis.graph.Edge;
import org.sbomgraph.analysis.graph.PackageGraph;
import org.sbomgraph.analysis.model.AnalysisNode;
import org.sbomgraph.analysis.model.GraphNode.ExternalNode;
import org.sbomgraph.analysis.model.NodeKey;
import org.sbomgraph.analysis.model.NodeSummary;
import org.sbomgraph.analysis.model.Relationship;
import org.sbomgraph.analysis.resolve.ResolvedSbom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Collects the ancestors or descendants of a node, up to a given depth.
 * <p>
 * When an {@link ExternalNode} is reached, it is resolved to the node of the SBOM it refers to,
 * and collection continues in the graph of that SBOM. The resolved node becomes the first child
 * of the external node, consuming one level of depth.
 * <p>
 * Nodes are discovered level by level, such that every node is claimed at its shortest distance
 * from the starting node, and visited at most once per collection. Collection does not recurse,
 * and thus supports arbitrarily deep graphs. A collection is performed by a single thread,
 * and never modifies shared state.
 *
 * @since 0.1.0
 */
public final class Collector {

    private static final Logger LOGGER = LoggerFactory.getLogger(Collector.class);

    private final TraversalContext context;
    private final Direction direction;
    private final Set<Relationship> relationships;
    private final Set<NodeKey> visited = new HashSet<>();
    private final Deque<Frame> queue = new ArrayDeque<>();

    private Collector(
            final TraversalContext context,
            final Direction direction,
            final Set<Relationship> relationships) {
        this.context = context;
        this.direction = direction;
        this.relationships = relationships;
    }

    /**
     * @param context       Context of the current request.
     * @param graph         Graph containing the starting node.
     * @param nodeIndex     Index of the starting node in {@code graph}.
     * @param direction     {@link Direction#INCOMING} to collect ancestors,
     *                      {@link Direction#OUTGOING} to collect descendants.
     * @param depth         Maximum number of edges to follow. {@code 0} collects nothing.
     * @param relationships Relationships to follow. All relationships are followed when empty.
     * @return The collected nodes, each with their own collected nodes nested.
     * @throws org.jdbi.v3.core.JdbiException               When resolving an external reference failed.
     * @throws java.util.concurrent.CompletionException When loading the graph of another SBOM failed.
     */
    public static List<AnalysisNode> collect(
            final TraversalContext context,
            final PackageGraph graph,
            final int nodeIndex,
            final Direction direction,
            final int depth,
            final Set<Relationship> relationships) {
        requireNonNull(context, "context must not be null");
        requireNonNull(graph, "graph must not be null");
        requireNonNull(direction, "direction must not be null");
        requireNonNull(relationships, "relationships must not be null");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }

        final var collector = new Collector(context, direction, Set.copyOf(relationships));
        return collector.collect(graph, nodeIndex, depth);
    }

    private List<AnalysisNode> collect(final PackageGraph graph, final int nodeIndex, final int depth) {
        final var root = new Frame(graph, nodeIndex, null, depth);
        visited.add(graph.node(nodeIndex).key());

        // Frames in the order they were claimed. Children are always claimed after their parent.
        final var claimed = new ArrayList<Frame>();
        queue.add(root);
        while (!queue.isEmpty()) {
            final Frame frame = queue.poll();
            claimed.add(frame);
            if (frame.remainingDepth > 0) {
                expand(frame);
            }
        }

        for (int i = claimed.size() - 1; i > 0; i--) {
            claimed.get(i).complete(direction);
        }

        return root.completedChildren();
    }

    private void expand(final Frame frame) {
        final PackageGraph graph = frame.graph;

        if (graph.node(frame.nodeIndex) instanceof final ExternalNode externalNode) {
            final Frame resolvedFrame = claimResolved(externalNode, frame.remainingDepth - 1);
            if (resolvedFrame != null) {
                frame.children.add(resolvedFrame);
                queue.add(resolvedFrame);
            }
        }

        for (final Edge edge : graph.edges(frame.nodeIndex, direction)) {
            if (!relationships.isEmpty() && !relationships.contains(edge.relationship())) {
                continue;
            }

            final int neighbourIndex = edge.neighbour(direction);
            if (!visited.add(graph.node(neighbourIndex).key())) {
                continue;
            }

            final var child = new Frame(graph, neighbourIndex, edge.relationship(), frame.remainingDepth - 1);
            frame.children.add(child);
            queue.add(child);
        }
    }

    private @Nullable Frame claimResolved(final ExternalNode externalNode, final int remainingDepth) {
        final ResolvedSbom resolved = context.resolve(externalNode).orElse(null);
        if (resolved == null) {
            return null;
        }

        final PackageGraph resolvedGraph = context.admittedGraph(resolved.sbomId()).orElse(null);
        if (resolvedGraph == null) {
            LOGGER.debug(
                    "Not following external node {} of SBOM {}, because SBOM {} is not admitted",
                    externalNode.nodeId(), externalNode.sbomId(), resolved.sbomId());
            return null;
        }

        final OptionalInt resolvedIndex = resolvedGraph.indexOf(resolved.nodeId());
        if (resolvedIndex.isEmpty()) {
            LOGGER.debug(
                    "External node {} of SBOM {} resolved to node {} of SBOM {}, which does not exist",
                    externalNode.nodeId(), externalNode.sbomId(), resolved.nodeId(), resolved.sbomId());
            return null;
        }
        if (!visited.add(resolved.key())) {
            return null;
        }

        return new Frame(resolvedGraph, resolvedIndex.getAsInt(), null, remainingDepth);
    }

    private static final class Frame {

        private final PackageGraph graph;
        private final int nodeIndex;
        private final @Nullable Relationship relationship;
        private final int remainingDepth;
        private final List<Frame> children = new ArrayList<>();
        private @Nullable AnalysisNode node;

        private Frame(
                final PackageGraph graph,
                final int nodeIndex,
                final @Nullable Relationship relationship,
                final int remainingDepth) {
            this.graph = graph;
            this.nodeIndex = nodeIndex;
            this.relationship = relationship;
            this.remainingDepth = remainingDepth;
        }

        private void complete(final Direction direction) {
            final List<AnalysisNode> collected = completedChildren();
            final NodeSummary summary = NodeSummary.of(graph.node(nodeIndex));

            node = direction == Direction.INCOMING
                    ? new AnalysisNode(summary, relationship, collected, List.of())
                    : new AnalysisNode(summary, relationship, List.of(), collected);
        }

        private List<AnalysisNode> completedChildren() {
            final var collected = new ArrayList<AnalysisNode>(children.size());
            for (final Frame child : children) {
                collected.add(requireNonNull(child.node, "child must be completed before its parent"));
            }

            return collected;
        }

    }

}
