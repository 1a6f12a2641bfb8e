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
package org.sbomgraph.analysis.graph;

import org.sbomgraph.analysis.model.GraphNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Immutable, directed multigraph of the nodes of exactly one SBOM.
 * <p>
 * Nodes are stored in an arena and addressed by their index, which is stable for the
 * lifetime of the graph. Edges reference their endpoints by index only.
 * The graph may contain cycles.
 * <p>
 * Instances are safe to share between threads.
 *
 * @since 0.1.0
 */
public final class PackageGraph {

    private final UUID sbomId;
    private final List<GraphNode> nodes;
    private final List<Edge> edges;
    private final List<List<Edge>> incomingEdges;
    private final List<List<Edge>> outgoingEdges;
    private final Map<String, Integer> indexByNodeId;
    private final long estimatedSize;

    PackageGraph(
            final UUID sbomId,
            final List<GraphNode> nodes,
            final List<Edge> edges,
            final long estimatedSize) {
        this.sbomId = requireNonNull(sbomId, "sbomId must not be null");
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.estimatedSize = estimatedSize;

        final var indexByNodeId = new HashMap<String, Integer>(this.nodes.size());
        final var incomingEdges = new ArrayList<List<Edge>>(this.nodes.size());
        final var outgoingEdges = new ArrayList<List<Edge>>(this.nodes.size());
        for (int i = 0; i < this.nodes.size(); i++) {
            indexByNodeId.put(this.nodes.get(i).nodeId(), i);
            incomingEdges.add(new ArrayList<>());
            outgoingEdges.add(new ArrayList<>());
        }
        for (final Edge edge : this.edges) {
            outgoingEdges.get(edge.source()).add(edge);
            incomingEdges.get(edge.target()).add(edge);
        }

        this.indexByNodeId = Collections.unmodifiableMap(indexByNodeId);
        this.incomingEdges = incomingEdges.stream().map(Collections::unmodifiableList).toList();
        this.outgoingEdges = outgoingEdges.stream().map(Collections::unmodifiableList).toList();
    }

    public UUID sbomId() {
        return sbomId;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public GraphNode node(final int index) {
        return nodes.get(index);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * @param index     Index of the node.
     * @param direction Whether to return incoming or outgoing edges.
     * @return The edges of the node, in insertion order.
     */
    public List<Edge> edges(final int index, final Direction direction) {
        return direction == Direction.OUTGOING
                ? outgoingEdges.get(index)
                : incomingEdges.get(index);
    }

    public OptionalInt indexOf(final String nodeId) {
        final Integer index = indexByNodeId.get(nodeId);
        return index != null ? OptionalInt.of(index) : OptionalInt.empty();
    }

    /**
     * @return Approximate number of bytes occupied by this graph on the heap.
     */
    public long estimatedSize() {
        return estimatedSize;
    }

    @Override
    public String toString() {
        return "PackageGraph{sbomId=%s, nodes=%d, edges=%d}".formatted(sbomId, nodes.size(), edges.size());
    }

}
