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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Detects cycles in {@link PackageGraph}s.
 * <p>
 * Graphs containing a cycle are excluded from analysis as a whole.
 * Cycles are never broken up, since any choice of edge to remove would be arbitrary.
 *
 * @since 0.1.0
 */
public class CycleGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(CycleGuard.class);

    private static final byte WHITE = 0;
    private static final byte GRAY = 1;
    private static final byte BLACK = 2;

    /**
     * Perform an iterative depth-first search over outgoing edges, starting from every
     * unvisited node, and stop at the first back-edge.
     *
     * @param sbomId ID of the SBOM the graph belongs to.
     * @param graph  The graph to check.
     * @return {@code true} when the graph does not contain any cycle, otherwise {@code false}.
     */
    public boolean isAcyclic(final UUID sbomId, final PackageGraph graph) {
        requireNonNull(sbomId, "sbomId must not be null");
        requireNonNull(graph, "graph must not be null");

        final byte[] colors = new byte[graph.nodeCount()];
        final Deque<Frame> stack = new ArrayDeque<>();

        for (int root = 0; root < graph.nodeCount(); root++) {
            if (colors[root] != WHITE) {
                continue;
            }

            colors[root] = GRAY;
            stack.push(new Frame(root, graph.edges(root, Direction.OUTGOING)));

            while (!stack.isEmpty()) {
                final Frame frame = stack.peek();
                if (frame.nextEdge >= frame.edges.size()) {
                    colors[frame.nodeIndex] = BLACK;
                    stack.pop();
                    continue;
                }

                final Edge edge = frame.edges.get(frame.nextEdge++);
                final int target = edge.target();
                if (colors[target] == GRAY) {
                    LOGGER.warn(
                            "SBOM {} contains a cycle: {} {} {} closes a loop; excluding it from analysis",
                            sbomId,
                            graph.node(frame.nodeIndex).nodeId(),
                            edge.relationship().label(),
                            graph.node(target).nodeId());
                    return false;
                } else if (colors[target] == WHITE) {
                    colors[target] = GRAY;
                    stack.push(new Frame(target, graph.edges(target, Direction.OUTGOING)));
                }
            }
        }

        return true;
    }

    private static final class Frame {

        private final int nodeIndex;
        private final List<Edge> edges;
        private int nextEdge;

        private Frame(final int nodeIndex, final List<Edge> edges) {
            this.nodeIndex = nodeIndex;
            this.edges = edges;
        }

    }

}
