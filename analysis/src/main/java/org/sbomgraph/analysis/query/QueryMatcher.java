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
package org.sbomgraph.analysis.query;

import org.sbomgraph.analysis.graph.PackageGraph;
import org.sbomgraph.analysis.model.GraphNode;
import org.sbomgraph.analysis.model.GraphNode.PackageNode;
import org.sbomgraph.analysis.query.ComponentReference.Cpe;
import org.sbomgraph.analysis.query.ComponentReference.Id;
import org.sbomgraph.analysis.query.ComponentReference.Name;
import org.sbomgraph.analysis.query.ComponentReference.Purl;
import org.sbomgraph.analysis.query.GraphQuery.ComponentQuery;
import org.sbomgraph.analysis.query.GraphQuery.FilterQuery;

import java.util.stream.IntStream;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether nodes match a {@link GraphQuery}.
 *
 * @since 0.1.0
 */
public final class QueryMatcher {

    private QueryMatcher() {
    }

    /**
     * @return Indexes of all nodes in {@code graph} that match {@code query}, in ascending order.
     */
    public static int[] matchingIndexes(final GraphQuery query, final PackageGraph graph) {
        requireNonNull(query, "query must not be null");
        requireNonNull(graph, "graph must not be null");

        return IntStream.range(0, graph.nodeCount())
                .filter(index -> matches(query, graph.node(index)))
                .toArray();
    }

    public static boolean matches(final GraphQuery query, final GraphNode node) {
        requireNonNull(query, "query must not be null");
        requireNonNull(node, "node must not be null");

        if (query instanceof final ComponentQuery componentQuery) {
            return matches(componentQuery.reference(), node);
        } else if (query instanceof final FilterQuery filterQuery) {
            return filterQuery.expression().apply(NodeFieldContext.of(node));
        }

        throw new IllegalStateException("Unexpected query type: " + query.getClass().getName());
    }

    private static boolean matches(final ComponentReference reference, final GraphNode node) {
        if (reference instanceof final Id id) {
            return node.nodeId().equals(id.nodeId());
        } else if (reference instanceof final Name name) {
            return node.name().equals(name.name());
        } else if (reference instanceof final Purl purl) {
            return node instanceof final PackageNode packageNode
                    && packageNode.purls().contains(purl.purl());
        } else if (reference instanceof final Cpe cpe) {
            return node instanceof final PackageNode packageNode
                    && packageNode.cpes().contains(cpe.cpe());
        }

        throw new IllegalStateException("Unexpected reference type: " + reference.getClass().getName());
    }

}
