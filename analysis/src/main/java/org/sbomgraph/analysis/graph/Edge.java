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

import org.sbomgraph.analysis.model.Relationship;

import static java.util.Objects.requireNonNull;

/**
 * A directed edge of a {@link PackageGraph}, referencing its endpoints by node index.
 *
 * @param source       Index of the left-hand side node.
 * @param target       Index of the right-hand side node.
 * @param relationship The relationship the edge represents.
 * @since 0.1.0
 */
public record Edge(int source, int target, Relationship relationship) {

    public Edge {
        if (source < 0) {
            throw new IllegalArgumentException("source must not be negative");
        }
        if (target < 0) {
            throw new IllegalArgumentException("target must not be negative");
        }
        requireNonNull(relationship, "relationship must not be null");
    }

    /**
     * @param direction The direction in which the edge is being followed.
     * @return Index of the node the edge leads to when followed in {@code direction}.
     */
    public int neighbour(final Direction direction) {
        return direction == Direction.OUTGOING ? target : source;
    }

}
