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
package org.sbomgraph.analysis.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A node of an analysis result, together with its collected ancestors and descendants.
 *
 * @param base         The node's attributes.
 * @param relationship The relationship through which this node was reached, if any.
 *                     {@code null} for starting nodes and for nodes reached by crossing
 *                     into another SBOM.
 * @param ancestors    Ancestors of the node, each with their own ancestors.
 * @param descendants  Descendants of the node, each with their own descendants.
 * @since 0.1.0
 */
public record AnalysisNode(
        NodeSummary base,
        @Nullable Relationship relationship,
        List<AnalysisNode> ancestors,
        List<AnalysisNode> descendants) {

    public AnalysisNode {
        requireNonNull(base, "base must not be null");
        ancestors = ancestors != null ? List.copyOf(ancestors) : List.of();
        descendants = descendants != null ? List.copyOf(descendants) : List.of();
    }

}
