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

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Flat projection of a {@link GraphNode}, as returned to callers.
 *
 * @since 0.1.0
 */
public record NodeSummary(
        UUID sbomId,
        String nodeId,
        String name,
        NodeKind kind,
        @Nullable String version,
        Set<String> purls,
        Set<String> cpes,
        @Nullable String documentId,
        @Nullable Instant published) {

    public NodeSummary {
        requireNonNull(sbomId, "sbomId must not be null");
        requireNonNull(nodeId, "nodeId must not be null");
        requireNonNull(name, "name must not be null");
        requireNonNull(kind, "kind must not be null");
        purls = purls != null ? Set.copyOf(purls) : Set.of();
        cpes = cpes != null ? Set.copyOf(cpes) : Set.of();
    }

    public static NodeSummary of(GraphNode node) {
        requireNonNull(node, "node must not be null");

        final NodeBase base = node.base();
        String version = null;
        Set<String> purls = Set.of();
        Set<String> cpes = Set.of();
        if (node instanceof final GraphNode.PackageNode packageNode) {
            version = packageNode.version();
            purls = packageNode.purls();
            cpes = packageNode.cpes();
        }

        return new NodeSummary(
                base.sbomId(),
                base.nodeId(),
                base.name(),
                node.kind(),
                version,
                purls,
                cpes,
                base.documentId(),
                base.published());
    }

}
