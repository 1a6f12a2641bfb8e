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

import java.util.Set;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A node of a {@link org.sbomgraph.analysis.graph.PackageGraph}.
 * <p>
 * The set of variants is closed. Consumers are expected to handle every variant explicitly.
 *
 * @since 0.1.0
 */
public sealed interface GraphNode {

    NodeBase base();

    NodeKind kind();

    default UUID sbomId() {
        return base().sbomId();
    }

    default String nodeId() {
        return base().nodeId();
    }

    default String name() {
        return base().name();
    }

    default NodeKey key() {
        return base().key();
    }

    record DocumentNode(NodeBase base) implements GraphNode {

        public DocumentNode {
            requireNonNull(base, "base must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DOCUMENT;
        }

    }

    /**
     * @param base    Common node attributes.
     * @param version Version of the package, if any.
     * @param purls   Canonical package URLs of the package.
     * @param cpes    CPEs of the package.
     */
    record PackageNode(
            NodeBase base,
            @Nullable String version,
            Set<String> purls,
            Set<String> cpes) implements GraphNode {

        public PackageNode {
            requireNonNull(base, "base must not be null");
            purls = purls != null ? Set.copyOf(purls) : Set.of();
            cpes = cpes != null ? Set.copyOf(cpes) : Set.of();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PACKAGE;
        }

    }

    /**
     * @param base                      Common node attributes.
     * @param externalDocumentReference Reference of the external document.
     * @param externalNodeId            ID of the node within the external document.
     */
    record ExternalNode(
            NodeBase base,
            String externalDocumentReference,
            String externalNodeId) implements GraphNode {

        public ExternalNode {
            requireNonNull(base, "base must not be null");
            requireNonNull(externalDocumentReference, "externalDocumentReference must not be null");
            requireNonNull(externalNodeId, "externalNodeId must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXTERNAL;
        }

    }

    record UnknownNode(NodeBase base) implements GraphNode {

        public UnknownNode {
            requireNonNull(base, "base must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNKNOWN;
        }

    }

}
