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

import org.jspecify.annotations.Nullable;
import org.sbomgraph.analysis.model.GraphNode;
import org.sbomgraph.analysis.model.GraphNode.DocumentNode;
import org.sbomgraph.analysis.model.GraphNode.ExternalNode;
import org.sbomgraph.analysis.model.GraphNode.PackageNode;
import org.sbomgraph.analysis.model.GraphNode.UnknownNode;
import org.sbomgraph.analysis.model.NodeBase;
import org.sbomgraph.analysis.model.NodeKind;
import org.sbomgraph.analysis.persistence.RelationshipRow;
import org.sbomgraph.analysis.persistence.SbomNodeRow;
import org.sbomgraph.analysis.util.PackageIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link PackageGraph} from the node and relationship rows of a single SBOM.
 * <p>
 * The builder is tolerant of partially ingested data:
 * <ul>
 *     <li>Multiple rows for the same node are merged, combining their package URLs and CPEs.</li>
 *     <li>Rows belonging to a different SBOM are ignored.</li>
 *     <li>Relationships referencing a node that does not exist are skipped.</li>
 * </ul>
 * Instances are not thread-safe, and are intended to be used for building a single graph.
 *
 * @since 0.1.0
 */
public final class PackageGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PackageGraphBuilder.class);

    private static final long GRAPH_OVERHEAD_BYTES = 256;
    private static final long NODE_OVERHEAD_BYTES = 160;
    private static final long EDGE_OVERHEAD_BYTES = 64;
    private static final long STRING_OVERHEAD_BYTES = 40;

    private final UUID sbomId;
    private final Map<String, NodeRowAccumulator> accumulatorByNodeId = new LinkedHashMap<>();
    private final List<RelationshipRow> relationshipRows = new ArrayList<>();
    private int ignoredNodeRows;

    public PackageGraphBuilder(final UUID sbomId) {
        this.sbomId = requireNonNull(sbomId, "sbomId must not be null");
    }

    public static PackageGraph build(
            final UUID sbomId,
            final Collection<SbomNodeRow> nodeRows,
            final Collection<RelationshipRow> relationshipRows) {
        final var builder = new PackageGraphBuilder(sbomId);
        nodeRows.forEach(builder::addNode);
        relationshipRows.forEach(builder::addRelationship);
        return builder.build();
    }

    public PackageGraphBuilder addNode(final SbomNodeRow row) {
        requireNonNull(row, "row must not be null");
        if (!sbomId.equals(row.sbomId())) {
            ignoredNodeRows++;
            return this;
        }

        final NodeRowAccumulator existing = accumulatorByNodeId.get(row.nodeId());
        if (existing == null) {
            accumulatorByNodeId.put(row.nodeId(), new NodeRowAccumulator(row));
        } else {
            existing.merge(row);
        }

        return this;
    }

    public PackageGraphBuilder addRelationship(final RelationshipRow row) {
        requireNonNull(row, "row must not be null");
        relationshipRows.add(row);
        return this;
    }

    public PackageGraph build() {
        final var nodes = new ArrayList<GraphNode>(accumulatorByNodeId.size());
        final var indexByNodeId = new LinkedHashMap<String, Integer>(accumulatorByNodeId.size());
        long estimatedSize = GRAPH_OVERHEAD_BYTES;

        for (final NodeRowAccumulator accumulator : accumulatorByNodeId.values()) {
            final GraphNode node = accumulator.toNode();
            indexByNodeId.put(node.nodeId(), nodes.size());
            nodes.add(node);
            estimatedSize += estimateSize(node);
        }

        final var edges = new ArrayList<Edge>(relationshipRows.size());
        int skippedRelationships = 0;
        for (final RelationshipRow row : relationshipRows) {
            final Integer sourceIndex = sbomId.equals(row.sbomId()) ? indexByNodeId.get(row.leftNodeId()) : null;
            final Integer targetIndex = sbomId.equals(row.sbomId()) ? indexByNodeId.get(row.rightNodeId()) : null;
            if (sourceIndex == null || targetIndex == null) {
                skippedRelationships++;
                continue;
            }

            edges.add(new Edge(sourceIndex, targetIndex, row.relationship()));
            estimatedSize += EDGE_OVERHEAD_BYTES;
        }

        if (ignoredNodeRows > 0) {
            LOGGER.debug("Ignored {} node rows not belonging to SBOM {}", ignoredNodeRows, sbomId);
        }
        if (skippedRelationships > 0) {
            LOGGER.debug(
                    "Skipped {} of {} relationships of SBOM {} due to unknown endpoints",
                    skippedRelationships, relationshipRows.size(), sbomId);
        }

        return new PackageGraph(sbomId, nodes, edges, estimatedSize);
    }

    private static long estimateSize(final GraphNode node) {
        long size = NODE_OVERHEAD_BYTES
                + estimateSize(node.nodeId())
                + estimateSize(node.name())
                + estimateSize(node.base().documentId());

        if (node instanceof final PackageNode packageNode) {
            size += estimateSize(packageNode.version());
            size += packageNode.purls().stream().mapToLong(PackageGraphBuilder::estimateSize).sum();
            size += packageNode.cpes().stream().mapToLong(PackageGraphBuilder::estimateSize).sum();
        } else if (node instanceof final ExternalNode externalNode) {
            size += estimateSize(externalNode.externalDocumentReference());
            size += estimateSize(externalNode.externalNodeId());
        }

        return size;
    }

    private static long estimateSize(final @Nullable String value) {
        if (value == null) {
            return 0;
        }

        return STRING_OVERHEAD_BYTES + value.length();
    }

    private static final class NodeRowAccumulator {

        private final SbomNodeRow row;
        private final Set<String> purls = new LinkedHashSet<>();
        private final Set<String> cpes = new LinkedHashSet<>();

        private NodeRowAccumulator(final SbomNodeRow row) {
            this.row = row;
            merge(row);
        }

        private void merge(final SbomNodeRow other) {
            if (other.purls() != null) {
                other.purls().stream()
                        .filter(purl -> purl != null && !purl.isBlank())
                        .map(PackageIdentifiers::canonicalizePurlLenient)
                        .forEach(purls::add);
            }
            if (other.cpes() != null) {
                other.cpes().stream()
                        .filter(cpe -> cpe != null && !cpe.isBlank())
                        .map(PackageIdentifiers::normalizeCpeLenient)
                        .forEach(cpes::add);
            }
        }

        private GraphNode toNode() {
            final var base = new NodeBase(
                    row.sbomId(),
                    row.nodeId(),
                    row.name() != null ? row.name() : "",
                    row.documentId(),
                    row.published());

            final NodeKind kind = row.kind() != null ? row.kind() : NodeKind.UNKNOWN;
            return switch (kind) {
                case DOCUMENT -> new DocumentNode(base);
                case PACKAGE -> new PackageNode(base, row.version(), purls, cpes);
                case EXTERNAL -> row.externalDocumentReference() != null && row.externalNodeId() != null
                        ? new ExternalNode(base, row.externalDocumentReference(), row.externalNodeId())
                        : new UnknownNode(base);
                case UNKNOWN -> new UnknownNode(base);
            };
        }

    }

}
