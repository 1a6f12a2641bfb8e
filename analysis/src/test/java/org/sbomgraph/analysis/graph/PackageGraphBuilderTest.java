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

import org.junit.jupiter.api.Test;
import org.sbomgraph.analysis.model.GraphNode;
import org.sbomgraph.analysis.model.GraphNode.DocumentNode;
import org.sbomgraph.analysis.model.GraphNode.ExternalNode;
import org.sbomgraph.analysis.model.GraphNode.PackageNode;
import org.sbomgraph.analysis.model.GraphNode.UnknownNode;
import org.sbomgraph.analysis.model.NodeKind;
import org.sbomgraph.analysis.model.Relationship;
import org.sbomgraph.analysis.persistence.RelationshipRow;
import org.sbomgraph.analysis.persistence.SbomNodeRow;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PackageGraphBuilderTest {

    private static final UUID SBOM_ID = UUID.fromString("e3a1b7c2-5d3b-4f35-9a32-0c7c1cb11111");

    @Test
    void shouldMapRowsToNodeVariants() {
        final PackageGraph graph = PackageGraphBuilder.build(
                SBOM_ID,
                List.of(
                        nodeRow("doc", NodeKind.DOCUMENT),
                        packageRow("pkg", "1.0.0", List.of("pkg:npm/foo@1.0.0"), List.of()),
                        externalRow("ext", "DocumentRef-other", "SPDXRef-bar"),
                        nodeRow("file", NodeKind.UNKNOWN)),
                List.of());

        assertThat(graph.sbomId()).isEqualTo(SBOM_ID);
        assertThat(graph.nodes()).satisfiesExactly(
                node -> assertThat(node).isInstanceOf(DocumentNode.class),
                node -> {
                    assertThat(node).isInstanceOf(PackageNode.class);
                    final var packageNode = (PackageNode) node;
                    assertThat(packageNode.version()).isEqualTo("1.0.0");
                    assertThat(packageNode.purls()).containsOnly("pkg:npm/foo@1.0.0");
                },
                node -> {
                    assertThat(node).isInstanceOf(ExternalNode.class);
                    final var externalNode = (ExternalNode) node;
                    assertThat(externalNode.externalDocumentReference()).isEqualTo("DocumentRef-other");
                    assertThat(externalNode.externalNodeId()).isEqualTo("SPDXRef-bar");
                },
                node -> assertThat(node).isInstanceOf(UnknownNode.class));
    }

    @Test
    void shouldMergeDuplicateNodeRows() {
        final PackageGraph graph = PackageGraphBuilder.build(
                SBOM_ID,
                List.of(
                        packageRow("pkg", "1.0.0", List.of("pkg:npm/foo@1.0.0"), List.of()),
                        packageRow("pkg", "1.0.0", List.of("pkg:npm/foo@1.0.0?arch=x86"), List.of())),
                List.of());

        assertThat(graph.nodeCount()).isEqualTo(1);
        assertThat(((PackageNode) graph.node(0)).purls())
                .containsExactlyInAnyOrder("pkg:npm/foo@1.0.0", "pkg:npm/foo@1.0.0?arch=x86");
    }

    @Test
    void shouldNormalizePackageIdentifiers() {
        final PackageGraph graph = PackageGraphBuilder.build(
                SBOM_ID,
                List.of(packageRow(
                        "pkg",
                        "2.0",
                        List.of("pkg:maven/org.acme/acme-lib@2.0?type=jar&classifier=sources", "not-a-purl"),
                        List.of("cpe:2.3:a:acme:library:2.0:*:*:*:*:*:*:*", "not-a-cpe"))),
                List.of());

        final var packageNode = (PackageNode) graph.node(0);
        assertThat(packageNode.purls()).containsExactlyInAnyOrder(
                "pkg:maven/org.acme/acme-lib@2.0?classifier=sources&type=jar",
                "not-a-purl");
        assertThat(packageNode.cpes()).containsExactlyInAnyOrder(
                "cpe:2.3:a:acme:library:2.0:*:*:*:*:*:*:*",
                "not-a-cpe");
    }

    @Test
    void shouldAddEdgesBetweenKnownNodes() {
        final PackageGraph graph = PackageGraphBuilder.build(
                SBOM_ID,
                List.of(
                        packageRow("a", null, List.of(), List.of()),
                        packageRow("b", null, List.of(), List.of())),
                List.of(new RelationshipRow(SBOM_ID, "a", Relationship.DEPENDS_ON, "b")));

        final int a = graph.indexOf("a").orElseThrow();
        final int b = graph.indexOf("b").orElseThrow();
        assertThat(graph.edges(a, Direction.OUTGOING)).containsExactly(new Edge(a, b, Relationship.DEPENDS_ON));
        assertThat(graph.edges(a, Direction.INCOMING)).isEmpty();
        assertThat(graph.edges(b, Direction.INCOMING)).containsExactly(new Edge(a, b, Relationship.DEPENDS_ON));
        assertThat(graph.edges(b, Direction.OUTGOING)).isEmpty();
    }

    @Test
    void shouldSkipRelationshipsWithUnknownEndpoints() {
        final PackageGraph graph = PackageGraphBuilder.build(
                SBOM_ID,
                List.of(
                        packageRow("a", null, List.of(), List.of()),
                        packageRow("b", null, List.of(), List.of())),
                List.of(
                        new RelationshipRow(SBOM_ID, "a", Relationship.DEPENDS_ON, "missing"),
                        new RelationshipRow(SBOM_ID, "missing", Relationship.DEPENDS_ON, "b"),
                        new RelationshipRow(UUID.randomUUID(), "a", Relationship.DEPENDS_ON, "b"),
                        new RelationshipRow(SBOM_ID, "a", Relationship.CONTAINS, "b")));

        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.edges()).extracting(Edge::relationship).containsExactly(Relationship.CONTAINS);
    }

    @Test
    void shouldIgnoreNodeRowsOfOtherSboms() {
        final var otherRow = new SbomNodeRow(
                UUID.randomUUID(), "other", "other", NodeKind.PACKAGE,
                null, null, null, null, null, null, null);

        final PackageGraph graph = PackageGraphBuilder.build(
                SBOM_ID, List.of(otherRow, packageRow("a", null, null, null)), List.of());

        assertThat(graph.nodes()).extracting(GraphNode::nodeId).containsExactly("a");
    }

    @Test
    void shouldFallBackToUnknownNodeForIncompleteExternalNode() {
        final PackageGraph graph = PackageGraphBuilder.build(
                SBOM_ID, List.of(externalRow("ext", null, null)), List.of());

        assertThat(graph.node(0)).isInstanceOf(UnknownNode.class);
    }

    @Test
    void shouldEstimateSizeProportionalToContent() {
        final PackageGraph small = PackageGraphBuilder.build(
                SBOM_ID, List.of(packageRow("a", null, List.of(), List.of())), List.of());
        final PackageGraph large = PackageGraphBuilder.build(
                SBOM_ID,
                List.of(
                        packageRow("a", null, List.of(), List.of()),
                        packageRow("b", "1.0.0", List.of("pkg:npm/b@1.0.0"), List.of())),
                List.of(new RelationshipRow(SBOM_ID, "a", Relationship.DEPENDS_ON, "b")));

        assertThat(small.estimatedSize()).isPositive();
        assertThat(large.estimatedSize()).isGreaterThan(small.estimatedSize());
    }

    private static SbomNodeRow nodeRow(final String nodeId, final NodeKind kind) {
        return new SbomNodeRow(
                SBOM_ID, nodeId, nodeId, kind, "urn:test", null,
                null, List.of(), List.of(), null, null);
    }

    private static SbomNodeRow packageRow(
            final String nodeId,
            final String version,
            final List<String> purls,
            final List<String> cpes) {
        return new SbomNodeRow(
                SBOM_ID, nodeId, nodeId, NodeKind.PACKAGE, "urn:test", null,
                version, purls, cpes, null, null);
    }

    private static SbomNodeRow externalRow(
            final String nodeId,
            final String externalDocumentReference,
            final String externalNodeId) {
        return new SbomNodeRow(
                SBOM_ID, nodeId, nodeId, NodeKind.EXTERNAL, "urn:test", null,
                null, List.of(), List.of(), externalDocumentReference, externalNodeId);
    }

}
