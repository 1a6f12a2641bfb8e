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
package org.sbomgraph.analysis.resolve;

import org.sbomgraph.analysis.model.GraphNode.ExternalNode;
import org.sbomgraph.analysis.persistence.AnalysisDao;
import org.sbomgraph.analysis.persistence.DiscriminatorType;
import org.sbomgraph.analysis.persistence.ExternalNodeRow;
import org.sbomgraph.analysis.persistence.NodeChecksumRow;
import org.sbomgraph.analysis.persistence.PackageRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static org.sbomgraph.analysis.common.MdcKeys.MDC_EXTERNAL_NODE_ID;
import static org.sbomgraph.analysis.common.MdcKeys.MDC_SBOM_ID;

/**
 * Resolves {@link ExternalNode}s to the node of another SBOM they refer to.
 * <p>
 * At most one resolution is ever returned. When multiple candidates exist, the first one wins.
 * Failures of the database propagate as {@link org.jdbi.v3.core.JdbiException}s,
 * whereas references that can't be resolved yield {@link Optional#empty()}.
 *
 * @since 0.1.0
 */
public class ExternalSbomResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExternalSbomResolver.class);

    private final AnalysisDao dao;

    public ExternalSbomResolver(final AnalysisDao dao) {
        this.dao = requireNonNull(dao, "dao must not be null");
    }

    public Optional<ResolvedSbom> resolve(final ExternalNode node) {
        requireNonNull(node, "node must not be null");

        try (var ignoredMdcSbomId = MDC.putCloseable(MDC_SBOM_ID, node.sbomId().toString());
             var ignoredMdcExternalNodeId = MDC.putCloseable(MDC_EXTERNAL_NODE_ID, node.nodeId())) {
            final ExternalNodeRow externalNode = dao.getExternalNode(node.sbomId(), node.nodeId()).orElse(null);
            if (externalNode == null) {
                LOGGER.debug("No external reference record exists for node {} of SBOM {}", node.nodeId(), node.sbomId());
                return Optional.empty();
            }

            final Optional<ResolvedSbom> resolved = switch (externalNode.externalType()) {
                case SPDX -> resolveSpdx(externalNode);
                case CYCLONEDX -> resolveCycloneDx(externalNode);
                case VENDOR_VARIANT -> resolveVendorVariant(externalNode);
            };

            if (resolved.isEmpty()) {
                LOGGER.debug(
                        "Unable to resolve {} reference {} of node {} in SBOM {}",
                        externalNode.externalType(),
                        externalNode.externalDocumentReference(),
                        node.nodeId(),
                        node.sbomId());
            }

            return resolved;
        }
    }

    /**
     * SPDX documents reference other documents through their checksum.
     * Only SHA-256 checksums are recorded for source documents.
     */
    private Optional<ResolvedSbom> resolveSpdx(final ExternalNodeRow externalNode) {
        if (isEmpty(externalNode.discriminatorValue())
                || externalNode.discriminatorType() != DiscriminatorType.SHA256) {
            return Optional.empty();
        }

        return dao.getSbomIdBySourceDocumentSha256(externalNode.discriminatorValue())
                .map(sbomId -> new ResolvedSbom(sbomId, externalNode.externalNodeReference()));
    }

    /**
     * CycloneDX documents reference other documents through BOM-Links, consisting of
     * the serial number and version of the referenced document.
     */
    private Optional<ResolvedSbom> resolveCycloneDx(final ExternalNodeRow externalNode) {
        if (isEmpty(externalNode.discriminatorValue())) {
            return Optional.empty();
        }

        final String documentId = "urn:cdx:%s/%s".formatted(
                externalNode.externalDocumentReference(),
                externalNode.discriminatorValue());

        return dao.getSbomIdByDocumentId(documentId)
                .map(sbomId -> new ResolvedSbom(sbomId, externalNode.externalNodeReference()));
    }

    /**
     * Vendor variants reference a component of another SBOM without naming that SBOM.
     * <p>
     * This is a heuristic: the component is first matched by its checksum, then by its version.
     * Unrelated SBOMs that happen to share a checksum or version will produce false matches.
     */
    private Optional<ResolvedSbom> resolveVendorVariant(final ExternalNodeRow externalNode) {
        final String reference = externalNode.externalNodeReference();

        final NodeChecksumRow checksum = dao.getNodeChecksum(reference).orElse(null);
        if (checksum != null) {
            return dao.getNodeChecksumByValueInOtherSbom(checksum.value(), checksum.sbomId())
                    .map(match -> new ResolvedSbom(match.sbomId(), match.nodeId()));
        }

        final PackageRow variant = dao.getPackage(reference).orElse(null);
        if (variant == null || variant.version() == null) {
            return Optional.empty();
        }

        return dao.getPackageByVersionInOtherSbom(variant.version(), variant.sbomId())
                .map(match -> new ResolvedSbom(match.sbomId(), match.nodeId()));
    }

    private static boolean isEmpty(final String value) {
        return value == null || value.isEmpty();
    }

}
