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

import org.sbomgraph.analysis.persistence.AnalysisDao;
import org.sbomgraph.analysis.persistence.RelationshipRow;
import org.sbomgraph.analysis.persistence.SbomNodeRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static java.util.Objects.requireNonNull;
import static org.sbomgraph.analysis.common.MdcKeys.MDC_SBOM_ID;

/**
 * Loads the rows of an SBOM from the database, and builds a {@link PackageGraph} from them.
 *
 * @since 0.1.0
 */
public class PackageGraphLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PackageGraphLoader.class);

    private final AnalysisDao dao;

    public PackageGraphLoader(final AnalysisDao dao) {
        this.dao = requireNonNull(dao, "dao must not be null");
    }

    /**
     * @param sbomId ID of the SBOM to load.
     * @return The loaded graph. Empty when the SBOM does not exist.
     * @throws org.jdbi.v3.core.JdbiException When loading any of the rows failed.
     */
    public PackageGraph load(final UUID sbomId) {
        requireNonNull(sbomId, "sbomId must not be null");

        try (var ignoredMdcSbomId = MDC.putCloseable(MDC_SBOM_ID, sbomId.toString())) {
            final long startTimeNs = System.nanoTime();

            final List<SbomNodeRow> nodeRows = dao.getNodes(sbomId);
            final List<RelationshipRow> relationshipRows = dao.getRelationships(sbomId);
            final PackageGraph graph = PackageGraphBuilder.build(sbomId, nodeRows, relationshipRows);

            LOGGER.debug(
                    "Loaded graph with {} nodes and {} edges (~{} bytes) in {}",
                    graph.nodeCount(),
                    graph.edgeCount(),
                    graph.estimatedSize(),
                    Duration.ofNanos(System.nanoTime() - startTimeNs));
            return graph;
        }
    }

}
