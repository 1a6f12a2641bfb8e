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
package org.sbomgraph.analysis.collect;

import org.sbomgraph.analysis.cache.GraphCache;
import org.sbomgraph.analysis.graph.CycleGuard;
import org.sbomgraph.analysis.graph.PackageGraph;
import org.sbomgraph.analysis.model.GraphNode.ExternalNode;
import org.sbomgraph.analysis.resolve.ExternalSbomResolver;
import org.sbomgraph.analysis.resolve.ResolvedSbom;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * State shared by all expansions of a single analysis request.
 * <p>
 * The outcome of the {@link CycleGuard} is remembered per SBOM, such that each graph
 * is checked at most once per request, no matter how often it is reached.
 * Instances are thread-safe.
 *
 * @since 0.1.0
 */
public final class TraversalContext {

    private final Map<UUID, PackageGraph> graphs;
    private final GraphCache graphCache;
    private final ExternalSbomResolver resolver;
    private final CycleGuard cycleGuard;
    private final Map<UUID, Boolean> admittedBySbomId = new ConcurrentHashMap<>();

    /**
     * @param graphs     Graphs already loaded for the request.
     * @param graphCache Cache to obtain graphs from that are not part of {@code graphs}.
     * @param resolver   Resolver for external references.
     * @param cycleGuard Guard to admit graphs with.
     */
    public TraversalContext(
            final Map<UUID, PackageGraph> graphs,
            final GraphCache graphCache,
            final ExternalSbomResolver resolver,
            final CycleGuard cycleGuard) {
        this.graphs = Map.copyOf(requireNonNull(graphs, "graphs must not be null"));
        this.graphCache = requireNonNull(graphCache, "graphCache must not be null");
        this.resolver = requireNonNull(resolver, "resolver must not be null");
        this.cycleGuard = requireNonNull(cycleGuard, "cycleGuard must not be null");
    }

    /**
     * @return Whether {@code graph} is free of cycles, and may thus be traversed.
     */
    public boolean isAdmitted(final PackageGraph graph) {
        return admittedBySbomId.computeIfAbsent(graph.sbomId(), sbomId -> cycleGuard.isAcyclic(sbomId, graph));
    }

    /**
     * Obtain the graph of a given SBOM, if it may be traversed.
     * <p>
     * Graphs that are not already part of the request are loaded through the {@link GraphCache},
     * blocking until they are available.
     *
     * @throws java.util.concurrent.CompletionException When loading the graph failed.
     */
    public Optional<PackageGraph> admittedGraph(final UUID sbomId) {
        PackageGraph graph = graphs.get(sbomId);
        if (graph == null) {
            graph = graphCache.getOrBuild(sbomId).join();
        }

        return isAdmitted(graph) ? Optional.of(graph) : Optional.empty();
    }

    public Optional<ResolvedSbom> resolve(final ExternalNode node) {
        return resolver.resolve(node);
    }

}
