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
package org.sbomgraph.analysis;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.jdbi.v3.core.JdbiException;
import org.jspecify.annotations.Nullable;
import org.sbomgraph.analysis.cache.GraphCache;
import org.sbomgraph.analysis.collect.Collector;
import org.sbomgraph.analysis.collect.TraversalContext;
import org.sbomgraph.analysis.graph.CycleGuard;
import org.sbomgraph.analysis.graph.Direction;
import org.sbomgraph.analysis.graph.PackageGraph;
import org.sbomgraph.analysis.graph.PackageGraphLoader;
import org.sbomgraph.analysis.model.AnalysisNode;
import org.sbomgraph.analysis.model.GraphNode;
import org.sbomgraph.analysis.model.NodeSummary;
import org.sbomgraph.analysis.persistence.AnalysisDao;
import org.sbomgraph.analysis.query.ComponentReference;
import org.sbomgraph.analysis.query.GraphQuery;
import org.sbomgraph.analysis.query.GraphQuery.ComponentQuery;
import org.sbomgraph.analysis.query.GraphQuery.FilterQuery;
import org.sbomgraph.analysis.query.QueryMatcher;
import org.sbomgraph.analysis.render.GraphRenderer;
import org.sbomgraph.analysis.render.RenderFormat;
import org.sbomgraph.analysis.resolve.ExternalSbomResolver;
import org.sbomgraph.common.pagination.Paginated;
import org.sbomgraph.common.pagination.PaginatedResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Answers questions about the dependency graphs of SBOMs.
 * <p>
 * A request is processed in the following stages:
 * <ol>
 *     <li>Load: obtain the graphs of all SBOMs in scope of the request from the {@link GraphCache}</li>
 *     <li>Admit: exclude graphs containing cycles</li>
 *     <li>Match: locate nodes matching the {@link GraphQuery}</li>
 *     <li>Expand: collect ancestors and descendants of every matched node, concurrently</li>
 *     <li>Paginate: apply the requested {@link Paginated} window</li>
 * </ol>
 * Every instance owns its own {@link GraphCache}, unless one is passed explicitly.
 * Sharing a cache between instances must hence be a deliberate choice.
 * <p>
 * Instances are thread-safe, and must be {@link #close() closed} once no longer needed.
 *
 * @since 0.1.0
 */
public class AnalysisService implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisDao dao;
    private final GraphCache graphCache;
    private final ExternalSbomResolver resolver;
    private final CycleGuard cycleGuard;
    private final ExecutorService expandExecutor;
    private final @Nullable ExecutorService loaderExecutor;

    /**
     * Create a new {@link AnalysisService} with its own {@link GraphCache}.
     */
    public AnalysisService(final AnalysisConfig config, final AnalysisDao dao, final MeterRegistry meterRegistry) {
        this(config, dao, meterRegistry, createLoaderExecutor(config));
    }

    /**
     * Create a new {@link AnalysisService} using an existing {@link GraphCache}.
     * <p>
     * The caller remains responsible for the executor the cache loads graphs with.
     */
    public AnalysisService(
            final AnalysisConfig config,
            final AnalysisDao dao,
            final GraphCache graphCache,
            final MeterRegistry meterRegistry) {
        this(config, dao, graphCache, meterRegistry, null);
    }

    private AnalysisService(
            final AnalysisConfig config,
            final AnalysisDao dao,
            final MeterRegistry meterRegistry,
            final ExecutorService loaderExecutor) {
        this(
                config,
                dao,
                new GraphCache(config.maxCacheSize(), new PackageGraphLoader(dao)::load, loaderExecutor),
                meterRegistry,
                loaderExecutor);
    }

    private AnalysisService(
            final AnalysisConfig config,
            final AnalysisDao dao,
            final GraphCache graphCache,
            final MeterRegistry meterRegistry,
            final @Nullable ExecutorService loaderExecutor) {
        requireNonNull(config, "config must not be null");
        requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.dao = requireNonNull(dao, "dao must not be null");
        this.graphCache = requireNonNull(graphCache, "graphCache must not be null");
        this.resolver = new ExternalSbomResolver(dao);
        this.cycleGuard = new CycleGuard();
        this.loaderExecutor = loaderExecutor;
        this.expandExecutor = Executors.newFixedThreadPool(
                config.concurrency(),
                new BasicThreadFactory.Builder()
                        .namingPattern("AnalysisService-Expander-%d")
                        .build());

        graphCache.bindTo(meterRegistry);
        new ExecutorServiceMetrics(expandExecutor, "AnalysisService-Expander", null)
                .bindTo(meterRegistry);
        if (loaderExecutor != null) {
            new ExecutorServiceMetrics(loaderExecutor, "AnalysisService-GraphLoader", null)
                    .bindTo(meterRegistry);
        }
    }

    private static ExecutorService createLoaderExecutor(final AnalysisConfig config) {
        requireNonNull(config, "config must not be null");
        return Executors.newFixedThreadPool(
                config.loaderConcurrency(),
                new BasicThreadFactory.Builder()
                        .namingPattern("AnalysisService-GraphLoader-%d")
                        .build());
    }

    /**
     * Locate nodes across all SBOMs in scope of {@code query}, and collect their ancestors and descendants.
     * <p>
     * For {@link ComponentQuery}s, only SBOMs containing a node with the referenced ID, name, package URL,
     * or CPE are in scope. For {@link FilterQuery}s, all SBOMs are in scope.
     * <p>
     * The order of results is not guaranteed.
     *
     * @throws AnalysisDataAccessException When accessing the database failed.
     */
    public PaginatedResults<AnalysisNode> retrieve(
            final GraphQuery query,
            final QueryOptions options,
            final Paginated paginated) {
        requireNonNull(query, "query must not be null");
        requireNonNull(options, "options must not be null");
        requireNonNull(paginated, "paginated must not be null");

        final List<UUID> sbomIds = withDataAccess(() -> sbomIdsInScope(query));
        LOGGER.debug("{} SBOMs are in scope of query {}", sbomIds.size(), query);

        final Map<UUID, PackageGraph> graphs = loadGraphs(sbomIds);
        return paginated.paginate(runQuery(query, options, graphs));
    }

    /**
     * Locate nodes within a single SBOM, and collect their ancestors and descendants.
     * <p>
     * Collection may still cross into other SBOMs through external references.
     *
     * @throws AnalysisDataAccessException When accessing the database failed.
     */
    public PaginatedResults<AnalysisNode> retrieveSingle(
            final UUID sbomId,
            final GraphQuery query,
            final QueryOptions options,
            final Paginated paginated) {
        requireNonNull(sbomId, "sbomId must not be null");
        requireNonNull(query, "query must not be null");
        requireNonNull(options, "options must not be null");
        requireNonNull(paginated, "paginated must not be null");

        final Map<UUID, PackageGraph> graphs = loadGraphs(List.of(sbomId));
        return paginated.paginate(runQuery(query, options, graphs));
    }

    /**
     * Load the graphs of all known SBOMs into the cache.
     *
     * @return The loaded graphs, keyed by SBOM ID.
     * @throws AnalysisDataAccessException When accessing the database failed.
     */
    public Map<UUID, PackageGraph> loadAllGraphs() {
        final List<UUID> sbomIds = withDataAccess(dao::getSbomIds);
        LOGGER.info("Loading graphs of {} SBOMs", sbomIds.size());
        return loadGraphs(sbomIds);
    }

    public AnalysisStatus status() {
        final long sbomCount = withDataAccess(dao::countSboms);
        return new AnalysisStatus(sbomCount, graphCache.len());
    }

    public void clearAllGraphs() {
        graphCache.clear();
    }

    public long cacheSizeUsed() {
        return graphCache.sizeUsed();
    }

    public long cacheLen() {
        return graphCache.len();
    }

    /**
     * Render the graph of a single SBOM.
     *
     * @throws AnalysisDataAccessException When accessing the database failed.
     */
    public String render(final UUID sbomId, final RenderFormat format) {
        requireNonNull(sbomId, "sbomId must not be null");
        requireNonNull(format, "format must not be null");

        final PackageGraph graph = join(graphCache.getOrBuild(sbomId));
        return GraphRenderer.render(graph, format);
    }

    @Override
    public void close() {
        LOGGER.debug("Waiting for expander to stop");
        shutdown(expandExecutor, "Expander");

        if (loaderExecutor != null) {
            LOGGER.debug("Waiting for graph loader to stop");
            shutdown(loaderExecutor, "Graph loader");
        }
    }

    private List<UUID> sbomIdsInScope(final GraphQuery query) {
        if (query instanceof final FilterQuery ignored) {
            return dao.getSbomIds();
        } else if (query instanceof final ComponentQuery componentQuery) {
            final ComponentReference reference = componentQuery.reference();
            if (reference instanceof final ComponentReference.Id id) {
                return dao.getSbomIdsByNodeId(id.nodeId());
            } else if (reference instanceof final ComponentReference.Name name) {
                return dao.getSbomIdsByName(name.name());
            } else if (reference instanceof final ComponentReference.Purl purl) {
                return dao.getSbomIdsByPurl(purl.lookupValues());
            } else if (reference instanceof final ComponentReference.Cpe cpe) {
                return dao.getSbomIdsByCpe(cpe.lookupValues());
            }
        }

        throw new IllegalStateException("Unexpected query: " + query);
    }

    private Map<UUID, PackageGraph> loadGraphs(final Collection<UUID> sbomIds) {
        final var futureBySbomId = new LinkedHashMap<UUID, CompletableFuture<PackageGraph>>(sbomIds.size());
        for (final UUID sbomId : new LinkedHashSet<>(sbomIds)) {
            futureBySbomId.put(sbomId, graphCache.getOrBuild(sbomId));
        }

        final var graphBySbomId = new LinkedHashMap<UUID, PackageGraph>(futureBySbomId.size());
        futureBySbomId.forEach((sbomId, future) -> graphBySbomId.put(sbomId, join(future)));
        return graphBySbomId;
    }

    private List<AnalysisNode> runQuery(
            final GraphQuery query,
            final QueryOptions options,
            final Map<UUID, PackageGraph> graphs) {
        final var context = new TraversalContext(graphs, graphCache, resolver, cycleGuard);

        final var expansions = new ArrayList<CompletableFuture<AnalysisNode>>();
        for (final PackageGraph graph : graphs.values()) {
            if (!context.isAdmitted(graph)) {
                continue;
            }

            for (final int nodeIndex : QueryMatcher.matchingIndexes(query, graph)) {
                expansions.add(CompletableFuture.supplyAsync(
                        () -> expand(context, graph, nodeIndex, options), expandExecutor));
            }
        }

        LOGGER.debug("Expanding {} matched nodes across {} graphs", expansions.size(), graphs.size());
        return expansions.stream()
                .map(AnalysisService::join)
                .toList();
    }

    private static AnalysisNode expand(
            final TraversalContext context,
            final PackageGraph graph,
            final int nodeIndex,
            final QueryOptions options) {
        final GraphNode node = graph.node(nodeIndex);
        LOGGER.debug("Discovered node {} of SBOM {}", node.nodeId(), node.sbomId());

        final List<AnalysisNode> ancestors = Collector.collect(
                context, graph, nodeIndex, Direction.INCOMING, options.ancestors(), options.relationships());
        final List<AnalysisNode> descendants = Collector.collect(
                context, graph, nodeIndex, Direction.OUTGOING, options.descendants(), options.relationships());

        return new AnalysisNode(NodeSummary.of(node), null, ancestors, descendants);
    }

    private static <T> T withDataAccess(final Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (JdbiException e) {
            throw new AnalysisDataAccessException("Failed to retrieve analysis data", e);
        }
    }

    private static <T> T join(final CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }

            if (cause instanceof final JdbiException jdbiException) {
                throw new AnalysisDataAccessException("Failed to retrieve analysis data", jdbiException);
            } else if (cause instanceof final RuntimeException runtimeException) {
                throw runtimeException;
            } else if (cause instanceof final Error error) {
                throw error;
            }

            throw e;
        }
    }

    private static void shutdown(final ExecutorService executorService, final String name) {
        executorService.shutdown();
        try {
            final boolean terminated = executorService.awaitTermination(30, TimeUnit.SECONDS);
            if (!terminated) {
                LOGGER.warn("{} did not stop in time", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

}
