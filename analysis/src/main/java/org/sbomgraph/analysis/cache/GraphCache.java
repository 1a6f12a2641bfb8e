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
package org.sbomgraph.analysis.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.sbomgraph.analysis.graph.PackageGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Bounded, process-local cache of {@link PackageGraph}s, keyed by SBOM ID.
 * <p>
 * Graphs are weighed by their {@link PackageGraph#estimatedSize() estimated size},
 * and evicted once the total weight exceeds the configured maximum.
 * Eviction only drops the reference held by the cache. Callers that already obtained
 * a graph can continue to use it.
 * <p>
 * Concurrent misses for the same key are coalesced by Caffeine. Graphs are only ever
 * published after they were fully built. Builds that fail are not retained, and will be
 * attempted again on the next access.
 *
 * @since 0.1.0
 */
public final class GraphCache implements MeterBinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphCache.class);

    public static final String METER_NAME_SIZE = "sbomgraph.analysis.graph.cache.size";
    public static final String METER_NAME_MAX_SIZE = "sbomgraph.analysis.graph.cache.max.size";
    public static final String METER_NAME_ITEMS = "sbomgraph.analysis.graph.cache.items";
    static final String CACHE_NAME = "AnalysisService-GraphCache";

    private final AsyncCache<UUID, PackageGraph> cache;
    private final Function<UUID, PackageGraph> loader;
    private final long maxSize;

    /**
     * @param maxSize  Maximum total weight of all cached graphs, in bytes.
     * @param loader   Function to load graphs that are not yet cached.
     * @param executor The {@link Executor} to load graphs on.
     */
    public GraphCache(final long maxSize, final Function<UUID, PackageGraph> loader, final Executor executor) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative");
        }
        this.maxSize = maxSize;
        this.loader = requireNonNull(loader, "loader must not be null");
        requireNonNull(executor, "executor must not be null");

        this.cache = Caffeine.newBuilder()
                .maximumWeight(maxSize)
                .weigher((UUID sbomId, PackageGraph graph) -> weigh(graph))
                .executor(executor)
                .recordStats()
                .buildAsync();
    }

    /**
     * Retrieve the graph of a given SBOM, loading it if it is not already cached.
     *
     * @param sbomId ID of the SBOM.
     * @return A {@link CompletableFuture} that completes with the graph, or exceptionally
     * when loading the graph failed.
     */
    public CompletableFuture<PackageGraph> getOrBuild(final UUID sbomId) {
        requireNonNull(sbomId, "sbomId must not be null");
        return cache.get(sbomId, this::load);
    }

    /**
     * @param sbomId ID of the SBOM.
     * @return The graph of the SBOM, if it is cached and fully built.
     */
    public Optional<PackageGraph> getIfPresent(final UUID sbomId) {
        requireNonNull(sbomId, "sbomId must not be null");

        final CompletableFuture<PackageGraph> future = cache.getIfPresent(sbomId);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }

        return Optional.ofNullable(future.join());
    }

    /**
     * @return The total weight of all resident graphs, in bytes.
     */
    public long sizeUsed() {
        cache.synchronous().cleanUp();
        return cache.synchronous().policy().eviction()
                .map(eviction -> eviction.weightedSize().orElse(0L))
                .orElse(0L);
    }

    /**
     * @return The number of resident graphs.
     */
    public long len() {
        cache.synchronous().cleanUp();
        return cache.synchronous().estimatedSize();
    }

    /**
     * @return The maximum total weight of all resident graphs, in bytes.
     */
    public long maxSize() {
        return maxSize;
    }

    public void clear() {
        LOGGER.info("Clearing {} cached graphs", len());
        cache.synchronous().invalidateAll();
        cache.synchronous().cleanUp();
    }

    @Override
    public void bindTo(final MeterRegistry registry) {
        Gauge.builder(METER_NAME_SIZE, this, GraphCache::sizeUsed)
                .description("Estimated size of all cached graphs")
                .baseUnit("bytes")
                .register(registry);
        Gauge.builder(METER_NAME_MAX_SIZE, this, GraphCache::maxSize)
                .description("Maximum size of all cached graphs")
                .baseUnit("bytes")
                .register(registry);
        Gauge.builder(METER_NAME_ITEMS, this, GraphCache::len)
                .description("Number of cached graphs")
                .register(registry);
        new CaffeineCacheMetrics<>(cache.synchronous(), CACHE_NAME, null)
                .bindTo(registry);
    }

    private PackageGraph load(final UUID sbomId) {
        LOGGER.debug("Graph of SBOM {} is not cached; Loading it", sbomId);
        return loader.apply(sbomId);
    }

    private static int weigh(final PackageGraph graph) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0, graph.estimatedSize()));
    }

}
