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

import org.eclipse.microprofile.config.Config;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of the {@link AnalysisService}.
 *
 * @since 0.1.0
 */
public final class AnalysisConfig {

    static final String PROPERTY_MAX_CACHE_SIZE = "sbomgraph.analysis.max-cache-size";
    static final String PROPERTY_CONCURRENCY = "sbomgraph.analysis.concurrency";
    static final String PROPERTY_LOADER_CONCURRENCY = "sbomgraph.analysis.loader-concurrency";

    static final long DEFAULT_MAX_CACHE_SIZE = 200L * 1024 * 1024;

    private final Config config;

    public AnalysisConfig(final Config config) {
        this.config = requireNonNull(config, "config must not be null");
    }

    /**
     * @return Maximum size of the graph cache, in bytes.
     */
    public long maxCacheSize() {
        final long maxCacheSize = config
                .getOptionalValue(PROPERTY_MAX_CACHE_SIZE, long.class)
                .orElse(DEFAULT_MAX_CACHE_SIZE);
        if (maxCacheSize < 0) {
            throw new IllegalArgumentException(
                    "%s must not be negative, but is %d".formatted(PROPERTY_MAX_CACHE_SIZE, maxCacheSize));
        }

        return maxCacheSize;
    }

    /**
     * @return Number of threads to expand matched nodes with.
     */
    public int concurrency() {
        return positiveInt(PROPERTY_CONCURRENCY);
    }

    /**
     * @return Number of threads to load graphs with.
     */
    public int loaderConcurrency() {
        return positiveInt(PROPERTY_LOADER_CONCURRENCY);
    }

    private int positiveInt(final String propertyName) {
        final int value = config
                .getOptionalValue(propertyName, int.class)
                .orElseGet(() -> Runtime.getRuntime().availableProcessors());
        if (value <= 0) {
            throw new IllegalArgumentException(
                    "%s must be greater than zero, but is %d".formatted(propertyName, value));
        }

        return value;
    }

}
