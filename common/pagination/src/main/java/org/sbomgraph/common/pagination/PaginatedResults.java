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
package org.sbomgraph.common.pagination;

import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A single page of items.
 *
 * @param items The items of the page.
 * @param total Total number of items across all pages.
 * @since 0.1.0
 */
public record PaginatedResults<T>(List<T> items, long total) {

    public PaginatedResults {
        requireNonNull(items, "items must not be null");
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative");
        }
        if (items.size() > total) {
            throw new IllegalArgumentException("items must not exceed total");
        }
    }

    public static <T> PaginatedResults<T> empty() {
        return new PaginatedResults<>(List.of(), 0);
    }

    public <R> PaginatedResults<R> map(Function<? super T, ? extends R> mapper) {
        return new PaginatedResults<>(items.stream().<R>map(mapper).toList(), total);
    }

}
