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

import static java.util.Objects.requireNonNull;

/**
 * Offset-based pagination parameters.
 *
 * @param offset Number of items to skip.
 * @param limit  Maximum number of items to return. {@code 0} returns all remaining items.
 * @since 0.1.0
 */
public record Paginated(long offset, long limit) {

    public static final Paginated UNLIMITED = new Paginated(0, 0);

    public Paginated {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }

    /**
     * Apply this pagination to a fully materialized list of items.
     *
     * @param items The complete, unpaginated items.
     * @param <T>   Type of the items.
     * @return The requested slice of {@code items}, together with the total number of items.
     */
    public <T> PaginatedResults<T> paginate(List<T> items) {
        requireNonNull(items, "items must not be null");

        final int total = items.size();
        final int fromIndex = (int) Math.min(offset, total);
        final int toIndex = limit == 0
                ? total
                : fromIndex + (int) Math.min(limit, total - fromIndex);

        return new PaginatedResults<>(List.copyOf(items.subList(fromIndex, toIndex)), total);
    }

}
