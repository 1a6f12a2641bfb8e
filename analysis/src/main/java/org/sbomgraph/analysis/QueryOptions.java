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

import org.sbomgraph.analysis.model.Relationship;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Options controlling how far the ancestors and descendants of matched nodes are collected.
 *
 * @param ancestors     Maximum depth of ancestors to collect. {@code 0} to not collect any.
 * @param descendants   Maximum depth of descendants to collect. {@code 0} to not collect any.
 * @param relationships Relationships to follow. All relationships are followed when empty.
 * @since 0.1.0
 */
public record QueryOptions(int ancestors, int descendants, Set<Relationship> relationships) {

    /**
     * Depth that does not impose any limit.
     */
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public QueryOptions {
        if (ancestors < 0) {
            throw new IllegalArgumentException("ancestors must not be negative");
        }
        if (descendants < 0) {
            throw new IllegalArgumentException("descendants must not be negative");
        }
        relationships = relationships != null ? Set.copyOf(relationships) : Set.of();
    }

    /**
     * @return Options that only locate matching nodes, without collecting any ancestors or descendants.
     */
    public static QueryOptions none() {
        return new QueryOptions(0, 0, Set.of());
    }

    public static QueryOptions unlimited() {
        return new QueryOptions(UNLIMITED, UNLIMITED, Set.of());
    }

    public QueryOptions withAncestors(final int ancestors) {
        return new QueryOptions(ancestors, this.descendants, this.relationships);
    }

    public QueryOptions withDescendants(final int descendants) {
        return new QueryOptions(this.ancestors, descendants, this.relationships);
    }

    public QueryOptions withRelationships(final Set<Relationship> relationships) {
        return new QueryOptions(this.ancestors, this.descendants, relationships);
    }

    /**
     * Parse a comma-separated list of relationships, e.g. {@code depends-on,contains}.
     *
     * @param value The value to parse.
     * @return The parsed relationships. Empty when {@code value} is {@code null} or blank.
     * @throws IllegalArgumentException When {@code value} contains an unknown relationship.
     */
    public static Set<Relationship> parseRelationships(final String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }

        final Set<Relationship> relationships = EnumSet.noneOf(Relationship.class);
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .map(part -> Relationship.fromString(part).orElseThrow(
                        () -> new IllegalArgumentException("Unknown relationship: " + part)))
                .forEach(relationships::add);
        return Set.copyOf(relationships);
    }

}
