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
package org.sbomgraph.analysis.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Label of a directed edge between two nodes of an SBOM.
 * <p>
 * Edges always point from the left-hand side of the relationship to its right-hand side,
 * e.g. {@code A DEPENDS_ON B} is stored as {@code A -> B}. Consequently, incoming edges
 * of a node lead to its ancestors, and outgoing edges lead to its descendants.
 *
 * @since 0.1.0
 */
public enum Relationship {

    DEPENDS_ON,
    DEV_DEPENDS_ON,
    BUILD_DEPENDS_ON,
    OPTIONAL_DEPENDS_ON,
    PROVIDED_DEPENDS_ON,
    RUNTIME_DEPENDS_ON,
    TEST_DEPENDS_ON,
    CONTAINS,
    DESCRIBES,
    GENERATED_FROM,
    ANCESTOR_OF,
    VARIANT_OF,
    BUILD_TOOL_OF,
    DEV_TOOL_OF,
    EXAMPLE_OF,
    PACKAGE_OF,
    UNDEFINED;

    private static final Map<String, Relationship> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Relationship::label, Function.identity()));

    /**
     * @return The kebab-case label of this relationship, e.g. {@code depends-on}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parse a relationship from either its label ({@code depends-on}) or its name ({@code DEPENDS_ON}).
     *
     * @param value The value to parse.
     * @return The matching {@link Relationship}, or {@link Optional#empty()} when none matches.
     */
    public static Optional<Relationship> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }

        final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Optional.ofNullable(BY_LABEL.get(normalized));
    }

}
