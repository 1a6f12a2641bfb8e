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
package org.sbomgraph.analysis.query;

import org.sbomgraph.analysis.util.PackageIdentifiers;

import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Exact reference to a component.
 *
 * @since 0.1.0
 */
public sealed interface ComponentReference {

    /**
     * Matches nodes with the given node ID.
     */
    record Id(String nodeId) implements ComponentReference {

        public Id {
            requireNonNull(nodeId, "nodeId must not be null");
        }

    }

    /**
     * Matches nodes with the given name.
     */
    record Name(String name) implements ComponentReference {

        public Name {
            requireNonNull(name, "name must not be null");
        }

    }

    /**
     * Matches packages with the given package URL.
     *
     * @param purl  Canonical form of the package URL, used to match nodes.
     * @param input Package URL as provided, with surrounding whitespace removed.
     */
    record Purl(String purl, String input) implements ComponentReference {

        public Purl {
            requireNonNull(purl, "purl must not be null");
            requireNonNull(input, "input must not be null");
        }

        /**
         * @param purl The package URL to canonicalize.
         * @throws IllegalArgumentException When {@code purl} is not a valid package URL.
         */
        public Purl(final String purl) {
            this(canonicalize(purl), purl.trim());
        }

        /**
         * Values to look up in stored package URLs, which may not be canonical.
         */
        public Set<String> lookupValues() {
            return Set.copyOf(List.of(purl, input));
        }

        private static String canonicalize(final String purl) {
            requireNonNull(purl, "purl must not be null");
            return PackageIdentifiers.tryCanonicalizePurl(purl)
                    .orElseThrow(() -> new IllegalArgumentException("Invalid package URL: " + purl));
        }

    }

    /**
     * Matches packages with the given CPE.
     *
     * @param cpe   The CPE in its 2.3 formatted string binding, used to match nodes.
     * @param input CPE as provided, with surrounding whitespace removed.
     */
    record Cpe(String cpe, String input) implements ComponentReference {

        public Cpe {
            requireNonNull(cpe, "cpe must not be null");
            requireNonNull(input, "input must not be null");
        }

        /**
         * @param cpe The CPE to normalize, in either URI or formatted string binding.
         * @throws IllegalArgumentException When {@code cpe} is not a valid CPE.
         */
        public Cpe(final String cpe) {
            this(normalize(cpe), cpe.trim());
        }

        /**
         * Values to look up in stored CPEs, which may use a different binding.
         */
        public Set<String> lookupValues() {
            return Set.copyOf(List.of(cpe, input));
        }

        private static String normalize(final String cpe) {
            requireNonNull(cpe, "cpe must not be null");
            return PackageIdentifiers.tryNormalizeCpe(cpe)
                    .orElseThrow(() -> new IllegalArgumentException("Invalid CPE: " + cpe));
        }

    }

}
