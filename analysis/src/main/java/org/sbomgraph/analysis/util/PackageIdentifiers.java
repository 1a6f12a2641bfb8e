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
package org.sbomgraph.analysis.util;

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import org.jspecify.annotations.Nullable;
import us.springett.parsers.cpe.Cpe;
import us.springett.parsers.cpe.CpeParser;
import us.springett.parsers.cpe.exceptions.CpeParsingException;

import java.util.Optional;

/**
 * Normalization of package identifiers, so that identifiers originating from
 * different SBOM documents can be compared using plain string equality.
 *
 * @since 0.1.0
 */
public final class PackageIdentifiers {

    private PackageIdentifiers() {
    }

    /**
     * @param purl The package URL to canonicalize.
     * @return The canonical form of {@code purl}, or {@link Optional#empty()} when it is not a valid package URL.
     */
    public static Optional<String> tryCanonicalizePurl(@Nullable String purl) {
        if (purl == null || purl.isBlank()) {
            return Optional.empty();
        }

        try {
            return Optional.of(new PackageURL(purl.trim()).canonicalize());
        } catch (MalformedPackageURLException e) {
            return Optional.empty();
        }
    }

    /**
     * Canonicalize a package URL, falling back to the trimmed input when it can't be parsed.
     * <p>
     * Ingested SBOMs frequently contain slightly malformed package URLs.
     * Those are retained verbatim, so they can still be matched exactly.
     */
    public static String canonicalizePurlLenient(String purl) {
        return tryCanonicalizePurl(purl).orElseGet(purl::trim);
    }

    /**
     * @param cpe The CPE to normalize, in either CPE 2.2 URI or CPE 2.3 formatted string binding.
     * @return The CPE 2.3 formatted string of {@code cpe}, or {@link Optional#empty()} when it is not a valid CPE.
     */
    public static Optional<String> tryNormalizeCpe(@Nullable String cpe) {
        if (cpe == null || cpe.isBlank()) {
            return Optional.empty();
        }

        try {
            final Cpe parsedCpe = CpeParser.parse(cpe.trim());
            return Optional.of(parsedCpe.toCpe23FS());
        } catch (CpeParsingException e) {
            return Optional.empty();
        }
    }

    public static String normalizeCpeLenient(String cpe) {
        return tryNormalizeCpe(cpe).orElseGet(cpe::trim);
    }

}
