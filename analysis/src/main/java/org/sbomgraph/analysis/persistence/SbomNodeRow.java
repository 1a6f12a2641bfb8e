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
package org.sbomgraph.analysis.persistence;

import org.jspecify.annotations.Nullable;
import org.sbomgraph.analysis.model.NodeKind;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * @since 0.1.0
 */
public record SbomNodeRow(
        UUID sbomId,
        String nodeId,
        String name,
        NodeKind kind,
        @Nullable String documentId,
        @Nullable Instant published,
        @Nullable String version,
        @Nullable List<String> purls,
        @Nullable List<String> cpes,
        @Nullable String externalDocumentReference,
        @Nullable String externalNodeId) {
}
