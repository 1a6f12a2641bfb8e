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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipTest {

    @Test
    void shouldUseKebabCaseLabels() {
        assertThat(Relationship.DEPENDS_ON.label()).isEqualTo("depends-on");
        assertThat(Relationship.BUILD_TOOL_OF.label()).isEqualTo("build-tool-of");
        assertThat(Relationship.UNDEFINED.label()).isEqualTo("undefined");
    }

    @Test
    void shouldParseLabelsAndNames() {
        assertThat(Relationship.fromString("depends-on")).contains(Relationship.DEPENDS_ON);
        assertThat(Relationship.fromString("TEST_DEPENDS_ON")).contains(Relationship.TEST_DEPENDS_ON);
        assertThat(Relationship.fromString(" Contains ")).contains(Relationship.CONTAINS);
    }

    @Test
    void shouldNotParseUnknownValues() {
        assertThat(Relationship.fromString("likes")).isEmpty();
        assertThat(Relationship.fromString("")).isEmpty();
        assertThat(Relationship.fromString(null)).isEmpty();
    }

}
