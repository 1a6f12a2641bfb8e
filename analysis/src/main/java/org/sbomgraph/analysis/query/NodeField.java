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

/**
 * Fields of a node that filter expressions can refer to.
 *
 * @since 0.1.0
 */
public enum NodeField {

    SBOM_ID("sbom_id", false),
    NODE_ID("node_id", false),
    NAME("name", false),
    VERSION("version", false),
    PURL("purl", true),
    CPE("cpe", true),
    EXTERNAL_DOCUMENT_REFERENCE("external_document_reference", false),
    EXTERNAL_NODE_ID("external_node_id", false);

    private final String fieldName;
    private final boolean multiValued;

    NodeField(final String fieldName, final boolean multiValued) {
        this.fieldName = fieldName;
        this.multiValued = multiValued;
    }

    /**
     * @return Name of the field as used in filter expressions.
     */
    public String fieldName() {
        return fieldName;
    }

    /**
     * @return Whether the field holds a list of strings, rather than a single string.
     */
    public boolean isMultiValued() {
        return multiValued;
    }

}
