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

import org.sbomgraph.analysis.model.GraphNode;
import org.sbomgraph.analysis.model.GraphNode.DocumentNode;
import org.sbomgraph.analysis.model.GraphNode.ExternalNode;
import org.sbomgraph.analysis.model.GraphNode.PackageNode;
import org.sbomgraph.analysis.model.GraphNode.UnknownNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The {@link NodeField}s available for a given node.
 * <p>
 * Which fields are available depends on the variant of the node:
 * <ul>
 *     <li>All nodes: {@link NodeField#SBOM_ID}, {@link NodeField#NODE_ID}, {@link NodeField#NAME}</li>
 *     <li>Packages: {@link NodeField#VERSION} (if known), {@link NodeField#PURL}, {@link NodeField#CPE}</li>
 *     <li>External nodes: {@link NodeField#EXTERNAL_DOCUMENT_REFERENCE}, {@link NodeField#EXTERNAL_NODE_ID}</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class NodeFieldContext {

    private final Map<NodeField, Object> values;

    private NodeFieldContext(final Map<NodeField, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static NodeFieldContext of(final GraphNode node) {
        requireNonNull(node, "node must not be null");

        final var values = new EnumMap<NodeField, Object>(NodeField.class);
        values.put(NodeField.SBOM_ID, node.sbomId().toString());
        values.put(NodeField.NODE_ID, node.nodeId());
        values.put(NodeField.NAME, node.name());

        if (node instanceof final PackageNode packageNode) {
            if (packageNode.version() != null) {
                values.put(NodeField.VERSION, packageNode.version());
            }
            values.put(NodeField.PURL, List.copyOf(packageNode.purls()));
            values.put(NodeField.CPE, List.copyOf(packageNode.cpes()));
        } else if (node instanceof final ExternalNode externalNode) {
            values.put(NodeField.EXTERNAL_DOCUMENT_REFERENCE, externalNode.externalDocumentReference());
            values.put(NodeField.EXTERNAL_NODE_ID, externalNode.externalNodeId());
        } else if (!(node instanceof DocumentNode) && !(node instanceof UnknownNode)) {
            throw new IllegalStateException("Unexpected node type: " + node.getClass().getName());
        }

        return new NodeFieldContext(values);
    }

    /**
     * @param field The field to get the value of.
     * @return The value of the field, which is either a {@link String}, or a {@link List} of {@link String}s
     * for {@link NodeField#isMultiValued() multi-valued} fields. {@link Optional#empty()} when the field
     * is not available for the node.
     */
    public Optional<Object> get(final NodeField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean has(final NodeField field) {
        return values.containsKey(field);
    }

    /**
     * @return The available fields, keyed by their {@link NodeField#fieldName() name}.
     */
    public Map<String, Object> asMap() {
        final var map = new HashMap<String, Object>(values.size());
        values.forEach((field, value) -> map.put(field.fieldName(), value));
        return map;
    }

    @Override
    public String toString() {
        return "NodeFieldContext" + values;
    }

}
