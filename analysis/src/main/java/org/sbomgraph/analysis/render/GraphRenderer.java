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
package org.sbomgraph.analysis.render;

import org.sbomgraph.analysis.graph.Edge;
import org.sbomgraph.analysis.graph.PackageGraph;
import org.sbomgraph.analysis.model.GraphNode;
import org.sbomgraph.analysis.model.GraphNode.ExternalNode;
import org.sbomgraph.analysis.model.GraphNode.PackageNode;

import static java.util.Objects.requireNonNull;

/**
 * Renders {@link PackageGraph}s in textual graph description languages.
 *
 * @since 0.1.0
 */
public final class GraphRenderer {

    private GraphRenderer() {
    }

    public static String render(final PackageGraph graph, final RenderFormat format) {
        requireNonNull(graph, "graph must not be null");
        requireNonNull(format, "format must not be null");

        return switch (format) {
            case DOT -> renderDot(graph);
            case MERMAID -> renderMermaid(graph);
        };
    }

    static String renderDot(final PackageGraph graph) {
        final var sb = new StringBuilder();
        sb.append("digraph \"").append(escapeDot(graph.sbomId().toString())).append("\" {\n");

        for (final GraphNode node : graph.nodes()) {
            sb.append("  \"").append(escapeDot(node.nodeId())).append('"')
                    .append(" [label=\"").append(escapeDot(label(node))).append("\"];\n");
        }
        for (final Edge edge : graph.edges()) {
            sb.append("  \"").append(escapeDot(graph.node(edge.source()).nodeId())).append('"')
                    .append(" -> ")
                    .append('"').append(escapeDot(graph.node(edge.target()).nodeId())).append('"')
                    .append(" [label=\"").append(edge.relationship().label()).append("\"];\n");
        }

        return sb.append("}\n").toString();
    }

    /**
     * Node IDs are not guaranteed to be valid Mermaid identifiers,
     * so nodes are identified by their index instead.
     */
    static String renderMermaid(final PackageGraph graph) {
        final var sb = new StringBuilder("graph TD\n");

        for (int i = 0; i < graph.nodeCount(); i++) {
            sb.append("  N").append(i)
                    .append("[\"").append(escapeMermaid(label(graph.node(i)))).append("\"]\n");
        }
        for (final Edge edge : graph.edges()) {
            sb.append("  N").append(edge.source())
                    .append(" -->|").append(edge.relationship().label()).append("| ")
                    .append('N').append(edge.target()).append('\n');
        }

        return sb.toString();
    }

    private static String label(final GraphNode node) {
        final String name = node.name().isBlank() ? node.nodeId() : node.name();

        if (node instanceof final PackageNode packageNode && packageNode.version() != null) {
            return name + " " + packageNode.version();
        } else if (node instanceof final ExternalNode externalNode) {
            return name + " (" + externalNode.externalDocumentReference() + ")";
        }

        return name;
    }

    private static String escapeDot(final String value) {
        return value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }

    private static String escapeMermaid(final String value) {
        return value
                .replace("\"", "#quot;")
                .replace("\n", " ");
    }

}
