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
 * A boolean expression over the {@link NodeField}s of a node.
 * <p>
 * Implementations must be thread-safe. Expressions referring to fields that are not
 * available for a given node must not match that node, rather than fail.
 *
 * @since 0.1.0
 */
public interface FilterExpression {

    boolean apply(NodeFieldContext context);

    /**
     * @param expression Text of the expression.
     * @return The parsed {@link FilterExpression}.
     * @throws IllegalArgumentException When {@code expression} is blank or can't be parsed.
     */
    static FilterExpression parse(final String expression) {
        return new CelFilterExpression(expression);
    }

}
