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

import org.projectnessie.cel.Env;
import org.projectnessie.cel.Env.AstIssuesTuple;
import org.projectnessie.cel.EnvOption;
import org.projectnessie.cel.Program;
import org.projectnessie.cel.checker.Decls;
import org.projectnessie.cel.common.types.BoolT;
import org.projectnessie.cel.common.types.Err;
import org.projectnessie.cel.common.types.Err.ErrException;
import org.projectnessie.cel.common.types.ref.Val;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * A {@link FilterExpression} written in the Common Expression Language (CEL).
 * <p>
 * Every {@link NodeField} is available as variable, e.g.:
 * <pre>{@code
 * name == "foo" && version.startsWith("1.")
 * "pkg:npm/foo@1.0.0" in purl
 * }</pre>
 * Expressions are not type-checked, such that references to fields that a node
 * does not provide result in an evaluation error, which is treated as non-match.
 *
 * @since 0.1.0
 */
public final class CelFilterExpression implements FilterExpression {

    private static final Logger LOGGER = LoggerFactory.getLogger(CelFilterExpression.class);

    private static final Env ENVIRONMENT = Env.newEnv(
            EnvOption.declarations(Arrays.stream(NodeField.values())
                    .map(field -> Decls.newVar(
                            field.fieldName(),
                            field.isMultiValued()
                                    ? Decls.newListType(Decls.String)
                                    : Decls.String))
                    .toList()));

    private final String expression;
    private final Program program;

    CelFilterExpression(final String expression) {
        requireNonNull(expression, "expression must not be null");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("expression must not be blank");
        }

        final AstIssuesTuple astIssuesTuple = ENVIRONMENT.parse(expression);
        if (astIssuesTuple.hasIssues()) {
            throw new IllegalArgumentException(
                    "Failed to parse filter expression: " + astIssuesTuple.getIssues());
        }

        this.expression = expression;
        this.program = ENVIRONMENT.program(astIssuesTuple.getAst());
    }

    @Override
    public boolean apply(final NodeFieldContext context) {
        requireNonNull(context, "context must not be null");

        final Val result;
        try {
            result = program.eval(context.asMap()).getVal();
        } catch (ErrException e) {
            LOGGER.trace("Evaluation of {} against {} failed", expression, context, e);
            return false;
        }

        if (Err.isError(result)) {
            LOGGER.trace("Evaluation of {} against {} failed: {}", expression, context, result);
            return false;
        }
        if (!(result instanceof BoolT)) {
            LOGGER.trace("Evaluation of {} against {} yielded non-boolean result {}", expression, context, result);
            return false;
        }

        return result.convertToNative(Boolean.class);
    }

    @Override
    public String toString() {
        return expression;
    }

}
