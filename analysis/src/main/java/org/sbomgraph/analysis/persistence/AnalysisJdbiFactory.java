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

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

import static java.util.Objects.requireNonNull;

/**
 * @since 0.1.0
 */
public final class AnalysisJdbiFactory {

    private AnalysisJdbiFactory() {
    }

    public static Jdbi createJdbi(final DataSource dataSource) {
        requireNonNull(dataSource, "dataSource must not be null");
        return Jdbi.create(dataSource)
                .installPlugin(new SqlObjectPlugin())
                .installPlugin(new PostgresPlugin());
    }

    /**
     * Create an {@link AnalysisDao} that acquires a {@link org.jdbi.v3.core.Handle} for every invocation.
     * <p>
     * The returned instance is thread-safe, which is required because graphs are
     * loaded concurrently.
     */
    public static AnalysisDao createDao(final Jdbi jdbi) {
        requireNonNull(jdbi, "jdbi must not be null");
        return jdbi.onDemand(AnalysisDao.class);
    }

}
