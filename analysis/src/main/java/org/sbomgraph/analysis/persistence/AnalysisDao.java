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

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to the rows the analysis graphs are built from.
 * <p>
 * All methods throw {@link org.jdbi.v3.core.JdbiException}s when the underlying query fails.
 *
 * @since 0.1.0
 */
public interface AnalysisDao {

    @SqlQuery("""
            SELECT "ID"
              FROM "SBOM"
             ORDER BY "ID"
            """)
    List<UUID> getSbomIds();

    @SqlQuery("""
            SELECT COUNT(*)
              FROM "SBOM"
            """)
    long countSboms();

    @SqlQuery("""
            SELECT "N"."SBOM_ID"
                 , "N"."NODE_ID"
                 , "N"."NAME"
                 , CASE
                     WHEN "N"."NODE_ID" = "S"."NODE_ID" THEN 'DOCUMENT'
                     WHEN "P"."NODE_ID" IS NOT NULL THEN 'PACKAGE'
                     WHEN "E"."NODE_ID" IS NOT NULL THEN 'EXTERNAL'
                     ELSE 'UNKNOWN'
                   END AS "KIND"
                 , "S"."DOCUMENT_ID"
                 , "S"."PUBLISHED"
                 , "P"."VERSION"
                 , ARRAY(
                     SELECT "PP"."PURL"
                       FROM "SBOM_PACKAGE_PURL" AS "PP"
                      WHERE "PP"."SBOM_ID" = "N"."SBOM_ID"
                        AND "PP"."NODE_ID" = "N"."NODE_ID"
                      ORDER BY "PP"."PURL"
                   ) AS "PURLS"
                 , ARRAY(
                     SELECT "PC"."CPE"
                       FROM "SBOM_PACKAGE_CPE" AS "PC"
                      WHERE "PC"."SBOM_ID" = "N"."SBOM_ID"
                        AND "PC"."NODE_ID" = "N"."NODE_ID"
                      ORDER BY "PC"."CPE"
                   ) AS "CPES"
                 , "E"."EXTERNAL_DOC_REF" AS "EXTERNAL_DOCUMENT_REFERENCE"
                 , "E"."EXTERNAL_NODE_REF" AS "EXTERNAL_NODE_ID"
              FROM "SBOM_NODE" AS "N"
             INNER JOIN "SBOM" AS "S"
                ON "S"."ID" = "N"."SBOM_ID"
              LEFT JOIN "SBOM_PACKAGE" AS "P"
                ON "P"."SBOM_ID" = "N"."SBOM_ID"
               AND "P"."NODE_ID" = "N"."NODE_ID"
              LEFT JOIN "SBOM_EXTERNAL_NODE" AS "E"
                ON "E"."SBOM_ID" = "N"."SBOM_ID"
               AND "E"."NODE_ID" = "N"."NODE_ID"
             WHERE "N"."SBOM_ID" = :sbomId
             ORDER BY "N"."NODE_ID"
            """)
    @RegisterConstructorMapper(SbomNodeRow.class)
    List<SbomNodeRow> getNodes(@Bind UUID sbomId);

    @SqlQuery("""
            SELECT "SBOM_ID"
                 , "LEFT_NODE_ID"
                 , "RELATIONSHIP"
                 , "RIGHT_NODE_ID"
              FROM "PACKAGE_RELATES_TO_PACKAGE"
             WHERE "SBOM_ID" = :sbomId
            """)
    @RegisterConstructorMapper(RelationshipRow.class)
    List<RelationshipRow> getRelationships(@Bind UUID sbomId);

    @SqlQuery("""
            SELECT "SBOM_ID"
                 , "NODE_ID"
                 , "EXTERNAL_DOC_REF" AS "EXTERNAL_DOCUMENT_REFERENCE"
                 , "EXTERNAL_NODE_REF" AS "EXTERNAL_NODE_REFERENCE"
                 , "EXTERNAL_TYPE"
                 , "DISCRIMINATOR_TYPE"
                 , "DISCRIMINATOR_VALUE"
              FROM "SBOM_EXTERNAL_NODE"
             WHERE "SBOM_ID" = :sbomId
               AND "NODE_ID" = :nodeId
             LIMIT 1
            """)
    @RegisterConstructorMapper(ExternalNodeRow.class)
    Optional<ExternalNodeRow> getExternalNode(@Bind UUID sbomId, @Bind String nodeId);

    @SqlQuery("""
            SELECT "S"."ID"
              FROM "SBOM" AS "S"
             INNER JOIN "SOURCE_DOCUMENT" AS "SD"
                ON "SD"."ID" = "S"."SOURCE_DOCUMENT_ID"
             WHERE "SD"."SHA256" = :sha256
             ORDER BY "S"."ID"
             LIMIT 1
            """)
    Optional<UUID> getSbomIdBySourceDocumentSha256(@Bind String sha256);

    @SqlQuery("""
            SELECT "ID"
              FROM "SBOM"
             WHERE "DOCUMENT_ID" = :documentId
             ORDER BY "ID"
             LIMIT 1
            """)
    Optional<UUID> getSbomIdByDocumentId(@Bind String documentId);

    @SqlQuery("""
            SELECT "SBOM_ID"
                 , "NODE_ID"
                 , "TYPE"
                 , "VALUE"
              FROM "SBOM_NODE_CHECKSUM"
             WHERE "NODE_ID" = :nodeId
             ORDER BY "SBOM_ID", "TYPE"
             LIMIT 1
            """)
    @RegisterConstructorMapper(NodeChecksumRow.class)
    Optional<NodeChecksumRow> getNodeChecksum(@Bind String nodeId);

    @SqlQuery("""
            SELECT "SBOM_ID"
                 , "NODE_ID"
                 , "TYPE"
                 , "VALUE"
              FROM "SBOM_NODE_CHECKSUM"
             WHERE "VALUE" = :value
               AND "SBOM_ID" != :excludedSbomId
             ORDER BY "SBOM_ID", "NODE_ID"
             LIMIT 1
            """)
    @RegisterConstructorMapper(NodeChecksumRow.class)
    Optional<NodeChecksumRow> getNodeChecksumByValueInOtherSbom(@Bind String value, @Bind UUID excludedSbomId);

    @SqlQuery("""
            SELECT "SBOM_ID"
                 , "NODE_ID"
                 , "VERSION"
              FROM "SBOM_PACKAGE"
             WHERE "NODE_ID" = :nodeId
             ORDER BY "SBOM_ID"
             LIMIT 1
            """)
    @RegisterConstructorMapper(PackageRow.class)
    Optional<PackageRow> getPackage(@Bind String nodeId);

    @SqlQuery("""
            SELECT "SBOM_ID"
                 , "NODE_ID"
                 , "VERSION"
              FROM "SBOM_PACKAGE"
             WHERE "VERSION" = :version
               AND "SBOM_ID" != :excludedSbomId
             ORDER BY "SBOM_ID", "NODE_ID"
             LIMIT 1
            """)
    @RegisterConstructorMapper(PackageRow.class)
    Optional<PackageRow> getPackageByVersionInOtherSbom(@Bind String version, @Bind UUID excludedSbomId);

    @SqlQuery("""
            SELECT DISTINCT "SBOM_ID"
              FROM "SBOM_NODE"
             WHERE "NODE_ID" = :nodeId
            """)
    List<UUID> getSbomIdsByNodeId(@Bind String nodeId);

    @SqlQuery("""
            SELECT DISTINCT "SBOM_ID"
              FROM "SBOM_NODE"
             WHERE "NAME" = :name
            """)
    List<UUID> getSbomIdsByName(@Bind String name);

    @SqlQuery("""
            SELECT DISTINCT "SBOM_ID"
              FROM "SBOM_PACKAGE_PURL"
             WHERE "PURL" = ANY(:purls)
            """)
    List<UUID> getSbomIdsByPurl(@Bind Collection<String> purls);

    @SqlQuery("""
            SELECT DISTINCT "SBOM_ID"
              FROM "SBOM_PACKAGE_CPE"
             WHERE "CPE" = ANY(:cpes)
            """)
    List<UUID> getSbomIdsByCpe(@Bind Collection<String> cpes);

}
