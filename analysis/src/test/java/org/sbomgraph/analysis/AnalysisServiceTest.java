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
package org.sbomgraph.analysis;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jdbi.v3.core.ConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sbomgraph.analysis.cache.GraphCache;
import org.sbomgraph.analysis.graph.CycleGuard;
import org.sbomgraph.analysis.graph.PackageGraph;
import org.sbomgraph.analysis.graph.PackageGraphLoader;
import org.sbomgraph.analysis.model.AnalysisNode;
import org.sbomgraph.analysis.model.NodeKind;
import org.sbomgraph.analysis.model.Relationship;
import org.sbomgraph.analysis.persistence.ExternalType;
import org.sbomgraph.analysis.persistence.InMemoryAnalysisDao;
import org.sbomgraph.analysis.query.ComponentReference;
import org.sbomgraph.analysis.query.GraphQuery;
import org.sbomgraph.analysis.render.RenderFormat;
import org.sbomgraph.common.pagination.Paginated;
import org.sbomgraph.common.pagination.PaginatedResults;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.awaitility.Awaitility.await;

class AnalysisServiceTest {

    private static final UUID SBOM_A = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID SBOM_B = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    private static final UUID SBOM_C = UUID.fromString("00000000-0000-0000-0000-00000000000c");

    private InMemoryAnalysisDao dao;
    private SimpleMeterRegistry meterRegistry;
    private AnalysisService analysisService;
    private ListAppender<ILoggingEvent> cycleGuardLogAppender;

    @BeforeEach
    void beforeEach() {
        dao = new InMemoryAnalysisDao();
        meterRegistry = new SimpleMeterRegistry();
        analysisService = new AnalysisService(config(), dao, meterRegistry);

        cycleGuardLogAppender = new ListAppender<>();
        cycleGuardLogAppender.start();
        ((Logger) LoggerFactory.getLogger(CycleGuard.class)).addAppender(cycleGuardLogAppender);
    }

    @AfterEach
    void afterEach() {
        ((Logger) LoggerFactory.getLogger(CycleGuard.class)).detachAppender(cycleGuardLogAppender);
        if (analysisService != null) {
            analysisService.close();
        }
    }

    @Test
    void shouldRetrieveDirectAncestorsAndDescendants() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "p1", "P1")
                .addPackage(SBOM_A, "p2", "P2")
                .addRelationship(SBOM_A, "p1", Relationship.DEPENDS_ON, "p2");

        final PaginatedResults<AnalysisNode> ancestorsOfP2 = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Id("p2")),
                QueryOptions.none().withAncestors(1),
                Paginated.UNLIMITED);
        final PaginatedResults<AnalysisNode> descendantsOfP1 = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Id("p1")),
                QueryOptions.none().withDescendants(1),
                Paginated.UNLIMITED);

        assertThat(ancestorsOfP2.total()).isEqualTo(1);
        assertThat(ancestorsOfP2.items()).singleElement().satisfies(node -> {
            assertThat(node.base().nodeId()).isEqualTo("p2");
            assertThat(node.relationship()).isNull();
            assertThat(node.descendants()).isEmpty();
            assertThat(node.ancestors()).singleElement().satisfies(ancestor -> {
                assertThat(ancestor.base().nodeId()).isEqualTo("p1");
                assertThat(ancestor.relationship()).isEqualTo(Relationship.DEPENDS_ON);
            });
        });
        assertThat(descendantsOfP1.items()).singleElement().satisfies(node -> {
            assertThat(node.ancestors()).isEmpty();
            assertThat(node.descendants()).extracting(descendant -> descendant.base().nodeId())
                    .containsExactly("p2");
        });
    }

    @Test
    void shouldFollowExternalReferenceIntoOtherSbom() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addSbom(SBOM_B, "urn:cdx:bbbb/1")
                .addPackage(SBOM_A, "x", "X")
                .addExternal(SBOM_A, "p1", ExternalType.CYCLONEDX, "bbbb", "p3", null, "1")
                .addRelationship(SBOM_A, "x", Relationship.DEPENDS_ON, "p1")
                .addPackage(SBOM_B, "p3", "P3");

        final PaginatedResults<AnalysisNode> results = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Id("x")),
                QueryOptions.none().withDescendants(2),
                Paginated.UNLIMITED);

        assertThat(results.items()).singleElement().satisfies(node ->
                assertThat(node.descendants()).singleElement().satisfies(external -> {
                    assertThat(external.base().kind()).isEqualTo(NodeKind.EXTERNAL);
                    assertThat(external.descendants()).singleElement().satisfies(resolved -> {
                        assertThat(resolved.base().sbomId()).isEqualTo(SBOM_B);
                        assertThat(resolved.base().nodeId()).isEqualTo("p3");
                    });
                }));
        assertThat(analysisService.cacheLen()).isEqualTo(2);
    }

    @Test
    void shouldRetrieveByPurl() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "foo", "foo", "1.0.0", List.of("pkg:npm/foo@1.0.0"), List.of())
                .addPackage(SBOM_A, "bar", "bar", "2.0.0", List.of("pkg:npm/bar@2.0.0"), List.of());

        final PaginatedResults<AnalysisNode> matched = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Purl("pkg:npm/foo@1.0.0")),
                QueryOptions.none(),
                Paginated.UNLIMITED);
        final PaginatedResults<AnalysisNode> unmatched = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Purl("pkg:npm/baz@1.0.0")),
                QueryOptions.none(),
                Paginated.UNLIMITED);

        assertThat(matched.total()).isEqualTo(1);
        assertThat(matched.items()).singleElement().satisfies(node -> {
            assertThat(node.base().nodeId()).isEqualTo("foo");
            assertThat(node.base().purls()).containsExactly("pkg:npm/foo@1.0.0");
        });
        assertThat(unmatched.total()).isZero();
        assertThat(unmatched.items()).isEmpty();
    }

    @Test
    void shouldRetrieveByPurlStoredInNonCanonicalForm() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "foo", "foo", "1.0.0", List.of("pkg:NPM/foo@1.0.0"), List.of());
        final GraphQuery query = GraphQuery.component(new ComponentReference.Purl("pkg:NPM/foo@1.0.0"));

        final PaginatedResults<AnalysisNode> all = analysisService.retrieve(
                query, QueryOptions.none(), Paginated.UNLIMITED);
        final PaginatedResults<AnalysisNode> single = analysisService.retrieveSingle(
                SBOM_A, query, QueryOptions.none(), Paginated.UNLIMITED);

        assertThat(all.total()).isEqualTo(1);
        assertThat(single.total()).isEqualTo(1);
        assertThat(all.items()).singleElement()
                .satisfies(node -> assertThat(node.base().nodeId()).isEqualTo("foo"));
    }

    @Test
    void shouldRetrieveByCpeStoredInUriBinding() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "foo", "foo", "1.0.0", List.of(), List.of("cpe:/a:acme:foo:1.0.0"));

        final PaginatedResults<AnalysisNode> matched = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Cpe("cpe:/a:acme:foo:1.0.0")),
                QueryOptions.none(),
                Paginated.UNLIMITED);

        assertThat(matched.total()).isEqualTo(1);
    }

    @Test
    void shouldRetrieveAlongVeryDeepChains() {
        final int length = 50_000;
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1");
        for (int i = 0; i < length; i++) {
            dao.addPackage(SBOM_A, "n" + i, "n" + i);
            if (i > 0) {
                dao.addRelationship(SBOM_A, "n" + (i - 1), Relationship.DEPENDS_ON, "n" + i);
            }
        }

        final PaginatedResults<AnalysisNode> results = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Id("n0")),
                QueryOptions.unlimited(),
                Paginated.UNLIMITED);

        assertThat(results.total()).isEqualTo(1);
        int depth = 0;
        AnalysisNode node = results.items().get(0);
        while (!node.descendants().isEmpty()) {
            node = node.descendants().get(0);
            depth++;
        }
        assertThat(depth).isEqualTo(length - 1);
        assertThat(node.base().nodeId()).isEqualTo("n" + (length - 1));
    }

    @Test
    void shouldExcludeCyclicGraphs() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addSbom(SBOM_C, "urn:cdx:cccc/1")
                .addPackage(SBOM_A, "foo", "foo")
                .addPackage(SBOM_C, "foo", "foo")
                .addPackage(SBOM_C, "bar", "bar")
                .addRelationship(SBOM_C, "foo", Relationship.DEPENDS_ON, "bar")
                .addRelationship(SBOM_C, "bar", Relationship.DEPENDS_ON, "foo");

        final PaginatedResults<AnalysisNode> results = analysisService.retrieve(
                GraphQuery.component(new ComponentReference.Name("foo")),
                QueryOptions.unlimited(),
                Paginated.UNLIMITED);

        assertThat(results.items()).extracting(node -> node.base().sbomId()).containsExactly(SBOM_A);
        assertThat(cycleGuardLogAppender.list).anySatisfy(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains(SBOM_C.toString());
        });
    }

    @Test
    void shouldRetrieveWithinSingleSbom() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addSbom(SBOM_B, "urn:cdx:bbbb/1")
                .addPackage(SBOM_A, "foo", "foo")
                .addPackage(SBOM_B, "foo", "foo");

        final PaginatedResults<AnalysisNode> results = analysisService.retrieveSingle(
                SBOM_B,
                GraphQuery.component(new ComponentReference.Name("foo")),
                QueryOptions.none(),
                Paginated.UNLIMITED);

        assertThat(results.items()).extracting(node -> node.base().sbomId()).containsExactly(SBOM_B);
        assertThat(dao.getNodesInvocations(SBOM_A)).isZero();
    }

    @Test
    void shouldRetrieveByFilterExpression() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addSbom(SBOM_B, "urn:cdx:bbbb/1")
                .addPackage(SBOM_A, "a1", "log4j-core", "2.14.1", List.of(), List.of())
                .addPackage(SBOM_A, "a2", "commons-text", "1.9", List.of(), List.of())
                .addPackage(SBOM_B, "b1", "log4j-api", "2.17.0", List.of(), List.of());

        final PaginatedResults<AnalysisNode> results = analysisService.retrieve(
                GraphQuery.filter("name.startsWith(\"log4j\")"),
                QueryOptions.none(),
                Paginated.UNLIMITED);

        assertThat(results.items()).extracting(node -> node.base().nodeId()).containsExactly("a1", "b1");
    }

    @Test
    void shouldPaginateResults() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "a", "a")
                .addPackage(SBOM_A, "b", "b")
                .addPackage(SBOM_A, "c", "c");

        final PaginatedResults<AnalysisNode> results = analysisService.retrieve(
                GraphQuery.filter("true"),
                QueryOptions.none(),
                new Paginated(1, 1));

        assertThat(results.total()).isEqualTo(3);
        assertThat(results.items()).extracting(node -> node.base().nodeId()).containsExactly("b");
    }

    @Test
    void shouldReportStatus() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addSbom(SBOM_B, "urn:cdx:bbbb/1")
                .addPackage(SBOM_A, "a", "a");

        assertThat(analysisService.status()).isEqualTo(new AnalysisStatus(2, 0));

        analysisService.retrieveSingle(
                SBOM_A, GraphQuery.filter("true"), QueryOptions.none(), Paginated.UNLIMITED);

        assertThat(analysisService.status()).isEqualTo(new AnalysisStatus(2, 1));
    }

    @Test
    void shouldLoadAndClearAllGraphs() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addSbom(SBOM_B, "urn:cdx:bbbb/1")
                .addPackage(SBOM_A, "a", "a")
                .addPackage(SBOM_B, "b", "b");

        final Map<UUID, PackageGraph> graphs = analysisService.loadAllGraphs();

        assertThat(graphs).containsOnlyKeys(SBOM_A, SBOM_B);
        assertThat(analysisService.cacheLen()).isEqualTo(2);
        assertThat(analysisService.cacheSizeUsed()).isEqualTo(
                graphs.values().stream().mapToLong(PackageGraph::estimatedSize).sum());

        analysisService.clearAllGraphs();

        assertThat(analysisService.cacheLen()).isZero();
        assertThat(analysisService.cacheSizeUsed()).isZero();
    }

    @Test
    void shouldRenderGraph() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "p1", "P1")
                .addPackage(SBOM_A, "p2", "P2")
                .addRelationship(SBOM_A, "p1", Relationship.DEPENDS_ON, "p2");

        assertThat(analysisService.render(SBOM_A, RenderFormat.DOT))
                .contains("\"p1\" -> \"p2\" [label=\"depends-on\"];");
        assertThat(analysisService.render(SBOM_A, RenderFormat.MERMAID))
                .contains("N0 -->|depends-on| N1");
    }

    @Test
    void shouldFailWithDataAccessExceptionWhenScopeCannotBeDetermined() {
        dao.failWith(new ConnectionException(new SQLException("connection refused")));

        assertThatExceptionOfType(AnalysisDataAccessException.class)
                .isThrownBy(() -> analysisService.retrieve(
                        GraphQuery.filter("true"), QueryOptions.none(), Paginated.UNLIMITED))
                .withCauseInstanceOf(ConnectionException.class);
        assertThatExceptionOfType(AnalysisDataAccessException.class)
                .isThrownBy(() -> analysisService.status());
    }

    @Test
    void shouldFailWithDataAccessExceptionWhenGraphCannotBeLoaded() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1");
        dao.failWith(new ConnectionException(new SQLException("connection refused")));

        assertThatExceptionOfType(AnalysisDataAccessException.class)
                .isThrownBy(() -> analysisService.retrieveSingle(
                        SBOM_A, GraphQuery.filter("true"), QueryOptions.none(), Paginated.UNLIMITED))
                .withCauseInstanceOf(ConnectionException.class);

        dao.failWith(null);
        dao.addPackage(SBOM_A, "a", "a");

        await("Retried load")
                .atMost(Duration.ofSeconds(5))
                .ignoreExceptions()
                .untilAsserted(() -> assertThat(analysisService.retrieveSingle(
                        SBOM_A, GraphQuery.filter("true"), QueryOptions.none(), Paginated.UNLIMITED).total())
                        .isEqualTo(1));
    }

    @Test
    void shouldShareExplicitlyProvidedCache() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "a", "a");
        final var graphCache = new GraphCache(Long.MAX_VALUE, new PackageGraphLoader(dao)::load, Runnable::run);

        try (final var first = new AnalysisService(config(), dao, graphCache, new SimpleMeterRegistry());
             final var second = new AnalysisService(config(), dao, graphCache, new SimpleMeterRegistry())) {
            first.loadAllGraphs();

            assertThat(second.cacheLen()).isEqualTo(1);
            assertThat(analysisService.cacheLen()).isZero();

            second.clearAllGraphs();

            assertThat(first.cacheLen()).isZero();
        }
    }

    @Test
    void shouldRegisterMetrics() {
        assertThat(meterRegistry.find(GraphCache.METER_NAME_SIZE).gauge()).isNotNull();
        assertThat(meterRegistry.find(GraphCache.METER_NAME_ITEMS).gauge()).isNotNull();
        assertThat(meterRegistry.find("executor.completed")
                .tag("name", "AnalysisService-Expander")
                .functionCounter()).isNotNull();
        assertThat(meterRegistry.find("executor.completed")
                .tag("name", "AnalysisService-GraphLoader")
                .functionCounter()).isNotNull();
    }

    @Test
    void shouldRejectRequestsAfterClose() {
        dao.addSbom(SBOM_A, "urn:cdx:aaaa/1")
                .addPackage(SBOM_A, "a", "a");
        analysisService.loadAllGraphs();

        analysisService.close();

        assertThatExceptionOfType(RejectedExecutionException.class)
                .isThrownBy(() -> analysisService.retrieve(
                        GraphQuery.filter("true"), QueryOptions.none(), Paginated.UNLIMITED));
        analysisService = null;
    }

    @Test
    void shouldRejectNullArguments() {
        assertThatExceptionOfType(NullPointerException.class)
                .isThrownBy(() -> analysisService.retrieve(null, QueryOptions.none(), Paginated.UNLIMITED))
                .withMessage("query must not be null");
        assertThatExceptionOfType(NullPointerException.class)
                .isThrownBy(() -> analysisService.retrieveSingle(
                        null, GraphQuery.filter("true"), QueryOptions.none(), Paginated.UNLIMITED))
                .withMessage("sbomId must not be null");
    }

    private static AnalysisConfig config() {
        return new AnalysisConfig(new SmallRyeConfigBuilder()
                .withDefaultValue("sbomgraph.analysis.concurrency", "2")
                .withDefaultValue("sbomgraph.analysis.loader-concurrency", "2")
                .build());
    }

}
