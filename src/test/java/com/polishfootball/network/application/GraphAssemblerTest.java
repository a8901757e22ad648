package com.polishfootball.network.application;

import com.polishfootball.network.Fixtures;
import com.polishfootball.network.application.dto.GraphData;
import com.polishfootball.network.application.query.GraphDataQuery;
import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import com.polishfootball.network.domain.model.LeagueType;
import com.polishfootball.network.infrastructure.config.GraphProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class GraphAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

    private GraphAssembler assembler;

    private final Club a = Fixtures.club("Arka Gdynia", LeagueType.FORTUNA_1_LIGA);
    private final Club b = Fixtures.club("Cracovia", LeagueType.EKSTRAKLASA);
    private final Club c = Fixtures.club("Chrobry Głogów", LeagueType.FORTUNA_1_LIGA);

    @BeforeEach
    void setUp() {
        assembler = new GraphAssembler(new GraphProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldDropIsolatedNodesWhenRequested() {
        // Given
        List<Connection> connections = List.of(Fixtures.connection(a, b, ConnectionType.ALLIANCE));

        // When
        GraphData graph = assembler.assemble(List.of(a, b, c), connections,
                new GraphDataQuery(false, true, null, null, false));

        // Then
        assertThat(graph.nodes()).extracting(GraphData.Node::id).containsExactlyInAnyOrder(a.id(), b.id());
        assertThat(graph.nodes()).allSatisfy(node -> assertThat(node.connectionCount()).isEqualTo(1));
        assertThat(graph.edges()).hasSize(1);
        assertThat(graph.metadata().appliedFilters()).containsEntry("excludeIsolatedNodes", "true");
    }

    @Test
    void shouldKeepIsolatedNodesByDefault() {
        // Given
        List<Connection> connections = List.of(Fixtures.connection(a, b, ConnectionType.ALLIANCE));

        // When
        GraphData graph = assembler.assemble(List.of(a, b, c), connections, GraphDataQuery.defaults());

        // Then
        assertThat(graph.nodes()).hasSize(3);
        GraphData.Node isolated = graph.nodes().stream().filter(node -> node.id().equals(c.id())).findFirst().orElseThrow();
        assertThat(isolated.connectionCount()).isZero();
        assertThat(isolated.size()).isEqualTo(20);
    }

    @Test
    void shouldDropEdgesWhoseEndpointWasFilteredOut() {
        // Given
        Club inactive = Fixtures.club("Polonia Warszawa", LeagueType.FORTUNA_1_LIGA, false, true);
        List<Connection> connections = List.of(
                Fixtures.connection(a, b, ConnectionType.FRIENDSHIP),
                Fixtures.connection(a, inactive, ConnectionType.RIVALRY));

        // When
        GraphData graph = assembler.assemble(List.of(a, b, inactive), connections, GraphDataQuery.defaults());

        // Then
        assertThat(graph.nodes()).extracting(GraphData.Node::id).doesNotContain(inactive.id());
        assertThat(graph.edges()).hasSize(1);
        assertThat(graph.metadata().totalEdges()).isEqualTo(1);
    }

    @Test
    void shouldApplyLeagueVerifiedAndReliabilityFilters() {
        // Given
        Club unverified = Fixtures.club("Stal Mielec", LeagueType.FORTUNA_1_LIGA, true, false);
        List<Connection> connections = List.of(
                Fixtures.connection(a, c, ConnectionType.FRIENDSHIP, 0.9, true),
                Fixtures.connection(a, c, ConnectionType.ALLIANCE, 0.3, true),
                Fixtures.connection(a, c, ConnectionType.RIVALRY, null, true),
                Fixtures.connection(a, unverified, ConnectionType.FRIENDSHIP, 0.9, true));

        // When
        GraphData graph = assembler.assemble(List.of(a, b, c, unverified), connections,
                new GraphDataQuery(true, true, 0.5, List.of(LeagueType.FORTUNA_1_LIGA), true));

        // Then
        assertThat(graph.nodes()).extracting(GraphData.Node::id).containsExactlyInAnyOrder(a.id(), c.id());
        assertThat(graph.edges()).singleElement()
                .satisfies(edge -> {
                    assertThat(edge.type()).isEqualTo(ConnectionType.FRIENDSHIP);
                    assertThat(edge.reliabilityScore()).isEqualTo(0.9);
                    assertThat(edge.verified()).isTrue();
                });
        assertThat(graph.metadata().appliedFilters()).containsOnly(
                entry("verifiedOnly", "true"),
                entry("activeOnly", "true"),
                entry("minReliabilityScore", "0.5"),
                entry("includeLeagues", "FORTUNA_1_LIGA"));
    }

    @Test
    void nodeSizeShouldGrowMonotonicallyAndStayBounded() {
        List<Integer> sizes = IntStream.rangeClosed(0, 100).map(assembler::nodeSize).boxed().toList();

        assertThat(sizes.get(0)).isEqualTo(20);
        assertThat(sizes.get(10)).isEqualTo(40);
        assertThat(sizes).isSorted();
        assertThat(sizes).allMatch(size -> size <= 100);
        assertThat(sizes.get(100)).isEqualTo(100);
        assertThat(assembler.nodeSize(Integer.MAX_VALUE)).isEqualTo(100);
    }

    @Test
    void shouldColourByCategoryWithFallback() {
        assertThat(GraphAssembler.leagueColor(LeagueType.EKSTRAKLASA)).isEqualTo("#FF0000");
        assertThat(GraphAssembler.leagueColor(LeagueType.FORTUNA_1_LIGA)).isEqualTo("#0066CC");
        assertThat(GraphAssembler.connectionColor(ConnectionType.ALLIANCE)).isEqualTo("#32CD32");
        assertThat(GraphAssembler.leagueColor(null)).isEqualTo(GraphAssembler.FALLBACK_COLOR);
        assertThat(GraphAssembler.connectionColor(null)).isEqualTo("#808080");
    }

    @Test
    void shouldComputeDistributionsAndEdgeWeights() {
        // Given
        Connection veryStrong = new Connection(UUID.randomUUID(), a.id(), b.id(), ConnectionType.RIVALRY,
                ConnectionStrength.VERY_STRONG, "Derby", 1.0, true, Fixtures.CREATED, null);

        // When
        GraphData graph = assembler.assemble(List.of(a, b, c),
                List.of(veryStrong, Fixtures.connection(b, c, ConnectionType.FRIENDSHIP)), GraphDataQuery.defaults());

        // Then
        assertThat(graph.metadata().leagueDistribution())
                .isEqualTo(Map.of("EKSTRAKLASA", 1L, "FORTUNA_1_LIGA", 2L));
        assertThat(graph.metadata().connectionTypeDistribution())
                .isEqualTo(Map.of("FRIENDSHIP", 1L, "RIVALRY", 1L));
        assertThat(graph.edges()).filteredOn(edge -> edge.id().equals(veryStrong.id()))
                .singleElement()
                .satisfies(edge -> {
                    assertThat(edge.weight()).isEqualTo(4);
                    assertThat(edge.color()).isEqualTo("#FF0000");
                    assertThat(edge.label()).isEqualTo("Derby");
                });
        assertThat(graph.metadata().generatedAt()).isEqualTo(NOW);
        assertThat(graph.metadata().totalNodes()).isEqualTo(3);
    }
}
