package com.polishfootball.network.application;

import com.polishfootball.network.application.dto.GraphData;
import com.polishfootball.network.application.query.GraphDataQuery;
import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionType;
import com.polishfootball.network.domain.model.LeagueType;
import com.polishfootball.network.infrastructure.config.GraphProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns clubs and connections into the graph payload: filters nodes and edges,
 * counts connections per node, sizes and colours them and computes distributions.
 */
@Component
public class GraphAssembler {

    static final String FALLBACK_COLOR = "#808080";

    private static final Map<LeagueType, String> LEAGUE_COLORS = new EnumMap<>(Map.of(
            LeagueType.EKSTRAKLASA, "#FF0000",
            LeagueType.FORTUNA_1_LIGA, "#0066CC",
            LeagueType.EUROPEAN_CLUB, "#32CD32"
    ));

    private static final Map<ConnectionType, String> CONNECTION_COLORS = new EnumMap<>(Map.of(
            ConnectionType.ALLIANCE, "#32CD32",
            ConnectionType.RIVALRY, "#FF0000",
            ConnectionType.FRIENDSHIP, "#0066CC"
    ));

    private final GraphProperties properties;
    private final Clock clock;

    public GraphAssembler(GraphProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public GraphData assemble(List<Club> allClubs, List<Connection> allConnections, GraphDataQuery query) {
        Set<LeagueType> leagues = new HashSet<>(query.includeLeagues());

        List<Club> clubs = allClubs.stream()
                .filter(club -> !query.activeOnly() || club.active())
                .filter(club -> !query.verifiedOnly() || club.verified())
                .filter(club -> leagues.isEmpty() || leagues.contains(club.league()))
                .toList();

        Set<UUID> clubIds = clubs.stream().map(Club::id).collect(Collectors.toSet());

        List<Connection> connections = allConnections.stream()
                .filter(connection -> !query.verifiedOnly() || connection.verified())
                .filter(connection -> meetsReliability(connection, query.minReliabilityScore()))
                .filter(connection -> clubIds.contains(connection.sourceClubId())
                        && clubIds.contains(connection.targetClubId()))
                .toList();

        Map<UUID, Integer> connectionCounts = countConnections(connections);

        if (!query.includeIsolatedNodes()) {
            clubs = clubs.stream()
                    .filter(club -> connectionCounts.getOrDefault(club.id(), 0) > 0)
                    .toList();
        }

        List<GraphData.Node> nodes = clubs.stream()
                .map(club -> toNode(club, connectionCounts.getOrDefault(club.id(), 0)))
                .toList();

        List<GraphData.Edge> edges = connections.stream()
                .map(GraphAssembler::toEdge)
                .toList();

        GraphData.Metadata metadata = new GraphData.Metadata(
                nodes.size(),
                edges.size(),
                clock.instant(),
                distribution(clubs, Club::league),
                distribution(connections, Connection::type),
                appliedFilters(query)
        );

        return new GraphData(nodes, edges, metadata);
    }

    int nodeSize(int connectionCount) {
        long size = properties.getNodeBaseSize() + (long) connectionCount * properties.getNodeSizeStep();
        return (int) Math.min(size, properties.getNodeMaxSize());
    }

    static String leagueColor(LeagueType league) {
        return league == null ? FALLBACK_COLOR : LEAGUE_COLORS.getOrDefault(league, FALLBACK_COLOR);
    }

    static String connectionColor(ConnectionType type) {
        return type == null ? FALLBACK_COLOR : CONNECTION_COLORS.getOrDefault(type, FALLBACK_COLOR);
    }

    private GraphData.Node toNode(Club club, int connectionCount) {
        return new GraphData.Node(
                club.id(),
                club.name(),
                club.shortName(),
                club.league(),
                club.city(),
                club.logoPath(),
                leagueColor(club.league()),
                nodeSize(connectionCount),
                connectionCount,
                club.verified(),
                club.featured()
        );
    }

    private static GraphData.Edge toEdge(Connection connection) {
        return new GraphData.Edge(
                connection.id(),
                connection.sourceClubId(),
                connection.targetClubId(),
                connection.type(),
                connection.strength(),
                connection.description(),
                connectionColor(connection.type()),
                connection.strength() == null ? 1 : connection.strength().weight(),
                connection.reliabilityScore(),
                connection.verified()
        );
    }

    // connections without a score never satisfy a reliability threshold
    private static boolean meetsReliability(Connection connection, Double minReliabilityScore) {
        if (minReliabilityScore == null) {
            return true;
        }
        return connection.reliabilityScore() != null && connection.reliabilityScore() >= minReliabilityScore;
    }

    private static Map<UUID, Integer> countConnections(List<Connection> connections) {
        Map<UUID, Integer> counts = new HashMap<>();
        for (Connection connection : connections) {
            counts.merge(connection.sourceClubId(), 1, Integer::sum);
            counts.merge(connection.targetClubId(), 1, Integer::sum);
        }
        return counts;
    }

    private static <T, E extends Enum<E>> Map<String, Long> distribution(List<T> items, Function<T, E> category) {
        return items.stream()
                .filter(item -> category.apply(item) != null)
                .collect(Collectors.groupingBy(item -> category.apply(item).name(), TreeMap::new, Collectors.counting()));
    }

    private static Map<String, String> appliedFilters(GraphDataQuery query) {
        Map<String, String> filters = new TreeMap<>();
        if (query.verifiedOnly()) {
            filters.put("verifiedOnly", "true");
        }
        if (query.activeOnly()) {
            filters.put("activeOnly", "true");
        }
        if (query.minReliabilityScore() != null) {
            filters.put("minReliabilityScore", query.minReliabilityScore().toString());
        }
        if (!query.includeLeagues().isEmpty()) {
            filters.put("includeLeagues", query.includeLeagues().stream()
                    .map(Enum::name)
                    .distinct()
                    .sorted()
                    .collect(Collectors.joining(",")));
        }
        if (!query.includeIsolatedNodes()) {
            filters.put("excludeIsolatedNodes", "true");
        }
        return filters;
    }
}
