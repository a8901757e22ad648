package com.polishfootball.network.application.dto;

import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import com.polishfootball.network.domain.model.LeagueType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Graph visualisation payload: club nodes, connection edges and summary metadata.
 */
public record GraphData(
        List<Node> nodes,
        List<Edge> edges,
        Metadata metadata
) {
    public record Node(
            UUID id,
            String label,
            String shortName,
            LeagueType league,
            String city,
            String logoPath,
            String color,
            int size,
            int connectionCount,
            boolean verified,
            boolean featured
    ) {}

    public record Edge(
            UUID id,
            UUID source,
            UUID target,
            ConnectionType type,
            ConnectionStrength strength,
            String label,
            String color,
            int weight,
            Double reliabilityScore,
            boolean verified
    ) {}

    public record Metadata(
            int totalNodes,
            int totalEdges,
            Instant generatedAt,
            Map<String, Long> leagueDistribution,
            Map<String, Long> connectionTypeDistribution,
            Map<String, String> appliedFilters
    ) {}
}
