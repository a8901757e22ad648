package com.polishfootball.network.application.dto;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;

import java.time.Instant;
import java.util.UUID;

/**
 * A connection with both of its clubs, as listed outside any single club's perspective.
 */
public record ConnectionSummary(
        UUID id,
        ClubRef sourceClub,
        ClubRef targetClub,
        ConnectionType type,
        ConnectionStrength strength,
        String description,
        Double reliabilityScore,
        boolean verified,
        Instant createdAt,
        Instant modifiedAt
) {
    public static ConnectionSummary of(Connection connection, Club source, Club target) {
        return new ConnectionSummary(
                connection.id(),
                ClubRef.fromClub(source),
                ClubRef.fromClub(target),
                connection.type(),
                connection.strength(),
                connection.description(),
                connection.reliabilityScore(),
                connection.verified(),
                connection.createdAt(),
                connection.modifiedAt()
        );
    }
}
