package com.polishfootball.network.application.dto;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;

import java.time.Instant;
import java.util.UUID;

/**
 * A connection seen from one club, pointing at the club on the other end.
 */
public record ConnectionDetail(
        UUID id,
        ClubRef relatedClub,
        ConnectionType type,
        ConnectionStrength strength,
        String description,
        Double reliabilityScore,
        boolean verified,
        Instant createdAt,
        Instant modifiedAt
) {
    public static ConnectionDetail of(Connection connection, Club relatedClub) {
        return new ConnectionDetail(
                connection.id(),
                ClubRef.fromClub(relatedClub),
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
