package com.polishfootball.network.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Typed relationship between two clubs.
 * The reliability score is supplied by curators and may be absent.
 */
public record Connection(
        UUID id,
        UUID sourceClubId,
        UUID targetClubId,
        ConnectionType type,
        ConnectionStrength strength,
        String description,
        Double reliabilityScore,
        boolean verified,
        Instant createdAt,
        Instant modifiedAt
) {
    public UUID otherEnd(UUID clubId) {
        return sourceClubId.equals(clubId) ? targetClubId : sourceClubId;
    }
}
