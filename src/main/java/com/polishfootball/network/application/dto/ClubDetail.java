package com.polishfootball.network.application.dto;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.LeagueType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A single club with, on request, its connections seen from that club.
 */
public record ClubDetail(
        UUID id,
        String name,
        String shortName,
        LeagueType league,
        String country,
        String city,
        String logoPath,
        Integer founded,
        boolean active,
        boolean verified,
        boolean featured,
        Instant createdAt,
        Instant modifiedAt,
        List<ConnectionDetail> connections
) {
    public ClubDetail {
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    public static ClubDetail fromClub(Club club, List<ConnectionDetail> connections) {
        return new ClubDetail(
                club.id(),
                club.name(),
                club.shortName(),
                club.league(),
                club.country(),
                club.city(),
                club.logoPath(),
                club.founded(),
                club.active(),
                club.verified(),
                club.featured(),
                club.createdAt(),
                club.modifiedAt(),
                connections
        );
    }
}
