package com.polishfootball.network.application.dto;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.LeagueType;

import java.time.Instant;
import java.util.UUID;

public record ClubSummary(
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
        Instant modifiedAt
) {
    public static ClubSummary fromClub(Club club) {
        return new ClubSummary(
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
                club.modifiedAt()
        );
    }
}
