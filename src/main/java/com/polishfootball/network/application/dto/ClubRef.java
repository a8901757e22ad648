package com.polishfootball.network.application.dto;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.LeagueType;

import java.util.UUID;

/**
 * Minimal club view embedded in connection listings.
 */
public record ClubRef(
        UUID id,
        String name,
        String shortName,
        LeagueType league,
        String city,
        String logoPath
) {
    public static ClubRef fromClub(Club club) {
        return new ClubRef(club.id(), club.name(), club.shortName(), club.league(), club.city(), club.logoPath());
    }
}
