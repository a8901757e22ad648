package com.polishfootball.network;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import com.polishfootball.network.domain.model.LeagueType;

import java.time.Instant;
import java.util.UUID;

public final class Fixtures {

    public static final Instant CREATED = Instant.parse("2024-01-10T12:00:00Z");

    private Fixtures() {
    }

    public static Club club(String name, LeagueType league) {
        return new Club(UUID.randomUUID(), name, name.substring(0, Math.min(3, name.length())).toUpperCase(),
                league, "Poland", "Warszawa", null, 1916, true, true, false, CREATED, null);
    }

    public static Club club(String name, LeagueType league, boolean active, boolean verified) {
        Club club = club(name, league);
        return new Club(club.id(), club.name(), club.shortName(), league, club.country(), club.city(),
                club.logoPath(), club.founded(), active, verified, club.featured(), club.createdAt(), null);
    }

    public static Club createdAt(Club club, Instant createdAt, Instant modifiedAt) {
        return new Club(club.id(), club.name(), club.shortName(), club.league(), club.country(), club.city(),
                club.logoPath(), club.founded(), club.active(), club.verified(), club.featured(),
                createdAt, modifiedAt);
    }

    public static Connection connection(Club source, Club target, ConnectionType type) {
        return new Connection(UUID.randomUUID(), source.id(), target.id(), type, ConnectionStrength.STRONG,
                source.name() + " - " + target.name(), 0.8, true, CREATED, null);
    }

    public static Connection connection(Club source, Club target, ConnectionType type,
                                        Double reliabilityScore, boolean verified) {
        return new Connection(UUID.randomUUID(), source.id(), target.id(), type, ConnectionStrength.MEDIUM,
                null, reliabilityScore, verified, CREATED, null);
    }
}
