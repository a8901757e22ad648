package com.polishfootball.network.domain.model;

import java.time.Instant;
import java.util.UUID;

public record Club(
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
) {}
