package com.polishfootball.network.application.query;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record ClubDetailQuery(
        @NotNull(message = "Club ID is required.")
        UUID clubId,

        boolean includeConnections
) {
    public static ClubDetailQuery of(UUID clubId) {
        return new ClubDetailQuery(clubId, false);
    }
}
