package com.polishfootball.network.application.query;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record ClubConnectionsQuery(
        @NotNull(message = "Club ID is required.")
        UUID clubId,

        boolean verifiedOnly,

        @Min(value = 1, message = "Page must be greater than 0.")
        Integer page,

        @Min(value = 1, message = "Page size must be between 1 and 100.")
        @Max(value = 100, message = "Page size must be between 1 and 100.")
        Integer pageSize
) {
    public ClubConnectionsQuery {
        page = page == null ? ClubSearchQuery.DEFAULT_PAGE : page;
        pageSize = pageSize == null ? ClubSearchQuery.DEFAULT_PAGE_SIZE : pageSize;
    }

    public static ClubConnectionsQuery forClub(UUID clubId) {
        return new ClubConnectionsQuery(clubId, false, null, null);
    }
}
