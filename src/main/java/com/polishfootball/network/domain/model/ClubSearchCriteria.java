package com.polishfootball.network.domain.model;

/**
 * Normalized club search handed to the backing store.
 * Null filter fields are not applied.
 */
public record ClubSearchCriteria(
        int page,
        int pageSize,
        String searchTerm,
        LeagueType league,
        String city,
        Boolean active,
        Boolean verified,
        Boolean featured,
        Integer foundedYearFrom,
        Integer foundedYearTo,
        ClubSortField sortField,
        boolean descending
) {
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
