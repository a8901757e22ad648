package com.polishfootball.network.application.query;

import com.polishfootball.network.domain.model.ClubSearchCriteria;
import com.polishfootball.network.domain.model.ClubSortField;
import com.polishfootball.network.domain.model.LeagueType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Club search request. Page and page size default to 1 and 20, sorting to name ascending.
 * Blank sort parameters select the default sort.
 */
public record ClubSearchQuery(
        @Min(value = 1, message = "Page must be greater than 0.")
        Integer page,

        @Min(value = 1, message = "Page size must be between 1 and 100.")
        @Max(value = 100, message = "Page size must be between 1 and 100.")
        Integer pageSize,

        @Size(max = 100, message = "Search term cannot exceed 100 characters.")
        String searchTerm,

        LeagueType league,
        String city,
        Boolean active,
        Boolean verified,
        Boolean featured,
        Integer foundedYearFrom,
        Integer foundedYearTo,

        @Pattern(regexp = "(?i)\\s*(name|shortName|league|foundedYear|city|createdAt)?\\s*",
                message = "Sort field must be one of: name, shortName, league, foundedYear, city, createdAt.")
        String sortBy,

        @Pattern(regexp = "(?i)\\s*(asc|desc)?\\s*", message = "Sort direction must be 'asc' or 'desc'.")
        String sortDirection
) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;

    public ClubSearchQuery {
        page = page == null ? DEFAULT_PAGE : page;
        pageSize = pageSize == null ? DEFAULT_PAGE_SIZE : pageSize;
    }

    public static ClubSearchQuery firstPage() {
        return new ClubSearchQuery(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static ClubSearchQuery page(int page, int pageSize) {
        return new ClubSearchQuery(page, pageSize, null, null, null, null, null, null, null, null, null, null);
    }

    @AssertTrue(message = "Founded year 'from' must be less than or equal to 'to'.")
    public boolean isFoundedYearRangeOrdered() {
        return foundedYearFrom == null || foundedYearTo == null || foundedYearFrom <= foundedYearTo;
    }

    public ClubSortField resolvedSortField() {
        return ClubSortField.fromFieldName(sortBy).orElse(ClubSortField.NAME);
    }

    public boolean descending() {
        return sortDirection != null && "desc".equalsIgnoreCase(sortDirection.trim());
    }

    public boolean hasDefaultSort() {
        return resolvedSortField() == ClubSortField.NAME && !descending();
    }

    public ClubSearchCriteria toCriteria() {
        return new ClubSearchCriteria(
                page,
                pageSize,
                searchTerm == null || searchTerm.isBlank() ? null : searchTerm.trim(),
                league,
                city == null || city.isBlank() ? null : city.trim(),
                active,
                verified,
                featured,
                foundedYearFrom,
                foundedYearTo,
                resolvedSortField(),
                descending()
        );
    }
}
