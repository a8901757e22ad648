package com.polishfootball.network.application.query;

import com.polishfootball.network.domain.model.ConnectionSortField;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

import java.util.UUID;

/**
 * Connection listing request. Every filter is optional; the default order is newest first.
 */
public record ConnectionSearchQuery(
        @Min(value = 1, message = "Page must be greater than 0.")
        Integer page,

        @Min(value = 1, message = "Page size must be between 1 and 100.")
        @Max(value = 100, message = "Page size must be between 1 and 100.")
        Integer pageSize,

        ConnectionType type,
        ConnectionStrength strength,
        Boolean verified,
        UUID clubId,

        @DecimalMin(value = "0.0", message = "Reliability score must be between 0 and 1.")
        @DecimalMax(value = "1.0", message = "Reliability score must be between 0 and 1.")
        Double minReliabilityScore,

        @Pattern(regexp = "(?i)\\s*(type|strength|createdAt|reliabilityScore)?\\s*",
                message = "Sort field must be one of: type, strength, createdAt, reliabilityScore.")
        String sortBy,

        @Pattern(regexp = "(?i)\\s*(asc|desc)?\\s*", message = "Sort direction must be 'asc' or 'desc'.")
        String sortDirection
) {
    public ConnectionSearchQuery {
        page = page == null ? ClubSearchQuery.DEFAULT_PAGE : page;
        pageSize = pageSize == null ? ClubSearchQuery.DEFAULT_PAGE_SIZE : pageSize;
    }

    public static ConnectionSearchQuery firstPage() {
        return new ConnectionSearchQuery(null, null, null, null, null, null, null, null, null);
    }

    public ConnectionSortField resolvedSortField() {
        return ConnectionSortField.fromFieldName(sortBy).orElse(ConnectionSortField.CREATED_AT);
    }

    public boolean descending() {
        return sortDirection == null || sortDirection.isBlank() || "desc".equalsIgnoreCase(sortDirection.trim());
    }

    public boolean hasDefaultSort() {
        return resolvedSortField() == ConnectionSortField.CREATED_AT && descending();
    }
}
