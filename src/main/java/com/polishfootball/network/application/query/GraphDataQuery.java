package com.polishfootball.network.application.query;

import com.polishfootball.network.domain.model.LeagueType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Objects;

/**
 * Graph filter. {@code activeOnly} and {@code includeIsolatedNodes} default to true.
 * Empty league entries (a trailing comma in the request) are dropped.
 */
public record GraphDataQuery(
        boolean verifiedOnly,
        Boolean activeOnly,

        @DecimalMin(value = "0.0", message = "Reliability score must be between 0 and 1.")
        @DecimalMax(value = "1.0", message = "Reliability score must be between 0 and 1.")
        Double minReliabilityScore,

        @Size(max = 10, message = "Cannot include more than 10 leagues.")
        List<LeagueType> includeLeagues,

        Boolean includeIsolatedNodes
) {
    public GraphDataQuery {
        activeOnly = activeOnly == null ? Boolean.TRUE : activeOnly;
        includeIsolatedNodes = includeIsolatedNodes == null ? Boolean.TRUE : includeIsolatedNodes;
        includeLeagues = includeLeagues == null
                ? List.of()
                : includeLeagues.stream().filter(Objects::nonNull).toList();
    }

    public static GraphDataQuery defaults() {
        return new GraphDataQuery(false, null, null, null, null);
    }
}
