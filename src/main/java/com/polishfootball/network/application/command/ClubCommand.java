package com.polishfootball.network.application.command;

import com.polishfootball.network.domain.model.Club;
import com.polishfootball.network.domain.model.LeagueType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.time.Year;
import java.util.UUID;

/**
 * Club fields accepted by create and update.
 */
public record ClubCommand(
        @NotBlank(message = "Club name is required.")
        @Size(min = 2, max = 100, message = "Club name must be between 2 and 100 characters long.")
        @Pattern(regexp = "[\\p{L}\\p{N} .\\-]*",
                message = "Club name can only contain letters, numbers, spaces, hyphens, and dots.")
        String name,

        @NotBlank(message = "Short name is required.")
        @Size(min = 2, max = 10, message = "Short name must be between 2 and 10 characters long.")
        @Pattern(regexp = "[\\p{L}\\p{N}]*", message = "Short name can only contain letters and numbers.")
        String shortName,

        @NotNull(message = "Invalid league specified.")
        LeagueType league,

        @Size(max = 50, message = "Country must not exceed 50 characters.")
        String country,

        @NotBlank(message = "City is required.")
        @Size(max = 50, message = "City must not exceed 50 characters.")
        String city,

        @Size(max = 500, message = "Logo path must not exceed 500 characters.")
        String logoPath,

        @Min(value = 1850, message = "Founded year must be after 1850.")
        Integer founded,

        boolean active,
        boolean verified,
        boolean featured
) {
    static final String DEFAULT_COUNTRY = "Poland";

    @AssertTrue(message = "Founded year cannot be in the future.")
    public boolean isFoundedNotInFuture() {
        return founded == null || founded <= Year.now().getValue();
    }

    Club toClub(UUID id, Instant createdAt, Instant modifiedAt) {
        return new Club(
                id,
                name.trim(),
                shortName.trim(),
                league,
                country == null || country.isBlank() ? DEFAULT_COUNTRY : country.trim(),
                city.trim(),
                logoPath == null || logoPath.isBlank() ? null : logoPath.trim(),
                founded,
                active,
                verified,
                featured,
                createdAt,
                modifiedAt
        );
    }
}
