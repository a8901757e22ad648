package com.polishfootball.network.application.command;

import com.polishfootball.network.domain.model.Connection;
import com.polishfootball.network.domain.model.ConnectionStrength;
import com.polishfootball.network.domain.model.ConnectionType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

public record ConnectionCommand(
        @NotNull(message = "Source club is required.")
        UUID sourceClubId,

        @NotNull(message = "Target club is required.")
        UUID targetClubId,

        @NotNull(message = "Connection type is required.")
        ConnectionType type,

        @NotNull(message = "Connection strength is required.")
        ConnectionStrength strength,

        @Size(max = 1000, message = "Description must not exceed 1000 characters.")
        String description,

        @DecimalMin(value = "0.0", message = "Reliability score must be between 0 and 1.")
        @DecimalMax(value = "1.0", message = "Reliability score must be between 0 and 1.")
        Double reliabilityScore,

        boolean verified
) {
    @AssertTrue(message = "A club cannot be connected to itself.")
    public boolean isDistinctEndpoints() {
        return sourceClubId == null || targetClubId == null || !sourceClubId.equals(targetClubId);
    }

    Connection toConnection(UUID id, Instant createdAt, Instant modifiedAt) {
        return new Connection(
                id,
                sourceClubId,
                targetClubId,
                type,
                strength,
                description == null || description.isBlank() ? null : description.trim(),
                reliabilityScore,
                verified,
                createdAt,
                modifiedAt
        );
    }
}
