package com.polishfootball.network.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum ClubSortField {
    NAME("name"),
    SHORT_NAME("shortName"),
    LEAGUE("league"),
    FOUNDED_YEAR("foundedYear"),
    CITY("city"),
    CREATED_AT("createdAt");

    private final String fieldName;

    ClubSortField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    public static Optional<ClubSortField> fromFieldName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(field -> field.fieldName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
