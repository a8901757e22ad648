package com.polishfootball.network.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum ConnectionSortField {
    TYPE("type"),
    STRENGTH("strength"),
    CREATED_AT("createdAt"),
    RELIABILITY_SCORE("reliabilityScore");

    private final String fieldName;

    ConnectionSortField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    public static Optional<ConnectionSortField> fromFieldName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(field -> field.fieldName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
