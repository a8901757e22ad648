package com.polishfootball.network.application.query;

import java.util.List;

/**
 * Outcome of a query. Callers tell a malformed request ({@link QueryStatus#VALIDATION_FAILED})
 * apart from a valid request the system could not complete ({@link QueryStatus#FAILED}).
 */
public record QueryResult<T>(
        QueryStatus status,
        T value,
        String message,
        List<FieldError> errors
) {
    public QueryResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static <T> QueryResult<T> success(T value) {
        return new QueryResult<>(QueryStatus.SUCCESS, value, null, List.of());
    }

    public static <T> QueryResult<T> invalid(List<FieldError> errors) {
        return new QueryResult<>(QueryStatus.VALIDATION_FAILED, null, "Validation failed", errors);
    }

    public static <T> QueryResult<T> notFound(String message) {
        return new QueryResult<>(QueryStatus.NOT_FOUND, null, message, List.of());
    }

    public static <T> QueryResult<T> cancelled(String message) {
        return new QueryResult<>(QueryStatus.CANCELLED, null, message, List.of());
    }

    public static <T> QueryResult<T> failure(String message) {
        return new QueryResult<>(QueryStatus.FAILED, null, message, List.of());
    }

    public boolean isSuccess() {
        return status == QueryStatus.SUCCESS;
    }
}
