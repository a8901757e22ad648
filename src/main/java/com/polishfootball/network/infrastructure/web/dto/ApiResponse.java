package com.polishfootball.network.infrastructure.web.dto;

import com.polishfootball.network.application.query.FieldError;

import java.util.List;

/**
 * Uniform response envelope for every endpoint.
 */
public record ApiResponse<T>(
        boolean success,
        String message,
        T data,
        List<FieldError> errors
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data, List.of());
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data, List.of());
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, message, null, List.of());
    }

    public static <T> ApiResponse<T> validationError(List<FieldError> errors) {
        return new ApiResponse<>(false, "Validation failed", null, errors);
    }
}
