package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.query.QueryResult;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps query outcomes onto HTTP status codes and the response envelope.
 */
final class QueryResponses {

    private QueryResponses() {
    }

    static <T> ResponseEntity<ApiResponse<T>> toResponse(QueryResult<T> result) {
        return switch (result.status()) {
            case SUCCESS -> ResponseEntity.ok(ApiResponse.ok(result.value()));
            case VALIDATION_FAILED -> ResponseEntity.badRequest()
                    .body(ApiResponse.validationError(result.errors()));
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error(result.message()));
            case CANCELLED -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error(result.message()));
            case FAILED -> ResponseEntity.internalServerError()
                    .body(ApiResponse.error(result.message()));
        };
    }
}
