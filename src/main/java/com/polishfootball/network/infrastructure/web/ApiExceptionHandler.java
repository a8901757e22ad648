package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.command.CommandValidationException;
import com.polishfootball.network.application.query.FieldError;
import com.polishfootball.network.application.query.ResourceNotFoundException;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CommandValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(CommandValidationException e) {
        return ResponseEntity.badRequest().body(ApiResponse.validationError(e.getErrors()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        var error = new FieldError(e.getName(), "Invalid value '" + e.getValue() + "'.");
        return ResponseEntity.badRequest().body(ApiResponse.validationError(List.of(error)));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException e) {
        var error = new FieldError(e.getParameterName(), "Parameter is required.");
        return ResponseEntity.badRequest().body(ApiResponse.validationError(List.of(error)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error("Malformed request body."));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        logger.error("Unexpected error handling request", e);
        return ResponseEntity.internalServerError().body(ApiResponse.error("An unexpected error occurred."));
    }
}
