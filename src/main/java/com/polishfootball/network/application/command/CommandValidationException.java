package com.polishfootball.network.application.command;

import com.polishfootball.network.application.query.FieldError;

import java.util.List;

/**
 * Raised when a create or update command fails field validation.
 */
public class CommandValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public CommandValidationException(List<FieldError> errors) {
        super("Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}
