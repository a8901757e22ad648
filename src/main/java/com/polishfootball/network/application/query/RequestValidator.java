package com.polishfootball.network.application.query;

import java.util.List;

/**
 * Declarative request validation.
 */
public interface RequestValidator {

    /**
     * @return field-level errors; an empty list means the request is valid
     */
    List<FieldError> validate(Object request);
}
