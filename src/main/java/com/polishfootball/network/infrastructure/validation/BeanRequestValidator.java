package com.polishfootball.network.infrastructure.validation;

import com.polishfootball.network.application.query.FieldError;
import com.polishfootball.network.application.query.RequestValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * {@link RequestValidator} backed by Jakarta Bean Validation constraints declared on the request records.
 */
@Component
public class BeanRequestValidator implements RequestValidator {

    private final Validator validator;

    public BeanRequestValidator(Validator validator) {
        this.validator = validator;
    }

    @Override
    public List<FieldError> validate(Object request) {
        Objects.requireNonNull(request, "request");

        return validator.validate(request).stream()
                .map(BeanRequestValidator::toFieldError)
                .sorted(Comparator.comparing(FieldError::field).thenComparing(FieldError::message))
                .toList();
    }

    private static FieldError toFieldError(ConstraintViolation<?> violation) {
        return new FieldError(violation.getPropertyPath().toString(), violation.getMessage());
    }
}
