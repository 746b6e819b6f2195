package com.lihtcmate.backend.modules.rentroll.application;

import java.util.List;

import com.lihtcmate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Upload rejected before anything was written. Each error names the offending unit.
 */
public class RentRollValidationException extends ProblemException {

    private final List<String> errors;

    public RentRollValidationException(List<String> errors) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "RENT_ROLL_VALIDATION_FAILED",
                "Rent roll rejected: %d problem(s) found".formatted(errors.size()));
        this.errors = List.copyOf(errors);
    }

    @Override
    public List<String> getErrors() {
        return errors;
    }
}
