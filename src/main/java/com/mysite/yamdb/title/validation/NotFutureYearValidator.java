package com.mysite.yamdb.title.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.time.Clock;
import java.time.Year;

public class NotFutureYearValidator implements ConstraintValidator<NotFutureYear, Integer> {

    private final Clock clock;

    public NotFutureYearValidator() {
        this(Clock.systemDefaultZone());
    }

    NotFutureYearValidator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean isValid(Integer year, ConstraintValidatorContext context) {
        if (year == null) {
            return true;
        }
        return year <= Year.now(clock).getValue();
    }
}
