package com.mysite.yamdb.title.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * 연도가 현재 연도를 넘지 않아야 한다. null 은 통과시킨다 (필수 여부는 @NotNull 로 따로 건다).
 */
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Constraint(validatedBy = NotFutureYearValidator.class)
@Documented
public @interface NotFutureYear {
    String message() default "Year must not be greater than the current year.";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
