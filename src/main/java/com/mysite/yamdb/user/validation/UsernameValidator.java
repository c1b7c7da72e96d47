package com.mysite.yamdb.user.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class UsernameValidator implements ConstraintValidator<ValidUsername, String> {

    public static final String RESERVED = "me";
    public static final String INVALID_MESSAGE =
            "Enter a valid username. This value may contain only letters, numbers, and @/./+/-/_ characters.";
    public static final String RESERVED_MESSAGE = "Username \"me\" is not allowed.";

    private static final Pattern USERNAME = Pattern.compile("^[\\w.@+-]+$", Pattern.UNICODE_CHARACTER_CLASS);

    public static boolean isReserved(String username) {
        return RESERVED.equals(username);
    }

    public static boolean matchesPattern(String username) {
        return USERNAME.matcher(username).matches();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true; // 필수 여부는 @NotBlank 가 담당
        }
        if (isReserved(value)) {
            context.disableDefaultConstraintViolation();
            context.buildConstraintViolationWithTemplate(RESERVED_MESSAGE).addConstraintViolation();
            return false;
        }
        return matchesPattern(value);
    }
}
