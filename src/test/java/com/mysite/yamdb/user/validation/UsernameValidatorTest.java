package com.mysite.yamdb.user.validation;

import com.mysite.yamdb.jwt.Auth.SignupRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UsernameValidatorTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    @DisplayName("문자, 숫자, @ . + - _ 로 된 이름은 허용")
    void validNames() {
        assertThat(UsernameValidator.matchesPattern("john.doe+1@site_x-y")).isTrue();
        assertThat(UsernameValidator.matchesPattern("사용자")).isTrue();
        assertThat(validator.validate(new SignupRequest("a@test.com", "valid_user"))).isEmpty();
    }

    @Test
    @DisplayName("공백이나 특수문자가 있으면 거부")
    void invalidCharacters() {
        assertThat(UsernameValidator.matchesPattern("bad name")).isFalse();
        assertThat(UsernameValidator.matchesPattern("bad#name")).isFalse();

        Set<ConstraintViolation<SignupRequest>> violations =
                validator.validate(new SignupRequest("a@test.com", "bad!name"));
        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly(UsernameValidator.INVALID_MESSAGE);
    }

    @Test
    @DisplayName("\"me\" 는 예약어라 전용 메시지로 거부")
    void reservedName() {
        Set<ConstraintViolation<SignupRequest>> violations =
                validator.validate(new SignupRequest("a@test.com", "me"));

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly(UsernameValidator.RESERVED_MESSAGE);
        // 대소문자가 다르면 예약어가 아니다
        assertThat(UsernameValidator.isReserved("Me")).isFalse();
    }
}
