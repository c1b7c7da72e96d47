package com.mysite.yamdb.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PasswordPolicyTest {

    @Test
    @DisplayName("정책을 모두 만족하면 예외 없음")
    void validPassword() {
        assertThatCode(() -> PasswordPolicy.validate("Blue-River-42", "tester", "tester@test.com"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("8자 미만 거부")
    void tooShort() {
        assertThatThrownBy(() -> PasswordPolicy.validate("Ab1!", "tester", "t@test.com"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too short");
    }

    @Test
    @DisplayName("숫자로만 된 비밀번호 거부")
    void entirelyNumeric() {
        assertThatThrownBy(() -> PasswordPolicy.validate("93817264", "tester", "t@test.com"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("This password is entirely numeric.");
    }

    @Test
    @DisplayName("아이디나 이메일 로컬파트를 포함하면 거부")
    void similarToUserInfo() {
        assertThatThrownBy(() -> PasswordPolicy.validate("myTESTER2024", "tester", "x@test.com"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("The password is too similar to the username.");
        assertThatThrownBy(() -> PasswordPolicy.validate("johnny-b-goode", "tester", "johnny@test.com"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("흔한 비밀번호 거부")
    void commonPassword() {
        assertThatThrownBy(() -> PasswordPolicy.validate("Password123", "tester", "t@test.com"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("This password is too common.");
    }
}
