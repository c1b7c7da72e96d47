package com.mysite.yamdb.util;

import java.util.Locale;
import java.util.Set;

public class PasswordPolicy {

    public static final int MIN_LENGTH = 8;

    // 자주 쓰이는 비밀번호 (소문자로 비교)
    private static final Set<String> COMMON_PASSWORDS = Set.of(
            "password", "password1", "password123", "12345678", "123456789", "1234567890",
            "qwerty123", "qwertyuiop", "iloveyou", "sunshine", "princess", "football",
            "baseball", "welcome1", "admin123", "letmein1", "trustno1", "abc12345",
            "11111111", "00000000", "passw0rd", "superman", "starwars", "whatever"
    );

    private static boolean isEntirelyNumeric(String s) {
        return s.chars().allMatch(Character::isDigit);
    }

    // 아이디/이메일 로컬파트 포함 금지
    private static boolean containsUserInfo(String pw, String username, String email) {
        String low = pw.toLowerCase(Locale.ROOT);
        if (username != null && !username.isBlank() && low.contains(username.toLowerCase(Locale.ROOT))) return true;
        if (email != null) {
            int at = email.indexOf('@');
            if (at > 0) {
                String local = email.substring(0, at).toLowerCase(Locale.ROOT);
                if (!local.isBlank() && low.contains(local)) return true;
            }
        }
        return false;
    }

    public static void validate(String password, String username, String email) {
        if (password == null || password.length() < MIN_LENGTH)
            throw new IllegalArgumentException(
                    "This password is too short. It must contain at least " + MIN_LENGTH + " characters.");
        if (isEntirelyNumeric(password))
            throw new IllegalArgumentException("This password is entirely numeric.");
        if (containsUserInfo(password, username, email))
            throw new IllegalArgumentException("The password is too similar to the username.");
        if (COMMON_PASSWORDS.contains(password.toLowerCase(Locale.ROOT)))
            throw new IllegalArgumentException("This password is too common.");
    }
}
