package com.mysite.yamdb.user.Role;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 사용자 권한 등급
 * <p>
 * 권한 판단은 문자열 비교 대신 이 enum 하나로만 한다.
 * API 표현은 소문자(user, moderator, admin)를 사용한다.
 */
public enum Role {

    USER,
    MODERATOR,
    ADMIN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role from(String value) {
        if (value == null) {
            return null;
        }
        for (Role role : values()) {
            if (role.value().equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("\"" + value + "\" is not a valid choice.");
    }

    /**
     * 다른 사용자의 리뷰/댓글을 수정·삭제할 수 있는 등급인지
     */
    public boolean isPrivileged() {
        return this == MODERATOR || this == ADMIN;
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
