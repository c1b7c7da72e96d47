package com.mysite.yamdb.util;

import java.security.SecureRandom;

// 영문 대소문자 + 숫자로 된 확인 코드 생성
public final class RandomCode {

    private static final String ALPHABET =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomCode() {
    }

    public static String generate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("코드 길이는 1 이상이어야 합니다.");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
